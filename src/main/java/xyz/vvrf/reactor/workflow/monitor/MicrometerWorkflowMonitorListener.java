package xyz.vvrf.reactor.workflow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Node;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.exception.WorkflowException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 把节点和执行事件记录为 Micrometer 指标。
 */
@Slf4j
public class MicrometerWorkflowMonitorListener implements WorkflowMonitorListener {

    // 指标名称
    public static final String METRIC_NODE_EXECUTION_TIME = "workflow.node.execution.time";
    public static final String METRIC_NODE_EXECUTION_TOTAL = "workflow.node.execution.total";
    public static final String METRIC_EXECUTION_TIME = "workflow.execution.time";
    public static final String METRIC_EXECUTION_TOTAL = "workflow.execution.total";
    public static final String METRIC_STATUS_CHANGE_TOTAL = "workflow.execution.status.change.total";

    // 标签键
    public static final String TAG_WORKFLOW_ID = "workflow.id";
    public static final String TAG_NODE_ID = "node.id";
    public static final String TAG_STATUS = "status";
    public static final String TAG_ERROR = "error";

    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";

    private final MeterRegistry meterRegistry;

    public MicrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onWorkflowStart(String executionId, String workflowId, String startNodeId) {
        // 执行指标在结束时记录
    }

    @Override
    public void onWorkflowComplete(String executionId, String workflowId, WorkflowStatus status, Duration totalDuration, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_WORKFLOW_ID, workflowId),
                Tag.of(TAG_STATUS, status.name()),
                Tag.of(TAG_ERROR, errorTag(error))
        );
        recordTimer(METRIC_EXECUTION_TIME, "工作流执行循环耗时", tags, totalDuration);
        incrementCounter(METRIC_EXECUTION_TOTAL, "按结束状态统计的工作流执行总数", tags);
    }

    @Override
    public void onNodeStart(String executionId, String workflowId, String nodeId, Node node) {
        // 节点指标在结束时记录
    }

    @Override
    public void onNodeSuccess(String executionId, String workflowId, String nodeId, Duration duration, NodeOutput output) {
        Tags tags = Tags.of(
                Tag.of(TAG_WORKFLOW_ID, workflowId),
                Tag.of(TAG_NODE_ID, nodeId),
                Tag.of(TAG_STATUS, STATUS_SUCCESS),
                Tag.of(TAG_ERROR, errorTag(null))
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, "工作流节点执行时间", tags, duration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, "按状态统计的工作流节点执行总数", tags);
    }

    @Override
    public void onNodeFailure(String executionId, String workflowId, String nodeId, Duration duration, Throwable error, Node node) {
        Tags tags = Tags.of(
                Tag.of(TAG_WORKFLOW_ID, workflowId),
                Tag.of(TAG_NODE_ID, nodeId),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR, errorTag(error))
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, "工作流节点执行时间", tags, duration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, "按状态统计的工作流节点执行总数", tags);
    }

    @Override
    public void onStatusChange(String executionId, String workflowId, WorkflowStatus from, WorkflowStatus to) {
        Tags tags = Tags.of(
                Tag.of(TAG_WORKFLOW_ID, workflowId),
                Tag.of(TAG_STATUS, to.name())
        );
        incrementCounter(METRIC_STATUS_CHANGE_TOTAL, "外部控制操作导致的状态变更次数", tags);
        log.debug("Micrometer 监听器记录执行 {} 的状态变更 {} -> {}", executionId, from, to);
    }

    // 工作流异常用错误码，其余用异常类名
    private static String errorTag(Throwable error) {
        if (error == null) {
            return "none";
        }
        if (error instanceof WorkflowException) {
            return ((WorkflowException) error).getCode();
        }
        return error.getClass().getSimpleName();
    }

    private void recordTimer(String name, String description, Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }

    private void incrementCounter(String name, String description, Tags tags) {
        try {
            Counter counter = Counter.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }
}
