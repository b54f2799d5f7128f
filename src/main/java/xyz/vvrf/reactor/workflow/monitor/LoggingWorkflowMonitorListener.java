package xyz.vvrf.reactor.workflow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Node;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;

import java.time.Duration;

/**
 * 把执行事件写入日志的监听器。
 * 由自动配置在 {@code workflow.monitor.logging-enabled=true} (默认) 时注册。
 */
@Slf4j
public class LoggingWorkflowMonitorListener implements WorkflowMonitorListener {

    @Override
    public void onWorkflowStart(String executionId, String workflowId, String startNodeId) {
        log.info("[MONITOR] 执行:[{}] 工作流:[{}] 开始。 起始节点:[{}]", executionId, workflowId, startNodeId);
    }

    @Override
    public void onWorkflowComplete(String executionId, String workflowId, WorkflowStatus status, Duration totalDuration, Throwable error) {
        if (error == null) {
            log.info("[MONITOR] 执行:[{}] 工作流:[{}] 结束。 状态:[{}], 耗时:[{}ms]",
                    executionId, workflowId, status, totalDuration.toMillis());
        } else {
            log.error("[MONITOR] 执行:[{}] 工作流:[{}] 结束。 状态:[{}], 耗时:[{}ms], 错误:[{}]",
                    executionId, workflowId, status, totalDuration.toMillis(), error.getMessage());
        }
    }

    @Override
    public void onNodeStart(String executionId, String workflowId, String nodeId, Node node) {
        log.info("[MONITOR] 执行:[{}] 工作流:[{}] 节点:[{}] 开始。 类型:[{}], 类:[{}]",
                executionId, workflowId, nodeId, node.getType(), node.getClass().getSimpleName());
    }

    @Override
    public void onNodeSuccess(String executionId, String workflowId, String nodeId, Duration duration, NodeOutput output) {
        log.info("[MONITOR] 执行:[{}] 工作流:[{}] 节点:[{}] 成功。 耗时:[{}ms], 输出键:[{}], 路由覆盖:[{}]",
                executionId, workflowId, nodeId, duration.toMillis(), output.getData().keySet(),
                output.getNextNode().orElse("-"));
    }

    @Override
    public void onNodeFailure(String executionId, String workflowId, String nodeId, Duration duration, Throwable error, Node node) {
        log.error("[MONITOR] 执行:[{}] 工作流:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 类:[{}]",
                executionId, workflowId, nodeId, duration.toMillis(), error.getMessage(), node.getClass().getSimpleName(), error);
    }

    @Override
    public void onStatusChange(String executionId, String workflowId, WorkflowStatus from, WorkflowStatus to) {
        log.info("[MONITOR] 执行:[{}] 工作流:[{}] 状态变更: {} -> {}", executionId, workflowId, from, to);
    }
}
