package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 成功执行后返回给调用方的结果。
 * result 取自状态数据中的 "result" 键，其余字段是最终状态的快照。
 */
@Getter
public final class WorkflowOutput {

    public static final String RESULT_KEY = "result";

    private final Object result;
    private final List<Message> messages;
    private final Map<String, Object> data;
    private final WorkflowState state;
    private final Map<String, Object> metadata;

    private WorkflowOutput(WorkflowState state) {
        this.state = state;
        this.result = state.get(RESULT_KEY);
        this.messages = state.getMessages();
        this.data = state.getData();
        this.metadata = state.getMetadata();
    }

    /**
     * 基于最终状态打包输出。传入的状态应当是已脱离执行循环的副本。
     */
    public static WorkflowOutput from(WorkflowState finalState) {
        return new WorkflowOutput(Objects.requireNonNull(finalState, "最终状态不能为空"));
    }

    public WorkflowStatus getStatus() {
        return state.getStatus();
    }

    /**
     * 执行历史中依次经过的节点 ID。
     */
    public List<String> getVisitedNodes() {
        return Collections.unmodifiableList(state.getHistory().stream()
                .map(NodeExecution::getNodeId)
                .collect(Collectors.toList()));
    }
}
