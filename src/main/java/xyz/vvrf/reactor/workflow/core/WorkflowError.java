package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;
import xyz.vvrf.reactor.workflow.util.DataCopies;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 记录在 WorkflowState 和 NodeExecution 上的错误信息（不可变值对象）。
 * 与异常不同，它是执行结果的一部分，可被快照、序列化。
 */
@Getter
public final class WorkflowError {

    public static final String CODE_INVALID_GRAPH = "invalid_graph";
    public static final String CODE_NODE_EXECUTION = "node_execution_error";
    public static final String CODE_NODE_NOT_FOUND = "node_not_found";
    public static final String CODE_ROUTING = "routing_error";
    public static final String CODE_MAX_ITERATIONS = "max_iterations_exceeded";
    public static final String CODE_CANCELLED = "execution_cancelled";
    public static final String CODE_DEADLINE_EXCEEDED = "deadline_exceeded";
    public static final String CODE_EXECUTION_ERROR = "execution_error";
    public static final String CODE_EXECUTION_PANIC = "execution_panic";
    public static final String CODE_EXECUTION_NOT_FOUND = "execution_not_found";
    public static final String CODE_INVALID_STATE_TRANSITION = "invalid_state_transition";
    public static final String CODE_WORKFLOW_NOT_FOUND = "workflow_not_found";

    private final String code;
    private final String message;
    private final String nodeId;
    private final Instant timestamp;
    private final Map<String, Object> details;

    public WorkflowError(String code, String message, String nodeId, Instant timestamp, Map<String, ?> details) {
        this.code = Objects.requireNonNull(code, "错误码不能为空");
        this.message = (message != null) ? message : "";
        this.nodeId = nodeId;
        this.timestamp = (timestamp != null) ? timestamp : Instant.now();
        this.details = (details != null && !details.isEmpty())
                ? Collections.unmodifiableMap(DataCopies.deepCopy(details))
                : Collections.emptyMap();
    }

    public static WorkflowError of(String code, String message) {
        return new WorkflowError(code, message, null, Instant.now(), null);
    }

    public static WorkflowError of(String code, String message, String nodeId) {
        return new WorkflowError(code, message, nodeId, Instant.now(), null);
    }

    /**
     * 基于异常构造，details 中记录异常类型与原始消息。
     */
    public static WorkflowError fromThrowable(String code, String message, String nodeId, Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (cause != null) {
            details.put("exception", cause.getClass().getName());
            if (cause.getMessage() != null) {
                details.put("cause", cause.getMessage());
            }
        }
        return new WorkflowError(code, message, nodeId, Instant.now(), details);
    }

    @Override
    public String toString() {
        return "WorkflowError{code='" + code + "', message='" + message + "'"
                + (nodeId != null ? ", nodeId='" + nodeId + "'" : "")
                + ", timestamp=" + timestamp + '}';
    }
}
