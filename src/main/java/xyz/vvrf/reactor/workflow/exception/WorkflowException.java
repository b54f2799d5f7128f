package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowError;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.util.Objects;
import java.util.Optional;

/**
 * 工作流引擎所有异常的基类（非受检）。
 * 每个异常带有稳定的错误码，可转换为记录在状态上的 {@link WorkflowError}。
 */
public class WorkflowException extends RuntimeException {

    private final String code;
    private final String nodeId;
    private transient WorkflowState state;

    public WorkflowException(String code, String message) {
        this(code, message, null, null);
    }

    public WorkflowException(String code, String message, String nodeId, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "错误码不能为空");
        this.nodeId = nodeId;
    }

    public String getCode() {
        return code;
    }

    public Optional<String> getNodeId() {
        return Optional.ofNullable(nodeId);
    }

    /**
     * 同步执行失败时，附带执行结束那一刻的状态快照。
     */
    public Optional<WorkflowState> getState() {
        return Optional.ofNullable(state);
    }

    /**
     * 由执行器在抛出前附加状态快照，只设置一次。
     */
    public WorkflowException withState(WorkflowState snapshot) {
        if (this.state == null) {
            this.state = snapshot;
        }
        return this;
    }

    public WorkflowError toWorkflowError() {
        return WorkflowError.fromThrowable(code, getMessage(), nodeId, getCause());
    }
}
