package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowContext.CancellationReason;
import xyz.vvrf.reactor.workflow.core.WorkflowError;

/**
 * 执行上下文被取消或超过截止时间。
 */
public class ExecutionCancelledException extends WorkflowException {

    private final CancellationReason reason;

    public ExecutionCancelledException(CancellationReason reason) {
        super(reason == CancellationReason.DEADLINE_EXCEEDED ? WorkflowError.CODE_DEADLINE_EXCEEDED : WorkflowError.CODE_CANCELLED,
                reason == CancellationReason.DEADLINE_EXCEEDED ? "context deadline exceeded" : "context canceled");
        this.reason = reason;
    }

    public CancellationReason getReason() {
        return reason;
    }
}
