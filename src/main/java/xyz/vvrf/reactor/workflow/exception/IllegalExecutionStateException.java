package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowError;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;

/**
 * 控制操作 (取消/暂停/恢复) 在当前状态下不合法。
 */
public class IllegalExecutionStateException extends WorkflowException {

    private final WorkflowStatus currentStatus;

    public IllegalExecutionStateException(String operation, WorkflowStatus currentStatus) {
        super(WorkflowError.CODE_INVALID_STATE_TRANSITION,
                String.format("execution cannot be %s, current status: %s", operation, currentStatus));
        this.currentStatus = currentStatus;
    }

    public WorkflowStatus getCurrentStatus() {
        return currentStatus;
    }
}
