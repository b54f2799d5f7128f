package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowError;

public class ExecutionNotFoundException extends WorkflowException {

    public ExecutionNotFoundException(String executionId) {
        super(WorkflowError.CODE_EXECUTION_NOT_FOUND, "execution not found: " + executionId);
    }
}
