package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowError;

public class WorkflowNotFoundException extends WorkflowException {

    public WorkflowNotFoundException(String kind, String id) {
        super(WorkflowError.CODE_WORKFLOW_NOT_FOUND, kind + " not found: " + id);
    }
}
