package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowError;

/**
 * 无法确定下一个节点，通常意味着分支节点的条件没有覆盖所有情况。
 */
public class RoutingException extends WorkflowException {

    public RoutingException(String nodeId, String message) {
        super(WorkflowError.CODE_ROUTING, message, nodeId, null);
    }

    public RoutingException(String nodeId, String message, Throwable cause) {
        super(WorkflowError.CODE_ROUTING, message, nodeId, cause);
    }
}
