package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowError;

/**
 * 节点执行失败。引擎不会重试，重试由节点自己负责。
 */
public class NodeExecutionException extends WorkflowException {

    public NodeExecutionException(String nodeId, Throwable cause) {
        super(WorkflowError.CODE_NODE_EXECUTION, String.format("node %s execution failed", nodeId), nodeId, cause);
    }
}
