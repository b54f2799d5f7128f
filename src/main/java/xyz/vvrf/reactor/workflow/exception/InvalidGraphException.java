package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowError;

/**
 * 图结构无效: 没有节点、起始节点缺失、悬空的边、重复的节点 ID、静态环等。
 * 总是在任何节点运行之前抛出。
 */
public class InvalidGraphException extends WorkflowException {

    public InvalidGraphException(String message) {
        super(WorkflowError.CODE_INVALID_GRAPH, message);
    }

    public InvalidGraphException(String message, String nodeId, Throwable cause) {
        super(WorkflowError.CODE_INVALID_GRAPH, message, nodeId, cause);
    }
}
