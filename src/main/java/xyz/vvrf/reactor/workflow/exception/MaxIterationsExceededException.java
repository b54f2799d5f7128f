package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.WorkflowError;

/**
 * 超过迭代上限。用于捕获静态环检测看不到的、由条件触发的无限循环。
 */
public class MaxIterationsExceededException extends WorkflowException {

    private final int maxIterations;

    public MaxIterationsExceededException(int maxIterations, String lastNodeId) {
        super(WorkflowError.CODE_MAX_ITERATIONS,
                String.format("workflow exceeded maximum iterations (%d)", maxIterations), lastNodeId, null);
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }
}
