package xyz.vvrf.reactor.workflow.registry;

import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;

import java.util.List;
import java.util.Optional;

/**
 * 按 ID 管理可复用的工作流图。
 */
public interface WorkflowRegistry {

    /**
     * 注册工作流。注册前会验证图结构。
     *
     * @throws IllegalArgumentException 如果 ID 为空或已注册
     * @throws xyz.vvrf.reactor.workflow.exception.InvalidGraphException 如果图验证失败
     */
    void register(WorkflowGraph graph);

    Optional<WorkflowGraph> getWorkflow(String workflowId);

    /**
     * @throws xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException 如果未注册
     */
    WorkflowGraph requireWorkflow(String workflowId);

    /**
     * @return 已注册工作流的 ID，按字典序
     */
    List<String> listWorkflows();

    /**
     * @throws xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException 如果未注册
     */
    void unregister(String workflowId);

    /**
     * @throws xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException 如果未注册
     */
    WorkflowInfo getWorkflowInfo(String workflowId);
}
