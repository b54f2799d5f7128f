package xyz.vvrf.reactor.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Condition;
import xyz.vvrf.reactor.workflow.core.Edge;
import xyz.vvrf.reactor.workflow.core.Node;
import xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;
import xyz.vvrf.reactor.workflow.node.AbstractNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * WorkflowRegistry 的内存实现。线程安全。
 */
@Slf4j
public class InMemoryWorkflowRegistry implements WorkflowRegistry {

    private static final String KIND = "workflow";

    private final Map<String, WorkflowGraph> workflows = new ConcurrentHashMap<>();

    @Override
    public void register(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "工作流图不能为空");
        String workflowId = graph.getId();
        if (workflowId == null || workflowId.trim().isEmpty()) {
            throw new IllegalArgumentException("workflow ID cannot be empty");
        }
        graph.validate();
        if (workflows.putIfAbsent(workflowId, graph) != null) {
            throw new IllegalArgumentException(String.format("workflow already registered: %s", workflowId));
        }
        log.info("已注册工作流 '{}' ({} 个节点)", workflowId, graph.getNodeCount());
    }

    @Override
    public Optional<WorkflowGraph> getWorkflow(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public WorkflowGraph requireWorkflow(String workflowId) {
        return getWorkflow(workflowId).orElseThrow(() -> new WorkflowNotFoundException(KIND, workflowId));
    }

    @Override
    public List<String> listWorkflows() {
        return workflows.keySet().stream().sorted().collect(Collectors.toList());
    }

    @Override
    public void unregister(String workflowId) {
        if (workflowId == null || workflows.remove(workflowId) == null) {
            throw new WorkflowNotFoundException(KIND, workflowId);
        }
        log.info("已注销工作流 '{}'", workflowId);
    }

    @Override
    public WorkflowInfo getWorkflowInfo(String workflowId) {
        WorkflowGraph graph = requireWorkflow(workflowId);

        List<WorkflowInfo.NodeInfo> nodes = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            String name = (node instanceof AbstractNode) ? ((AbstractNode) node).getName() : node.getId();
            nodes.add(WorkflowInfo.NodeInfo.builder()
                    .id(node.getId())
                    .name(name)
                    .type(node.getType())
                    .build());
        }

        List<WorkflowInfo.EdgeInfo> edges = new ArrayList<>();
        for (List<Edge> outgoing : graph.getAllEdges().values()) {
            for (Edge edge : outgoing) {
                edges.add(WorkflowInfo.EdgeInfo.builder()
                        .id(edge.getId())
                        .from(edge.getFromNode())
                        .to(edge.getToNode())
                        .conditional(edge.isConditional())
                        .condition(edge.getCondition().map(Condition::getDescription).orElse(null))
                        .weight(edge.getWeight())
                        .build());
            }
        }

        return WorkflowInfo.builder()
                .id(graph.getId())
                .name(graph.getName())
                .description(graph.getDescription())
                .startNode(graph.getStartNodeId().orElse(""))
                .allowCycles(graph.isAllowCycles())
                .nodes(nodes)
                .edges(edges)
                .build();
    }
}
