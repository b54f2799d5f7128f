package xyz.vvrf.reactor.workflow.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Condition;
import xyz.vvrf.reactor.workflow.core.Edge;
import xyz.vvrf.reactor.workflow.core.Node;
import xyz.vvrf.reactor.workflow.core.WorkflowState;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;
import xyz.vvrf.reactor.workflow.node.DecisionNode;
import xyz.vvrf.reactor.workflow.node.EndNode;
import xyz.vvrf.reactor.workflow.node.StartNode;
import xyz.vvrf.reactor.workflow.node.TransformNode;
import xyz.vvrf.reactor.workflow.registry.WorkflowRegistry;

import java.util.Map;
import java.util.function.Function;

/**
 * 工作流图的链式构建器。
 * <p>
 * 节点和边在调用时立即加入图，结构错误 (重复节点、悬空边) 当场抛出；
 * 整体验证 (起始节点、环) 推迟到 {@link #build()}。
 * 边按添加顺序决定路由优先级。
 *
 * <pre>{@code
 * WorkflowGraph graph = new WorkflowBuilder("double", "Double", "doubles x")
 *         .addTransformNode("double", data -> Collections.singletonMap("x", ((Integer) data.get("x")) * 2))
 *         .setStartNode("double")
 *         .build();
 * }</pre>
 */
@Slf4j
public class WorkflowBuilder {

    private final WorkflowGraph graph;
    private boolean built;

    public WorkflowBuilder(String id, String name, String description) {
        this.graph = new WorkflowGraph(id, name, description);
    }

    public WorkflowBuilder addNode(Node node) {
        ensureNotBuilt();
        graph.addNode(node);
        return this;
    }

    public WorkflowBuilder addStartNode(String id) {
        return addNode(new StartNode(id));
    }

    public WorkflowBuilder addEndNode(String id) {
        return addNode(new EndNode(id));
    }

    public WorkflowBuilder addEndNode(String id, Function<WorkflowState, Map<String, ?>> finalizer) {
        return addNode(new EndNode(id, id, finalizer));
    }

    public WorkflowBuilder addTransformNode(String id, Function<Map<String, Object>, Map<String, ?>> transformer) {
        return addNode(new TransformNode(id, transformer));
    }

    public WorkflowBuilder addTransformNode(String id, String name, Function<Map<String, Object>, Map<String, ?>> transformer) {
        return addNode(new TransformNode(id, name, transformer));
    }

    public WorkflowBuilder addDecisionNode(String id, Function<WorkflowState, String> router) {
        return addNode(new DecisionNode(id, router));
    }

    public WorkflowBuilder addDecisionNode(String id, String name, Function<WorkflowState, String> router) {
        return addNode(new DecisionNode(id, name, router));
    }

    /**
     * 添加条件边。
     *
     * @param condition 激活条件，null 表示无条件边
     */
    public WorkflowBuilder addEdge(String fromNode, String toNode, Condition condition) {
        ensureNotBuilt();
        graph.addEdge(Edge.of(fromNode, toNode, condition));
        return this;
    }

    public WorkflowBuilder addEdge(Edge edge) {
        ensureNotBuilt();
        graph.addEdge(edge);
        return this;
    }

    public WorkflowBuilder addSimpleEdge(String fromNode, String toNode) {
        return addEdge(fromNode, toNode, null);
    }

    public WorkflowBuilder setStartNode(String nodeId) {
        ensureNotBuilt();
        graph.setStartNode(nodeId);
        return this;
    }

    /**
     * 允许图中存在环 (例如由条件约束的重试循环)；迭代上限仍然生效。
     */
    public WorkflowBuilder allowCycles() {
        ensureNotBuilt();
        graph.setAllowCycles(true);
        return this;
    }

    public WorkflowBuilder metadata(String key, Object value) {
        ensureNotBuilt();
        graph.putMetadata(key, value);
        return this;
    }

    /**
     * 验证并返回构建好的图。构建器此后不可再用。
     *
     * @throws xyz.vvrf.reactor.workflow.exception.InvalidGraphException 如果验证失败
     */
    public WorkflowGraph build() {
        ensureNotBuilt();
        graph.validate();
        built = true;
        log.debug("Workflow '{}' built with {} nodes", graph.getId(), graph.getNodeCount());
        return graph;
    }

    /**
     * 构建并注册到给定的注册表。
     */
    public WorkflowGraph buildAndRegister(WorkflowRegistry registry) {
        WorkflowGraph result = build();
        registry.register(result);
        return result;
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException(String.format("workflow %s has already been built", graph.getId()));
        }
    }
}
