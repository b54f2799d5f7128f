package xyz.vvrf.reactor.workflow.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.condition.FieldCondition;
import xyz.vvrf.reactor.workflow.core.Edge;
import xyz.vvrf.reactor.workflow.core.Message;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowInput;
import xyz.vvrf.reactor.workflow.core.WorkflowOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowState;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.exception.InvalidGraphException;
import xyz.vvrf.reactor.workflow.test.util.TestNode;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowGraphTest {

    private WorkflowGraph graph;

    @BeforeEach
    void setUp() {
        graph = new WorkflowGraph("wf", "Workflow", "test workflow");
    }

    @Test
    @DisplayName("重复添加同 ID 节点时失败")
    void addNodeRejectsDuplicateId() {
        graph.addNode(TestNode.builder("a").build());

        assertThatThrownBy(() -> graph.addNode(TestNode.builder("a").build()))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("node already exists: a");
    }

    @Test
    void addNodeRejectsEmptyId() {
        assertThatThrownBy(() -> graph.addNode(TestNode.builder("").build()))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessageContaining("node ID cannot be empty");
    }

    @Test
    void addNodeRunsNodeSelfValidation() {
        TestNode broken = TestNode.builder("broken").invalid(new IllegalStateException("missing tool")).build();

        assertThatThrownBy(() -> graph.addNode(broken))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("node broken validation failed: missing tool");
    }

    @Test
    void addEdgeRequiresExistingEndpoints() {
        graph.addNode(TestNode.builder("a").build());

        assertThatThrownBy(() -> graph.addEdge(Edge.of("x", "a")))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("from node not found: x");
        assertThatThrownBy(() -> graph.addEdge(Edge.of("a", "y")))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("to node not found: y");
        assertThatThrownBy(() -> graph.addEdge(Edge.of("a", "")))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("edge must have both from and to nodes");
    }

    @Test
    void sameTargetConditionalEdgesRouteIndependently() {
        graph.addNode(TestNode.builder("a").build());
        graph.addNode(TestNode.builder("b").build());
        graph.addNode(TestNode.builder("c").build());
        graph.addEdge(Edge.of("a", "b", FieldCondition.eq("x", 1)));
        graph.addEdge(Edge.of("a", "c", FieldCondition.eq("x", 2)));
        graph.addEdge(Edge.of("a", "b", FieldCondition.eq("x", 3)));
        graph.setStartNode("a");

        WorkflowOutput output = graph.execute(WorkflowContext.background(),
                WorkflowInput.builder().put("x", 3).build());

        assertThat(graph.getEdges("a")).extracting(Edge::getId).containsExactly("a->b", "a->c", "a->b");
        assertThat(output.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(output.getVisitedNodes()).containsExactly("a", "b");
    }

    @Test
    void removeEdgeRemovesFirstMatchOnly() {
        graph.addNode(TestNode.builder("a").build());
        graph.addNode(TestNode.builder("b").build());
        Edge first = Edge.of("a", "b", FieldCondition.eq("x", 1));
        Edge second = Edge.of("a", "b", FieldCondition.eq("x", 2));
        graph.addEdge(first);
        graph.addEdge(second);

        graph.removeEdge("a->b");

        assertThat(graph.getEdges("a")).containsExactly(second);
    }

    @Test
    void setStartNodeRequiresExistingNode() {
        assertThatThrownBy(() -> graph.setStartNode("ghost"))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("start node not found: ghost");
    }

    @Test
    void validateRejectsEmptyGraph() {
        assertThatThrownBy(() -> graph.validate())
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("workflow 'wf' has no nodes");
    }

    @Test
    void validateRejectsMissingStartNode() {
        graph.addNode(TestNode.builder("a").build());

        assertThatThrownBy(() -> graph.validate())
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("workflow 'wf' has no start node");
    }

    @Test
    @DisplayName("结构性环导致验证失败，允许环时通过")
    void validateDetectsCycles() {
        graph.addNode(TestNode.builder("a").build());
        graph.addNode(TestNode.builder("b").build());
        graph.addEdge(Edge.of("a", "b"));
        graph.addEdge(Edge.of("b", "a"));
        graph.setStartNode("a");

        assertThatThrownBy(() -> graph.validate())
                .isInstanceOf(InvalidGraphException.class)
                .hasMessageContaining("cycle detected");

        graph.setAllowCycles(true);
        graph.validate();
    }

    @Test
    void selfLoopIsACycle() {
        graph.addNode(TestNode.builder("a").build());
        graph.addEdge(Edge.of("a", "a"));
        graph.setStartNode("a");

        assertThatThrownBy(() -> graph.validate()).isInstanceOf(InvalidGraphException.class);
    }

    @Test
    void unreachableNodesOnlyWarn() {
        graph.addNode(TestNode.builder("a").build());
        graph.addNode(TestNode.builder("island").build());
        graph.setStartNode("a");

        graph.validate();

        assertThat(graph.findUnreachableNodes()).containsExactly("island");
    }

    @Test
    @DisplayName("删除节点同时删除指向它的边并清空起始节点")
    void removeNodeStripsInboundEdges() {
        graph.addNode(TestNode.builder("a").build());
        graph.addNode(TestNode.builder("b").build());
        graph.addEdge(Edge.of("a", "b"));
        graph.setStartNode("b");

        graph.removeNode("b");

        assertThat(graph.getEdges("a")).isEmpty();
        assertThat(graph.getStartNodeId()).isEmpty();
        assertThat(graph.getNode("b")).isEmpty();
        assertThatThrownBy(() -> graph.removeNode("b")).isInstanceOf(InvalidGraphException.class);
    }

    @Test
    void removeEdgeById() {
        graph.addNode(TestNode.builder("a").build());
        graph.addNode(TestNode.builder("b").build());
        graph.addEdge(Edge.builder("a", "b").id("link").build());

        graph.removeEdge("link");

        assertThat(graph.getEdges("a")).isEmpty();
        assertThatThrownBy(() -> graph.removeEdge("link"))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("edge not found: link");
    }

    @Test
    void accessorsReturnCopies() {
        graph.addNode(TestNode.builder("a").build());
        graph.addNode(TestNode.builder("b").build());
        graph.addEdge(Edge.of("a", "b"));

        graph.getEdges("a").clear();
        graph.getNodes().clear();

        assertThat(graph.getEdges("a")).hasSize(1);
        assertThat(graph.getNodeCount()).isEqualTo(2);
    }

    @Test
    void cloneGraphIsIndependent() {
        graph.addNode(TestNode.builder("a").build());
        graph.addNode(TestNode.builder("b").build());
        graph.addEdge(Edge.of("a", "b"));
        graph.setStartNode("a");

        WorkflowGraph copy = graph.cloneGraph();
        copy.removeEdge("a->b");

        assertThat(copy.getId()).isEqualTo("wf_clone");
        assertThat(copy.getStartNodeId()).contains("a");
        assertThat(graph.getEdges("a")).hasSize(1);
    }

    @Test
    @DisplayName("初始状态按输入播种")
    void createStateSeedsFromInput() {
        graph.addNode(TestNode.builder("a").build());
        graph.setStartNode("a");
        WorkflowInput input = WorkflowInput.builder()
                .userId("u1")
                .sessionId("s1")
                .query("where to?")
                .put("x", 1)
                .context(Collections.singletonMap("locale", "en"))
                .preferences(Collections.singletonMap("budget", "low"))
                .message(Message.user("hi"))
                .build();

        WorkflowState state = graph.createState("exec-1", input);

        assertThat(state.getId()).isEqualTo("exec-1");
        assertThat(state.getWorkflowId()).isEqualTo("wf");
        assertThat(state.getStatus()).isEqualTo(WorkflowStatus.PENDING);
        assertThat(state.getCurrentNode()).isEqualTo("a");
        assertThat(state.getData())
                .containsEntry("x", 1)
                .containsEntry("locale", "en")
                .containsEntry(WorkflowGraph.DATA_QUERY, "where to?");
        assertThat(state.getMetadata())
                .containsEntry(WorkflowGraph.METADATA_USER_ID, "u1")
                .containsEntry(WorkflowGraph.METADATA_SESSION_ID, "s1")
                .containsEntry(WorkflowGraph.METADATA_PREFERENCES, Collections.singletonMap("budget", "low"));
        assertThat(state.getMessages()).containsExactly(Message.user("hi"));
    }

    @Test
    void executeRunsOnCallerThread() {
        graph.addNode(TestNode.builder("a").returns(NodeOutput.of("result", "done")).build());
        graph.setStartNode("a");

        WorkflowOutput output = graph.execute(WorkflowContext.background(), WorkflowInput.empty());

        assertThat(output.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(output.getResult()).isEqualTo("done");
    }
}
