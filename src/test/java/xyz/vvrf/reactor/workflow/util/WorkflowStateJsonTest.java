package xyz.vvrf.reactor.workflow.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.Edge;
import xyz.vvrf.reactor.workflow.core.Message;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowError;
import xyz.vvrf.reactor.workflow.core.WorkflowInput;
import xyz.vvrf.reactor.workflow.core.WorkflowOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowState;
import xyz.vvrf.reactor.workflow.exception.WorkflowException;
import xyz.vvrf.reactor.workflow.execution.StandardWorkflowExecutor;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;
import xyz.vvrf.reactor.workflow.test.util.TestNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class WorkflowStateJsonTest {

    private final ObjectMapper reader = new ObjectMapper();
    private final WorkflowStateJson json = new WorkflowStateJson();
    private final StandardWorkflowExecutor executor = new StandardWorkflowExecutor();

    private static WorkflowGraph greeting(TestNode second) {
        WorkflowGraph graph = new WorkflowGraph("greet", "Greet", "");
        graph.addNode(TestNode.builder("hello")
                .returns(NodeOutput.builder().put("greeted", true).message(Message.assistant("hello")).build())
                .build());
        graph.addNode(second);
        graph.addEdge(Edge.of("hello", second.getId()));
        graph.setStartNode("hello");
        return graph;
    }

    @Test
    void serializesCompletedOutput() throws Exception {
        WorkflowOutput output = executor.execute(WorkflowContext.background(),
                greeting(TestNode.builder("done").returns(NodeOutput.of(WorkflowOutput.RESULT_KEY, "ok")).build()),
                WorkflowInput.builder().query("hi").userId("u1").build());

        JsonNode root = reader.readTree(json.toJson(output));

        assertThat(root.get("result").asText()).isEqualTo("ok");
        assertThat(root.get("messages").get(0).get("role").asText()).isEqualTo("assistant");
        JsonNode state = root.get("state");
        assertThat(state.get("workflow_id").asText()).isEqualTo("greet");
        assertThat(state.get("status").asText()).isEqualTo("completed");
        assertThat(state.get("current_node").asText()).isEmpty();
        assertThat(state.get("data").get("query").asText()).isEqualTo("hi");
        assertThat(state.get("metadata").get("user_id").asText()).isEqualTo("u1");
        assertThat(state.get("history")).hasSize(2);
        assertThat(state.get("history").get(0).get("node_id").asText()).isEqualTo("hello");
        assertThat(state.get("history").get(0).get("start_time").isTextual()).isTrue();
        assertThat(state.get("error").isNull()).isTrue();
    }

    @Test
    void serializesFailureDetails() throws Exception {
        WorkflowException failure = catchThrowableOfType(() -> executor.execute(WorkflowContext.background(),
                greeting(TestNode.builder("broken").failsWith(new IllegalStateException("boom")).build()),
                WorkflowInput.empty()), WorkflowException.class);
        WorkflowState state = failure.getState().orElseThrow(AssertionError::new);

        JsonNode root = reader.readTree(json.toJson(state));

        assertThat(root.get("status").asText()).isEqualTo("failed");
        assertThat(root.get("error").get("code").asText()).isEqualTo(WorkflowError.CODE_NODE_EXECUTION);
        assertThat(root.get("error").get("node_id").asText()).isEqualTo("broken");
        assertThat(root.get("error").get("details").get("cause").asText()).isEqualTo("boom");
        assertThat(root.get("history").get(1).get("error").get("code").asText()).isEqualTo(WorkflowError.CODE_NODE_EXECUTION);
    }

    @Test
    void unserializableDataIsReported() {
        WorkflowState state = new WorkflowState("exec-1", "wf");
        state.putData("stream", new Object());

        assertThatThrownBy(() -> json.toJson(state))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("failed to serialize workflow state");
    }
}
