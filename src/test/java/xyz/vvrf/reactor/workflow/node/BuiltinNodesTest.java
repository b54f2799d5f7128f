package xyz.vvrf.reactor.workflow.node;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuiltinNodesTest {

    private final WorkflowContext context = WorkflowContext.background();

    private static WorkflowState stateWith(String key, Object value) {
        WorkflowState state = new WorkflowState("exec-1", "wf");
        state.putData(key, value);
        return state;
    }

    @Test
    void startNodeEmitsInitialData() {
        StartNode node = new StartNode("start", "Start", Collections.singletonMap("greeting", "hello"));

        StepVerifier.create(node.execute(context, new WorkflowState("exec-1", "wf")))
                .assertNext(output -> {
                    assertThat(output.getData()).containsExactly(Map.entry("greeting", "hello"));
                    assertThat(output.getMetadata()).containsKey(StartNode.METADATA_EXECUTION_STARTED);
                    assertThat(output.getNextNode()).isEmpty();
                })
                .verifyComplete();
        assertThat(node.getType()).isEqualTo(StartNode.TYPE);
        assertThat(new StartNode("s").getName()).isEqualTo("s");
    }

    @Test
    void endNodeAppliesFinalizer() {
        EndNode node = new EndNode("end", "End", state -> Collections.singletonMap("result", state.get("x")));

        StepVerifier.create(node.execute(context, stateWith("x", 42)))
                .assertNext(output -> {
                    assertThat(output.getData()).containsEntry("result", 42);
                    assertThat(output.getMetadata()).containsKey(EndNode.METADATA_EXECUTION_COMPLETED);
                })
                .verifyComplete();
    }

    @Test
    void endNodeFinalizerFailureIsSignalled() {
        EndNode node = new EndNode("end", "End", state -> {
            throw new IllegalArgumentException("bad state");
        });

        StepVerifier.create(node.execute(context, new WorkflowState("exec-1", "wf")))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void transformNodeSeesCurrentData() {
        TransformNode node = new TransformNode("double",
                data -> Collections.singletonMap("x", ((Integer) data.get("x")) * 2));

        StepVerifier.create(node.execute(context, stateWith("x", 3)))
                .assertNext(output -> assertThat(output.getData()).containsEntry("x", 6))
                .verifyComplete();
    }

    @Test
    void transformNodeRequiresFunction() {
        assertThatThrownBy(() -> new TransformNode("t", null).validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("transformer function cannot be null");
    }

    @Test
    void decisionNodeOverridesRouting() {
        DecisionNode node = new DecisionNode("route", state -> (Integer) state.get("x") > 0 ? "pos" : "");

        StepVerifier.create(node.execute(context, stateWith("x", 1)))
                .assertNext(output -> {
                    assertThat(output.getNextNode()).contains("pos");
                    assertThat(output.getMetadata()).containsEntry(DecisionNode.METADATA_DECISION, "pos");
                })
                .verifyComplete();
        StepVerifier.create(node.execute(context, stateWith("x", -1)))
                .assertNext(output -> assertThat(output.isEmpty()).isTrue())
                .verifyComplete();
    }

    @Test
    void nodesRequireIdentity() {
        assertThatThrownBy(() -> new StartNode(" ").validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("node ID cannot be empty");
        assertThatThrownBy(() -> new DecisionNode("d", null).validate())
                .isInstanceOf(IllegalStateException.class);
    }
}
