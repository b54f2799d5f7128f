package xyz.vvrf.reactor.workflow.builder;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.condition.FieldCondition;
import xyz.vvrf.reactor.workflow.core.WorkflowInput;
import xyz.vvrf.reactor.workflow.core.WorkflowOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.exception.InvalidGraphException;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;
import xyz.vvrf.reactor.workflow.registry.InMemoryWorkflowRegistry;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowBuilderTest {

    // start -> classify -> small / large -> end
    private static WorkflowBuilder sizing() {
        return new WorkflowBuilder("sizing", "Sizing", "classifies x")
                .addStartNode("start")
                .addDecisionNode("classify", state -> ((Integer) state.get("x")) > 10 ? "large" : "small")
                .addTransformNode("small", data -> Collections.singletonMap("size", "small"))
                .addTransformNode("large", "Large", data -> Collections.singletonMap("size", "large"))
                .addEndNode("end", state -> Collections.singletonMap(WorkflowOutput.RESULT_KEY, state.get("size")))
                .addSimpleEdge("start", "classify")
                .addSimpleEdge("classify", "small")
                .addSimpleEdge("classify", "large")
                .addSimpleEdge("small", "end")
                .addSimpleEdge("large", "end")
                .setStartNode("start")
                .metadata("owner", "tests");
    }

    @Test
    void buildsExecutableGraph() {
        WorkflowGraph graph = sizing().build();

        WorkflowOutput large = graph.execute(null, WorkflowInput.builder().put("x", 42).build());
        WorkflowOutput small = graph.execute(null, WorkflowInput.builder().put("x", 1).build());

        assertThat(large.getVisitedNodes()).containsExactly("start", "classify", "large", "end");
        assertThat(large.getResult()).isEqualTo("large");
        assertThat(small.getVisitedNodes()).containsExactly("start", "classify", "small", "end");
        assertThat(graph.getMetadata()).containsEntry("owner", "tests");
    }

    @Test
    void conditionalEdgesKeepInsertionOrder() {
        WorkflowGraph graph = new WorkflowBuilder("cond", "Cond", "")
                .addStartNode("start")
                .addEndNode("a")
                .addEndNode("b")
                .addEdge("start", "a", FieldCondition.eq("route", "a"))
                .addEdge("start", "b", null)
                .setStartNode("start")
                .build();

        assertThat(graph.execute(null, WorkflowInput.builder().put("route", "a").build()).getVisitedNodes())
                .containsExactly("start", "a");
        assertThat(graph.execute(null, WorkflowInput.empty()).getVisitedNodes())
                .containsExactly("start", "b");
    }

    @Test
    void structuralErrorsSurfaceImmediately() {
        WorkflowBuilder builder = new WorkflowBuilder("bad", "Bad", "").addStartNode("start");

        assertThatThrownBy(() -> builder.addStartNode("start"))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("node already exists: start");
        assertThatThrownBy(() -> builder.addSimpleEdge("start", "ghost"))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("to node not found: ghost");
    }

    @Test
    void cyclesRequireOptIn() {
        WorkflowBuilder looping = new WorkflowBuilder("retry", "Retry", "")
                .addTransformNode("attempt", data -> Collections.singletonMap("done", true))
                .addEdge("attempt", "attempt", FieldCondition.notExists("done"))
                .setStartNode("attempt");

        assertThatThrownBy(looping::build).isInstanceOf(InvalidGraphException.class);

        WorkflowGraph graph = new WorkflowBuilder("retry", "Retry", "")
                .addTransformNode("attempt", data -> Collections.singletonMap("done", true))
                .addEdge("attempt", "attempt", FieldCondition.notExists("done"))
                .setStartNode("attempt")
                .allowCycles()
                .build();
        assertThat(graph.isAllowCycles()).isTrue();
    }

    @Test
    void builderIsSingleUse() {
        WorkflowBuilder builder = sizing();
        builder.build();

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("workflow sizing has already been built");
        assertThatThrownBy(() -> builder.addEndNode("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void buildAndRegister() {
        InMemoryWorkflowRegistry registry = new InMemoryWorkflowRegistry();

        WorkflowGraph graph = sizing().buildAndRegister(registry);

        assertThat(registry.requireWorkflow("sizing")).isSameAs(graph);
        assertThat(graph.execute(null, WorkflowInput.builder().put("x", 5).build()).getStatus())
                .isEqualTo(WorkflowStatus.COMPLETED);
    }
}
