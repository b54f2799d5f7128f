package xyz.vvrf.reactor.workflow.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.builder.WorkflowBuilder;
import xyz.vvrf.reactor.workflow.core.WorkflowInput;
import xyz.vvrf.reactor.workflow.core.WorkflowOutput;
import xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateRegistryTest {

    private TemplateRegistry registry;
    private final AtomicReference<Map<String, Object>> received = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        registry = new TemplateRegistry();
        registry.register(WorkflowTemplate.builder()
                .id("multiplier")
                .name("Multiplier")
                .description("multiplies x by a factor")
                .parameter(TemplateParameter.builder()
                        .name("factor").type(TemplateParameter.Type.INT).required(true).build())
                .parameter(TemplateParameter.builder()
                        .name("label").type(TemplateParameter.Type.STRING).defaultValue("product").build())
                .graphFactory(params -> {
                    received.set(params);
                    int factor = (Integer) params.get("factor");
                    String label = (String) params.get("label");
                    return new WorkflowBuilder("multiplier-" + factor, "Multiplier", "")
                            .addTransformNode("multiply", data -> Collections.singletonMap(label, ((Integer) data.get("x")) * factor))
                            .setStartNode("multiply")
                            .build();
                })
                .build());
    }

    @Test
    void instantiatesWithDefaults() {
        WorkflowGraph graph = registry.instantiate("multiplier", Collections.singletonMap("factor", 3));

        assertThat(graph.getId()).isEqualTo("multiplier-3");
        assertThat(received.get()).containsEntry("label", "product");

        WorkflowOutput output = graph.execute(null, WorkflowInput.builder().put("x", 2).build());
        assertThat(output.getData()).containsEntry("product", 6);
    }

    @Test
    void explicitValuesOverrideDefaults() {
        Map<String, Object> params = new HashMap<>();
        params.put("factor", 2);
        params.put("label", "doubled");

        registry.instantiate("multiplier", params);

        assertThat(received.get()).containsEntry("label", "doubled");
    }

    @Test
    void rejectsMissingAndMistypedParameters() {
        assertThatThrownBy(() -> registry.instantiate("multiplier", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("invalid parameters: required parameter missing: factor");
        assertThatThrownBy(() -> registry.instantiate("multiplier", Collections.singletonMap("factor", "3")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("invalid parameters: invalid parameter factor: expected int, got String");
        assertThat(received.get()).isNull();
    }

    @Test
    void unknownTemplate() {
        assertThatThrownBy(() -> registry.instantiate("nope", null))
                .isInstanceOf(WorkflowNotFoundException.class)
                .hasMessage("template not found: nope");
        assertThat(registry.getTemplate("nope")).isEmpty();
    }

    @Test
    void registrationRules() {
        assertThatThrownBy(() -> registry.register(WorkflowTemplate.builder().id("multiplier").graphFactory(p -> null).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("template already registered: multiplier");
        assertThatThrownBy(() -> registry.register(WorkflowTemplate.builder().id(" ").graphFactory(p -> null).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("template ID cannot be empty");
        assertThatThrownBy(() -> registry.register(WorkflowTemplate.builder().id("bare").build()))
                .isInstanceOf(IllegalArgumentException.class);

        registry.register(WorkflowTemplate.builder().id("empty").graphFactory(p -> null).build());
        assertThat(registry.listTemplates()).containsExactly("empty", "multiplier");
        assertThatThrownBy(() -> registry.instantiate("empty", null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void parameterTypes() {
        assertThat(TemplateParameter.Type.INT.accepts(1L)).isTrue();
        assertThat(TemplateParameter.Type.INT.accepts(1.0)).isFalse();
        assertThat(TemplateParameter.Type.FLOAT.accepts(1.5f)).isTrue();
        assertThat(TemplateParameter.Type.BOOL.accepts(Boolean.TRUE)).isTrue();
        assertThat(TemplateParameter.Type.STRING.accepts(null)).isFalse();
    }
}
