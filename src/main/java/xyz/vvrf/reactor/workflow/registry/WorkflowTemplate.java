package xyz.vvrf.reactor.workflow.registry;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 参数化的工作流模板。{@link #graphFactory} 函数接收已校验并补全默认值的参数，返回新的工作流图。
 */
@Data
@Builder
public class WorkflowTemplate {

    private String id;
    private String name;
    private String description;
    @Singular
    private List<TemplateParameter> parameters;
    private Function<Map<String, Object>, WorkflowGraph> graphFactory;
}
