package xyz.vvrf.reactor.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 工作流模板注册表。线程安全。
 */
@Slf4j
public class TemplateRegistry {

    private static final String KIND = "template";

    private final Map<String, WorkflowTemplate> templates = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException 如果 ID 为空、未提供图工厂或 ID 已注册
     */
    public void register(WorkflowTemplate template) {
        Objects.requireNonNull(template, "模板不能为空");
        String templateId = template.getId();
        if (templateId == null || templateId.trim().isEmpty()) {
            throw new IllegalArgumentException("template ID cannot be empty");
        }
        if (template.getGraphFactory() == null) {
            throw new IllegalArgumentException(String.format("template %s has no graph factory", templateId));
        }
        if (templates.putIfAbsent(templateId, template) != null) {
            throw new IllegalArgumentException(String.format("template already registered: %s", templateId));
        }
        log.info("已注册工作流模板 '{}' ({} 个参数)", templateId,
                template.getParameters() == null ? 0 : template.getParameters().size());
    }

    public Optional<WorkflowTemplate> getTemplate(String templateId) {
        if (templateId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(templateId));
    }

    /**
     * @return 已注册模板的 ID，按字典序
     */
    public List<String> listTemplates() {
        return templates.keySet().stream().sorted().collect(Collectors.toList());
    }

    /**
     * 用参数实例化模板: 校验必填参数和类型，补全默认值，再调用模板的图工厂。
     *
     * @param templateId 模板 ID
     * @param params     参数 (可以为 null)
     * @return 新构造的工作流图
     * @throws WorkflowNotFoundException 如果模板未注册
     * @throws IllegalArgumentException  如果参数无效
     */
    public WorkflowGraph instantiate(String templateId, Map<String, ?> params) {
        WorkflowTemplate template = getTemplate(templateId)
                .orElseThrow(() -> new WorkflowNotFoundException(KIND, templateId));

        Map<String, Object> enriched = new LinkedHashMap<>();
        if (params != null) {
            enriched.putAll(params);
        }
        List<TemplateParameter> declared = template.getParameters();
        if (declared != null) {
            for (TemplateParameter parameter : declared) {
                validateParameter(parameter, enriched);
            }
            for (TemplateParameter parameter : declared) {
                if (!enriched.containsKey(parameter.getName()) && parameter.getDefaultValue() != null) {
                    enriched.put(parameter.getName(), parameter.getDefaultValue());
                }
            }
        }

        log.debug("正在实例化模板 '{}'，参数: {}", templateId, enriched.keySet());
        WorkflowGraph graph = template.getGraphFactory().apply(enriched);
        if (graph == null) {
            throw new IllegalStateException(String.format("template %s produced no workflow", templateId));
        }
        return graph;
    }

    private static void validateParameter(TemplateParameter parameter, Map<String, Object> params) {
        String name = parameter.getName();
        if (!params.containsKey(name)) {
            if (parameter.isRequired()) {
                throw new IllegalArgumentException(String.format("invalid parameters: required parameter missing: %s", name));
            }
            return;
        }
        Object value = params.get(name);
        TemplateParameter.Type type = parameter.getType();
        if (type != null && !type.accepts(value)) {
            throw new IllegalArgumentException(String.format("invalid parameters: invalid parameter %s: expected %s, got %s",
                    name, type.name().toLowerCase(), value == null ? "null" : value.getClass().getSimpleName()));
        }
    }
}
