package xyz.vvrf.reactor.workflow.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import xyz.vvrf.reactor.workflow.core.Message;
import xyz.vvrf.reactor.workflow.core.NodeExecution;
import xyz.vvrf.reactor.workflow.core.ToolCall;
import xyz.vvrf.reactor.workflow.core.WorkflowError;
import xyz.vvrf.reactor.workflow.core.WorkflowOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 把执行状态和执行结果序列化为 JSON 文档，字段名使用 snake_case，时间使用 ISO-8601。
 * 数据中的值必须可被 Jackson 序列化。
 */
public final class WorkflowStateJson {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    private final ObjectMapper objectMapper;

    public WorkflowStateJson() {
        this(DEFAULT_MAPPER);
    }

    public WorkflowStateJson(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    /**
     * @throws IllegalStateException 如果状态中的值无法序列化
     */
    public String toJson(WorkflowState state) {
        return write(toDocument(state));
    }

    public String toJson(WorkflowOutput output) {
        Objects.requireNonNull(output, "输出不能为空");
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("result", output.getResult());
        document.put("messages", messages(output.getMessages()));
        document.put("data", output.getData());
        document.put("metadata", output.getMetadata());
        document.put("state", toDocument(output.getState()));
        return write(document);
    }

    /**
     * 状态的文档形式 (有序 Map)，可用于进一步组装。
     */
    public Map<String, Object> toDocument(WorkflowState state) {
        Objects.requireNonNull(state, "状态不能为空");
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", state.getId());
        document.put("workflow_id", state.getWorkflowId());
        document.put("status", state.getStatus().getValue());
        document.put("current_node", state.getCurrentNode());
        document.put("data", state.getData());
        document.put("messages", messages(state.getMessages()));
        document.put("history", history(state.getHistory()));
        document.put("created_at", state.getCreatedAt());
        document.put("updated_at", state.getUpdatedAt());
        document.put("error", state.getError().map(WorkflowStateJson::error).orElse(null));
        document.put("metadata", state.getMetadata());
        return document;
    }

    private String write(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize workflow state: " + e.getOriginalMessage(), e);
        }
    }

    private static List<Map<String, Object>> messages(List<Message> messages) {
        List<Map<String, Object>> result = new ArrayList<>(messages.size());
        for (Message message : messages) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("role", message.getRole());
            m.put("content", message.getContent());
            if (message.getName() != null) {
                m.put("name", message.getName());
            }
            if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
                List<Map<String, Object>> calls = new ArrayList<>();
                for (ToolCall call : message.getToolCalls()) {
                    Map<String, Object> c = new LinkedHashMap<>();
                    c.put("id", call.getId());
                    c.put("type", call.getType());
                    if (call.getFunction() != null) {
                        Map<String, Object> f = new LinkedHashMap<>();
                        f.put("name", call.getFunction().getName());
                        f.put("arguments", call.getFunction().getArguments());
                        c.put("function", f);
                    }
                    calls.add(c);
                }
                m.put("tool_calls", calls);
            }
            result.add(m);
        }
        return result;
    }

    private static List<Map<String, Object>> history(List<NodeExecution> history) {
        List<Map<String, Object>> result = new ArrayList<>(history.size());
        for (NodeExecution entry : history) {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("node_id", entry.getNodeId());
            h.put("node_type", entry.getNodeType());
            h.put("start_time", entry.getStartTime());
            h.put("end_time", entry.getEndTime().orElse(null));
            h.put("duration", entry.getDuration());
            h.put("input", entry.getInput());
            h.put("output", entry.getOutput());
            h.put("error", entry.getError().map(WorkflowStateJson::error).orElse(null));
            h.put("metadata", entry.getMetadata());
            result.add(h);
        }
        return result;
    }

    private static Map<String, Object> error(WorkflowError error) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("code", error.getCode());
        e.put("message", error.getMessage());
        e.put("node_id", error.getNodeId());
        e.put("timestamp", error.getTimestamp());
        e.put("details", error.getDetails());
        return e;
    }
}
