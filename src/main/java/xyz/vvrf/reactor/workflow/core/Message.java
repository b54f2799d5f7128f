package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 对话风格的消息（不可变）。
 * WorkflowState 中的消息日志只追加，不修改。
 */
@Getter
public final class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private final String role;
    private final String content;
    private final String name;
    private final List<ToolCall> toolCalls;

    public Message(String role, String content, String name, List<ToolCall> toolCalls) {
        this.role = Objects.requireNonNull(role, "消息角色不能为空");
        this.content = (content != null) ? content : "";
        this.name = name;
        this.toolCalls = (toolCalls != null && !toolCalls.isEmpty())
                ? Collections.unmodifiableList(new ArrayList<>(toolCalls))
                : Collections.emptyList();
    }

    public static Message of(String role, String content) {
        return new Message(role, content, null, null);
    }

    public static Message system(String content) {
        return of(ROLE_SYSTEM, content);
    }

    public static Message user(String content) {
        return of(ROLE_USER, content);
    }

    public static Message assistant(String content) {
        return of(ROLE_ASSISTANT, content);
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return new Message(ROLE_ASSISTANT, content, null, toolCalls);
    }

    public static Message tool(String name, String content) {
        return new Message(ROLE_TOOL, content, name, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message message = (Message) o;
        return role.equals(message.role)
                && content.equals(message.content)
                && Objects.equals(name, message.name)
                && toolCalls.equals(message.toolCalls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content, name, toolCalls);
    }

    @Override
    public String toString() {
        return "Message{role='" + role + "', content='" + content + "'"
                + (name != null ? ", name='" + name + "'" : "")
                + (toolCalls.isEmpty() ? "" : ", toolCalls=" + toolCalls.size())
                + '}';
    }
}
