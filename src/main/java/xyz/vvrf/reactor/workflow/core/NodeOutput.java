package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单次节点执行的输出（不可变数据类）。
 * 引擎负责把 data 合并进状态数据 (同名键后写覆盖)，把 messages 追加到消息日志。
 * nextNode 非空时无条件覆盖基于边的路由。
 */
public final class NodeOutput {

    private static final NodeOutput EMPTY = new NodeOutput(null, null, null, null);

    @Getter private final Map<String, Object> data;
    @Getter private final List<Message> messages;
    @Getter private final Map<String, Object> metadata;
    private final String nextNode;

    private NodeOutput(Map<String, ?> data, List<Message> messages, String nextNode, Map<String, ?> metadata) {
        this.data = (data != null) ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Collections.emptyMap();
        this.messages = (messages != null) ? Collections.unmodifiableList(new ArrayList<>(messages)) : Collections.emptyList();
        this.nextNode = (nextNode != null && !nextNode.isEmpty()) ? nextNode : null;
        this.metadata = (metadata != null) ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Collections.emptyMap();
    }

    // --- 静态工厂方法 ---

    /**
     * 不产生任何数据，也不覆盖路由。
     */
    public static NodeOutput empty() {
        return EMPTY;
    }

    public static NodeOutput of(Map<String, ?> data) {
        return new NodeOutput(data, null, null, null);
    }

    public static NodeOutput of(String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, value);
        return new NodeOutput(data, null, null, null);
    }

    /**
     * 仅指定下一个节点 (动态路由覆盖)。
     */
    public static NodeOutput routeTo(String nextNode) {
        return new NodeOutput(null, null, nextNode, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getNextNode() {
        return Optional.ofNullable(nextNode);
    }

    public boolean isEmpty() {
        return data.isEmpty() && messages.isEmpty() && metadata.isEmpty() && nextNode == null;
    }

    @Override
    public String toString() {
        return "NodeOutput{dataKeys=" + data.keySet()
                + ", messages=" + messages.size()
                + (nextNode != null ? ", nextNode='" + nextNode + "'" : "")
                + '}';
    }

    public static final class Builder {
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final List<Message> messages = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String nextNode;

        private Builder() {}

        public Builder put(String key, Object value) {
            data.put(key, value);
            return this;
        }

        public Builder putAll(Map<String, ?> values) {
            if (values != null) {
                data.putAll(values);
            }
            return this;
        }

        public Builder message(Message message) {
            if (message != null) {
                messages.add(message);
            }
            return this;
        }

        public Builder messages(List<Message> values) {
            if (values != null) {
                messages.addAll(values);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Builder nextNode(String nextNode) {
            this.nextNode = nextNode;
            return this;
        }

        public NodeOutput build() {
            return new NodeOutput(data, messages, nextNode, metadata);
        }
    }
}
