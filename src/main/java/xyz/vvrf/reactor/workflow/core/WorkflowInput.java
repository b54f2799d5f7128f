package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 调用方传入工作流的输入（不可变）。
 */
@Getter
public final class WorkflowInput {

    private final String userId;
    private final String sessionId;
    private final String query;
    private final Map<String, Object> data;
    private final List<Message> messages;
    private final Map<String, Object> context;
    private final Map<String, Object> preferences;

    private WorkflowInput(Builder builder) {
        this.userId = builder.userId;
        this.sessionId = builder.sessionId;
        this.query = builder.query;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.messages = Collections.unmodifiableList(new ArrayList<>(builder.messages));
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
        this.preferences = Collections.unmodifiableMap(new LinkedHashMap<>(builder.preferences));
    }

    public static WorkflowInput empty() {
        return builder().build();
    }

    public static WorkflowInput ofData(Map<String, ?> data) {
        return builder().data(data).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String userId;
        private String sessionId;
        private String query;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final List<Message> messages = new ArrayList<>();
        private final Map<String, Object> context = new LinkedHashMap<>();
        private final Map<String, Object> preferences = new LinkedHashMap<>();

        private Builder() {}

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder data(Map<String, ?> values) {
            if (values != null) {
                data.putAll(values);
            }
            return this;
        }

        public Builder put(String key, Object value) {
            data.put(key, value);
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

        public Builder context(Map<String, ?> values) {
            if (values != null) {
                context.putAll(values);
            }
            return this;
        }

        public Builder preferences(Map<String, ?> values) {
            if (values != null) {
                preferences.putAll(values);
            }
            return this;
        }

        public WorkflowInput build() {
            return new WorkflowInput(this);
        }
    }
}
