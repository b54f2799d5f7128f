package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 消息中携带的工具调用请求（不可变）。
 */
@Getter
public final class ToolCall {

    private final String id;
    private final String type;
    private final FunctionCall function;

    public ToolCall(String id, String type, FunctionCall function) {
        this.id = id;
        this.type = (type != null) ? type : "function";
        this.function = Objects.requireNonNull(function, "FunctionCall 不能为空");
    }

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCall(name, arguments));
    }

    /**
     * 被调用的函数名及其原始 JSON 参数。
     */
    @Getter
    public static final class FunctionCall {
        private final String name;
        private final String arguments;

        public FunctionCall(String name, String arguments) {
            this.name = Objects.requireNonNull(name, "函数名不能为空");
            this.arguments = (arguments != null) ? arguments : "";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FunctionCall)) return false;
            FunctionCall that = (FunctionCall) o;
            return name.equals(that.name) && arguments.equals(that.arguments);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, arguments);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolCall)) return false;
        ToolCall toolCall = (ToolCall) o;
        return Objects.equals(id, toolCall.id) && type.equals(toolCall.type) && function.equals(toolCall.function);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, function);
    }

    @Override
    public String toString() {
        return "ToolCall{id='" + id + "', type='" + type + "', function=" + function.getName() + '}';
    }
}
