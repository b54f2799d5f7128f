package xyz.vvrf.reactor.workflow.registry;

import lombok.Builder;
import lombok.Data;

/**
 * 工作流模板的参数声明。
 */
@Data
@Builder
public class TemplateParameter {

    public enum Type {
        STRING,
        INT,
        FLOAT,
        BOOL;

        /**
         * 值是否符合此类型。INT 接受 Integer 和 Long，FLOAT 接受 Float 和 Double。
         */
        public boolean accepts(Object value) {
            switch (this) {
                case STRING:
                    return value instanceof String;
                case INT:
                    return value instanceof Integer || value instanceof Long;
                case FLOAT:
                    return value instanceof Double || value instanceof Float;
                case BOOL:
                    return value instanceof Boolean;
                default:
                    return false;
            }
        }
    }

    private String name;
    private Type type;
    private String description;
    private boolean required;
    /**
     * 未提供参数时使用的默认值，可以为 null。
     */
    private Object defaultValue;
}
