package xyz.vvrf.reactor.workflow.condition;

import lombok.Getter;
import xyz.vvrf.reactor.workflow.core.Condition;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * 基于状态数据中单个字段的条件。
 * <p>
 * 字段不存在时: NOT_EXISTS 和 NE 为 true，其余运算符为 false。
 * 值无法比较 (数值运算符遇到非数字、CONTAINS 遇到不支持的容器类型) 时抛出 {@link IllegalStateException}，
 * 引擎会把它转换为路由错误。
 */
@Getter
public final class FieldCondition implements Condition {

    public enum Operator {
        EXISTS("exists"),
        NOT_EXISTS("not exists"),
        EQ("=="),
        NE("!="),
        CONTAINS("contains"),
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final String field;
    private final Operator operator;
    private final Object value;

    public FieldCondition(String field, Operator operator, Object value) {
        this.field = Objects.requireNonNull(field, "字段名不能为空");
        this.operator = Objects.requireNonNull(operator, "运算符不能为空");
        this.value = value;
    }

    public static FieldCondition exists(String field) {
        return new FieldCondition(field, Operator.EXISTS, null);
    }

    public static FieldCondition notExists(String field) {
        return new FieldCondition(field, Operator.NOT_EXISTS, null);
    }

    public static FieldCondition eq(String field, Object value) {
        return new FieldCondition(field, Operator.EQ, value);
    }

    public static FieldCondition ne(String field, Object value) {
        return new FieldCondition(field, Operator.NE, value);
    }

    public static FieldCondition contains(String field, Object value) {
        return new FieldCondition(field, Operator.CONTAINS, value);
    }

    public static FieldCondition gt(String field, Number value) {
        return new FieldCondition(field, Operator.GT, value);
    }

    public static FieldCondition gte(String field, Number value) {
        return new FieldCondition(field, Operator.GTE, value);
    }

    public static FieldCondition lt(String field, Number value) {
        return new FieldCondition(field, Operator.LT, value);
    }

    public static FieldCondition lte(String field, Number value) {
        return new FieldCondition(field, Operator.LTE, value);
    }

    @Override
    public boolean evaluate(WorkflowContext context, WorkflowState state) {
        boolean present = state.has(field);
        Object actual = state.get(field);

        switch (operator) {
            case EXISTS:
                return present;
            case NOT_EXISTS:
                return !present;
            case EQ:
                return present && valuesEqual(actual, value);
            case NE:
                return !present || !valuesEqual(actual, value);
            case CONTAINS:
                return present && contains(actual, value);
            case GT:
                return present && compare(actual, value) > 0;
            case GTE:
                return present && compare(actual, value) >= 0;
            case LT:
                return present && compare(actual, value) < 0;
            case LTE:
                return present && compare(actual, value) <= 0;
            default:
                throw new IllegalStateException("unknown operator: " + operator);
        }
    }

    @Override
    public String getDescription() {
        if (operator == Operator.EXISTS || operator == Operator.NOT_EXISTS) {
            return String.format("field '%s' %s", field, operator.getSymbol());
        }
        return String.format("field '%s' %s %s", field, operator.getSymbol(), value);
    }

    @Override
    public String toString() {
        return "FieldCondition{" + getDescription() + "}";
    }

    // 数字按数值比较，1 与 1.0 相等
    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return toDecimal(actual).compareTo(toDecimal(expected)) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private int compare(Object actual, Object expected) {
        return toComparableNumber(actual).compareTo(toComparableNumber(expected));
    }

    private BigDecimal toComparableNumber(Object candidate) {
        if (candidate instanceof Number) {
            return toDecimal(candidate);
        }
        if (candidate instanceof String) {
            try {
                return new BigDecimal(((String) candidate).trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException(String.format("field '%s': cannot convert '%s' to number", field, candidate), e);
            }
        }
        throw new IllegalStateException(String.format("field '%s': cannot convert %s to number",
                field, candidate == null ? "null" : candidate.getClass().getSimpleName()));
    }

    private static BigDecimal toDecimal(Object number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(((Number) number).doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    private boolean contains(Object container, Object item) {
        if (container instanceof String) {
            if (!(item instanceof String)) {
                throw new IllegalStateException(String.format("field '%s': cannot check if string contains %s",
                        field, item == null ? "null" : item.getClass().getSimpleName()));
            }
            return ((String) container).contains((String) item);
        }
        if (container instanceof Collection) {
            for (Object element : (Collection<?>) container) {
                if (valuesEqual(element, item)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map) {
            return ((Map<?, ?>) container).containsKey(item);
        }
        throw new IllegalStateException(String.format("field '%s': cannot check contains for type %s",
                field, container == null ? "null" : container.getClass().getSimpleName()));
    }
}
