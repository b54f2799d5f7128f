package xyz.vvrf.reactor.workflow.condition;

import xyz.vvrf.reactor.workflow.core.Condition;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 常用条件的工厂方法和组合子。
 */
public final class Conditions {

    private static final Condition ALWAYS_TRUE = of("always", state -> true);
    private static final Condition ALWAYS_FALSE = of("never", state -> false);

    private Conditions() {
    }

    public static Condition alwaysTrue() {
        return ALWAYS_TRUE;
    }

    public static Condition alwaysFalse() {
        return ALWAYS_FALSE;
    }

    /**
     * 用状态上的谓词构造条件。
     *
     * @param description 易读描述
     * @param predicate   评估函数
     */
    public static Condition of(String description, Predicate<WorkflowState> predicate) {
        return new DescribedCondition(description, (context, state) -> predicate.test(state));
    }

    /**
     * 所有条件都满足时为 true，短路求值；空参数为 true。
     */
    public static Condition and(Condition... conditions) {
        List<Condition> parts = copyOf(conditions);
        return new DescribedCondition(join(parts, " AND "), (context, state) -> {
            for (Condition part : parts) {
                if (!part.evaluate(context, state)) {
                    return false;
                }
            }
            return true;
        });
    }

    /**
     * 任一条件满足时为 true，短路求值；空参数为 false。
     */
    public static Condition or(Condition... conditions) {
        List<Condition> parts = copyOf(conditions);
        return new DescribedCondition(join(parts, " OR "), (context, state) -> {
            for (Condition part : parts) {
                if (part.evaluate(context, state)) {
                    return true;
                }
            }
            return false;
        });
    }

    public static Condition not(Condition condition) {
        Objects.requireNonNull(condition, "条件不能为空");
        return new DescribedCondition("NOT (" + condition.getDescription() + ")",
                (context, state) -> !condition.evaluate(context, state));
    }

    private static List<Condition> copyOf(Condition[] conditions) {
        Objects.requireNonNull(conditions, "条件列表不能为空");
        List<Condition> parts = new ArrayList<>(Arrays.asList(conditions));
        parts.forEach(c -> Objects.requireNonNull(c, "条件列表不能包含 null"));
        return Collections.unmodifiableList(parts);
    }

    private static String join(List<Condition> parts, String separator) {
        return parts.stream()
                .map(c -> "(" + c.getDescription() + ")")
                .collect(Collectors.joining(separator));
    }

    private static final class DescribedCondition implements Condition {
        private final String description;
        private final Condition delegate;

        private DescribedCondition(String description, Condition delegate) {
            this.description = Objects.requireNonNull(description, "描述不能为空");
            this.delegate = delegate;
        }

        @Override
        public boolean evaluate(WorkflowContext context, WorkflowState state) {
            return delegate.evaluate(context, state);
        }

        @Override
        public String getDescription() {
            return description;
        }

        @Override
        public String toString() {
            return "Condition{" + description + "}";
        }
    }
}
