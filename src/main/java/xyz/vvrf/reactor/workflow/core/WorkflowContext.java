package xyz.vvrf.reactor.workflow.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 执行上下文：承载取消信号、截止时间和请求级别的键值。
 * <p>
 * 上下文是树形的，子上下文在父上下文结束时同样视为结束。
 * 引擎只在循环迭代边界轮询 {@link #isDone()}，不会中断正在运行的节点；
 * 执行阻塞 I/O 的节点应自行检查该上下文。
 */
public final class WorkflowContext {

    /**
     * 上下文结束的原因。
     */
    public enum CancellationReason {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private static final WorkflowContext BACKGROUND = new WorkflowContext(null, null, null, null, false);

    private final WorkflowContext parent;
    private final Instant deadline;
    private final String key;
    private final Object value;
    private final AtomicBoolean cancelled;
    private final boolean cancellable;

    private WorkflowContext(WorkflowContext parent, Instant deadline, String key, Object value, boolean cancellable) {
        this.parent = parent;
        this.deadline = deadline;
        this.key = key;
        this.value = value;
        this.cancellable = cancellable;
        this.cancelled = new AtomicBoolean(false);
    }

    /**
     * 永不结束的根上下文。
     */
    public static WorkflowContext background() {
        return BACKGROUND;
    }

    /**
     * 派生一个可通过 {@link #cancel()} 取消的子上下文。
     */
    public WorkflowContext withCancel() {
        return new WorkflowContext(this, null, null, null, true);
    }

    public WorkflowContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "超时时间不能为空");
        return withDeadline(Instant.now().plus(timeout));
    }

    public WorkflowContext withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "截止时间不能为空");
        return new WorkflowContext(this, deadline, null, null, true);
    }

    public WorkflowContext withValue(String key, Object value) {
        Objects.requireNonNull(key, "键不能为空");
        return new WorkflowContext(this, null, key, value, false);
    }

    /**
     * 取消本上下文及其所有子上下文。
     *
     * @throws IllegalStateException 如果本上下文不是由 withCancel/withTimeout/withDeadline 派生的
     */
    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("context is not cancellable; derive one with withCancel()");
        }
        cancelled.set(true);
    }

    public boolean isDone() {
        return getCancellationReason().isPresent();
    }

    /**
     * @return 结束原因；尚未结束时为空
     */
    public Optional<CancellationReason> getCancellationReason() {
        if (cancelled.get()) {
            return Optional.of(CancellationReason.CANCELLED);
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            return Optional.of(CancellationReason.DEADLINE_EXCEEDED);
        }
        return (parent != null) ? parent.getCancellationReason() : Optional.empty();
    }

    /**
     * 最近的截止时间 (自身或祖先中最早的一个)。
     */
    public Optional<Instant> getDeadline() {
        Optional<Instant> inherited = (parent != null) ? parent.getDeadline() : Optional.empty();
        if (deadline == null) {
            return inherited;
        }
        return inherited.filter(d -> d.isBefore(deadline)).map(Optional::of).orElse(Optional.of(deadline));
    }

    /**
     * 沿祖先链查找键值。
     */
    public Optional<Object> getValue(String lookupKey) {
        for (WorkflowContext ctx = this; ctx != null; ctx = ctx.parent) {
            if (ctx.key != null && ctx.key.equals(lookupKey)) {
                return Optional.ofNullable(ctx.value);
            }
        }
        return Optional.empty();
    }
}
