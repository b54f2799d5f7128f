package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 定期清理执行注册表中已结束的执行。
 * 执行注册表只存在于内存中，不清理会随提交次数无限增长。
 */
@Slf4j
public class ExecutionCleanupTask {

    private final WorkflowExecutor executor;
    private final Scheduler scheduler;
    private final Duration retention;
    private final Duration interval;
    private Disposable task;

    /**
     * @param executor  要清理的执行器
     * @param scheduler 运行清理任务的调度器
     * @param retention 已结束执行的保留时长
     * @param interval  清理间隔
     */
    public ExecutionCleanupTask(WorkflowExecutor executor, Scheduler scheduler, Duration retention, Duration interval) {
        this.executor = Objects.requireNonNull(executor, "执行器不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "调度器不能为空");
        this.retention = Objects.requireNonNull(retention, "保留时长不能为空");
        this.interval = Objects.requireNonNull(interval, "清理间隔不能为空");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("清理间隔必须为正: " + interval);
        }
        if (retention.isNegative()) {
            throw new IllegalArgumentException("保留时长不能为负: " + retention);
        }
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        long periodMillis = interval.toMillis();
        task = scheduler.schedulePeriodically(this::runOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("执行清理任务已启动。间隔: {}, 保留时长: {}", interval, retention);
    }

    public synchronized void stop() {
        if (task != null) {
            task.dispose();
            task = null;
            log.info("执行清理任务已停止。");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDisposed();
    }

    /**
     * 执行一次清理。异常只记录，不中断周期任务。
     *
     * @return 移除的执行数量
     */
    public int runOnce() {
        try {
            int removed = executor.cleanupCompletedExecutions(retention);
            log.debug("执行清理完成，移除 {} 个执行。", removed);
            return removed;
        } catch (RuntimeException e) {
            log.error("执行清理失败: {}", e.getMessage(), e);
            return 0;
        }
    }
}
