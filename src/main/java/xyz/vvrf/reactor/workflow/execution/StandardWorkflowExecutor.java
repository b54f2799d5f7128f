package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowError;
import xyz.vvrf.reactor.workflow.core.WorkflowInput;
import xyz.vvrf.reactor.workflow.core.WorkflowOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowState;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.exception.ExecutionNotFoundException;
import xyz.vvrf.reactor.workflow.exception.InvalidGraphException;
import xyz.vvrf.reactor.workflow.exception.WorkflowException;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * WorkflowExecutor 的标准实现。
 * <p>
 * 同步执行直接在调用方线程上驱动循环；后台执行在配置的 Reactor {@link Scheduler} 上运行，
 * 并登记在本实例独占的执行注册表中 (读写锁保护)。注册表不持久化，需定期调用
 * {@link #cleanupCompletedExecutions(Duration)} 回收已结束的执行。
 */
@Slf4j
public class StandardWorkflowExecutor implements WorkflowExecutor {

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private static final Set<WorkflowStatus> CANCELLABLE = Collections.unmodifiableSet(
            EnumSet.of(WorkflowStatus.PENDING, WorkflowStatus.RUNNING));
    private static final Set<WorkflowStatus> PAUSABLE = Collections.unmodifiableSet(
            EnumSet.of(WorkflowStatus.RUNNING));

    private final ExecutionLoop loop;
    private final Scheduler executionScheduler;
    private final Map<String, WorkflowExecution> executions = new LinkedHashMap<>();
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();

    /**
     * 使用默认设置: 迭代上限 100，共享的 boundedElastic 调度器，无监听器。
     */
    public StandardWorkflowExecutor() {
        this(DEFAULT_MAX_ITERATIONS, Schedulers.boundedElastic(), Collections.emptyList());
    }

    /**
     * 创建 StandardWorkflowExecutor 实例。
     *
     * @param maxIterations      单次执行的迭代上限 (至少为 1)
     * @param executionScheduler 后台执行使用的调度器
     * @param monitorListeners   监控监听器列表 (可以为 null)
     */
    public StandardWorkflowExecutor(int maxIterations,
                                    Scheduler executionScheduler,
                                    List<WorkflowMonitorListener> monitorListeners) {
        this.executionScheduler = Objects.requireNonNull(executionScheduler, "执行调度器不能为空");
        List<WorkflowMonitorListener> listeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners))
                : Collections.emptyList();
        this.loop = new ExecutionLoop(maxIterations, listeners);
        log.debug("StandardWorkflowExecutor 已初始化。迭代上限: {}, 调度器: {}, 监听器数量: {}",
                maxIterations, executionScheduler, listeners.size());
    }

    public int getMaxIterations() {
        return loop.getMaxIterations();
    }

    @Override
    public WorkflowOutput execute(WorkflowContext context, WorkflowGraph graph, WorkflowInput input) {
        return executeReactive(context, graph, input).block();
    }

    @Override
    public Mono<WorkflowOutput> executeReactive(WorkflowContext context, WorkflowGraph graph, WorkflowInput input) {
        Objects.requireNonNull(graph, "工作流图不能为空");
        WorkflowContext ctx = (context != null) ? context : WorkflowContext.background();

        return Mono.defer(() -> {
            String executionId = newExecutionId();
            WorkflowExecution execution = new WorkflowExecution(executionId, graph, ctx, graph.createState(executionId, input));
            try {
                graph.validate();
            } catch (InvalidGraphException e) {
                execution.recordFailure(e);
                return Mono.<WorkflowOutput>error(e.withState(execution.snapshot()));
            }
            return loop.run(execution)
                    .map(state -> WorkflowOutput.from(execution.snapshot()))
                    .onErrorMap(error -> !(error instanceof WorkflowException), error -> new WorkflowException(
                            WorkflowError.CODE_EXECUTION_PANIC, "workflow execution panicked: " + error,
                            execution.read(() -> execution.getState().getCurrentNode()), error))
                    .onErrorMap(WorkflowException.class, e -> e.withState(execution.snapshot()));
        });
    }

    @Override
    public String executeAsync(WorkflowContext context, WorkflowGraph graph, WorkflowInput input) {
        Objects.requireNonNull(graph, "工作流图不能为空");
        WorkflowContext ctx = (context != null) ? context : WorkflowContext.background();

        String executionId = newExecutionId();
        WorkflowExecution execution = new WorkflowExecution(executionId, graph, ctx, graph.createState(executionId, input));
        execution.markLoopScheduled();

        registryLock.writeLock().lock();
        try {
            executions.put(executionId, execution);
        } finally {
            registryLock.writeLock().unlock();
        }
        log.info("[ExecutionId: {}][Workflow: '{}'] Async execution registered.", executionId, graph.getId());

        try {
            launch(execution);
        } catch (RuntimeException e) {
            // 调度器拒绝任务，执行从未开始
            registryLock.writeLock().lock();
            try {
                executions.remove(executionId);
            } finally {
                registryLock.writeLock().unlock();
            }
            log.error("[ExecutionId: {}][Workflow: '{}'] Failed to schedule async execution.", executionId, graph.getId(), e);
            throw e;
        }
        return executionId;
    }

    // 在调度器上运行循环；任何逃逸的 Throwable 都被转换为 FAILED 状态，不向调度器线程传播
    private void launch(WorkflowExecution execution) {
        executionScheduler.schedule(() -> {
            try {
                Mono.defer(() -> {
                            execution.getGraph().validate();
                            return loop.run(execution);
                        })
                        .subscribe(
                                state -> log.debug("[ExecutionId: {}][Workflow: '{}'] Async loop returned with status {}.",
                                        execution.getExecutionId(), execution.getWorkflowId(), state.getStatus()),
                                error -> handleAsyncFailure(execution, error));
            } catch (Throwable t) {
                handleAsyncFailure(execution, t);
            }
        });
    }

    private void handleAsyncFailure(WorkflowExecution execution, Throwable error) {
        // 循环内的错误已由 ExecutionLoop 记录；这里兜底处理循环之外的失败 (例如验证失败或致命错误)
        execution.recordFailure(error);
        if (!(error instanceof WorkflowException)) {
            log.error("[ExecutionId: {}][Workflow: '{}'] Recovered from panic in async execution: {}",
                    execution.getExecutionId(), execution.getWorkflowId(), error.toString(), error);
        } else {
            log.debug("[ExecutionId: {}][Workflow: '{}'] Async execution ended with error: {}",
                    execution.getExecutionId(), execution.getWorkflowId(), error.getMessage());
        }
    }

    @Override
    public WorkflowState getExecution(String executionId) {
        return find(executionId).snapshot();
    }

    @Override
    public List<WorkflowState> listExecutions() {
        registryLock.readLock().lock();
        try {
            List<WorkflowState> states = new ArrayList<>(executions.size());
            for (WorkflowExecution execution : executions.values()) {
                states.add(execution.snapshot());
            }
            return states;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    @Override
    public void cancelExecution(String executionId) {
        WorkflowExecution execution = find(executionId);
        WorkflowExecution.CancelOutcome outcome = execution.cancel(CANCELLABLE);
        WorkflowStatus previous = outcome.getPrevious();
        log.info("[ExecutionId: {}][Workflow: '{}'] Execution cancelled (was {}).",
                executionId, execution.getWorkflowId(), previous);
        loop.safeNotifyListeners(l -> l.onStatusChange(executionId, execution.getWorkflowId(), previous, WorkflowStatus.CANCELLED));
        // 暂停挂起的执行没有循环来报告结束
        if (previous == WorkflowStatus.PAUSED && outcome.isLoopParked()) {
            Duration elapsed = Duration.between(execution.read(() -> execution.getState().getCreatedAt()), Instant.now());
            loop.safeNotifyListeners(l -> l.onWorkflowComplete(executionId, execution.getWorkflowId(),
                    WorkflowStatus.CANCELLED, elapsed, null));
        }
    }

    @Override
    public void pauseExecution(String executionId) {
        WorkflowExecution execution = find(executionId);
        WorkflowStatus previous = execution.transition("paused", PAUSABLE, WorkflowStatus.PAUSED);
        log.info("[ExecutionId: {}][Workflow: '{}'] Execution paused.", executionId, execution.getWorkflowId());
        loop.safeNotifyListeners(l -> l.onStatusChange(executionId, execution.getWorkflowId(), previous, WorkflowStatus.PAUSED));
    }

    @Override
    public void resumeExecution(String executionId) {
        WorkflowExecution execution = find(executionId);
        boolean restart = execution.resume();
        log.info("[ExecutionId: {}][Workflow: '{}'] Execution resumed{}.", executionId, execution.getWorkflowId(),
                restart ? ", rescheduling loop" : "");
        loop.safeNotifyListeners(l -> l.onStatusChange(executionId, execution.getWorkflowId(), WorkflowStatus.PAUSED, WorkflowStatus.RUNNING));
        if (restart) {
            launch(execution);
        }
    }

    @Override
    public int cleanupCompletedExecutions(Duration olderThan) {
        Objects.requireNonNull(olderThan, "保留时长不能为空");
        Instant cutoff = Instant.now().minus(olderThan);
        int removed = 0;

        registryLock.writeLock().lock();
        try {
            Iterator<WorkflowExecution> it = executions.values().iterator();
            while (it.hasNext()) {
                WorkflowExecution execution = it.next();
                boolean expired = execution.read(() -> {
                    WorkflowState state = execution.getState();
                    return state.getStatus().isTerminal() && state.getUpdatedAt().isBefore(cutoff);
                });
                if (expired) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            registryLock.writeLock().unlock();
        }

        if (removed > 0) {
            log.info("Cleaned up {} completed executions older than {}.", removed, olderThan);
        }
        return removed;
    }

    private WorkflowExecution find(String executionId) {
        registryLock.readLock().lock();
        try {
            WorkflowExecution execution = executions.get(executionId);
            if (execution == null) {
                throw new ExecutionNotFoundException(executionId);
            }
            return execution;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    private static String newExecutionId() {
        return UUID.randomUUID().toString();
    }
}
