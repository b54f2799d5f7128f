package xyz.vvrf.reactor.workflow.execution;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowError;
import xyz.vvrf.reactor.workflow.core.WorkflowState;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.exception.ExecutionCancelledException;
import xyz.vvrf.reactor.workflow.exception.IllegalExecutionStateException;
import xyz.vvrf.reactor.workflow.exception.WorkflowException;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 封装单次工作流执行的运行时状态。
 * 每次 execute/executeAsync 调用创建一个实例。
 * <p>
 * 活动的 {@link WorkflowState} 只由执行循环写入；控制操作只翻转状态标志。
 * 所有写入和快照都经过本实例的读写锁，保证读者拿到的是一致的副本。
 */
@Slf4j
final class WorkflowExecution {

    @Getter private final String executionId;
    @Getter private final WorkflowGraph graph;
    @Getter private final WorkflowContext context;
    @Getter private final WorkflowState state;
    private final AtomicInteger iterations = new AtomicInteger(0);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    // 循环是否仍在运行或已排队；由锁保护
    private boolean loopActive;

    WorkflowExecution(String executionId, WorkflowGraph graph, WorkflowContext context, WorkflowState state) {
        this.executionId = executionId;
        this.graph = graph;
        this.context = context;
        this.state = state;
        log.debug("[ExecutionId: {}][Workflow: '{}'] 创建 WorkflowExecution (startNode: '{}')",
                executionId, graph.getId(), state.getCurrentNode());
    }

    String getWorkflowId() {
        return graph.getId();
    }

    int getIterations() {
        return iterations.get();
    }

    int incrementIterations() {
        return iterations.incrementAndGet();
    }

    void update(Runnable mutation) {
        lock.writeLock().lock();
        try {
            mutation.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    <T> T compute(Supplier<T> mutation) {
        lock.writeLock().lock();
        try {
            return mutation.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 当前状态的深拷贝
     */
    WorkflowState snapshot() {
        return read(state::deepCopy);
    }

    WorkflowStatus currentStatus() {
        return state.getStatus();
    }

    void markLoopScheduled() {
        update(() -> loopActive = true);
    }

    /**
     * 循环开始时调用: PENDING 转为 RUNNING。
     *
     * @return false 表示执行在开始前已被取消，循环不应继续
     */
    boolean beginLoop() {
        return compute(() -> {
            WorkflowStatus status = state.getStatus();
            if (status.isTerminal()) {
                loopActive = false;
                return false;
            }
            if (status == WorkflowStatus.PENDING) {
                state.setStatus(WorkflowStatus.RUNNING);
            }
            loopActive = true;
            return true;
        });
    }

    /**
     * 循环停下 (暂停挂起、外部取消或自然结束) 时调用，调用方已持有写锁。
     */
    void parkLoopUnlocked() {
        loopActive = false;
    }

    /**
     * 外部控制操作的状态转换。
     *
     * @param operation 操作名称，用于错误信息
     * @param allowed   允许的前置状态
     * @param target    目标状态
     * @return 转换前的状态
     * @throws IllegalExecutionStateException 如果当前状态不在 allowed 中
     */
    WorkflowStatus transition(String operation, Set<WorkflowStatus> allowed, WorkflowStatus target) {
        return compute(() -> {
            WorkflowStatus current = state.getStatus();
            if (!allowed.contains(current)) {
                throw new IllegalExecutionStateException(operation, current);
            }
            state.setStatus(target);
            return current;
        });
    }

    /**
     * 取消执行，并在同一临界区内判断循环是否已挂起。
     *
     * @return 转换前的状态和循环是否已挂起
     * @throws IllegalExecutionStateException 如果当前状态不允许取消
     */
    CancelOutcome cancel(Set<WorkflowStatus> allowed) {
        return compute(() -> {
            WorkflowStatus previous = transition("cancelled", allowed, WorkflowStatus.CANCELLED);
            return new CancelOutcome(previous, !loopActive);
        });
    }

    /**
     * PAUSED → RUNNING。
     *
     * @return true 表示循环已经挂起，需要重新调度
     */
    boolean resume() {
        return compute(() -> {
            WorkflowStatus current = state.getStatus();
            if (current != WorkflowStatus.PAUSED) {
                throw new IllegalExecutionStateException("resumed", current);
            }
            state.setStatus(WorkflowStatus.RUNNING);
            if (loopActive) {
                return false;
            }
            loopActive = true;
            return true;
        });
    }

    /**
     * 记录导致循环终止的错误。
     * 取消只保留 CANCELLED 状态，不写错误；其余错误标记为 FAILED，已有的错误记录 (例如节点错误) 保持不变。
     */
    void recordFailure(Throwable error) {
        update(() -> {
            loopActive = false;
            if (error instanceof ExecutionCancelledException) {
                state.setStatus(WorkflowStatus.CANCELLED);
                return;
            }
            if (!state.getStatus().isTerminal()) {
                state.setStatus(WorkflowStatus.FAILED);
            }
            if (!state.getError().isPresent()) {
                state.setError(toWorkflowError(error));
            }
        });
    }

    private WorkflowError toWorkflowError(Throwable error) {
        if (error instanceof WorkflowException) {
            return ((WorkflowException) error).toWorkflowError();
        }
        return WorkflowError.fromThrowable(WorkflowError.CODE_EXECUTION_PANIC,
                "workflow execution panicked: " + error, state.getCurrentNode(), error);
    }

    @Getter
    static final class CancelOutcome {
        private final WorkflowStatus previous;
        private final boolean loopParked;

        CancelOutcome(WorkflowStatus previous, boolean loopParked) {
            this.previous = previous;
            this.loopParked = loopParked;
        }
    }
}
