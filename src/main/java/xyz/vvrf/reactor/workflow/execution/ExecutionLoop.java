package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.Condition;
import xyz.vvrf.reactor.workflow.core.Edge;
import xyz.vvrf.reactor.workflow.core.Node;
import xyz.vvrf.reactor.workflow.core.NodeExecution;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowError;
import xyz.vvrf.reactor.workflow.core.WorkflowState;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.exception.ExecutionCancelledException;
import xyz.vvrf.reactor.workflow.exception.MaxIterationsExceededException;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.exception.RoutingException;
import xyz.vvrf.reactor.workflow.exception.WorkflowException;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.util.DataCopies;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 驱动单个执行在图上逐节点推进的核心循环。
 * <p>
 * 每次迭代: 检查边界条件 (终点、迭代上限、上下文取消、外部暂停/取消)，
 * 调用当前节点，合并输出，追加审计记录，再按出边确定下一个节点。
 * 取消和暂停只在迭代边界被观察到，正在运行的节点总会跑完并被记录。
 */
@Slf4j
class ExecutionLoop {

    private enum Boundary {
        CONTINUE,
        FINISHED,
        PARKED
    }

    private final int maxIterations;
    private final List<WorkflowMonitorListener> monitorListeners;

    ExecutionLoop(int maxIterations, List<WorkflowMonitorListener> monitorListeners) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("最大迭代次数必须大于 0: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.monitorListeners = monitorListeners;
    }

    int getMaxIterations() {
        return maxIterations;
    }

    /**
     * 运行循环直到自然结束、挂起或出错。
     * 出错时状态已被标记 (FAILED 或 CANCELLED)，错误原样向下游传播。
     *
     * @return 以活动状态结束的 Mono
     */
    Mono<WorkflowState> run(WorkflowExecution execution) {
        return Mono.defer(() -> {
            if (!execution.beginLoop()) {
                log.info("[ExecutionId: {}][Workflow: '{}'] Execution already {}, loop not started.",
                        execution.getExecutionId(), execution.getWorkflowId(), execution.currentStatus());
                return Mono.just(execution.getState());
            }
            Instant loopStart = Instant.now();
            String startNodeId = execution.read(() -> execution.getState().getCurrentNode());
            log.info("[ExecutionId: {}][Workflow: '{}'] Execution loop started at node '{}' (iteration {}/{}).",
                    execution.getExecutionId(), execution.getWorkflowId(), startNodeId,
                    execution.getIterations(), maxIterations);
            safeNotifyListeners(l -> l.onWorkflowStart(execution.getExecutionId(), execution.getWorkflowId(), startNodeId));

            return Mono.defer(() -> step(execution))
                    .repeat()
                    .takeUntil(stop -> stop)
                    .then(Mono.fromSupplier(execution::getState))
                    .doOnSuccess(state -> {
                        WorkflowStatus status = execution.currentStatus();
                        log.info("[ExecutionId: {}][Workflow: '{}'] Execution loop ended with status {} after {} iterations.",
                                execution.getExecutionId(), execution.getWorkflowId(), status, execution.getIterations());
                        // 暂停挂起不是一次结束，恢复后同一执行会再次进入循环
                        if (status == WorkflowStatus.PAUSED) {
                            return;
                        }
                        Duration elapsed = Duration.between(loopStart, Instant.now());
                        safeNotifyListeners(l -> l.onWorkflowComplete(execution.getExecutionId(), execution.getWorkflowId(), status, elapsed, null));
                    })
                    .doOnError(error -> {
                        execution.recordFailure(error);
                        WorkflowStatus status = execution.currentStatus();
                        if (error instanceof ExecutionCancelledException) {
                            log.info("[ExecutionId: {}][Workflow: '{}'] Execution cancelled: {}",
                                    execution.getExecutionId(), execution.getWorkflowId(), error.getMessage());
                        } else {
                            log.error("[ExecutionId: {}][Workflow: '{}'] Execution failed with status {}: {}",
                                    execution.getExecutionId(), execution.getWorkflowId(), status, error.getMessage(), error);
                        }
                        Duration elapsed = Duration.between(loopStart, Instant.now());
                        safeNotifyListeners(l -> l.onWorkflowComplete(execution.getExecutionId(), execution.getWorkflowId(), status, elapsed, error));
                    });
        });
    }

    /**
     * 一次迭代。
     *
     * @return true 表示循环应当停止
     */
    private Mono<Boolean> step(WorkflowExecution execution) {
        WorkflowState state = execution.getState();
        WorkflowContext context = execution.getContext();

        Boundary boundary;
        try {
            boundary = checkBoundary(execution);
        } catch (WorkflowException e) {
            return Mono.error(e);
        }
        if (boundary != Boundary.CONTINUE) {
            return Mono.just(Boolean.TRUE);
        }

        String nodeId = state.getCurrentNode();
        Optional<Node> resolved = execution.getGraph().getNode(nodeId);
        if (!resolved.isPresent()) {
            return Mono.error(new WorkflowException(WorkflowError.CODE_NODE_NOT_FOUND,
                    String.format("node not found: %s", nodeId), nodeId, null));
        }
        Node node = resolved.get();

        return invokeNode(execution, node)
                .map(output -> {
                    String next = determineNextNode(execution.getGraph(), nodeId, context, state, output);
                    execution.update(() -> state.setCurrentNode(next));
                    int iteration = execution.incrementIterations();
                    log.debug("[ExecutionId: {}][Workflow: '{}'] Iteration {}: '{}' -> '{}'",
                            execution.getExecutionId(), execution.getWorkflowId(), iteration, nodeId,
                            next.isEmpty() ? "<end>" : next);
                    return Boolean.FALSE;
                });
    }

    // 在写锁内检查循环边界；所有导致停止的状态变化在同一临界区内完成
    private Boundary checkBoundary(WorkflowExecution execution) {
        WorkflowState state = execution.getState();
        return execution.compute(() -> {
            if (state.isAtTerminalNode()) {
                WorkflowStatus status = state.getStatus();
                if (status == WorkflowStatus.RUNNING || status == WorkflowStatus.PAUSED) {
                    state.setStatus(WorkflowStatus.COMPLETED);
                }
                execution.parkLoopUnlocked();
                return Boundary.FINISHED;
            }
            if (execution.getIterations() >= maxIterations) {
                throw new MaxIterationsExceededException(maxIterations, state.getCurrentNode());
            }
            Optional<WorkflowContext.CancellationReason> reason = execution.getContext().getCancellationReason();
            if (reason.isPresent()) {
                state.setStatus(WorkflowStatus.CANCELLED);
                execution.parkLoopUnlocked();
                throw new ExecutionCancelledException(reason.get());
            }
            WorkflowStatus status = state.getStatus();
            if (status == WorkflowStatus.PAUSED || status == WorkflowStatus.CANCELLED) {
                log.info("[ExecutionId: {}][Workflow: '{}'] Loop observed status {} before node '{}', stopping.",
                        execution.getExecutionId(), execution.getWorkflowId(), status, state.getCurrentNode());
                execution.parkLoopUnlocked();
                return Boundary.PARKED;
            }
            return Boundary.CONTINUE;
        });
    }

    /**
     * 调用节点并把结果写回状态。
     * 节点以 Exception 失败时记录审计和错误后转换为 {@link NodeExecutionException}；
     * Error 不被当作节点失败，而是原样传播。
     */
    private Mono<NodeOutput> invokeNode(WorkflowExecution execution, Node node) {
        WorkflowState state = execution.getState();
        String nodeId = node.getId();
        String executionId = execution.getExecutionId();
        String workflowId = execution.getWorkflowId();

        Instant startTime = Instant.now();
        Map<String, Object> inputSnapshot = execution.read(() -> DataCopies.deepCopy(state.getData()));
        safeNotifyListeners(l -> l.onNodeStart(executionId, workflowId, nodeId, node));
        log.debug("[ExecutionId: {}][Workflow: '{}'] Executing node '{}' (type: {})",
                executionId, workflowId, nodeId, node.getType());

        return Mono.defer(() -> node.execute(execution.getContext(), state))
                .switchIfEmpty(Mono.fromSupplier(NodeOutput::empty))
                .onErrorResume(error -> error instanceof Exception, error -> {
                    Instant endTime = Instant.now();
                    NodeExecutionException failure = new NodeExecutionException(nodeId, error);
                    WorkflowError record = WorkflowError.fromThrowable(
                            WorkflowError.CODE_NODE_EXECUTION, failure.getMessage(), nodeId, error);
                    NodeExecution entry = NodeExecution.start(nodeId, node.getType(), startTime, inputSnapshot)
                            .endTime(endTime)
                            .error(record)
                            .build();
                    execution.update(() -> {
                        state.appendHistory(entry);
                        state.setError(record);
                    });
                    log.warn("[ExecutionId: {}][Workflow: '{}'] Node '{}' failed: {}",
                            executionId, workflowId, nodeId, error.getMessage());
                    Duration duration = Duration.between(startTime, endTime);
                    safeNotifyListeners(l -> l.onNodeFailure(executionId, workflowId, nodeId, duration, error, node));
                    return Mono.<NodeOutput>error(failure);
                })
                .map(output -> {
                    Instant endTime = Instant.now();
                    NodeExecution entry = NodeExecution.start(nodeId, node.getType(), startTime, inputSnapshot)
                            .endTime(endTime)
                            .output(output.getData())
                            .metadata(output.getMetadata())
                            .build();
                    execution.update(() -> {
                        state.mergeData(output.getData());
                        state.appendMessages(output.getMessages());
                        state.appendHistory(entry);
                    });
                    Duration duration = Duration.between(startTime, endTime);
                    log.debug("[ExecutionId: {}][Workflow: '{}'] Node '{}' completed in {}ms, output keys: {}",
                            executionId, workflowId, nodeId, duration.toMillis(), output.getData().keySet());
                    safeNotifyListeners(l -> l.onNodeSuccess(executionId, workflowId, nodeId, duration, output));
                    return output;
                });
    }

    /**
     * 确定下一个节点。
     * 节点输出的 nextNode 无条件优先；否则按插入顺序取第一个满足条件的出边 (无条件边总是满足)。
     * 没有出边表示终点，返回空字符串；有出边但都不满足是路由错误。
     *
     * @throws RoutingException 没有边满足条件、条件评估失败，或 nextNode 指向不存在的节点
     */
    String determineNextNode(WorkflowGraph graph, String currentNodeId, WorkflowContext context,
                             WorkflowState state, NodeOutput output) {
        Optional<String> override = output.getNextNode();
        if (override.isPresent()) {
            String next = override.get();
            if (!graph.getNode(next).isPresent()) {
                throw new RoutingException(currentNodeId,
                        String.format("node %s routed to unknown node %s", currentNodeId, next));
            }
            return next;
        }

        List<Edge> edges = graph.getEdges(currentNodeId);
        if (edges.isEmpty()) {
            return "";
        }
        for (Edge edge : edges) {
            Optional<Condition> condition = edge.getCondition();
            if (!condition.isPresent()) {
                return edge.getToNode();
            }
            boolean matched;
            try {
                matched = condition.get().evaluate(context, state);
            } catch (RuntimeException e) {
                throw new RoutingException(currentNodeId, String.format("failed to evaluate condition on edge %s: %s",
                        edge.getId(), e.getMessage()), e);
            }
            if (matched) {
                return edge.getToNode();
            }
        }
        throw new RoutingException(currentNodeId,
                String.format("no edge condition was satisfied from node %s", currentNodeId));
    }

    void safeNotifyListeners(Consumer<WorkflowMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (WorkflowMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("工作流监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
