package xyz.vvrf.reactor.workflow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowInput;
import xyz.vvrf.reactor.workflow.core.WorkflowOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowState;
import xyz.vvrf.reactor.workflow.graph.WorkflowGraph;

import java.time.Duration;
import java.util.List;

/**
 * 工作流执行器接口。
 * 同步/响应式执行一个图，并管理后台执行的注册表 (暂停、恢复、取消、清理)。
 */
public interface WorkflowExecutor {

    /**
     * 同步执行工作流，在调用方线程上运行。
     *
     * @param context 执行上下文 (可以为 null，等同于 {@link WorkflowContext#background()})
     * @param graph   工作流图
     * @param input   输入
     * @return 执行结果
     * @throws xyz.vvrf.reactor.workflow.exception.WorkflowException 任何致命错误，异常中附带最终状态快照；
     *         节点抛出的 Error 以 execution_panic 错误码包装
     */
    WorkflowOutput execute(WorkflowContext context, WorkflowGraph graph, WorkflowInput input);

    /**
     * 响应式执行工作流。每次订阅触发一次独立的执行。
     *
     * @return 成功时发出执行结果，失败时以 WorkflowException 结束
     */
    Mono<WorkflowOutput> executeReactive(WorkflowContext context, WorkflowGraph graph, WorkflowInput input);

    /**
     * 在后台执行工作流。
     * 普通的失败不会在此抛出，而是体现在 {@link #getExecution(String)} 返回的状态上。
     *
     * @return 新分配的执行 ID
     */
    String executeAsync(WorkflowContext context, WorkflowGraph graph, WorkflowInput input);

    /**
     * @return 执行状态的深拷贝
     * @throws xyz.vvrf.reactor.workflow.exception.ExecutionNotFoundException 如果 ID 未知
     */
    WorkflowState getExecution(String executionId);

    /**
     * @return 所有已注册执行状态的深拷贝，按提交顺序
     */
    List<WorkflowState> listExecutions();

    /**
     * 取消执行，只允许从 PENDING 或 RUNNING 状态。不会中断正在运行的节点。
     */
    void cancelExecution(String executionId);

    /**
     * 暂停执行，只允许从 RUNNING 状态。不会中断正在运行的节点。
     */
    void pauseExecution(String executionId);

    /**
     * 恢复执行，只允许从 PAUSED 状态。
     */
    void resumeExecution(String executionId);

    /**
     * 移除处于终止状态且最后更新时间早于 now - olderThan 的执行。
     *
     * @return 移除的数量
     */
    int cleanupCompletedExecutions(Duration olderThan);
}
