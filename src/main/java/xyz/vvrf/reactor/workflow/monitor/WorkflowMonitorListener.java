package xyz.vvrf.reactor.workflow.monitor;

import xyz.vvrf.reactor.workflow.core.Node;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;

import java.time.Duration;

/**
 * 用于监控工作流执行事件的监听器接口。
 * 包括执行级别和节点级别的事件。
 * <p>
 * 回调在执行循环所在线程上同步调用，实现应当快速返回；抛出的异常会被记录并忽略，不影响执行。
 */
public interface WorkflowMonitorListener {

    /**
     * 执行循环开始 (或暂停后恢复) 时调用。
     *
     * @param executionId 执行 ID
     * @param workflowId  工作流 ID
     * @param startNodeId 本次循环开始的节点
     */
    void onWorkflowStart(String executionId, String workflowId, String startNodeId);

    /**
     * 执行循环以终态结束时调用 (完成、失败或取消)。
     * 暂停挂起不触发此回调；恢复后循环再次开始时会重新调用 {@link #onWorkflowStart}。
     *
     * @param executionId   执行 ID
     * @param workflowId    工作流 ID
     * @param status        结束时的状态
     * @param totalDuration 本次循环耗时
     * @param error         导致失败的异常；成功时为 null
     */
    void onWorkflowComplete(String executionId, String workflowId, WorkflowStatus status, Duration totalDuration, Throwable error);

    /**
     * 节点执行开始时调用。
     *
     * @param executionId 执行 ID
     * @param workflowId  工作流 ID
     * @param nodeId      节点 ID
     * @param node        节点实现
     */
    void onNodeStart(String executionId, String workflowId, String nodeId, Node node);

    /**
     * 节点成功执行完成时调用。
     *
     * @param executionId 执行 ID
     * @param workflowId  工作流 ID
     * @param nodeId      节点 ID
     * @param duration    节点执行耗时
     * @param output      节点输出
     */
    void onNodeSuccess(String executionId, String workflowId, String nodeId, Duration duration, NodeOutput output);

    /**
     * 节点执行失败时调用。
     *
     * @param executionId 执行 ID
     * @param workflowId  工作流 ID
     * @param nodeId      节点 ID
     * @param duration    节点执行耗时
     * @param error       节点抛出的原始错误
     * @param node        节点实现
     */
    void onNodeFailure(String executionId, String workflowId, String nodeId, Duration duration, Throwable error, Node node);

    /**
     * 外部控制操作 (取消/暂停/恢复) 改变执行状态时调用。
     *
     * @param executionId 执行 ID
     * @param workflowId  工作流 ID
     * @param from        原状态
     * @param to          新状态
     */
    void onStatusChange(String executionId, String workflowId, WorkflowStatus from, WorkflowStatus to);
}
