package xyz.vvrf.reactor.workflow.core;

import reactor.core.publisher.Mono;

/**
 * 工作流节点接口，一个统一执行契约下的工作单元（工具调用、模型调用、纯函数等）。
 * <p>
 * 实现要求:
 * <ul>
 *     <li>同一个节点实例会被多个执行并发复用，{@link #execute} 必须可以针对不同状态反复调用。</li>
 *     <li>不得修改传入的 {@link WorkflowState}，所有修改通过返回的 {@link NodeOutput} 表达，由引擎合并。</li>
 *     <li>执行 I/O 时应响应 {@link WorkflowContext} 的取消，不得无限期阻塞。</li>
 * </ul>
 */
public interface Node {

    /**
     * @return 节点在图内唯一的 ID
     */
    String getId();

    /**
     * @return 节点类型标识，用于审计记录和指标
     */
    String getType();

    /**
     * 纯结构性自检，不做 I/O。
     *
     * @throws RuntimeException 如果节点配置无效 (例如 {@link IllegalStateException})
     */
    default void validate() {
    }

    /**
     * 执行节点逻辑。
     * 返回空的 Mono 等同于 {@link NodeOutput#empty()}；以错误结束或直接抛出异常都视为节点执行失败。
     *
     * @param context 执行上下文
     * @param state   当前执行状态 (只读视图)
     * @return 包含节点输出的 Mono
     */
    Mono<NodeOutput> execute(WorkflowContext context, WorkflowState state);
}
