package xyz.vvrf.reactor.workflow.core;

/**
 * 定义边的激活条件。
 * 与节点一样，评估必须是纯函数式的，不做 I/O，也不修改状态。
 */
@FunctionalInterface
public interface Condition {

    /**
     * 评估条件是否满足。
     *
     * @param context 执行上下文
     * @param state   当前执行状态
     * @return 如果条件满足，则返回 true，边可被选中
     * @throws RuntimeException 评估失败时抛出，引擎会将其转换为路由错误
     */
    boolean evaluate(WorkflowContext context, WorkflowState state);

    /**
     * 条件的易读描述，主要用于日志和工作流信息展示。
     */
    default String getDescription() {
        return getClass().getSimpleName();
    }
}
