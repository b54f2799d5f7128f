package xyz.vvrf.reactor.workflow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/**
 * 出口标记节点。可选的收尾函数根据最终状态产生额外数据 (例如写入 "result")。
 * 终止由图结构决定: 没有出边的节点即为终点，EndNode 本身不强制结束执行。
 */
public class EndNode extends AbstractNode {

    public static final String TYPE = "end";
    public static final String METADATA_EXECUTION_COMPLETED = "execution_completed";

    private final Function<WorkflowState, Map<String, ?>> finalizer;

    public EndNode(String id) {
        this(id, id, null);
    }

    /**
     * @param finalizer 收尾函数，可以为 null；抛出的异常视为节点失败
     */
    public EndNode(String id, String name, Function<WorkflowState, Map<String, ?>> finalizer) {
        super(id, TYPE, name);
        this.finalizer = finalizer;
    }

    @Override
    public Mono<NodeOutput> execute(WorkflowContext context, WorkflowState state) {
        return Mono.fromSupplier(() -> {
            NodeOutput.Builder builder = NodeOutput.builder();
            if (finalizer != null) {
                Map<String, ?> extra = finalizer.apply(state);
                if (extra != null) {
                    builder.putAll(extra);
                }
            }
            return builder.metadata(METADATA_EXECUTION_COMPLETED, Instant.now()).build();
        });
    }
}
