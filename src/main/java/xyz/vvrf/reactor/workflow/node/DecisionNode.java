package xyz.vvrf.reactor.workflow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.util.function.Function;

/**
 * 决策节点: 根据状态选出下一个节点，通过 {@link NodeOutput#getNextNode()} 覆盖基于边的路由。
 * 路由函数返回 null 或空串时不覆盖，交由出边条件决定。
 */
public class DecisionNode extends AbstractNode {

    public static final String TYPE = "decision";
    public static final String METADATA_DECISION = "decision";

    private final Function<WorkflowState, String> router;

    public DecisionNode(String id, Function<WorkflowState, String> router) {
        this(id, id, router);
    }

    public DecisionNode(String id, String name, Function<WorkflowState, String> router) {
        super(id, TYPE, name);
        this.router = router;
    }

    @Override
    public void validate() {
        super.validate();
        if (router == null) {
            throw new IllegalStateException("router function cannot be null");
        }
    }

    @Override
    public Mono<NodeOutput> execute(WorkflowContext context, WorkflowState state) {
        return Mono.fromSupplier(() -> {
            String next = router.apply(state);
            if (next == null || next.isEmpty()) {
                return NodeOutput.empty();
            }
            return NodeOutput.builder()
                    .nextNode(next)
                    .metadata(METADATA_DECISION, next)
                    .build();
        });
    }
}
