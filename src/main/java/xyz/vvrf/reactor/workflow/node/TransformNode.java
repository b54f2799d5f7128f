package xyz.vvrf.reactor.workflow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.util.Map;
import java.util.function.Function;

/**
 * 纯数据变换节点: 读取当前 Data 的只读视图，返回要合并回状态的新键值。
 */
public class TransformNode extends AbstractNode {

    public static final String TYPE = "transform";

    private final Function<Map<String, Object>, Map<String, ?>> transformer;

    public TransformNode(String id, Function<Map<String, Object>, Map<String, ?>> transformer) {
        this(id, id, transformer);
    }

    public TransformNode(String id, String name, Function<Map<String, Object>, Map<String, ?>> transformer) {
        super(id, TYPE, name);
        this.transformer = transformer;
    }

    @Override
    public void validate() {
        super.validate();
        if (transformer == null) {
            throw new IllegalStateException("transformer function cannot be null");
        }
    }

    @Override
    public Mono<NodeOutput> execute(WorkflowContext context, WorkflowState state) {
        return Mono.fromSupplier(() -> NodeOutput.of(transformer.apply(state.getData())));
    }
}
