package xyz.vvrf.reactor.workflow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 入口标记节点。作为普通步骤执行，可以写入一组初始数据。
 */
public class StartNode extends AbstractNode {

    public static final String TYPE = "start";
    public static final String METADATA_EXECUTION_STARTED = "execution_started";

    private final Map<String, Object> initialData;

    public StartNode(String id) {
        this(id, id, Collections.emptyMap());
    }

    public StartNode(String id, String name, Map<String, ?> initialData) {
        super(id, TYPE, name);
        this.initialData = (initialData != null)
                ? Collections.unmodifiableMap(new LinkedHashMap<>(initialData))
                : Collections.emptyMap();
    }

    public Map<String, Object> getInitialData() {
        return initialData;
    }

    @Override
    public Mono<NodeOutput> execute(WorkflowContext context, WorkflowState state) {
        return Mono.fromSupplier(() -> NodeOutput.builder()
                .putAll(initialData)
                .metadata(METADATA_EXECUTION_STARTED, Instant.now())
                .build());
    }
}
