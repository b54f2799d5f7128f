package xyz.vvrf.reactor.workflow.node;

import lombok.Getter;
import xyz.vvrf.reactor.workflow.core.Node;

/**
 * 节点实现的基类，持有 ID、类型和显示名称。
 */
@Getter
public abstract class AbstractNode implements Node {

    private final String id;
    private final String type;
    private final String name;

    protected AbstractNode(String id, String type, String name) {
        this.id = id;
        this.type = type;
        this.name = (name != null && !name.isEmpty()) ? name : id;
    }

    @Override
    public void validate() {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalStateException("node ID cannot be empty");
        }
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalStateException("node type cannot be empty");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', type='" + type + "', name='" + name + "'}";
    }
}
