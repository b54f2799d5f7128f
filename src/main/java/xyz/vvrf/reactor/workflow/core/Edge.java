package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 两个节点之间的有向转移，可选地由 {@link Condition} 守护（不可变）。
 * weight 仅作信息记录，路由总是按插入顺序取第一个满足条件的边。
 */
public final class Edge {

    @Getter private final String id;
    @Getter private final String fromNode;
    @Getter private final String toNode;
    private final Condition condition;
    @Getter private final double weight;
    @Getter private final Map<String, Object> metadata;

    private Edge(String id, String fromNode, String toNode, Condition condition, double weight, Map<String, ?> metadata) {
        this.fromNode = fromNode;
        this.toNode = toNode;
        this.id = (id != null && !id.isEmpty()) ? id : defaultId(fromNode, toNode);
        this.condition = condition;
        this.weight = weight;
        this.metadata = (metadata != null && !metadata.isEmpty())
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    /**
     * 无条件边。
     */
    public static Edge of(String fromNode, String toNode) {
        return new Edge(null, fromNode, toNode, null, 1.0, null);
    }

    public static Edge of(String fromNode, String toNode, Condition condition) {
        return new Edge(null, fromNode, toNode, condition, 1.0, null);
    }

    public static Builder builder(String fromNode, String toNode) {
        return new Builder(fromNode, toNode);
    }

    static String defaultId(String fromNode, String toNode) {
        return fromNode + "->" + toNode;
    }

    public Optional<Condition> getCondition() {
        return Optional.ofNullable(condition);
    }

    public boolean isConditional() {
        return condition != null;
    }

    /**
     * 复制一条边：元数据独立，条件对象共享。
     */
    public Edge copy() {
        return new Edge(id, fromNode, toNode, condition, weight, metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return Double.compare(edge.weight, weight) == 0
                && id.equals(edge.id)
                && Objects.equals(fromNode, edge.fromNode)
                && Objects.equals(toNode, edge.toNode)
                && Objects.equals(condition, edge.condition)
                && metadata.equals(edge.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fromNode, toNode, condition, weight, metadata);
    }

    @Override
    public String toString() {
        return "Edge{" + id + (condition != null ? " [" + condition.getDescription() + "]" : "") + '}';
    }

    public static final class Builder {
        private final String fromNode;
        private final String toNode;
        private String id;
        private Condition condition;
        private double weight = 1.0;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String fromNode, String toNode) {
            this.fromNode = fromNode;
            this.toNode = toNode;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder condition(Condition condition) {
            this.condition = condition;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Edge build() {
            return new Edge(id, fromNode, toNode, condition, weight, metadata);
        }
    }
}
