package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;
import xyz.vvrf.reactor.workflow.util.DataCopies;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 单次节点调用的审计记录（不可变）。
 * 每次调用创建一次并追加到执行历史，之后不再修改。
 */
public final class NodeExecution {

    @Getter private final String nodeId;
    @Getter private final String nodeType;
    @Getter private final Instant startTime;
    private final Instant endTime;
    @Getter private final Duration duration;
    @Getter private final Map<String, Object> input;
    @Getter private final Map<String, Object> output;
    private final WorkflowError error;
    @Getter private final Map<String, Object> metadata;

    private NodeExecution(Builder builder) {
        this.nodeId = Objects.requireNonNull(builder.nodeId, "节点 ID 不能为空");
        this.nodeType = builder.nodeType;
        this.startTime = Objects.requireNonNull(builder.startTime, "开始时间不能为空");
        this.endTime = builder.endTime;
        this.duration = (endTime != null) ? Duration.between(startTime, endTime) : Duration.ZERO;
        this.input = Collections.unmodifiableMap(DataCopies.deepCopy(builder.input));
        this.output = Collections.unmodifiableMap(DataCopies.deepCopy(builder.output));
        this.error = builder.error;
        this.metadata = Collections.unmodifiableMap(DataCopies.deepCopy(builder.metadata));
    }

    /**
     * 开始记录一次节点调用。
     *
     * @param nodeId    节点 ID
     * @param nodeType  节点类型
     * @param startTime 调用开始时间
     * @param input     调用时状态数据的快照
     */
    public static Builder start(String nodeId, String nodeType, Instant startTime, Map<String, ?> input) {
        Builder builder = new Builder();
        builder.nodeId = nodeId;
        builder.nodeType = nodeType;
        builder.startTime = startTime;
        builder.input = input;
        return builder;
    }

    /**
     * 节点返回前为空。
     */
    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<WorkflowError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return "NodeExecution{nodeId='" + nodeId + "', nodeType='" + nodeType
                + "', duration=" + duration.toMillis() + "ms"
                + (error != null ? ", error=" + error.getCode() : "")
                + '}';
    }

    public static final class Builder {
        private String nodeId;
        private String nodeType;
        private Instant startTime;
        private Instant endTime;
        private Map<String, ?> input;
        private Map<String, ?> output;
        private WorkflowError error;
        private Map<String, ?> metadata;

        private Builder() {}

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder output(Map<String, ?> output) {
            this.output = output;
            return this;
        }

        public Builder error(WorkflowError error) {
            this.error = error;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = metadata;
            return this;
        }

        public NodeExecution build() {
            return new NodeExecution(this);
        }
    }
}
