package xyz.vvrf.reactor.workflow.registry;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 已注册工作流的结构描述，用于展示和序列化。
 */
@Data
@Builder
public class WorkflowInfo {

    private String id;
    private String name;
    private String description;
    private String startNode;
    private boolean allowCycles;
    private List<NodeInfo> nodes;
    private List<EdgeInfo> edges;

    @Data
    @Builder
    public static class NodeInfo {
        private String id;
        private String name;
        private String type;
    }

    @Data
    @Builder
    public static class EdgeInfo {
        private String id;
        private String from;
        private String to;
        private boolean conditional;
        /**
         * 条件描述；无条件边为 null。
         */
        private String condition;
        private double weight;
    }
}
