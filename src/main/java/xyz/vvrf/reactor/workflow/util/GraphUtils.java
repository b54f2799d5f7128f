package xyz.vvrf.reactor.workflow.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Edge;
import xyz.vvrf.reactor.workflow.exception.InvalidGraphException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提供工作流图结构的循环检测和可达性分析工具方法。
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 使用深度优先搜索 (DFS) 检测图中是否存在循环。
     *
     * @param allNodeIds 图中所有节点 ID (按迭代顺序作为 DFS 起点)
     * @param edges      按源节点分组的出边
     * @param workflowId 工作流 ID，用于日志和错误信息
     * @throws InvalidGraphException 如果检测到循环
     */
    public static void detectCycles(Collection<String> allNodeIds,
                                    Map<String, List<Edge>> edges,
                                    String workflowId) {
        log.debug("Workflow '{}': Starting cycle detection...", workflowId);
        Set<String> visited = new HashSet<>(); // 完全访问过的节点
        Set<String> visiting = new HashSet<>(); // 当前递归路径上的节点
        Map<String, List<String>> adj = buildAdjacencyList(edges);

        for (String nodeId : allNodeIds) {
            if (!visited.contains(nodeId)) {
                hasCycleDFS(nodeId, visited, visiting, adj, workflowId);
            }
        }
        log.debug("Workflow '{}': No cycles detected.", workflowId);
    }

    // DFS 辅助方法，发现循环时直接抛出
    private static void hasCycleDFS(String nodeId,
                                    Set<String> visited,
                                    Set<String> visiting,
                                    Map<String, List<String>> adj,
                                    String workflowId) {
        visited.add(nodeId);
        visiting.add(nodeId);

        for (String neighbor : adj.getOrDefault(nodeId, Collections.emptyList())) {
            if (visiting.contains(neighbor)) {
                throw new InvalidGraphException(String.format(
                        "workflow '%s': cycle detected, path involves edge from '%s' to '%s'",
                        workflowId, nodeId, neighbor));
            }
            if (!visited.contains(neighbor)) {
                hasCycleDFS(neighbor, visited, visiting, adj, workflowId);
            }
        }

        visiting.remove(nodeId); // 回溯
    }

    /**
     * 从起始节点出发 (BFS) 可以到达的所有节点，包含起始节点本身。
     * 只考虑静态的边，节点输出中的动态 nextNode 覆盖不可见。
     */
    public static Set<String> findReachable(String startNodeId, Map<String, List<Edge>> edges) {
        Set<String> reachable = new LinkedHashSet<>();
        if (startNodeId == null || startNodeId.isEmpty()) {
            return reachable;
        }
        Map<String, List<String>> adj = buildAdjacencyList(edges);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startNodeId);
        reachable.add(startNodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adj.getOrDefault(current, Collections.emptyList())) {
                if (reachable.add(next)) {
                    queue.add(next);
                }
            }
        }
        return reachable;
    }

    // 辅助方法：构建邻接表 (From -> List<To>)，保持插入顺序
    private static Map<String, List<String>> buildAdjacencyList(Map<String, List<Edge>> edges) {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (Map.Entry<String, List<Edge>> entry : edges.entrySet()) {
            List<String> targets = adj.computeIfAbsent(entry.getKey(), k -> new ArrayList<>());
            for (Edge edge : entry.getValue()) {
                targets.add(edge.getToNode());
            }
        }
        return adj;
    }
}
