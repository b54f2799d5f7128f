package xyz.vvrf.reactor.workflow.graph;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Edge;
import xyz.vvrf.reactor.workflow.core.Node;
import xyz.vvrf.reactor.workflow.core.WorkflowContext;
import xyz.vvrf.reactor.workflow.core.WorkflowInput;
import xyz.vvrf.reactor.workflow.core.WorkflowOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowState;
import xyz.vvrf.reactor.workflow.execution.StandardWorkflowExecutor;
import xyz.vvrf.reactor.workflow.exception.InvalidGraphException;
import xyz.vvrf.reactor.workflow.util.DataCopies;
import xyz.vvrf.reactor.workflow.util.GraphUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 工作流图：节点集合加上每个节点按插入顺序排列的出边。
 * <p>
 * 图在构建完成后以读为主，可被任意多个执行并发读取，由读写锁保护；
 * 所有访问器都返回副本。构建 (addNode/addEdge) 应在并发执行开始之前完成。
 * 节点按引用在执行之间共享，被视为不可变的值对象。
 */
@Slf4j
public class WorkflowGraph {

    public static final String METADATA_USER_ID = "user_id";
    public static final String METADATA_SESSION_ID = "session_id";
    public static final String METADATA_PREFERENCES = "preferences";
    public static final String DATA_QUERY = "query";

    private final String id;
    private final String name;
    private final String description;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, List<Edge>> edges = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String startNode = "";
    private boolean allowCycles;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public WorkflowGraph(String id, String name, String description) {
        this.id = Objects.requireNonNull(id, "工作流 ID 不能为空");
        this.name = (name != null) ? name : id;
        this.description = (description != null) ? description : "";
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 添加节点，并为其初始化空的出边列表。
     *
     * @throws InvalidGraphException 如果节点自检失败，或同 ID 的节点已存在
     */
    public void addNode(Node node) {
        Objects.requireNonNull(node, "节点不能为空");
        String nodeId = node.getId();
        if (nodeId == null || nodeId.isEmpty()) {
            throw new InvalidGraphException(String.format("workflow '%s': node ID cannot be empty", id));
        }
        try {
            node.validate();
        } catch (InvalidGraphException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidGraphException(String.format("node %s validation failed: %s", nodeId, e.getMessage()), nodeId, e);
        }

        lock.writeLock().lock();
        try {
            if (nodes.containsKey(nodeId)) {
                throw new InvalidGraphException(String.format("node already exists: %s", nodeId));
            }
            nodes.put(nodeId, node);
            edges.put(nodeId, new ArrayList<>());
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Workflow '{}': added node '{}' (type: {})", id, nodeId, node.getType());
    }

    /**
     * 添加边，追加到源节点出边列表的末尾。插入顺序决定路由优先级。
     * 不检查边 ID 是否重复: 同一对节点之间可以有多条条件不同的边。
     *
     * @throws InvalidGraphException 如果端点为空或不存在
     */
    public void addEdge(Edge edge) {
        Objects.requireNonNull(edge, "边不能为空");
        String from = edge.getFromNode();
        String to = edge.getToNode();
        if (from == null || from.isEmpty() || to == null || to.isEmpty()) {
            throw new InvalidGraphException("edge must have both from and to nodes");
        }

        lock.writeLock().lock();
        try {
            if (!nodes.containsKey(from)) {
                throw new InvalidGraphException(String.format("from node not found: %s", from));
            }
            if (!nodes.containsKey(to)) {
                throw new InvalidGraphException(String.format("to node not found: %s", to));
            }
            edges.computeIfAbsent(from, k -> new ArrayList<>()).add(edge);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Workflow '{}': added edge '{}'{}", id, edge.getId(),
                edge.isConditional() ? " (conditional)" : "");
    }

    /**
     * @throws InvalidGraphException 如果节点不存在
     */
    public void setStartNode(String nodeId) {
        lock.writeLock().lock();
        try {
            if (nodeId == null || !nodes.containsKey(nodeId)) {
                throw new InvalidGraphException(String.format("start node not found: %s", nodeId));
            }
            this.startNode = nodeId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return 起始节点
     * @throws InvalidGraphException 如果未设置或已不存在
     */
    public Node getStartNode() {
        lock.readLock().lock();
        try {
            if (startNode.isEmpty()) {
                throw new InvalidGraphException(String.format("workflow '%s': no start node set", id));
            }
            Node node = nodes.get(startNode);
            if (node == null) {
                throw new InvalidGraphException(String.format("start node not found: %s", startNode));
            }
            return node;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> getStartNodeId() {
        lock.readLock().lock();
        try {
            return startNode.isEmpty() ? Optional.empty() : Optional.of(startNode);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Node> getNode(String nodeId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(nodeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 该节点出边的副本，按插入顺序
     */
    public List<Edge> getEdges(String fromNodeId) {
        lock.readLock().lock();
        try {
            List<Edge> outgoing = edges.get(fromNodeId);
            return (outgoing != null) ? new ArrayList<>(outgoing) : new ArrayList<>();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 节点 ID 到节点的副本，按添加顺序
     */
    public Map<String, Node> getNodes() {
        lock.readLock().lock();
        try {
            return new LinkedHashMap<>(nodes);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 源节点 ID 到出边列表的副本
     */
    public Map<String, List<Edge>> getAllEdges() {
        lock.readLock().lock();
        try {
            return copyEdgesUnlocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getNodeCount() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 删除节点及其出边，并去除其他节点指向它的边。
     * 如果删除的是起始节点，起始节点被清空，调用方需要重新设置。
     *
     * @throws InvalidGraphException 如果节点不存在
     */
    public void removeNode(String nodeId) {
        lock.writeLock().lock();
        try {
            if (!nodes.containsKey(nodeId)) {
                throw new InvalidGraphException(String.format("node not found: %s", nodeId));
            }
            nodes.remove(nodeId);
            edges.remove(nodeId);
            for (List<Edge> outgoing : edges.values()) {
                outgoing.removeIf(edge -> edge.getToNode().equals(nodeId));
            }
            if (startNode.equals(nodeId)) {
                startNode = "";
                log.warn("Workflow '{}': start node '{}' removed, start node cleared", id, nodeId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 移除第一条 ID 匹配的边 (按源节点添加顺序和出边插入顺序)，同 ID 的其余边保留。
     *
     * @throws InvalidGraphException 如果边不存在
     */
    public void removeEdge(String edgeId) {
        lock.writeLock().lock();
        try {
            for (List<Edge> outgoing : edges.values()) {
                Iterator<Edge> it = outgoing.iterator();
                while (it.hasNext()) {
                    if (it.next().getId().equals(edgeId)) {
                        it.remove();
                        return;
                    }
                }
            }
            throw new InvalidGraphException(String.format("edge not found: %s", edgeId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isAllowCycles() {
        lock.readLock().lock();
        try {
            return allowCycles;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 允许图中存在结构性环 (例如由条件控制的重试回路)。
     * 开启后 {@link #validate()} 跳过环检测，失控的循环仍由执行器的迭代上限兜底。
     */
    public void setAllowCycles(boolean allowCycles) {
        lock.writeLock().lock();
        try {
            this.allowCycles = allowCycles;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, Object> getMetadata() {
        lock.readLock().lock();
        try {
            return new LinkedHashMap<>(metadata);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void putMetadata(String key, Object value) {
        lock.writeLock().lock();
        try {
            metadata.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 验证图结构，依次检查: 至少一个节点; 起始节点已设置且存在; 每个节点自检通过; 不存在结构性环。
     * 不可达节点只记录警告。
     *
     * @throws InvalidGraphException 如果验证失败
     */
    public void validate() {
        lock.readLock().lock();
        try {
            if (nodes.isEmpty()) {
                throw new InvalidGraphException(String.format("workflow '%s' has no nodes", id));
            }
            if (startNode.isEmpty()) {
                throw new InvalidGraphException(String.format("workflow '%s' has no start node", id));
            }
            if (!nodes.containsKey(startNode)) {
                throw new InvalidGraphException(String.format("start node not found: %s", startNode));
            }
            for (Node node : nodes.values()) {
                try {
                    node.validate();
                } catch (RuntimeException e) {
                    throw new InvalidGraphException(
                            String.format("node %s validation failed: %s", node.getId(), e.getMessage()), node.getId(), e);
                }
            }
            if (!allowCycles) {
                GraphUtils.detectCycles(nodes.keySet(), edges, id);
            }

            Set<String> unreachable = findUnreachableUnlocked();
            if (!unreachable.isEmpty()) {
                log.warn("Workflow '{}': nodes not reachable from start node '{}': {}", id, startNode, unreachable);
            }
        } finally {
            lock.readLock().unlock();
        }
        log.debug("Workflow '{}': validation passed ({} nodes)", id, getNodeCount());
    }

    /**
     * 从起始节点沿静态边无法到达的节点。未设置起始节点时返回全部节点。
     */
    public Set<String> findUnreachableNodes() {
        lock.readLock().lock();
        try {
            return findUnreachableUnlocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 复制出一个独立的图: 节点按引用共享，边列表深拷贝。ID 和名称追加 "_clone" 后缀。
     */
    public WorkflowGraph cloneGraph() {
        lock.readLock().lock();
        try {
            WorkflowGraph copy = new WorkflowGraph(id + "_clone", name + "_clone", description);
            copy.nodes.putAll(nodes);
            for (Map.Entry<String, List<Edge>> entry : edges.entrySet()) {
                List<Edge> copied = new ArrayList<>(entry.getValue().size());
                for (Edge edge : entry.getValue()) {
                    copied.add(edge.copy());
                }
                copy.edges.put(entry.getKey(), copied);
            }
            copy.metadata.putAll(DataCopies.deepCopy(metadata));
            copy.startNode = startNode;
            copy.allowCycles = allowCycles;
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 为一次新的执行构造初始状态。
     * Data 取自输入数据并合并输入上下文; query 写入 Data; userId/sessionId/preferences 写入 Metadata;
     * 当前节点为起始节点。
     *
     * @param executionId 执行 ID
     * @param input       工作流输入 (可以为 null)
     */
    public WorkflowState createState(String executionId, WorkflowInput input) {
        WorkflowState state = new WorkflowState(executionId, id);
        WorkflowInput in = (input != null) ? input : WorkflowInput.empty();

        state.mergeData(DataCopies.deepCopy(in.getData()));
        state.mergeData(DataCopies.deepCopy(in.getContext()));
        if (in.getQuery() != null && !in.getQuery().isEmpty()) {
            state.putData(DATA_QUERY, in.getQuery());
        }
        state.appendMessages(in.getMessages());
        if (in.getUserId() != null && !in.getUserId().isEmpty()) {
            state.putMetadata(METADATA_USER_ID, in.getUserId());
        }
        if (in.getSessionId() != null && !in.getSessionId().isEmpty()) {
            state.putMetadata(METADATA_SESSION_ID, in.getSessionId());
        }
        if (!in.getPreferences().isEmpty()) {
            state.putMetadata(METADATA_PREFERENCES, DataCopies.deepCopy(in.getPreferences()));
        }
        state.setCurrentNode(getStartNodeId().orElse(""));
        return state;
    }

    /**
     * 在调用方线程上同步执行此图。
     *
     * @return 执行结果
     * @throws xyz.vvrf.reactor.workflow.exception.WorkflowException 任何致命错误
     */
    public WorkflowOutput execute(WorkflowContext context, WorkflowInput input) {
        return new StandardWorkflowExecutor().execute(context, this, input);
    }

    // --- 内部辅助方法，调用方需持有锁 ---

    private Map<String, List<Edge>> copyEdgesUnlocked() {
        Map<String, List<Edge>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Edge>> entry : edges.entrySet()) {
            copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return copy;
    }

    private Set<String> findUnreachableUnlocked() {
        Set<String> reachable = GraphUtils.findReachable(startNode, edges);
        Set<String> unreachable = new LinkedHashSet<>(nodes.keySet());
        unreachable.removeAll(reachable);
        return Collections.unmodifiableSet(unreachable);
    }

    @Override
    public String toString() {
        return "WorkflowGraph{id='" + id + "', name='" + name + "', nodes=" + getNodeCount()
                + ", startNode='" + getStartNodeId().orElse("") + "'}";
    }
}
