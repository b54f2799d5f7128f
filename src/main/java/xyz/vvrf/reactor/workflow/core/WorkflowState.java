package xyz.vvrf.reactor.workflow.core;

import xyz.vvrf.reactor.workflow.util.DataCopies;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 单次工作流执行的可变状态记录。
 * <p>
 * 单写者: 只有驱动该执行的循环会修改它，写操作由执行器在锁内完成；
 * 其他线程只能通过 {@link #deepCopy()} 得到的快照读取。
 * 节点拿到的是活动状态，但所有 getter 返回只读视图，节点的修改必须通过返回的 {@link NodeOutput} 表达。
 */
public class WorkflowState {

    private final String id;
    private final String workflowId;
    private volatile WorkflowStatus status;
    private String currentNode;
    private final Map<String, Object> data;
    private final List<Message> messages;
    private final List<NodeExecution> history;
    private final Instant createdAt;
    private Instant updatedAt;
    private WorkflowError error;
    private final Map<String, Object> metadata;

    public WorkflowState(String id, String workflowId) {
        this.id = Objects.requireNonNull(id, "执行 ID 不能为空");
        this.workflowId = Objects.requireNonNull(workflowId, "工作流 ID 不能为空");
        this.status = WorkflowStatus.PENDING;
        this.currentNode = "";
        this.data = new LinkedHashMap<>();
        this.messages = new ArrayList<>();
        this.history = new ArrayList<>();
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
        this.metadata = new LinkedHashMap<>();
    }

    // 深拷贝专用
    private WorkflowState(WorkflowState source) {
        this.id = source.id;
        this.workflowId = source.workflowId;
        this.status = source.status;
        this.currentNode = source.currentNode;
        this.data = DataCopies.deepCopy(source.data);
        this.messages = new ArrayList<>(source.messages);
        this.history = new ArrayList<>(source.history);
        this.createdAt = source.createdAt;
        this.updatedAt = source.updatedAt;
        this.error = source.error;
        this.metadata = DataCopies.deepCopy(source.metadata);
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    /**
     * @return 当前节点 ID；空字符串表示已到达终点
     */
    public String getCurrentNode() {
        return currentNode;
    }

    public boolean isAtTerminalNode() {
        return currentNode == null || currentNode.isEmpty();
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    /**
     * 读取单个数据值，不存在时返回 null。
     */
    public Object get(String key) {
        return data.get(key);
    }

    public boolean has(String key) {
        return data.containsKey(key);
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<NodeExecution> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Optional<WorkflowError> getError() {
        return Optional.ofNullable(error);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    // --- 以下修改方法仅供执行引擎使用 ---

    public void setStatus(WorkflowStatus status) {
        this.status = Objects.requireNonNull(status, "状态不能为空");
        touch();
    }

    public void setCurrentNode(String nodeId) {
        this.currentNode = (nodeId != null) ? nodeId : "";
        touch();
    }

    public void putData(String key, Object value) {
        data.put(key, value);
        touch();
    }

    /**
     * 合并数据，同名键后写覆盖。
     */
    public void mergeData(Map<String, ?> values) {
        if (values != null && !values.isEmpty()) {
            data.putAll(values);
            touch();
        }
    }

    public void appendMessages(List<Message> values) {
        if (values != null && !values.isEmpty()) {
            messages.addAll(values);
            touch();
        }
    }

    public void appendHistory(NodeExecution execution) {
        history.add(Objects.requireNonNull(execution, "NodeExecution 不能为空"));
        touch();
    }

    public void setError(WorkflowError error) {
        this.error = error;
        touch();
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
        touch();
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }

    /**
     * 返回完全独立的副本；历史记录和消息本身不可变，只复制列表。
     */
    public WorkflowState deepCopy() {
        return new WorkflowState(this);
    }

    @Override
    public String toString() {
        return "WorkflowState{id='" + id + "', workflowId='" + workflowId
                + "', status=" + status
                + ", currentNode='" + currentNode + "'"
                + ", history=" + history.size()
                + (error != null ? ", error=" + error.getCode() : "")
                + '}';
    }
}
