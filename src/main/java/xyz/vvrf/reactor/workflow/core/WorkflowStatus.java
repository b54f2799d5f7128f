package xyz.vvrf.reactor.workflow.core;

/**
 * 工作流执行状态。
 * <p>
 * 合法转换: PENDING → RUNNING → {COMPLETED, FAILED, CANCELLED}; RUNNING ⇄ PAUSED (仅外部暂停/恢复)。
 * 终止状态之后不接受任何转换。
 */
public enum WorkflowStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    PAUSED("paused");

    private final String value;

    WorkflowStatus(String value) {
        this.value = value;
    }

    /**
     * 小写的外部表示，用于日志、指标标签和 JSON 快照。
     */
    public String getValue() {
        return value;
    }

    /**
     * @return 如果是 COMPLETED / FAILED / CANCELLED 之一则为 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @Override
    public String toString() {
        return value;
    }
}
