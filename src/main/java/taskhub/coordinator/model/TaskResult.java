package taskhub.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-node slot for the outcome of a task. Created empty at fan-out time;
 * {@code result}, {@code log} and the start/finish timestamps are filled in
 * later by the node.
 */
public final class TaskResult {
    private final Long id;
    private final long taskId;
    private final long nodeId;
    private final String result;
    private final String log;
    private final Instant assignedAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private TaskResult(Builder builder) {
        this.id = builder.id;
        this.taskId = builder.taskId;
        this.nodeId = builder.nodeId;
        this.result = builder.result;
        this.log = builder.log;
        this.assignedAt = builder.assignedAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public Long id() {
        return id;
    }

    public long taskId() {
        return taskId;
    }

    public long nodeId() {
        return nodeId;
    }

    public String result() {
        return result;
    }

    public String log() {
        return log;
    }

    public Instant assignedAt() {
        return assignedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /** True once the node has reported back */
    public boolean isFinished() {
        return finishedAt != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private long taskId;
        private long nodeId;
        private String result;
        private String log;
        private Instant assignedAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder taskId(long taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder nodeId(long nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder log(String log) {
            this.log = log;
            return this;
        }

        public Builder assignedAt(Instant assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public TaskResult build() {
            return new TaskResult(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskResult that))
            return false;
        return taskId == that.taskId &&
                nodeId == that.nodeId &&
                Objects.equals(id, that.id) &&
                Objects.equals(result, that.result) &&
                Objects.equals(log, that.log) &&
                Objects.equals(assignedAt, that.assignedAt) &&
                Objects.equals(startedAt, that.startedAt) &&
                Objects.equals(finishedAt, that.finishedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, taskId, nodeId);
    }

    @Override
    public String toString() {
        return "TaskResult{id=" + id + ", taskId=" + taskId + ", nodeId=" + nodeId +
                ", finished=" + isFinished() + "}";
    }
}
