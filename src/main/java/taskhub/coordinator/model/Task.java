package taskhub.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a unit of work submitted for a
 * collaboration. Per-node results are separate {@link TaskResult} rows and are
 * only loaded through explicit repository calls.
 */
public final class Task {

    /** Lifecycle tag of a freshly created task. */
    public static final String STATUS_OPEN = "open";

    private final Long id; // null until persisted
    private final long collaborationId;
    private final String name;
    private final String description;
    private final String image;
    private final String input; // JSON text or a raw string
    private final String status;
    private final Instant createdAt;

    private Task(Builder builder) {
        this.id = builder.id;
        this.collaborationId = builder.collaborationId;
        this.name = Objects.requireNonNullElse(builder.name, "");
        this.description = Objects.requireNonNullElse(builder.description, "");
        this.image = Objects.requireNonNullElse(builder.image, "");
        this.input = Objects.requireNonNullElse(builder.input, "");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
    }

    // Getters
    public Long id() {
        return id;
    }

    public long collaborationId() {
        return collaborationId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String image() {
        return image;
    }

    public String input() {
        return input;
    }

    public String status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isPersisted() {
        return id != null;
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .collaborationId(collaborationId)
                .name(name)
                .description(description)
                .image(image)
                .input(input)
                .status(status)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private long collaborationId;
        private String name;
        private String description;
        private String image;
        private String input;
        private String status = STATUS_OPEN;
        private Instant createdAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder collaborationId(long collaborationId) {
            this.collaborationId = collaborationId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return collaborationId == task.collaborationId &&
                Objects.equals(id, task.id) &&
                name.equals(task.name) &&
                description.equals(task.description) &&
                image.equals(task.image) &&
                input.equals(task.input) &&
                status.equals(task.status) &&
                Objects.equals(createdAt, task.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, collaborationId, name, status);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", collaborationId=" + collaborationId +
                ", name='" + name + "', status='" + status + "'}";
    }
}
