package taskhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskhub.coordinator.model.TaskResult;

import java.time.Instant;

/**
 * Response DTO for one node's result slot.
 * GET /api/v1/task/{id}/result, and embedded with {@code include=results}.
 */
public record TaskResultResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("node_id") long nodeId,
        @JsonProperty("result") String result,
        @JsonProperty("log") String log,
        @JsonProperty("assigned_at") Instant assignedAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt) {

    public static TaskResultResponse from(TaskResult result) {
        return new TaskResultResponse(
                result.id(),
                result.taskId(),
                result.nodeId(),
                result.result(),
                result.log(),
                result.assignedAt(),
                result.startedAt(),
                result.finishedAt());
    }
}
