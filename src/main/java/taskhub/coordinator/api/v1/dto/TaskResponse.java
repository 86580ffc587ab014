package taskhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskhub.coordinator.model.Task;
import taskhub.coordinator.model.TaskView;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for task details.
 * {@code results} is only present when the caller asked for them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("collaboration_id") long collaborationId,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("image") String image,
        @JsonProperty("input") String input,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("results") List<TaskResultResponse> results) {

    /** Create response from domain model, without results */
    public static TaskResponse from(Task task) {
        return from(task, null);
    }

    public static TaskResponse from(TaskView view) {
        List<TaskResultResponse> results = view.includesResults()
                ? view.results().stream().map(TaskResultResponse::from).toList()
                : null;
        return from(view.task(), results);
    }

    private static TaskResponse from(Task task, List<TaskResultResponse> results) {
        return new TaskResponse(
                task.id(),
                task.collaborationId(),
                task.name(),
                task.description(),
                task.image(),
                task.input(),
                task.status(),
                task.createdAt(),
                results);
    }
}
