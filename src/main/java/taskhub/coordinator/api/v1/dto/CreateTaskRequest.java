package taskhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import taskhub.coordinator.service.CreateTaskCommand;

/**
 * Request DTO for creating a new task.
 * POST /api/v1/task
 * <p>
 * {@code input} may be a JSON string or any structured JSON value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateTaskRequest(
        @JsonProperty("collaboration_id") Long collaborationId,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("image") String image,
        @JsonProperty("input") JsonNode input) {

    public CreateTaskCommand toCommand() {
        return new CreateTaskCommand(collaborationId, name, description, image, input);
    }
}
