package taskhub.coordinator.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Input of the create-task use case.
 *
 * @param collaborationId owning collaboration, null when the request omitted it
 * @param input           free-form payload; text is stored verbatim, any other
 *                        JSON value is stored as its JSON text
 */
public record CreateTaskCommand(
        Long collaborationId,
        String name,
        String description,
        String image,
        JsonNode input) {

    public static CreateTaskCommand of(Long collaborationId, String name) {
        return new CreateTaskCommand(collaborationId, name, null, null, null);
    }
}
