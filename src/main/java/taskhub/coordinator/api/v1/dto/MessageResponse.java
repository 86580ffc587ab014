package taskhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plain acknowledgement, e.g. after a delete.
 */
public record MessageResponse(@JsonProperty("msg") String msg) {
}
