package taskhub.coordinator.model;

/**
 * Worker endpoint belonging to a collaboration.
 */
public record Node(long id, String name, long collaborationId) {
}
