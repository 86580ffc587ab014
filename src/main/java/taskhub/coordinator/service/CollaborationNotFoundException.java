package taskhub.coordinator.service;

public class CollaborationNotFoundException extends NotFoundException {

    private final long collaborationId;

    public CollaborationNotFoundException(long collaborationId) {
        super("collaboration id=" + collaborationId + " not found");
        this.collaborationId = collaborationId;
    }

    public long collaborationId() {
        return collaborationId;
    }
}
