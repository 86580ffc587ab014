package taskhub.coordinator.notification;

/**
 * Outbound push channel scoped by room.
 * <p>
 * Delivery is best effort: implementations must not block on slow receivers,
 * and callers treat any {@link RuntimeException} thrown here as a failed
 * notification, never as a failed operation.
 */
@FunctionalInterface
public interface Notifier {

    /** Event sent to a collaboration's room when a task was created for it. */
    String NEW_TASK = "new_task";

    /**
     * Broadcast an event to every subscriber of a room.
     *
     * @param event   event name, e.g. {@link #NEW_TASK}
     * @param payload event data, serialized as JSON
     * @param room    room to deliver to, e.g. {@code collaboration_7}
     */
    void emit(String event, Object payload, String room);
}
