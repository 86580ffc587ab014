package taskhub.coordinator.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notifier that pushes {@code {"event": ..., "data": ...}} text frames to the
 * WebSocket subscribers of a room.
 */
public class WebSocketNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(WebSocketNotifier.class);

    private final RoomRegistry rooms;
    private final ObjectMapper mapper;

    public WebSocketNotifier(RoomRegistry rooms, ObjectMapper mapper) {
        this.rooms = rooms;
        this.mapper = mapper;
    }

    @Override
    public void emit(String event, Object payload, String room) {
        String frame;
        try {
            frame = mapper.writeValueAsString(envelope(event, payload));
        } catch (JsonProcessingException e) {
            throw new NotificationException("Failed to encode '" + event + "' for " + room, e);
        }

        int recipients = rooms.broadcast(room, frame);
        log.debug("Emitted {} to {} ({} subscribers)", event, room, recipients);
    }

    static Map<String, Object> envelope(String event, Object payload) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", event);
        envelope.put("data", payload);
        return envelope;
    }
}
