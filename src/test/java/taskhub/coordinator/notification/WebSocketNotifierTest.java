package taskhub.coordinator.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketNotifierTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private RoomRegistry rooms;
    private WebSocketNotifier notifier;

    @BeforeEach
    void setUp() {
        rooms = new RoomRegistry();
        notifier = new WebSocketNotifier(rooms, mapper);
    }

    @Test
    void deliversOnlyToSubscribersOfTheRoom() throws Exception {
        EmbeddedChannel inRoom = new EmbeddedChannel();
        EmbeddedChannel otherRoom = new EmbeddedChannel();
        rooms.join("collaboration_1", inRoom);
        rooms.join("collaboration_2", otherRoom);

        notifier.emit(Notifier.NEW_TASK, 42L, "collaboration_1");

        TextWebSocketFrame frame = inRoom.readOutbound();
        assertNotNull(frame);
        JsonNode message = mapper.readTree(frame.text());
        frame.release();
        assertEquals("new_task", message.get("event").asText());
        assertEquals(42L, message.get("data").asLong());

        assertNull(inRoom.readOutbound(), "exactly one frame per emit");
        assertNull(otherRoom.readOutbound());
    }

    @Test
    void emitToEmptyRoomIsANoOp() {
        assertDoesNotThrow(() -> notifier.emit(Notifier.NEW_TASK, 1L, "collaboration_99"));
        assertEquals(0, rooms.size("collaboration_99"));
    }

    @Test
    void closedChannelsLeaveTheirRooms() {
        EmbeddedChannel channel = new EmbeddedChannel();
        rooms.join("collaboration_3", channel);
        assertEquals(1, rooms.size("collaboration_3"));

        channel.close();

        assertEquals(0, rooms.size("collaboration_3"));
    }

    @Test
    void leaveStopsDelivery() {
        EmbeddedChannel channel = new EmbeddedChannel();
        rooms.join("collaboration_4", channel);

        assertTrue(rooms.leave("collaboration_4", channel));
        assertFalse(rooms.leave("collaboration_4", channel));

        notifier.emit(Notifier.NEW_TASK, 5L, "collaboration_4");
        assertNull(channel.readOutbound());
    }
}
