package taskhub.coordinator.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import taskhub.coordinator.notification.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoomSubscriptionHandlerTest {

    private RoomRegistry rooms;
    private RoomSubscriptionHandler handler;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        rooms = new RoomRegistry();
        handler = new RoomSubscriptionHandler(rooms);
        channel = new EmbeddedChannel(handler);
    }

    private JsonNode readReply() throws Exception {
        TextWebSocketFrame frame = channel.readOutbound();
        assertNotNull(frame, "expected a reply frame");
        try {
            return RouterHandler.mapper().readTree(frame.text());
        } finally {
            frame.release();
        }
    }

    @Test
    void handshakeQueryJoinsRooms() {
        handler.joinFromQuery(channel, "/tasks?collaboration_id=1&collaboration_id=2&collaboration_id=oops");

        assertEquals(1, rooms.size("collaboration_1"));
        assertEquals(1, rooms.size("collaboration_2"));
    }

    @Test
    void joinAndLeaveFramesAreAcknowledged() throws Exception {
        channel.writeInbound(new TextWebSocketFrame("{\"action\":\"join\",\"room\":\"collaboration_7\"}"));

        JsonNode joined = readReply();
        assertEquals("joined", joined.get("event").asText());
        assertEquals("collaboration_7", joined.get("data").asText());
        assertEquals(1, rooms.size("collaboration_7"));

        channel.writeInbound(new TextWebSocketFrame("{\"action\":\"leave\",\"room\":\"collaboration_7\"}"));

        assertEquals("left", readReply().get("event").asText());
        assertEquals(0, rooms.size("collaboration_7"));
    }

    @Test
    void rejectsUnknownRoomsAndActions() throws Exception {
        channel.writeInbound(new TextWebSocketFrame("{\"action\":\"join\",\"room\":\"admins\"}"));
        assertEquals("error", readReply().get("event").asText());

        channel.writeInbound(new TextWebSocketFrame("{\"action\":\"shout\",\"room\":\"collaboration_1\"}"));
        assertEquals("error", readReply().get("event").asText());

        channel.writeInbound(new TextWebSocketFrame("not json"));
        assertEquals("error", readReply().get("event").asText());

        assertTrue(rooms.rooms().isEmpty());
    }
}
