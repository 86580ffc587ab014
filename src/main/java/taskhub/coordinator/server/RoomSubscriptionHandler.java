package taskhub.coordinator.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler.HandshakeComplete;
import taskhub.coordinator.model.Collaboration;
import taskhub.coordinator.notification.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Manages which rooms a WebSocket subscriber listens on.
 *
 * Rooms can be joined at handshake with {@code ?collaboration_id=<id>}
 * (repeatable) or later with a text frame
 * {@code {"action":"join","room":"collaboration_<id>"}}; {@code "leave"}
 * works the same way. Each join/leave is acknowledged with
 * {@code {"event":"joined"|"left","data":"<room>"}}.
 */
@Sharable
public class RoomSubscriptionHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(RoomSubscriptionHandler.class);
    private static final Pattern ROOM_PATTERN = Pattern.compile("^collaboration_\\d+$");

    private final RoomRegistry rooms;

    public RoomSubscriptionHandler(RoomRegistry rooms) {
        this.rooms = rooms;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof HandshakeComplete handshake) {
            joinFromQuery(ctx.channel(), handshake.requestUri());
            log.debug("Subscriber connected: {}", ctx.channel().remoteAddress());
        }
        super.userEventTriggered(ctx, evt);
    }

    void joinFromQuery(Channel channel, String requestUri) {
        List<String> ids = new QueryStringDecoder(requestUri).parameters().get("collaboration_id");
        if (ids == null) {
            return;
        }
        for (String id : ids) {
            try {
                rooms.join(Collaboration.roomFor(Long.parseLong(id)), channel);
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid collaboration_id '{}' from {}", id, channel.remoteAddress());
            }
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) throws Exception {
        JsonNode message;
        try {
            message = RouterHandler.mapper().readTree(frame.text());
        } catch (Exception e) {
            reply(ctx, "error", "malformed message");
            return;
        }

        String action = message.path("action").asText("");
        String room = message.path("room").asText("");
        if (!ROOM_PATTERN.matcher(room).matches()) {
            reply(ctx, "error", "unknown room '" + room + "'");
            return;
        }

        switch (action) {
            case "join" -> {
                rooms.join(room, ctx.channel());
                reply(ctx, "joined", room);
            }
            case "leave" -> {
                rooms.leave(room, ctx.channel());
                reply(ctx, "left", room);
            }
            default -> reply(ctx, "error", "unknown action '" + action + "'");
        }
    }

    private void reply(ChannelHandlerContext ctx, String event, String data) throws Exception {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", event);
        envelope.put("data", data);
        ctx.writeAndFlush(new TextWebSocketFrame(RouterHandler.mapper().writeValueAsString(envelope)));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Subscriber channel error: {}", cause.getMessage());
        ctx.close();
    }
}
