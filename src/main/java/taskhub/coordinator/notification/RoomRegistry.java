package taskhub.coordinator.notification;

import io.netty.channel.Channel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.ChannelGroupFuture;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named groups of subscriber channels.
 * Closed channels leave their groups automatically.
 */
public final class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final Map<String, ChannelGroup> rooms = new ConcurrentHashMap<>();

    public void join(String room, Channel channel) {
        rooms.computeIfAbsent(room, r -> new DefaultChannelGroup(r, GlobalEventExecutor.INSTANCE))
                .add(channel);
        log.debug("Channel {} joined {}", channel.id().asShortText(), room);
    }

    public boolean leave(String room, Channel channel) {
        ChannelGroup group = rooms.get(room);
        boolean removed = group != null && group.remove(channel);
        if (removed) {
            log.debug("Channel {} left {}", channel.id().asShortText(), room);
        }
        return removed;
    }

    /**
     * Write a text frame to every channel in the room.
     *
     * @return number of channels the frame was written to
     */
    public int broadcast(String room, String text) {
        ChannelGroup group = rooms.get(room);
        if (group == null || group.isEmpty()) {
            return 0;
        }
        int recipients = group.size();
        ChannelGroupFuture future = group.writeAndFlush(new TextWebSocketFrame(text));
        future.addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("Broadcast to {} partially failed: {}", room, f.cause() != null ? f.cause().getMessage() : "unknown");
            }
        });
        return recipients;
    }

    public int size(String room) {
        ChannelGroup group = rooms.get(room);
        return group == null ? 0 : group.size();
    }

    public Set<String> rooms() {
        return Set.copyOf(rooms.keySet());
    }

    /** Close every subscriber channel. */
    public void closeAll() {
        rooms.values().forEach(group -> group.close().awaitUninterruptibly());
        rooms.clear();
    }
}
