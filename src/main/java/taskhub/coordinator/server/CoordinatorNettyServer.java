package taskhub.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import taskhub.coordinator.config.CoordinatorConfig;
import taskhub.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Netty server hosting the REST API and the WebSocket notification endpoint
 * on one port.
 */
public final class CoordinatorNettyServer {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private CoordinatorNettyServer() {
    }

    /** HTTP + WebSocket pipeline */
    static ChannelHandler pipelineInitializer(Dependencies deps) {
        CoordinatorConfig config = deps.config();
        RouterHandler router = deps.routerHandler();
        RoomSubscriptionHandler subscriptions = new RoomSubscriptionHandler(deps.roomRegistry());
        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath(config.notificationPath())
                .checkStartsWith(true)
                .build();

        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(config.maxContentLength()));
                // upgrades requests on the notification path, passes the rest on
                p.addLast(new WebSocketServerProtocolHandler(wsConfig));
                p.addLast(subscriptions);
                p.addLast(router);
            }
        };
    }

    /**
     * Start serving on {@code deps.config().serverPort()}; port 0 picks a free port.
     *
     * @return true if the server is running after the call
     */
    public static synchronized boolean start(Dependencies deps) {
        if (running)
            return true;
        CoordinatorConfig config = deps.config();
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps));

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            dependencies = deps;
            running = true;
            log.info("Coordinator started on {}:{} (notifications at {})",
                    config.serverHost(), boundPort(), config.notificationPath());
            return true;
        } catch (Exception e) {
            log.error("Start error: {}", e.getMessage(), e);
            shutdownGroups();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running)
            return;
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
            dependencies.roomRegistry().closeAll();
        } finally {
            shutdownGroups();
            dependencies = null;
            running = false;
            log.info("Coordinator stopped");
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /** Port actually bound, or -1 when not running. */
    public static int boundPort() {
        Channel ch = serverChannel;
        if (ch == null || !(ch.localAddress() instanceof InetSocketAddress address)) {
            return -1;
        }
        return address.getPort();
    }

    private static void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }
}
