package ticketsync.server.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.config.ServerConfig;
import ticketsync.server.hub.BroadcastHub;

import java.net.InetSocketAddress;

/**
 * Netty server carrying the REST API and the {@code /ws} broadcast WebSocket on one port.
 *
 * Controllers run on a separate executor group so blocking file access and manual grooming
 * triggers never stall the I/O threads.
 */
public final class TicketSyncServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TicketSyncServer.class);

    public static final String WEBSOCKET_PATH = "/ws";
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final ServerConfig config;
    private final RouterHandler router;
    private final BroadcastHub hub;
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup routerGroup;

    public TicketSyncServer(ServerConfig config, RouterHandler router, BroadcastHub hub) {
        this.config = config;
        this.router = router;
        this.hub = hub;
    }

    ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                clients.add(ch);
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH, null, true));
                p.addLast(new WebSocketFrameHandler(hub));
                p.addLast(routerGroup, "router", router); // REST
            }
        };
    }

    /**
     * Bind and start serving.
     *
     * @throws IllegalStateException if the port cannot be bound
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        routerGroup = new DefaultEventExecutorGroup(8);
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            running = true;
            log.info("Server listening on {}:{} (WebSocket at {})", config.serverHost(), port(), WEBSOCKET_PATH);
        } catch (Exception e) {
            // bind failures surface here as undeclared checked exceptions
            log.error("Could not start server on port {}: {}", config.serverPort(), e.getMessage());
            shutdownGroups();
            throw new IllegalStateException("Could not bind port " + config.serverPort(), e);
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
            clients.close().awaitUninterruptibly();
        } finally {
            shutdownGroups();
            running = false;
            log.info("Server stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** Bound port; differs from the configured one when that was 0 */
    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    private void shutdownGroups() {
        if (routerGroup != null) {
            routerGroup.shutdownGracefully();
            routerGroup = null;
        }
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
