package ticketsync.server.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.hub.BroadcastHub;
import ticketsync.server.hub.ClientMessage;

/**
 * Connects one WebSocket channel to the broadcast hub. One instance per channel.
 */
public class WebSocketFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    private final BroadcastHub hub;
    private ChannelSubscriber subscriber;

    public WebSocketFrameHandler(BroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            subscriber = new ChannelSubscriber(ctx.channel());
            hub.connect(subscriber);
            log.info("Client connected: {}", subscriber.id());
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        if (subscriber == null) {
            return;
        }
        String text = frame.text();
        try {
            ClientMessage message = RouterHandler.mapper().readValue(text, ClientMessage.class);
            if (!message.applyTo(hub, subscriber.id())) {
                log.debug("Ignoring message from {}: {}", subscriber.id(), text);
            }
        } catch (JsonProcessingException e) {
            log.warn("Malformed message from {}: {}", subscriber.id(), e.getOriginalMessage());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (subscriber != null) {
            hub.disconnect(subscriber.id());
            log.info("Client disconnected: {}", subscriber.id());
            subscriber = null;
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("WebSocket error: {}", cause.getMessage());
        ctx.close();
    }
}
