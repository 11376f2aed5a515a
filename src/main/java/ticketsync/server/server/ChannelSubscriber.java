package ticketsync.server.server;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import ticketsync.server.hub.Subscriber;

/**
 * Broadcast subscriber backed by a WebSocket channel.
 */
final class ChannelSubscriber implements Subscriber {

    private final Channel channel;
    private final String id;

    ChannelSubscriber(Channel channel) {
        this.channel = channel;
        this.id = "ws-" + channel.id().asShortText();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String message) {
        channel.writeAndFlush(new TextWebSocketFrame(message));
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }
}
