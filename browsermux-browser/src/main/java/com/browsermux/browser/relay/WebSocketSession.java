package com.browsermux.browser.relay;

import com.browsermux.browser.transport.ProtocolMessage;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ExternalSession} backed by an accepted Netty WebSocket channel.
 * A session that has started closing and one that is closed look the same.
 */
class WebSocketSession implements ExternalSession {

    private static final AtomicLong COUNTER = new AtomicLong();

    private final String id;
    private final Channel channel;
    private volatile boolean closing;

    WebSocketSession(Channel channel) {
        this.channel = channel;
        this.id = "ws-" + COUNTER.incrementAndGet();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isClosing() {
        return closing || !channel.isActive();
    }

    @Override
    public void send(ProtocolMessage message) {
        if (isClosing()) {
            return;
        }
        channel.writeAndFlush(new TextWebSocketFrame(message.toJson()));
    }

    @Override
    public void close(String reason) {
        close(WebSocketCloseStatus.NORMAL_CLOSURE.code(), reason);
    }

    void close(int statusCode, String reason) {
        if (closing) {
            return;
        }
        closing = true;
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame(statusCode, CloseReason.truncate(reason)))
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }

    /** The peer started the closing handshake. */
    void markClosing() {
        closing = true;
    }

    Channel channel() {
        return channel;
    }

    @Override
    public String toString() {
        return "WebSocketSession(" + id + ")";
    }
}
