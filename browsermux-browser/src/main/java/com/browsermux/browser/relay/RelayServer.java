package com.browsermux.browser.relay;

import com.browsermux.browser.transport.MessageTransport;
import com.browsermux.browser.transport.ProtocolMessage;
import com.browsermux.browser.transport.TransportListener;
import com.browsermux.common.infra.ErrorUtils;
import com.browsermux.common.logging.SubsystemLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.netty.util.CharsetUtil;
import lombok.Getter;

import java.net.InetSocketAddress;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * WebSocket listener that lets external controllers share one browser
 * transport.
 *
 * <p>Connections are accepted only on {@code /<token>}, where the token is
 * random per server. All channels and the {@link SessionRouter} run on a
 * single event loop; messages from the transport are handed to that loop
 * in arrival order.
 */
public class RelayServer implements TransportListener {

    private static final SubsystemLogger log = SubsystemLogger.create("relay");
    private static final int HANDSHAKE_MAX_CONTENT = 65536;

    @Getter private final String host;
    @Getter private final String token;
    private final int requestedPort;
    private final int maxFrameBytes;
    private final MessageTransport transport;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventLoop reactor;
    private SessionRouter router;
    private Channel serverChannel;
    @Getter private int port;
    @Getter private String wsEndpoint;

    public RelayServer(String host, int port, int maxFrameBytes, MessageTransport transport) {
        this.host = host;
        this.requestedPort = port;
        this.maxFrameBytes = maxFrameBytes;
        this.transport = transport;

        byte[] tokenBytes = new byte[16];
        new SecureRandom().nextBytes(tokenBytes);
        this.token = HexFormat.of().formatHex(tokenBytes);
    }

    /**
     * Bind the listener. The endpoint is available once this returns.
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(1);
        reactor = workerGroup.next();
        router = new SessionRouter(transport);

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(HANDSHAKE_MAX_CONTENT),
                                new WebSocketFrameAggregator(maxFrameBytes),
                                new RelayHandler());
                    }
                });

        serverChannel = b.bind(host, requestedPort).sync().channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        wsEndpoint = "ws://" + host + ":" + port + "/" + token;
        log.info("relay listening", Map.of("endpoint", wsEndpoint));
    }

    /**
     * Close every session, stop listening and release the event loops.
     */
    public void stop() {
        if (reactor != null) {
            runOnReactor(() -> shutdownRouting(null));
        }
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
    }

    // ==================== Transport events ====================

    @Override
    public void onMessage(ProtocolMessage message) {
        runOnReactor(() -> router.onTransportMessage(message));
    }

    @Override
    public void onClose(Throwable cause) {
        runOnReactor(() -> shutdownRouting(cause));
    }

    private void shutdownRouting(Throwable cause) {
        router.onTransportClose(cause);
        if (serverChannel != null && serverChannel.isOpen()) {
            serverChannel.close();
        }
    }

    /**
     * Snapshot of the routing tables, taken on the event loop while it runs.
     */
    public SessionRouter.PendingState pendingState() {
        if (reactor == null || reactor.inEventLoop() || reactor.isShuttingDown()) {
            return router.pendingState();
        }
        try {
            return reactor.submit(router::pendingState).syncUninterruptibly().getNow();
        } catch (RejectedExecutionException e) {
            return router.pendingState();
        }
    }

    public boolean isListening() {
        return serverChannel != null && serverChannel.isOpen();
    }

    private void runOnReactor(Runnable task) {
        try {
            reactor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("relay event loop already stopped");
        }
    }

    // ==================== Relay Handler ====================

    private class RelayHandler extends SimpleChannelInboundHandler<Object> {

        private WebSocketServerHandshaker handshaker;
        private WebSocketSession session;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof FullHttpRequest request) {
                handleHttpRequest(ctx, request);
            } else if (msg instanceof WebSocketFrame frame) {
                handleWebSocketFrame(ctx, frame);
            }
        }

        private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest req) {
            String path = new QueryStringDecoder(req.uri()).path();
            boolean upgrade = req.headers().contains(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true);
            if (!upgrade || !path.equals("/" + token)) {
                log.debug("rejecting connection", Map.of("path", path, "upgrade", upgrade));
                sendResponse(ctx, HttpResponseStatus.NOT_FOUND, "Not Found");
                return;
            }

            WebSocketServerHandshakerFactory wsFactory = new WebSocketServerHandshakerFactory(
                    "ws://" + req.headers().get(HttpHeaderNames.HOST) + path, null, true, maxFrameBytes);
            handshaker = wsFactory.newHandshaker(req);
            if (handshaker == null) {
                WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
                return;
            }
            session = new WebSocketSession(ctx.channel());
            handshaker.handshake(ctx.channel(), req).addListener(future -> {
                if (!future.isSuccess()) {
                    log.debug("handshake failed: " + ErrorUtils.formatErrorMessage(future.cause()));
                    ctx.close();
                }
            });
            router.onConnect(session);
        }

        private void handleWebSocketFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (session == null) {
                ctx.close();
                return;
            }
            if (frame instanceof CloseWebSocketFrame) {
                session.markClosing();
                handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
                return;
            }
            if (frame instanceof PingWebSocketFrame) {
                ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
                return;
            }
            if (frame instanceof BinaryWebSocketFrame) {
                log.warn("closing session that sent a binary frame", Map.of("session", session.id()));
                session.close(WebSocketCloseStatus.INVALID_MESSAGE_TYPE.code(), "Binary frames are not supported");
                return;
            }
            if (!(frame instanceof TextWebSocketFrame textFrame)) {
                return;
            }

            ProtocolMessage message;
            try {
                message = ProtocolMessage.parse(textFrame.text());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("dropping invalid session message", Map.of(
                        "session", session.id(), "error", ErrorUtils.formatErrorMessage(e)));
                return;
            }
            router.onSessionMessage(session, message);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            if (session != null) {
                session.markClosing();
                router.onDisconnect(session);
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("relay handler error: " + ErrorUtils.formatErrorMessage(cause));
            ctx.close();
        }
    }

    // ==================== Helpers ====================

    private static void sendResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String body) {
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(body, CharsetUtil.UTF_8));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        resp.headers().set(HttpHeaderNames.CONTENT_LENGTH, resp.content().readableBytes());
        resp.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }
}
