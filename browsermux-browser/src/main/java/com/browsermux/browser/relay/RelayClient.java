package com.browsermux.browser.relay;

import com.browsermux.browser.transport.ProtocolMessage;
import com.browsermux.common.infra.ErrorUtils;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * JSON-RPC client for a relay endpoint.
 *
 * <p>Usage:
 * <pre>
 *   try (RelayClient client = RelayClient.connect(server.wsEndpoint())) {
 *       JsonNode ctx = client.send("Playwright.createContext", null);
 *       client.onEvent(event -> System.out.println(event.method()));
 *   }
 * </pre>
 */
@Slf4j
public class RelayClient implements AutoCloseable {

    private static final long DEFAULT_COMMAND_TIMEOUT_MS = 30_000;
    private static final long HANDSHAKE_TIMEOUT_MS = 5_000;

    private final OkHttpClient client;
    private final AtomicInteger nextId = new AtomicInteger(1);
    private final ConcurrentHashMap<Integer, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final List<Consumer<ProtocolMessage>> eventListeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<CloseInfo> closed = new CompletableFuture<>();
    private final long commandTimeoutMs;
    private volatile WebSocket socket;

    /** How the relay ended the connection. */
    public record CloseInfo(int code, String reason) {
    }

    private RelayClient(long commandTimeoutMs) {
        this.commandTimeoutMs = commandTimeoutMs;
        this.client = new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS) // WebSocket: no read timeout
                .build();
    }

    public static RelayClient connect(String wsEndpoint) throws RelayException {
        return connect(wsEndpoint, DEFAULT_COMMAND_TIMEOUT_MS);
    }

    /**
     * Open a connection and wait for the handshake.
     */
    public static RelayClient connect(String wsEndpoint, long commandTimeoutMs) throws RelayException {
        RelayClient relayClient = new RelayClient(commandTimeoutMs);
        relayClient.open(wsEndpoint);
        return relayClient;
    }

    private void open(String wsEndpoint) throws RelayException {
        CountDownLatch openLatch = new CountDownLatch(1);
        CompletableFuture<Void> errorFuture = new CompletableFuture<>();

        WebSocketListener listener = new WebSocketListener() {
            @Override
            public void onOpen(WebSocket ws, Response response) {
                socket = ws;
                openLatch.countDown();
            }

            @Override
            public void onMessage(WebSocket ws, String text) {
                handleMessage(text);
            }

            @Override
            public void onClosing(WebSocket ws, int code, String reason) {
                failPending(new RelayException("Relay socket closing: " + reason));
                closed.complete(new CloseInfo(code, reason));
                ws.close(1000, null);
            }

            @Override
            public void onClosed(WebSocket ws, int code, String reason) {
                failPending(new RelayException("Relay socket closed: " + reason));
                closed.complete(new CloseInfo(code, reason));
            }

            @Override
            public void onFailure(WebSocket ws, Throwable t, Response response) {
                openLatch.countDown();
                errorFuture.completeExceptionally(t);
                failPending(new RelayException("Relay socket failed: " + ErrorUtils.formatErrorMessage(t)));
                int code = response != null ? response.code() : -1;
                closed.complete(new CloseInfo(code, ErrorUtils.formatErrorMessage(t)));
            }
        };

        WebSocket ws = client.newWebSocket(new Request.Builder().url(wsEndpoint).build(), listener);
        try {
            if (!openLatch.await(HANDSHAKE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                ws.cancel();
                shutdownClient();
                throw new RelayException("Relay WebSocket handshake timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ws.cancel();
            shutdownClient();
            throw new RelayException("Relay connection interrupted");
        }
        if (errorFuture.isCompletedExceptionally() || socket == null) {
            shutdownClient();
            throw new RelayException("Relay connection failed: "
                    + ErrorUtils.formatErrorMessage(errorFuture.handle((v, t) -> t).join()));
        }
    }

    private void handleMessage(String text) {
        ProtocolMessage message;
        try {
            message = ProtocolMessage.parse(text);
        } catch (Exception e) {
            log.debug("Relay parse error: {}", e.getMessage());
            return;
        }
        Integer id = message.id();
        if (id == null) {
            for (Consumer<ProtocolMessage> listener : eventListeners) {
                listener.accept(message);
            }
            return;
        }
        CompletableFuture<JsonNode> future = pending.remove(id);
        if (future == null) {
            return;
        }
        if (message.isError()) {
            JsonNode error = message.error();
            String errorText = error.has("message") ? error.get("message").asText() : error.toString();
            future.completeExceptionally(new RelayException(errorText));
        } else {
            future.complete(message.result() != null ? message.result() : ProtocolMessage.newObject());
        }
    }

    // ==================== Commands ====================

    /**
     * Send a request and wait for its result.
     */
    public JsonNode send(String method, JsonNode params) throws RelayException {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = dispatch(id, method, params);
        try {
            return future.get(commandTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.remove(id);
            throw new RelayException("Relay command timeout: " + method);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RelayException re) throw re;
            throw new RelayException("Relay command failed: " + ErrorUtils.formatErrorMessage(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException("Relay command interrupted: " + method);
        }
    }

    /**
     * Send a request; the future completes with the result or a {@link RelayException}.
     */
    public CompletableFuture<JsonNode> sendAsync(String method, JsonNode params) {
        return dispatch(nextId.getAndIncrement(), method, params);
    }

    private CompletableFuture<JsonNode> dispatch(int id, String method, JsonNode params) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pending.put(id, future);
        if (!socket.send(ProtocolMessage.request(id, method, params).toJson())) {
            pending.remove(id);
            future.completeExceptionally(new RelayException("Failed to send relay command: " + method));
        }
        return future;
    }

    /**
     * Send a raw text frame, bypassing request bookkeeping.
     */
    public boolean sendRaw(String text) {
        return socket.send(text);
    }

    /**
     * Register a listener for notifications (messages without an id).
     */
    public void onEvent(Consumer<ProtocolMessage> listener) {
        eventListeners.add(listener);
    }

    /**
     * Completes when the connection is closed, by either side.
     */
    public CompletableFuture<CloseInfo> closeFuture() {
        return closed;
    }

    int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        try {
            socket.close(1000, "done");
        } catch (IllegalArgumentException e) {
            log.debug("Relay close failed: {}", e.getMessage());
        }
        shutdownClient();
    }

    private void failPending(RelayException error) {
        for (CompletableFuture<JsonNode> f : pending.values()) {
            f.completeExceptionally(error);
        }
        pending.clear();
    }

    private void shutdownClient() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    /**
     * Relay operation exception.
     */
    public static class RelayException extends Exception {
        public RelayException(String message) {
            super(message);
        }

        public RelayException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
