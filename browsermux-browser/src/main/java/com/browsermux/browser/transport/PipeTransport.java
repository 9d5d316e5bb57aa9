package com.browsermux.browser.transport;

import com.browsermux.common.infra.ErrorUtils;
import com.browsermux.common.logging.SubsystemLogger;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Message channel over the browser's pipe pair. Each message is one JSON
 * object followed by a single NUL byte.
 *
 * <p>A dedicated reader thread reassembles frames and hands them to the
 * listener in arrival order. Writes go through a single writer thread so
 * {@link #send(ProtocolMessage)} never blocks the caller on a slow reader.
 */
public class PipeTransport implements MessageTransport {

    private static final SubsystemLogger log = SubsystemLogger.create("transport/pipe");
    private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();
    private static final int READ_BUFFER_SIZE = 8192;

    private final InputStream in;
    private final OutputStream out;
    private final int maxFrameBytes;
    private final ExecutorService writer;
    private final Thread reader;
    /** Used only by the reader thread. */
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object deliveryLock = new Object();
    private volatile TransportListener listener;

    /**
     * @param in            bytes written by the browser
     * @param out           bytes read by the browser
     * @param maxFrameBytes largest accepted inbound frame, excluding the delimiter
     */
    public PipeTransport(InputStream in, OutputStream out, int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive: " + maxFrameBytes);
        }
        this.in = in;
        this.out = out;
        this.maxFrameBytes = maxFrameBytes;
        int n = INSTANCE_COUNTER.incrementAndGet();
        this.writer = Executors.newSingleThreadExecutor(daemonThreadFactory("browsermux-pipe-writer-" + n));
        this.reader = daemonThreadFactory("browsermux-pipe-reader-" + n).newThread(this::readLoop);
    }

    @Override
    public void start(TransportListener listener) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Transport already started");
        }
        this.listener = listener;
        reader.start();
    }

    @Override
    public void send(ProtocolMessage message) {
        if (closed.get()) {
            log.debug("dropping message sent after close", Map.of("method", String.valueOf(message.method())));
            return;
        }
        byte[] json = message.toJson().getBytes(StandardCharsets.UTF_8);
        try {
            writer.execute(() -> write(json));
        } catch (RejectedExecutionException e) {
            log.debug("dropping message, writer already stopped");
        }
    }

    @Override
    public void close() {
        closeWith(null);
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    // ==================== Writing ====================

    private void write(byte[] json) {
        if (closed.get()) {
            return;
        }
        try {
            out.write(json);
            out.write(0);
            out.flush();
            if (log.isTraceEnabled()) {
                log.trace("SEND ► " + new String(json, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            closeWith(e);
        }
    }

    // ==================== Reading ====================

    private void readLoop() {
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        byte[] buffer = new byte[READ_BUFFER_SIZE];
        try {
            int n;
            while ((n = in.read(buffer)) != -1) {
                int start = 0;
                for (int i = 0; i < n; i++) {
                    if (buffer[i] != 0) {
                        continue;
                    }
                    appendChecked(pending, buffer, start, i - start);
                    deliver(decode(pending));
                    pending.reset();
                    start = i + 1;
                    if (closed.get()) {
                        return;
                    }
                }
                appendChecked(pending, buffer, start, n - start);
            }
            if (pending.size() > 0) {
                log.debug("discarding partial frame at end of stream", Map.of("bytes", pending.size()));
            }
            closeWith(null);
        } catch (TransportFramingException e) {
            log.error("fatal framing error: " + e.getMessage(), Map.of("kind", e.getKind()));
            closeWith(e);
        } catch (IOException e) {
            if (!closed.get()) {
                log.debug("pipe read failed: " + ErrorUtils.formatErrorMessage(e));
            }
            closeWith(e);
        }
    }

    private void appendChecked(ByteArrayOutputStream pending, byte[] buffer, int offset, int length) {
        if (length <= 0) {
            return;
        }
        if ((long) pending.size() + length > maxFrameBytes) {
            throw new TransportFramingException(TransportFramingException.Kind.FRAME_TOO_LARGE,
                    "Inbound frame exceeds " + maxFrameBytes + " bytes");
        }
        pending.write(buffer, offset, length);
    }

    private String decode(ByteArrayOutputStream pending) {
        try {
            return decoder.decode(ByteBuffer.wrap(pending.toByteArray())).toString();
        } catch (CharacterCodingException e) {
            throw new TransportFramingException(TransportFramingException.Kind.INVALID_UTF8,
                    "Frame is not valid UTF-8", e);
        }
    }

    private void deliver(String frame) {
        if (log.isTraceEnabled()) {
            log.trace("◀ RECV " + frame);
        }
        ProtocolMessage message;
        try {
            message = ProtocolMessage.parse(frame);
        } catch (JsonProcessingException e) {
            throw new TransportFramingException(TransportFramingException.Kind.MALFORMED_JSON,
                    "Malformed JSON frame: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new TransportFramingException(TransportFramingException.Kind.NOT_AN_OBJECT,
                    "Frame is not a JSON object", e);
        }
        synchronized (deliveryLock) {
            if (closed.get()) {
                return;
            }
            try {
                listener.onMessage(message);
            } catch (RuntimeException e) {
                log.error("transport listener failed", e);
            }
        }
    }

    // ==================== Closing ====================

    private void closeWith(Throwable cause) {
        synchronized (deliveryLock) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
        }
        writer.shutdown();
        try {
            out.close();
        } catch (IOException e) {
            log.debug("closing pipe output failed: " + ErrorUtils.formatErrorMessage(e));
        }
        log.debug("pipe transport closed",
                Map.of("cause", cause != null ? ErrorUtils.formatErrorMessage(cause) : "end of stream"));
        TransportListener current = listener;
        if (current == null) {
            return;
        }
        try {
            current.onClose(cause);
        } catch (RuntimeException e) {
            log.error("transport close listener failed", e);
        }
    }

    private static ThreadFactory daemonThreadFactory(String name) {
        return runnable -> {
            Thread t = new Thread(runnable, name);
            t.setDaemon(true);
            return t;
        };
    }
}
