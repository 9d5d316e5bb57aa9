package com.browsermux.browser.transport;

/**
 * A bidirectional message channel to the browser.
 */
public interface MessageTransport {

    /**
     * Begin reading. Must be called once, before any message can arrive.
     */
    void start(TransportListener listener);

    /**
     * Queue one message for writing. Never blocks on the peer; failures
     * surface through {@link TransportListener#onClose(Throwable)}.
     * Messages sent after close are dropped.
     */
    void send(ProtocolMessage message);

    /**
     * Close the write side and stop delivering messages.
     */
    void close();

    boolean isClosed();
}
