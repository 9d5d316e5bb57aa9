package com.browsermux.browser.transport;

/**
 * Receives what a {@link MessageTransport} reads.
 */
public interface TransportListener {

    /**
     * One complete message, in arrival order. Never called after
     * {@link #onClose(Throwable)}.
     */
    void onMessage(ProtocolMessage message);

    /**
     * Called exactly once when the transport ends.
     *
     * @param cause null for a normal end of stream or a local close,
     *              otherwise the read, write or framing failure
     */
    void onClose(Throwable cause);
}
