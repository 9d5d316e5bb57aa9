package com.browsermux.browser.relay;

import com.browsermux.browser.transport.ProtocolMessage;

/**
 * One external controller connection as seen by the {@link SessionRouter}.
 */
public interface ExternalSession {

    /** Stable identifier, used in logs. */
    String id();

    /**
     * True once the session has started closing or is closed. Nothing is
     * delivered to a closing session.
     */
    boolean isClosing();

    /**
     * Deliver a message to the controller. Must not block.
     */
    void send(ProtocolMessage message);

    /**
     * Close the connection with a human-readable reason. Idempotent.
     */
    void close(String reason);
}
