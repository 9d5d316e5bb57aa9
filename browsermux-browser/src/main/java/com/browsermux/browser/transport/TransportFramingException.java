package com.browsermux.browser.transport;

import lombok.Getter;

/**
 * Raised when the byte stream from the browser cannot be split into
 * protocol messages. Always fatal for the transport.
 */
@Getter
public class TransportFramingException extends RuntimeException {

    public enum Kind {
        INVALID_UTF8,
        MALFORMED_JSON,
        FRAME_TOO_LARGE,
        NOT_AN_OBJECT
    }

    private final Kind kind;

    public TransportFramingException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransportFramingException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
