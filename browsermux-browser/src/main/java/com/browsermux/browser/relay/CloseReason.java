package com.browsermux.browser.relay;

import java.nio.charset.StandardCharsets;

/**
 * WebSocket close-reason truncation. A close frame carries at most 123
 * bytes of reason text.
 */
public final class CloseReason {

    private CloseReason() {
    }

    /** Maximum bytes kept from a close reason. */
    public static final int CLOSE_REASON_MAX_BYTES = 120;

    public static String truncate(String reason) {
        return truncate(reason, CLOSE_REASON_MAX_BYTES);
    }

    /**
     * Truncate to the given UTF-8 byte budget without splitting a character.
     */
    public static String truncate(String reason, int maxBytes) {
        if (reason == null) {
            return "";
        }
        byte[] encoded = reason.getBytes(StandardCharsets.UTF_8);
        if (encoded.length <= maxBytes) {
            return reason;
        }
        int end = maxBytes;
        // back off to the start of a UTF-8 sequence
        while (end > 0 && (encoded[end] & 0xC0) == 0x80) {
            end--;
        }
        return new String(encoded, 0, end, StandardCharsets.UTF_8);
    }
}
