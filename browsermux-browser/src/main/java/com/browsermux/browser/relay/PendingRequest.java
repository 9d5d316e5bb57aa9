package com.browsermux.browser.relay;

/**
 * What a mixed id maps back to: the id the session used and the session
 * that is waiting for the response.
 */
public record PendingRequest(int originalId, ExternalSession session) {
}
