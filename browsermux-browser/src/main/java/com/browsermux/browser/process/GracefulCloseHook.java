package com.browsermux.browser.process;

import java.util.concurrent.CompletableFuture;

/**
 * Asks the browser to exit on its own. Completion of the returned future
 * means the request was issued, not that the process has exited.
 */
@FunctionalInterface
public interface GracefulCloseHook {
    CompletableFuture<Void> attempt() throws Exception;
}
