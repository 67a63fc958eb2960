package org.httpstub.interfaces;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot notification that fires when a running count first reaches a threshold.
 * Usage:
 *  - After each captured exchange: signal.onResponseCaptured(count);
 *  - Owner side: signal.await(timeoutMs) or signal.future().get(...)
 *  - On teardown: signal.disable(); nothing fires afterwards.
 */
public interface CompletionSignal {

    /** Record the new count; satisfies the signal the first time {@code count >= threshold}. */
    void onResponseCaptured(int count);

    /** Permanently prevents a pending signal from firing. */
    void disable();

    /**
     * Block until satisfied or timeout.
     * @return true if satisfied; false if timed out.
     */
    boolean await(long timeoutMs);

    boolean isSatisfied();

    /** A view of the signal that callers cannot complete or cancel. */
    CompletableFuture<Void> future();

    int threshold();
}
