package org.httpstub.util;

import org.httpstub.interfaces.CompletionSignal;

import java.util.concurrent.CompletableFuture;

/**
 * Monitor-based, single-shot completion signal.
 * <ul>
 *   <li>{@code satisfied} moves from false to true at most once and never back.</li>
 *   <li>Once {@link #disable()} ran, no later count can satisfy it.</li>
 *   <li>The backing future is completed outside the monitor so dependent stages never run under the lock.</li>
 * </ul>
 */
public final class SimpleCompletionSignal implements CompletionSignal {

    private final Object mon = new Object();
    private final CompletableFuture<Void> future = new CompletableFuture<>();
    private final int threshold;

    private volatile boolean satisfied;
    private volatile boolean disabled;

    /**
     * @param threshold number of captured responses after which the signal fires (must be positive)
     */
    public SimpleCompletionSignal(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive, was " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public void onResponseCaptured(int count) {
        synchronized (mon) {
            if (satisfied || disabled || count < threshold) {
                return;
            }
            satisfied = true;
            mon.notifyAll(); // wake up owners blocked in await()
        }
        future.complete(null);
    }

    @Override
    public void disable() {
        synchronized (mon) {
            disabled = true;
        }
    }

    /**
     * Waits until the signal is satisfied or the timeout expires.
     *
     * @param timeoutMs maximum wait time in milliseconds
     * @return {@code true} if satisfied before timeout, {@code false} otherwise (also when interrupted)
     */
    @Override
    public boolean await(long timeoutMs) {
        long end = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        synchronized (mon) {
            while (!satisfied) {
                long wait = end - System.currentTimeMillis();
                if (wait <= 0) return false;
                try {
                    mon.wait(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return satisfied;
                }
            }
            return true;
        }
    }

    @Override
    public boolean isSatisfied() {
        return satisfied;
    }

    @Override
    public CompletableFuture<Void> future() {
        return future.copy();
    }

    @Override
    public int threshold() {
        return threshold;
    }
}
