package org.httpstub.server;

import java.io.IOException;

/** Every bind attempt hit a port that was already taken. */
public class BindExhaustedException extends IOException {
    private final int attempts;

    public BindExhaustedException(int attempts, Throwable lastFailure) {
        super("could not bind a port after " + attempts + " attempt(s)", lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
