package org.httpstub.api.interfaces;

import org.httpstub.api.interfaces.http.HttpRequest;
import org.httpstub.api.interfaces.http.HttpResponse;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/*
AutoCloseable so a test can scope the stub with try-with-resources
 */
public interface IStubServer extends AutoCloseable {
    URI uri();
    int port();

    CompletableFuture<Void> completion();
    boolean awaitCompletion(long timeout, TimeUnit unit);

    List<HttpRequest> requests();
    List<HttpResponse> responses();

    boolean isClosed();

    /** Idempotent; never throws. */
    @Override void close();
}
