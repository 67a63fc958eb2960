package org.httpstub.server;

import org.httpstub.api.impl.CapturedRequest;
import org.httpstub.api.impl.HttpRequestReader;
import org.httpstub.api.impl.MalformedRequestException;
import org.httpstub.api.impl.StubHttpContext;
import org.httpstub.api.impl.StubHttpResponse;
import org.httpstub.api.interfaces.IResponder;
import org.httpstub.api.interfaces.IStubServer;
import org.httpstub.api.interfaces.http.HttpRequest;
import org.httpstub.api.interfaces.http.HttpResponse;
import org.httpstub.config.StubConfig;
import org.httpstub.interfaces.CompletionSignal;
import org.httpstub.interfaces.HttpCodec;
import org.httpstub.interfaces.PortSelector;
import org.httpstub.interfaces.RetryExecutor;
import org.httpstub.util.RandomPortSelector;
import org.httpstub.util.SimpleCompletionSignal;
import org.httpstub.util.SimpleRetryExecutor;

import java.io.IOException;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HttpStub is an ephemeral HTTP server that simulates a remote endpoint in tests.
 * <p>
 * <b>Design notes:</b>
 * <ul>
 *   <li>Binds a random port in the configured range, retrying on contention up to {@code maxBindAttempts} times.</li>
 *   <li>One daemon worker accepts and serves connections strictly one at a time; the responder never runs concurrently with itself.</li>
 *   <li>Every served exchange is captured; {@code requests().get(i)} and {@code responses().get(i)} belong to the same exchange.</li>
 *   <li>The completion signal fires once, when the number of captured responses first reaches {@code completeRequestCount}.</li>
 *   <li>A responder failure is logged and answered with 500; the exchange is still captured and the loop keeps serving.</li>
 * </ul>
 * After a response is written its output half is shut down so the client sees the end of the
 * message, but the connection itself stays open until {@link #close()}.
 */
public final class HttpStub implements IStubServer {

    private static final String TAG = "[HttpStub] ";
    private static final int MAX_ACCEPT_FAILURES = 20;
    private static final long ACCEPT_BACKOFF_MS = 10L;
    private static final long MAX_ACCEPT_BACKOFF_MS = 1_000L;

    private final IResponder responder;
    private final StubConfig config;
    private final CompletionSignal completion;
    private final ServerSocket listener;
    private final int port;
    private final URI uri;
    private final Thread worker;

    // guarded by exchangesLock; the worker is the only writer
    private final Object exchangesLock = new Object();
    private final List<HttpRequest> requests = new ArrayList<>();
    private final List<StubHttpResponse> responses = new ArrayList<>();

    // set under exchangesLock so no append can slip in after teardown started
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile Socket inFlight;

    /**
     * Starts a stub with settings from {@link StubConfig#fromSystemProperties()}.
     *
     * @param responder            shapes each response; invoked on the worker thread
     * @param completeRequestCount number of served requests after which {@link #completion()} resolves
     * @throws BindExhaustedException if no port could be bound
     */
    public HttpStub(IResponder responder, int completeRequestCount) throws IOException {
        this(responder, completeRequestCount, StubConfig.fromSystemProperties());
    }

    public HttpStub(IResponder responder, int completeRequestCount, StubConfig config) throws IOException {
        this(responder, completeRequestCount, config, new RandomPortSelector());
    }

    public HttpStub(IResponder responder, int completeRequestCount,
                    StubConfig config, PortSelector portSelector) throws IOException {
        this.responder = Objects.requireNonNull(responder, "responder");
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(portSelector, "portSelector");
        this.completion = new SimpleCompletionSignal(completeRequestCount);

        this.listener = bindWithRetry(portSelector);
        this.port = listener.getLocalPort();
        this.uri = URI.create("http://" + config.host() + ":" + port + "/");

        this.worker = new Thread(this::backgroundLoop, "http-stub-" + port);
        worker.setDaemon(true);
        worker.start();

        System.out.println(TAG + "listening on " + uri + " (complete after " + completeRequestCount + ")");
    }

    /* ------------------------------ accessors ------------------------------ */

    @Override
    public URI uri() {
        return uri;
    }

    @Override
    public int port() {
        return port;
    }

    /** Resolves once; never resolves if the stub is closed before the count is reached. */
    @Override
    public CompletableFuture<Void> completion() {
        return completion.future();
    }

    @Override
    public boolean awaitCompletion(long timeout, TimeUnit unit) {
        return completion.await(unit.toMillis(timeout));
    }

    @Override
    public List<HttpRequest> requests() {
        synchronized (exchangesLock) {
            return List.copyOf(requests);
        }
    }

    @Override
    public List<HttpResponse> responses() {
        synchronized (exchangesLock) {
            return List.copyOf(responses);
        }
    }

    @Override
    public boolean isClosed() {
        return cancelled.get();
    }

    /* ------------------------------ teardown ------------------------------ */

    /**
     * Stops accepting, releases the listener and every captured connection.
     * Only the first call has an effect. Captured data stays readable.
     */
    @Override
    public void close() {
        synchronized (exchangesLock) {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
        }
        completion.disable();

        try {
            listener.close(); // unblocks accept()
        } catch (IOException e) {
            System.err.println(TAG + "closing listener failed: " + e.getMessage());
        }

        Socket pending = inFlight;
        if (pending != null) {
            closeSocket(pending); // unblocks a read of a half-sent request
        }

        if (Thread.currentThread() != worker) {
            try {
                worker.join(config.shutdownTimeoutMs());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            if (worker.isAlive()) {
                System.err.println(TAG + "worker still busy after " + config.shutdownTimeoutMs() + "ms; abandoning it");
            }
        }

        List<StubHttpResponse> captured;
        synchronized (exchangesLock) {
            captured = new ArrayList<>(responses);
        }
        for (StubHttpResponse response : captured) {
            try {
                response.close();
            } catch (IOException e) {
                System.err.println(TAG + "closing captured response failed: " + e.getMessage());
            }
        }

        System.out.println(TAG + "closed " + uri + " after " + captured.size() + " exchange(s)");
    }

    /* ------------------------------ binding ------------------------------ */

    private ServerSocket bindWithRetry(PortSelector portSelector) throws IOException {
        InetAddress address = InetAddress.getByName(config.host());
        RetryExecutor retry = SimpleRetryExecutor.immediate(config.maxBindAttempts(), BindException.class);
        try {
            return retry.execute(() -> bind(address, portSelector.nextPort(config.minPort(), config.maxPort())));
        } catch (BindException e) {
            throw new BindExhaustedException(retry.maxAttempts(), e);
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("binding failed", e);
        }
    }

    private static ServerSocket bind(InetAddress address, int port) throws IOException {
        ServerSocket ss = new ServerSocket();
        try {
            ss.bind(new InetSocketAddress(address, port));
            return ss;
        } catch (IOException e) {
            ss.close();
            throw e;
        }
    }

    /* ------------------------------ worker ------------------------------ */

    private void backgroundLoop() {
        int acceptFailures = 0;
        while (!listener.isClosed() && !cancelled.get()) {
            Socket socket;
            try {
                socket = listener.accept();
            } catch (IOException e) {
                if (cancelled.get() || listener.isClosed()) {
                    return; // teardown closed the listener
                }
                acceptFailures++;
                System.err.println(TAG + "accept failed (" + acceptFailures + " in a row): " + e.getMessage());
                if (acceptFailures >= MAX_ACCEPT_FAILURES) {
                    System.err.println(TAG + "giving up on " + uri + " after " + acceptFailures + " accept failures");
                    return;
                }
                try {
                    Thread.sleep(SimpleRetryExecutor.backoffDelay(ACCEPT_BACKOFF_MS, MAX_ACCEPT_BACKOFF_MS, acceptFailures));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
                continue;
            }
            acceptFailures = 0;

            if (cancelled.get()) {
                closeSocket(socket);
                return;
            }
            serve(socket);
        }
    }

    /** Processes a single connection end-to-end: read, respond, capture, commit. */
    private void serve(Socket socket) {
        inFlight = socket;
        StubHttpResponse response = new StubHttpResponse(socket);
        boolean captured = false;
        try {
            if (config.readTimeoutMs() > 0) {
                socket.setSoTimeout(config.readTimeoutMs());
            }

            CapturedRequest request;
            try {
                request = HttpRequestReader.read(socket.getInputStream());
            } catch (MalformedRequestException e) {
                System.err.println(TAG + "rejecting malformed request: " + e.getMessage());
                response.status(HttpCodec.BAD_REQUEST);
                response.body(e.getMessage());
                response.commit(socket.getOutputStream());
                return;
            }

            respond(request, response);
            response.freeze();

            int count;
            synchronized (exchangesLock) {
                if (cancelled.get()) {
                    return;
                }
                requests.add(request);
                responses.add(response);
                count = responses.size();
            }
            captured = true;

            try {
                response.commit(socket.getOutputStream());
                socket.shutdownOutput();
                System.out.println(TAG + "captured #" + count + " " + request.method() + " " + request.path()
                        + " -> " + response.status());
            } finally {
                // counts even when the client went away before the response was sent
                completion.onResponseCaptured(count);
                if (count == completion.threshold() && completion.isSatisfied()) {
                    System.out.println(TAG + "completion reached after " + count + " request(s)");
                }
            }
        } catch (IOException e) {
            if (!cancelled.get()) {
                System.err.println(TAG + "exchange failed: " + e.getMessage());
            }
        } finally {
            inFlight = null;
            if (!captured) {
                closeSocket(socket);
            }
        }
    }

    /** Runs the responder on a 200 default; a failure turns the response into a 500. */
    private void respond(CapturedRequest request, StubHttpResponse response) {
        response.status(HttpCodec.OK);
        try {
            responder.respond(new StubHttpContext(request, response));
        } catch (Exception | AssertionError e) {
            System.err.println(TAG + "responder failed for " + request + ": " + e);
            response.reset();
            response.status(HttpCodec.INTERNAL_SERVER_ERROR);
            response.header("Content-Type", "text/plain; charset=utf-8");
            response.body("responder failed: " + e);
        }
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            System.err.println(TAG + "closing connection failed: " + e.getMessage());
        }
    }
}
