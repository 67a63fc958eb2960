package org.httpstub.api.impl;

import org.httpstub.api.interfaces.http.HttpResponse;
import org.httpstub.http.DefaultHttpCodec;
import org.httpstub.interfaces.HttpCodec;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Buffered response shaped by the responder and committed by the stub.
 * <p>
 * The body is collected in memory so the stub can send an exact {@code Content-Length}.
 * Once frozen (at the latest when committed) write-side calls throw {@link IllegalStateException}
 * while the read side keeps serving the recorded status, headers and body.
 * </p>
 * The response also owns the connection it was produced for; {@link #close()} releases it.
 */
public class StubHttpResponse implements HttpResponse, Closeable {
    private static final HttpCodec CODEC = new DefaultHttpCodec();

    private final Closeable connection;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final Map<String, String> headers = new LinkedHashMap<>();

    private int status = HttpCodec.OK;
    private String reason = CODEC.reason(HttpCodec.OK);
    private volatile boolean frozen;
    private volatile boolean committed;
    private volatile boolean closed;

    public StubHttpResponse() {
        this(null);
    }

    public StubHttpResponse(Closeable connection) {
        this.connection = connection;
    }

    @Override
    public void status(int code) {
        status(code, CODEC.reason(code));
    }

    @Override
    public void status(int code, String reason) {
        ensureWritable();
        if (code < 100 || code > 999) {
            throw new IllegalArgumentException("status code out of range: " + code);
        }
        this.status = code;
        this.reason = reason == null ? CODEC.reason(code) : reason;
    }

    @Override
    public void header(String name, String value) {
        ensureWritable();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name must not be blank");
        }
        headers.keySet().removeIf(name::equalsIgnoreCase);
        if (value != null) {
            headers.put(name, value);
        }
    }

    @Override
    public void body(String text) {
        ensureWritable();
        buffer.reset();
        if (text != null) {
            buffer.writeBytes(text.getBytes(StandardCharsets.UTF_8));
        }
    }

    @Override
    public OutputStream outputStream() {
        ensureWritable();
        return new OutputStream() {
            @Override
            public void write(int b) {
                ensureWritable();
                buffer.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                ensureWritable();
                buffer.write(b, off, len);
            }
        };
    }

    @Override public int status() { return status; }
    @Override public String reason() { return reason; }
    @Override public Map<String, String> headers() { return Collections.unmodifiableMap(headers); }
    @Override public byte[] body() { return buffer.toByteArray(); }

    @Override
    public String bodyAsString() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Override public boolean isCommitted() { return committed; }
    @Override public boolean isClosed() { return closed; }

    /** Case-insensitive header presence check. */
    public boolean hasHeader(String name) {
        for (String key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    /** Drops everything the responder set; used when the responder fails mid-way. */
    public void reset() {
        ensureWritable();
        headers.clear();
        buffer.reset();
        status = HttpCodec.OK;
        reason = CODEC.reason(HttpCodec.OK);
    }

    /** Ends the write side; the response can still be committed. Idempotent. */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Writes the response to {@code out}. Freezes it even when the write fails. */
    public void commit(OutputStream out) throws IOException {
        if (committed) {
            throw new IllegalStateException("response already committed");
        }
        frozen = true;
        HttpResponseWriter.write(out, this);
        committed = true;
    }

    /** Releases the underlying connection. Safe to call more than once. */
    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        if (connection != null) {
            connection.close();
        }
    }

    private void ensureWritable() {
        if (frozen) {
            throw new IllegalStateException(committed ? "response already committed" : "response is frozen");
        }
    }
}
