package org.httpstub.api.impl;

import org.httpstub.api.interfaces.http.HttpRequest;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Immutable snapshot of one inbound request. */
public final class CapturedRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String query;
    private final String version;
    private final Map<String, String> headers;
    private final byte[] body;

    public CapturedRequest(String method, String target, String version,
                           Map<String, String> headers, byte[] body) {
        this.method = method;
        int q = target.indexOf('?');
        this.path = q >= 0 ? target.substring(0, q) : target;
        this.query = q >= 0 ? target.substring(q + 1) : null;
        this.version = version;

        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? new byte[0] : body.clone();
    }

    @Override public String method() { return method; }
    @Override public String path() { return path; }
    @Override public String query() { return query; }
    @Override public String version() { return version; }

    @Override
    public String header(String name) {
        if (name == null) return null;
        return headers.get(name);
    }

    @Override public Map<String, String> headers() { return headers; }

    @Override public byte[] body() { return body.clone(); }

    @Override
    public InputStream bodyStream() {
        return new ByteArrayInputStream(body);
    }

    @Override
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return method + " " + (query == null ? path : path + "?" + query) + " " + version
                + " (" + body.length + " bytes)";
    }
}
