package org.httpstub.api.interfaces.http;

import java.io.InputStream;
import java.util.Map;

/** Read-only view of an inbound request as the responder saw it. */
public interface HttpRequest {
    String method();
    String path();

    /** Raw query string without the leading '?', or {@code null}. */
    String query();
    String version();

    /** Case-insensitive lookup; {@code null} when absent. */
    String header(String name);
    Map<String, String> headers();

    byte[] body();

    /** A fresh stream over {@link #body()} on every call. */
    InputStream bodyStream();

    String bodyAsString();
}
