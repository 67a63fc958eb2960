package org.httpstub.interfaces;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * HttpCodec: wire-level helpers for talking HTTP/1.1 over raw sockets.
 * Client-side builders and parsers plus the status vocabulary the stub uses.
 */
public interface HttpCodec {

    int OK = 200;
    int CREATED = 201;
    int ACCEPTED = 202;
    int NO_CONTENT = 204;
    int BAD_REQUEST = 400;
    int NOT_FOUND = 404;
    int INTERNAL_SERVER_ERROR = 500;
    int SERVICE_UNAVAILABLE = 503;

    /** Build full HTTP/1.1 request headers (no body). */
    String buildRequest(String method,
                        String path,
                        String host,
                        int port,
                        Map<String, String> extraHeaders,
                        int contentLength);

    /** Send prepared request headers and optional body. */
    void send(OutputStream out, String requestHeaders, byte[] body) throws IOException;

    /** Read entire HTTP response (status line, headers, body) into a single string. */
    String readRawResponse(InputStream in) throws IOException;

    /* ---------------- Response parsing ---------------- */

    /** Status code from the first line of a raw response, or -1 when unparseable. */
    int statusOf(String rawResponse);

    /** Header value from a raw response (case-insensitive), or {@code null}. */
    String headerOf(String rawResponse, String name);

    /** Everything after the blank line that ends the header block. */
    String bodyOf(String rawResponse);

    /** Map HTTP status codes to reason phrases. */
    String reason(int code);
}
