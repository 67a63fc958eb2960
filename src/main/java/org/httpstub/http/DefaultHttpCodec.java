package org.httpstub.http;

import org.httpstub.interfaces.HttpCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * DefaultHttpCodec implements low-level HTTP/1.1 wire formatting.
 * <p>
 * The request builders and response parsers are the client half used to drive a stub
 * over raw sockets; {@link #reason(int)} is shared with the server half.
 * </p>
 */
public class DefaultHttpCodec implements HttpCodec {

    /**
     * Builds a raw HTTP/1.1 request string with headers.
     *
     * @param method         HTTP method (e.g. "GET", "POST").
     * @param path           request target (must start with '/').
     * @param host           target host.
     * @param port           target port.
     * @param extraHeaders   optional map of additional headers (can be null).
     * @param contentLength  payload size in bytes.
     * @return complete HTTP request head ready to send.
     */
    @Override
    public String buildRequest(String method, String path, String host, int port,
                               Map<String, String> extraHeaders, int contentLength) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(" ").append(path).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(host).append(":").append(port).append("\r\n");

        if (extraHeaders != null) {
            for (Map.Entry<String, String> e : extraHeaders.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
            }
        }

        sb.append("Content-Length: ").append(contentLength).append("\r\n\r\n");
        return sb.toString();
    }

    /**
     * Writes the full request (headers + body) to the output stream.
     *
     * @param out     destination stream.
     * @param headers request head built via {@link #buildRequest}.
     * @param body    request payload; may be empty for GET.
     * @throws IOException if I/O fails during transmission.
     */
    @Override
    public void send(OutputStream out, String headers, byte[] body) throws IOException {
        out.write(headers.getBytes(StandardCharsets.UTF_8));
        if (body != null && body.length > 0) {
            out.write(body);
        }
        out.flush();
    }

    /** Reads until the peer closes its side; the stub always does after one response. */
    @Override
    public String readRawResponse(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    @Override
    public int statusOf(String rawResponse) {
        if (rawResponse == null) return -1;
        int eol = rawResponse.indexOf("\r\n");
        String statusLine = eol >= 0 ? rawResponse.substring(0, eol) : rawResponse;
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2 || !parts[0].startsWith("HTTP/")) return -1;
        try {
            return Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public String headerOf(String rawResponse, String name) {
        if (rawResponse == null || name == null) return null;
        int end = rawResponse.indexOf("\r\n\r\n");
        String head = end >= 0 ? rawResponse.substring(0, end) : rawResponse;
        String[] lines = head.split("\r\n");
        for (int i = 1; i < lines.length; i++) {
            int colon = lines[i].indexOf(':');
            if (colon > 0 && lines[i].substring(0, colon).trim().equalsIgnoreCase(name)) {
                return lines[i].substring(colon + 1).trim();
            }
        }
        return null;
    }

    @Override
    public String bodyOf(String rawResponse) {
        if (rawResponse == null) return "";
        int end = rawResponse.indexOf("\r\n\r\n");
        return end >= 0 ? rawResponse.substring(end + 4) : "";
    }

    /**
     * Converts a numeric HTTP status code into a standard reason phrase.
     * Codes outside the table map to "Unknown".
     */
    @Override
    public String reason(int code) {
        return switch (code) {
            case OK -> "OK";
            case CREATED -> "Created";
            case ACCEPTED -> "Accepted";
            case NO_CONTENT -> "No Content";
            case 301 -> "Moved Permanently";
            case 302 -> "Found";
            case 304 -> "Not Modified";
            case BAD_REQUEST -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case NOT_FOUND -> "Not Found";
            case 409 -> "Conflict";
            case INTERNAL_SERVER_ERROR -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case SERVICE_UNAVAILABLE -> "Service Unavailable";
            default -> "Unknown";
        };
    }
}
