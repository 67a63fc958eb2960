package org.httpstub.api.impl;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parses one HTTP/1.x request from a connection into a {@link CapturedRequest}.
 * <ul>
 *   <li>Header block is read byte-by-byte up to CRLFCRLF.</li>
 *   <li>Repeated header names are folded into one comma-separated value.</li>
 *   <li>Body is framed by {@code Content-Length} or {@code Transfer-Encoding: chunked}; otherwise empty.</li>
 * </ul>
 */
public final class HttpRequestReader {

    private static final int MAX_HEADER_BYTES = 64 * 1024;

    private HttpRequestReader() {}

    public static CapturedRequest read(InputStream in) throws IOException {
        String[] lines = readHeaderLines(in);
        if (lines.length == 0 || lines[0].isBlank()) {
            throw new MalformedRequestException("empty request");
        }

        String[] parts = lines[0].trim().split(" ");
        if (parts.length != 3 || !parts[2].startsWith("HTTP/")) {
            throw new MalformedRequestException("bad request line: " + lines[0]);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) continue;
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new MalformedRequestException("bad header line: " + line);
            }
            String name = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            String existing = findKey(headers, name);
            if (existing == null) {
                headers.put(name, value);
            } else {
                headers.put(existing, headers.get(existing) + ", " + value);
            }
        }

        byte[] body;
        String te = valueOf(headers, "Transfer-Encoding");
        if (te != null && te.toLowerCase(Locale.ROOT).contains("chunked")) {
            body = readChunked(in);
        } else {
            body = readBody(in, contentLength(headers));
        }

        return new CapturedRequest(parts[0], parts[1], parts[2], headers, body);
    }

    /** Reads header bytes up to CRLFCRLF and splits them by CRLF. */
    static String[] readHeaderLines(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int state = 0;
        int b;

        while ((b = in.read()) != -1) {
            buf.write(b);
            if (buf.size() > MAX_HEADER_BYTES) {
                throw new MalformedRequestException("header block too large");
            }
            if (state == 0 && b == '\r') {
                state = 1;
            } else if (state == 1 && b == '\n') {
                state = 2;
            } else if (state == 2 && b == '\r') {
                state = 3;
            } else if (state == 3 && b == '\n') {
                break;
            } else {
                state = b == '\r' ? 1 : 0;
            }
        }

        String headersStr = buf.toString(StandardCharsets.ISO_8859_1);
        if (headersStr.isEmpty()) {
            return new String[0];
        }
        return headersStr.split("\r\n");
    }

    static int contentLength(Map<String, String> headers) throws MalformedRequestException {
        String raw = valueOf(headers, "Content-Length");
        if (raw == null) return 0;
        try {
            int len = Integer.parseInt(raw.trim());
            if (len < 0) throw new MalformedRequestException("negative Content-Length");
            return len;
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("bad Content-Length: " + raw);
        }
    }

    private static byte[] readBody(InputStream in, int len) throws IOException {
        byte[] body = in.readNBytes(len);
        if (body.length < len) {
            throw new EOFException("body truncated: expected " + len + " bytes, got " + body.length);
        }
        return body;
    }

    private static byte[] readChunked(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (true) {
            String sizeLine = readLine(in);
            int semi = sizeLine.indexOf(';');
            String hex = (semi >= 0 ? sizeLine.substring(0, semi) : sizeLine).trim();
            int size;
            try {
                size = Integer.parseInt(hex, 16);
            } catch (NumberFormatException e) {
                throw new MalformedRequestException("bad chunk size: " + sizeLine);
            }
            if (size == 0) {
                // trailers, terminated by an empty line
                while (!readLine(in).isEmpty()) {
                    // skip
                }
                return out.toByteArray();
            }
            out.write(readBody(in, size));
            readLine(in); // CRLF after chunk data
        }
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') break;
            if (b != '\r') buf.write(b);
        }
        if (b == -1) {
            throw new EOFException("stream ended inside chunked body");
        }
        return buf.toString(StandardCharsets.ISO_8859_1);
    }

    private static String valueOf(Map<String, String> headers, String name) {
        String key = findKey(headers, name);
        return key == null ? null : headers.get(key);
    }

    private static String findKey(Map<String, String> headers, String name) {
        for (String key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) return key;
        }
        return null;
    }
}
