package org.httpstub.api.impl;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    /**
     * Serializes status line, headers and body. {@code Content-Length} and
     * {@code Connection: close} are added unless the responder set them.
     * The head is encoded as ISO-8859-1, the body is written as-is.
     */
    public static void write(OutputStream out, StubHttpResponse res) throws IOException {
        byte[] body = res.body();

        OutputStreamWriter w = new OutputStreamWriter(out, StandardCharsets.ISO_8859_1);
        w.write("HTTP/1.1 " + res.status() + " " + res.reason() + "\r\n");

        for (Map.Entry<String, String> e : res.headers().entrySet()) {
            w.write(e.getKey() + ": " + e.getValue() + "\r\n");
        }
        if (!res.hasHeader("Content-Length")) {
            w.write("Content-Length: " + body.length + "\r\n");
        }
        if (!res.hasHeader("Connection")) {
            w.write("Connection: close\r\n");
        }

        w.write("\r\n"); // end headers
        w.flush();

        out.write(body);
        out.flush();
    }
}
