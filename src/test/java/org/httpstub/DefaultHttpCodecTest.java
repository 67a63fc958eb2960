package org.httpstub;

import org.httpstub.http.DefaultHttpCodec;
import org.httpstub.interfaces.HttpCodec;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultHttpCodecTest {

    private static final String RAW =
            "HTTP/1.1 404 Not Found\r\nContent-Type: text/plain\r\nContent-Length: 4\r\n\r\nnope";

    @Test
    void buildRequestIncludesHeadersAndLength() {
        DefaultHttpCodec h = new DefaultHttpCodec();
        String req = h.buildRequest("POST", "/_search", "localhost", 50000,
                Map.of("X-Test", "1"), 42);

        assertTrue(req.startsWith("POST /_search HTTP/1.1\r\n"));
        assertTrue(req.contains("Host: localhost:50000\r\n"));
        assertTrue(req.contains("X-Test: 1\r\n"));
        assertTrue(req.endsWith("Content-Length: 42\r\n\r\n"));
    }

    @Test
    void sendWritesHeadersAndBody() throws IOException {
        DefaultHttpCodec h = new DefaultHttpCodec();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String headers = "POST / HTTP/1.1\r\nContent-Length: 5\r\n\r\n";

        h.send(out, headers, "hello".getBytes(StandardCharsets.UTF_8));
        assertEquals(headers + "hello", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void readRawResponseReadsAll() throws IOException {
        DefaultHttpCodec h = new DefaultHttpCodec();
        InputStream in = new ByteArrayInputStream(RAW.getBytes(StandardCharsets.UTF_8));
        assertEquals(RAW, h.readRawResponse(in));
    }

    @Test
    void parsesStatusHeadersAndBody() {
        DefaultHttpCodec h = new DefaultHttpCodec();
        assertEquals(404, h.statusOf(RAW));
        assertEquals("text/plain", h.headerOf(RAW, "content-type"));
        assertNull(h.headerOf(RAW, "X-Missing"));
        assertEquals("nope", h.bodyOf(RAW));
    }

    @Test
    void unparseableResponsesAreTolerated() {
        DefaultHttpCodec h = new DefaultHttpCodec();
        assertEquals(-1, h.statusOf(""));
        assertEquals(-1, h.statusOf("garbage"));
        assertEquals(-1, h.statusOf("HTTP/1.1 abc"));
        assertEquals("", h.bodyOf("no blank line"));
    }

    @Test
    void reasonMapsKnownCodes() {
        DefaultHttpCodec h = new DefaultHttpCodec();
        assertEquals("OK", h.reason(HttpCodec.OK));
        assertEquals("Created", h.reason(HttpCodec.CREATED));
        assertEquals("No Content", h.reason(HttpCodec.NO_CONTENT));
        assertEquals("Bad Request", h.reason(HttpCodec.BAD_REQUEST));
        assertEquals("Not Found", h.reason(HttpCodec.NOT_FOUND));
        assertEquals("Internal Server Error", h.reason(HttpCodec.INTERNAL_SERVER_ERROR));
        assertEquals("Unknown", h.reason(418));
    }
}
