package org.httpstub.api.interfaces.http;

import java.io.OutputStream;
import java.util.Map;

/**
 * Outgoing response contract.
 * <p>
 * The write side (status, headers, body) is usable only until the stub commits the
 * response to the wire; the read side stays available afterwards for assertions.
 */
public interface HttpResponse {

    // write side
    void status(int code);
    void status(int code, String reason);
    void header(String name, String value);
    void body(String text);

    /** Buffered body stream; closing it does not commit the response. */
    OutputStream outputStream();

    // read side
    int status();
    String reason();
    Map<String, String> headers();
    byte[] body();
    String bodyAsString();

    boolean isCommitted();
    boolean isClosed();
}
