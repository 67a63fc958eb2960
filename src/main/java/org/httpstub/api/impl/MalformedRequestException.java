package org.httpstub.api.impl;

import java.io.IOException;

/** Raised when the bytes on a connection do not form an HTTP/1.x request. */
public class MalformedRequestException extends IOException {
    public MalformedRequestException(String message) {
        super(message);
    }
}
