package org.httpstub.api.interfaces;

import org.httpstub.api.interfaces.http.HttpContext;

/**
 * Caller-supplied logic that shapes the response for each captured request.
 * Invoked on the stub's worker thread, one exchange at a time.
 */
@FunctionalInterface
public interface IResponder {
    void respond(HttpContext ctx) throws Exception;
}
