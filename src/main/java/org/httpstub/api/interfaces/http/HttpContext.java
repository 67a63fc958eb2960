package org.httpstub.api.interfaces.http;

/**
 * One exchange in flight: the parsed request and the response being shaped for it.
 * Valid only for the duration of a single responder call.
 */
public interface HttpContext {
    HttpRequest request();
    HttpResponse response();
}
