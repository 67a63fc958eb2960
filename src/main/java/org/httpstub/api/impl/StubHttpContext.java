package org.httpstub.api.impl;

import org.httpstub.api.interfaces.http.HttpContext;
import org.httpstub.api.interfaces.http.HttpRequest;
import org.httpstub.api.interfaces.http.HttpResponse;

public record StubHttpContext(HttpRequest request, HttpResponse response) implements HttpContext {
}
