package org.httpstub.http;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import org.httpstub.api.interfaces.http.HttpRequest;

import java.lang.reflect.Type;

/** Readers for captured request bodies. */
public final class HttpRequests {
    private static final Gson GSON = new Gson();

    private HttpRequests() {}

    /**
     * Parses the request body as JSON.
     *
     * @throws JsonSyntaxException if the body is not valid JSON
     */
    public static JsonElement bodyAsJson(HttpRequest request) {
        String body = request.bodyAsString();
        if (body.isBlank()) {
            throw new JsonSyntaxException("empty body in " + request.method() + " " + request.path());
        }
        return JsonParser.parseString(body);
    }

    /** Binds the JSON body onto {@code type}. */
    public static <T> T bodyAs(HttpRequest request, Type type) {
        return GSON.fromJson(bodyAsJson(request), type);
    }
}
