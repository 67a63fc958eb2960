package org.httpstub.http;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.httpstub.api.interfaces.http.HttpResponse;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/** Convenience writers for responders. */
public final class HttpResponses {
    private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private HttpResponses() {}

    /**
     * Appends {@code output} as UTF-8 to the response body. The writer is closed even
     * when the write fails.
     */
    public static void write(HttpResponse response, String output) throws IOException {
        try (Writer writer = new OutputStreamWriter(response.outputStream(), StandardCharsets.UTF_8)) {
            writer.write(output);
        }
    }

    /** Serializes {@code value} with Gson and marks the response as JSON. */
    public static void writeJson(HttpResponse response, Object value) throws IOException {
        response.header("Content-Type", "application/json; charset=utf-8");
        write(response, GSON.toJson(value));
    }
}
