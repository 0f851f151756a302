package com.docsearch.service.web;

import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.Status;
import com.google.gson.Gson;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

final class Responses {

    private Responses() {}

    static int httpStatus(Status status) {
        return switch (status) {
            case OK -> 200;
            case VALIDATION_ERROR -> 400;
            case NOT_FOUND -> 404;
            case TIMEOUT -> 504;
            case BACKEND_UNAVAILABLE -> 503;
            case INTEGRITY_ERROR -> 500;
        };
    }

    /**
     * Writes {@code body(payload)} on success, otherwise the mapped status
     * with {@code {"success":false,"error":..}}.
     */
    static <T> void send(Context ctx, Gson gson, EngineResponse<T> resp,
                         Function<T, Map<String, Object>> body) {
        if (resp.isOk()) {
            ctx.status(200).result(gson.toJson(body.apply(resp.payload())));
            return;
        }
        error(ctx, gson, httpStatus(resp.status()), resp.error());
    }

    static void error(Context ctx, Gson gson, int status, String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", false);
        out.put("error", message);
        ctx.status(status).result(gson.toJson(out));
    }

    static Map<String, Object> body(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            out.put((String) keyValues[i], keyValues[i + 1]);
        }
        return out;
    }
}
