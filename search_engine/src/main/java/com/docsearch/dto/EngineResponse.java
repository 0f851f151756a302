package com.docsearch.dto;

/**
 * Typed result of an engine operation. Validation failures and misses travel
 * as a {@link Status}, never as exceptions.
 *
 * @param <T> payload type, {@code null} unless the status carries one
 */
public record EngineResponse<T>(Status status, T payload, String error) {

    public static <T> EngineResponse<T> ok(T payload) {
        return new EngineResponse<>(Status.OK, payload, null);
    }

    public static <T> EngineResponse<T> validation(String error) {
        return new EngineResponse<>(Status.VALIDATION_ERROR, null, error);
    }

    public static <T> EngineResponse<T> notFound(String error) {
        return new EngineResponse<>(Status.NOT_FOUND, null, error);
    }

    public static <T> EngineResponse<T> timeout(String error) {
        return new EngineResponse<>(Status.TIMEOUT, null, error);
    }

    public static <T> EngineResponse<T> integrity(String error) {
        return new EngineResponse<>(Status.INTEGRITY_ERROR, null, error);
    }

    public static <T> EngineResponse<T> unavailable(String error) {
        return new EngineResponse<>(Status.BACKEND_UNAVAILABLE, null, error);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * Re-types a non-OK response so it can be passed along by a caller with a
     * different payload type.
     */
    public <R> EngineResponse<R> failure() {
        if (status == Status.OK) {
            throw new IllegalStateException("response is not a failure");
        }
        return new EngineResponse<>(status, null, error);
    }
}
