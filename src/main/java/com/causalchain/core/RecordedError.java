package com.causalchain.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

/**
 * Failure attached to an event. Keeps the exception type and message in a
 * serializable form; the original throwable is retained for in-process
 * inspection only.
 */
@Getter
public final class RecordedError {

    private final String type;
    private final String message;

    @JsonIgnore
    private final Throwable cause;

    private RecordedError(String type, String message, Throwable cause) {
        this.type = type;
        this.message = message;
        this.cause = cause;
    }

    public static RecordedError of(Throwable error) {
        return new RecordedError(error.getClass().getName(), error.getMessage(), error);
    }

    /**
     * Failure reported by a caller that has no throwable, e.g. over HTTP.
     */
    public static RecordedError of(String type, String message) {
        return new RecordedError(type != null ? type : "error", message, null);
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
