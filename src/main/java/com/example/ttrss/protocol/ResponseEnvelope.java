package com.example.ttrss.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.Objects;

/**
 * One decoded API response. Immutable; {@link #content()} hands out copies.
 */
public final class ResponseEnvelope {

    private final Integer sequence;
    private final ApiStatus status;
    private final String error;
    private final JsonObject content;

    private ResponseEnvelope(Integer sequence, ApiStatus status, String error, JsonObject content) {
        this.sequence = sequence;
        this.status = status;
        this.error = error;
        this.content = content;
    }

    /**
     * Builds an envelope and runs error classification over {@code content}.
     */
    public static ResponseEnvelope of(Integer sequence, ApiStatus status, JsonObject content) {
        Objects.requireNonNull(status, "status");
        JsonObject copy = content == null ? new JsonObject() : content.deepCopy();
        return new ResponseEnvelope(sequence, status, Errors.classify(status, copy), copy);
    }

    /** Echoed request sequence number, or {@code null} when the server sent none. */
    public Integer sequence() {
        return sequence;
    }

    public ApiStatus status() {
        return status;
    }

    /** Error text; never null when {@link #status()} is {@link ApiStatus#ERROR}. */
    public String error() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isOk() {
        return status == ApiStatus.OK && error == null;
    }

    public JsonObject content() {
        return content.deepCopy();
    }

    public boolean has(String key) {
        return content.has(key);
    }

    public JsonElement get(String key) {
        JsonElement e = content.get(key);
        return e == null ? null : e.deepCopy();
    }

    @Override
    public String toString() {
        return "ResponseEnvelope{seq=" + sequence + ", status=" + status
                + (error != null ? ", error=" + error : "") + "}";
    }
}
