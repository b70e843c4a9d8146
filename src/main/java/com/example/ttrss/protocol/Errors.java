package com.example.ttrss.protocol;

import com.example.ttrss.core.Settings;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

public final class Errors {

    private Errors() {
    }

    /**
     * Error text for a response: the string {@code "error"} entry if any, otherwise a placeholder
     * when the status is ERROR, otherwise null.
     */
    public static String classify(ApiStatus status, JsonObject content) {
        String text = errorText(content);
        if (text != null) return text;
        if (status != ApiStatus.OK) return Settings.NO_ERROR_TEXT;
        return null;
    }

    static String errorText(JsonObject content) {
        if (content == null) return null;
        JsonElement e = content.get(Operations.KEY_ERROR);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) return null;
        return e.getAsString();
    }
}
