package com.example.ttrss.transport;

import com.example.ttrss.protocol.ApiStatus;
import com.example.ttrss.protocol.Operations;
import com.example.ttrss.protocol.ResponseEnvelope;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class JsonWire {

    private static final Gson GSON = new Gson();

    private JsonWire() {
    }

    public static JsonObject toRequest(Map<String, ?> parameters) {
        if (parameters == null || parameters.isEmpty()) return new JsonObject();
        JsonElement tree = GSON.toJsonTree(parameters);
        if (!tree.isJsonObject()) {
            throw new IllegalArgumentException("Parameters do not encode as a JSON object: " + parameters);
        }
        return tree.getAsJsonObject();
    }

    public static byte[] encode(JsonObject request) {
        return GSON.toJson(request).getBytes(StandardCharsets.UTF_8);
    }

    public static ResponseEnvelope readResponse(InputStream in) throws IOException, MalformedBodyException {
        JsonElement root;
        try {
            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            root = JsonParser.parseReader(reader);
        } catch (JsonIOException e) {
            // a failed read, not a bad document
            if (e.getCause() instanceof IOException io) throw io;
            throw new IOException(e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new MalformedBodyException("not valid JSON: " + e.getMessage(), e);
        }
        return toEnvelope(root);
    }

    public static ResponseEnvelope toEnvelope(JsonElement root) throws MalformedBodyException {
        if (root == null || !root.isJsonObject()) {
            throw new MalformedBodyException("expected a JSON object, got " + describe(root));
        }
        JsonObject obj = root.getAsJsonObject();

        Integer seq = optionalInt(obj, Operations.KEY_SEQ);
        Integer rawStatus = optionalInt(obj, Operations.KEY_STATUS);
        ApiStatus status = rawStatus == null ? ApiStatus.OK : ApiStatus.fromWire(rawStatus);

        JsonElement content = obj.get(Operations.KEY_CONTENT);
        JsonObject contentObj;
        if (content == null || content.isJsonNull()) {
            contentObj = new JsonObject();
        } else if (content.isJsonObject()) {
            contentObj = content.getAsJsonObject();
        } else {
            throw new MalformedBodyException("\"content\" is not a JSON object: " + describe(content));
        }
        return ResponseEnvelope.of(seq, status, contentObj);
    }

    private static Integer optionalInt(JsonObject obj, String key) throws MalformedBodyException {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) return null;
        if (e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber()) {
            try {
                return new BigDecimal(e.getAsString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException ex) {
                throw new MalformedBodyException("\"" + key + "\" is not an integer: " + e, ex);
            }
        }
        throw new MalformedBodyException("\"" + key + "\" is not a number: " + e);
    }

    static String describe(JsonElement e) {
        if (e == null || e.isJsonNull()) return "null";
        if (e.isJsonArray()) return "array";
        if (e.isJsonObject()) return "object";
        JsonPrimitive p = e.getAsJsonPrimitive();
        if (p.isString()) return "string";
        if (p.isBoolean()) return "boolean";
        return "number";
    }

    public static class MalformedBodyException extends Exception {
        public MalformedBodyException(String message) {
            super(message);
        }

        public MalformedBodyException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
