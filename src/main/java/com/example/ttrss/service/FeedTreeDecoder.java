package com.example.ttrss.service;

import com.example.ttrss.client.ProtocolViolationException;
import com.example.ttrss.model.FeedTreeNode;
import com.example.ttrss.model.NodeKind;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link FeedTreeNode} tree from a {@code getFeedTree} response.
 *
 * <p>Expected shape: {@code {"categories": {"items": [ ... ]}}}. Each item carries {@code bare_ID},
 * {@code name} and {@code type}; feeds may carry {@code error}, categories may carry nested
 * {@code items}. Item keys match case-insensitively when no exact key is present, so
 * {@code bare_id} is read as {@code bare_ID}. The returned root is the synthetic {@code "/"} category.
 */
public final class FeedTreeDecoder {

    private static final String KEY_CATEGORIES = "categories";
    private static final String KEY_ITEMS = "items";
    private static final String KEY_ID = "bare_ID";
    private static final String KEY_NAME = "name";
    private static final String KEY_TYPE = "type";
    private static final String KEY_ERROR = "error";

    private FeedTreeDecoder() {
    }

    public static FeedTreeNode decode(JsonObject content) throws ProtocolViolationException {
        JsonElement categories = content == null ? null : content.get(KEY_CATEGORIES);
        if (categories == null) {
            throw new ProtocolViolationException("getFeedTree: content lacks categories key");
        }
        if (!categories.isJsonObject()) {
            throw new ProtocolViolationException("getFeedTree: categories is not a JSON object: " + categories);
        }
        JsonElement items = categories.getAsJsonObject().get(KEY_ITEMS);
        if (items == null) {
            throw new ProtocolViolationException("getFeedTree: categories has no items entry");
        }
        if (!items.isJsonArray()) {
            throw new ProtocolViolationException("getFeedTree: items is not a JSON array: " + items);
        }
        return FeedTreeNode.root(decodeItems(items.getAsJsonArray(), "items"));
    }

    private static List<FeedTreeNode> decodeItems(JsonArray items, String path) throws ProtocolViolationException {
        List<FeedTreeNode> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            out.add(decodeItem(items.get(i), path + "[" + i + "]"));
        }
        return out;
    }

    private static FeedTreeNode decodeItem(JsonElement element, String path) throws ProtocolViolationException {
        if (!element.isJsonObject()) {
            throw new ProtocolViolationException("getFeedTree: " + path + " is not a JSON object: " + element);
        }
        JsonObject item = element.getAsJsonObject();
        int id = requireInt(item, KEY_ID, path);
        String name = requireString(item, KEY_NAME, path);
        String type = requireString(item, KEY_TYPE, path);

        NodeKind kind = NodeKind.fromWire(type);
        if (kind == null) {
            throw new ProtocolViolationException("getFeedTree: " + path + "." + KEY_TYPE + " is neither category nor feed: " + type);
        }

        if (kind == NodeKind.FEED) {
            return FeedTreeNode.feed(id, name, optionalString(item, KEY_ERROR));
        }

        JsonElement children = field(item, KEY_ITEMS);
        if (children == null || children.isJsonNull()) {
            return FeedTreeNode.category(id, name, List.of());
        }
        if (!children.isJsonArray()) {
            throw new ProtocolViolationException("getFeedTree: " + path + ".items is not a JSON array: " + children);
        }
        return FeedTreeNode.category(id, name, decodeItems(children.getAsJsonArray(), path + ".items"));
    }

    private static int requireInt(JsonObject item, String key, String path) throws ProtocolViolationException {
        JsonElement e = field(item, key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw new ProtocolViolationException("getFeedTree: " + path + "." + key + " is missing or not a number");
        }
        try {
            return new BigDecimal(e.getAsString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException ex) {
            throw new ProtocolViolationException("getFeedTree: " + path + "." + key + " is not an integer: " + e);
        }
    }

    private static String requireString(JsonObject item, String key, String path) throws ProtocolViolationException {
        JsonElement e = field(item, key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw new ProtocolViolationException("getFeedTree: " + path + "." + key + " is missing or not a string");
        }
        return e.getAsString();
    }

    private static JsonElement field(JsonObject item, String key) {
        JsonElement exact = item.get(key);
        if (exact != null) return exact;
        for (Map.Entry<String, JsonElement> e : item.entrySet()) {
            if (e.getKey().equalsIgnoreCase(key)) return e.getValue();
        }
        return null;
    }

    private static String optionalString(JsonObject item, String key) {
        JsonElement e = field(item, key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) return "";
        return e.getAsString();
    }
}
