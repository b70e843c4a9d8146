package com.example.ttrss.model;

public enum NodeKind {
    CATEGORY("category"),
    FEED("feed");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    /** Returns null for anything but the two literal discriminators. */
    public static NodeKind fromWire(String name) {
        for (NodeKind k : values()) {
            if (k.wireName.equals(name)) return k;
        }
        return null;
    }
}
