package com.example.ttrss.model;

/**
 * Result codes of {@code subscribeToFeed}; the wire value is the ordinal.
 */
public enum SubscriptionCode {
    ALREADY_SUBSCRIBED("already subscribed to feed"),
    ADDED(""),
    INVALID_URL("invalid feed URL"),
    HTML_NO_FEEDS("no feed link found in HTML at URL"),
    HTML_MULTIPLE_FEEDS("multiple feed links found in HTML at URL"),
    GET_FAILED("unable to GET URL"),
    XML_INVALID("invalid XML at URL");

    private static final SubscriptionCode[] VALUES = values();

    private final String description;

    SubscriptionCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public boolean isSubscribed() {
        return this == ADDED || this == ALREADY_SUBSCRIBED;
    }

    public static boolean isValidWireValue(long value) {
        return value >= 0 && value < VALUES.length;
    }

    public static SubscriptionCode fromWire(int value) {
        if (!isValidWireValue(value)) {
            throw new IllegalArgumentException("Unknown subscription code: " + value);
        }
        return VALUES[value];
    }
}
