package com.example.ttrss.model;

import java.util.Objects;

/**
 * What the server said about a subscribe attempt. Informational: also produced for
 * {@link SubscriptionCode#ADDED}, so check {@link #code()} rather than treating it as a failure.
 */
public final class SubscriptionOutcome {

    private final SubscriptionCode code;
    private final String message;

    public SubscriptionOutcome(SubscriptionCode code, String message) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
    }

    public SubscriptionCode code() {
        return code;
    }

    public String message() {
        return message;
    }

    public String describe() {
        return code.description() + ": " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionOutcome that)) return false;
        return code == that.code && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
