package com.example.ttrss.model;

import java.util.Objects;

public final class SubscribeResult {

    private final boolean subscribed;
    private final SubscriptionOutcome outcome;

    public SubscribeResult(boolean subscribed, SubscriptionOutcome outcome) {
        this.subscribed = subscribed;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    /** True when the feed is now subscribed, whether newly added or already present. */
    public boolean subscribed() {
        return subscribed;
    }

    public SubscriptionOutcome outcome() {
        return outcome;
    }

    @Override
    public String toString() {
        return "SubscribeResult{subscribed=" + subscribed + ", outcome=" + outcome + "}";
    }
}
