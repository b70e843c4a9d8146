package com.example.ttrss.tree;

import java.util.Objects;

/**
 * What a {@link FeedTreeVisitor} wants the walk to do next.
 */
public final class VisitResult {

    public enum Action {
        CONTINUE,
        SKIP_SUBTREE,
        ABORT
    }

    public static final VisitResult CONTINUE = new VisitResult(Action.CONTINUE, null);

    /** Only legal for categories; returned for a feed it aborts the walk. */
    public static final VisitResult SKIP_SUBTREE = new VisitResult(Action.SKIP_SUBTREE, null);

    private final Action action;
    private final Exception reason;

    private VisitResult(Action action, Exception reason) {
        this.action = action;
        this.reason = reason;
    }

    public static VisitResult abort(Exception reason) {
        return new VisitResult(Action.ABORT, Objects.requireNonNull(reason, "reason"));
    }

    public Action action() {
        return action;
    }

    /** Non-null only for {@link Action#ABORT}. */
    public Exception reason() {
        return reason;
    }

    @Override
    public String toString() {
        return action == Action.ABORT ? "ABORT(" + reason + ")" : action.name();
    }
}
