package com.example.ttrss.model;

import com.example.ttrss.core.Settings;
import java.util.List;
import java.util.Objects;

/**
 * A category or feed in the feed tree. Immutable; categories own their children in document order.
 */
public final class FeedTreeNode {

    private final int id;
    private final String name;
    private final NodeKind kind;
    private final String lastError;
    private final List<FeedTreeNode> children;

    private FeedTreeNode(int id, String name, NodeKind kind, String lastError, List<FeedTreeNode> children) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind;
        this.lastError = lastError;
        this.children = children;
    }

    public static FeedTreeNode category(int id, String name, List<FeedTreeNode> children) {
        return new FeedTreeNode(id, name, NodeKind.CATEGORY, "", List.copyOf(children));
    }

    public static FeedTreeNode feed(int id, String name, String lastError) {
        return new FeedTreeNode(id, name, NodeKind.FEED, lastError == null ? "" : lastError, List.of());
    }

    /** The synthetic {@code "/"} category wrapping the top-level entries. */
    public static FeedTreeNode root(List<FeedTreeNode> children) {
        return category(Settings.ROOT_NODE_ID, Settings.ROOT_NODE_NAME, children);
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean isCategory() {
        return kind == NodeKind.CATEGORY;
    }

    public boolean isFeed() {
        return kind == NodeKind.FEED;
    }

    /** Last update error of a feed; empty when there is none and always empty for categories. */
    public String lastError() {
        return lastError;
    }

    public boolean hasError() {
        return !lastError.isEmpty();
    }

    public List<FeedTreeNode> children() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeedTreeNode that)) return false;
        return id == that.id && kind == that.kind && name.equals(that.name)
                && lastError.equals(that.lastError) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, kind, lastError, children);
    }

    @Override
    public String toString() {
        if (isFeed()) {
            return "feed " + id + " " + name + (hasError() ? " [" + lastError + "]" : "");
        }
        return "category " + id + " " + name + " (" + children.size() + ")";
    }
}
