package com.example.ttrss.tree;

import com.example.ttrss.model.FeedTreeNode;

/**
 * Thrown when a walk stops early. The cause is the visitor's abort reason, if it gave one.
 */
public class FeedTreeWalkException extends Exception {

    private final transient FeedTreeNode node;

    public FeedTreeWalkException(FeedTreeNode node, Exception reason) {
        super("walk aborted at " + node + ": " + reason.getMessage(), reason);
        this.node = node;
    }

    public FeedTreeWalkException(FeedTreeNode node, String message) {
        super(message);
        this.node = node;
    }

    /** The node whose visit stopped the walk. */
    public FeedTreeNode node() {
        return node;
    }
}
