package com.example.ttrss.tree;

import com.example.ttrss.model.FeedTreeNode;
import java.util.Objects;

/**
 * Depth-first, pre-order walk over a feed tree. Every node is visited at most once.
 *
 * <p>{@link VisitResult#SKIP_SUBTREE} on a category skips its children and continues with the
 * next sibling. On a feed it aborts the walk: feeds have no subtree to skip.
 */
public final class FeedTreeWalker {

    private FeedTreeWalker() {
    }

    public static void walk(FeedTreeNode root, FeedTreeVisitor visitor) throws FeedTreeWalkException {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(visitor, "visitor");
        VisitResult result = visit(root, visitor);
        if (root.isCategory() && result.action() == VisitResult.Action.CONTINUE) {
            walkChildren(root, visitor);
        }
    }

    private static void walkChildren(FeedTreeNode category, FeedTreeVisitor visitor) throws FeedTreeWalkException {
        for (FeedTreeNode child : category.children()) {
            VisitResult result = visit(child, visitor);
            if (child.isCategory() && result.action() == VisitResult.Action.CONTINUE) {
                walkChildren(child, visitor);
            }
        }
    }

    /**
     * Visits one node and throws for anything that ends the walk. Returns CONTINUE, or
     * SKIP_SUBTREE for a category.
     */
    private static VisitResult visit(FeedTreeNode node, FeedTreeVisitor visitor) throws FeedTreeWalkException {
        VisitResult result = visitor.visit(node);
        if (result == null) {
            throw new FeedTreeWalkException(node, "visitor returned null for " + node);
        }
        switch (result.action()) {
            case CONTINUE:
                return result;
            case SKIP_SUBTREE:
                if (node.isFeed()) {
                    throw new FeedTreeWalkException(node, "skip-subtree returned for feed " + node.name() + " which has no subtree");
                }
                return result;
            case ABORT:
                throw new FeedTreeWalkException(node, result.reason());
            default:
                throw new IllegalStateException("Unhandled action " + result.action());
        }
    }
}
