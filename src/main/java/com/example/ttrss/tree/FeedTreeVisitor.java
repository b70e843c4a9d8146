package com.example.ttrss.tree;

import com.example.ttrss.model.FeedTreeNode;

@FunctionalInterface
public interface FeedTreeVisitor {
    VisitResult visit(FeedTreeNode node);
}
