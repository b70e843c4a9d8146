package com.example.ttrss.protocol;

/**
 * Ids the server reserves for virtual categories and feeds.
 */
public final class PredefinedIds {

    // Categories
    public static final int CATEGORY_UNCATEGORIZED = 0;
    public static final int CATEGORY_SPECIAL = -1;
    public static final int CATEGORY_LABELS = -2;
    public static final int CATEGORY_FEEDS_NOT_VIRTUAL = -3;
    public static final int CATEGORY_FEEDS_ALL = -4;

    // Feeds
    public static final int FEED_ARCHIVED_ARTICLES = 0;
    public static final int FEED_STARRED_ARTICLES = -1;
    public static final int FEED_PUBLISHED_ARTICLES = -2;
    public static final int FEED_FRESH_ARTICLES = -3;
    public static final int FEED_ALL_ARTICLES = -4;
    public static final int FEED_RECENTLY_READ = -6;

    // Plugin feeds count down from here, label feeds from LABEL_BASE_INDEX (server defaults)
    public static final int PLUGIN_FEED_BASE_INDEX = -128;
    public static final int LABEL_BASE_INDEX = -1024;

    private PredefinedIds() {
    }
}
