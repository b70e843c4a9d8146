package com.example.ttrss.protocol;

public final class Operations {
    public static final String LOGIN = "login";
    public static final String SUBSCRIBE_TO_FEED = "subscribeToFeed";
    public static final String GET_FEED_TREE = "getFeedTree";

    // Request keys
    public static final String KEY_OP = "op";
    public static final String KEY_SID = "sid";
    public static final String KEY_SEQ = "seq";
    public static final String KEY_USER = "user";
    public static final String KEY_PASSWORD = "password";
    public static final String KEY_FEED_URL = "feed_url";
    public static final String KEY_CATEGORY_ID = "category_id";
    public static final String KEY_FEED_LOGIN = "login";
    public static final String KEY_INCLUDE_EMPTY = "include_empty";

    // Response keys
    public static final String KEY_STATUS = "status";
    public static final String KEY_CONTENT = "content";
    public static final String KEY_ERROR = "error";
    public static final String KEY_SESSION_ID = "session_id";

    private Operations() {
    }
}
