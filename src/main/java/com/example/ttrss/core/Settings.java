package com.example.ttrss.core;

public final class Settings {
    // Appended to the host URL to form the API endpoint
    public static final String API_PATH = "api/";
    public static final String JSON_CONTENT_TYPE = "application/json";

    // HTTP timeouts
    public static final long CONNECT_TIMEOUT_MS = 10000; // 10 seconds
    public static final long REQUEST_TIMEOUT_MS = 60000; // 1 minute

    // Placeholder texts
    public static final String NO_ERROR_TEXT = "(response contained no error text)";
    public static final String NO_SUBSCRIBE_MESSAGE = "(no underlying error returned by API)";

    // Feed tree
    public static final String ROOT_NODE_NAME = "/";
    public static final int ROOT_NODE_ID = Integer.MIN_VALUE;

    // CLI
    public static final String PASSWORD_ENV = "TTRSS_PASSWORD";

    private Settings() {
    }
}
