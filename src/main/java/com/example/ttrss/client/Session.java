package com.example.ttrss.client;

import java.net.URI;

/**
 * Endpoint and session token shared by one channel. One logical session per instance;
 * callers serialize login against concurrent calls.
 */
public final class Session {

    private volatile URI endpoint;
    private volatile String token = "";

    public Session() {
    }

    public Session(URI endpoint) {
        this.endpoint = endpoint;
    }

    public URI endpoint() {
        return endpoint;
    }

    public void endpoint(URI endpoint) {
        this.endpoint = endpoint;
    }

    public String token() {
        return token;
    }

    public void token(String token) {
        this.token = token == null ? "" : token;
    }

    public boolean isLoggedIn() {
        return !token.isEmpty();
    }

    @Override
    public String toString() {
        return "Session{endpoint=" + endpoint + ", loggedIn=" + isLoggedIn() + "}";
    }
}
