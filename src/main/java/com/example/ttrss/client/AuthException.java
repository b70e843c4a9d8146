package com.example.ttrss.client;

public class AuthException extends TtrssException {

    private final String endpoint;
    private final String user;

    public AuthException(String endpoint, String user, String apiError) {
        super("failed to log in at " + endpoint + " as " + user + (apiError != null ? ": " + apiError : ""));
        this.endpoint = endpoint;
        this.user = user;
    }

    public String endpoint() {
        return endpoint;
    }

    public String user() {
        return user;
    }
}
