package com.example.ttrss.client;

/**
 * Base of every failure raised while talking to the feed service.
 */
public class TtrssException extends Exception {

    public TtrssException(String message) {
        super(message);
    }

    public TtrssException(String message, Throwable cause) {
        super(message, cause);
    }
}
