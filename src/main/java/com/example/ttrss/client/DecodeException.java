package com.example.ttrss.client;

/**
 * The server answered but the body is not an API response. Usually a wrong base URL.
 */
public class DecodeException extends TtrssException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
