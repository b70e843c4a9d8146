package com.example.ttrss.client;

/**
 * A response did not have the shape an operation expects.
 */
public class ProtocolViolationException extends TtrssException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
