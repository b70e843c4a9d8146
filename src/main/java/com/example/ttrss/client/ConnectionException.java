package com.example.ttrss.client;

import java.io.IOException;

/**
 * The HTTP exchange itself failed. Never retried here.
 */
public class ConnectionException extends TtrssException {

    public ConnectionException(String message, IOException cause) {
        super(message, cause);
    }
}
