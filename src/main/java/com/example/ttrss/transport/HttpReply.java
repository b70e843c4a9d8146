package com.example.ttrss.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

public final class HttpReply implements Closeable {

    private final int statusCode;
    private final InputStream body;

    public HttpReply(int statusCode, InputStream body) {
        this.statusCode = statusCode;
        this.body = Objects.requireNonNull(body, "body");
    }

    public int statusCode() {
        return statusCode;
    }

    public InputStream body() {
        return body;
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
