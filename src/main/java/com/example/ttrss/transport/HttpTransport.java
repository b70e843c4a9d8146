package com.example.ttrss.transport;

import java.io.IOException;
import java.net.URI;

/**
 * Blocking request/response primitive the channel sends through.
 */
public interface HttpTransport {

    /**
     * POSTs {@code body} to {@code endpoint}. The caller closes the returned reply.
     *
     * @throws IOException on any transport failure (refused, timeout, TLS, interrupted)
     */
    HttpReply post(URI endpoint, String contentType, byte[] body) throws IOException;
}
