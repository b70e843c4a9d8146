package com.example.ttrss.client;

import com.example.ttrss.protocol.ApiStatus;
import com.example.ttrss.protocol.ResponseEnvelope;

/**
 * Application-level error reported in a response envelope, raised by the operation wrappers.
 * {@link RpcChannel#call} itself returns such envelopes as data.
 */
public class ApiErrorException extends TtrssException {

    private final String operation;
    private final ApiStatus status;
    private final String apiError;

    public ApiErrorException(String operation, ResponseEnvelope envelope) {
        super(operation + ": API error: " + envelope.error());
        this.operation = operation;
        this.status = envelope.status();
        this.apiError = envelope.error();
    }

    public String operation() {
        return operation;
    }

    public ApiStatus status() {
        return status;
    }

    public String apiError() {
        return apiError;
    }
}
