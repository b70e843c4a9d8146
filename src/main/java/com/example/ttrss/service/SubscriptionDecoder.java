package com.example.ttrss.service;

import com.example.ttrss.client.ProtocolViolationException;
import com.example.ttrss.core.Settings;
import com.example.ttrss.model.SubscribeResult;
import com.example.ttrss.model.SubscriptionCode;
import com.example.ttrss.model.SubscriptionOutcome;
import com.example.ttrss.protocol.Operations;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.math.BigDecimal;

/**
 * Decodes the nested {@code status} object of a {@code subscribeToFeed} response.
 * The server reports every attempt as a successful call; the real outcome is
 * {@code content.status.code} with an optional {@code content.status.message}.
 */
public final class SubscriptionDecoder {

    private static final String KEY_CODE = "code";
    private static final String KEY_MESSAGE = "message";

    private SubscriptionDecoder() {
    }

    public static SubscribeResult decode(JsonObject content) throws ProtocolViolationException {
        JsonElement status = content == null ? null : content.get(Operations.KEY_STATUS);
        if (status == null || !status.isJsonObject()) {
            throw new ProtocolViolationException("subscribeToFeed: no subscription status object, have instead " + content);
        }
        JsonObject statusObj = status.getAsJsonObject();

        SubscriptionCode code = SubscriptionCode.fromWire(readCode(statusObj));

        JsonElement msg = statusObj.get(KEY_MESSAGE);
        String message = msg != null && msg.isJsonPrimitive() && msg.getAsJsonPrimitive().isString()
                ? msg.getAsString()
                : Settings.NO_SUBSCRIBE_MESSAGE;

        return new SubscribeResult(code.isSubscribed(), new SubscriptionOutcome(code, message));
    }

    private static int readCode(JsonObject statusObj) throws ProtocolViolationException {
        JsonElement code = statusObj.get(KEY_CODE);
        if (code == null || !code.isJsonPrimitive() || !code.getAsJsonPrimitive().isNumber()) {
            throw new ProtocolViolationException("subscribeToFeed: unknown subscription status " + statusObj);
        }
        long value;
        try {
            value = new BigDecimal(code.getAsString()).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ProtocolViolationException("subscribeToFeed: subscription code is not an integer: " + code);
        }
        if (!SubscriptionCode.isValidWireValue(value)) {
            throw new ProtocolViolationException("subscribeToFeed: subscription code out of range: " + value);
        }
        return (int) value;
    }
}
