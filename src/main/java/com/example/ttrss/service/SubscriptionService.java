package com.example.ttrss.service;

import com.example.ttrss.client.ApiErrorException;
import com.example.ttrss.client.ConnectionException;
import com.example.ttrss.client.DecodeException;
import com.example.ttrss.client.ProtocolViolationException;
import com.example.ttrss.client.RpcChannel;
import com.example.ttrss.model.SubscribeResult;
import com.example.ttrss.protocol.Operations;
import com.example.ttrss.protocol.ResponseEnvelope;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SubscriptionService {

    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionService.class);

    private final RpcChannel channel;

    public SubscriptionService(RpcChannel channel) {
        this.channel = channel;
    }

    /**
     * Subscribes to {@code feedUrl} in {@code categoryId}. Feed credentials are sent only when
     * {@code feedLogin} is non-empty.
     */
    public SubscribeResult subscribe(String feedUrl, int categoryId, String feedLogin, String feedPassword)
            throws ConnectionException, DecodeException, ApiErrorException, ProtocolViolationException {
        Objects.requireNonNull(feedUrl, "feedUrl");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(Operations.KEY_FEED_URL, feedUrl);
        params.put(Operations.KEY_CATEGORY_ID, categoryId);
        if (feedLogin != null && !feedLogin.isEmpty()) {
            params.put(Operations.KEY_FEED_LOGIN, feedLogin);
            params.put(Operations.KEY_PASSWORD, feedPassword == null ? "" : feedPassword);
        }

        ResponseEnvelope resp = channel.call(Operations.SUBSCRIBE_TO_FEED, params);
        if (resp.hasError()) {
            throw new ApiErrorException(Operations.SUBSCRIBE_TO_FEED, resp);
        }
        SubscribeResult result = SubscriptionDecoder.decode(resp.content());
        LOG.debug("Subscribe to {} in category {}: {}", feedUrl, categoryId, result.outcome().code());
        return result;
    }
}
