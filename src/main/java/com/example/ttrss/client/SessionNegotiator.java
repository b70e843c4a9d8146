package com.example.ttrss.client;

import com.example.ttrss.protocol.ApiStatus;
import com.example.ttrss.protocol.Operations;
import com.example.ttrss.protocol.ResponseEnvelope;
import com.example.ttrss.util.Net;
import com.google.gson.JsonElement;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchanges credentials for a session id and installs it on the channel's session.
 */
public class SessionNegotiator {

    private static final Logger LOG = LoggerFactory.getLogger(SessionNegotiator.class);

    private final RpcChannel channel;

    public SessionNegotiator(RpcChannel channel) {
        this.channel = channel;
    }

    public boolean login(String hostUrl, String user, String password)
            throws ConnectionException, DecodeException, AuthException {
        URI endpoint = Net.apiEndpoint(hostUrl);
        Session session = channel.session();
        session.endpoint(endpoint);
        // a stale token must not ride along on the login call
        session.token("");
        LOG.info("Logging in as {} at {}", user, endpoint);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put(Operations.KEY_USER, user);
        params.put(Operations.KEY_PASSWORD, password);
        ResponseEnvelope resp = channel.call(Operations.LOGIN, params);

        JsonElement sessionId = resp.get(Operations.KEY_SESSION_ID);
        boolean isString = sessionId != null && sessionId.isJsonPrimitive() && sessionId.getAsJsonPrimitive().isString();
        if (!isString || resp.status() != ApiStatus.OK) {
            LOG.warn("Login as {} at {} rejected: {}", user, endpoint, resp.error());
            throw new AuthException(endpoint.toString(), user, resp.error());
        }

        session.token(sessionId.getAsString());
        LOG.info("Logged in as {}", user);
        return true;
    }
}
