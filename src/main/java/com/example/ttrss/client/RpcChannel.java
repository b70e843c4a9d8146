package com.example.ttrss.client;

import com.example.ttrss.core.Settings;
import com.example.ttrss.protocol.Operations;
import com.example.ttrss.protocol.ResponseEnvelope;
import com.example.ttrss.transport.HttpReply;
import com.example.ttrss.transport.HttpTransport;
import com.example.ttrss.transport.JsonWire;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an operation name and its parameters into one {@link ResponseEnvelope}.
 *
 * <p>The operation name and, once logged in, the session id are added to every request.
 * Application errors come back inside the envelope; only transport and decode failures throw.
 */
public class RpcChannel {

    private static final Logger LOG = LoggerFactory.getLogger(RpcChannel.class);

    private final HttpTransport transport;
    private final Session session;

    public RpcChannel(HttpTransport transport, Session session) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.session = Objects.requireNonNull(session, "session");
    }

    public Session session() {
        return session;
    }

    public ResponseEnvelope call(String operation) throws ConnectionException, DecodeException {
        return call(operation, Collections.emptyMap());
    }

    public ResponseEnvelope call(String operation, Map<String, ?> parameters) throws ConnectionException, DecodeException {
        Objects.requireNonNull(operation, "operation");
        URI endpoint = session.endpoint();
        if (endpoint == null) {
            throw new IllegalStateException("No endpoint set; log in first");
        }

        JsonObject request = JsonWire.toRequest(parameters);
        request.addProperty(Operations.KEY_OP, operation);
        String token = session.token();
        if (!token.isEmpty()) {
            request.addProperty(Operations.KEY_SID, token);
        }
        LOG.debug("Issuing call {} to {}", operation, endpoint);

        ResponseEnvelope envelope;
        try (HttpReply reply = transport.post(endpoint, Settings.JSON_CONTENT_TYPE, JsonWire.encode(request))) {
            LOG.debug("{} answered HTTP {}", operation, reply.statusCode());
            envelope = JsonWire.readResponse(reply.body());
        } catch (JsonWire.MalformedBodyException e) {
            throw new DecodeException("API JSON response was malformed (" + e.getMessage()
                    + ") - are you sure you supplied the correct URL? " + endpoint, e);
        } catch (IOException e) {
            throw new ConnectionException("connection error: " + e.getMessage(), e);
        }

        LOG.debug("{} status: {}", operation, envelope.status());
        return envelope;
    }
}
