package com.example.ttrss.client;

import com.example.ttrss.core.Settings;
import com.example.ttrss.protocol.ApiStatus;
import com.example.ttrss.protocol.ResponseEnvelope;
import com.example.ttrss.support.ScriptedTransport;
import com.example.ttrss.transport.HttpReply;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RpcChannelTest {

    private static final URI ENDPOINT = URI.create("http://host/api/");

    private ScriptedTransport transport;
    private Session session;
    private RpcChannel channel;

    @Before
    public void setUp() {
        transport = new ScriptedTransport();
        session = new Session(ENDPOINT);
        channel = new RpcChannel(transport, session);
    }

    @Test
    public void addsOperationAndOmitsSidBeforeLogin() throws Exception {
        transport.reply("{\"seq\":0,\"status\":0,\"content\":{\"version\":\"21.0\"}}");

        ResponseEnvelope env = channel.call("getVersion");

        ScriptedTransport.Sent sent = transport.last();
        assertEquals(ENDPOINT, sent.endpoint);
        assertEquals(Settings.JSON_CONTENT_TYPE, sent.contentType);
        assertEquals("getVersion", sent.body.get("op").getAsString());
        assertFalse(sent.body.has("sid"));
        assertTrue(env.isOk());
        assertEquals("21.0", env.get("version").getAsString());
    }

    @Test
    public void injectsTokenAfterLogin() throws Exception {
        session.token("abc123");
        transport.reply("{\"seq\":5,\"status\":0,\"content\":{}}");

        Map<String, Object> params = new HashMap<>();
        params.put("seq", 5);
        params.put("include_empty", false);
        ResponseEnvelope env = channel.call("getFeedTree", params);

        ScriptedTransport.Sent sent = transport.last();
        assertEquals("abc123", sent.body.get("sid").getAsString());
        assertEquals("getFeedTree", sent.body.get("op").getAsString());
        assertFalse(sent.body.get("include_empty").getAsBoolean());
        assertEquals(Integer.valueOf(5), env.sequence());
        assertFalse("caller's map is left alone", params.containsKey("op"));
    }

    @Test
    public void applicationErrorIsReturnedNotThrown() throws Exception {
        transport.reply("{\"seq\":0,\"status\":1,\"content\":{\"error\":\"NOT_LOGGED_IN\"}}");

        ResponseEnvelope env = channel.call("getFeedTree");

        assertEquals(ApiStatus.ERROR, env.status());
        assertEquals("NOT_LOGGED_IN", env.error());
    }

    @Test
    public void errorStatusWithoutTextGetsPlaceholder() throws Exception {
        transport.reply("{\"seq\":0,\"status\":1}");
        assertEquals(Settings.NO_ERROR_TEXT, channel.call("logout").error());
    }

    @Test
    public void okWithoutErrorKeyHasNullError() throws Exception {
        transport.reply("{\"seq\":0,\"status\":0,\"content\":{\"status\":\"OK\"}}");
        assertNull(channel.call("logout").error());
    }

    @Test
    public void transportFailureBecomesConnectionException() throws Exception {
        ConnectException refused = new ConnectException("Connection refused");
        transport.fail(refused);
        try {
            channel.call("login");
            fail("expected ConnectionException");
        } catch (ConnectionException e) {
            assertSame(refused, e.getCause());
            assertTrue(e.getMessage().contains("Connection refused"));
        }
    }

    @Test
    public void htmlBodyBecomesDecodeException() throws Exception {
        transport.reply("<!DOCTYPE html><html><body>Tiny Tiny RSS</body></html>");
        try {
            channel.call("login");
            fail("expected DecodeException");
        } catch (DecodeException e) {
            assertTrue(e.getMessage().contains("malformed"));
            assertTrue(e.getMessage().contains("correct URL"));
        }
    }

    @Test
    public void truncatedOrBrokenBodiesAreDecodeExceptions() throws Exception {
        String[] bodies = {"{\"seq\":0,", "{\"seq\" 0}", "{\"seq\":0,\"content\":{\"error\":\"unterminated"};
        for (String body : bodies) {
            transport.reply(body);
            try {
                channel.call("login");
                fail("expected DecodeException for " + body);
            } catch (DecodeException e) {
                assertTrue(e.getMessage().contains("correct URL"));
            }
        }
    }

    @Test
    public void bodyReadFailureIsConnectionException() throws Exception {
        IOException reset = new IOException("connection reset");
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw reset;
            }
        };
        RpcChannel resetting = new RpcChannel((endpoint, type, body) -> new HttpReply(200, failing), session);
        try {
            resetting.call("login");
            fail("expected ConnectionException");
        } catch (ConnectionException e) {
            assertSame(reset, e.getCause());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void requiresEndpoint() throws Exception {
        new RpcChannel(transport, new Session()).call("login");
    }

    @Test
    public void readFailureMidBodyIsConnectionException() throws Exception {
        RpcChannel broken = new RpcChannel((endpoint, type, body) -> {
            throw new IOException("reset by peer");
        }, session);
        try {
            broken.call("login");
            fail("expected ConnectionException");
        } catch (ConnectionException e) {
            assertTrue(e.getMessage().contains("reset by peer"));
        }
    }
}
