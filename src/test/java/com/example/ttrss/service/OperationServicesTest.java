package com.example.ttrss.service;

import com.example.ttrss.client.ApiErrorException;
import com.example.ttrss.client.RpcChannel;
import com.example.ttrss.client.Session;
import com.example.ttrss.model.FeedTreeNode;
import com.example.ttrss.model.SubscribeResult;
import com.example.ttrss.model.SubscriptionCode;
import com.example.ttrss.protocol.ApiStatus;
import com.example.ttrss.support.ScriptedTransport;
import com.google.gson.JsonObject;
import java.net.URI;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OperationServicesTest {

    private ScriptedTransport transport;
    private SubscriptionService subscriptions;
    private FeedTreeService feedTree;

    @Before
    public void setUp() {
        transport = new ScriptedTransport();
        Session session = new Session(URI.create("http://host/api/"));
        session.token("sid");
        RpcChannel channel = new RpcChannel(transport, session);
        subscriptions = new SubscriptionService(channel);
        feedTree = new FeedTreeService(channel);
    }

    @Test
    public void subscribeSendsFeedCredentialsOnlyWhenGiven() throws Exception {
        transport.reply("{\"status\":0,\"content\":{\"status\":{\"code\":1}}}");
        transport.reply("{\"status\":0,\"content\":{\"status\":{\"code\":0}}}");

        SubscribeResult added = subscriptions.subscribe("http://example.org/feed", 3, null, null);
        JsonObject first = transport.last().body;
        assertEquals("subscribeToFeed", first.get("op").getAsString());
        assertEquals("http://example.org/feed", first.get("feed_url").getAsString());
        assertEquals(3, first.get("category_id").getAsInt());
        assertFalse(first.has("login"));
        assertFalse(first.has("password"));
        assertEquals(SubscriptionCode.ADDED, added.outcome().code());

        SubscribeResult again = subscriptions.subscribe("http://example.org/private", 0, "reader", "pw");
        JsonObject second = transport.last().body;
        assertEquals("reader", second.get("login").getAsString());
        assertEquals("pw", second.get("password").getAsString());
        assertTrue(again.subscribed());
    }

    @Test
    public void subscribeRaisesEnvelopeErrors() throws Exception {
        transport.reply("{\"status\":1,\"content\":{\"error\":\"NOT_LOGGED_IN\"}}");
        try {
            subscriptions.subscribe("http://example.org/feed", 0, "", "");
            fail("expected ApiErrorException");
        } catch (ApiErrorException e) {
            assertEquals("NOT_LOGGED_IN", e.apiError());
            assertEquals(ApiStatus.ERROR, e.status());
            assertEquals("subscribeToFeed", e.operation());
        }
    }

    @Test
    public void fetchFeedTreeSendsIncludeEmptyAndDecodes() throws Exception {
        transport.reply("{\"seq\":0,\"status\":0,\"content\":" + FeedTreeDecoderTest.SAMPLE + "}");

        FeedTreeNode root = feedTree.fetchFeedTree(true);

        assertTrue(transport.last().body.get("include_empty").getAsBoolean());
        assertEquals("getFeedTree", transport.last().body.get("op").getAsString());
        assertEquals(3, root.children().size());
    }

    @Test(expected = ApiErrorException.class)
    public void fetchFeedTreeRaisesOnErrorStatus() throws Exception {
        transport.reply("{\"seq\":0,\"status\":1,\"content\":{}}");
        feedTree.fetchFeedTree(false);
    }
}
