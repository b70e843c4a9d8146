package com.example.ttrss;

import com.example.ttrss.client.ApiErrorException;
import com.example.ttrss.client.AuthException;
import com.example.ttrss.client.ConnectionException;
import com.example.ttrss.client.DecodeException;
import com.example.ttrss.client.ProtocolViolationException;
import com.example.ttrss.client.RpcChannel;
import com.example.ttrss.client.Session;
import com.example.ttrss.client.SessionNegotiator;
import com.example.ttrss.model.FeedTreeNode;
import com.example.ttrss.model.SubscribeResult;
import com.example.ttrss.service.FeedTreeService;
import com.example.ttrss.service.SubscriptionService;
import com.example.ttrss.transport.HttpTransport;
import com.example.ttrss.transport.JdkHttpTransport;

/**
 * One session against one feed service. Not safe for concurrent login; use one instance per session.
 */
public class FeedClient {

    private final RpcChannel channel;
    private final SessionNegotiator negotiator;
    private final SubscriptionService subscriptionService;
    private final FeedTreeService feedTreeService;

    public FeedClient() {
        this(new JdkHttpTransport());
    }

    public FeedClient(HttpTransport transport) {
        this.channel = new RpcChannel(transport, new Session());
        this.negotiator = new SessionNegotiator(channel);
        this.subscriptionService = new SubscriptionService(channel);
        this.feedTreeService = new FeedTreeService(channel);
    }

    public RpcChannel channel() {
        return channel;
    }

    public Session session() {
        return channel.session();
    }

    public boolean login(String hostUrl, String user, String password)
            throws ConnectionException, DecodeException, AuthException {
        return negotiator.login(hostUrl, user, password);
    }

    public SubscribeResult subscribe(String feedUrl, int categoryId)
            throws ConnectionException, DecodeException, ApiErrorException, ProtocolViolationException {
        return subscriptionService.subscribe(feedUrl, categoryId, null, null);
    }

    public SubscribeResult subscribe(String feedUrl, int categoryId, String feedLogin, String feedPassword)
            throws ConnectionException, DecodeException, ApiErrorException, ProtocolViolationException {
        return subscriptionService.subscribe(feedUrl, categoryId, feedLogin, feedPassword);
    }

    public FeedTreeNode fetchFeedTree(boolean includeEmptyCategories)
            throws ConnectionException, DecodeException, ApiErrorException, ProtocolViolationException {
        return feedTreeService.fetchFeedTree(includeEmptyCategories);
    }
}
