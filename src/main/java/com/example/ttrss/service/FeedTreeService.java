package com.example.ttrss.service;

import com.example.ttrss.client.ApiErrorException;
import com.example.ttrss.client.ConnectionException;
import com.example.ttrss.client.DecodeException;
import com.example.ttrss.client.ProtocolViolationException;
import com.example.ttrss.client.RpcChannel;
import com.example.ttrss.model.FeedTreeNode;
import com.example.ttrss.protocol.Operations;
import com.example.ttrss.protocol.ResponseEnvelope;
import java.util.Map;

public class FeedTreeService {

    private final RpcChannel channel;

    public FeedTreeService(RpcChannel channel) {
        this.channel = channel;
    }

    public FeedTreeNode fetchFeedTree(boolean includeEmptyCategories)
            throws ConnectionException, DecodeException, ApiErrorException, ProtocolViolationException {
        ResponseEnvelope resp = channel.call(Operations.GET_FEED_TREE,
                Map.of(Operations.KEY_INCLUDE_EMPTY, includeEmptyCategories));
        if (!resp.isOk()) {
            throw new ApiErrorException(Operations.GET_FEED_TREE, resp);
        }
        return FeedTreeDecoder.decode(resp.content());
    }
}
