package com.example.ttrss.util;

import com.example.ttrss.core.Settings;
import java.net.URI;
import java.net.URISyntaxException;

public final class Net {

    private Net() {
    }

    /**
     * Host URL with exactly one trailing {@code api/} segment, e.g. {@code http://host} and
     * {@code http://host/} both become {@code http://host/api/}.
     */
    public static URI apiEndpoint(String hostUrl) {
        if (hostUrl == null || hostUrl.isBlank()) {
            throw new IllegalArgumentException("Host URL is empty");
        }
        String url = hostUrl.trim();
        if (url.endsWith("/api")) url += "/";
        if (!url.endsWith("/" + Settings.API_PATH)) {
            if (!url.endsWith("/")) url += "/";
            url += Settings.API_PATH;
        }
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("Not an absolute http(s) URL: " + hostUrl);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid host URL: " + hostUrl, e);
        }
    }
}
