package com.example.ttrss.transport;

import com.example.ttrss.core.Settings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HttpTransport} on top of the JDK {@link HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofMillis(Settings.CONNECT_TIMEOUT_MS))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                Duration.ofMillis(Settings.REQUEST_TIMEOUT_MS));
    }

    public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public HttpReply post(URI endpoint, String contentType, byte[] body) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", contentType)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            return new HttpReply(response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ioe = new InterruptedIOException("Interrupted while waiting for " + endpoint);
            ioe.initCause(e);
            throw ioe;
        } catch (IllegalArgumentException e) {
            throw new IOException("Cannot send to " + endpoint + ": " + e.getMessage(), e);
        }
    }
}
