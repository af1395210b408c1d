package com.llmcat.core.source;

import com.llmcat.core.config.LlmcatProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * {@link UrlFetcher} on the JDK {@link HttpClient}. Redirects are followed and the
 * body is read fully into memory. No timeout is applied, so a stalled server
 * stalls the task.
 */
@Component
public class HttpUrlFetcher implements UrlFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpUrlFetcher.class);

    private final HttpClient client;
    private final String userAgent;

    @Autowired
    public HttpUrlFetcher(LlmcatProperties properties) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                properties.getFetch().getUserAgent());
    }

    HttpUrlFetcher(HttpClient client, String userAgent) {
        this.client = client;
        this.userAgent = userAgent;
    }

    @Override
    public byte[] fetch(String url) throws IOException, InterruptedException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("User-Agent", userAgent)
                .GET()
                .build();

        HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        int status = response.statusCode();
        log.debug("GET {} -> {}", url, status);
        if (status < 200 || status > 299) {
            throw new FetchFailedException(url, status);
        }
        return response.body();
    }
}
