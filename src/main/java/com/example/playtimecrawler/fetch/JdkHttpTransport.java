package com.example.playtimecrawler.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link PageTransport} on the JDK HTTP client, sending the headers a desktop browser would.
 */
public final class JdkHttpTransport implements PageTransport {
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String userAgent;

    public JdkHttpTransport(Duration requestTimeout, String userAgent) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;
    }

    @Override
    public TransportResponse get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new TransportResponse(response.statusCode(), response.body());
    }
}
