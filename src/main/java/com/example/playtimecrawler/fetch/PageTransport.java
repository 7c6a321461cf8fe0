package com.example.playtimecrawler.fetch;

import java.io.IOException;

/**
 * Single HTTP GET against the catalog. Timeouts surface as
 * {@link java.net.http.HttpTimeoutException} (an {@link IOException}).
 */
@FunctionalInterface
public interface PageTransport {
    TransportResponse get(String url) throws IOException, InterruptedException;
}
