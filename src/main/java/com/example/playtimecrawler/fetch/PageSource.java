package com.example.playtimecrawler.fetch;

@FunctionalInterface
public interface PageSource {
    /**
     * Fetches one page; never throws for per-page failures, only when interrupted.
     */
    FetchResult fetch(String url) throws InterruptedException;
}
