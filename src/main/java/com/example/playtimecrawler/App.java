package com.example.playtimecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

public final class App {
    static final String LOG_FILE_PROPERTY = "playtime.log.file";
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private App() {
    }

    public static void main(String[] args) {
        // No logger before the config is read: the log file location comes from it.
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            System.err.println("Usage: java -jar playtime-crawler.jar <config.json>");
            System.exit(1);
        }
        CrawlerConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
        } catch (IOException | IllegalArgumentException ex) {
            System.err.println("Invalid configuration " + args[0] + ": " + ex.getMessage());
            System.exit(1);
            return;
        }

        // Logback reads the log path when the first logger is created.
        System.setProperty(LOG_FILE_PROPERTY, config.logPath().toString());
        Logger logger = LoggerFactory.getLogger(App.class);

        CrawlerEngine engine = new CrawlerEngine(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            engine.requestStop();
            try {
                if (!engine.awaitCompletion(SHUTDOWN_GRACE)) {
                    logger.warn("Crawl did not drain within {}", SHUTDOWN_GRACE);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "crawl-shutdown"));

        try {
            engine.run();
        } catch (IOException ex) {
            logger.error("Crawl failed", ex);
            System.exit(1);
        }
    }
}
