package com.example.playtimecrawler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public class ConfigLoader {
    static final String UNBOUNDED_COUNT = "*";

    private static final long DEFAULT_COUNT = 1000L;
    private static final int DEFAULT_CONCURRENCY = 8;
    private static final int DEFAULT_MISS_THRESHOLD = 400;
    private static final int DEFAULT_QUEUE_CAPACITY_FACTOR = 8;
    private static final String DEFAULT_CSV_PATH = "hltb_dataset.csv";
    private static final String DEFAULT_LOG_PATH = "hltb.log";
    private static final String DEFAULT_URL_TEMPLATE = "https://howlongtobeat.com/game/{id}";
    private static final int DEFAULT_MAX_ATTEMPTS = 5;
    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(600);
    private static final double DEFAULT_BACKOFF_MULTIPLIER = 1.7;
    private static final Duration DEFAULT_BACKOFF_JITTER = Duration.ofMillis(400);
    private static final Duration DEFAULT_POLITENESS_DELAY = Duration.ofMillis(250);
    private static final Duration DEFAULT_POLITENESS_JITTER = Duration.ofMillis(350);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/126.0.0.0 Safari/537.36";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CrawlerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        return toConfig(raw == null ? new RawConfig() : raw);
    }

    /**
     * Configuration with every default applied.
     */
    public CrawlerConfig defaults() {
        return toConfig(new RawConfig());
    }

    private CrawlerConfig toConfig(RawConfig raw) {
        Optional<Long> count = parseCount(raw.count);
        Optional<Long> startId = Optional.ofNullable(raw.start);
        if (startId.isPresent() && startId.get() < 1) {
            throw new IllegalArgumentException("start must be a positive identifier, got " + raw.start);
        }
        int concurrency = positive(raw.concurrency, DEFAULT_CONCURRENCY, "concurrency");
        int missThreshold = positive(raw.missThreshold, DEFAULT_MISS_THRESHOLD, "missThreshold");
        int queueCapacityFactor = positive(raw.queueCapacityFactor, DEFAULT_QUEUE_CAPACITY_FACTOR, "queueCapacityFactor");

        String urlTemplate = optionalString(raw.urlTemplate, DEFAULT_URL_TEMPLATE);
        if (!urlTemplate.contains(CrawlerConfig.ID_PLACEHOLDER)) {
            throw new IllegalArgumentException("urlTemplate must contain " + CrawlerConfig.ID_PLACEHOLDER);
        }
        Path csvPath = Path.of(optionalString(raw.csvPath, DEFAULT_CSV_PATH));
        Path logPath = Path.of(optionalString(raw.logPath, DEFAULT_LOG_PATH));

        double multiplier = raw.backoffMultiplier == null ? DEFAULT_BACKOFF_MULTIPLIER : raw.backoffMultiplier;
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0, got " + multiplier);
        }
        FetchSettings fetch = new FetchSettings(
                positive(raw.maxAttempts, DEFAULT_MAX_ATTEMPTS, "maxAttempts"),
                nonNegative(raw.initialBackoff, DEFAULT_INITIAL_BACKOFF, "initialBackoff"),
                multiplier,
                nonNegative(raw.backoffJitter, DEFAULT_BACKOFF_JITTER, "backoffJitter"),
                nonNegative(raw.politenessDelay, DEFAULT_POLITENESS_DELAY, "politenessDelay"),
                nonNegative(raw.politenessJitter, DEFAULT_POLITENESS_JITTER, "politenessJitter"),
                nonNegative(raw.requestTimeout, DEFAULT_REQUEST_TIMEOUT, "requestTimeout"),
                optionalString(raw.userAgent, DEFAULT_USER_AGENT)
        );

        return new CrawlerConfig(
                urlTemplate,
                count,
                startId,
                concurrency,
                missThreshold,
                queueCapacityFactor,
                csvPath,
                logPath,
                fetch
        );
    }

    /**
     * A finite identifier count, or empty for {@code "*"} (unbounded mode).
     */
    static Optional<Long> parseCount(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(DEFAULT_COUNT);
        }
        String value = raw.strip();
        if (value.equals(UNBOUNDED_COUNT)) {
            return Optional.empty();
        }
        long count;
        try {
            count = Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("count must be a non-negative integer or \"*\", got \"" + raw + "\"", ex);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be a non-negative integer or \"*\", got " + count);
        }
        return Optional.of(count);
    }

    private int positive(Integer value, int fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1, got " + value);
        }
        return value;
    }

    private Duration nonNegative(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
        return value;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String count;
        public Long start;
        public Integer concurrency;
        public Integer missThreshold;
        public Integer queueCapacityFactor;
        public String csvPath;
        public String logPath;
        public String urlTemplate;
        public Integer maxAttempts;
        public Duration initialBackoff;
        public Double backoffMultiplier;
        public Duration backoffJitter;
        public Duration politenessDelay;
        public Duration politenessJitter;
        public Duration requestTimeout;
        public String userAgent;
    }
}
