package com.dish.curation.config;

import com.dish.curation.cache.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Options for the curation components.
 *
 * <p>Properties understood by {@link #fromProperties(Properties)}:</p>
 * <ul>
 *   <li>{@code curation.bulk-link.concurrency} (default 8)</li>
 *   <li>{@code curation.bulk-link.timeout-ms} (default 30000)</li>
 *   <li>{@code curation.search.debounce-ms} (default 400)</li>
 *   <li>{@code curation.cache.enabled}, {@code curation.cache.max-size}, {@code curation.cache.ttl-seconds}</li>
 * </ul>
 */
public class CurationOptions {
    private static final Logger log = LoggerFactory.getLogger(CurationOptions.class);

    public static final String RESOURCE_NAME = "curation.properties";

    private static final int DEFAULT_BULK_LINK_CONCURRENCY = 8;
    private static final Duration DEFAULT_BULK_LINK_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_DEBOUNCE_DELAY = Duration.ofMillis(400);

    private final int bulkLinkConcurrency;
    private final Duration bulkLinkTimeout;
    private final Duration debounceDelay;
    private final CacheConfig cacheConfig;

    private CurationOptions(Builder builder) {
        this.bulkLinkConcurrency = builder.bulkLinkConcurrency;
        this.bulkLinkTimeout = builder.bulkLinkTimeout;
        this.debounceDelay = builder.debounceDelay;
        this.cacheConfig = builder.cacheConfig;
    }

    public int getBulkLinkConcurrency() {
        return bulkLinkConcurrency;
    }

    public Duration getBulkLinkTimeout() {
        return bulkLinkTimeout;
    }

    public Duration getDebounceDelay() {
        return debounceDelay;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static CurationOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from {@code curation.properties} on the classpath, or returns the
     * defaults when the resource is absent.
     */
    public static CurationOptions load() {
        try (InputStream in = CurationOptions.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE_NAME);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE_NAME, e);
        }
    }

    public static CurationOptions fromProperties(Properties properties) {
        Builder builder = builder();
        builder.bulkLinkConcurrency(intProperty(properties, "curation.bulk-link.concurrency",
                DEFAULT_BULK_LINK_CONCURRENCY));
        builder.bulkLinkTimeout(Duration.ofMillis(intProperty(properties, "curation.bulk-link.timeout-ms",
                (int) DEFAULT_BULK_LINK_TIMEOUT.toMillis())));
        builder.debounceDelay(Duration.ofMillis(intProperty(properties, "curation.search.debounce-ms",
                (int) DEFAULT_DEBOUNCE_DELAY.toMillis())));

        CacheConfig cacheDefaults = CacheConfig.defaults();
        boolean cacheEnabled = Boolean.parseBoolean(
                properties.getProperty("curation.cache.enabled", String.valueOf(cacheDefaults.enabled())).trim());
        builder.cacheConfig(new CacheConfig(
                intProperty(properties, "curation.cache.max-size", cacheDefaults.maxSize()),
                intProperty(properties, "curation.cache.ttl-seconds", cacheDefaults.ttlSeconds()),
                cacheEnabled));
        CurationOptions options = builder.build();
        log.info("Curation options loaded: bulkLinkConcurrency={}, debounce={}ms, cache={}",
                options.bulkLinkConcurrency, options.debounceDelay.toMillis(),
                options.cacheConfig);
        return options;
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer, got '" + raw + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int bulkLinkConcurrency = DEFAULT_BULK_LINK_CONCURRENCY;
        private Duration bulkLinkTimeout = DEFAULT_BULK_LINK_TIMEOUT;
        private Duration debounceDelay = DEFAULT_DEBOUNCE_DELAY;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder bulkLinkConcurrency(int bulkLinkConcurrency) {
            this.bulkLinkConcurrency = bulkLinkConcurrency;
            return this;
        }

        public Builder bulkLinkTimeout(Duration bulkLinkTimeout) {
            this.bulkLinkTimeout = bulkLinkTimeout;
            return this;
        }

        public Builder debounceDelay(Duration debounceDelay) {
            this.debounceDelay = debounceDelay;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public CurationOptions build() {
            if (bulkLinkConcurrency < 1) {
                throw new IllegalArgumentException("bulkLinkConcurrency must be >= 1");
            }
            if (bulkLinkTimeout == null || bulkLinkTimeout.isNegative() || bulkLinkTimeout.isZero()) {
                throw new IllegalArgumentException("bulkLinkTimeout must be > 0");
            }
            if (debounceDelay == null || debounceDelay.isNegative()) {
                throw new IllegalArgumentException("debounceDelay must be >= 0");
            }
            if (cacheConfig == null) {
                cacheConfig = CacheConfig.disabled();
            }
            return new CurationOptions(this);
        }
    }
}
