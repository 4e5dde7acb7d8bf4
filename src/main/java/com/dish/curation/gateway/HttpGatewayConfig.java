package com.dish.curation.gateway;

import java.time.Duration;
import java.util.Objects;

/**
 * Endpoints and timeout for {@link HttpDataGateway}.
 *
 * @param publicBaseUrl base URL of the read-only API, e.g. {@code http://localhost:3001}
 * @param adminBaseUrl  base URL of the admin API, e.g. {@code http://localhost:3002}
 * @param timeout       per-request timeout
 */
public record HttpGatewayConfig(String publicBaseUrl, String adminBaseUrl, Duration timeout) {

    public HttpGatewayConfig {
        publicBaseUrl = stripTrailingSlashes(Objects.requireNonNull(publicBaseUrl, "publicBaseUrl is required"));
        adminBaseUrl = stripTrailingSlashes(Objects.requireNonNull(adminBaseUrl, "adminBaseUrl is required"));
        timeout = timeout != null ? timeout : Duration.ofSeconds(10);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * Local development defaults: public API on port 3001, admin API on port 3002.
     */
    public static HttpGatewayConfig localDefaults() {
        return new HttpGatewayConfig("http://localhost:3001", "http://localhost:3002", Duration.ofSeconds(10));
    }

    private static String stripTrailingSlashes(String url) {
        return url.replaceAll("/+$", "");
    }
}
