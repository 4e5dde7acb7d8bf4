package com.dish.curation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRankChange(correlationId, "DISH", 42)) {
 *     log.info("rank.assigned itemId={} rank={}", 42, 1);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRankChange(String correlationId, String kind, long itemId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("itemKind", kind);
        ctx.put("itemId", String.valueOf(itemId));
        ctx.put("operation", "rank");
        return ctx;
    }

    public static LogContext forLink(long dishId, long restaurantId) {
        LogContext ctx = new LogContext();
        ctx.put("dishId", String.valueOf(dishId));
        ctx.put("restaurantId", String.valueOf(restaurantId));
        ctx.put("operation", "link");
        return ctx;
    }

    public static LogContext forBulkLink(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "bulkLink");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
