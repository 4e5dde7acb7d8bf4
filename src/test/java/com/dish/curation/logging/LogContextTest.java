package com.dish.curation.logging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @Test
    @DisplayName("Should put rank change keys in the MDC and remove them on close")
    void testRankChangeContext() {
        try (LogContext ctx = LogContext.forRankChange("corr-1", "DISH", 42).with("scope", "dish:1:main")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("42", MDC.get("itemId"));
            assertEquals("rank", MDC.get("operation"));
            assertEquals("dish:1:main", MDC.get("scope"));
        }

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("scope"));
    }

    @Test
    @DisplayName("Should tag link and bulk link operations")
    void testLinkContexts() {
        try (LogContext ctx = LogContext.forLink(3, 4)) {
            assertEquals("3", MDC.get("dishId"));
            assertEquals("link", MDC.get("operation"));
        }
        try (LogContext ctx = LogContext.forBulkLink("batch-9")) {
            assertEquals("batch-9", MDC.get("batchId"));
            assertEquals("bulkLink", MDC.get("operation"));
        }

        assertNull(MDC.get("operation"));
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
