package com.campaign.canon.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set run, campaign, session and operation")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1", "strahd", "session-07")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("strahd", MDC.get("campaignId"));
            assertEquals("session-07", MDC.get("sessionId"));
            assertEquals("run", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forCorrection should set campaign and correction ids")
    void forCorrectionSetsMDC() {
        try (LogContext ctx = LogContext.forCorrection("strahd", "corr-9")) {
            assertEquals("corr-9", MDC.get("correctionId"));
            assertEquals("correction", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forResolution should omit a missing run id")
    void forResolutionWithoutRun() {
        try (LogContext ctx = LogContext.forResolution("strahd", null)) {
            assertEquals("resolve", MDC.get("operation"));
            assertNull(MDC.get("runId"));
        }
    }

    @Test
    @DisplayName("with() should add keys that are removed on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forSession("strahd", "session-07").with("attempt", "2")) {
            assertEquals("2", MDC.get("attempt"));
        }
        assertNull(MDC.get("attempt"));
        assertNull(MDC.get("sessionId"));
    }

    @Test
    @DisplayName("Closing a nested context should restore the outer values")
    void nestedContextsRestore() {
        try (LogContext run = LogContext.forRun("run-1", "strahd", "session-07")) {
            try (LogContext stage = LogContext.forStage("extract")) {
                assertEquals("extract", MDC.get("stage"));
                assertEquals("run-1", MDC.get("runId"));
            }
            assertNull(MDC.get("stage"));

            try (LogContext resolve = LogContext.forResolution("strahd", "run-1")) {
                assertEquals("resolve", MDC.get("operation"));
            }
            assertEquals("run", MDC.get("operation"));
        }
        assertNull(MDC.get("campaignId"));
    }
}
