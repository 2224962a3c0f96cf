package com.campaign.canon.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and restores the previous values on close,
 * so contexts can be nested.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId, campaignId, sessionId)) {
 *     log.info("run.started key={}", key.digest());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forCorrection(String campaignId, String correctionId) {
        LogContext ctx = new LogContext();
        ctx.put("campaignId", campaignId);
        ctx.put("correctionId", correctionId);
        ctx.put("operation", "correction");
        return ctx;
    }

    public static LogContext forRun(String runId, String campaignId, String sessionId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("campaignId", campaignId);
        ctx.put("sessionId", sessionId);
        ctx.put("operation", "run");
        return ctx;
    }

    public static LogContext forSession(String campaignId, String sessionId) {
        LogContext ctx = new LogContext();
        ctx.put("campaignId", campaignId);
        ctx.put("sessionId", sessionId);
        return ctx;
    }

    /**
     * Stage context, meant to be nested inside {@link #forRun}.
     */
    public static LogContext forStage(String stage) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stage);
        return ctx;
    }

    public static LogContext forResolution(String campaignId, String runId) {
        LogContext ctx = new LogContext();
        ctx.put("campaignId", campaignId);
        if (runId != null) {
            ctx.put("runId", runId);
        }
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Adds another key-value pair to this context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        // Restore what an enclosing context had set.
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
