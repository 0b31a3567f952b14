package com.lead.discovery.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC. Keys added through this context
 * are removed again when it is closed.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMatching(correlationId, leadId)) {
 *     log.info("matching.completed leadId={} matches={}", leadId, count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forMerge(String correlationId, String sourceProfileId, String targetProfileId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sourceProfileId", sourceProfileId);
        ctx.put("targetProfileId", targetProfileId);
        ctx.put("operation", "merge");
        return ctx;
    }

    public static LogContext forMatching(String correlationId, String leadId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("leadId", leadId);
        ctx.put("operation", "match");
        return ctx;
    }

    public static LogContext forRanking(String correlationId, String serviceId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("serviceId", serviceId);
        ctx.put("operation", "rank");
        return ctx;
    }

    public static LogContext forDiscovery(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "discover");
        return ctx;
    }

    public static LogContext forAlert(String alertType, String leadId) {
        LogContext ctx = new LogContext();
        ctx.put("alertType", alertType);
        ctx.put("leadId", leadId != null ? leadId : "none");
        ctx.put("operation", "alert");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

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
