package com.record.linkage.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forMatching(runId, "LEVENSHTEIN", "people.csv", "STREET")) {
 *     log.info("matching.completed queries={} failures={}", queries, failures);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one matching run.
     */
    public static LogContext forMatching(String runId, String algorithm, String source, String column) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("algorithm", algorithm);
        ctx.put("source", source);
        ctx.put("column", column);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Creates a log context for evaluating one dataset.
     */
    public static LogContext forEvaluation(String dataset) {
        LogContext ctx = new LogContext();
        ctx.put("dataset", dataset);
        ctx.put("operation", "evaluate");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
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
