package com.phonetic.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forEncoding("beider-morse")) {
 *     log.debug("encoded input={} code={}", input, code);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a single encode call.
     */
    public static LogContext forEncoding(String algorithm) {
        LogContext ctx = new LogContext();
        ctx.put("algorithm", algorithm);
        ctx.put("operation", "encode");
        return ctx;
    }

    /**
     * Context for loading rule resources.
     */
    public static LogContext forConfigLoad(String source) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("ruleSource", source);
        ctx.put("operation", "config-load");
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
