package com.archivist.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped MDC entries for a sync, import or reconcile run.
 *
 * <p>Closing the context puts back whatever the keys held before it was opened, so an
 * import nested in a reconcile leaves {@code operation=reconcile} behind it.</p>
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSync(plan.getId()).with("campaignId", plan.getCampaignId())) {
 *     log.info("sync.job.done type={} name='{}'", job.type(), job.name());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private static final String OPERATION = "operation";

    private final Deque<String[]> previous = new ArrayDeque<>();

    private LogContext() {
    }

    private static LogContext open(String operation, String idKey, String id) {
        LogContext ctx = new LogContext();
        ctx.put(idKey, id);
        ctx.put(OPERATION, operation);
        return ctx;
    }

    public static LogContext forSync(String planId) {
        return open("sync", "planId", planId);
    }

    public static LogContext forImport(String runId) {
        return open("import", "importRunId", runId);
    }

    public static LogContext forReconcile(String campaignId) {
        return open("reconcile", "campaignId", campaignId);
    }

    /**
     * Id for an importer or refresh run that has no natural identifier.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        previous.push(new String[]{key, MDC.get(key)});
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            String[] entry = previous.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
