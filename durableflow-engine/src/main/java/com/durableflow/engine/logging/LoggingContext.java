package com.durableflow.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forActivity(workflowId, runId, activityId, attempt)) {
 *     log.info("Running activity"); // Automatically includes workflowId, runId, activityId, attempt
 * }
 * </pre>
 *
 * Contexts nest: closing one restores whatever values the enclosing scope had set.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String RUN_ID = "runId";
    public static final String ACTIVITY_ID = "activityId";
    public static final String ATTEMPT = "attempt";
    public static final String TASK_ID = "taskId";
    public static final String WORKER_ID = "workerId";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for run-level operations.
     */
    public static LoggingContext forRun(String workflowId, String runId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKFLOW_ID, workflowId);
        ctx.put(RUN_ID, runId);
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one activity attempt.
     */
    public static LoggingContext forActivity(String workflowId, String runId, String activityId, int attempt) {
        LoggingContext ctx = forRun(workflowId, runId);
        ctx.put(ACTIVITY_ID, activityId);
        ctx.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Create a logging context for a leased task.
     */
    public static LoggingContext forTask(String taskId, String workflowId, String runId) {
        LoggingContext ctx = forRun(workflowId, runId);
        ctx.put(TASK_ID, taskId);
        return ctx;
    }

    /**
     * Create a logging context for worker operations.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKER_ID, workerId);
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Get current run ID from context.
     */
    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    private void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
