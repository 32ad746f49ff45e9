package com.entity.linker.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC scope for one linker operation. Entries are added on creation and removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forLinking(runId)) {
 *     log.info("linking.completed decisions={}", decisions.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String OPERATION = "operation";
    public static final String STRATEGY = "strategy";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forLinking(String runId) {
        return operation(runId, "link");
    }

    public static LogContext forTraining(String runId, String algorithm) {
        return operation(runId, "train").with(STRATEGY, algorithm);
    }

    public static LogContext forEvaluation(String runId, String algorithm, int folds) {
        return operation(runId, "evaluate")
                .with(STRATEGY, algorithm)
                .with("folds", Integer.toString(folds));
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds one more entry to this scope.
     */
    public LogContext with(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
        return this;
    }

    private static LogContext operation(String runId, String operation) {
        return new LogContext().with(RUN_ID, runId).with(OPERATION, operation);
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
