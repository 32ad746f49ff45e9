package com.entity.linker.tracing;

import java.util.Map;

/**
 * Starts spans around the linker stages (block, extract, score, train).
 * {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    String RUN_ID_ATTRIBUTE = "linker.run_id";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts a span tagged with the run it belongs to.
     */
    default Span startStage(String stage, String runId) {
        return startSpan("linker." + stage, Map.of(RUN_ID_ATTRIBUTE, runId));
    }
}
