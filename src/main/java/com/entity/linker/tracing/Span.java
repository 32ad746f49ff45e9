package com.entity.linker.tracing;

/**
 * A traced pipeline stage. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracing.startSpan("linker.extract")) {
 *     span.setAttribute("pairs", pairs.size());
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records the exception and marks the span as failed.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
