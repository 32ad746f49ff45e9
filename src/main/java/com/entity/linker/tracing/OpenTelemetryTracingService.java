package com.entity.linker.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpan(builder.startSpan());
    }

    private record OTelSpan(io.opentelemetry.api.trace.Span delegate) implements Span {

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
