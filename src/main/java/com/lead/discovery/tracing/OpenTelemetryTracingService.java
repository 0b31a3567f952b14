package com.lead.discovery.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * OpenTelemetry-backed {@link TracingService}. Needs {@code opentelemetry-api} at runtime.
 * Span names are prefixed with {@code lead.} so they group together in a trace view.
 */
public class OpenTelemetryTracingService implements TracingService {

    private static final String PREFIX = "lead.";

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
        SpanBuilder builder = tracer.spanBuilder(PREFIX + operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpan(builder.startSpan());
    }

    private static final class OTelSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        OTelSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
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
