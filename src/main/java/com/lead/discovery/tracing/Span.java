package com.lead.discovery.tracing;

/**
 * A traced unit of work. Closing the span ends it, so spans belong in try-with-resources.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
