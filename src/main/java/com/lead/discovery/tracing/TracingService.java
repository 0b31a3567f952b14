package com.lead.discovery.tracing;

import java.util.Map;

/**
 * Starts spans around matching, merging and discovery. The default
 * {@link NoOpTracingService} keeps the engine free of any tracing dependency.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
