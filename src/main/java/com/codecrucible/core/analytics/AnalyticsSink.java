package com.codecrucible.core.analytics;

/**
 * Receives per-call and per-run metrics. Implementations must not throw back
 * into the engine; a failing sink only loses metrics.
 */
public interface AnalyticsSink {

    void logApiCall(ApiCallRecord record);

    void logCompletion(CompletionRecord record);
}
