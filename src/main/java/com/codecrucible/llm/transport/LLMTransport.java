package com.codecrucible.llm.transport;

import java.time.Duration;
import java.util.Map;

/**
 * Performs exactly one outbound POST. No retries, no status interpretation:
 * any HTTP status comes back as a {@link TransportResponse}, and only failures
 * to get a response at all (connect error, timeout) raise.
 */
public interface LLMTransport {

    TransportResponse post(String endpoint, Map<String, String> headers, String jsonBody, Duration timeout)
            throws TransportException;

    class TransportException extends Exception {

        public TransportException(String message) {
            super(message);
        }

        public TransportException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
