package com.codecrucible.llm;

/**
 * Why a single backend call produced no text.
 */
public final class LLMError {

    public enum Kind {
        /** Per-model budget exhausted; the caller may skip or retry later. */
        RATE_LIMIT_EXCEEDED,
        /** Transport failure, non-success status, or an error in the response. Never auto-retried. */
        API_ERROR
    }

    private final Kind   kind;
    private final String message;

    private LLMError(Kind kind, String message) {
        this.kind    = kind;
        this.message = message != null ? message : "";
    }

    public static LLMError rateLimitExceeded(String message) {
        return new LLMError(Kind.RATE_LIMIT_EXCEEDED, message);
    }

    public static LLMError apiError(String message) {
        return new LLMError(Kind.API_ERROR, message);
    }

    public Kind   getKind()    { return kind; }
    public String getMessage() { return message; }

    public boolean isRateLimit() {
        return kind == Kind.RATE_LIMIT_EXCEEDED;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
