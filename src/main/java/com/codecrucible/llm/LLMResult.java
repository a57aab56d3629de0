package com.codecrucible.llm;

import java.util.Objects;

/**
 * Outcome of one backend call: either the response text or an {@link LLMError}.
 *
 * Per-call failures are values, not exceptions, so the orchestrator can skip a
 * flaky checker or keep the previous code after a failed fix without
 * unwinding the run.
 */
public final class LLMResult {

    private final String   text;
    private final LLMError error;
    private final boolean  cached;

    private LLMResult(String text, LLMError error, boolean cached) {
        this.text   = text;
        this.error  = error;
        this.cached = cached;
    }

    public static LLMResult success(String text) {
        return new LLMResult(Objects.requireNonNull(text, "text"), null, false);
    }

    public static LLMResult cached(String text) {
        return new LLMResult(Objects.requireNonNull(text, "text"), null, true);
    }

    public static LLMResult failure(LLMError error) {
        return new LLMResult(null, Objects.requireNonNull(error, "error"), false);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Response text; only valid when {@link #isSuccess()}. */
    public String getText() {
        if (error != null) {
            throw new IllegalStateException("No text on a failed result: " + error);
        }
        return text;
    }

    public LLMError getError() {
        return error;
    }

    public boolean isCached() {
        return cached;
    }

    @Override
    public String toString() {
        if (error != null) return "LLMResult{" + error + "}";
        return String.format("LLMResult{success, %d chars%s}", text.length(), cached ? ", cached" : "");
    }
}
