package com.codecrucible.llm;

/**
 * One generate/check/fix/feature call against one backend.
 *
 * Implementations sanitize nothing themselves; callers pass already-sanitized
 * input. They never retry: a rate-limited or failed call comes back as a
 * failed {@link LLMResult} immediately.
 */
public interface LLMClient {

    /** Used when a caller passes no language. */
    String DEFAULT_LANGUAGE = "python";

    /**
     * @param model     backend to call
     * @param input     prompt or code, already sanitized
     * @param task      decides the action tag and per-task temperature/max tokens
     * @param language  target programming language, e.g. {@code python}
     * @param requestId correlation id for analytics, usually the workflow entry id
     */
    LLMResult call(ModelConfig model, String input, TaskType task, String language, String requestId);

    /**
     * Convenience for call sites without a workflow entry.
     */
    default LLMResult call(ModelConfig model, String input, TaskType task, String language) {
        return call(model, input, task, language, null);
    }
}
