package com.codecrucible.llm;

import com.codecrucible.config.EngineSettings;
import com.codecrucible.core.analytics.AnalyticsSink;
import com.codecrucible.core.analytics.ApiCallRecord;
import com.codecrucible.core.cache.CacheKeys;
import com.codecrucible.core.cache.ResponseCache;
import com.codecrucible.core.ratelimit.RateLimitDecision;
import com.codecrucible.core.ratelimit.RateLimiter;
import com.codecrucible.llm.transport.LLMTransport;
import com.codecrucible.llm.transport.TransportResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache, rate budget, transport and response parsing for a
 * single backend call.
 *
 * Order per call:
 *   1. cache lookup (a hit costs no budget and no transport call)
 *   2. rate budget for the model
 *   3. POST {prompt, action, temperature, max_tokens, language} with a 30s timeout
 *   4. parse {"result": ...} / {"error": ...}
 *
 * Concurrent calls with the same cache key share one in-flight request, so an
 * identical (model, input, action, language) tuple reaches the transport at
 * most once per TTL. Failures are returned, never cached, and never retried.
 */
@Component
public class DefaultLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultLLMClient.class);

    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    static final String USER_AGENT        = "CodeCrucible/0.1";
    static final int    MAX_ERROR_SNIPPET = 300;

    private final RateLimiter   rateLimiter;
    private final ResponseCache cache;
    private final LLMTransport  transport;
    private final AnalyticsSink analytics;
    private final ObjectMapper  objectMapper;
    private final Duration      cacheTtl;
    private final Clock         clock;

    private final ConcurrentHashMap<String, CompletableFuture<LLMResult>> inFlight = new ConcurrentHashMap<>();

    public DefaultLLMClient(
            RateLimiter    rateLimiter,
            ResponseCache  cache,
            LLMTransport   transport,
            AnalyticsSink  analytics,
            ObjectMapper   objectMapper,
            EngineSettings settings,
            Clock          clock
    ) {
        this.rateLimiter  = rateLimiter;
        this.cache        = cache;
        this.transport    = transport;
        this.analytics    = analytics;
        this.objectMapper = objectMapper;
        this.cacheTtl     = settings.getCacheTtl();
        this.clock        = clock;
    }

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public LLMResult call(ModelConfig model, String input, TaskType task, String language, String requestId) {
        String lang   = (language == null || language.isBlank()) ? DEFAULT_LANGUAGE : language.trim();
        String prompt = input != null ? input : "";
        String reqId  = requestId != null ? requestId : UUID.randomUUID().toString();
        String key    = CacheKeys.of(model.getId(), prompt, task.getAction(), lang);

        Optional<String> hit = cache.get(key);
        if (hit.isPresent()) {
            log.info("[LLM] Cache hit | model={} action={} request={}", model.getId(), task.getAction(), reqId);
            return LLMResult.cached(hit.get());
        }

        CompletableFuture<LLMResult> mine     = new CompletableFuture<>();
        CompletableFuture<LLMResult> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("[LLM] Joining in-flight call | model={} action={}", model.getId(), task.getAction());
            try {
                return existing.join();
            } catch (CompletionException e) {
                throw unwrap(e);
            }
        }

        try {
            LLMResult result = execute(model, prompt, task, lang, reqId, key);
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    // =========================================================================
    // Single call
    // =========================================================================

    private LLMResult execute(ModelConfig model, String prompt, TaskType task,
                              String language, String requestId, String key) {

        // another flight may have filled the cache between the fast path and here
        Optional<String> hit = cache.get(key);
        if (hit.isPresent()) {
            return LLMResult.cached(hit.get());
        }

        long tokensIn = TokenEstimator.estimate(prompt);
        RateLimitDecision decision = rateLimiter.acquire(model, tokensIn);
        if (!decision.isAllowed()) {
            return LLMResult.failure(LLMError.rateLimitExceeded(decision.getReason()));
        }

        String body;
        try {
            body = buildRequestBody(model, prompt, task, language);
        } catch (JsonProcessingException e) {
            return LLMResult.failure(LLMError.apiError("Could not encode request: " + e.getOriginalMessage()));
        }

        long start = System.nanoTime();
        TransportResponse response;
        try {
            response = transport.post(model.getEndpoint(), buildHeaders(model), body, REQUEST_TIMEOUT);
        } catch (LLMTransport.TransportException e) {
            return fail(model, task, requestId, tokensIn, start, "API request failed: " + e.getMessage());
        }

        if (!response.isSuccess()) {
            return fail(model, task, requestId, tokensIn, start,
                    "API returned HTTP " + response.getStatusCode() + ": " + snippet(response.getBody()));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            return fail(model, task, requestId, tokensIn, start,
                    "Malformed API response: " + snippet(response.getBody()));
        }

        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String message = error.isTextual() ? error.asText() : error.toString();
            return fail(model, task, requestId, tokensIn, start, "API error: " + message);
        }

        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            return fail(model, task, requestId, tokensIn, start, "Malformed API response: missing 'result'");
        }

        String text      = result.isTextual() ? result.asText() : result.toString();
        long   tokensOut = TokenEstimator.estimate(text);
        double duration  = secondsSince(start);

        cache.put(key, text, cacheTtl);
        rateLimiter.recordTokens(model, tokensOut);
        analytics.logApiCall(new ApiCallRecord(requestId, model.getId(), task.getAction(),
                tokensIn, tokensOut, duration, ApiCallRecord.STATUS_SUCCESS, clock.instant()));

        log.info("[LLM] API call to {} for action {} | {}ms | in~{} out~{} tokens",
                model.getId(), task.getAction(), Math.round(duration * 1000), tokensIn, tokensOut);

        return LLMResult.success(text);
    }

    private LLMResult fail(ModelConfig model, TaskType task, String requestId,
                           long tokensIn, long start, String message) {
        analytics.logApiCall(new ApiCallRecord(requestId, model.getId(), task.getAction(),
                tokensIn, 0, secondsSince(start), ApiCallRecord.STATUS_ERROR, clock.instant()));
        log.warn("[LLM] {} {} failed: {}", model.getId(), task.getAction(), message);
        return LLMResult.failure(LLMError.apiError(message));
    }

    // =========================================================================
    // Request building
    // =========================================================================

    String buildRequestBody(ModelConfig model, String prompt, TaskType task, String language)
            throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("prompt",      prompt);
        body.put("action",      task.getAction());
        body.put("temperature", model.temperatureFor(task));
        body.put("max_tokens",  model.maxTokensFor(task));
        body.put("language",    language);
        return objectMapper.writeValueAsString(body);
    }

    private Map<String, String> buildHeaders(ModelConfig model) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (model.getCredential() != null && !model.getCredential().isBlank()) {
            headers.put("Authorization", "Bearer " + model.getCredential());
        }
        headers.put("Content-Type",  "application/json");
        headers.put("Accept",        "application/json");
        headers.put("User-Agent",    USER_AGENT);
        return headers;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /** Joiners see the same exception the leading call threw. */
    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return e;
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static String snippet(String body) {
        if (body == null || body.isEmpty()) return "<empty body>";
        return body.length() > MAX_ERROR_SNIPPET ? body.substring(0, MAX_ERROR_SNIPPET) + "..." : body;
    }
}
