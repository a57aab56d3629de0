package com.codecrucible.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw {@code crucible.*} settings as bound from application.properties.
 *
 * <p>Example:
 * <pre>
 * crucible.max-iterations=5
 * crucible.iteration-limit=3
 * crucible.rotation-strategy=round_robin
 * crucible.models.claude.endpoint=https://llm.example.com/v1/claude
 * crucible.credentials.claude=${CLAUDE_API_KEY}
 * crucible.tasks.generation=claude,gemini
 * crucible.tasks.checking=claude,gemini
 * crucible.tasks.fixing=claude
 * crucible.tasks.feature=claude
 * crucible.rate-limits.claude.calls-per-minute=60
 * crucible.weights.gemini=3
 * </pre>
 *
 * <p>This class is only a binding target. {@link CrucibleConfiguration} turns it
 * into the validated, immutable {@link EngineSettings} and model registry the
 * engine actually runs on.
 */
@ConfigurationProperties(prefix = "crucible")
public class CrucibleProperties {

    private int    maxIterations    = 5;
    private int    iterationLimit   = 3;
    private String rotationStrategy = "round_robin";
    private long   cacheTtlSeconds  = 3600;

    private Retry retry = new Retry();

    private Map<String, Model>         models      = new LinkedHashMap<>();
    private Map<String, String>        credentials = new HashMap<>();
    private Map<String, List<String>>  tasks       = new LinkedHashMap<>();
    private Map<String, RateLimit>     rateLimits  = new HashMap<>();
    private Map<String, Integer>       weights     = new HashMap<>();

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }

    public int getIterationLimit() { return iterationLimit; }
    public void setIterationLimit(int iterationLimit) { this.iterationLimit = iterationLimit; }

    public String getRotationStrategy() { return rotationStrategy; }
    public void setRotationStrategy(String rotationStrategy) { this.rotationStrategy = rotationStrategy; }

    public long getCacheTtlSeconds() { return cacheTtlSeconds; }
    public void setCacheTtlSeconds(long cacheTtlSeconds) { this.cacheTtlSeconds = cacheTtlSeconds; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Map<String, Model> getModels() { return models; }
    public void setModels(Map<String, Model> models) { this.models = models; }

    public Map<String, String> getCredentials() { return credentials; }
    public void setCredentials(Map<String, String> credentials) { this.credentials = credentials; }

    public Map<String, List<String>> getTasks() { return tasks; }
    public void setTasks(Map<String, List<String>> tasks) { this.tasks = tasks; }

    public Map<String, RateLimit> getRateLimits() { return rateLimits; }
    public void setRateLimits(Map<String, RateLimit> rateLimits) { this.rateLimits = rateLimits; }

    public Map<String, Integer> getWeights() { return weights; }
    public void setWeights(Map<String, Integer> weights) { this.weights = weights; }

    public static class Model {

        private String endpoint;
        private double temperature = 0.7;
        private int    maxTokens   = 2000;

        /** Keyed by task type ({@code generation}, {@code checking}, ...). */
        private Map<String, Double>  taskTemperatures = new HashMap<>();
        private Map<String, Integer> taskMaxTokens    = new HashMap<>();

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public Map<String, Double> getTaskTemperatures() { return taskTemperatures; }
        public void setTaskTemperatures(Map<String, Double> taskTemperatures) { this.taskTemperatures = taskTemperatures; }

        public Map<String, Integer> getTaskMaxTokens() { return taskMaxTokens; }
        public void setTaskMaxTokens(Map<String, Integer> taskMaxTokens) { this.taskMaxTokens = taskMaxTokens; }
    }

    public static class RateLimit {

        private int callsPerMinute  = 60;
        private int tokensPerMinute = 10000;

        public int getCallsPerMinute() { return callsPerMinute; }
        public void setCallsPerMinute(int callsPerMinute) { this.callsPerMinute = callsPerMinute; }

        public int getTokensPerMinute() { return tokensPerMinute; }
        public void setTokensPerMinute(int tokensPerMinute) { this.tokensPerMinute = tokensPerMinute; }
    }

    /**
     * Bounded retry for calls rejected by the rate limiter. Total attempts, so
     * the default of 1 means no retry.
     */
    public static class Retry {

        private int  maxAttempts = 1;
        private long backoffMs   = 500;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBackoffMs() { return backoffMs; }
        public void setBackoffMs(long backoffMs) { this.backoffMs = backoffMs; }
    }

    /** Convenience for tests and programmatic setup. */
    public CrucibleProperties task(String taskKey, String... modelIds) {
        tasks.put(taskKey, new ArrayList<>(List.of(modelIds)));
        return this;
    }
}
