package com.codecrucible.config;

import java.time.Duration;

/**
 * Validated loop and call knobs. Built once at startup by
 * {@link CrucibleConfiguration}; the orchestrator never reads raw properties.
 */
public final class EngineSettings {

    public static final int MIN_MAX_ITERATIONS   = 1;
    public static final int MAX_MAX_ITERATIONS   = 20;
    public static final int MIN_ITERATION_LIMIT  = 1;
    public static final int MAX_ITERATION_LIMIT  = 10;
    public static final int MAX_RETRY_ATTEMPTS   = 10;

    private final int              maxIterations;
    private final int              iterationLimit;
    private final RotationStrategy rotationStrategy;
    private final Duration         cacheTtl;
    private final int              retryMaxAttempts;
    private final long             retryBackoffMs;

    public EngineSettings(
            int              maxIterations,
            int              iterationLimit,
            RotationStrategy rotationStrategy,
            Duration         cacheTtl,
            int              retryMaxAttempts,
            long             retryBackoffMs
    ) {
        if (maxIterations < MIN_MAX_ITERATIONS || maxIterations > MAX_MAX_ITERATIONS) {
            throw new ConfigurationValidationException(
                    "max-iterations must be between " + MIN_MAX_ITERATIONS + " and "
                    + MAX_MAX_ITERATIONS + ", got " + maxIterations);
        }
        if (iterationLimit < MIN_ITERATION_LIMIT || iterationLimit > MAX_ITERATION_LIMIT) {
            throw new ConfigurationValidationException(
                    "iteration-limit must be between " + MIN_ITERATION_LIMIT + " and "
                    + MAX_ITERATION_LIMIT + ", got " + iterationLimit);
        }
        if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
            throw new ConfigurationValidationException("cache-ttl-seconds must be positive");
        }
        if (retryMaxAttempts < 1 || retryMaxAttempts > MAX_RETRY_ATTEMPTS) {
            throw new ConfigurationValidationException(
                    "retry.max-attempts must be between 1 and " + MAX_RETRY_ATTEMPTS
                    + ", got " + retryMaxAttempts);
        }
        if (retryBackoffMs < 0) {
            throw new ConfigurationValidationException("retry.backoff-ms must not be negative");
        }
        this.maxIterations    = maxIterations;
        this.iterationLimit   = iterationLimit;
        this.rotationStrategy = rotationStrategy != null ? rotationStrategy : RotationStrategy.ROUND_ROBIN;
        this.cacheTtl         = cacheTtl;
        this.retryMaxAttempts = retryMaxAttempts;
        this.retryBackoffMs   = retryBackoffMs;
    }

    /** Settings with every default from the settings store. */
    public static EngineSettings defaults() {
        return new EngineSettings(5, 3, RotationStrategy.ROUND_ROBIN, Duration.ofSeconds(3600), 1, 500);
    }

    public EngineSettings withIterations(int maxIterations, int iterationLimit) {
        return new EngineSettings(maxIterations, iterationLimit, rotationStrategy,
                cacheTtl, retryMaxAttempts, retryBackoffMs);
    }

    public EngineSettings withRetry(int maxAttempts, long backoffMs) {
        return new EngineSettings(maxIterations, iterationLimit, rotationStrategy,
                cacheTtl, maxAttempts, backoffMs);
    }

    public int              getMaxIterations()    { return maxIterations; }
    public int              getIterationLimit()   { return iterationLimit; }
    public RotationStrategy getRotationStrategy() { return rotationStrategy; }
    public Duration         getCacheTtl()         { return cacheTtl; }
    public int              getRetryMaxAttempts() { return retryMaxAttempts; }
    public long             getRetryBackoffMs()   { return retryBackoffMs; }

    @Override
    public String toString() {
        return String.format("EngineSettings{maxIterations=%d, iterationLimit=%d, strategy=%s, cacheTtl=%ds, retry=%d}",
                maxIterations, iterationLimit, rotationStrategy, cacheTtl.getSeconds(), retryMaxAttempts);
    }
}
