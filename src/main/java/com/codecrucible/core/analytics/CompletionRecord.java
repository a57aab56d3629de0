package com.codecrucible.core.analytics;

import java.time.Instant;

public class CompletionRecord {

    private final String  entryId;
    private final double  durationSeconds;
    private final int     iterations;
    private final Integer featuresImplemented;
    private final Instant timestamp;

    /**
     * @param featuresImplemented {@code null} for plain refinement runs
     */
    public CompletionRecord(String entryId, double durationSeconds, int iterations,
                            Integer featuresImplemented, Instant timestamp) {
        this.entryId             = entryId;
        this.durationSeconds     = durationSeconds;
        this.iterations          = iterations;
        this.featuresImplemented = featuresImplemented;
        this.timestamp           = timestamp;
    }

    public String  getEntryId()             { return entryId; }
    public double  getDurationSeconds()     { return durationSeconds; }
    public int     getIterations()          { return iterations; }
    public Integer getFeaturesImplemented() { return featuresImplemented; }
    public Instant getTimestamp()           { return timestamp; }
}
