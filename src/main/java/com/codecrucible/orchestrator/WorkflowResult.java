package com.codecrucible.orchestrator;

/**
 * What a finished run hands back to its caller.
 */
public final class WorkflowResult {

    private final String  entryId;
    private final String  code;
    private final int     iterations;
    private final double  durationSeconds;
    private final Integer featuresImplemented;

    private WorkflowResult(String entryId, String code, int iterations,
                           double durationSeconds, Integer featuresImplemented) {
        this.entryId             = entryId;
        this.code                = code;
        this.iterations          = iterations;
        this.durationSeconds     = durationSeconds;
        this.featuresImplemented = featuresImplemented;
    }

    public static WorkflowResult refinement(String entryId, String code, int iterations, double durationSeconds) {
        return new WorkflowResult(entryId, code, iterations, durationSeconds, null);
    }

    public static WorkflowResult featureEnhanced(String entryId, String code, int iterations,
                                                 double durationSeconds, int featuresImplemented) {
        return new WorkflowResult(entryId, code, iterations, durationSeconds, featuresImplemented);
    }

    public String  getEntryId()             { return entryId; }
    public String  getCode()                { return code; }
    public int     getIterations()          { return iterations; }
    public double  getDurationSeconds()     { return durationSeconds; }

    /** {@code null} for plain refinement runs. */
    public Integer getFeaturesImplemented() { return featuresImplemented; }

    @Override
    public String toString() {
        return String.format("WorkflowResult{entry=%s, iterations=%d, features=%s, %.2fs}",
                entryId, iterations, featuresImplemented, durationSeconds);
    }
}
