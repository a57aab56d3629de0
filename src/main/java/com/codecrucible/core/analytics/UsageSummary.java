package com.codecrucible.core.analytics;

/**
 * Aggregated usage for one (model, action) pair over a reporting window.
 */
public class UsageSummary {

    private final String modelId;
    private final String action;
    private final long   calls;
    private final long   tokensIn;
    private final long   tokensOut;
    private final double avgDurationSeconds;

    public UsageSummary(String modelId, String action, long calls,
                        long tokensIn, long tokensOut, double avgDurationSeconds) {
        this.modelId            = modelId;
        this.action             = action;
        this.calls              = calls;
        this.tokensIn           = tokensIn;
        this.tokensOut          = tokensOut;
        this.avgDurationSeconds = avgDurationSeconds;
    }

    public String getModelId()            { return modelId; }
    public String getAction()             { return action; }
    public long   getCalls()              { return calls; }
    public long   getTokensIn()           { return tokensIn; }
    public long   getTokensOut()          { return tokensOut; }
    public double getAvgDurationSeconds() { return avgDurationSeconds; }
}
