package com.codecrucible.core.analytics;

import java.time.Instant;

/**
 * One outbound backend call as seen by the analytics sink. Token counts are
 * estimates, not provider-reported usage.
 */
public class ApiCallRecord {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR   = "error";

    private final String  requestId;
    private final String  modelId;
    private final String  action;
    private final long    tokensIn;
    private final long    tokensOut;
    private final double  durationSeconds;
    private final String  status;
    private final Instant timestamp;

    public ApiCallRecord(
            String  requestId,
            String  modelId,
            String  action,
            long    tokensIn,
            long    tokensOut,
            double  durationSeconds,
            String  status,
            Instant timestamp
    ) {
        this.requestId       = requestId;
        this.modelId         = modelId;
        this.action          = action;
        this.tokensIn        = tokensIn;
        this.tokensOut       = tokensOut;
        this.durationSeconds = durationSeconds;
        this.status          = status;
        this.timestamp       = timestamp;
    }

    public String  getRequestId()       { return requestId; }
    public String  getModelId()         { return modelId; }
    public String  getAction()          { return action; }
    public long    getTokensIn()        { return tokensIn; }
    public long    getTokensOut()       { return tokensOut; }
    public double  getDurationSeconds() { return durationSeconds; }
    public String  getStatus()          { return status; }
    public Instant getTimestamp()       { return timestamp; }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    @Override
    public String toString() {
        return String.format("ApiCallRecord{request=%s, model=%s, action=%s, in=%d, out=%d, %.3fs, %s}",
                requestId, modelId, action, tokensIn, tokensOut, durationSeconds, status);
    }
}
