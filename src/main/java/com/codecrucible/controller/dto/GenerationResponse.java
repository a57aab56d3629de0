package com.codecrucible.controller.dto;

import com.codecrucible.orchestrator.WorkflowResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire shape of a finished run: {@code {code, iterations, duration, features_implemented?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationResponse {

    @JsonProperty("entry_id")
    private final String entryId;

    private final String code;
    private final int    iterations;
    private final double duration;

    @JsonProperty("features_implemented")
    private final Integer featuresImplemented;

    public GenerationResponse(String entryId, String code, int iterations, double duration, Integer featuresImplemented) {
        this.entryId             = entryId;
        this.code                = code;
        this.iterations          = iterations;
        this.duration            = duration;
        this.featuresImplemented = featuresImplemented;
    }

    public static GenerationResponse from(WorkflowResult result) {
        return new GenerationResponse(result.getEntryId(), result.getCode(), result.getIterations(),
                result.getDurationSeconds(), result.getFeaturesImplemented());
    }

    public String  getEntryId()             { return entryId; }
    public String  getCode()                { return code; }
    public int     getIterations()          { return iterations; }
    public double  getDuration()            { return duration; }
    public Integer getFeaturesImplemented() { return featuresImplemented; }
}
