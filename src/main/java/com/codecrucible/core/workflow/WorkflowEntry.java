package com.codecrucible.core.workflow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One refinement run as persisted through {@link WorkflowStore}.
 *
 * Mutated only by the orchestrator that created it. The counters only move
 * forward: {@link #incrementIterations()} and
 * {@link #incrementFeaturesImplemented()} are the sole writers, and the latter
 * refuses to go past the feature list.
 */
public class WorkflowEntry {

    private String id;

    private final String       prompt;
    private final String       language;
    private final List<String> features;
    private final Instant      createdAt;

    private WorkflowStatus status = WorkflowStatus.PROCESSING;
    private WorkflowPhase  phase  = WorkflowPhase.CREATED;

    private String  generatedCode       = "";
    private String  bugReport           = "";
    private int     iterationCount      = 0;
    private int     featuresImplemented = 0;
    private double  durationSeconds     = 0;
    private String  error;
    private Instant completedAt;

    private List<String> securityFindings = List.of();

    public WorkflowEntry(String prompt, String language, List<String> features, Instant createdAt) {
        this.prompt    = prompt;
        this.language  = language;
        this.features  = features != null ? List.copyOf(features) : List.of();
        this.createdAt = createdAt;
    }

    // =========================================================================
    // State changes
    // =========================================================================

    public void transitionTo(WorkflowPhase next) {
        if (phase.isTerminal()) {
            throw new IllegalStateException("Entry " + id + " is already " + phase + ", cannot move to " + next);
        }
        this.phase = next;
    }

    public void incrementIterations() {
        iterationCount++;
    }

    public void incrementFeaturesImplemented() {
        if (featuresImplemented >= features.size()) {
            throw new IllegalStateException(
                    "featuresImplemented would exceed the " + features.size() + " requested features");
        }
        featuresImplemented++;
    }

    public void markCompleted(Instant at, double durationSeconds) {
        transitionTo(WorkflowPhase.COMPLETED);
        this.status          = WorkflowStatus.COMPLETED;
        this.completedAt     = at;
        this.durationSeconds = durationSeconds;
    }

    /**
     * Allowed from any phase, including COMPLETED when persisting the
     * completion itself failed.
     */
    public void markFailed(String error, Instant at, double durationSeconds) {
        this.phase           = WorkflowPhase.FAILED;
        this.status          = WorkflowStatus.FAILED;
        this.error           = error;
        this.completedAt     = at;
        this.durationSeconds = durationSeconds;
    }

    public void setGeneratedCode(String generatedCode) {
        this.generatedCode = generatedCode != null ? generatedCode : "";
    }

    public void setBugReport(String bugReport) {
        this.bugReport = bugReport != null ? bugReport : "";
    }

    public void setSecurityFindings(List<String> securityFindings) {
        this.securityFindings = List.copyOf(securityFindings);
    }

    void assignId(String id) {
        this.id = id;
    }

    /** Detached snapshot, used by stores so callers never share the live instance. */
    public WorkflowEntry copy() {
        WorkflowEntry c = new WorkflowEntry(prompt, language, features, createdAt);
        c.id                  = id;
        c.status              = status;
        c.phase               = phase;
        c.generatedCode       = generatedCode;
        c.bugReport           = bugReport;
        c.iterationCount      = iterationCount;
        c.featuresImplemented = featuresImplemented;
        c.durationSeconds     = durationSeconds;
        c.error               = error;
        c.completedAt         = completedAt;
        c.securityFindings    = new ArrayList<>(securityFindings);
        return c;
    }

    // =========================================================================
    // Getters
    // =========================================================================

    public String         getId()                  { return id; }
    public String         getPrompt()              { return prompt; }
    public String         getLanguage()            { return language; }
    public List<String>   getFeatures()            { return features; }
    public WorkflowStatus getStatus()              { return status; }
    public WorkflowPhase  getPhase()               { return phase; }
    public String         getGeneratedCode()       { return generatedCode; }
    public String         getBugReport()           { return bugReport; }
    public int            getIterationCount()      { return iterationCount; }
    public int            getFeaturesImplemented() { return featuresImplemented; }
    public double         getDurationSeconds()     { return durationSeconds; }
    public String         getError()               { return error; }
    public List<String>   getSecurityFindings()    { return securityFindings; }
    public Instant        getCreatedAt()           { return createdAt; }
    public Instant        getCompletedAt()         { return completedAt; }

    @Override
    public String toString() {
        return "WorkflowEntry{id=" + id + ", status=" + status + ", phase=" + phase
                + ", iterations=" + iterationCount + ", features=" + featuresImplemented + "/" + features.size() + "}";
    }
}
