package com.codecrucible.orchestrator;

import com.codecrucible.config.EngineSettings;
import com.codecrucible.core.analytics.AnalyticsSink;
import com.codecrucible.core.analytics.CompletionRecord;
import com.codecrucible.core.security.SecurityFinding;
import com.codecrucible.core.security.SecuritySanitizer;
import com.codecrucible.core.version.CodeVersionStore;
import com.codecrucible.core.workflow.WorkflowEntry;
import com.codecrucible.core.workflow.WorkflowPhase;
import com.codecrucible.core.workflow.WorkflowStore;
import com.codecrucible.llm.LLMClient;
import com.codecrucible.llm.LLMResult;
import com.codecrucible.llm.ModelConfig;
import com.codecrucible.llm.TaskType;
import com.codecrucible.llm.selection.ModelSelector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Drives one refinement run end to end.
 *
 * Phase flow:  GENERATING → (CHECKING_BUGS ⇄ FIXING)* → [FEATURE_INJECTION]* → COMPLETED
 *
 * Failure policy:
 *   - a checker that fails is skipped and contributes nothing to the report
 *   - a failed fix or feature call keeps the previous code; the iteration still counts
 *   - a failed generation, a persistence failure, or an empty model pool fails the run
 *
 * Rate-limited calls are retried with exponential backoff plus jitter up to
 * {@code crucible.retry.max-attempts} total attempts. API errors are never retried.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final ModelSelector     selector;
    private final LLMClient         client;
    private final SecuritySanitizer sanitizer;
    private final PromptBuilder     prompts;
    private final WorkflowStore     store;
    private final CodeVersionStore  versions;
    private final AnalyticsSink     analytics;
    private final EngineSettings    settings;
    private final Clock             clock;
    private final Random            jitterRandom;

    @Autowired
    public WorkflowOrchestrator(
            ModelSelector     selector,
            LLMClient         client,
            SecuritySanitizer sanitizer,
            PromptBuilder     prompts,
            WorkflowStore     store,
            CodeVersionStore  versions,
            AnalyticsSink     analytics,
            EngineSettings    settings,
            Clock             clock
    ) {
        this(selector, client, sanitizer, prompts, store, versions, analytics, settings, clock, new Random());
    }

    WorkflowOrchestrator(
            ModelSelector     selector,
            LLMClient         client,
            SecuritySanitizer sanitizer,
            PromptBuilder     prompts,
            WorkflowStore     store,
            CodeVersionStore  versions,
            AnalyticsSink     analytics,
            EngineSettings    settings,
            Clock             clock,
            Random            jitterRandom
    ) {
        this.selector     = selector;
        this.client       = client;
        this.sanitizer    = sanitizer;
        this.prompts      = prompts;
        this.store        = store;
        this.versions     = versions;
        this.analytics    = analytics;
        this.settings     = settings;
        this.clock        = clock;
        this.jitterRandom = jitterRandom;
    }

    // =========================================================================
    // ENTRY POINTS
    // =========================================================================

    /**
     * Generate code for {@code prompt}, then check and fix until every checker
     * is satisfied or {@code max-iterations} passes have run.
     */
    public WorkflowResult runWorkflow(String prompt, String language) throws WorkflowException {
        return run(prompt, List.of(), language, false);
    }

    /**
     * Like {@link #runWorkflow} but always runs the full iteration budget and
     * applies the next feature on every {@code iteration-limit}-th iteration.
     */
    public WorkflowResult generateFeatureEnhancedCode(String prompt, List<String> features, String language)
            throws WorkflowException {
        return run(prompt, features != null ? features : List.of(), language, true);
    }

    // =========================================================================
    // RUN
    // =========================================================================

    private WorkflowResult run(String prompt, List<String> features, String language, boolean featureMode)
            throws WorkflowException {

        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        String lang  = (language == null || language.isBlank()) ? LLMClient.DEFAULT_LANGUAGE : language.trim();
        long   start = System.nanoTime();

        WorkflowEntry entry = new WorkflowEntry(prompt, lang, features, clock.instant());
        try {
            store.create(entry);
        } catch (WorkflowStore.PersistenceException e) {
            log.error("[Orchestrator] Could not create workflow entry: {}", e.getMessage());
            throw new WorkflowException("Could not create workflow entry: " + e.getMessage(), null, e);
        }

        log.info("========== WORKFLOW START {} ==========", entry.getId());
        log.info("[Orchestrator] mode={} language={} features={} settings={}",
                featureMode ? "feature-enhanced" : "refinement", lang, features.size(), settings);

        try {
            String code = generate(entry, start);
            code = iterate(entry, code, featureMode);
            return complete(entry, code, start, featureMode);

        } catch (WorkflowStore.PersistenceException e) {
            throw failRun(entry, start, "Persistence failure: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw failRun(entry, start, e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }
    }

    private String generate(WorkflowEntry entry, long start)
            throws WorkflowException, WorkflowStore.PersistenceException {

        moveTo(entry, WorkflowPhase.GENERATING);

        ModelConfig model  = selector.select(TaskType.GENERATION);
        LLMResult   result = callWithRetry(model, sanitizer.sanitizePrompt(entry.getPrompt()),
                TaskType.GENERATION, entry);

        if (!result.isSuccess()) {
            throw failRun(entry, start, "Code generation failed: " + result.getError().getMessage(), null);
        }

        String code = result.getText();
        entry.setGeneratedCode(code);
        store.update(entry);
        versions.save(entry.getId(), 0, code, "Initial generation by " + model.getId());

        log.info("[Orchestrator] Generated {} chars with {}", code.length(), model.getId());
        return code;
    }

    private String iterate(WorkflowEntry entry, String code, boolean featureMode)
            throws WorkflowStore.PersistenceException {

        int          maxIterations  = settings.getMaxIterations();
        int          iterationLimit = settings.getIterationLimit();
        List<String> features       = entry.getFeatures();
        int          featureIndex   = 0;

        for (int n = 1; n <= maxIterations; n++) {

            log.info("[Orchestrator] ---- Iteration {}/{} ----", n, maxIterations);

            BugReportAggregator report = checkBugs(entry, code);
            entry.setBugReport(report.getAggregateReport());

            if (!report.isBugFree()) {
                code = fix(entry, code, report.getAggregateReport(), n);
            }

            if (featureMode && n % iterationLimit == 0 && featureIndex < features.size()) {
                code = applyFeature(entry, code, features.get(featureIndex), n);
                featureIndex++;
                entry.incrementFeaturesImplemented();
            }

            entry.incrementIterations();
            entry.setGeneratedCode(code);
            store.update(entry);

            if (!featureMode && report.isBugFree()) {
                log.info("[Orchestrator] Bug-free after {} iteration(s)", n);
                break;
            }
        }
        return code;
    }

    private WorkflowResult complete(WorkflowEntry entry, String code, long start, boolean featureMode)
            throws WorkflowStore.PersistenceException {

        List<String> findings = new ArrayList<>();
        for (SecurityFinding finding : sanitizer.checkCodeSecurity(code)) {
            log.warn("[Orchestrator] {} (entry {})", finding.getMessage(), entry.getId());
            findings.add(finding.getMessage());
        }

        double duration = secondsSince(start);
        entry.setGeneratedCode(code);
        entry.setSecurityFindings(findings);
        moveTo(entry, WorkflowPhase.COMPLETED);
        entry.markCompleted(clock.instant(), duration);
        store.update(entry);

        Integer features = featureMode ? entry.getFeaturesImplemented() : null;
        analytics.logCompletion(new CompletionRecord(entry.getId(), duration,
                entry.getIterationCount(), features, clock.instant()));

        log.info("========== WORKFLOW COMPLETED {} | iterations={} | {}s ==========",
                entry.getId(), entry.getIterationCount(), String.format("%.2f", duration));

        return featureMode
                ? WorkflowResult.featureEnhanced(entry.getId(), code, entry.getIterationCount(),
                        duration, entry.getFeaturesImplemented())
                : WorkflowResult.refinement(entry.getId(), code, entry.getIterationCount(), duration);
    }

    // =========================================================================
    // STEPS
    // =========================================================================

    private BugReportAggregator checkBugs(WorkflowEntry entry, String code) {
        moveTo(entry, WorkflowPhase.CHECKING_BUGS);

        String              input      = sanitizer.sanitizeCode(code);
        BugReportAggregator aggregator = new BugReportAggregator();

        for (ModelConfig checker : selector.modelsFor(TaskType.CHECKING)) {
            LLMResult result = callWithRetry(checker, input, TaskType.CHECKING, entry);
            if (!result.isSuccess()) {
                log.warn("[Orchestrator] Checker {} skipped: {}", checker.getId(), result.getError());
                continue;
            }
            if (aggregator.add(result.getText())) {
                log.info("[Orchestrator] Checker {} reported issues", checker.getId());
            }
        }

        if (!aggregator.isBugFree()) {
            log.info("[Orchestrator] {} report(s), severities {}",
                    aggregator.getReportCount(), aggregator.getSeverityCounts());
        }
        return aggregator;
    }

    private String fix(WorkflowEntry entry, String code, String bugReport, int iteration) {
        moveTo(entry, WorkflowPhase.FIXING);

        ModelConfig model  = selector.select(TaskType.FIXING);
        LLMResult   result = callWithRetry(model, prompts.buildFixPrompt(code, bugReport), TaskType.FIXING, entry);

        if (!result.isSuccess()) {
            log.warn("[Orchestrator] Fix by {} failed, keeping previous code: {}", model.getId(), result.getError());
            return code;
        }
        String fixed = result.getText();
        if (fixed.isBlank()) {
            log.warn("[Orchestrator] Fix by {} returned no code, keeping previous code", model.getId());
            return code;
        }
        if (!fixed.equals(code)) {
            versions.save(entry.getId(), iteration, fixed, "Bug fixes by " + model.getId());
        }
        return fixed;
    }

    private String applyFeature(WorkflowEntry entry, String code, String feature, int iteration) {
        moveTo(entry, WorkflowPhase.FEATURE_INJECTION);

        ModelConfig model  = selector.select(TaskType.FEATURE);
        LLMResult   result = callWithRetry(model, prompts.buildFeaturePrompt(feature, code), TaskType.FEATURE, entry);

        if (!result.isSuccess()) {
            log.warn("[Orchestrator] Feature '{}' by {} failed, moving on: {}", feature, model.getId(), result.getError());
            return code;
        }
        String enhanced = result.getText();
        if (enhanced.isBlank()) {
            log.warn("[Orchestrator] Feature '{}' by {} returned no code, moving on", feature, model.getId());
            return code;
        }
        if (!enhanced.equals(code)) {
            versions.save(entry.getId(), iteration, enhanced, "Feature '" + feature + "' by " + model.getId());
        }
        log.info("[Orchestrator] Applied feature '{}' in iteration {}", feature, iteration);
        return enhanced;
    }

    // =========================================================================
    // RETRY
    // =========================================================================

    private LLMResult callWithRetry(ModelConfig model, String input, TaskType task, WorkflowEntry entry) {
        int       maxAttempts = settings.getRetryMaxAttempts();
        LLMResult result      = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            result = client.call(model, input, task, entry.getLanguage(), entry.getId());

            if (result.isSuccess() || !result.getError().isRateLimit() || attempt == maxAttempts) {
                return result;
            }

            long backoff = computeBackoff(attempt);
            log.warn("[Orchestrator] {} rate limited for {} (attempt {}/{}), retrying in {}ms",
                    model.getId(), task.getKey(), attempt, maxAttempts, backoff);
            if (!sleep(backoff)) {
                return result;
            }
        }
        return result;
    }

    /** Exponential backoff with jitter up to half the base delay */
    private long computeBackoff(int attempt) {
        long base        = settings.getRetryBackoffMs();
        long exponential = base * (1L << (attempt - 1));
        long jitter      = jitterRandom.nextLong(base / 2 + 1);
        return exponential + jitter;
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private void moveTo(WorkflowEntry entry, WorkflowPhase next) {
        WorkflowPhase current = entry.getPhase();
        if (current == next) return;
        log.info("[Orchestrator] Transition: {} → {}", current, next);
        if (next != WorkflowPhase.COMPLETED) {
            entry.transitionTo(next);
        }
    }

    private WorkflowException failRun(WorkflowEntry entry, long start, String message, Throwable cause) {
        log.error("[Orchestrator] Workflow {} failed: {}", entry.getId(), message);

        entry.markFailed(message, clock.instant(), secondsSince(start));
        WorkflowException failure = new WorkflowException(message, entry.getId(), cause);
        try {
            store.update(entry);
        } catch (WorkflowStore.PersistenceException e) {
            log.error("[Orchestrator] Could not record failure of {}: {}", entry.getId(), e.getMessage());
            failure.addSuppressed(e);
        }
        return failure;
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
