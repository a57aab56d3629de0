package com.codecrucible.orchestrator;

import com.codecrucible.config.EngineSettings;
import com.codecrucible.config.RotationStrategy;
import com.codecrucible.core.analytics.CompletionRecord;
import com.codecrucible.core.analytics.InMemoryAnalyticsSink;
import com.codecrucible.core.metrics.CodeMetricsCalculator;
import com.codecrucible.core.security.SecuritySanitizer;
import com.codecrucible.core.version.CodeVersionStore;
import com.codecrucible.core.workflow.InMemoryWorkflowStore;
import com.codecrucible.core.workflow.WorkflowEntry;
import com.codecrucible.core.workflow.WorkflowPhase;
import com.codecrucible.core.workflow.WorkflowStatus;
import com.codecrucible.core.workflow.WorkflowStore;
import com.codecrucible.llm.LLMClient;
import com.codecrucible.llm.LLMError;
import com.codecrucible.llm.LLMResult;
import com.codecrucible.llm.ModelConfig;
import com.codecrucible.llm.ModelRegistry;
import com.codecrucible.llm.TaskType;
import com.codecrucible.llm.selection.ModelSelector;
import com.codecrucible.llm.selection.ModelSelectorState;
import com.codecrucible.llm.selection.NoModelsConfiguredException;
import com.codecrucible.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowOrchestratorTest {

    private static final String GENERATED = "def add(a, b):\n    return a + b";

    private MutableClock          clock;
    private InMemoryWorkflowStore store;
    private CodeVersionStore      versions;
    private InMemoryAnalyticsSink analytics;
    private ScriptedClient        client;

    @BeforeEach
    void setUp() {
        clock     = new MutableClock();
        store     = new InMemoryWorkflowStore();
        versions  = new CodeVersionStore(new CodeMetricsCalculator(), clock);
        analytics = new InMemoryAnalyticsSink(new ObjectMapper(), clock);
        client    = new ScriptedClient();
        client.on(TaskType.GENERATION, input -> LLMResult.success(GENERATED));
        client.on(TaskType.CHECKING,   input -> LLMResult.success(""));
        client.on(TaskType.FIXING,     input -> LLMResult.success(GENERATED + "\n# fixed"));
        client.on(TaskType.FEATURE,    input -> LLMResult.success(GENERATED + "\n# feature"));
    }

    // =========================================================================
    // Fixtures
    // =========================================================================

    /** Answers per task type and records every call in order. */
    static class ScriptedClient implements LLMClient {

        interface Answer {
            LLMResult answer(String input);
        }

        final Map<TaskType, Answer> answers = new EnumMap<>(TaskType.class);
        final List<TaskType>        calls   = new ArrayList<>();
        final List<String>          inputs  = new ArrayList<>();
        final List<String>          models  = new ArrayList<>();

        void on(TaskType task, Answer answer) {
            answers.put(task, answer);
        }

        int count(TaskType task) {
            return (int) calls.stream().filter(t -> t == task).count();
        }

        @Override
        public LLMResult call(ModelConfig model, String input, TaskType task, String language, String requestId) {
            calls.add(task);
            inputs.add(input);
            models.add(model.getId());
            return answers.get(task).answer(input);
        }
    }

    static class FailingStore extends InMemoryWorkflowStore {
        private int updatesLeft;

        FailingStore(int updatesBeforeFailure) {
            this.updatesLeft = updatesBeforeFailure;
        }

        @Override
        public void update(WorkflowEntry entry) throws PersistenceException {
            if (updatesLeft-- <= 0) {
                throw new PersistenceException("disk full");
            }
            super.update(entry);
        }
    }

    private static ModelConfig model(String id) {
        return ModelConfig.builder(id).endpoint("http://localhost/" + id).build();
    }

    private static Map<TaskType, List<ModelConfig>> pools(String... checkers) {
        Map<TaskType, List<ModelConfig>> pools = new EnumMap<>(TaskType.class);
        pools.put(TaskType.GENERATION, List.of(model("gen")));
        List<ModelConfig> checking = new ArrayList<>();
        for (String id : checkers) {
            checking.add(model(id));
        }
        pools.put(TaskType.CHECKING, checking);
        pools.put(TaskType.FIXING,   List.of(model("fixer")));
        pools.put(TaskType.FEATURE,  List.of(model("featurer")));
        return pools;
    }

    private WorkflowOrchestrator orchestrator(EngineSettings settings, Map<TaskType, List<ModelConfig>> pools,
                                              WorkflowStore workflowStore) {
        ModelSelector selector = new ModelSelector(new ModelRegistry(pools), new ModelSelectorState(),
                RotationStrategy.ROUND_ROBIN, new Random(3));
        SecuritySanitizer sanitizer = new SecuritySanitizer();
        return new WorkflowOrchestrator(selector, client, sanitizer, new PromptBuilder(sanitizer),
                workflowStore, versions, analytics, settings, clock, new Random(5));
    }

    private WorkflowOrchestrator orchestrator(int maxIterations, int iterationLimit) {
        return orchestrator(EngineSettings.defaults().withIterations(maxIterations, iterationLimit),
                pools("checker"), store);
    }

    // =========================================================================
    // Refinement loop
    // =========================================================================

    @Test
    void testIterationsNeverExceedMax() throws Exception {
        client.on(TaskType.CHECKING, input -> LLMResult.success("Bug: still broken"));

        for (int max = 1; max <= 6; max++) {
            WorkflowResult result = orchestrator(max, 3).runWorkflow("add two numbers", "python");
            assertTrue(result.getIterations() <= max, "iterations " + result.getIterations() + " > " + max);
            assertEquals(max, result.getIterations());
        }
    }

    @Test
    void testBugFreeStopsAfterFirstIteration() throws Exception {
        client.on(TaskType.CHECKING, input -> LLMResult.success("  \n\t"));

        WorkflowResult result = orchestrator(10, 3).runWorkflow("add two numbers", "python");

        assertEquals(1, result.getIterations());
        assertEquals(0, client.count(TaskType.FIXING));
        assertNull(result.getFeaturesImplemented());
    }

    @Test
    void testEndToEndAddTwoNumbers() throws Exception {
        client.on(TaskType.CHECKING, input -> LLMResult.success("no issues"));

        WorkflowResult result = orchestrator(5, 3).runWorkflow("add two numbers", "python");

        assertEquals(1, result.getIterations());
        assertEquals(GENERATED, result.getCode());
        assertEquals(0, client.count(TaskType.FIXING));
        assertEquals(1, client.count(TaskType.GENERATION));

        WorkflowEntry entry = store.findById(result.getEntryId()).orElseThrow();
        assertEquals(WorkflowStatus.COMPLETED, entry.getStatus());
        assertEquals(WorkflowPhase.COMPLETED, entry.getPhase());
        assertEquals(GENERATED, entry.getGeneratedCode());
        assertNotNull(entry.getCompletedAt());

        List<CompletionRecord> completions = analytics.getCompletions();
        assertEquals(1, completions.size());
        assertEquals(1, completions.get(0).getIterations());
        assertEquals(1, versions.versions(result.getEntryId()).size());
    }

    @Test
    void testBugReportTriggersFixWithReportAndSanitizedCode() throws Exception {
        client.on(TaskType.GENERATION, input -> LLMResult.success("import os\ndef f():\n    return 1"));
        client.on(TaskType.CHECKING,   input -> input.contains("# fixed")
                ? LLMResult.success("")
                : LLMResult.success("f never uses its input\nSeverity: Minor"));
        client.on(TaskType.FIXING,     input -> LLMResult.success("def f():\n    return 2\n# fixed"));

        WorkflowResult result = orchestrator(5, 3).runWorkflow("write f", "python");

        assertEquals(2, result.getIterations());
        assertEquals("def f():\n    return 2\n# fixed", result.getCode());

        String fixPrompt = client.inputs.get(client.calls.indexOf(TaskType.FIXING));
        assertTrue(fixPrompt.startsWith("Fix the following bugs in the code.\n\nBug report:\n"));
        assertTrue(fixPrompt.contains("f never uses its input"));
        assertFalse(fixPrompt.contains("import os"));

        assertFalse(client.inputs.get(client.calls.indexOf(TaskType.CHECKING)).contains("import os"));
        assertEquals(2, versions.versions(result.getEntryId()).size());
    }

    @Test
    void testFailingCheckerIsSkipped() throws Exception {
        client.on(TaskType.CHECKING, input -> LLMResult.failure(LLMError.apiError("checker down")));

        WorkflowResult result = orchestrator(
                EngineSettings.defaults().withIterations(5, 3), pools("flaky", "steady"), store)
                .runWorkflow("add two numbers", "python");

        assertEquals(1, result.getIterations());
        assertEquals(2, client.count(TaskType.CHECKING));
        assertEquals(0, client.count(TaskType.FIXING));
    }

    @Test
    void testEveryCheckerIsConsultedAndReportsAggregated() throws Exception {
        client.on(TaskType.CHECKING, input -> LLMResult.success("issue"));

        WorkflowResult result = orchestrator(
                EngineSettings.defaults().withIterations(1, 1), pools("c1", "c2"), store)
                .runWorkflow("add two numbers", "python");

        WorkflowEntry entry = store.findById(result.getEntryId()).orElseThrow();
        assertEquals("issue\n\nissue", entry.getBugReport());
        assertTrue(client.models.containsAll(List.of("c1", "c2")));
    }

    @Test
    void testFixFailureKeepsCodeAndCountsIteration() throws Exception {
        client.on(TaskType.CHECKING, input -> LLMResult.success("Bug"));
        client.on(TaskType.FIXING,   input -> LLMResult.failure(LLMError.apiError("fixer down")));

        WorkflowResult result = orchestrator(3, 3).runWorkflow("add two numbers", "python");

        assertEquals(3, result.getIterations());
        assertEquals(GENERATED, result.getCode());
        assertEquals(3, client.count(TaskType.FIXING));
    }

    // =========================================================================
    // Feature loop
    // =========================================================================

    @Test
    void testFeaturesAppliedAtIterationsThreeAndSix() throws Exception {
        List<Integer> featureIterations = new ArrayList<>();
        client.on(TaskType.FEATURE, input -> {
            featureIterations.add(client.count(TaskType.CHECKING));
            return LLMResult.success(GENERATED + "\n# feature " + featureIterations.size());
        });

        WorkflowResult result = orchestrator(9, 3)
                .generateFeatureEnhancedCode("add two numbers", List.of("logging", "validation"), "python");

        assertEquals(List.of(3, 6), featureIterations);
        assertEquals(2, result.getFeaturesImplemented());
        assertEquals(9, result.getIterations());
        assertTrue(result.getCode().endsWith("# feature 2"));

        WorkflowEntry entry = store.findById(result.getEntryId()).orElseThrow();
        assertEquals(2, entry.getFeaturesImplemented());
        assertEquals(2, analytics.getCompletions().get(0).getFeaturesImplemented());
    }

    @Test
    void testFeaturePromptCarriesFeatureAndCode() throws Exception {
        orchestrator(1, 1).generateFeatureEnhancedCode("add two numbers", List.of("add `logging`"), "python");

        String prompt = client.inputs.get(client.calls.indexOf(TaskType.FEATURE));
        assertEquals("Add feature: add logging\n\nExisting code:\n" + GENERATED, prompt);
    }

    @Test
    void testFeatureLoopDoesNotStopWhenBugFree() throws Exception {
        WorkflowResult result = orchestrator(4, 2)
                .generateFeatureEnhancedCode("add two numbers", List.of("a"), "python");

        assertEquals(4, result.getIterations());
        assertEquals(4, client.count(TaskType.CHECKING));
        assertEquals(1, client.count(TaskType.FEATURE));
        assertEquals(1, result.getFeaturesImplemented());
    }

    @Test
    void testFeatureFailureStillAdvancesIndex() throws Exception {
        client.on(TaskType.FEATURE, input -> LLMResult.failure(LLMError.apiError("feature model down")));

        WorkflowResult result = orchestrator(3, 1)
                .generateFeatureEnhancedCode("add two numbers", List.of("a", "b"), "python");

        assertEquals(2, client.count(TaskType.FEATURE));
        assertEquals(2, result.getFeaturesImplemented());
        assertEquals(GENERATED, result.getCode());
    }

    // =========================================================================
    // Failures
    // =========================================================================

    @Test
    void testGenerationFailureMarksEntryFailed() {
        client.on(TaskType.GENERATION, input -> LLMResult.failure(LLMError.apiError("HTTP 500")));

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> orchestrator(5, 3).runWorkflow("add two numbers", "python"));

        WorkflowEntry entry = store.findById(ex.getEntryId()).orElseThrow();
        assertEquals(WorkflowStatus.FAILED, entry.getStatus());
        assertTrue(entry.getError().contains("HTTP 500"));
        assertEquals(0, client.count(TaskType.CHECKING));
        assertTrue(analytics.getCompletions().isEmpty());
    }

    @Test
    void testPersistenceFailureIsRethrown() {
        FailingStore failing = new FailingStore(1);

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> orchestrator(EngineSettings.defaults(), pools("checker"), failing)
                        .runWorkflow("add two numbers", "python"));

        assertInstanceOf(WorkflowStore.PersistenceException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("disk full"));
    }

    @Test
    void testMissingCheckingPoolFailsRun() {
        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> orchestrator(EngineSettings.defaults(), pools(), store)
                        .runWorkflow("add two numbers", "python"));

        assertInstanceOf(NoModelsConfiguredException.class, ex.getCause());
        assertEquals(WorkflowStatus.FAILED, store.findById(ex.getEntryId()).orElseThrow().getStatus());
        assertEquals(GENERATED, store.findById(ex.getEntryId()).orElseThrow().getGeneratedCode());
    }

    @Test
    void testBlankPromptIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator(5, 3).runWorkflow("  ", "python"));
    }

    // =========================================================================
    // Retry, language, security
    // =========================================================================

    @Test
    void testRateLimitedCallIsRetried() throws Exception {
        int[] attempts = {0};
        client.on(TaskType.GENERATION, input -> ++attempts[0] == 1
                ? LLMResult.failure(LLMError.rateLimitExceeded("busy"))
                : LLMResult.success(GENERATED));

        WorkflowResult result = orchestrator(EngineSettings.defaults().withRetry(3, 0), pools("checker"), store)
                .runWorkflow("add two numbers", "python");

        assertEquals(GENERATED, result.getCode());
        assertEquals(2, client.count(TaskType.GENERATION));
    }

    @Test
    void testRateLimitWithoutRetryFailsGeneration() {
        client.on(TaskType.GENERATION, input -> LLMResult.failure(LLMError.rateLimitExceeded("busy")));

        assertThrows(WorkflowException.class, () -> orchestrator(5, 3).runWorkflow("add two numbers", "python"));
        assertEquals(1, client.count(TaskType.GENERATION));
    }

    @Test
    void testApiErrorIsNeverRetried() {
        client.on(TaskType.GENERATION, input -> LLMResult.failure(LLMError.apiError("bad request")));

        assertThrows(WorkflowException.class,
                () -> orchestrator(EngineSettings.defaults().withRetry(5, 0), pools("checker"), store)
                        .runWorkflow("add two numbers", "python"));
        assertEquals(1, client.count(TaskType.GENERATION));
    }

    @Test
    void testLanguageDefaultsToPython() throws Exception {
        WorkflowResult result = orchestrator(1, 1).runWorkflow("add two numbers", null);

        assertEquals(LLMClient.DEFAULT_LANGUAGE, store.findById(result.getEntryId()).orElseThrow().getLanguage());
    }

    @Test
    void testSecurityFindingsAreStoredOnCompletion() throws Exception {
        client.on(TaskType.GENERATION, input -> LLMResult.success("import os\nprint(os.getcwd())"));

        WorkflowResult result = orchestrator(1, 1).runWorkflow("show cwd", "python");

        WorkflowEntry entry = store.findById(result.getEntryId()).orElseThrow();
        assertEquals(List.of("Security: Use of disallowed import 'os'"), entry.getSecurityFindings());
    }

    @Test
    void testGenerationPromptIsSanitized() throws Exception {
        orchestrator(1, 1).runWorkflow("  add `two` numbers $now ", "python");

        assertEquals("add two numbers now", client.inputs.get(0));
    }
}
