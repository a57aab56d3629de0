package com.codecrucible.controller;

import com.codecrucible.controller.dto.GenerationRequest;
import com.codecrucible.controller.dto.GenerationResponse;
import com.codecrucible.core.analytics.InMemoryAnalyticsSink;
import com.codecrucible.core.analytics.UsageSummary;
import com.codecrucible.core.version.CodeVersion;
import com.codecrucible.core.version.CodeVersionStore;
import com.codecrucible.core.workflow.WorkflowEntry;
import com.codecrucible.core.workflow.WorkflowStore;
import com.codecrucible.orchestrator.WorkflowException;
import com.codecrucible.orchestrator.WorkflowOrchestrator;
import com.codecrucible.orchestrator.WorkflowResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class GenerationController {

    private static final Logger log = LoggerFactory.getLogger(GenerationController.class);

    private final WorkflowOrchestrator  orchestrator;
    private final WorkflowStore         store;
    private final CodeVersionStore      versions;
    private final InMemoryAnalyticsSink analytics;

    public GenerationController(
            WorkflowOrchestrator  orchestrator,
            WorkflowStore         store,
            CodeVersionStore      versions,
            InMemoryAnalyticsSink analytics
    ) {
        this.orchestrator = orchestrator;
        this.store        = store;
        this.versions     = versions;
        this.analytics    = analytics;
    }

    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GenerationRequest request) {

        String prompt = request.getPrompt();

        if (prompt == null || prompt.trim().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "prompt is required"));
        }

        List<String> features = request.getFeatures();

        try {
            WorkflowResult result = (features == null || features.isEmpty())
                    ? orchestrator.runWorkflow(prompt, request.getLanguage())
                    : orchestrator.generateFeatureEnhancedCode(prompt, features, request.getLanguage());

            return ResponseEntity.ok(GenerationResponse.from(result));

        } catch (WorkflowException e) {
            log.warn("[API] Generation failed for entry {}: {}", e.getEntryId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/workflows/{id}")
    public ResponseEntity<WorkflowEntry> getWorkflow(@PathVariable String id) {
        return store.findById(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/workflows/{id}/versions")
    public ResponseEntity<List<CodeVersion>> getVersions(@PathVariable String id) {
        if (store.findById(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(versions.versions(id));
    }

    @GetMapping("/analytics/usage")
    public ResponseEntity<List<UsageSummary>> usage(@RequestParam(defaultValue = "30") int days) {
        if (days < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(analytics.usageReport(Duration.ofDays(days)));
    }
}
