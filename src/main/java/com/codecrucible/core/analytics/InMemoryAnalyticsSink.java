package com.codecrucible.core.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local analytics sink.
 *
 * Keeps every record in memory and writes one JSON line per completed run to
 * the log ({@code [Benchmark] {...}}) so log shippers can pick runs up without
 * a database.
 */
@Component
public class InMemoryAnalyticsSink implements AnalyticsSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAnalyticsSink.class);

    private final ConcurrentLinkedQueue<ApiCallRecord>    apiCalls    = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CompletionRecord> completions = new ConcurrentLinkedQueue<>();

    private final ObjectMapper objectMapper;
    private final Clock        clock;

    public InMemoryAnalyticsSink(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public void logApiCall(ApiCallRecord record) {
        apiCalls.add(record);
        log.debug("[Analytics] {}", record);
    }

    @Override
    public void logCompletion(CompletionRecord record) {
        completions.add(record);

        ObjectNode json = objectMapper.createObjectNode();
        json.put("entry_id", record.getEntryId());
        json.put("duration_seconds", record.getDurationSeconds());
        json.put("iterations", record.getIterations());
        if (record.getFeaturesImplemented() != null) {
            json.put("features_implemented", record.getFeaturesImplemented());
        }
        json.put("completed_at", record.getTimestamp().toString());

        try {
            log.info("[Benchmark] {}", objectMapper.writeValueAsString(json));
        } catch (JsonProcessingException e) {
            log.warn("[Analytics] Could not serialize completion for {}: {}", record.getEntryId(), e.getMessage());
        }
    }

    public List<ApiCallRecord> getApiCalls() {
        return List.copyOf(apiCalls);
    }

    public List<CompletionRecord> getCompletions() {
        return List.copyOf(completions);
    }

    /**
     * Per (model, action) totals for calls newer than {@code now - window},
     * busiest pair first.
     */
    public List<UsageSummary> usageReport(Duration window) {
        Instant since = clock.instant().minus(window);

        Map<String, List<ApiCallRecord>> grouped = new LinkedHashMap<>();
        for (ApiCallRecord record : apiCalls) {
            if (record.getTimestamp().isBefore(since)) continue;
            grouped.computeIfAbsent(record.getModelId() + "\u0000" + record.getAction(), k -> new ArrayList<>())
                   .add(record);
        }

        List<UsageSummary> report = new ArrayList<>();
        for (List<ApiCallRecord> records : grouped.values()) {
            long   tokensIn  = 0;
            long   tokensOut = 0;
            double duration  = 0;
            for (ApiCallRecord r : records) {
                tokensIn  += r.getTokensIn();
                tokensOut += r.getTokensOut();
                duration  += r.getDurationSeconds();
            }
            ApiCallRecord first = records.get(0);
            report.add(new UsageSummary(first.getModelId(), first.getAction(), records.size(),
                    tokensIn, tokensOut, duration / records.size()));
        }

        report.sort(Comparator.comparingLong(UsageSummary::getCalls).reversed());
        return report;
    }
}
