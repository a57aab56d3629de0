package com.codecrucible.core.version;

import com.codecrucible.core.metrics.CodeMetricsCalculator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run code history. Each saved version carries its quality score and
 * cyclomatic complexity; {@link #versions(String)} lists newest first.
 */
@Component
public class CodeVersionStore {

    private static final Logger log = LoggerFactory.getLogger(CodeVersionStore.class);

    private final Map<String, List<CodeVersion>> versionsByEntry = new ConcurrentHashMap<>();
    private final AtomicLong                     sequence        = new AtomicLong();

    private final CodeMetricsCalculator metrics;
    private final Clock                 clock;

    public CodeVersionStore(CodeMetricsCalculator metrics, Clock clock) {
        this.metrics = metrics;
        this.clock   = clock;
    }

    public CodeVersion save(String entryId, int iteration, String code, String message) {
        String text = code != null ? code : "";
        CodeVersion version = new CodeVersion(
                entryId,
                iteration,
                text,
                message,
                metrics.qualityScore(text),
                metrics.cyclomaticComplexity(text),
                clock.instant(),
                sequence.incrementAndGet()
        );

        List<CodeVersion> list = versionsByEntry.computeIfAbsent(entryId, k -> new ArrayList<>());
        synchronized (list) {
            list.add(version);
        }

        log.debug("[Versions] {}", version);
        return version;
    }

    public List<CodeVersion> versions(String entryId) {
        List<CodeVersion> list = versionsByEntry.get(entryId);
        if (list == null) {
            return List.of();
        }
        List<CodeVersion> copy;
        synchronized (list) {
            copy = new ArrayList<>(list);
        }
        Collections.reverse(copy);
        return copy;
    }
}
