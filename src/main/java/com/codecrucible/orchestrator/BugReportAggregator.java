package com.codecrucible.orchestrator;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collects the per-model reports of one checking pass.
 *
 * Blank reports and explicit all-clear answers ("no issues", "No bugs found.")
 * contribute nothing. The aggregate is the remaining reports joined by a blank
 * line; an empty aggregate means the code is bug-free.
 */
public class BugReportAggregator {

    private static final Pattern ALL_CLEAR = Pattern.compile(
            "(?:no\\s+(?:issues|bugs|problems|errors)(?:\\s+(?:found|detected))?|none)[.!]?",
            Pattern.CASE_INSENSITIVE);

    private final List<String>             reports    = new ArrayList<>();
    private final Map<BugSeverity, Integer> severities = new EnumMap<>(BugSeverity.class);

    /** @return whether the report was kept */
    public boolean add(String report) {
        if (isAllClear(report)) {
            return false;
        }
        String trimmed = report.trim();
        reports.add(trimmed);
        severities.merge(BugSeverity.parse(trimmed), 1, Integer::sum);
        return true;
    }

    public boolean isBugFree() {
        return reports.isEmpty();
    }

    public String getAggregateReport() {
        return String.join("\n\n", reports);
    }

    public int getReportCount() {
        return reports.size();
    }

    public Map<BugSeverity, Integer> getSeverityCounts() {
        return Map.copyOf(severities);
    }

    static boolean isAllClear(String report) {
        return report == null || report.isBlank() || ALL_CLEAR.matcher(report.trim()).matches();
    }
}
