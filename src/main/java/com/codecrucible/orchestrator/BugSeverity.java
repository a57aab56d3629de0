package com.codecrucible.orchestrator;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Severity a checker states in its report ("Severity: Major"). Only used for
 * logging; any non-blank report still triggers a fix.
 */
public enum BugSeverity {
    MAJOR,
    MINOR,
    INFO,
    UNKNOWN;

    private static final Pattern SEVERITY_LINE =
            Pattern.compile("severity\\s*:\\s*(major|minor|info)\\b", Pattern.CASE_INSENSITIVE);

    public static BugSeverity parse(String report) {
        if (report == null) return UNKNOWN;
        Matcher m = SEVERITY_LINE.matcher(report);
        if (!m.find()) return UNKNOWN;
        return valueOf(m.group(1).toUpperCase(Locale.ROOT));
    }
}
