package com.codecrucible.core.metrics;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap textual code metrics recorded with every stored version.
 *
 * qualityScore:  100, minus 1 per line over 80 chars, minus 10 when the second
 *                line is not a docstring, minus 5 when no comment appears;
 *                clamped to [0, 100]
 * complexity:    1 + number of "if ", "for ", "while " tokens
 */
@Component
public class CodeMetricsCalculator {

    public static final int MAX_LINE_LENGTH = 80;

    static final int LONG_LINE_PENALTY         = 1;
    static final int MISSING_DOCSTRING_PENALTY = 10;
    static final int MISSING_COMMENT_PENALTY   = 5;

    private static final Pattern BRANCH_TOKEN = Pattern.compile("\\b(?:if|for|while) ");

    public int qualityScore(String code) {
        if (code == null || code.isBlank()) {
            return 0;
        }
        String[] lines = code.split("\n", -1);
        int score = 100;

        for (String line : lines) {
            if (line.length() > MAX_LINE_LENGTH) {
                score -= LONG_LINE_PENALTY;
            }
        }

        if (lines.length < 2 || !isDocstring(lines[1])) {
            score -= MISSING_DOCSTRING_PENALTY;
        }

        if (!code.contains("#") && !code.contains("//")) {
            score -= MISSING_COMMENT_PENALTY;
        }

        return Math.max(0, Math.min(100, score));
    }

    public int cyclomaticComplexity(String code) {
        if (code == null || code.isEmpty()) {
            return 1;
        }
        Matcher m = BRANCH_TOKEN.matcher(code);
        int branches = 0;
        while (m.find()) {
            branches++;
        }
        return 1 + branches;
    }

    private static boolean isDocstring(String line) {
        String t = line.trim();
        return t.startsWith("\"\"\"") || t.startsWith("'''") || t.startsWith("/**");
    }
}
