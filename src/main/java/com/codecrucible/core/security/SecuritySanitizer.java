package com.codecrucible.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Text-level safety net applied to prompts and code before they are sent to a
 * backend.
 *
 * This is regex based, not a parser. A denylisted token in an unrelated
 * context (a string literal, a comment) still removes the whole line, and a
 * statement spread over several lines is only stripped on its first line.
 */
@Component
public class SecuritySanitizer {

    private static final Logger log = LoggerFactory.getLogger(SecuritySanitizer.class);

    public static final List<String> DISALLOWED_IMPORTS   = List.of("os", "subprocess", "sys", "shutil");
    public static final List<String> DISALLOWED_FUNCTIONS = List.of("eval", "exec", "system", "popen");

    private static final Pattern PROMPT_INJECTION_CHARS = Pattern.compile("[`$\\\\]");
    private static final Pattern SCRIPT_BLOCKS =
            Pattern.compile("<(script|style)\\b[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern SHELL_INVOCATION = Pattern.compile(
            "\\b(?:os\\.(?:system|popen)|subprocess\\.(?:call|run|popen|check_output|check_call))\\s*\\(",
            Pattern.CASE_INSENSITIVE);

    private final Map<String, List<Pattern>> importPatterns   = new LinkedHashMap<>();
    private final Map<String, Pattern>       functionPatterns = new LinkedHashMap<>();

    public SecuritySanitizer() {
        for (String module : DISALLOWED_IMPORTS) {
            String quoted = Pattern.quote(module);
            importPatterns.put(module, List.of(
                    // import os | import os.path | import json, os | import json as j, os
                    Pattern.compile("^\\s*import\\s+(?:[\\w.]+(?:\\s+as\\s+\\w+)?\\s*,\\s*)*"
                            + quoted + "(?:\\.[\\w.]+)?\\b", Pattern.CASE_INSENSITIVE),
                    // from os import x | from os.path import x
                    Pattern.compile("^\\s*from\\s+" + quoted + "(?:\\.[\\w.]+)?\\s+import\\b",
                            Pattern.CASE_INSENSITIVE)
            ));
        }
        for (String function : DISALLOWED_FUNCTIONS) {
            functionPatterns.put(function,
                    Pattern.compile("\\b" + Pattern.quote(function) + "\\s*\\(", Pattern.CASE_INSENSITIVE));
        }
    }

    // =========================================================================
    // Prompts
    // =========================================================================

    /**
     * Removes backticks, {@code $} and backslashes, drops script/style blocks and
     * trims. Total: {@code null} yields an empty string.
     */
    public String sanitizePrompt(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = SCRIPT_BLOCKS.matcher(text).replaceAll("");
        cleaned = PROMPT_INJECTION_CHARS.matcher(cleaned).replaceAll("");
        return cleaned.trim();
    }

    // =========================================================================
    // Code
    // =========================================================================

    /**
     * Drops every line that imports a denylisted module, calls a denylisted
     * function or invokes a shell. Remaining lines keep their order and content.
     */
    public String sanitizeCode(String code) {
        if (code == null || code.isEmpty()) {
            return "";
        }

        String[] lines   = code.split("\n", -1);
        List<String> kept = new ArrayList<>(lines.length);
        int removed = 0;

        for (String line : lines) {
            if (isDangerousLine(line)) {
                removed++;
                continue;
            }
            kept.add(line);
        }

        if (removed > 0) {
            log.debug("[Security] Stripped {} dangerous line(s) from code", removed);
        }
        return String.join("\n", kept);
    }

    /**
     * Reports denylist hits without modifying the code. One finding per distinct
     * module and function, plus one if any shell invocation is present.
     */
    public List<SecurityFinding> checkCodeSecurity(String code) {
        List<SecurityFinding> findings = new ArrayList<>();
        if (code == null || code.isEmpty()) {
            return findings;
        }

        String[] lines = code.split("\n", -1);

        for (Map.Entry<String, List<Pattern>> entry : importPatterns.entrySet()) {
            if (anyLineMatches(lines, entry.getValue())) {
                findings.add(new SecurityFinding(
                        SecurityFinding.Category.DISALLOWED_IMPORT,
                        entry.getKey(),
                        "Security: Use of disallowed import '" + entry.getKey() + "'"));
            }
        }

        for (Map.Entry<String, Pattern> entry : functionPatterns.entrySet()) {
            if (entry.getValue().matcher(code).find()) {
                findings.add(new SecurityFinding(
                        SecurityFinding.Category.DANGEROUS_FUNCTION,
                        entry.getKey(),
                        "Security: Use of dangerous function '" + entry.getKey() + "'"));
            }
        }

        var shell = SHELL_INVOCATION.matcher(code);
        if (shell.find()) {
            String call = shell.group().replaceAll("\\s*\\($", "");
            findings.add(new SecurityFinding(
                    SecurityFinding.Category.SHELL_INVOCATION,
                    call,
                    "Security: Potential shell injection vulnerability"));
        }

        return findings;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private boolean isDangerousLine(String line) {
        for (List<Pattern> patterns : importPatterns.values()) {
            for (Pattern p : patterns) {
                if (p.matcher(line).find()) return true;
            }
        }
        for (Pattern p : functionPatterns.values()) {
            if (p.matcher(line).find()) return true;
        }
        return SHELL_INVOCATION.matcher(line).find();
    }

    private boolean anyLineMatches(String[] lines, List<Pattern> patterns) {
        for (String line : lines) {
            for (Pattern p : patterns) {
                if (p.matcher(line).find()) return true;
            }
        }
        return false;
    }
}
