package com.codecrucible.orchestrator;

import com.codecrucible.core.security.SecuritySanitizer;

import org.springframework.stereotype.Component;

/**
 * Prompt templates for the fix and feature steps.
 */
@Component
public class PromptBuilder {

    static final String FIX_HEADER     = "Fix the following bugs in the code.";
    static final String FEATURE_PREFIX = "Add feature: ";

    private final SecuritySanitizer sanitizer;

    public PromptBuilder(SecuritySanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public String buildFixPrompt(String code, String bugReport) {
        return FIX_HEADER + "\n\n"
                + "Bug report:\n" + bugReport + "\n\n"
                + "Code:\n" + sanitizer.sanitizeCode(code);
    }

    public String buildFeaturePrompt(String feature, String code) {
        return FEATURE_PREFIX + sanitizer.sanitizePrompt(feature) + "\n\n"
                + "Existing code:\n" + code;
    }
}
