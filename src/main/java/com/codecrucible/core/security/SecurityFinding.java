package com.codecrucible.core.security;

/**
 * One denylist hit reported by {@link SecuritySanitizer#checkCodeSecurity(String)}.
 */
public class SecurityFinding {

    public enum Category {
        DISALLOWED_IMPORT,
        DANGEROUS_FUNCTION,
        SHELL_INVOCATION
    }

    private final Category category;
    private final String   token;
    private final String   message;

    public SecurityFinding(Category category, String token, String message) {
        this.category = category;
        this.token    = token;
        this.message  = message;
    }

    public Category getCategory() {
        return category;
    }

    /** The denylisted module, function or shell call that matched. */
    public String getToken() {
        return token;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return message;
    }
}
