package com.codecrucible.core.ratelimit;

/**
 * Outcome of {@link RateLimiter#acquire}. Construct via the static factories.
 */
public final class RateLimitDecision {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, null);

    private final boolean allowed;
    private final String  reason;

    private RateLimitDecision(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason  = reason;
    }

    public static RateLimitDecision allowed() {
        return ALLOWED;
    }

    public static RateLimitDecision exceeded(String reason) {
        return new RateLimitDecision(false, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    /** Why the budget was refused; {@code null} when allowed. */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return allowed ? "RateLimitDecision{allowed}" : "RateLimitDecision{exceeded, reason='" + reason + "'}";
    }
}
