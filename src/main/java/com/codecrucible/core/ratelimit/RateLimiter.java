package com.codecrucible.core.ratelimit;

import com.codecrucible.llm.ModelConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window call and token budget per model.
 *
 * Never blocks, sleeps or retries: a request that would push either counter
 * past the model's per-minute ceiling is refused and the caller decides what
 * to do. Check-and-increment happens under the model's window lock, so two
 * runs hitting the same model cannot both take the last slot.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final Duration WINDOW = Duration.ofSeconds(60);

    private final RateLimiterState state;
    private final Clock            clock;

    public RateLimiter(RateLimiterState state, Clock clock) {
        this.state = state;
        this.clock = clock;
    }

    /**
     * Debits one call and {@code estimatedTokens} from the model's window, or
     * refuses without debiting anything.
     */
    public RateLimitDecision acquire(ModelConfig model, long estimatedTokens) {
        long tokens = Math.max(0, estimatedTokens);
        RateLimiterState.Window window = state.windowFor(model.getId());

        synchronized (window) {
            rollIfExpired(window);

            if (window.calls + 1 > model.getCallsPerMinute()) {
                log.warn("[RateLimiter] Call budget exhausted for {} ({}/{} calls)",
                        model.getId(), window.calls, model.getCallsPerMinute());
                return RateLimitDecision.exceeded("Rate limit exceeded for model " + model.getId()
                        + ": " + model.getCallsPerMinute() + " calls per minute");
            }
            if (window.tokens + tokens > model.getTokensPerMinute()) {
                log.warn("[RateLimiter] Token budget exhausted for {} ({}+{}/{} tokens)",
                        model.getId(), window.tokens, tokens, model.getTokensPerMinute());
                return RateLimitDecision.exceeded("Rate limit exceeded for model " + model.getId()
                        + ": " + model.getTokensPerMinute() + " tokens per minute");
            }

            window.calls++;
            window.tokens += tokens;
            log.debug("[RateLimiter] {} acquired (calls={}/{}, tokens={}/{})",
                    model.getId(), window.calls, model.getCallsPerMinute(),
                    window.tokens, model.getTokensPerMinute());
            return RateLimitDecision.allowed();
        }
    }

    /**
     * Adds tokens consumed after the fact (response tokens). May push the window
     * past its ceiling; the next {@link #acquire} is then refused.
     */
    public void recordTokens(ModelConfig model, long tokens) {
        if (tokens <= 0) return;
        RateLimiterState.Window window = state.windowFor(model.getId());
        synchronized (window) {
            rollIfExpired(window);
            window.tokens += tokens;
        }
    }

    private void rollIfExpired(RateLimiterState.Window window) {
        Instant now = clock.instant();
        if (window.start == null || !now.isBefore(window.start.plus(WINDOW))) {
            window.start  = now;
            window.calls  = 0;
            window.tokens = 0;
        }
    }
}
