package com.codecrucible.core.ratelimit;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-model call and token counters for the current fixed window.
 *
 * One instance is shared by every run in the process. Each model's counters
 * are guarded by that model's {@link Window} monitor; nothing survives a
 * restart.
 */
public class RateLimiterState {

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    Window windowFor(String modelId) {
        return windows.computeIfAbsent(modelId, id -> new Window());
    }

    /** Calls counted in the model's current window, for diagnostics. */
    public int callsInWindow(String modelId) {
        Window window = windows.get(modelId);
        if (window == null) return 0;
        synchronized (window) {
            return window.calls;
        }
    }

    public long tokensInWindow(String modelId) {
        Window window = windows.get(modelId);
        if (window == null) return 0;
        synchronized (window) {
            return window.tokens;
        }
    }

    static final class Window {
        Instant start;
        int     calls;
        long    tokens;
    }
}
