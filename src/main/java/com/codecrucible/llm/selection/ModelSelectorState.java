package com.codecrucible.llm.selection;

import com.codecrucible.llm.TaskType;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin cursors, one per task type. Shared by every run; losing it on
 * restart just starts each rotation from the first model again.
 */
public class ModelSelectorState {

    private final Map<TaskType, AtomicInteger> cursors = new EnumMap<>(TaskType.class);

    public ModelSelectorState() {
        for (TaskType task : TaskType.values()) {
            cursors.put(task, new AtomicInteger());
        }
    }

    /**
     * Returns the current position and advances the cursor modulo
     * {@code poolSize} in one atomic step.
     */
    int next(TaskType task, int poolSize) {
        return cursors.get(task).getAndUpdate(i -> (i + 1) % poolSize) % poolSize;
    }
}
