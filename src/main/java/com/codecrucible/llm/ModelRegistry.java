package com.codecrucible.llm;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of every configured backend and the ordered pool each task
 * type draws from. Pools are kept in configuration order; the round-robin
 * cursor and the checking fan-out both depend on that order.
 */
public final class ModelRegistry {

    private final Map<String, ModelConfig>         modelsById;
    private final Map<TaskType, List<ModelConfig>> pools;

    public ModelRegistry(Map<TaskType, List<ModelConfig>> pools) {
        Map<TaskType, List<ModelConfig>> copy = new EnumMap<>(TaskType.class);
        Map<String, ModelConfig>         byId = new LinkedHashMap<>();

        for (Map.Entry<TaskType, List<ModelConfig>> entry : pools.entrySet()) {
            List<ModelConfig> models = entry.getValue() != null ? List.copyOf(entry.getValue()) : List.of();
            copy.put(entry.getKey(), models);
            for (ModelConfig model : models) {
                byId.putIfAbsent(model.getId(), model);
            }
        }

        this.pools      = Collections.unmodifiableMap(copy);
        this.modelsById = Collections.unmodifiableMap(byId);
    }

    /** Ordered pool for a task type; empty when nothing is configured. */
    public List<ModelConfig> modelsFor(TaskType task) {
        return pools.getOrDefault(task, List.of());
    }

    public Optional<ModelConfig> findById(String id) {
        return Optional.ofNullable(modelsById.get(id));
    }
}
