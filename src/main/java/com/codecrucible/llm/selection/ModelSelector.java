package com.codecrucible.llm.selection;

import com.codecrucible.config.EngineSettings;
import com.codecrucible.config.RotationStrategy;
import com.codecrucible.llm.ModelConfig;
import com.codecrucible.llm.ModelRegistry;
import com.codecrucible.llm.TaskType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Picks the backend for the next call of a given task type.
 *
 * ROUND_ROBIN  models[cursor], cursor = (cursor + 1) mod n
 * RANDOM       uniform draw
 * WEIGHTED     cumulative-weight scan against a uniform draw in [0, total)
 */
@Component
public class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    private final ModelRegistry      registry;
    private final ModelSelectorState state;
    private final RotationStrategy   strategy;
    private final Random             random;

    @Autowired
    public ModelSelector(ModelRegistry registry, ModelSelectorState state,
                         EngineSettings settings, Random random) {
        this(registry, state, settings.getRotationStrategy(), random);
    }

    public ModelSelector(ModelRegistry registry, ModelSelectorState state,
                         RotationStrategy strategy, Random random) {
        this.registry = registry;
        this.state    = state;
        this.strategy = strategy;
        this.random   = random;
    }

    public ModelConfig select(TaskType task) {
        List<ModelConfig> models = modelsFor(task);

        ModelConfig chosen = switch (strategy) {
            case ROUND_ROBIN -> models.get(state.next(task, models.size()));
            case RANDOM      -> models.get(random.nextInt(models.size()));
            case WEIGHTED    -> weightedChoice(models);
        };

        log.debug("[ModelSelector] {} -> {} ({})", task.getKey(), chosen.getId(), strategy);
        return chosen;
    }

    /** Full ordered pool for a task type, used for the checking fan-out. */
    public List<ModelConfig> modelsFor(TaskType task) {
        List<ModelConfig> models = registry.modelsFor(task);
        if (models.isEmpty()) {
            throw new NoModelsConfiguredException(task);
        }
        return models;
    }

    private ModelConfig weightedChoice(List<ModelConfig> models) {
        long total = 0;
        for (ModelConfig model : models) {
            total += Math.max(0, model.getWeight());
        }
        if (total == 0) {
            // every weight is zero; fall back to a uniform draw
            return models.get(random.nextInt(models.size()));
        }

        double draw       = random.nextDouble() * total;
        double cumulative = 0;
        for (ModelConfig model : models) {
            cumulative += Math.max(0, model.getWeight());
            if (draw < cumulative) {
                return model;
            }
        }
        for (int i = models.size() - 1; i >= 0; i--) {
            if (models.get(i).getWeight() > 0) return models.get(i);
        }
        return models.get(models.size() - 1);
    }
}
