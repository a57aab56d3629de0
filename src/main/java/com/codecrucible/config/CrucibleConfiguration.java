package com.codecrucible.config;

import com.codecrucible.core.ratelimit.RateLimiterState;
import com.codecrucible.llm.ModelConfig;
import com.codecrucible.llm.ModelRegistry;
import com.codecrucible.llm.TaskType;
import com.codecrucible.llm.selection.ModelSelectorState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Turns the raw {@link CrucibleProperties} into validated engine settings and
 * owns the process-wide shared state (rate counters, rotation cursors).
 *
 * Validation is eager: a task type without models, a referenced model without
 * an endpoint, or an out-of-range knob stops the context from starting.
 */
@Configuration
@EnableConfigurationProperties(CrucibleProperties.class)
public class CrucibleConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CrucibleConfiguration.class);

    @Bean
    public EngineSettings engineSettings(CrucibleProperties properties) {
        EngineSettings settings = buildSettings(properties);
        log.info("[Config] {}", settings);
        return settings;
    }

    @Bean
    public ModelRegistry modelRegistry(CrucibleProperties properties) {
        ModelRegistry registry = buildRegistry(properties);
        for (TaskType task : TaskType.values()) {
            log.info("[Config] {} pool: {}", task.getKey(),
                    registry.modelsFor(task).stream().map(ModelConfig::getId).toList());
        }
        return registry;
    }

    @Bean
    public RateLimiterState rateLimiterState() {
        return new RateLimiterState();
    }

    @Bean
    public ModelSelectorState modelSelectorState() {
        return new ModelSelectorState();
    }

    @Bean
    public Clock crucibleClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random selectionRandom() {
        return new Random();
    }

    // =========================================================================
    // Binding + validation
    // =========================================================================

    static EngineSettings buildSettings(CrucibleProperties properties) {
        CrucibleProperties.Retry retry = properties.getRetry() != null
                ? properties.getRetry()
                : new CrucibleProperties.Retry();
        return new EngineSettings(
                properties.getMaxIterations(),
                properties.getIterationLimit(),
                RotationStrategy.fromKey(properties.getRotationStrategy()),
                Duration.ofSeconds(properties.getCacheTtlSeconds()),
                retry.getMaxAttempts(),
                retry.getBackoffMs()
        );
    }

    static ModelRegistry buildRegistry(CrucibleProperties properties) {
        Map<TaskType, List<String>> idsByTask = new EnumMap<>(TaskType.class);
        for (Map.Entry<String, List<String>> entry : properties.getTasks().entrySet()) {
            TaskType task;
            try {
                task = TaskType.fromKey(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationValidationException(e.getMessage());
            }
            List<String> ids = new ArrayList<>();
            if (entry.getValue() != null) {
                for (String id : entry.getValue()) {
                    if (id != null && !id.isBlank()) {
                        ids.add(id.trim());
                    }
                }
            }
            idsByTask.put(task, ids);
        }

        Map<TaskType, List<ModelConfig>> pools = new EnumMap<>(TaskType.class);
        for (TaskType task : TaskType.values()) {
            List<String> ids = idsByTask.getOrDefault(task, List.of());
            if (ids.isEmpty()) {
                throw new ConfigurationValidationException(
                        "No models configured for task type '" + task.getKey() + "'");
            }
            List<ModelConfig> pool = new ArrayList<>();
            for (String id : ids) {
                pool.add(toModelConfig(id, properties));
            }
            pools.put(task, pool);
        }
        return new ModelRegistry(pools);
    }

    private static ModelConfig toModelConfig(String id, CrucibleProperties properties) {
        CrucibleProperties.Model model = properties.getModels().get(id);
        if (model == null || model.getEndpoint() == null || model.getEndpoint().isBlank()) {
            throw new ConfigurationValidationException("Model '" + id + "' has no endpoint configured");
        }

        CrucibleProperties.RateLimit limit = properties.getRateLimits().getOrDefault(id, new CrucibleProperties.RateLimit());
        if (limit.getCallsPerMinute() <= 0 || limit.getTokensPerMinute() <= 0) {
            throw new ConfigurationValidationException("Rate limits for model '" + id + "' must be positive");
        }

        int weight = properties.getWeights().getOrDefault(id, ModelConfig.DEFAULT_WEIGHT);
        if (weight < 0) {
            throw new ConfigurationValidationException("Weight for model '" + id + "' must not be negative");
        }

        String credential = properties.getCredentials().get(id);
        if (credential == null || credential.isBlank()) {
            log.warn("[Config] No credential configured for model '{}'", id);
        }

        ModelConfig.Builder builder = ModelConfig.builder(id)
                .endpoint(model.getEndpoint().trim())
                .credential(credential)
                .temperature(model.getTemperature())
                .maxTokens(model.getMaxTokens())
                .weight(weight)
                .callsPerMinute(limit.getCallsPerMinute())
                .tokensPerMinute(limit.getTokensPerMinute());

        try {
            model.getTaskTemperatures().forEach((task, value) -> builder.taskTemperature(TaskType.fromKey(task), value));
            model.getTaskMaxTokens().forEach((task, value) -> builder.taskMaxTokens(TaskType.fromKey(task), value));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationValidationException("Model '" + id + "': " + e.getMessage());
        }

        return builder.build();
    }
}
