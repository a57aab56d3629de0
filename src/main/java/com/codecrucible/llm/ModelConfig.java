package com.codecrucible.llm;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one configured backend.
 *
 * Always construct via {@link #builder(String)}; defaults mirror the
 * settings-store defaults (temperature 0.7, 2000 max tokens, weight 1,
 * 60 calls and 10000 tokens per minute).
 */
public final class ModelConfig {

    public static final double DEFAULT_TEMPERATURE       = 0.7;
    public static final int    DEFAULT_MAX_TOKENS        = 2000;
    public static final int    DEFAULT_WEIGHT            = 1;
    public static final int    DEFAULT_CALLS_PER_MINUTE  = 60;
    public static final int    DEFAULT_TOKENS_PER_MINUTE = 10000;

    private final String                  id;
    private final String                  endpoint;
    private final String                  credential;
    private final double                  temperature;
    private final int                     maxTokens;
    private final Map<TaskType, Double>   taskTemperatures;
    private final Map<TaskType, Integer>  taskMaxTokens;
    private final int                     weight;
    private final int                     callsPerMinute;
    private final int                     tokensPerMinute;

    private ModelConfig(Builder b) {
        this.id               = b.id;
        this.endpoint         = b.endpoint;
        this.credential       = b.credential != null ? b.credential : "";
        this.temperature      = b.temperature;
        this.maxTokens        = b.maxTokens;
        this.taskTemperatures = Collections.unmodifiableMap(new EnumMap<>(b.taskTemperatures));
        this.taskMaxTokens    = Collections.unmodifiableMap(new EnumMap<>(b.taskMaxTokens));
        this.weight           = b.weight;
        this.callsPerMinute   = b.callsPerMinute;
        this.tokensPerMinute  = b.tokensPerMinute;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId()              { return id; }
    public String getEndpoint()        { return endpoint; }
    public String getCredential()      { return credential; }
    public int    getWeight()          { return weight; }
    public int    getCallsPerMinute()  { return callsPerMinute; }
    public int    getTokensPerMinute() { return tokensPerMinute; }

    public double temperatureFor(TaskType task) {
        return taskTemperatures.getOrDefault(task, temperature);
    }

    public int maxTokensFor(TaskType task) {
        return taskMaxTokens.getOrDefault(task, maxTokens);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelConfig)) return false;
        return id.equals(((ModelConfig) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    // credential deliberately left out
    @Override
    public String toString() {
        return String.format("ModelConfig{id='%s', endpoint='%s', weight=%d, cpm=%d, tpm=%d}",
                id, endpoint, weight, callsPerMinute, tokensPerMinute);
    }

    public static final class Builder {

        private final String id;
        private String endpoint;
        private String credential;
        private double temperature     = DEFAULT_TEMPERATURE;
        private int    maxTokens       = DEFAULT_MAX_TOKENS;
        private final Map<TaskType, Double>  taskTemperatures = new EnumMap<>(TaskType.class);
        private final Map<TaskType, Integer> taskMaxTokens    = new EnumMap<>(TaskType.class);
        private int    weight          = DEFAULT_WEIGHT;
        private int    callsPerMinute  = DEFAULT_CALLS_PER_MINUTE;
        private int    tokensPerMinute = DEFAULT_TOKENS_PER_MINUTE;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder endpoint(String endpoint)       { this.endpoint = endpoint;               return this; }
        public Builder credential(String credential)   { this.credential = credential;           return this; }
        public Builder temperature(double temperature) { this.temperature = temperature;         return this; }
        public Builder maxTokens(int maxTokens)        { this.maxTokens = maxTokens;             return this; }
        public Builder weight(int weight)              { this.weight = weight;                   return this; }
        public Builder callsPerMinute(int calls)       { this.callsPerMinute = calls;            return this; }
        public Builder tokensPerMinute(int tokens)     { this.tokensPerMinute = tokens;          return this; }

        public Builder taskTemperature(TaskType task, double value) {
            taskTemperatures.put(task, value);
            return this;
        }

        public Builder taskMaxTokens(TaskType task, int value) {
            taskMaxTokens.put(task, value);
            return this;
        }

        public ModelConfig build() {
            return new ModelConfig(this);
        }
    }
}
