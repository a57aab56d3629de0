package com.codecrucible.config;

import com.codecrucible.llm.ModelConfig;
import com.codecrucible.llm.ModelRegistry;
import com.codecrucible.llm.TaskType;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CrucibleConfigurationTest {

    private static CrucibleProperties validProperties() {
        CrucibleProperties props = new CrucibleProperties();

        CrucibleProperties.Model gen = new CrucibleProperties.Model();
        gen.setEndpoint("http://localhost/gen");
        gen.getTaskTemperatures().put("checking", 0.1);
        props.getModels().put("gen", gen);

        CrucibleProperties.Model check = new CrucibleProperties.Model();
        check.setEndpoint("http://localhost/check");
        props.getModels().put("check", check);

        props.getCredentials().put("gen", "secret");
        props.getWeights().put("check", 4);

        return props.task("generation", "gen")
                    .task("checking", "gen", "check")
                    .task("fixing", "gen")
                    .task("feature", "check");
    }

    @Test
    void testDefaults() {
        EngineSettings settings = CrucibleConfiguration.buildSettings(new CrucibleProperties());

        assertEquals(5, settings.getMaxIterations());
        assertEquals(3, settings.getIterationLimit());
        assertEquals(RotationStrategy.ROUND_ROBIN, settings.getRotationStrategy());
        assertEquals(Duration.ofSeconds(3600), settings.getCacheTtl());
        assertEquals(1, settings.getRetryMaxAttempts());
    }

    @Test
    void testRegistryBuildsPoolsInOrder() {
        ModelRegistry registry = CrucibleConfiguration.buildRegistry(validProperties());

        assertEquals(2, registry.modelsFor(TaskType.CHECKING).size());
        assertEquals("gen",   registry.modelsFor(TaskType.CHECKING).get(0).getId());
        assertEquals("check", registry.modelsFor(TaskType.CHECKING).get(1).getId());

        ModelConfig gen = registry.findById("gen").orElseThrow();
        assertEquals("secret", gen.getCredential());
        assertEquals(0.1, gen.temperatureFor(TaskType.CHECKING));
        assertEquals(0.7, gen.temperatureFor(TaskType.FIXING));
        assertEquals(2000, gen.maxTokensFor(TaskType.FIXING));
        assertEquals(60, gen.getCallsPerMinute());
        assertEquals(10000, gen.getTokensPerMinute());

        assertEquals(4, registry.findById("check").orElseThrow().getWeight());
    }

    @Test
    void testEmptyTaskListFailsFast() {
        CrucibleProperties props = validProperties().task("feature");

        ConfigurationValidationException ex = assertThrows(ConfigurationValidationException.class,
                () -> CrucibleConfiguration.buildRegistry(props));
        assertTrue(ex.getMessage().contains("feature"));
    }

    @Test
    void testMissingEndpointFailsFast() {
        CrucibleProperties props = validProperties().task("fixing", "ghost");

        assertThrows(ConfigurationValidationException.class, () -> CrucibleConfiguration.buildRegistry(props));
    }

    @Test
    void testUnknownTaskTypeFailsFast() {
        CrucibleProperties props = validProperties().task("reviewing", "gen");

        assertThrows(ConfigurationValidationException.class, () -> CrucibleConfiguration.buildRegistry(props));
    }

    @Test
    void testOutOfRangeKnobsFailFast() {
        CrucibleProperties tooMany = new CrucibleProperties();
        tooMany.setMaxIterations(21);
        assertThrows(ConfigurationValidationException.class, () -> CrucibleConfiguration.buildSettings(tooMany));

        CrucibleProperties zeroLimit = new CrucibleProperties();
        zeroLimit.setIterationLimit(0);
        assertThrows(ConfigurationValidationException.class, () -> CrucibleConfiguration.buildSettings(zeroLimit));

        CrucibleProperties badStrategy = new CrucibleProperties();
        badStrategy.setRotationStrategy("fastest");
        assertThrows(ConfigurationValidationException.class, () -> CrucibleConfiguration.buildSettings(badStrategy));
    }

    @Test
    void testNegativeWeightFailsFast() {
        CrucibleProperties props = validProperties();
        props.getWeights().put("gen", -1);

        assertThrows(ConfigurationValidationException.class, () -> CrucibleConfiguration.buildRegistry(props));
    }
}
