package com.gentoro.autoreport.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.autoreport.exception.ConfigurationException;
import com.gentoro.autoreport.exception.WeightConfigException;
import com.gentoro.autoreport.weight.AggregationMethod;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineSettingsTest {

  @TempDir Path dir;

  private EngineSettings load(String yaml) throws Exception {
    Path file = dir.resolve("application.yaml");
    Files.writeString(file, yaml, StandardCharsets.UTF_8);
    return EngineSettings.from(new ConfigurationProvider(file.toString()).config());
  }

  @Test
  void readsAutoreportSection() throws Exception {
    EngineSettings settings =
        load(
            "autoreport:\n"
                + "  parallel_processing: false\n"
                + "  max_workers: 2\n"
                + "  timeout_seconds: 5\n"
                + "  cache_enabled: false\n"
                + "  max_retry_attempts: 4\n"
                + "  aggregation_method: harmonic_mean\n"
                + "  weights:\n"
                + "    paragraph: 0.4\n"
                + "    section: 0.2\n"
                + "    document: 0.2\n"
                + "    business_rule: 0.1\n"
                + "    semantic: 0.1\n");

    assertFalse(settings.parallelProcessing());
    assertEquals(2, settings.maxWorkers());
    assertEquals(Duration.ofSeconds(5), settings.placeholderTimeout());
    assertFalse(settings.cacheEnabled());
    assertEquals(4, settings.maxRetryAttempts());
    assertEquals(0.4, settings.weights().paragraph(), 1e-9);
    assertEquals(AggregationMethod.HARMONIC_MEAN, settings.weights().method());
    assertTrue(settings.enableSemanticAnalysis());
    assertEquals(5, settings.maxNestingDepth());
  }

  @Test
  void missingKeysUseDefaults() throws Exception {
    EngineSettings settings = load("other:\n  key: 1\n");
    assertEquals(EngineSettings.defaults(), settings);
    assertEquals(EngineSettings.defaults(), EngineSettings.from(null));
  }

  @Test
  void classpathConfigurationLoads() {
    EngineSettings settings = EngineSettings.from(new ConfigurationProvider(null).config());
    assertEquals(4, settings.maxWorkers());
    assertEquals(0.25, settings.weights().paragraph(), 1e-9);
  }

  @Test
  void weightsMustSumToOne() {
    assertThrows(
        WeightConfigException.class,
        () ->
            load(
                "autoreport:\n"
                    + "  weights:\n"
                    + "    paragraph: 0.2\n"
                    + "    section: 0.2\n"
                    + "    document: 0.2\n"
                    + "    business_rule: 0.15\n"
                    + "    semantic: 0.15\n"));
  }

  @Test
  void invalidValuesFailFast() {
    assertThrows(ConfigurationException.class, () -> load("autoreport:\n  max_workers: 0\n"));
    assertThrows(ConfigurationException.class, () -> load("autoreport:\n  max_workers: many\n"));
    assertThrows(
        ConfigurationException.class, () -> load("autoreport:\n  min_intent_confidence: 1.5\n"));
    assertThrows(
        ConfigurationException.class, () -> load("autoreport:\n  aggregation_method: median\n"));
  }

  @Test
  void missingFileIsConfigurationError() {
    assertThrows(
        ConfigurationException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }

  @Test
  void toBuilderRoundTrips() {
    EngineSettings settings = EngineSettings.builder().maxWorkers(7).build();
    assertEquals(settings, settings.toBuilder().build());
  }
}
