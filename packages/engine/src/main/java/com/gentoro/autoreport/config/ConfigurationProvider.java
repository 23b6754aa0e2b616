package com.gentoro.autoreport.config;

import com.gentoro.autoreport.exception.ConfigurationException;
import com.gentoro.autoreport.logging.LoggingService;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the YAML application configuration.
 *
 * <p>Resolution order:
 *
 * <ol>
 *   <li>explicit path passed to the constructor
 *   <li>{@code AUTOREPORT_CONFIG} environment variable
 *   <li>{@code application.yaml} on the classpath
 * </ol>
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String CONFIG_ENV = "AUTOREPORT_CONFIG";
  public static final String CLASSPATH_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this.config = load(configFile);
  }

  public Configuration config() {
    return config;
  }

  private YAMLConfiguration load(String configFile) {
    String location = configFile;
    if (location == null || location.isBlank()) {
      location = System.getenv(CONFIG_ENV);
    }

    YAMLConfiguration yaml = new YAMLConfiguration();
    if (location != null && !location.isBlank()) {
      Path path = Path.of(location);
      if (!Files.isRegularFile(path)) {
        throw new ConfigurationException("Configuration file not found: " + path);
      }
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        yaml.read(reader);
        log.info("Loaded configuration from {}", path.toAbsolutePath());
        return yaml;
      } catch (Exception e) {
        throw new ConfigurationException("Failed to read configuration file: " + path, e);
      }
    }

    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
      if (in == null) {
        log.warn("No {} on classpath, using built-in defaults", CLASSPATH_RESOURCE);
        return yaml;
      }
      yaml.read(new InputStreamReader(in, StandardCharsets.UTF_8));
      log.debug("Loaded configuration from classpath:{}", CLASSPATH_RESOURCE);
      return yaml;
    } catch (Exception e) {
      throw new ConfigurationException("Failed to read classpath " + CLASSPATH_RESOURCE, e);
    }
  }
}
