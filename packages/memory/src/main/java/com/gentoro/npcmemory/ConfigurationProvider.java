package com.gentoro.npcmemory;

import com.gentoro.npcmemory.exception.ConfigException;
import com.gentoro.npcmemory.exception.ExceptionUtil;
import com.gentoro.npcmemory.exception.SerializationException;
import com.gentoro.npcmemory.logging.LoggingService;
import com.gentoro.npcmemory.memory.MemoryStoreSettings;
import com.gentoro.npcmemory.retrieval.ContextRetrievalConfig;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath) and an absolute or relative filesystem path, optionally as a {@code file:} URI. A
 * missing classpath resource yields an empty configuration so every setting keeps its default.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:npc-memory.yaml";

  private final Configuration configuration;

  /** Reads {@link #DEFAULT_LOCATION}. */
  public ConfigurationProvider() {
    this(DEFAULT_LOCATION);
  }

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Wrap an already built configuration, e.g. one assembled in tests. */
  public ConfigurationProvider(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  public ContextRetrievalConfig retrievalConfig() {
    return ContextRetrievalConfig.fromConfiguration(configuration);
  }

  public MemoryStoreSettings storeSettings() {
    return MemoryStoreSettings.fromConfiguration(configuration);
  }

  /** Push {@code logging.level.*} entries to the logging backend. */
  public void applyLogging() {
    LoggingService.applyConfiguration(configuration);
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      log.debug("No classpath resource {}; using built-in defaults", resourceName);
      return new YAMLConfiguration();
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return config;
    } catch (Exception e) {
      log.error(
          "Could not read classpath resource {}: {} [{}]",
          resourceName,
          e.getMessage(),
          ExceptionUtil.formatCompactStackTrace(e));
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          ex ->
              new SerializationException(
                  "Failed to read YAML from classpath resource: " + resourceName, ex));
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return builder.getConfiguration();
    } catch (ConfigurationException | RuntimeException e) {
      log.error(
          "Could not load configuration file {}: {} [{}]",
          file.getAbsolutePath(),
          e.getMessage(),
          ExceptionUtil.formatCompactStackTrace(e));
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new ConfigException("Failed to load YAML file: " + file, ex));
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath(DEFAULT_LOCATION.substring("classpath:".length()));
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }
}
