package com.gentoro.batchinfer;

import com.gentoro.batchinfer.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the YAML application configuration. The location is either a file path or a {@code
 * classpath:} reference; when none is given, {@code classpath:application.yaml} is used.
 */
public class ConfigurationProvider {
  public static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final String location;
  private final YAMLConfiguration config;

  public ConfigurationProvider(String location) {
    this.location = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    this.config = load(this.location);
  }

  public Configuration config() {
    return config;
  }

  public String location() {
    return location;
  }

  private static YAMLConfiguration load(String location) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = open(location)) {
      yaml.read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Could not load configuration from " + location, e);
    }
    return yaml;
  }

  private static Reader open(String location) throws IOException {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
      if (in == null) {
        throw new ConfigException("Configuration resource not found: " + location);
      }
      return new InputStreamReader(in, StandardCharsets.UTF_8);
    }
    Path path = Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return Files.newBufferedReader(path, StandardCharsets.UTF_8);
  }
}
