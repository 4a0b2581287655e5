package com.leaplabs.discovery;

import com.leaplabs.discovery.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML configuration into an Apache Commons {@link Configuration}.
 *
 * <p>The location is {@code classpath:name.yaml}, a {@code file:} URI or a filesystem path. Blank
 * means the bundled {@code application.yaml}; a classpath resource that does not exist leaves
 * every component on its defaults. {@code ${env:NAME}} and {@code ${env:NAME:-default}} read the
 * process environment first and a {@code .env.local} file in the working directory second.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final String CLASSPATH = "classpath:";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this(location, Path.of(".env.local"));
  }

  ConfigurationProvider(String location, Path envFile) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    read(yaml, location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim());
    yaml.getInterpolator().registerLookup("env", new EnvLookup(envFile));
    this.configuration = yaml;
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static void read(YAMLConfiguration yaml, String location) {
    if (location.startsWith(CLASSPATH)) {
      String resource = location.substring(CLASSPATH.length());
      InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
      if (in == null) {
        log.info("No {} on the classpath; using defaults", resource);
        return;
      }
      log.info("Loading configuration from classpath resource: {}", resource);
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        yaml.read(reader);
      } catch (IOException | ConfigurationException e) {
        throw new ConfigException("Failed to read YAML from classpath resource: " + resource, e);
      }
      return;
    }

    Path file = toPath(location);
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file not found: " + file.toAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Path toPath(String location) {
    try {
      return location.regionMatches(true, 0, "file:", 0, 5)
          ? Path.of(URI.create(location))
          : Path.of(location);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid configuration location: " + location, e);
    }
  }

  /** Resolves {@code NAME} or {@code NAME:-default}; empty values count as unset. */
  private static final class EnvLookup implements Lookup {
    private final Path envFile;
    private volatile Configuration fileValues;

    EnvLookup(Path envFile) {
      this.envFile = envFile;
    }

    @Override
    public Object lookup(String expression) {
      int sep = expression.indexOf(":-");
      String name = sep < 0 ? expression : expression.substring(0, sep);
      String value = System.getenv(name);
      if (value == null || value.isEmpty()) {
        value = unquote(fileValues().getString(name, null));
      }
      if (value == null || value.isEmpty()) {
        return sep < 0 ? null : expression.substring(sep + 2);
      }
      return value;
    }

    private Configuration fileValues() {
      Configuration values = fileValues;
      if (values == null) {
        synchronized (this) {
          if (fileValues == null) {
            fileValues = readEnvFile(envFile);
          }
          values = fileValues;
        }
      }
      return values;
    }
  }

  private static Configuration readEnvFile(Path file) {
    PropertiesConfiguration values = new PropertiesConfiguration();
    if (!Files.isRegularFile(file)) {
      log.debug("No {} found; only process environment variables are used", file);
      return values;
    }
    log.info("Reading environment overrides from {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      values.read(reader);
      return values;
    } catch (IOException | ConfigurationException e) {
      log.warn("Could not read {}, ignoring it", file.toAbsolutePath(), e);
      return new PropertiesConfiguration();
    }
  }

  private static String unquote(String value) {
    if (value != null
        && value.length() >= 2
        && (value.startsWith("\"") && value.endsWith("\"")
            || value.startsWith("'") && value.endsWith("'"))) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }
}
