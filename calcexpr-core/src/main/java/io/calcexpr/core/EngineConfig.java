package io.calcexpr.core;

import io.calcexpr.core.format.ResultFormatter;
import io.calcexpr.core.parser.ExpressionParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for {@link ExpressionEngine}. Loaded from the classpath resource {@value
 * #RESOURCE}, with {@code calcexpr.*} system properties taking precedence.
 *
 * @param maxDepth maximum nesting of parentheses and function calls
 * @param strictCharacters whether unrecognized characters are lexical errors instead of being
 *     skipped
 * @param displayDigits significant digits used by the result formatter
 * @param cacheFactorials whether factorial results are memoized
 */
public record EngineConfig(
    int maxDepth, boolean strictCharacters, int displayDigits, boolean cacheFactorials) {

  private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "calcexpr.properties";

  static final String MAX_DEPTH = "calcexpr.maxDepth";
  static final String STRICT_CHARACTERS = "calcexpr.strictCharacters";
  static final String DISPLAY_DIGITS = "calcexpr.displayDigits";
  static final String CACHE_FACTORIALS = "calcexpr.cacheFactorials";

  public EngineConfig {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    }
    if (displayDigits < 6 || displayDigits > 17) {
      throw new IllegalArgumentException(
          "displayDigits must be between 6 and 17: " + displayDigits);
    }
  }

  /**
   * Creates the default configuration.
   *
   * @return nesting limit 100, lenient tokenizing, 15 display digits, memoized factorials
   */
  public static EngineConfig defaults() {
    return new EngineConfig(
        ExpressionParser.DEFAULT_MAX_DEPTH, false, ResultFormatter.DEFAULT_DISPLAY_DIGITS, true);
  }

  /**
   * Loads configuration from {@value #RESOURCE} on the classpath, then applies system property
   * overrides.
   *
   * @return the loaded configuration, or defaults if nothing is configured
   */
  public static EngineConfig load() {
    Properties props = new Properties();
    try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
          props.load(reader);
        }
        log.debug("Loaded engine configuration from {}", RESOURCE);
      }
    } catch (IOException e) {
      log.warn("Failed to read {}, using defaults", RESOURCE, e);
    }
    for (String key : List.of(MAX_DEPTH, STRICT_CHARACTERS, DISPLAY_DIGITS, CACHE_FACTORIALS)) {
      String override = System.getProperty(key);
      if (override != null) {
        props.setProperty(key, override);
      }
    }
    return fromProperties(props);
  }

  /**
   * Creates configuration from properties. Missing or malformed values fall back to the defaults.
   *
   * @param props properties using the {@code calcexpr.*} keys
   * @return the configuration
   */
  public static EngineConfig fromProperties(Properties props) {
    EngineConfig defaults = defaults();
    int maxDepth = parseInt(props, MAX_DEPTH, defaults.maxDepth, 1, Integer.MAX_VALUE);
    int displayDigits = parseInt(props, DISPLAY_DIGITS, defaults.displayDigits, 6, 17);
    boolean strict = parseBoolean(props, STRICT_CHARACTERS, defaults.strictCharacters);
    boolean cache = parseBoolean(props, CACHE_FACTORIALS, defaults.cacheFactorials);
    return new EngineConfig(maxDepth, strict, displayDigits, cache);
  }

  /**
   * Converts this configuration to properties.
   *
   * @return properties using the {@code calcexpr.*} keys
   */
  public Properties toProperties() {
    Properties props = new Properties();
    props.setProperty(MAX_DEPTH, String.valueOf(maxDepth));
    props.setProperty(STRICT_CHARACTERS, String.valueOf(strictCharacters));
    props.setProperty(DISPLAY_DIGITS, String.valueOf(displayDigits));
    props.setProperty(CACHE_FACTORIALS, String.valueOf(cacheFactorials));
    return props;
  }

  public EngineConfig withMaxDepth(int maxDepth) {
    return new EngineConfig(maxDepth, strictCharacters, displayDigits, cacheFactorials);
  }

  public EngineConfig withStrictCharacters(boolean strictCharacters) {
    return new EngineConfig(maxDepth, strictCharacters, displayDigits, cacheFactorials);
  }

  private static int parseInt(Properties props, String key, int fallback, int min, int max) {
    String value = props.getProperty(key);
    if (value == null) {
      return fallback;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed >= min && parsed <= max) {
        return parsed;
      }
      log.warn("Ignoring {}={}: expected a value between {} and {}", key, value, min, max);
    } catch (NumberFormatException e) {
      log.warn("Ignoring {}={}: not an integer", key, value);
    }
    return fallback;
  }

  private static boolean parseBoolean(Properties props, String key, boolean fallback) {
    String value = props.getProperty(key);
    if (value == null) {
      return fallback;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> {
        log.warn("Ignoring {}={}: not a boolean", key, value);
        yield fallback;
      }
    };
  }
}
