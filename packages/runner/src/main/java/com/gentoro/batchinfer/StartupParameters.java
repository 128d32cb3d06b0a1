package com.gentoro.batchinfer;

import com.gentoro.batchinfer.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line arguments of the form {@code --name value}, {@code --name=value} or a bare {@code
 * --flag} (which reads as {@code true}). Dashes inside names are normalized to underscores, so
 * {@code --num-workers} and {@code --num_workers} are the same parameter.
 */
public class StartupParameters {
  private final Map<String, String> parameters;

  public StartupParameters(String[] args) {
    this.parameters = Collections.unmodifiableMap(parse(args == null ? new String[0] : args));
  }

  private static Map<String, String> parse(String[] args) {
    Map<String, String> result = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      String value;
      int eq = name.indexOf('=');
      if (eq >= 0) {
        value = name.substring(eq + 1);
        name = name.substring(0, eq);
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        value = args[++i];
      } else {
        value = "true";
      }
      result.put(normalize(name), value);
    }
    return result;
  }

  private static String normalize(String name) {
    return name.trim().replace('-', '_');
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(normalize(name));
  }

  public Map<String, String> parameters() {
    return parameters;
  }

  /**
   * Typed access to a parameter; supports {@link String}, {@link Integer}, {@link Long}, {@link
   * Double} and {@link Boolean}. Returns {@code null} when absent.
   */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(normalize(name));
    if (raw == null) {
      return null;
    }
    try {
      Object value;
      if (type == String.class) {
        value = raw;
      } else if (type == Integer.class) {
        value = Integer.valueOf(raw.trim());
      } else if (type == Long.class) {
        value = Long.valueOf(raw.trim());
      } else if (type == Double.class) {
        value = Double.valueOf(raw.trim());
      } else if (type == Boolean.class) {
        value = parseBoolean(name, raw);
      } else {
        throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
      }
      return type.cast(value);
    } catch (NumberFormatException e) {
      throw new ConfigException(
          "Invalid value for --" + name + ": '" + raw + "' is not a " + type.getSimpleName(), e);
    }
  }

  private static Boolean parseBoolean(String name, String raw) {
    String value = raw.trim();
    if ("true".equalsIgnoreCase(value)) return Boolean.TRUE;
    if ("false".equalsIgnoreCase(value)) return Boolean.FALSE;
    throw new ConfigException("Invalid value for --" + name + ": '" + raw + "' is not a boolean");
  }

  /** Optional path of an external configuration file ({@code --config}). */
  public String configFile() {
    return getParameter("config", String.class);
  }
}
