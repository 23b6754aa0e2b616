package com.gentoro.autoreport;

import com.gentoro.autoreport.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Command line options in {@code --key=value} form. A bare {@code --flag} is stored as {@code
 * true}; anything not starting with {@code --} is rejected.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (String arg : args) {
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigurationException("Unrecognized argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public boolean has(String name) {
    return StringUtils.isNotBlank(parameters.get(name));
  }

  /** Path passed with {@code --config}, or null. */
  public String configFile() {
    return parameters.get("config");
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public String requireParameter(String name) {
    String value = parameters.get(name);
    if (StringUtils.isBlank(value)) {
      throw new ConfigurationException("Missing required argument --" + name);
    }
    return value;
  }

  /** Typed lookup; supports String, Integer, Long, Double and Boolean. */
  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null) {
      return null;
    }
    Object converted;
    if (type == String.class) {
      converted = value;
    } else if (type == Integer.class) {
      converted = number(name, value).intValue();
    } else if (type == Long.class) {
      converted = number(name, value).longValue();
    } else if (type == Double.class) {
      converted = number(name, value).doubleValue();
    } else if (type == Boolean.class) {
      converted = BooleanUtils.toBoolean(value);
    } else {
      throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
    }
    return type.cast(converted);
  }

  private static Number number(String name, String value) {
    if (!NumberUtils.isCreatable(value)) {
      throw new ConfigurationException("Argument --" + name + " is not a number: " + value);
    }
    return NumberUtils.createNumber(value);
  }
}
