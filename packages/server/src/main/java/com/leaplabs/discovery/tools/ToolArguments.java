package com.leaplabs.discovery.tools;

import com.leaplabs.discovery.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Typed, validating access to the loosely typed argument map an MCP tool call carries. */
public final class ToolArguments {
  private final Map<String, Object> values;

  public ToolArguments(Map<String, Object> values) {
    this.values = values == null ? Collections.emptyMap() : values;
  }

  public static ToolArguments of(Map<String, Object> values) {
    return new ToolArguments(values);
  }

  public String requiredString(String name) {
    String value = optionalString(name);
    if (value == null || value.isBlank()) {
      throw new ValidationException(name + " is required.");
    }
    return value;
  }

  public String optionalString(String name) {
    Object value = values.get(name);
    if (value == null) return null;
    if (value instanceof String s) return s;
    if (value instanceof Number || value instanceof Boolean) return value.toString();
    throw new ValidationException(name + " must be a string.");
  }

  public Integer optionalInt(String name) {
    Object value = values.get(name);
    if (value == null) return null;
    if (value instanceof Number n) {
      double d = n.doubleValue();
      if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
        throw new ValidationException(name + " must be an integer, got " + value);
      }
      return n.intValue();
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        throw new ValidationException(name + " must be an integer, got '" + s + "'");
      }
    }
    throw new ValidationException(name + " must be an integer.");
  }

  public int intOrDefault(String name, int defaultValue) {
    Integer value = optionalInt(name);
    return value == null ? defaultValue : value;
  }

  public Double optionalDouble(String name) {
    Object value = values.get(name);
    if (value == null) return null;
    if (value instanceof Number n) return n.doubleValue();
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Double.parseDouble(s.trim());
      } catch (NumberFormatException e) {
        throw new ValidationException(name + " must be a number, got '" + s + "'");
      }
    }
    throw new ValidationException(name + " must be a number.");
  }

  public double requiredDouble(String name) {
    Double value = optionalDouble(name);
    if (value == null) {
      throw new ValidationException(name + " is required.");
    }
    return value;
  }

  /** A JSON object of string values, e.g. column name to description. */
  public Map<String, String> optionalStringMap(String name) {
    Object value = values.get(name);
    if (value == null) return null;
    if (!(value instanceof Map<?, ?> map)) {
      throw new ValidationException(name + " must be an object mapping names to text.");
    }
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : map.entrySet()) {
      if (e.getKey() == null || e.getValue() == null) {
        throw new ValidationException(name + " must not contain null keys or values.");
      }
      result.put(e.getKey().toString(), e.getValue().toString());
    }
    return result;
  }
}
