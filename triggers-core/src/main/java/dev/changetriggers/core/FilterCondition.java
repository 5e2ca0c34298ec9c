package dev.changetriggers.core;

import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of {@code field == literal} constraints over a row snapshot.
 *
 * <p>Numbers compare by value, so a filter literal {@code 1} matches a column value {@code 1.0}.
 * Every other value compares with {@link Object#equals(Object)}.
 */
public final class FilterCondition {

  private final Map<String, Object> expected;

  private FilterCondition(Map<String, Object> expected) {
    this.expected = Collections.unmodifiableMap(new LinkedHashMap<>(expected));
  }

  /**
   * Builds a condition from a decoded JSON value.
   *
   * @param raw a {@link JsonObject} or {@link Map}
   * @throws IllegalArgumentException if {@code raw} is not an object
   */
  @SuppressWarnings("unchecked")
  public static FilterCondition of(Object raw) {
    Objects.requireNonNull(raw, "raw");
    if (raw instanceof JsonObject) {
      return new FilterCondition(((JsonObject) raw).getMap());
    }
    if (raw instanceof Map) {
      return new FilterCondition((Map<String, Object>) raw);
    }
    throw new IllegalArgumentException("filter condition must be a JSON object, got "
      + raw.getClass().getSimpleName());
  }

  public Map<String, Object> expected() {
    return expected;
  }

  public boolean test(Map<String, Object> row) {
    Objects.requireNonNull(row, "row");
    for (Map.Entry<String, Object> constraint : expected.entrySet()) {
      if (!row.containsKey(constraint.getKey())) {
        return false;
      }
      if (!literalEquals(constraint.getValue(), row.get(constraint.getKey()))) {
        return false;
      }
    }
    return true;
  }

  private static boolean literalEquals(Object expected, Object actual) {
    if (expected instanceof Number && actual instanceof Number) {
      return toDecimal((Number) expected).compareTo(toDecimal((Number) actual)) == 0;
    }
    return Objects.equals(expected, actual);
  }

  private static BigDecimal toDecimal(Number value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(value.doubleValue());
    }
    return BigDecimal.valueOf(value.longValue());
  }

  @Override
  public String toString() {
    return "FilterCondition" + expected;
  }
}
