package com.ospicorp.labnotebook.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Numeric coercion shared by validation and reporting. A value is numeric when it is a JSON
 * number or a string holding a finite decimal number; booleans never are.
 */
public final class NumericValues {
  private NumericValues() {
  }

  public static OptionalDouble parse(Object value) {
    if (value instanceof Boolean) {
      return OptionalDouble.empty();
    }
    if (value instanceof BigDecimal || value instanceof BigInteger
        || value instanceof Double || value instanceof Float) {
      return finite(((Number) value).doubleValue());
    }
    if (value instanceof Number number) {
      return OptionalDouble.of(number.doubleValue());
    }
    if (value instanceof String text) {
      String trimmed = text.strip();
      if (trimmed.isEmpty()) {
        return OptionalDouble.empty();
      }
      try {
        return finite(new BigDecimal(trimmed).doubleValue());
      } catch (NumberFormatException ex) {
        return OptionalDouble.empty();
      }
    }
    return OptionalDouble.empty();
  }

  /**
   * Flattens a stored quantitative value (scalar or list) into its numeric parts, skipping
   * anything that does not parse.
   */
  public static List<Double> collect(Object value) {
    List<Double> out = new ArrayList<>();
    if (value instanceof List<?> list) {
      for (Object element : list) {
        parse(element).ifPresent(out::add);
      }
    } else {
      parse(value).ifPresent(out::add);
    }
    return out;
  }

  private static OptionalDouble finite(double number) {
    return Double.isFinite(number) ? OptionalDouble.of(number) : OptionalDouble.empty();
  }
}
