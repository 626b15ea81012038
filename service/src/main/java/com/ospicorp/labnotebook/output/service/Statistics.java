package com.ospicorp.labnotebook.output.service;

import com.ospicorp.labnotebook.output.model.SummaryStatistics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

public final class Statistics {
  private Statistics() {
  }

  public static Optional<SummaryStatistics> summarize(List<Double> values) {
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }
    List<Double> sorted = new ArrayList<>(values);
    Collections.sort(sorted);
    double sum = 0d;
    for (double v : sorted) {
      sum += v;
    }
    return Optional.of(new SummaryStatistics(
        sorted.size(),
        sorted.get(0),
        quantile(sorted, 0.25),
        quantile(sorted, 0.5),
        quantile(sorted, 0.75),
        sorted.get(sorted.size() - 1),
        sum / sorted.size()));
  }

  /**
   * Linear interpolation between the closest ranks at position {@code (n - 1) * q}; the input
   * must be sorted ascending and non-empty.
   */
  static double quantile(List<Double> sorted, double q) {
    double pos = (sorted.size() - 1) * q;
    int base = (int) Math.floor(pos);
    double rest = pos - base;
    if (base + 1 < sorted.size()) {
      return sorted.get(base) + rest * (sorted.get(base + 1) - sorted.get(base));
    }
    return sorted.get(base);
  }

  public static OptionalDouble mean(List<Double> values) {
    if (values == null || values.isEmpty()) {
      return OptionalDouble.empty();
    }
    double sum = 0d;
    for (double v : values) {
      sum += v;
    }
    return OptionalDouble.of(sum / values.size());
  }
}
