package dev.whispr.search;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps logical field names to positive combination weights. Fields absent from the table weigh
 * {@value #DEFAULT_WEIGHT}. Used only when combining per-field scores; never persisted.
 */
public final class FieldWeightTable {

  static final double DEFAULT_WEIGHT = 1.0;

  private final Map<String, Double> weights;

  private FieldWeightTable(Map<String, Double> weights) {
    this.weights = Map.copyOf(weights);
  }

  /** The built-in weights declared on {@link SearchField}. */
  public static FieldWeightTable defaults() {
    Map<String, Double> weights = new HashMap<>();
    for (SearchField field : SearchField.values()) {
      weights.put(field.key(), field.defaultWeight());
    }
    return new FieldWeightTable(weights);
  }

  /**
   * Returns a copy of this table with the given weights replacing or adding entries.
   *
   * @param overrides field name to weight; every weight must be positive
   * @return the merged table
   * @throws IllegalArgumentException if any override is not positive
   */
  public FieldWeightTable withOverrides(Map<String, Double> overrides) {
    Map<String, Double> merged = new HashMap<>(weights);
    overrides.forEach(
        (field, weight) -> {
          if (weight == null || weight <= 0.0) {
            throw new IllegalArgumentException(
                "Field weight must be positive for '" + field + "', got: " + weight);
          }
          merged.put(field, weight);
        });
    return new FieldWeightTable(merged);
  }

  public double weight(String field) {
    return weights.getOrDefault(field, DEFAULT_WEIGHT);
  }
}
