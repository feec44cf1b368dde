package dev.whispr.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for multi-entity search.
 *
 * <p>Properties are bound from {@code whispr.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code timeout} - deadline for one search fan-out; every adapter task still running when
 *       it expires is cancelled and the request fails (default 5s)
 *   <li>{@code executor-threads} - size of the fan-out pool (default 5, bounded [1, 32])
 *   <li>{@code field-weights} - per-field combination weight overrides merged over the built-in
 *       table, e.g. {@code whispr.search.field-weights.description=3.0}
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "whispr.search")
public class SearchProperties {

  private Duration timeout = Duration.ofSeconds(5);
  private int executorThreads = 5;
  private Map<String, Double> fieldWeights = new HashMap<>();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException("whispr.search.timeout must be positive, got: " + timeout);
    }
    if (executorThreads < 1 || executorThreads > 32) {
      throw new IllegalStateException(
          "whispr.search.executor-threads must be in [1, 32], got: " + executorThreads);
    }
    fieldWeights.forEach(
        (field, weight) -> {
          if (weight == null || weight <= 0.0) {
            throw new IllegalStateException(
                "whispr.search.field-weights." + field + " must be positive, got: " + weight);
          }
        });
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public int getExecutorThreads() {
    return executorThreads;
  }

  public void setExecutorThreads(int executorThreads) {
    this.executorThreads = executorThreads;
  }

  public Map<String, Double> getFieldWeights() {
    return fieldWeights;
  }

  public void setFieldWeights(Map<String, Double> fieldWeights) {
    this.fieldWeights = fieldWeights;
  }
}
