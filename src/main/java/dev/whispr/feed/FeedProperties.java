package dev.whispr.feed;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for feed assembly, bound from {@code whispr.feed.*}.
 *
 * <ul>
 *   <li>{@code social-window} - how far back the social phase looks (default 7d)
 *   <li>{@code topical-pool-size} - maximum rows fetched by the topical phase (default 50)
 *   <li>{@code exploratory-pool-factor} - the exploratory phase fetches this many rows per
 *       remaining slot (default 3)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "whispr.feed")
public class FeedProperties {

  private Duration socialWindow = Duration.ofDays(7);
  private int topicalPoolSize = 50;
  private int exploratoryPoolFactor = 3;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (socialWindow == null || socialWindow.isZero() || socialWindow.isNegative()) {
      throw new IllegalStateException(
          "whispr.feed.social-window must be positive, got: " + socialWindow);
    }
    if (topicalPoolSize < 1) {
      throw new IllegalStateException(
          "whispr.feed.topical-pool-size must be at least 1, got: " + topicalPoolSize);
    }
    if (exploratoryPoolFactor < 1) {
      throw new IllegalStateException(
          "whispr.feed.exploratory-pool-factor must be at least 1, got: " + exploratoryPoolFactor);
    }
  }

  public Duration getSocialWindow() {
    return socialWindow;
  }

  public void setSocialWindow(Duration socialWindow) {
    this.socialWindow = socialWindow;
  }

  public int getTopicalPoolSize() {
    return topicalPoolSize;
  }

  public void setTopicalPoolSize(int topicalPoolSize) {
    this.topicalPoolSize = topicalPoolSize;
  }

  public int getExploratoryPoolFactor() {
    return exploratoryPoolFactor;
  }

  public void setExploratoryPoolFactor(int exploratoryPoolFactor) {
    this.exploratoryPoolFactor = exploratoryPoolFactor;
  }
}
