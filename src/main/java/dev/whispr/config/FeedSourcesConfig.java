package dev.whispr.config;

import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Time and randomness behind feed assembly. Both beans back off when a test context supplies its
 * own fixed clock or seeded generator.
 */
@Configuration
public class FeedSourcesConfig {

  /** Review age for recency decay is measured in UTC. */
  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Shared by sampling trials and the final shuffle; one generator per process. */
  @Bean
  @ConditionalOnMissingBean
  public RandomGenerator randomGenerator() {
    return new Random();
  }
}
