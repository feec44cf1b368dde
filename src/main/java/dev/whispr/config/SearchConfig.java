package dev.whispr.config;

import dev.whispr.search.FieldWeightTable;
import dev.whispr.search.SearchProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Wires the relevance weight table and the bounded pool that search fans out on. */
@Configuration
public class SearchConfig {

  /** Built-in field weights with {@code whispr.search.field-weights} merged over them. */
  @Bean
  public FieldWeightTable fieldWeightTable(SearchProperties searchProperties) {
    return FieldWeightTable.defaults().withOverrides(searchProperties.getFieldWeights());
  }

  /**
   * Fixed-size pool running one task per enabled entity adapter. The queue is unbounded so a
   * burst of searches waits for a thread instead of being rejected; the search deadline bounds
   * the wait.
   */
  @Bean(name = "searchExecutor")
  public ThreadPoolTaskExecutor searchExecutor(SearchProperties searchProperties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(searchProperties.getExecutorThreads());
    executor.setMaxPoolSize(searchProperties.getExecutorThreads());
    executor.setThreadNamePrefix("search-");
    executor.initialize();
    return executor;
  }
}
