package dev.whispr.feed;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class FeedPropertiesTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(() -> new FeedProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  void rejectsNegativeSocialWindow() {
    FeedProperties props = new FeedProperties();
    props.setSocialWindow(Duration.ofDays(-1));

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("social-window");
  }

  @Test
  void rejectsEmptyTopicalPool() {
    FeedProperties props = new FeedProperties();
    props.setTopicalPoolSize(0);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("topical-pool-size");
  }

  @Test
  void rejectsZeroExploratoryFactor() {
    FeedProperties props = new FeedProperties();
    props.setExploratoryPoolFactor(0);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("exploratory-pool-factor");
  }
}
