package dev.whispr.api;

import dev.whispr.search.EntityType;
import dev.whispr.search.SortField;
import dev.whispr.search.SortOrder;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Registers the viewer resolver and the lowercase wire-name converters for query parameters. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
    resolvers.add(new ViewerArgumentResolver());
  }

  @Override
  public void addFormatters(FormatterRegistry registry) {
    registry.addConverter(String.class, EntityType.class, EntityType::fromValue);
    registry.addConverter(String.class, SortField.class, SortField::fromValue);
    registry.addConverter(String.class, SortOrder.class, SortOrder::fromValue);
  }
}
