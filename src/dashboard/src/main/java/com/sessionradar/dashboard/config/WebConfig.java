package com.sessionradar.dashboard.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Registers CORS for {@code /api/**} when an origin allowlist is configured. */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final DashboardProperties properties;

  public WebConfig(DashboardProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> configured = properties.getApi().getCors().getAllowedOrigins();
    if (configured == null) {
      return;
    }
    List<String> allowedOrigins = configured.stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .map(String::trim)
        .toList();
    if (allowedOrigins.isEmpty()) {
      return;
    }

    registry
        .addMapping("/api/**")
        .allowedMethods("GET", "OPTIONS")
        .allowedHeaders("*")
        .allowedOrigins(allowedOrigins.toArray(String[]::new))
        .maxAge(600);
  }
}
