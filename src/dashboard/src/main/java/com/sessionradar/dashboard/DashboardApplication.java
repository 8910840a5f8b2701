package com.sessionradar.dashboard;

import com.sessionradar.dashboard.config.DashboardProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the SessionRadar dashboard API service.
 *
 * <p>The service is read-only: it serves aggregates, open sessions and recent closed sessions
 * from the documents written by the ingester.
 */
@SpringBootApplication
@EnableConfigurationProperties(DashboardProperties.class)
public class DashboardApplication {
  /**
   * Starts the dashboard API application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(DashboardApplication.class, args);
  }
}
