package com.sessionradar.ingester;

import com.sessionradar.ingester.config.IngesterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class IngesterApplication {
  // Live mode keeps running on the scheduler; sync and backfill exit once their run is done.
  public static void main(String[] args) {
    ConfigurableApplicationContext context = SpringApplication.run(IngesterApplication.class, args);
    IngesterProperties.Mode mode = context.getBean(IngesterProperties.class).mode();
    if (mode != null && mode != IngesterProperties.Mode.LIVE) {
      System.exit(SpringApplication.exit(context));
    }
  }

  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "ingester.scheduling",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SchedulingConfiguration {}
}
