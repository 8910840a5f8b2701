package com.sessionradar.ingester.config;

import com.sessionradar.ingester.session.PseudoSessionRule;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(IngesterProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(properties.feed().timeoutMs()))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public PseudoSessionRule pseudoSessionRule(IngesterProperties properties) {
    return new PseudoSessionRule(properties.tracking().pseudoSuffixes());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
