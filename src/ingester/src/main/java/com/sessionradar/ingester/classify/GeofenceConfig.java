package com.sessionradar.ingester.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionradar.ingester.config.IngesterProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GeofenceConfig {
  private static final Logger log = LoggerFactory.getLogger(GeofenceConfig.class);

  @Bean
  public Geofence geofence(IngesterProperties properties, ObjectMapper objectMapper) {
    IngesterProperties.Classifier classifier = properties.classifier();
    String location = classifier.geofencePath();
    if (location == null || location.isBlank()) {
      log.info("No geofence configured, pilots are matched by route only");
      return Geofence.NONE;
    }
    Path path = Path.of(location);
    if (!Files.isRegularFile(path)) {
      log.warn("Geofence file {} not found, pilots are matched by route only", path);
      return Geofence.NONE;
    }
    try {
      GeoJsonGeofence geofence = GeoJsonGeofence.load(path, classifier.regionIds(), objectMapper);
      log.info("Loaded geofence from {} ({} regions)", path, geofence.regionCount());
      return geofence;
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read geofence " + path, ex);
    }
  }
}
