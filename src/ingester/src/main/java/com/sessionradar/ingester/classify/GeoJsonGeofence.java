package com.sessionradar.ingester.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Region boundaries read from a GeoJSON FeatureCollection of Polygon / MultiPolygon features.
 *
 * <p>A feature's region id is taken from its {@code id}, {@code ICAO} or {@code fir} property, in
 * that order. Only features whose id is in the configured set are kept.
 */
public final class GeoJsonGeofence implements Geofence {
  private final List<Region> regions;

  GeoJsonGeofence(List<Region> regions) {
    this.regions = List.copyOf(regions);
  }

  public static GeoJsonGeofence load(Path path, Collection<String> regionIds, ObjectMapper mapper)
      throws IOException {
    return parse(mapper.readTree(Files.readString(path)), regionIds);
  }

  public static GeoJsonGeofence parse(JsonNode featureCollection, Collection<String> regionIds) {
    Set<String> wanted = regionIds == null
        ? Set.of()
        : regionIds.stream().map(id -> id.trim().toUpperCase(Locale.ROOT)).collect(Collectors.toSet());
    List<Region> regions = new ArrayList<>();
    for (JsonNode feature : featureCollection.path("features")) {
      String id = regionId(feature.path("properties"));
      if (id == null || !wanted.contains(id.toUpperCase(Locale.ROOT))) {
        continue;
      }
      JsonNode geometry = feature.path("geometry");
      String type = geometry.path("type").asText("");
      List<Polygon> polygons = new ArrayList<>();
      if ("Polygon".equals(type)) {
        polygons.add(polygon(geometry.path("coordinates")));
      } else if ("MultiPolygon".equals(type)) {
        for (JsonNode coordinates : geometry.path("coordinates")) {
          polygons.add(polygon(coordinates));
        }
      } else {
        continue;
      }
      regions.add(new Region(id.toUpperCase(Locale.ROOT), polygons));
    }
    return new GeoJsonGeofence(regions);
  }

  @Override
  public Optional<String> regionAt(double latitude, double longitude) {
    for (Region region : regions) {
      for (Polygon polygon : region.polygons()) {
        if (polygon.contains(longitude, latitude)) {
          return Optional.of(region.id());
        }
      }
    }
    return Optional.empty();
  }

  public int regionCount() {
    return regions.size();
  }

  private static String regionId(JsonNode properties) {
    for (String field : List.of("id", "ICAO", "fir")) {
      JsonNode node = properties.get(field);
      if (node != null && node.isTextual() && !node.asText().isBlank()) {
        return node.asText().trim();
      }
    }
    return null;
  }

  private static Polygon polygon(JsonNode rings) {
    List<double[][]> parsed = new ArrayList<>();
    for (JsonNode ring : rings) {
      double[][] points = new double[ring.size()][];
      for (int i = 0; i < ring.size(); i++) {
        JsonNode position = ring.get(i);
        points[i] = new double[] {position.path(0).asDouble(), position.path(1).asDouble()};
      }
      parsed.add(points);
    }
    return new Polygon(parsed);
  }

  record Region(String id, List<Polygon> polygons) {}

  /** First ring is the outer boundary, the rest are holes. Coordinates are [lon, lat]. */
  record Polygon(List<double[][]> rings) {
    boolean contains(double x, double y) {
      if (rings.isEmpty() || !insideRing(rings.get(0), x, y)) {
        return false;
      }
      for (int i = 1; i < rings.size(); i++) {
        if (insideRing(rings.get(i), x, y)) {
          return false;
        }
      }
      return true;
    }

    private static boolean insideRing(double[][] ring, double x, double y) {
      boolean inside = false;
      for (int i = 0, j = ring.length - 1; i < ring.length; j = i++) {
        double xi = ring[i][0];
        double yi = ring[i][1];
        double xj = ring[j][0];
        double yj = ring[j][1];
        if ((yi > y) != (yj > y) && x < (xj - xi) * (y - yi) / (yj - yi) + xi) {
          inside = !inside;
        }
      }
      return inside;
    }
  }
}
