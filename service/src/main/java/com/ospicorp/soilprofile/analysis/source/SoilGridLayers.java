package com.ospicorp.soilprofile.analysis.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shallowest-depth values from a SoilGrids {@code properties/query} document, converted from
 * mapped integers to conventional units by each layer's {@code d_factor}. Absent, malformed or
 * wrong-typed properties are null.
 *
 * @param clayPct clay content, %
 * @param sandPct sand content, %
 * @param siltPct silt content, %
 * @param ph pH in water
 * @param organicCarbon soil organic carbon, g/kg
 */
public record SoilGridLayers(
    Double clayPct,
    Double sandPct,
    Double siltPct,
    Double ph,
    Double organicCarbon
) {

  public static final String CLAY = "clay";
  public static final String SAND = "sand";
  public static final String SILT = "silt";
  public static final String PH = "phh2o";
  public static final String ORGANIC_CARBON = "soc";

  public static final SoilGridLayers EMPTY = new SoilGridLayers(null, null, null, null, null);

  public static SoilGridLayers from(JsonNode payload) {
    JsonNode layers = payload.path("properties").path("layers");
    return new SoilGridLayers(
        shallowest(layers, CLAY),
        shallowest(layers, SAND),
        shallowest(layers, SILT),
        shallowest(layers, PH),
        shallowest(layers, ORGANIC_CARBON));
  }

  public double clayOrZero() {
    return orZero(clayPct);
  }

  public double sandOrZero() {
    return orZero(sandPct);
  }

  public double siltOrZero() {
    return orZero(siltPct);
  }

  public double phOrZero() {
    return orZero(ph);
  }

  private static double orZero(Double value) {
    return value == null ? 0d : value;
  }

  private static Double shallowest(JsonNode layers, String name) {
    if (!layers.isArray()) {
      return null;
    }
    for (JsonNode layer : layers) {
      if (!name.equals(layer.path("name").asText(null))) {
        continue;
      }
      JsonNode depth = shallowestDepth(layer.path("depths"));
      if (depth == null) {
        return null;
      }
      Double mean = JsonNumbers.read(depth.path("values").get("mean"));
      if (mean == null) {
        return null;
      }
      return mean / conversionFactor(layer);
    }
    return null;
  }

  private static JsonNode shallowestDepth(JsonNode depths) {
    if (!depths.isArray()) {
      return null;
    }
    JsonNode best = null;
    double bestTop = Double.POSITIVE_INFINITY;
    for (JsonNode depth : depths) {
      if (!depth.isObject()) {
        continue;
      }
      Double top = JsonNumbers.read(depth.path("range").get("top_depth"));
      double key = top == null ? Double.MAX_VALUE : top;
      if (best == null || key < bestTop) {
        best = depth;
        bestTop = key;
      }
    }
    return best;
  }

  private static double conversionFactor(JsonNode layer) {
    Double factor = JsonNumbers.read(layer.path("unit_measure").get("d_factor"));
    return factor == null || factor == 0d ? 1d : factor;
  }
}
