package com.ospicorp.soilprofile.analysis.model;

/**
 * A geographic point in decimal degrees (WGS84).
 */
public record Coordinate(double latitude, double longitude) {

  public Coordinate {
    if (!isValid(latitude, longitude)) {
      throw new IllegalArgumentException(describeInvalid(latitude, longitude));
    }
  }

  public static boolean isValid(double latitude, double longitude) {
    return Double.isFinite(latitude) && Double.isFinite(longitude)
        && latitude >= -90d && latitude <= 90d
        && longitude >= -180d && longitude <= 180d;
  }

  public static String describeInvalid(double latitude, double longitude) {
    return "Invalid coordinate (" + latitude + ", " + longitude
        + "): latitude must be within [-90, 90] and longitude within [-180, 180]";
  }
}
