package com.wifi.propagation.model;

/**
 * Axis-aligned geographic rectangle given by its south-west and north-east corners.
 *
 * @param swLat south-west latitude
 * @param swLng south-west longitude
 * @param neLat north-east latitude
 * @param neLng north-east longitude
 */
public record BoundingBox(double swLat, double swLng, double neLat, double neLng) {

  /**
   * Checks whether a point lies inside this box, borders included.
   *
   * @param lat latitude to test
   * @param lng longitude to test
   * @return {@code true} when the point is inside or on the border
   */
  public boolean contains(double lat, double lng) {
    return lat >= swLat && lat <= neLat && lng >= swLng && lng <= neLng;
  }

  /** Rectangular area in square degrees, only meaningful for comparing boxes with each other. */
  public double areaDeg2() {
    return (neLat - swLat) * (neLng - swLng);
  }
}
