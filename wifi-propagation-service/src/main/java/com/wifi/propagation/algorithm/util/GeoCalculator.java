package com.wifi.propagation.algorithm.util;

/**
 * Geodesic and planar geometry helpers shared by the propagation model.
 *
 * <p>All angles are in degrees and all distances in meters. Segment intersection works on raw
 * latitude/longitude pairs; at floor-plan scale the distortion of treating degrees as planar
 * coordinates does not change which walls a ray crosses.
 */
public final class GeoCalculator {

  /** Mean Earth radius used by the Haversine formula. */
  public static final double EARTH_RADIUS_METERS = 6371000.0;

  private GeoCalculator() {
    // Utility class
  }

  /**
   * Great-circle distance between two points using the Haversine formula.
   *
   * @return distance in meters, 0 for identical points
   */
  public static double haversineDistanceMeters(double lat1, double lng1, double lat2, double lng2) {
    double dLat = Math.toRadians(lat2 - lat1);
    double dLng = Math.toRadians(lng2 - lng1);
    double a =
        Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1))
                * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2)
                * Math.sin(dLng / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_METERS * c;
  }

  /**
   * Initial compass bearing from point 1 to point 2.
   *
   * @return bearing in [0, 360), 0 is north and 90 east
   */
  public static double bearingDegrees(double lat1, double lng1, double lat2, double lng2) {
    double dLng = Math.toRadians(lng2 - lng1);
    double lat1Rad = Math.toRadians(lat1);
    double lat2Rad = Math.toRadians(lat2);

    double x = Math.sin(dLng) * Math.cos(lat2Rad);
    double y =
        Math.cos(lat1Rad) * Math.sin(lat2Rad)
            - Math.sin(lat1Rad) * Math.cos(lat2Rad) * Math.cos(dLng);

    double bearing = (Math.toDegrees(Math.atan2(x, y)) + 360) % 360;
    // (-tiny + 360) % 360 can round to exactly 360.0
    return bearing >= 360 ? 0 : bearing;
  }

  /**
   * Strict intersection test for segments a1-a2 and b1-b2 using cross-product signs. Only proper
   * crossings count: touching endpoints and collinear overlap return false.
   */
  public static boolean segmentsIntersect(
      double ax1, double ay1, double ax2, double ay2,
      double bx1, double by1, double bx2, double by2) {
    double d1 = crossProduct(bx1, by1, bx2, by2, ax1, ay1);
    double d2 = crossProduct(bx1, by1, bx2, by2, ax2, ay2);
    double d3 = crossProduct(ax1, ay1, ax2, ay2, bx1, by1);
    double d4 = crossProduct(ax1, ay1, ax2, ay2, bx2, by2);

    return ((d1 > 0 && d2 < 0) || (d1 < 0 && d2 > 0))
        && ((d3 > 0 && d4 < 0) || (d3 < 0 && d4 > 0));
  }

  /** Z component of (b - a) x (c - a). */
  private static double crossProduct(
      double ax, double ay, double bx, double by, double cx, double cy) {
    return (bx - ax) * (cy - ay) - (by - ay) * (cx - ax);
  }
}
