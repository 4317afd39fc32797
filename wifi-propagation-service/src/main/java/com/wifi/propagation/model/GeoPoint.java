package com.wifi.propagation.model;

/** A WGS84 latitude/longitude pair in degrees. */
public record GeoPoint(double lat, double lng) {

  public static GeoPoint of(double lat, double lng) {
    return new GeoPoint(lat, lng);
  }
}
