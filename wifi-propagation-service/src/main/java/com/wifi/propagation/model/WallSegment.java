package com.wifi.propagation.model;

/** One straight piece of a wall, the unit the ray caster tests against. */
public record WallSegment(double lat1, double lng1, double lat2, double lng2, String material) {}
