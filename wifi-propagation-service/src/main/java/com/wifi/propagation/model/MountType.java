package com.wifi.propagation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Physical mounting of an access point. Each mount rotates the radiation pattern in the vertical
 * plane; the offset is the rotation in degrees relative to a flat ceiling mount.
 */
public enum MountType {
  CEILING("ceiling", 0),
  WALL("wall", -90),
  DESKTOP("desktop", 180);

  private final String value;
  private final int elevationOffsetDeg;

  MountType(String value, int elevationOffsetDeg) {
    this.value = value;
    this.elevationOffsetDeg = elevationOffsetDeg;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public int getElevationOffsetDeg() {
    return elevationOffsetDeg;
  }

  /**
   * Lenient lookup: anything that is not "wall" or "desktop" counts as a ceiling mount.
   *
   * @param value mount name, case-insensitive, may be null
   * @return the mount type, never null
   */
  @JsonCreator
  public static MountType fromValue(String value) {
    if (value == null) {
      return CEILING;
    }
    String normalized = value.trim().toLowerCase();
    for (MountType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    return CEILING;
  }
}
