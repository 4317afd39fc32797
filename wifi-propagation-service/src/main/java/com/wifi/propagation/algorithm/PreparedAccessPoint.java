package com.wifi.propagation.algorithm;

import com.wifi.propagation.model.PropagationAccessPoint;

/**
 * An access point together with the per-request values that do not depend on the observation
 * point, so they are resolved once instead of once per cell.
 *
 * @param accessPoint the access point
 * @param elevationOffsetDeg mount offset between the actual mount and the pattern's native mount
 */
public record PreparedAccessPoint(PropagationAccessPoint accessPoint, int elevationOffsetDeg) {}
