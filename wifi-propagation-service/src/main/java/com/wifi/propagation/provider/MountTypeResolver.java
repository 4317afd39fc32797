package com.wifi.propagation.provider;

import com.wifi.propagation.model.MountType;

/** Knows how a device model is mounted out of the box. */
public interface MountTypeResolver {

  MountType defaultMountType(String model);
}
