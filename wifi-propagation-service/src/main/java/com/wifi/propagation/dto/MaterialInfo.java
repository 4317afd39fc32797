package com.wifi.propagation.dto;

import com.wifi.propagation.model.Band;

/** Loss of one material on one band. */
public record MaterialInfo(String id, Band band, double attenuationDb) {}
