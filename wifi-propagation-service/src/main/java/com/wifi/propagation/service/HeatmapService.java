package com.wifi.propagation.service;

import com.wifi.propagation.dto.HeatmapRequest;
import com.wifi.propagation.dto.HeatmapResponse;
import com.wifi.propagation.dto.MaterialInfo;
import com.wifi.propagation.model.Band;

import java.util.List;

/**
 * Service interface for signal heatmap operations.
 */
public interface HeatmapService {

    /**
     * Computes the predicted signal strength grid for a floor plan region.
     *
     * @param request area, band, access points, walls and buildings
     * @return the heatmap
     * @throws IllegalArgumentException if the request is invalid
     * @throws com.wifi.propagation.exception.HeatmapComputationException if the computation fails
     */
    HeatmapResponse computeHeatmap(HeatmapRequest request);

    /**
     * Lists the known wall and floor materials with their loss on a band.
     *
     * @param band radio band
     * @return materials ordered by id
     */
    List<MaterialInfo> listMaterials(Band band);
}
