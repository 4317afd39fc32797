package com.wifi.propagation.service;

import com.wifi.propagation.config.PropagationProperties;
import com.wifi.propagation.dto.AccessPointRequest;
import com.wifi.propagation.dto.BuildingRequest;
import com.wifi.propagation.dto.HeatmapRequest;
import com.wifi.propagation.dto.LatLngRequest;
import com.wifi.propagation.dto.WallRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Business validation of heatmap requests, on top of the bean validation constraints on the DTOs.
 *
 * Checks:
 * 1. All coordinates are finite numbers
 * 2. The south-west corner is not north or east of the north-east corner
 * 3. At least one and at most {@code propagation.validation.max-access-points} APs
 * 4. Every wall has at least two vertices and, when given, one material per segment
 * 5. The grid resolution is a positive finite number
 *
 * Violations throw {@link IllegalArgumentException}, which the API reports as 400 Bad Request.
 */
@Component
@RequiredArgsConstructor
public class HeatmapRequestValidator {

    private final PropagationProperties properties;

    public void validate(HeatmapRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Heatmap request is required");
        }
        validateBounds(request);
        validateResolution(request.getGridResolutionMeters());
        validateAccessPoints(request.getAccessPoints());
        validateWalls(request.getWallsByFloor());
        validateBuildings(request.getBuildings());
        validateTxPowerOverrides(request.getTxPowerOverrides());
    }

    private void validateBounds(HeatmapRequest request) {
        requireFinite("swLat", request.getSwLat());
        requireFinite("swLng", request.getSwLng());
        requireFinite("neLat", request.getNeLat());
        requireFinite("neLng", request.getNeLng());
        if (request.getSwLat() > request.getNeLat()) {
            throw new IllegalArgumentException("swLat must not be greater than neLat");
        }
        if (request.getSwLng() > request.getNeLng()) {
            throw new IllegalArgumentException("swLng must not be greater than neLng");
        }
    }

    private void validateResolution(Double resolution) {
        requireFinite("gridResolutionMeters", resolution);
        if (resolution <= 0) {
            throw new IllegalArgumentException("gridResolutionMeters must be positive");
        }
    }

    private void validateAccessPoints(List<AccessPointRequest> accessPoints) {
        if (accessPoints == null || accessPoints.isEmpty()) {
            throw new IllegalArgumentException("At least one access point is required");
        }
        int max = properties.getValidation().getMaxAccessPoints();
        if (accessPoints.size() > max) {
            throw new IllegalArgumentException(
                "At most " + max + " access points are allowed, got " + accessPoints.size());
        }
        for (int i = 0; i < accessPoints.size(); i++) {
            AccessPointRequest ap = accessPoints.get(i);
            if (ap == null) {
                throw new IllegalArgumentException("accessPoints[" + i + "] must not be null");
            }
            requireFinite("accessPoints[" + i + "].latitude", ap.getLatitude());
            requireFinite("accessPoints[" + i + "].longitude", ap.getLongitude());
            requireFinite("accessPoints[" + i + "].txPowerDbm", ap.getTxPowerDbm());
            if (ap.getAntennaGainDbi() != null) {
                requireFinite("accessPoints[" + i + "].antennaGainDbi", ap.getAntennaGainDbi());
            }
        }
    }

    private void validateWalls(Map<Integer, List<WallRequest>> wallsByFloor) {
        if (wallsByFloor == null) {
            return;
        }
        wallsByFloor.forEach((floor, walls) -> {
            if (walls == null) {
                return;
            }
            for (int i = 0; i < walls.size(); i++) {
                validateWall("wallsByFloor[" + floor + "][" + i + "]", walls.get(i));
            }
        });
    }

    private void validateWall(String path, WallRequest wall) {
        if (wall == null || wall.getPoints() == null || wall.getPoints().size() < 2) {
            throw new IllegalArgumentException(path + " needs at least two points");
        }
        for (LatLngRequest point : wall.getPoints()) {
            if (point == null) {
                throw new IllegalArgumentException(path + " contains a null point");
            }
            requireFinite(path + ".lat", point.getLat());
            requireFinite(path + ".lng", point.getLng());
        }
        int segments = wall.getPoints().size() - 1;
        if (wall.getMaterials() != null && wall.getMaterials().size() != segments) {
            throw new IllegalArgumentException(path + " has " + segments + " segments but "
                + wall.getMaterials().size() + " materials");
        }
    }

    private void validateBuildings(List<BuildingRequest> buildings) {
        if (buildings == null) {
            return;
        }
        for (int i = 0; i < buildings.size(); i++) {
            BuildingRequest building = buildings.get(i);
            String path = "buildings[" + i + "]";
            if (building == null) {
                throw new IllegalArgumentException(path + " must not be null");
            }
            requireFinite(path + ".swLat", building.getSwLat());
            requireFinite(path + ".swLng", building.getSwLng());
            requireFinite(path + ".neLat", building.getNeLat());
            requireFinite(path + ".neLng", building.getNeLng());
        }
    }

    private void validateTxPowerOverrides(Map<String, Double> overrides) {
        if (overrides == null) {
            return;
        }
        overrides.forEach((mac, txPower) -> requireFinite("txPowerOverrides[" + mac + "]", txPower));
    }

    private static void requireFinite(String field, Double value) {
        if (value == null || !Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be a finite number");
        }
    }
}
