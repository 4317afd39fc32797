package com.wifi.propagation.mapper;

import com.wifi.propagation.dto.AccessPointRequest;
import com.wifi.propagation.dto.BuildingRequest;
import com.wifi.propagation.dto.HeatmapRequest;
import com.wifi.propagation.dto.LatLngRequest;
import com.wifi.propagation.dto.WallRequest;
import com.wifi.propagation.model.BoundingBox;
import com.wifi.propagation.model.BuildingFloorInfo;
import com.wifi.propagation.model.GeoPoint;
import com.wifi.propagation.model.MountType;
import com.wifi.propagation.model.PropagationAccessPoint;
import com.wifi.propagation.model.WallPolyline;
import com.wifi.propagation.provider.MountTypeResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps heatmap request DTOs to the engine's domain model.
 * Applies simulation overrides and fills in factory mount types.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeatmapRequestMapper {

    private final MountTypeResolver mountTypeResolver;

    public BoundingBox toBoundingBox(HeatmapRequest request) {
        return new BoundingBox(request.getSwLat(), request.getSwLng(), request.getNeLat(), request.getNeLng());
    }

    /**
     * Maps the request's access points, applying TX power and antenna mode overrides keyed by MAC
     * address. MAC matching ignores case and the ':' / '-' separator.
     *
     * @param request heatmap request
     * @return engine access points in request order
     */
    public List<PropagationAccessPoint> toAccessPoints(HeatmapRequest request) {
        if (request.getAccessPoints() == null) {
            return List.of();
        }
        Map<String, Double> txOverrides = byMac(request.getTxPowerOverrides());
        Map<String, String> modeOverrides = byMac(request.getAntennaModeOverrides());

        List<PropagationAccessPoint> accessPoints = new ArrayList<>(request.getAccessPoints().size());
        for (AccessPointRequest apRequest : request.getAccessPoints()) {
            PropagationAccessPoint ap = toAccessPoint(apRequest);
            String mac = normalizeMac(apRequest.getMacAddress());
            if (mac != null) {
                Double txPower = txOverrides.get(mac);
                if (txPower != null) {
                    log.debug("TX power override for {}: {} -> {} dBm", mac, ap.txPowerDbm(), txPower);
                    ap = ap.withTxPowerDbm(txPower);
                }
                String mode = modeOverrides.get(mac);
                if (mode != null) {
                    log.debug("Antenna mode override for {}: {} -> {}", mac, ap.antennaMode(), mode);
                    ap = ap.withAntennaMode(mode);
                }
            }
            accessPoints.add(ap);
        }
        return accessPoints;
    }

    public Map<Integer, List<WallPolyline>> toWallsByFloor(HeatmapRequest request) {
        if (request.getWallsByFloor() == null) {
            return Map.of();
        }
        Map<Integer, List<WallPolyline>> wallsByFloor = new HashMap<>();
        request.getWallsByFloor().forEach((floor, walls) -> {
            if (floor == null || walls == null) {
                return;
            }
            List<WallPolyline> polylines = new ArrayList<>(walls.size());
            for (WallRequest wall : walls) {
                polylines.add(toWall(floor, wall));
            }
            wallsByFloor.put(floor, polylines);
        });
        return wallsByFloor;
    }

    public List<BuildingFloorInfo> toBuildings(HeatmapRequest request) {
        if (request.getBuildings() == null) {
            return List.of();
        }
        List<BuildingFloorInfo> buildings = new ArrayList<>(request.getBuildings().size());
        for (BuildingRequest building : request.getBuildings()) {
            buildings.add(new BuildingFloorInfo(
                new BoundingBox(building.getSwLat(), building.getSwLng(), building.getNeLat(), building.getNeLng()),
                building.getFloorMaterials()));
        }
        return buildings;
    }

    private PropagationAccessPoint toAccessPoint(AccessPointRequest request) {
        MountType mountType = request.getMountType() != null
            ? request.getMountType()
            : mountTypeResolver.defaultMountType(request.getModel());

        return new PropagationAccessPoint(
            request.getMacAddress(),
            request.getLatitude(),
            request.getLongitude(),
            request.getFloor() != null ? request.getFloor() : 0,
            request.getTxPowerDbm(),
            request.getAntennaGainDbi() != null ? request.getAntennaGainDbi() : 0.0,
            request.getModel(),
            request.getAntennaMode(),
            mountType,
            request.getOrientationDeg() != null ? request.getOrientationDeg() : 0);
    }

    private WallPolyline toWall(int floor, WallRequest wall) {
        List<GeoPoint> points = new ArrayList<>();
        if (wall.getPoints() != null) {
            for (LatLngRequest point : wall.getPoints()) {
                points.add(GeoPoint.of(point.getLat(), point.getLng()));
            }
        }
        return new WallPolyline(floor, points, wall.getMaterial(), wall.getMaterials());
    }

    private static <T> Map<String, T> byMac(Map<String, T> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return Map.of();
        }
        Map<String, T> normalized = new HashMap<>();
        overrides.forEach((mac, value) -> {
            String key = normalizeMac(mac);
            if (key != null && value != null) {
                normalized.put(key, value);
            }
        });
        return normalized;
    }

    private static String normalizeMac(String mac) {
        if (mac == null || mac.isBlank()) {
            return null;
        }
        return mac.trim().replace('-', ':').toUpperCase(Locale.ROOT);
    }
}
