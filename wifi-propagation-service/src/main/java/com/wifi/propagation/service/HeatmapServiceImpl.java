package com.wifi.propagation.service;

import com.wifi.propagation.algorithm.HeatmapCalculator;
import com.wifi.propagation.dto.HeatmapRequest;
import com.wifi.propagation.dto.HeatmapResponse;
import com.wifi.propagation.dto.MaterialInfo;
import com.wifi.propagation.exception.HeatmapComputationException;
import com.wifi.propagation.mapper.HeatmapRequestMapper;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.BoundingBox;
import com.wifi.propagation.model.BuildingFloorInfo;
import com.wifi.propagation.model.HeatmapGrid;
import com.wifi.propagation.model.PropagationAccessPoint;
import com.wifi.propagation.model.WallPolyline;
import com.wifi.propagation.provider.AntennaPatternProvider;
import com.wifi.propagation.provider.MaterialAttenuationProvider;
import com.wifi.propagation.provider.PatternResolution;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Heatmap service: validates and maps the request, runs the calculator and records metrics.
 */
@Service
@Slf4j
public class HeatmapServiceImpl implements HeatmapService {

    static final String DURATION_TIMER = "propagation.heatmap.duration";
    static final String CELLS_COUNTER = "propagation.heatmap.cells";
    static final String FAILURES_COUNTER = "propagation.heatmap.failures";

    private final HeatmapCalculator calculator;
    private final HeatmapRequestValidator validator;
    private final HeatmapRequestMapper mapper;
    private final AntennaPatternProvider patternProvider;
    private final MaterialAttenuationProvider materialProvider;
    private final MeterRegistry meterRegistry;
    private final Counter cellsCounter;
    private final Counter failuresCounter;

    public HeatmapServiceImpl(
            HeatmapCalculator calculator,
            HeatmapRequestValidator validator,
            HeatmapRequestMapper mapper,
            AntennaPatternProvider patternProvider,
            MaterialAttenuationProvider materialProvider,
            MeterRegistry meterRegistry) {
        this.calculator = calculator;
        this.validator = validator;
        this.mapper = mapper;
        this.patternProvider = patternProvider;
        this.materialProvider = materialProvider;
        this.meterRegistry = meterRegistry;
        this.cellsCounter = Counter.builder(CELLS_COUNTER)
            .description("Number of heatmap cells computed")
            .register(meterRegistry);
        this.failuresCounter = Counter.builder(FAILURES_COUNTER)
            .description("Number of heatmap computations that failed or timed out")
            .register(meterRegistry);
    }

    @Override
    public HeatmapResponse computeHeatmap(HeatmapRequest request) {
        validator.validate(request);

        Band band = request.getBand();
        int activeFloor = request.getActiveFloor() != null ? request.getActiveFloor() : 0;
        BoundingBox bounds = mapper.toBoundingBox(request);
        List<PropagationAccessPoint> accessPoints = mapper.toAccessPoints(request);
        Map<Integer, List<WallPolyline>> wallsByFloor = mapper.toWallsByFloor(request);
        List<BuildingFloorInfo> buildings = mapper.toBuildings(request);

        if (log.isDebugEnabled()) {
            logDiagnostics(band, accessPoints, buildings);
        }

        long startTime = System.nanoTime();
        HeatmapGrid grid;
        try {
            grid = calculator.computeHeatmap(
                bounds, band, accessPoints, wallsByFloor, activeFloor,
                request.getGridResolutionMeters(), buildings);
        } catch (HeatmapComputationException e) {
            failuresCounter.increment();
            throw e;
        }
        long elapsedNanos = System.nanoTime() - startTime;

        Timer.builder(DURATION_TIMER)
            .description("Time spent computing heatmaps")
            .tag("band", band.getCode())
            .register(meterRegistry)
            .record(Duration.ofNanos(elapsedNanos));
        cellsCounter.increment(grid.data().length);

        long computationTimeMs = elapsedNanos / 1_000_000;
        log.info("Computed {}x{} heatmap: band={} floor={} aps={} walls={} in {} ms",
            grid.width(), grid.height(), band.getCode(), activeFloor, accessPoints.size(),
            wallsByFloor.values().stream().mapToInt(List::size).sum(), computationTimeMs);

        return HeatmapResponse.from(grid, band, activeFloor, accessPoints.size(), computationTimeMs);
    }

    @Override
    public List<MaterialInfo> listMaterials(Band band) {
        return new TreeSet<>(materialProvider.knownMaterialIds()).stream()
            .map(id -> new MaterialInfo(id, band, materialProvider.attenuationDb(id, band)))
            .toList();
    }

    private void logDiagnostics(
            Band band, List<PropagationAccessPoint> accessPoints, List<BuildingFloorInfo> buildings) {
        for (int i = 0; i < buildings.size(); i++) {
            BuildingFloorInfo building = buildings.get(i);
            log.debug("Building {}: bounds={} floorMaterials={}", i, building.bounds(), building.floorMaterials());
        }
        for (PropagationAccessPoint ap : accessPoints) {
            PatternResolution resolution = patternProvider.resolvePattern(ap.model(), band, ap.antennaMode());
            log.debug("AP {} model={} mode={} mount={} floor={} pattern={}{}",
                ap.macAddress(), ap.model(), ap.antennaMode(), ap.mountType().getValue(), ap.floor(),
                resolution.isPresent() ? "found" : "none",
                resolution.isPresent() && resolution.fallback() ? " (fallback)" : "");
        }
    }
}
