package com.wifi.propagation.algorithm;

import static com.wifi.propagation.support.PropagationTestSupport.BASE_LAT;
import static com.wifi.propagation.support.PropagationTestSupport.BASE_LNG;
import static com.wifi.propagation.support.PropagationTestSupport.accessPoint;
import static com.wifi.propagation.support.PropagationTestSupport.ceilingMounts;
import static com.wifi.propagation.support.PropagationTestSupport.east;
import static com.wifi.propagation.support.PropagationTestSupport.north;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.wifi.propagation.config.HeatmapExecutorConfig;
import com.wifi.propagation.config.PropagationProperties;
import com.wifi.propagation.exception.HeatmapComputationException;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.BoundingBox;
import com.wifi.propagation.model.BuildingFloorInfo;
import com.wifi.propagation.model.GeoPoint;
import com.wifi.propagation.model.HeatmapGrid;
import com.wifi.propagation.model.MountType;
import com.wifi.propagation.model.PropagationAccessPoint;
import com.wifi.propagation.model.WallPolyline;
import com.wifi.propagation.support.FixedMaterialProvider;
import com.wifi.propagation.support.PropagationTestSupport;
import com.wifi.propagation.support.TestAntennaPatternProvider;

class HeatmapCalculatorTest {

  /** 100.5 m east-west by 50.5 m north-south, anchored at the base location. */
  private static final BoundingBox OFFICE =
      new BoundingBox(
          BASE_LAT, BASE_LNG, north(BASE_LAT, 50.5), east(BASE_LAT, BASE_LNG, 100.5));

  private final FixedMaterialProvider materials =
      FixedMaterialProvider.uniform(5.0).withFrequencyMhz(5500);
  private ExecutorService pool;
  private PropagationProperties properties;
  private SignalStrengthModel signalModel;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(4);
    properties = new PropagationProperties();
    properties.getComputation().setWorkers(4);
    properties.getComputation().setTimeoutSeconds(10);
    signalModel =
        PropagationTestSupport.signalModel(TestAntennaPatternProvider.flat(), materials, ceilingMounts());
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  private HeatmapCalculator calculator() {
    return new HeatmapCalculator(signalModel, materials, pool, properties);
  }

  @Nested
  @DisplayName("Grid dimensions")
  class GridDimensionTests {

    @Test
    @DisplayName("one cell per resolution step on each axis")
    void oneCellPerStep() {
      HeatmapCalculator.GridDimensions dims = HeatmapCalculator.gridDimensions(OFFICE, 1.0);
      assertThat(dims.width()).isEqualTo(100);
      assertThat(dims.height()).isEqualTo(50);

      HeatmapCalculator.GridDimensions coarse = HeatmapCalculator.gridDimensions(OFFICE, 10.0);
      assertThat(coarse.width()).isEqualTo(10);
      assertThat(coarse.height()).isEqualTo(5);
    }

    @Test
    @DisplayName("dimensions are capped at 500 per side")
    void dimensionsAreCapped() {
      BoundingBox campus =
          new BoundingBox(BASE_LAT, BASE_LNG, north(BASE_LAT, 5000), east(BASE_LAT, BASE_LNG, 5000));
      HeatmapCalculator.GridDimensions dims = HeatmapCalculator.gridDimensions(campus, 0.5);
      assertThat(dims.width()).isEqualTo(HeatmapCalculator.MAX_GRID_DIMENSION);
      assertThat(dims.height()).isEqualTo(HeatmapCalculator.MAX_GRID_DIMENSION);
    }

    @Test
    @DisplayName("a degenerate area still yields one cell")
    void degenerateAreaYieldsOneCell() {
      BoundingBox point = new BoundingBox(BASE_LAT, BASE_LNG, BASE_LAT, BASE_LNG);
      HeatmapCalculator.GridDimensions dims = HeatmapCalculator.gridDimensions(point, 1.0);
      assertThat(dims.width()).isEqualTo(1);
      assertThat(dims.height()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Grid values")
  class GridValueTests {

    @Test
    @DisplayName("without access points every cell holds the no-coverage sentinel")
    void emptyApListYieldsSentinel() {
      HeatmapGrid grid =
          calculator().computeHeatmap(OFFICE, Band.BAND_5_GHZ, List.of(), Map.of(), 0, 2.0, List.of());

      assertThat(grid.data()).hasSize(grid.width() * grid.height());
      for (float value : grid.data()) {
        assertThat(value).isEqualTo(HeatmapCalculator.NO_COVERAGE_DBM);
      }
    }

    @Test
    @DisplayName("data length matches the dimensions")
    void dataLengthMatchesDimensions() {
      HeatmapGrid grid =
          calculator()
              .computeHeatmap(
                  OFFICE, Band.BAND_5_GHZ, List.of(accessPoint(north(BASE_LAT, 25), east(BASE_LAT, BASE_LNG, 50), 0, 20, 3)),
                  Map.of(), 0, 1.0, List.of());

      assertThat(grid.width()).isEqualTo(100);
      assertThat(grid.height()).isEqualTo(50);
      assertThat(grid.data()).hasSize(5000);
      assertThat(grid.bounds()).isEqualTo(OFFICE);
    }

    @Test
    @DisplayName("row 0 is the southern edge and column 0 the western edge")
    void rowZeroIsSouth() {
      PropagationAccessPoint northEastAp =
          accessPoint(north(BASE_LAT, 49), east(BASE_LAT, BASE_LNG, 99), 0, 20, 3);

      HeatmapGrid grid =
          calculator().computeHeatmap(OFFICE, Band.BAND_5_GHZ, List.of(northEastAp), Map.of(), 0, 5.0, List.of());

      float southWest = grid.valueAt(0, 0);
      float northEast = grid.valueAt(grid.width() - 1, grid.height() - 1);
      assertThat(northEast).isGreaterThan(southWest);
    }

    @Test
    @DisplayName("each cell holds the strongest AP")
    void cellsHoldStrongestAp() {
      PropagationAccessPoint weak = accessPoint(north(BASE_LAT, 25), east(BASE_LAT, BASE_LNG, 50), 0, 5, 0);
      PropagationAccessPoint strong = accessPoint(north(BASE_LAT, 25), east(BASE_LAT, BASE_LNG, 50), 0, 20, 0);

      HeatmapGrid both =
          calculator().computeHeatmap(OFFICE, Band.BAND_5_GHZ, List.of(weak, strong), Map.of(), 0, 10.0, List.of());
      HeatmapGrid strongOnly =
          calculator().computeHeatmap(OFFICE, Band.BAND_5_GHZ, List.of(strong), Map.of(), 0, 10.0, List.of());

      assertThat(both.data()).containsExactly(strongOnly.data());
    }
  }

  @Nested
  @DisplayName("Parallel execution")
  class ParallelTests {

    @Test
    @DisplayName("parallel computation matches single-threaded computation exactly")
    void parallelMatchesSingleThreaded() {
      List<PropagationAccessPoint> aps =
          List.of(
              accessPoint(north(BASE_LAT, 10), east(BASE_LAT, BASE_LNG, 20), 0, 20, 3),
              new PropagationAccessPoint(
                  "00:11:22:33:44:66", north(BASE_LAT, 40), east(BASE_LAT, BASE_LNG, 80), 1, 23, 4,
                  "Flat-AP", null, MountType.WALL, 135),
              new PropagationAccessPoint(
                  "00:11:22:33:44:77", north(BASE_LAT, 5), east(BASE_LAT, BASE_LNG, 95), 0, 17, 2,
                  "Flat-AP", null, MountType.DESKTOP, 300));
      double wallLat = north(BASE_LAT, 30);
      Map<Integer, List<WallPolyline>> walls =
          Map.of(
              0, List.of(new WallPolyline(0, List.of(
                  GeoPoint.of(wallLat, east(BASE_LAT, BASE_LNG, 0)),
                  GeoPoint.of(wallLat, east(BASE_LAT, BASE_LNG, 60)),
                  GeoPoint.of(north(BASE_LAT, 50), east(BASE_LAT, BASE_LNG, 60))), "concrete", null)),
              1, List.of(new WallPolyline(1, List.of(
                  GeoPoint.of(BASE_LAT, east(BASE_LAT, BASE_LNG, 70)),
                  GeoPoint.of(north(BASE_LAT, 50), east(BASE_LAT, BASE_LNG, 70))), "glass", null)));
      List<BuildingFloorInfo> buildings =
          List.of(new BuildingFloorInfo(OFFICE, Map.of(1, "floor_concrete")));

      HeatmapGrid parallel =
          calculator().computeHeatmap(OFFICE, Band.BAND_5_GHZ, aps, walls, 0, 1.0, buildings);
      HeatmapGrid serial =
          new HeatmapCalculator(signalModel, materials, Runnable::run, properties)
              .computeHeatmap(OFFICE, Band.BAND_5_GHZ, aps, walls, 0, 1.0, buildings);

      assertThat(parallel.width()).isEqualTo(serial.width());
      assertThat(parallel.height()).isEqualTo(serial.height());
      assertThat(parallel.data()).containsExactly(serial.data());
    }

    @Test
    @DisplayName("a computation that outlives the timeout fails as timed out")
    void timeoutFailsComputation() {
      properties.getComputation().setTimeoutSeconds(1);
      HeatmapCalculator stalled =
          new HeatmapCalculator(signalModel, materials, task -> { }, properties);

      assertThatThrownBy(
              () -> stalled.computeHeatmap(OFFICE, Band.BAND_5_GHZ,
                  List.of(accessPoint(BASE_LAT, BASE_LNG, 0, 20, 3)), Map.of(), 0, 5.0, List.of()))
          .isInstanceOf(HeatmapComputationException.class)
          .satisfies(e -> assertThat(((HeatmapComputationException) e).isTimedOut()).isTrue());
    }

    @Test
    @DisplayName("bands run on the caller of a saturated pool stop at the deadline")
    void saturatedPoolHonoursDeadline() {
      properties.getComputation().setWorkers(1);
      properties.getComputation().setQueueCapacity(0);
      properties.getComputation().setTimeoutSeconds(1);
      HeatmapExecutorConfig executorConfig = new HeatmapExecutorConfig(properties);
      SignalStrengthModel slowModel =
          PropagationTestSupport.signalModel(slowPatterns(), materials, ceilingMounts());
      HeatmapCalculator saturated =
          new HeatmapCalculator(slowModel, materials, executorConfig.heatmapExecutor(), properties);

      long start = System.nanoTime();
      try {
        assertThatThrownBy(
                () -> saturated.computeHeatmap(OFFICE, Band.BAND_5_GHZ,
                    List.of(accessPoint(BASE_LAT, BASE_LNG, 0, 20, 3)), Map.of(), 0, 1.0, List.of()))
            .isInstanceOf(HeatmapComputationException.class)
            .satisfies(e -> assertThat(((HeatmapComputationException) e).isTimedOut()).isTrue());
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(2500));
      } finally {
        executorConfig.shutdown();
      }
    }

    @Test
    @DisplayName("a shut down executor fails the computation at once")
    void shutDownExecutorFailsImmediately() {
      HeatmapExecutorConfig executorConfig = new HeatmapExecutorConfig(properties);
      HeatmapCalculator stopped =
          new HeatmapCalculator(signalModel, materials, executorConfig.heatmapExecutor(), properties);
      executorConfig.shutdown();

      long start = System.nanoTime();
      assertThatThrownBy(
              () -> stopped.computeHeatmap(OFFICE, Band.BAND_5_GHZ,
                  List.of(accessPoint(BASE_LAT, BASE_LNG, 0, 20, 3)), Map.of(), 0, 5.0, List.of()))
          .isInstanceOf(HeatmapComputationException.class)
          .hasMessageContaining("rejected")
          .satisfies(e -> assertThat(((HeatmapComputationException) e).isTimedOut()).isFalse());
      assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    private TestAntennaPatternProvider slowPatterns() {
      return new TestAntennaPatternProvider() {
        @Override
        public float azimuthGainDb(String model, Band band, int angleDeg, String antennaMode) {
          try {
            Thread.sleep(2);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return 0f;
        }
      };
    }

    @Test
    @DisplayName("a failing row band fails the computation")
    void failingBandFailsComputation() {
      TestAntennaPatternProvider broken =
          new TestAntennaPatternProvider() {
            @Override
            public float azimuthGainDb(String model, Band band, int angleDeg, String antennaMode) {
              throw new IllegalStateException("pattern table corrupted");
            }
          };
      SignalStrengthModel brokenModel =
          PropagationTestSupport.signalModel(broken, materials, ceilingMounts());
      HeatmapCalculator failing = new HeatmapCalculator(brokenModel, materials, pool, properties);

      assertThatThrownBy(
              () -> failing.computeHeatmap(OFFICE, Band.BAND_5_GHZ,
                  List.of(accessPoint(BASE_LAT, BASE_LNG, 0, 20, 3)), Map.of(), 0, 5.0, List.of()))
          .isInstanceOf(HeatmapComputationException.class)
          .satisfies(e -> assertThat(((HeatmapComputationException) e).isTimedOut()).isFalse());
    }
  }
}
