package com.wifi.propagation.algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.wifi.propagation.algorithm.attenuation.WallSegmentIndex;
import com.wifi.propagation.algorithm.util.GeoCalculator;
import com.wifi.propagation.config.HeatmapExecutorConfig;
import com.wifi.propagation.config.PropagationProperties;
import com.wifi.propagation.exception.HeatmapComputationException;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.BoundingBox;
import com.wifi.propagation.model.BuildingFloorInfo;
import com.wifi.propagation.model.HeatmapGrid;
import com.wifi.propagation.model.PropagationAccessPoint;
import com.wifi.propagation.model.WallPolyline;
import com.wifi.propagation.provider.MaterialAttenuationProvider;

/**
 * Computes a signal strength grid over a geographic area.
 *
 * <p>The area is divided into cells of roughly {@code gridResolutionMeters}, capped at
 * {@value #MAX_GRID_DIMENSION} cells per side. Every cell holds the strongest signal of any AP at
 * the cell center.
 *
 * <p>Thread Safety: rows are split into contiguous bands computed on the heatmap executor. All
 * inputs are immutable for the duration of a computation and every band writes a disjoint slice of
 * the output array, so no locking is needed. Bands check a shared cancellation flag between rows;
 * the flag is raised when the caller gives up waiting or a band finds the deadline passed. The
 * deadline is fixed before the first band is submitted, so bands the executor runs on the calling
 * thread count against it too.
 */
@Component
public class HeatmapCalculator {

  private static final Logger logger = LoggerFactory.getLogger(HeatmapCalculator.class);

  /** Hard cap on cells per side, bounds the cost of a single request. */
  public static final int MAX_GRID_DIMENSION = 500;

  /** Value of every cell when no AP is present. */
  public static final float NO_COVERAGE_DBM = -100f;

  /**
   * Row bands per worker. More bands than workers keeps all workers busy when some rows are
   * cheaper than others (rows far from walls cross fewer segments).
   */
  private static final int BANDS_PER_WORKER = 4;

  private final SignalStrengthModel signalModel;
  private final MaterialAttenuationProvider materialProvider;
  private final Executor executor;
  private final int workers;
  private final long timeoutSeconds;

  public HeatmapCalculator(
      SignalStrengthModel signalModel,
      MaterialAttenuationProvider materialProvider,
      @Qualifier(HeatmapExecutorConfig.HEATMAP_EXECUTOR) Executor executor,
      PropagationProperties properties) {
    this.signalModel = signalModel;
    this.materialProvider = materialProvider;
    this.executor = executor;
    this.workers = Math.max(1, properties.getComputation().getWorkers());
    this.timeoutSeconds = properties.getComputation().getTimeoutSeconds();
  }

  /**
   * Computes the heatmap for one floor.
   *
   * @param bounds area to cover
   * @param band radio band
   * @param aps access points on any floor
   * @param wallsByFloor wall polylines keyed by floor, may be empty
   * @param activeFloor floor the heatmap is drawn for
   * @param gridResolutionMeters requested cell size
   * @param buildings buildings with floor materials, may be null
   * @return the grid, never null
   * @throws HeatmapComputationException if the workers do not finish in time or the executor
   *     rejects the work
   */
  public HeatmapGrid computeHeatmap(
      BoundingBox bounds,
      Band band,
      List<PropagationAccessPoint> aps,
      Map<Integer, List<WallPolyline>> wallsByFloor,
      int activeFloor,
      double gridResolutionMeters,
      List<BuildingFloorInfo> buildings) {

    GridDimensions dimensions = gridDimensions(bounds, gridResolutionMeters);
    float[] data = new float[dimensions.width() * dimensions.height()];

    PropagationContext context =
        new PropagationContext(
            band,
            materialProvider.centerFrequencyMhz(band),
            activeFloor,
            WallSegmentIndex.fromWalls(wallsByFloor),
            buildings);
    List<PreparedAccessPoint> prepared =
        signalModel.prepareAll(aps == null ? List.of() : aps, band);

    logger.debug(
        "Computing {}x{} heatmap for {} APs on floor {} ({} wall segments)",
        dimensions.width(), dimensions.height(), prepared.size(), activeFloor,
        context.segmentIndex().segmentCount());

    long deadlineNanos =
        System.nanoTime() + Math.min(TimeUnit.SECONDS.toNanos(timeoutSeconds), Long.MAX_VALUE / 2);
    GridJob job =
        new GridJob(bounds, dimensions, prepared, context, data, new AtomicBoolean(), deadlineNanos);
    runBands(job);

    return new HeatmapGrid(dimensions.width(), dimensions.height(), bounds, data);
  }

  /**
   * Grid size for an area: one cell per {@code resolution} meters, at least 1 and at most
   * {@value #MAX_GRID_DIMENSION} per side.
   */
  public static GridDimensions gridDimensions(BoundingBox bounds, double gridResolutionMeters) {
    double widthMeters =
        GeoCalculator.haversineDistanceMeters(
            bounds.swLat(), bounds.swLng(), bounds.swLat(), bounds.neLng());
    double heightMeters =
        GeoCalculator.haversineDistanceMeters(
            bounds.swLat(), bounds.swLng(), bounds.neLat(), bounds.swLng());

    int width = clampDimension(widthMeters / gridResolutionMeters);
    int height = clampDimension(heightMeters / gridResolutionMeters);
    return new GridDimensions(width, height);
  }

  private static int clampDimension(double cells) {
    // (int) NaN is 0 and (int) +Inf is Integer.MAX_VALUE, both end up inside [1, MAX]
    return Math.min(MAX_GRID_DIMENSION, Math.max(1, (int) cells));
  }

  private void runBands(GridJob job) {
    int height = job.dimensions().height();
    int bandCount = Math.min(height, workers * BANDS_PER_WORKER);
    int rowsPerBand = (height + bandCount - 1) / bandCount;

    List<CompletableFuture<Void>> futures = new ArrayList<>();
    try {
      for (int startRow = 0; startRow < height && !job.cancelled().get(); startRow += rowsPerBand) {
        int endRow = Math.min(height, startRow + rowsPerBand);
        futures.add(CompletableFuture.runAsync(new RowBand(job, startRow, endRow), executor));
      }
    } catch (RejectedExecutionException e) {
      cancel(futures, job.cancelled());
      logger.warn("Heatmap executor rejected a row band: {}", e.getMessage());
      throw new HeatmapComputationException("Heatmap executor rejected the computation", e);
    }

    awaitBands(futures, job);
  }

  private void awaitBands(List<CompletableFuture<Void>> futures, GridJob job) {
    AtomicBoolean cancelled = job.cancelled();
    CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    try {
      long remainingNanos = job.deadlineNanos() - System.nanoTime();
      if (!all.isDone() && remainingNanos <= 0) {
        throw new TimeoutException();
      }
      all.get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
      if (cancelled.get()) {
        // a band stopped at the deadline, its rows are incomplete
        throw new TimeoutException();
      }
    } catch (TimeoutException e) {
      cancel(futures, cancelled);
      logger.warn("Heatmap computation timed out after {} seconds", timeoutSeconds);
      throw new HeatmapComputationException(
          "Heatmap computation timed out after " + timeoutSeconds + " seconds", true);
    } catch (InterruptedException e) {
      cancel(futures, cancelled);
      Thread.currentThread().interrupt();
      throw new HeatmapComputationException("Heatmap computation was interrupted", false);
    } catch (ExecutionException e) {
      cancel(futures, cancelled);
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.error("Heatmap row band failed: {}", cause.getMessage(), cause);
      throw new HeatmapComputationException("Heatmap computation failed", cause);
    }
  }

  private static void cancel(List<CompletableFuture<Void>> futures, AtomicBoolean cancelled) {
    cancelled.set(true);
    futures.forEach(future -> future.cancel(true));
  }

  /** Cells per side of a heatmap. */
  public record GridDimensions(int width, int height) {}

  /** Everything the row bands of one heatmap share. */
  private record GridJob(
      BoundingBox bounds,
      GridDimensions dimensions,
      List<PreparedAccessPoint> aps,
      PropagationContext context,
      float[] data,
      AtomicBoolean cancelled,
      long deadlineNanos) {}

  /** Computes rows {@code [startRow, endRow)} into the shared output array. */
  private final class RowBand implements Runnable {

    private final GridJob job;
    private final int startRow;
    private final int endRow;

    private RowBand(GridJob job, int startRow, int endRow) {
      this.job = job;
      this.startRow = startRow;
      this.endRow = endRow;
    }

    @Override
    public void run() {
      BoundingBox bounds = job.bounds();
      int width = job.dimensions().width();
      double latStep = (bounds.neLat() - bounds.swLat()) / job.dimensions().height();
      double lngStep = (bounds.neLng() - bounds.swLng()) / width;
      float[] data = job.data();

      for (int y = startRow; y < endRow; y++) {
        if (job.cancelled().get()) {
          return;
        }
        if (System.nanoTime() - job.deadlineNanos() > 0) {
          job.cancelled().set(true);
          return;
        }
        double pointLat = bounds.swLat() + (y + 0.5) * latStep;
        for (int x = 0; x < width; x++) {
          double pointLng = bounds.swLng() + (x + 0.5) * lngStep;
          data[y * width + x] = strongestSignal(pointLat, pointLng);
        }
      }
    }

    private float strongestSignal(double pointLat, double pointLng) {
      List<PreparedAccessPoint> aps = job.aps();
      if (aps.isEmpty()) {
        return NO_COVERAGE_DBM;
      }
      float best = -Float.MAX_VALUE;
      for (PreparedAccessPoint ap : aps) {
        float signal = signalModel.signalDbm(ap, pointLat, pointLng, job.context());
        if (signal > best) {
          best = signal;
        }
      }
      return best;
    }
  }
}
