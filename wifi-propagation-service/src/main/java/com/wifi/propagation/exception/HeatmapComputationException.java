package com.wifi.propagation.exception;

/**
 * Exception thrown when a heatmap could not be computed, for example because the row workers did
 * not finish in time or the computation was interrupted.
 */
public class HeatmapComputationException extends RuntimeException {

    private final boolean timedOut;

    public HeatmapComputationException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public HeatmapComputationException(String message, Throwable cause) {
        super(message, cause);
        this.timedOut = false;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
