package org.skyline.routing.estimate;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.skyline.routing.core.OptimizationResponse;

import java.time.Duration;
import java.util.Objects;

/**
 * Converts a route into an approximate delivery time.
 *
 * <p>Time = {@code stops * dwell + distance / unitsPerSecond}. The defaults model a building whose
 * 200 x 300 unit floor plan takes about two minutes to cross diagonally (360.55 units in 120 s)
 * and a 90 second stop at every visited anchor.</p>
 */
@Getter
@Accessors(fluent = true)
public final class DeliveryTimeEstimator {
    public static final Duration DEFAULT_DWELL = Duration.ofSeconds(90);
    public static final double DEFAULT_UNITS_PER_SECOND = 360.55d / 120.0d;

    private final Duration dwellPerStop;
    private final double unitsPerSecond;

    public DeliveryTimeEstimator(Duration dwellPerStop, double unitsPerSecond) {
        this.dwellPerStop = Objects.requireNonNull(dwellPerStop, "dwellPerStop");
        if (dwellPerStop.isNegative()) {
            throw new IllegalArgumentException("dwellPerStop must be non-negative: " + dwellPerStop);
        }
        if (!Double.isFinite(unitsPerSecond) || unitsPerSecond <= 0.0d) {
            throw new IllegalArgumentException("unitsPerSecond must be finite and positive: " + unitsPerSecond);
        }
        this.unitsPerSecond = unitsPerSecond;
    }

    public static DeliveryTimeEstimator defaults() {
        return new DeliveryTimeEstimator(DEFAULT_DWELL, DEFAULT_UNITS_PER_SECOND);
    }

    /**
     * @param distance walked distance in graph units.
     * @param stops number of stops.
     */
    public Duration estimate(double distance, int stops) {
        if (!Double.isFinite(distance) || distance < 0.0d) {
            throw new IllegalArgumentException("distance must be finite and non-negative: " + distance);
        }
        if (stops < 0) {
            throw new IllegalArgumentException("stops must be non-negative: " + stops);
        }
        long walkNanos = Math.round(distance / unitsPerSecond * 1_000_000_000.0d);
        return dwellPerStop.multipliedBy(stops).plusNanos(walkNanos);
    }

    /**
     * Estimates an optimization result, stopping once at every anchor (start included).
     */
    public Duration estimate(OptimizationResponse response) {
        Objects.requireNonNull(response, "response");
        return estimate(response.getTotalCost(), response.getTelemetry().getAnchorCount());
    }
}
