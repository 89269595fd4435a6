package com.timeseries.dsem.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Tunable constants for compilation, assembly and effect solving.
 *
 * <p>
 * Bindable from the {@code options} object of a JSON model definition; any
 * field left out keeps its default.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SolverOptions {
    /** Lag-0 variance assigned to a variable with no explicit {@code x <-> x, 0} arrow. */
    private double varianceFloor = 1e-6;

    /** A lag-0 block with |det(I - A_block)| below this is treated as singular. */
    private double singularityTolerance = 1e-10;

    /**
     * Long-run effects require spectral radius {@code < 1 - stabilityMargin}.
     * Must exceed the rounding error of the eigen solver, which can report a
     * unit root as slightly below one.
     */
    private double stabilityMargin = 1e-9;

    private double defaultPathStart = 0.01;
    private double defaultVarianceStart = 1.0;
    private double defaultCovarianceStart = 0.0;

    /** Worker threads used by the batch evaluator. */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    public static SolverOptions defaults() {
        return new SolverOptions();
    }

    /** Start value used when an arrow of this kind names no explicit one. */
    public double defaultStart(ArrowKind kind, boolean variance) {
        if (kind == ArrowKind.PATH)
            return defaultPathStart;
        return variance ? defaultVarianceStart : defaultCovarianceStart;
    }
}
