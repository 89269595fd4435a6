package com.timeseries.dsem.error;

/**
 * A long-run effect was requested on a system whose companion transition
 * matrix has spectral radius at or above the stability bound. Recoverable:
 * callers fall back to a finite horizon.
 */
public class DivergentSeriesException extends SolverException {
    private final double spectralRadius;
    private final int maxLag;

    public DivergentSeriesException(double spectralRadius, double bound, int maxLag) {
        super(String.format(
                "Long-run effect diverges: spectral radius %.6g of the lag-%d companion matrix is not below %.6g;"
                        + " use a finite-horizon cumulative effect instead",
                spectralRadius, maxLag, bound));
        this.spectralRadius = spectralRadius;
        this.maxLag = maxLag;
    }

    public double spectralRadius() {
        return spectralRadius;
    }

    /** Highest lag of the transition family that was stacked. */
    public int maxLag() {
        return maxLag;
    }
}
