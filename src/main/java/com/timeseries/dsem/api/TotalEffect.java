package com.timeseries.dsem.api;

/**
 * Total effect of an innovation in {@code from} on {@code to}, summed over
 * every directed path.
 *
 * @param lag lag in time steps; the horizon for a cumulative effect; or
 *            {@link #LONG_RUN} for the sum over all future time
 */
public record TotalEffect(String from, String to, int lag, double value) {
    public static final int LONG_RUN = -1;

    public boolean isLongRun() {
        return lag == LONG_RUN;
    }
}
