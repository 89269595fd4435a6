package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.VariableSet;

import org.ejml.data.DMatrixRMaj;

/**
 * Per-lag path and covariance matrices for one parameter vector.
 *
 * <p>
 * {@code path(lag).get(i, j)} is the coefficient of variable {@code j} at
 * that lag in the structural equation for variable {@code i}. Covariance
 * matrices are symmetric. A lag beyond the highest specified one reads as
 * the zero matrix.
 *
 * <p>
 * Instances are created fresh by {@link PathMatrixAssembler#assemble(double[])}
 * and never mutated afterwards; accessors hand out copies.
 */
public final class PathMatrixSet {
    private final VariableSet variables;
    private final DMatrixRMaj[] paths;
    private final DMatrixRMaj[] covariances;

    PathMatrixSet(VariableSet variables, DMatrixRMaj[] paths, DMatrixRMaj[] covariances) {
        this.variables = variables;
        this.paths = paths;
        this.covariances = covariances;
    }

    public VariableSet variables() {
        return variables;
    }

    /** Highest lag with a path matrix; 0 when the model has no lagged arrows. */
    public int maxPathLag() {
        return paths.length - 1;
    }

    public int maxCovarianceLag() {
        return covariances.length - 1;
    }

    /** A copy of {@code A_lag}. */
    public DMatrixRMaj path(int lag) {
        return copyAt(paths, lag);
    }

    /** A copy of the covariance matrix at {@code lag}. */
    public DMatrixRMaj covariance(int lag) {
        return copyAt(covariances, lag);
    }

    public double path(int lag, String to, String from) {
        return valueAt(paths, lag, variables.requireIndex(to), variables.requireIndex(from));
    }

    public double covariance(int lag, String a, String b) {
        return valueAt(covariances, lag, variables.requireIndex(a), variables.requireIndex(b));
    }

    /** Row-major {@code double[][]} view of {@code A_lag}, freshly allocated. */
    public double[][] pathArray(int lag) {
        return toArray(copyAt(paths, lag));
    }

    public double[][] covarianceArray(int lag) {
        return toArray(copyAt(covariances, lag));
    }

    // Internal, uncopied access for the solver.
    DMatrixRMaj pathRef(int lag) {
        return paths[lag];
    }

    private DMatrixRMaj copyAt(DMatrixRMaj[] family, int lag) {
        if (lag < 0)
            throw new IllegalArgumentException("Negative lag: " + lag);
        int v = variables.size();
        return lag < family.length ? family[lag].copy() : new DMatrixRMaj(v, v);
    }

    private static double valueAt(DMatrixRMaj[] family, int lag, int row, int col) {
        if (lag < 0)
            throw new IllegalArgumentException("Negative lag: " + lag);
        return lag < family.length ? family[lag].get(row, col) : 0.0;
    }

    private static double[][] toArray(DMatrixRMaj m) {
        double[][] out = new double[m.numRows][m.numCols];
        for (int r = 0; r < m.numRows; r++)
            for (int c = 0; c < m.numCols; c++)
                out[r][c] = m.get(r, c);
        return out;
    }
}
