package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.Arrow;
import com.timeseries.dsem.api.ArrowKind;
import com.timeseries.dsem.api.ParameterTable;
import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.api.VariableSet;

import java.util.List;

import org.ejml.data.DMatrixRMaj;

/**
 * Scatters a parameter vector into a fresh {@link PathMatrixSet}.
 *
 * <p>
 * The arrow list is flattened once at construction into parallel primitive
 * arrays, so {@link #assemble(double[])} is a tight loop with no lookups. The
 * assembler holds no mutable state and may be shared across threads.
 *
 * <p>
 * Lag-0 variances that no arrow specifies are set to
 * {@link SolverOptions#getVarianceFloor()}. Any explicit {@code x <-> x, 0}
 * arrow, fixed or free, replaces the floor.
 */
public final class PathMatrixAssembler {
    private final VariableSet variables;
    private final ParameterTable parameters;
    private final double varianceFloor;

    // Flattened arrow data (structure-of-arrays).
    private final boolean[] covariance;
    private final int[] rows;
    private final int[] cols;
    private final int[] lags;
    private final int[] parameterIndex;
    private final double[] fixedValue;

    private final int maxPathLag;
    private final int maxCovarianceLag;
    // Lag-0 diagonal cells that fall back to the variance floor.
    private final int[] flooredVariances;

    public PathMatrixAssembler(VariableSet variables, List<Arrow> arrows, ParameterTable parameters,
            SolverOptions options) {
        this.variables = variables;
        this.parameters = parameters;
        this.varianceFloor = options.getVarianceFloor();

        int n = arrows.size();
        covariance = new boolean[n];
        rows = new int[n];
        cols = new int[n];
        lags = new int[n];
        parameterIndex = new int[n];
        fixedValue = new double[n];

        int pathLag = 0, covLag = 0;
        boolean[] explicitVariance = new boolean[variables.size()];
        for (int i = 0; i < n; i++) {
            Arrow a = arrows.get(i);
            covariance[i] = a.kind() == ArrowKind.COVARIANCE;
            rows[i] = a.toIndex();
            cols[i] = a.fromIndex();
            lags[i] = a.lag();
            parameterIndex[i] = a.parameterIndex();
            fixedValue[i] = a.fixedValue();
            if (a.parameterIndex() >= parameters.size())
                throw new IllegalArgumentException("Arrow references parameter " + a.parameterIndex()
                        + " outside table of size " + parameters.size() + ": " + a.toNotation());
            if (covariance[i]) {
                covLag = Math.max(covLag, a.lag());
                if (a.lag() == 0 && a.fromIndex() == a.toIndex())
                    explicitVariance[a.fromIndex()] = true;
            } else {
                pathLag = Math.max(pathLag, a.lag());
            }
        }
        this.maxPathLag = pathLag;
        this.maxCovarianceLag = covLag;

        int floored = 0;
        for (boolean e : explicitVariance)
            if (!e)
                floored++;
        this.flooredVariances = new int[floored];
        for (int v = 0, k = 0; v < explicitVariance.length; v++)
            if (!explicitVariance[v])
                flooredVariances[k++] = v;
    }

    /**
     * Builds the matrices for one parameter vector.
     *
     * @param theta free parameter values, one per {@link ParameterTable} entry
     * @throws IllegalArgumentException if {@code theta} has the wrong length or a
     *                                  non-finite entry
     */
    public PathMatrixSet assemble(double[] theta) {
        parameters.requireLength(theta);
        for (int p = 0; p < theta.length; p++)
            if (!Double.isFinite(theta[p]))
                throw new IllegalArgumentException("Parameter '" + parameters.parameter(p).name()
                        + "' is not finite: " + theta[p]);

        int v = variables.size();
        DMatrixRMaj[] paths = new DMatrixRMaj[maxPathLag + 1];
        for (int k = 0; k < paths.length; k++)
            paths[k] = new DMatrixRMaj(v, v);
        DMatrixRMaj[] covs = new DMatrixRMaj[maxCovarianceLag + 1];
        for (int k = 0; k < covs.length; k++)
            covs[k] = new DMatrixRMaj(v, v);

        for (int i = 0; i < rows.length; i++) {
            double value = parameterIndex[i] < 0 ? fixedValue[i] : theta[parameterIndex[i]];
            int r = rows[i], c = cols[i];
            if (covariance[i]) {
                DMatrixRMaj m = covs[lags[i]];
                m.add(r, c, value);
                if (r != c)
                    m.add(c, r, value);
            } else {
                paths[lags[i]].add(r, c, value);
            }
        }

        for (int d : flooredVariances)
            covs[0].set(d, d, varianceFloor);

        return new PathMatrixSet(variables, paths, covs);
    }

    /** Assembles at the table's start values. */
    public PathMatrixSet assembleAtStart() {
        return assemble(parameters.startValues());
    }

    public int maxPathLag() {
        return maxPathLag;
    }

    public VariableSet variables() {
        return variables;
    }
}
