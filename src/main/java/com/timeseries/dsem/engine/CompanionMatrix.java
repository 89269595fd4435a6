package com.timeseries.dsem.engine;

import com.timeseries.dsem.error.DivergentSeriesException;
import com.timeseries.dsem.error.SolverException;

import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * Stacked one-step transition of a multi-lag system.
 *
 * <p>
 * For a transition family {@code Phi_1 .. Phi_p} over {@code V} variables:
 *
 * <pre>
 *     | Phi_1 Phi_2 ... Phi_p |
 * F = |   I     0   ...   0   |
 *     |   0     I   ...   0   |
 *     |   0     0   ... I 0   |
 * </pre>
 *
 * The top-left {@code V x V} block of {@code F^d} sums the products of
 * {@code Phi_k} over every ordered decomposition of {@code d} into available
 * lags, which is the lag-{@code d} path sum without enumerating paths.
 */
public final class CompanionMatrix {
    private final int variables;
    private final int order;
    private final DMatrixRMaj f;

    /**
     * @param transitions {@code transitions[k-1]} is {@code Phi_k}; all {@code V x V}
     */
    public CompanionMatrix(DMatrixRMaj[] transitions) {
        if (transitions.length == 0)
            throw new IllegalArgumentException("Companion matrix needs at least one lag");
        this.variables = transitions[0].numRows;
        this.order = transitions.length;
        int n = variables * order;
        this.f = new DMatrixRMaj(n, n);
        for (int k = 0; k < order; k++)
            CommonOps_DDRM.insert(transitions[k], f, 0, k * variables);
        for (int k = 1; k < order; k++)
            for (int i = 0; i < variables; i++)
                f.set(k * variables + i, (k - 1) * variables + i, 1.0);
    }

    public int variableCount() {
        return variables;
    }

    /** Number of stacked lags {@code p}. */
    public int order() {
        return order;
    }

    public int dimension() {
        return f.numRows;
    }

    /** A copy of {@code F}. */
    public DMatrixRMaj matrix() {
        return f.copy();
    }

    /** {@code F^d} by repeated squaring. */
    public DMatrixRMaj power(int d) {
        if (d < 0)
            throw new IllegalArgumentException("Negative power: " + d);
        int n = f.numRows;
        DMatrixRMaj result = CommonOps_DDRM.identity(n);
        DMatrixRMaj base = f.copy();
        DMatrixRMaj tmp = new DMatrixRMaj(n, n);
        while (d > 0) {
            if ((d & 1) != 0) {
                CommonOps_DDRM.mult(result, base, tmp);
                result.setTo(tmp);
            }
            d >>= 1;
            if (d > 0) {
                CommonOps_DDRM.mult(base, base, tmp);
                base.setTo(tmp);
            }
        }
        return result;
    }

    /** Top-left {@code V x V} block of {@code F^d}. */
    public DMatrixRMaj leadingBlockOfPower(int d) {
        return CommonOps_DDRM.extract(power(d), 0, variables, 0, variables);
    }

    /** Advances a stacked state ({@code Vp x m}) one step: returns {@code F * state}. */
    public DMatrixRMaj step(DMatrixRMaj state) {
        DMatrixRMaj out = new DMatrixRMaj(f.numRows, state.numCols);
        CommonOps_DDRM.mult(f, state, out);
        return out;
    }

    /** Largest eigenvalue modulus of {@code F}. */
    public double spectralRadius() {
        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(f.numRows, false);
        if (!eig.decompose(f.copy()))
            throw new SolverException("Eigen decomposition of the " + f.numRows + "x" + f.numCols
                    + " companion matrix did not converge");
        double radius = 0.0;
        for (int i = 0; i < eig.getNumberOfEigenvalues(); i++) {
            Complex_F64 lambda = eig.getEigenvalue(i);
            radius = Math.max(radius, lambda.getMagnitude());
        }
        return radius;
    }

    /**
     * Top-left {@code V x V} block of {@code (I - F)^-1}, the sum of that block of
     * {@code F^d} over all {@code d >= 0}. Only meaningful when the spectral
     * radius is below one; the caller checks.
     *
     * @throws DivergentSeriesException if {@code I - F} is numerically singular
     */
    public DMatrixRMaj geometricSeriesLeadingBlock() {
        int n = f.numRows;
        DMatrixRMaj iMinusF = CommonOps_DDRM.identity(n);
        CommonOps_DDRM.subtractEquals(iMinusF, f);
        DMatrixRMaj rhs = new DMatrixRMaj(n, variables);
        for (int i = 0; i < variables; i++)
            rhs.set(i, i, 1.0);
        DMatrixRMaj x = new DMatrixRMaj(n, variables);
        if (!CommonOps_DDRM.solve(iMinusF, rhs, x) || MatrixFeatures_DDRM.hasUncountable(x))
            throw new DivergentSeriesException(spectralRadius(), 1.0, order);
        return CommonOps_DDRM.extract(x, 0, variables, 0, variables);
    }
}
