package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.api.TotalEffect;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.error.DivergentSeriesException;
import com.timeseries.dsem.error.NonIdentifiableStructureException;

import java.util.ArrayList;
import java.util.List;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import lombok.extern.log4j.Log4j2;

/**
 * Derives total effects from one {@link PathMatrixSet}.
 *
 * <h2>Model</h2>
 * <p>
 * {@code y_t = A_0 y_t + A_1 y_{t-1} + ... + A_p y_{t-p} + e_t}. With
 * {@code B = (I - A_0)^-1} and {@code Phi_k = B A_k}, the response of
 * {@code y_d} to an innovation {@code e_0} is
 *
 * <pre>
 * Psi_0 = B
 * Psi_d = sum_{k=1..min(d,p)} Phi_k Psi_{d-k}
 * </pre>
 *
 * which equals the leading block of {@code F^d} times {@code B} for the
 * {@link CompanionMatrix} {@code F}. The total effect of {@code x} at lag
 * {@code d} on {@code y} is {@code Psi_d[y, x]}.
 *
 * <h2>Failure modes</h2>
 * <ul>
 * <li>Construction fails with {@link NonIdentifiableStructureException} when a
 * cyclic lag-0 block has unit feedback gain.</li>
 * <li>{@link #longRunEffects()} fails with {@link DivergentSeriesException}
 * unless the companion spectral radius is below
 * {@code 1 - stabilityMargin}; {@link #cumulativeEffects(int)} is the
 * finite-horizon fallback.</li>
 * </ul>
 *
 * Instances are immutable after construction.
 */
@Log4j2
public final class EffectSolver {
    private final VariableSet variables;
    private final SolverOptions options;
    private final int v;
    private final DMatrixRMaj reduced;
    private final DMatrixRMaj[] transitions;
    private final CompanionMatrix companion;

    public EffectSolver(PathMatrixSet matrices, SolverOptions options) {
        this.variables = matrices.variables();
        this.options = options;
        this.v = variables.size();
        this.reduced = invertSimultaneous(matrices.pathRef(0));

        int p = matrices.maxPathLag();
        this.transitions = new DMatrixRMaj[p];
        for (int k = 1; k <= p; k++) {
            DMatrixRMaj phi = new DMatrixRMaj(v, v);
            CommonOps_DDRM.mult(reduced, matrices.pathRef(k), phi);
            transitions[k - 1] = phi;
        }
        this.companion = p > 0 ? new CompanionMatrix(transitions) : null;
    }

    public EffectSolver(PathMatrixSet matrices) {
        this(matrices, SolverOptions.defaults());
    }

    private DMatrixRMaj invertSimultaneous(DMatrixRMaj a0) {
        DMatrixRMaj iMinusA = CommonOps_DDRM.identity(v);
        CommonOps_DDRM.subtractEquals(iMinusA, a0);

        SimultaneousStructure structure = SimultaneousStructure.fromMatrix(variables, a0);
        if (structure.isRecursive())
            return substituteInCausalOrder(a0, structure);

        List<List<String>> singular = new ArrayList<>();
        for (int[] block : structure.cyclicBlocks()) {
            DMatrixRMaj sub = new DMatrixRMaj(block.length, block.length);
            for (int r = 0; r < block.length; r++)
                for (int c = 0; c < block.length; c++)
                    sub.set(r, c, iMinusA.get(block[r], block[c]));
            double det = CommonOps_DDRM.det(sub);
            log.debug("Lag-0 block {} has det(I - A) = {}", structure.names(block), det);
            if (Math.abs(det) < options.getSingularityTolerance())
                singular.add(structure.names(block));
        }
        if (!singular.isEmpty())
            throw new NonIdentifiableStructureException(singular);

        DMatrixRMaj inv = new DMatrixRMaj(v, v);
        if (!CommonOps_DDRM.invert(iMinusA, inv))
            throw new NonIdentifiableStructureException(structure.cyclicBlockNames());
        return inv;
    }

    /**
     * {@code B = I + A_0 B}, solved row by row with parents before children.
     * Exact for a single arrow, where LU would round.
     */
    private DMatrixRMaj substituteInCausalOrder(DMatrixRMaj a0, SimultaneousStructure structure) {
        DMatrixRMaj b = new DMatrixRMaj(v, v);
        for (int i : structure.causalOrder()) {
            b.set(i, i, 1.0);
            for (int j = 0; j < v; j++) {
                double coef = a0.get(i, j);
                if (j == i || coef == 0.0)
                    continue;
                for (int c = 0; c < v; c++)
                    b.add(i, c, coef * b.get(j, c));
            }
        }
        return b;
    }

    public VariableSet variables() {
        return variables;
    }

    /** Highest lag of the transition family; 0 for a purely simultaneous model. */
    public int maxLag() {
        return transitions.length;
    }

    /** A copy of {@code (I - A_0)^-1}. */
    public DMatrixRMaj reducedForm() {
        return reduced.copy();
    }

    /** A copy of {@code Phi_k = (I - A_0)^-1 A_k}, zero beyond {@link #maxLag()}. */
    public DMatrixRMaj transition(int k) {
        if (k < 1)
            throw new IllegalArgumentException("Transition lag must be >= 1: " + k);
        return k <= transitions.length ? transitions[k - 1].copy() : new DMatrixRMaj(v, v);
    }

    /** {@code Psi_lag}, computed from one companion power. */
    public DMatrixRMaj impulseResponse(int lag) {
        requireHorizon(lag);
        if (lag == 0)
            return reduced.copy();
        DMatrixRMaj out = new DMatrixRMaj(v, v);
        if (companion == null)
            return out;
        CommonOps_DDRM.mult(companion.leadingBlockOfPower(lag), reduced, out);
        return out;
    }

    /** {@code Psi_0 .. Psi_horizon}, by stepping the stacked state. */
    public DMatrixRMaj[] impulseResponses(int horizon) {
        requireHorizon(horizon);
        DMatrixRMaj[] out = new DMatrixRMaj[horizon + 1];
        out[0] = reduced.copy();
        if (companion == null) {
            for (int d = 1; d <= horizon; d++)
                out[d] = new DMatrixRMaj(v, v);
            return out;
        }
        DMatrixRMaj state = new DMatrixRMaj(companion.dimension(), v);
        CommonOps_DDRM.insert(reduced, state, 0, 0);
        for (int d = 1; d <= horizon; d++) {
            state = companion.step(state);
            out[d] = CommonOps_DDRM.extract(state, 0, v, 0, v);
        }
        return out;
    }

    /** Total effect of an innovation in {@code from} on {@code to}, {@code lag} steps later. */
    public double totalEffect(String from, String to, int lag) {
        int f = variables.requireIndex(from);
        int t = variables.requireIndex(to);
        return impulseResponse(lag).get(t, f);
    }

    /** Every pairwise total effect for lags {@code 0..horizon}. */
    public EffectTable totalEffects(int horizon) {
        DMatrixRMaj[] psi = impulseResponses(horizon);
        EffectTable.Builder b = EffectTable.builder(variables);
        for (int d = 0; d <= horizon; d++)
            b.addMatrix(d, psi[d]);
        return b.build();
    }

    /**
     * Sum of total effects over lags {@code 0..horizon}. Rows carry
     * {@code lag == horizon}. Always finite; use it when
     * {@link #longRunEffects()} diverges.
     */
    public EffectTable cumulativeEffects(int horizon) {
        DMatrixRMaj[] psi = impulseResponses(horizon);
        DMatrixRMaj sum = new DMatrixRMaj(v, v);
        for (DMatrixRMaj m : psi)
            CommonOps_DDRM.addEquals(sum, m);
        return EffectTable.builder(variables).addMatrix(horizon, sum).build();
    }

    /** Spectral radius of the companion matrix; 0 when there are no lagged arrows. */
    public double spectralRadius() {
        return companion == null ? 0.0 : companion.spectralRadius();
    }

    public boolean isStable() {
        return spectralRadius() < stabilityBound();
    }

    /**
     * Sum of total effects over all future time, {@code [(I - F)^-1]_11 B}. Rows
     * carry {@link TotalEffect#LONG_RUN}.
     *
     * @throws DivergentSeriesException if the system is not stable
     */
    public EffectTable longRunEffects() {
        DMatrixRMaj sum;
        if (companion == null) {
            sum = reduced.copy();
        } else {
            double radius = companion.spectralRadius();
            double bound = stabilityBound();
            if (!(radius < bound))
                throw new DivergentSeriesException(radius, bound, companion.order());
            log.debug("Companion spectral radius {} below {}; summing geometric series", radius, bound);
            sum = new DMatrixRMaj(v, v);
            CommonOps_DDRM.mult(companion.geometricSeriesLeadingBlock(), reduced, sum);
        }
        return EffectTable.builder(variables).addMatrix(TotalEffect.LONG_RUN, sum).build();
    }

    public double longRunEffect(String from, String to) {
        return longRunEffects().value(from, to, TotalEffect.LONG_RUN);
    }

    private double stabilityBound() {
        return 1.0 - options.getStabilityMargin();
    }

    private static void requireHorizon(int horizon) {
        if (horizon < 0)
            throw new IllegalArgumentException("Lag horizon must be non-negative: " + horizon);
    }
}
