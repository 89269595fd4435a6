package com.timeseries.dsem.util;

import com.timeseries.dsem.api.Arrow;
import com.timeseries.dsem.api.CompilationWarning;
import com.timeseries.dsem.api.Parameter;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.dsl.SpecificationCompiler.CompiledModel;
import com.timeseries.dsem.engine.PathMatrixSet;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Diagnostic utility for inspecting a compiled model.
 *
 * <p>
 * Produces plain-text tables for logs and debugging sessions. Do <b>not</b>
 * use inside an optimizer loop (allocates strings).
 */
public final class ModelExplain {
    private final CompiledModel model;

    public ModelExplain(CompiledModel model) {
        this.model = model;
    }

    /** One line per free parameter: index, name, start value and the arrows sharing it. */
    public String parameters() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-4s %-20s %12s  %s%n", "idx", "parameter", "start", "arrows"));
        for (Parameter p : model.parameters().parameters()) {
            String arrows = model.arrowsFor(p).stream()
                    .map(Arrow::toNotation)
                    .collect(Collectors.joining("; "));
            sb.append(String.format(Locale.ROOT, "%-4d %-20s %12.6g  %s%n", p.index(), p.name(), p.startValue(), arrows));
        }
        List<Arrow> fixed = model.arrows().stream().filter(Arrow::isFixed).toList();
        if (!fixed.isEmpty()) {
            sb.append("fixed:").append(System.lineSeparator());
            for (Arrow a : fixed)
                sb.append(String.format(Locale.ROOT, "     %-20s %12.6g  %s%n", a.label(), a.fixedValue(), a.toNotation()));
        }
        return sb.toString();
    }

    /** Lag-0 classification and any cyclic blocks. */
    public String structure() {
        var s = model.structure();
        if (s.isRecursive()) {
            int[] order = s.causalOrder();
            return "recursive; causal order " + s.names(order);
        }
        return "non-recursive; cyclic blocks " + s.cyclicBlockNames();
    }

    public String warnings() {
        return model.warnings().stream().map(CompilationWarning::toString)
                .collect(Collectors.joining(System.lineSeparator()));
    }

    /** Every path and covariance matrix, labelled by variable. */
    public static String matrices(PathMatrixSet set) {
        StringBuilder sb = new StringBuilder();
        for (int lag = 0; lag <= set.maxPathLag(); lag++)
            appendMatrix(sb, "A_" + lag, set.variables(), set.pathArray(lag));
        for (int lag = 0; lag <= set.maxCovarianceLag(); lag++)
            appendMatrix(sb, "S_" + lag, set.variables(), set.covarianceArray(lag));
        return sb.toString();
    }

    private static void appendMatrix(StringBuilder sb, String title, VariableSet vars, double[][] m) {
        sb.append(title).append(System.lineSeparator());
        sb.append(String.format(Locale.ROOT, "%12s", ""));
        for (int c = 0; c < vars.size(); c++)
            sb.append(String.format(Locale.ROOT, " %12s", vars.name(c)));
        sb.append(System.lineSeparator());
        for (int r = 0; r < m.length; r++) {
            sb.append(String.format(Locale.ROOT, "%12s", vars.name(r)));
            for (double x : m[r])
                sb.append(String.format(Locale.ROOT, " %12.6g", x));
            sb.append(System.lineSeparator());
        }
    }

    @Override
    public String toString() {
        return structure() + System.lineSeparator() + parameters();
    }
}
