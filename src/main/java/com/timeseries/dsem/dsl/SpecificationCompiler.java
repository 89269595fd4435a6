package com.timeseries.dsem.dsl;

import com.timeseries.dsem.api.Arrow;
import com.timeseries.dsem.api.ArrowKind;
import com.timeseries.dsem.api.CompilationWarning;
import com.timeseries.dsem.api.Parameter;
import com.timeseries.dsem.api.ParameterTable;
import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.engine.SimultaneousStructure;
import com.timeseries.dsem.error.GrammarException;
import com.timeseries.dsem.error.UnknownVariableException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles model text into a {@link CompiledModel}.
 *
 * <p>
 * Two passes over the arrow records:
 * <ol>
 * <li>Build the symbol table: every non-numeric, non-{@code NA} parameter token
 * gets an index in order of first appearance. The start value is the first
 * explicit one given for that name; a later, different explicit start value is
 * ignored and reported as a {@link CompilationWarning}.</li>
 * <li>Resolve every arrow against the table into an {@link Arrow} carrying the
 * parameter index (or its fixed value).</li>
 * </ol>
 * Compilation is deterministic: the same text and variables always give the
 * same arrows and parameter order.
 */
public final class SpecificationCompiler {
    private static final Logger log = LogManager.getLogger(SpecificationCompiler.class);

    private final VariableSet variables;
    private final SolverOptions options;
    private final ArrowNotationParser parser;
    private final EquationNormalizer normalizer = new EquationNormalizer();

    public SpecificationCompiler(VariableSet variables, SolverOptions options) {
        this.variables = variables;
        this.options = options;
        this.parser = new ArrowNotationParser(variables);
    }

    public SpecificationCompiler(VariableSet variables) {
        this(variables, SolverOptions.defaults());
    }

    /** Compiles arrow notation. */
    public CompiledModel compileArrows(String text) {
        return compileArrows(text, List.of());
    }

    public CompiledModel compileArrows(String text, List<String> covarianceGroups) {
        return compile(parser.parse(text), covarianceGroups);
    }

    /** Compiles equation notation. */
    public CompiledModel compileEquations(String text) {
        return compileEquations(text, List.of());
    }

    public CompiledModel compileEquations(String text, List<String> covarianceGroups) {
        List<ArrowRecord> records = normalizer.normalize(text);
        for (ArrowRecord r : records)
            parser.validate(r);
        return compile(records, covarianceGroups);
    }

    /**
     * Compiles already validated records, then adds variances and covariances for
     * each covariance group.
     *
     * @param covarianceGroups comma-separated variable lists, e.g. {@code "x, y, z"}
     */
    public CompiledModel compile(List<ArrowRecord> records, List<String> covarianceGroups) {
        List<CompilationWarning> warnings = new ArrayList<>();
        List<ArrowRecord> all = new ArrayList<>(records);
        all.addAll(expandCovarianceGroups(records, covarianceGroups));

        // Pass 1: symbol table
        Map<String, Declaration> declarations = new LinkedHashMap<>();
        Map<EdgeKey, ArrowRecord> seenEdges = new HashMap<>();
        for (ArrowRecord r : all) {
            ArrowRecord previous = seenEdges.putIfAbsent(EdgeKey.of(r), r);
            if (previous != null)
                warn(warnings, r, "Arrow repeats line " + previous.lineNumber() + "; coefficients will be summed");

            String token = r.parameter();
            if (Tokens.isNumber(token)) {
                if (r.startValue() != null)
                    warn(warnings, r, "Start value ignored for arrow fixed at " + token);
                continue;
            }
            if (token.equals(Tokens.FIXED_AT_START)) {
                if (r.startValue() == null)
                    throw new GrammarException("Parameter NA fixes the arrow at its start value, but none is given",
                            r.lineNumber(), r.line(), token);
                continue;
            }

            Declaration d = declarations.get(token);
            if (d == null) {
                declarations.put(token, new Declaration(token, r));
            } else {
                if (d.kind != r.kind())
                    warn(warnings, r, "Parameter '" + token + "' is shared by path and covariance arrows");
                if (r.startValue() != null) {
                    if (d.explicitStart == null) {
                        d.explicitStart = r.startValue();
                        d.startLine = r.lineNumber();
                    } else if (Double.compare(d.explicitStart, r.startValue()) != 0) {
                        warn(warnings, r, "Parameter '" + token + "' already has start value " + d.explicitStart
                                + " from line " + d.startLine + "; ignoring " + r.startValue());
                    }
                }
            }
        }

        ParameterTable.Builder tb = ParameterTable.builder();
        for (Declaration d : declarations.values()) {
            double start = d.explicitStart != null ? d.explicitStart
                    : options.defaultStart(d.kind, d.variance);
            tb.declare(d.name, d.kind, start, d.lineNumber);
        }
        ParameterTable table = tb.build();

        // Pass 2: resolve arrows
        List<Arrow> arrows = new ArrayList<>(all.size());
        SimultaneousStructure.Builder lag0 = SimultaneousStructure.builder(variables);
        int maxLag = 0;
        for (ArrowRecord r : all) {
            int from = variables.indexOf(r.from());
            int to = variables.indexOf(r.to());
            String token = r.parameter();
            int pIdx = -1;
            double fixed = Double.NaN;
            if (Tokens.isNumber(token))
                fixed = Double.parseDouble(token);
            else if (token.equals(Tokens.FIXED_AT_START))
                fixed = r.startValue();
            else
                pIdx = table.indexOf(token);
            arrows.add(new Arrow(r.kind(), r.from(), r.to(), from, to, r.lag(), token, pIdx, fixed, r.lineNumber()));
            if (r.kind() == ArrowKind.PATH) {
                maxLag = Math.max(maxLag, r.lag());
                if (r.lag() == 0)
                    lag0.addEdge(from, to);
            }
        }
        SimultaneousStructure structure = lag0.build();

        log.debug("Compiled {} arrows over {} variables into {} free parameters (max lag {})",
                arrows.size(), variables.size(), table.size(), maxLag);
        if (!structure.isRecursive())
            log.debug("Lag-0 structure is non-recursive; cyclic blocks {}", structure.cyclicBlockNames());

        return new CompiledModel(variables, Collections.unmodifiableList(arrows), table, structure,
                Collections.unmodifiableList(warnings), maxLag);
    }

    private List<ArrowRecord> expandCovarianceGroups(List<ArrowRecord> explicit, List<String> groups) {
        if (groups == null || groups.isEmpty())
            return List.of();
        Set<PairKey> covered = new HashSet<>();
        for (ArrowRecord r : explicit)
            if (r.kind() == ArrowKind.COVARIANCE && r.lag() == 0)
                covered.add(PairKey.of(r.from(), r.to()));

        List<ArrowRecord> out = new ArrayList<>();
        for (String group : groups) {
            List<String> members = new ArrayList<>();
            for (String raw : group.split(",")) {
                String name = raw.strip();
                if (name.isEmpty())
                    continue;
                if (!variables.contains(name))
                    throw new UnknownVariableException(name, 0, group);
                if (!members.contains(name))
                    members.add(name);
            }
            for (int i = 0; i < members.size(); i++) {
                for (int j = i; j < members.size(); j++) {
                    String a = members.get(i), b = members.get(j);
                    if (!covered.add(PairKey.of(a, b)))
                        continue;
                    String name = i == j ? "V[" + a + "]" : "C[" + a + "," + b + "]";
                    out.add(new ArrowRecord(ArrowKind.COVARIANCE, a, b, 0, name, null, 0, group));
                }
            }
        }
        return out;
    }

    private static void warn(List<CompilationWarning> warnings, ArrowRecord r, String message) {
        CompilationWarning w = new CompilationWarning(r.lineNumber(), r.line(), message);
        log.warn("Specification warning at {}", w);
        warnings.add(w);
    }

    public VariableSet variables() {
        return variables;
    }

    public SolverOptions options() {
        return options;
    }

    private static final class Declaration {
        final String name;
        final ArrowKind kind;
        final boolean variance;
        final int lineNumber;
        Double explicitStart;
        int startLine;

        Declaration(String name, ArrowRecord first) {
            this.name = name;
            this.kind = first.kind();
            this.variance = first.kind() == ArrowKind.COVARIANCE && first.from().equals(first.to());
            this.lineNumber = first.lineNumber();
            this.explicitStart = first.startValue();
            this.startLine = first.lineNumber();
        }
    }

    private record EdgeKey(ArrowKind kind, String a, String b, int lag) {
        static EdgeKey of(ArrowRecord r) {
            if (r.kind() == ArrowKind.COVARIANCE && r.from().compareTo(r.to()) > 0)
                return new EdgeKey(r.kind(), r.to(), r.from(), r.lag());
            return new EdgeKey(r.kind(), r.from(), r.to(), r.lag());
        }
    }

    private record PairKey(String a, String b) {
        static PairKey of(String x, String y) {
            return x.compareTo(y) <= 0 ? new PairKey(x, y) : new PairKey(y, x);
        }
    }

    /**
     * The result of compilation: immutable, shareable across threads.
     *
     * @param structure classification of the lag-0 path graph
     * @param warnings  conditions resolved deterministically but worth surfacing;
     *                  empty on a clean compile
     * @param maxLag    highest path lag
     */
    public record CompiledModel(
            VariableSet variables, List<Arrow> arrows, ParameterTable parameters,
            SimultaneousStructure structure, List<CompilationWarning> warnings, int maxLag) {

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }

        /** Arrows that reference the named parameter. */
        public List<Arrow> arrowsFor(String parameter) {
            return arrows.stream().filter(a -> parameter.equals(a.label()) && !a.isFixed()).toList();
        }

        public List<Arrow> arrowsFor(Parameter parameter) {
            return arrowsFor(parameter.name());
        }
    }
}
