package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.VariableSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.ejml.data.DMatrixRMaj;

/**
 * CSR-encoded graph of the lag-0 (simultaneous) arrows.
 *
 * <p>
 * The lag-0 system may be non-recursive. This class classifies it:
 * <ul>
 * <li>Kahn's algorithm yields a causal order when the graph is acyclic; then
 * {@code I - A_0} is unit lower triangular in that order and always
 * invertible.</li>
 * <li>Otherwise Tarjan's algorithm splits the graph into strongly connected
 * components. Permuted to block-triangular form,
 * {@code det(I - A_0)} is the product of the determinants of the cyclic blocks,
 * so each cyclic block is the smallest variable subset that can make the
 * system singular.</li>
 * </ul>
 *
 * Data layout follows the usual compressed sparse row scheme:
 * {@code childrenList[childrenOffset[i] .. childrenOffset[i+1])} holds the
 * indices of the responses that variable {@code i} feeds at lag 0.
 */
public final class SimultaneousStructure {
    private final VariableSet variables;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    // Causal order, or null if the lag-0 graph has a cycle.
    private final int[] causalOrder;
    private final List<int[]> cyclicBlocks;

    private SimultaneousStructure(VariableSet variables, int[] childrenOffset, int[] childrenList,
            int[] parentCount, int[] causalOrder, List<int[]> cyclicBlocks) {
        this.variables = variables;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.causalOrder = causalOrder;
        this.cyclicBlocks = cyclicBlocks;
    }

    /** Derives the structure from the non-zero pattern of a lag-0 path matrix. */
    public static SimultaneousStructure fromMatrix(VariableSet variables, DMatrixRMaj a0) {
        Builder b = builder(variables);
        for (int row = 0; row < a0.numRows; row++)
            for (int col = 0; col < a0.numCols; col++)
                if (row != col && a0.get(row, col) != 0.0)
                    b.addEdge(col, row);
        return b.build();
    }

    public int variableCount() {
        return variables.size();
    }

    public VariableSet variables() {
        return variables;
    }

    /** True when the lag-0 graph is acyclic. */
    public boolean isRecursive() {
        return causalOrder != null;
    }

    /** Variable indices in causal order, or an empty array when non-recursive. */
    public int[] causalOrder() {
        return causalOrder == null ? new int[0] : causalOrder.clone();
    }

    /** Strongly connected lag-0 blocks of two or more variables, as index arrays. */
    public List<int[]> cyclicBlocks() {
        List<int[]> copy = new ArrayList<>(cyclicBlocks.size());
        for (int[] block : cyclicBlocks)
            copy.add(block.clone());
        return copy;
    }

    /** Cyclic blocks rendered as variable names. */
    public List<List<String>> cyclicBlockNames() {
        List<List<String>> out = new ArrayList<>(cyclicBlocks.size());
        for (int[] block : cyclicBlocks)
            out.add(names(block));
        return out;
    }

    public List<String> names(int[] block) {
        List<String> names = new ArrayList<>(block.length);
        for (int v : block)
            names.add(variables.name(v));
        return names;
    }

    public int childCount(int v) {
        return childrenOffset[v + 1] - childrenOffset[v];
    }

    public int child(int v, int i) {
        return childrenList[childrenOffset[v] + i];
    }

    public int parentCount(int v) {
        return parentCount[v];
    }

    public static Builder builder(VariableSet variables) {
        return new Builder(variables);
    }

    /** Collects lag-0 edges and classifies the resulting graph. */
    public static final class Builder {
        private final VariableSet variables;
        private final List<List<Integer>> forwardEdges;

        private Builder(VariableSet variables) {
            this.variables = variables;
            this.forwardEdges = new ArrayList<>(variables.size());
            for (int i = 0; i < variables.size(); i++)
                forwardEdges.add(new ArrayList<>());
        }

        /** Adds the edge {@code from -> to}; parallel edges are collapsed. */
        public Builder addEdge(int from, int to) {
            if (from == to)
                throw new IllegalArgumentException("Self-edge not allowed at lag 0: " + variables.name(from));
            List<Integer> children = forwardEdges.get(from);
            if (!children.contains(to))
                children.add(to);
            return this;
        }

        public Builder addEdge(String from, String to) {
            return addEdge(variables.requireIndex(from), variables.requireIndex(to));
        }

        public SimultaneousStructure build() {
            int n = variables.size();

            // CSR arrays
            int[] offsets = new int[n + 1];
            for (int v = 0; v < n; v++)
                offsets[v + 1] = offsets[v] + forwardEdges.get(v).size();
            int[] flat = new int[offsets[n]];
            int[] parents = new int[n];
            for (int v = 0; v < n; v++) {
                List<Integer> children = forwardEdges.get(v);
                for (int j = 0; j < children.size(); j++) {
                    flat[offsets[v] + j] = children.get(j);
                    parents[children.get(j)]++;
                }
            }

            int[] order = kahn(n, offsets, flat, parents);
            List<int[]> blocks = order != null ? Collections.emptyList() : tarjan(n, offsets, flat);
            return new SimultaneousStructure(variables, offsets, flat, parents, order, blocks);
        }

        private static int[] kahn(int n, int[] offsets, int[] flat, int[] parents) {
            int[] inDegree = parents.clone();
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;
            while (head < tail) {
                int curr = queue[head++];
                for (int e = offsets[curr]; e < offsets[curr + 1]; e++)
                    if (--inDegree[flat[e]] == 0)
                        queue[tail++] = flat[e];
            }
            return tail == n ? queue : null;
        }

        /** Iterative Tarjan; returns components of size >= 2 with sorted members. */
        private static List<int[]> tarjan(int n, int[] offsets, int[] flat) {
            int[] index = new int[n];
            int[] low = new int[n];
            boolean[] onStack = new boolean[n];
            Arrays.fill(index, -1);
            int[] stack = new int[n];
            int sp = 0;
            int[] callStack = new int[n];
            int[] edgeCursor = new int[n];
            int counter = 0;
            List<int[]> out = new ArrayList<>();

            for (int root = 0; root < n; root++) {
                if (index[root] >= 0)
                    continue;
                int csp = 0;
                callStack[csp++] = root;
                index[root] = low[root] = counter++;
                edgeCursor[root] = offsets[root];
                stack[sp++] = root;
                onStack[root] = true;

                while (csp > 0) {
                    int v = callStack[csp - 1];
                    if (edgeCursor[v] < offsets[v + 1]) {
                        int w = flat[edgeCursor[v]++];
                        if (index[w] < 0) {
                            index[w] = low[w] = counter++;
                            edgeCursor[w] = offsets[w];
                            stack[sp++] = w;
                            onStack[w] = true;
                            callStack[csp++] = w;
                        } else if (onStack[w]) {
                            low[v] = Math.min(low[v], index[w]);
                        }
                        continue;
                    }
                    csp--;
                    if (csp > 0) {
                        int parent = callStack[csp - 1];
                        low[parent] = Math.min(low[parent], low[v]);
                    }
                    if (low[v] == index[v]) {
                        int start = sp;
                        do {
                            start--;
                            onStack[stack[start]] = false;
                        } while (stack[start] != v);
                        if (sp - start > 1) {
                            int[] block = Arrays.copyOfRange(stack, start, sp);
                            Arrays.sort(block);
                            out.add(block);
                        }
                        sp = start;
                    }
                }
            }
            out.sort((a, b) -> Integer.compare(a[0], b[0]));
            return Collections.unmodifiableList(out);
        }
    }
}
