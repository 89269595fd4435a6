package com.timeseries.dsem.error;

import java.util.List;

/**
 * {@code I - A_0} is singular: some simultaneous block has a total feedback
 * gain of exactly one.
 *
 * <p>
 * {@link #implicatedBlocks()} lists the strongly connected lag-0 blocks whose
 * own {@code I - A_block} is singular. Each block is the smallest cyclic
 * subset that explains the failure.
 */
public class NonIdentifiableStructureException extends SolverException {
    private final List<List<String>> implicatedBlocks;

    public NonIdentifiableStructureException(List<List<String>> implicatedBlocks) {
        super("Simultaneous structure is not identifiable: I - A_0 is singular for variables "
                + implicatedBlocks);
        this.implicatedBlocks = List.copyOf(implicatedBlocks);
    }

    public List<List<String>> implicatedBlocks() {
        return implicatedBlocks;
    }

    /** All implicated variables, flattened in block order. */
    public List<String> implicatedVariables() {
        return implicatedBlocks.stream().flatMap(List::stream).toList();
    }
}
