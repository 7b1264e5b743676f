package com.branchfeatures.adapter.static_analysis;

/**
 * Tunables of the extraction pipeline.
 *
 * @param propagation     how block distances spread from control points
 * @param dependencyOrder order of producers on the {@code Depends on:} line
 */
public record ExtractorOptions(PropagationMode propagation, DependencyOrder dependencyOrder) {

    public enum PropagationMode {
        /** Distances flow to predecessor blocks only. */
        BACKWARD,
        /** Distances flow to predecessors and successors. */
        BIDIRECTIONAL
    }

    public enum DependencyOrder {
        /** Producers sorted by instruction index. */
        PROGRAM_ORDER,
        /** Producers in hash-set iteration order; may differ between runs. */
        UNORDERED
    }

    public ExtractorOptions {
        if (propagation == null) propagation = PropagationMode.BACKWARD;
        if (dependencyOrder == null) dependencyOrder = DependencyOrder.PROGRAM_ORDER;
    }

    public static ExtractorOptions defaults() {
        return new ExtractorOptions(PropagationMode.BACKWARD, DependencyOrder.PROGRAM_ORDER);
    }
}
