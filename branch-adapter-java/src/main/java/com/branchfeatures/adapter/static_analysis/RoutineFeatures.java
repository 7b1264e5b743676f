package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Routine;

import java.util.Map;
import java.util.Set;

/**
 * Everything extracted from one routine, ready for a report writer.
 */
public record RoutineFeatures(
        Routine routine,
        Map<Block, String> labels,
        FeatureTable features,
        Map<Instruction, Long> branchIds,
        Map<Instruction, Set<Instruction>> dependencies
) {
    public FeatureRecord featuresOf(Instruction instruction) {
        return features.of(instruction);
    }

    /** BranchID of the instruction, or null when it is not a numbered conditional branch. */
    public Long branchIdOf(Instruction instruction) {
        return branchIds.get(instruction);
    }

    public Set<Instruction> dependenciesOf(Instruction instruction) {
        return dependencies.getOrDefault(instruction, Set.of());
    }
}
