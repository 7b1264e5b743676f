package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Routine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numbers the two-way conditional branch terminators of a routine, in block layout order, from
 * the run's shared counter.
 */
public class BranchIdAssigner {

    public Map<Instruction, Long> assign(Routine routine, AnalysisContext context) {
        Map<Instruction, Long> ids = new LinkedHashMap<>();
        for (Block block : routine.blocks()) {
            Instruction terminator = block.terminator();
            if (terminator != null && terminator.isConditionalBranch()) {
                ids.put(terminator, context.nextBranchId());
            }
        }
        return ids;
    }
}
