package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Loop;
import com.branchfeatures.adapter.ir.LoopForest;
import com.branchfeatures.adapter.ir.Routine;

/**
 * Sets {@code in_loop} and {@code loop_depth} from the routine's loop-nest forest.
 */
public class LoopAnalyzer {

    public void analyze(Routine routine, FeatureTable features) {
        LoopForest forest = routine.loops();
        for (Loop loop : forest.topLevelLoops()) {
            markInLoop(loop, features);
        }
        for (Block block : routine.blocks()) {
            Loop innermost = forest.loopFor(block);
            if (innermost == null) continue;
            int depth = innermost.depth();
            for (Instruction instruction : block.instructions()) {
                features.of(instruction).loopDepth = depth;
            }
        }
    }

    // Visits every sub-loop even when its blocks were already marked by the parent.
    private void markInLoop(Loop loop, FeatureTable features) {
        for (Block block : loop.blocks()) {
            for (Instruction instruction : block.instructions()) {
                features.of(instruction).inLoop = 1;
            }
        }
        for (Loop sub : loop.subLoops()) {
            markInLoop(sub, features);
        }
    }
}
