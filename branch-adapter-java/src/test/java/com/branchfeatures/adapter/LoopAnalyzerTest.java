package com.branchfeatures.adapter;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.InstructionKind;
import com.branchfeatures.adapter.ir.Loop;
import com.branchfeatures.adapter.ir.LoopForest;
import com.branchfeatures.adapter.ir.Routine;
import com.branchfeatures.adapter.static_analysis.FeatureRecord;
import com.branchfeatures.adapter.static_analysis.FeatureTable;
import com.branchfeatures.adapter.static_analysis.LoopAnalyzer;
import com.branchfeatures.fixture.ControlFlowSamples;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.branchfeatures.adapter.RoutineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LoopAnalyzerTest {

    private final LoopAnalyzer analyzer = new LoopAnalyzer();

    @Test
    void nestedLoopsMarkDepthOfInnermostLoop() {
        // pre -> outer { header -> inner { body } -> latch } -> exit
        Routine routine = new Routine("nest");
        Block pre = block(0, InstructionKind.OTHER);
        Block header = block(1, InstructionKind.BRANCH);
        Block body = block(2, InstructionKind.BRANCH);
        Block latch = block(3, InstructionKind.BRANCH);
        Block exit = block(4, InstructionKind.RETURN);
        pre.addSuccessor(header);
        header.addSuccessor(body).addSuccessor(exit);
        body.addSuccessor(body).addSuccessor(latch);
        latch.addSuccessor(header);
        routine.addBlock(pre).addBlock(header).addBlock(body).addBlock(latch).addBlock(exit);

        Loop outer = new Loop(header, Set.of(header, body, latch));
        Loop inner = new Loop(body, Set.of(body));
        outer.addSubLoop(inner);
        routine.setLoops(new LoopForest(List.of(outer)));

        FeatureTable features = new FeatureTable(routine);
        analyzer.analyze(routine, features);

        assertLoop(features, pre, 0, 0);
        assertLoop(features, header, 1, 1);
        assertLoop(features, body, 1, 2);
        assertLoop(features, latch, 1, 1);
        assertLoop(features, exit, 0, 0);
    }

    @Test
    void missingLoopDataLeavesDefaults() {
        Routine routine = diamond();
        routine.setLoops(null);
        FeatureTable features = new FeatureTable(routine);
        analyzer.analyze(routine, features);

        for (Instruction instruction : routine.instructions()) {
            assertEquals(0, features.of(instruction).inLoop);
            assertEquals(0, features.of(instruction).loopDepth);
        }
    }

    @Test
    void compiledNestedLoops() throws Exception {
        Routine routine = routine(ControlFlowSamples.class, "nestedLoops");
        FeatureTable features = new FeatureTable(routine);
        analyzer.analyze(routine, features);

        FeatureRecord multiply = features.of(find(routine, "IMUL"));
        assertEquals(1, multiply.inLoop);
        assertEquals(2, multiply.loopDepth);

        FeatureRecord outerIncrement = features.of(find(routine, "IINC 3"));
        assertEquals(1, outerIncrement.inLoop);
        assertEquals(1, outerIncrement.loopDepth);

        FeatureRecord result = features.of(find(routine, "IRETURN"));
        assertEquals(0, result.inLoop);
        assertEquals(0, result.loopDepth);
    }

    private static int nextIndex;

    private static Block block(int index, InstructionKind terminatorKind) {
        Block block = new Block(index, "");
        block.addInstruction(other(nextIndex++, "NOP"));
        block.addInstruction(new Instruction(nextIndex++, terminatorKind, terminatorKind.name()));
        return block;
    }

    private static void assertLoop(FeatureTable features, Block block, int inLoop, int depth) {
        for (Instruction instruction : block.instructions()) {
            assertEquals(inLoop, features.of(instruction).inLoop, "in_loop of " + block);
            assertEquals(depth, features.of(instruction).loopDepth, "loop_depth of " + block);
        }
    }
}
