package com.branchfeatures.adapter;

import com.branchfeatures.adapter.bytecode.LoopNestBuilder;
import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.InstructionKind;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Loop;
import com.branchfeatures.adapter.ir.LoopForest;
import com.branchfeatures.adapter.ir.Routine;
import com.branchfeatures.fixture.ControlFlowSamples;
import com.branchfeatures.fixture.LinearSearch;
import org.junit.jupiter.api.Test;

import static com.branchfeatures.adapter.RoutineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LoopNestBuilderTest {

    @Test
    void straightLineCodeHasNoLoops() throws Exception {
        Routine routine = routine(ControlFlowSamples.class, "straightLine");
        assertTrue(routine.loops().topLevelLoops().isEmpty());
    }

    @Test
    void singleLoopExcludesEarlyReturn() throws Exception {
        Routine routine = routine(LinearSearch.class, "linearSearch");
        LoopForest forest = routine.loops();

        assertEquals(1, forest.topLevelLoops().size());
        Loop loop = forest.topLevelLoops().get(0);
        assertEquals(1, loop.depth());
        assertSame(blockContaining(routine, "IF_ICMPGE"), loop.header());
        assertTrue(loop.contains(blockContaining(routine, "IINC")));
        assertTrue(loop.contains(blockContaining(routine, "IALOAD")));
        assertFalse(loop.contains(blockContaining(routine, "ICONST_1")));
        assertFalse(loop.contains(routine.entry()));
    }

    @Test
    void nestedLoopsFormAParentChildPair() throws Exception {
        Routine routine = routine(ControlFlowSamples.class, "nestedLoops");
        LoopForest forest = routine.loops();

        assertEquals(1, forest.topLevelLoops().size());
        Loop outer = forest.topLevelLoops().get(0);
        assertEquals(1, outer.subLoops().size());
        Loop inner = outer.subLoops().get(0);

        assertSame(outer, inner.parent());
        assertEquals(2, inner.depth());
        assertTrue(outer.contains(inner));
        assertSame(inner, forest.loopFor(blockContaining(routine, "IMUL")));
        assertSame(outer, forest.loopFor(blockContaining(routine, "IINC 3")));
        assertNull(forest.loopFor(blockContaining(routine, "IRETURN")));
        assertEquals(2, forest.allLoops().size());
    }

    @Test
    void selfLoopIsASingleBlockLoop() {
        Routine routine = new Routine("spin");
        Block entry = new Block(0, "");
        Block spin = new Block(1, "");
        entry.addInstruction(other(0, "NOP"));
        spin.addInstruction(new Instruction(1, InstructionKind.BRANCH, "GOTO L1"));
        entry.addSuccessor(spin);
        spin.addSuccessor(spin);
        routine.addBlock(entry).addBlock(spin);

        LoopForest forest = new LoopNestBuilder().build(routine);
        assertEquals(1, forest.topLevelLoops().size());
        assertEquals(1, forest.topLevelLoops().get(0).blocks().size());
        assertSame(spin, forest.topLevelLoops().get(0).header());
    }

    @Test
    void unreachableCycleIsIgnored() {
        Routine routine = new Routine("orphan");
        Block entry = new Block(0, "");
        Block a = new Block(1, "");
        Block b = new Block(2, "");
        entry.addInstruction(new Instruction(0, InstructionKind.RETURN, "RETURN"));
        a.addInstruction(other(1, "NOP"));
        b.addInstruction(other(2, "NOP"));
        a.addSuccessor(b);
        b.addSuccessor(a);
        routine.addBlock(entry).addBlock(a).addBlock(b);

        assertTrue(new LoopNestBuilder().build(routine).topLevelLoops().isEmpty());
    }
}
