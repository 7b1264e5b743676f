package com.branchfeatures.adapter;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.InstructionKind;
import com.branchfeatures.adapter.ir.Routine;
import com.branchfeatures.adapter.static_analysis.ControlFlowDistanceCalculator;
import com.branchfeatures.adapter.static_analysis.ExtractorOptions.PropagationMode;
import com.branchfeatures.adapter.static_analysis.FeatureTable;
import com.branchfeatures.fixture.BinarySearch;
import com.branchfeatures.fixture.ControlFlowSamples;
import com.branchfeatures.fixture.LinearSearch;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.branchfeatures.adapter.RoutineFixtures.*;
import static com.branchfeatures.adapter.static_analysis.ControlFlowDistanceCalculator.MAX_DISTANCE;
import static org.junit.jupiter.api.Assertions.*;

class ControlFlowDistanceCalculatorTest {

    private final ControlFlowDistanceCalculator backward = new ControlFlowDistanceCalculator(PropagationMode.BACKWARD);

    @Test
    void singleBlockCountsDownToTheReturn() {
        Routine routine = new Routine("r");
        Block block = new Block(0, "");
        block.addInstruction(other(0, "ICONST_1"))
             .addInstruction(other(1, "ICONST_2"))
             .addInstruction(other(2, "IADD"))
             .addInstruction(new Instruction(3, InstructionKind.RETURN, "IRETURN"));
        routine.addBlock(block);

        assertEquals(List.of(3, 2, 1, 0), distances(backward, routine));
    }

    @Test
    void diamondBranchAndReturnsAreControlPoints() {
        Routine routine = diamond();
        assertEquals(List.of(1, 0, 0, 0), distances(backward, routine));
    }

    @Test
    void callsResetTheCountInsideABlock() {
        Routine routine = new Routine("r");
        Block block = new Block(0, "");
        block.addInstruction(other(0, "ALOAD 0"))
             .addInstruction(new Instruction(1, InstructionKind.CALL, "INVOKESTATIC f()V"))
             .addInstruction(other(2, "ICONST_0"))
             .addInstruction(other(3, "POP"))
             .addInstruction(new Instruction(4, InstructionKind.RETURN, "RETURN"));
        routine.addBlock(block);

        assertEquals(List.of(1, 0, 2, 1, 0), distances(backward, routine));
    }

    @Test
    void fallThroughBlockUsesBlockDistance() {
        Routine routine = new Routine("r");
        Block first = new Block(0, "");
        Block second = new Block(1, "");
        Block last = new Block(2, "");
        first.addInstruction(other(0, "ICONST_0")).addInstruction(other(1, "ISTORE 1"));
        second.addInstruction(other(2, "IINC 1 1"));
        last.addInstruction(new Instruction(3, InstructionKind.RETURN, "RETURN"));
        first.addSuccessor(second);
        second.addSuccessor(last);
        routine.addBlock(first).addBlock(second).addBlock(last);

        assertEquals(List.of(2, 2, 1, 0), distances(backward, routine));
    }

    @Test
    void blocksThatReachNoControlPointStayAtMaximum() {
        Routine routine = new Routine("r");
        Block entry = new Block(0, "");
        Block dead = new Block(1, "");
        entry.addInstruction(new Instruction(0, InstructionKind.CALL, "INVOKESTATIC f()V"));
        dead.addInstruction(other(1, "NOP"));
        entry.addSuccessor(dead);
        routine.addBlock(entry).addBlock(dead);

        assertEquals(List.of(0, MAX_DISTANCE), distances(backward, routine));
        assertEquals(MAX_DISTANCE, backward.blockDistances(routine).get(dead));
    }

    @Test
    void bidirectionalModeAlsoReachesSuccessors() {
        Routine routine = new Routine("r");
        Block entry = new Block(0, "");
        Block after = new Block(1, "");
        entry.addInstruction(new Instruction(0, InstructionKind.CALL, "INVOKESTATIC f()V"));
        after.addInstruction(other(1, "NOP"));
        entry.addSuccessor(after);
        routine.addBlock(entry).addBlock(after);

        ControlFlowDistanceCalculator bidirectional = new ControlFlowDistanceCalculator(PropagationMode.BIDIRECTIONAL);
        assertEquals(List.of(0, 1), distances(bidirectional, routine));
    }

    @Test
    void longBlockSaturatesAtMaximumInsteadOfFallingBack() {
        Routine routine = new Routine("r");
        Block block = new Block(0, "");
        int length = 1200;
        for (int i = 0; i < length; i++) {
            block.addInstruction(other(i, "NOP"));
        }
        block.addInstruction(new Instruction(length, InstructionKind.RETURN, "RETURN"));
        routine.addBlock(block);

        List<Integer> distances = distances(backward, routine);
        assertEquals(0, distances.get(length));
        assertEquals(1, distances.get(length - 1));
        assertEquals(MAX_DISTANCE, distances.get(length - MAX_DISTANCE));
        assertEquals(MAX_DISTANCE, distances.get(0));
        for (int i = 0; i < length; i++) {
            assertNotEquals(0, distances.get(i), "instruction " + i);
        }
    }

    @Test
    void zeroExactlyAtControlPointsInCompiledCode() throws Exception {
        List<Routine> all = new ArrayList<>();
        all.addAll(routines(BinarySearch.class));
        all.addAll(routines(LinearSearch.class));
        all.addAll(routines(ControlFlowSamples.class));

        for (Routine routine : all) {
            FeatureTable features = new FeatureTable(routine);
            backward.compute(routine, features);
            for (Instruction instruction : routine.instructions()) {
                int distance = features.of(instruction).distToControlFlow;
                assertEquals(instruction.isControlPoint(), distance == 0, routine.name() + " " + instruction);
                assertTrue(distance >= 0 && distance <= MAX_DISTANCE);
            }
        }
    }

    private static List<Integer> distances(ControlFlowDistanceCalculator calculator, Routine routine) {
        FeatureTable features = new FeatureTable(routine);
        calculator.compute(routine, features);
        List<Integer> result = new ArrayList<>();
        for (Instruction instruction : routine.instructions()) {
            result.add(features.of(instruction).distToControlFlow);
        }
        return result;
    }
}
