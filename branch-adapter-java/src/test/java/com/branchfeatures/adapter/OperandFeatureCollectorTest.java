package com.branchfeatures.adapter;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.InstructionKind;
import com.branchfeatures.adapter.ir.Operand;
import com.branchfeatures.adapter.ir.Routine;
import com.branchfeatures.adapter.static_analysis.FeatureRecord;
import com.branchfeatures.adapter.static_analysis.FeatureTable;
import com.branchfeatures.adapter.static_analysis.OperandFeatureCollector;
import com.branchfeatures.fixture.ControlFlowSamples;
import com.branchfeatures.fixture.LinearSearch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.branchfeatures.adapter.RoutineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class OperandFeatureCollectorTest {

    private final OperandFeatureCollector collector = new OperandFeatureCollector();

    @Test
    void blockCountsAreSharedByEveryInstruction() {
        Routine routine = diamond();
        FeatureTable features = collect(routine);

        for (Instruction instruction : routine.blocks().get(0).instructions()) {
            assertEquals(0, features.of(instruction).numPredsOfBlock);
            assertEquals(2, features.of(instruction).numSuccsOfBlock);
        }
        FeatureRecord taken = features.of(routine.blocks().get(1).terminator());
        assertEquals(1, taken.numPredsOfBlock);
        assertEquals(0, taken.numSuccsOfBlock);
    }

    @Test
    void duplicateEdgesCountOnce() {
        Routine routine = new Routine("r");
        Block a = new Block(0, "");
        Block b = new Block(1, "");
        a.addInstruction(new Instruction(0, InstructionKind.SWITCH, "TABLESWITCH"));
        b.addInstruction(new Instruction(1, InstructionKind.RETURN, "RETURN"));
        a.addSuccessor(b).addSuccessor(b);
        routine.addBlock(a).addBlock(b);

        FeatureTable features = collect(routine);
        assertEquals(1, features.of(a.terminator()).numSuccsOfBlock);
        assertEquals(1, features.of(b.terminator()).numPredsOfBlock);
    }

    @Test
    void flagsAreIndependent() {
        Routine routine = new Routine("r");
        Block block = new Block(0, "");
        Instruction pointerParam = new Instruction(0, InstructionKind.OTHER, "ALOAD 0")
                .addOperand(Operand.parameter(0, true));
        Instruction mixed = new Instruction(1, InstructionKind.OTHER, "IADD")
                .addOperand(Operand.produced(List.of(pointerParam), false))
                .addOperand(Operand.intConstant(4));
        Instruction constantOnly = new Instruction(2, InstructionKind.OTHER, "BIPUSH 9")
                .addOperand(Operand.intConstant(9));
        Instruction bareLoad = new Instruction(3, InstructionKind.LOAD, "IALOAD");
        Instruction ret = new Instruction(4, InstructionKind.RETURN, "RETURN");
        block.addInstruction(pointerParam).addInstruction(mixed).addInstruction(constantOnly)
             .addInstruction(bareLoad).addInstruction(ret);
        routine.addBlock(block);

        FeatureTable features = collect(routine);
        assertFlags(features.of(pointerParam), true, true, false, 1);
        assertFlags(features.of(mixed), false, true, true, 2);
        assertFlags(features.of(constantOnly), false, false, true, 1);
        assertFlags(features.of(bareLoad), true, false, false, 0);
        assertFlags(features.of(ret), false, false, false, 0);
    }

    @Test
    void branchConditionIsCountedOnce() {
        Routine routine = diamond();
        FeatureTable features = collect(routine);

        FeatureRecord branch = features.of(routine.blocks().get(0).terminator());
        assertEquals(2, branch.numOperands);
        assertTrue(branch.registerOperand);
        assertFalse(branch.immediate);
        assertFalse(branch.memoryAccess);
    }

    @Test
    void compiledArrayAccess() throws Exception {
        Routine routine = routine(LinearSearch.class, "linearSearch");
        FeatureTable features = collect(routine);

        FeatureRecord arrayLoad = features.of(find(routine, "IALOAD"));
        assertTrue(arrayLoad.memoryAccess);
        assertTrue(arrayLoad.registerOperand);
        assertEquals(2, arrayLoad.numOperands);

        FeatureRecord arrayRef = features.of(find(routine, "ALOAD 0"));
        assertTrue(arrayRef.memoryAccess, "reference parameter is a pointer operand");

        FeatureRecord increment = features.of(find(routine, "IINC"));
        assertTrue(increment.immediate);
        assertTrue(increment.registerOperand);
    }

    @Test
    void compiledStaticFieldUpdate() throws Exception {
        Routine routine = routine(ControlFlowSamples.class, "bump");
        FeatureTable features = collect(routine);

        FeatureRecord add = features.of(find(routine, "IADD"));
        assertTrue(add.registerOperand);
        assertTrue(add.immediate);
        assertFalse(add.memoryAccess);

        assertTrue(features.of(find(routine, "PUTSTATIC")).memoryAccess);
        assertTrue(features.of(find(routine, "LDC 1.5")).immediate);
    }

    private FeatureTable collect(Routine routine) {
        FeatureTable features = new FeatureTable(routine);
        collector.collect(routine, features);
        return features;
    }

    private static void assertFlags(FeatureRecord record, boolean memory, boolean register, boolean immediate,
                                    int operands) {
        assertEquals(memory, record.memoryAccess, "op_is_mem_access");
        assertEquals(register, record.registerOperand, "op_is_reg_operand");
        assertEquals(immediate, record.immediate, "op_is_immediate");
        assertEquals(operands, record.numOperands, "num_operands");
    }
}
