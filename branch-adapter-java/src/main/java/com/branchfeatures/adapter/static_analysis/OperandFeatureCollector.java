package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.InstructionKind;
import com.branchfeatures.adapter.ir.Operand;
import com.branchfeatures.adapter.ir.Routine;

import java.util.ArrayList;
import java.util.List;

/**
 * Block fan-in/fan-out and operand classification.
 */
public class OperandFeatureCollector {

    public void collect(Routine routine, FeatureTable features) {
        for (Block block : routine.blocks()) {
            int preds = block.predecessors().size();
            int succs = block.successors().size();
            for (Instruction instruction : block.instructions()) {
                FeatureRecord record = features.of(instruction);
                record.numPredsOfBlock = preds;
                record.numSuccsOfBlock = succs;
                record.numOperands = instruction.operands().size();

                boolean memory = instruction.kind().isMemoryAccess();
                boolean register = false;
                boolean immediate = false;
                for (Operand operand : scanned(instruction)) {
                    memory |= operand.isPointer();
                    register |= operand.isRegister();
                    immediate |= operand.isImmediate();
                }
                record.memoryAccess = memory;
                record.registerOperand = register;
                record.immediate = immediate;
            }
        }
    }

    // Branch and switch conditions are scanned again after the full operand list.
    private static List<Operand> scanned(Instruction instruction) {
        List<Operand> operands = new ArrayList<>(instruction.operands());
        if (instruction.kind() == InstructionKind.BRANCH || instruction.kind() == InstructionKind.SWITCH) {
            operands.addAll(instruction.condition());
        }
        return operands;
    }
}
