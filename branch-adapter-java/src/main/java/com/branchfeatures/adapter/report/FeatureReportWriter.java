package com.branchfeatures.adapter.report;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.static_analysis.FeatureRecord;
import com.branchfeatures.adapter.static_analysis.RoutineFeatures;

import java.io.PrintWriter;
import java.io.Writer;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Line-oriented text report. For each routine:
 *
 * <pre>
 * Control-flow features for function: com.example.Foo.bar(I)I
 * L0:
 * #0 ILOAD 0: [in_loop: 0, dist_to_control_flow: 1, ...]
 * BranchID: 0   #1 IFLE L1: [in_loop: 0, dist_to_control_flow: 0, ...]
 *   Depends on:   #0 ILOAD 0
 * </pre>
 */
public class FeatureReportWriter {

    static final String HEADER = "Control-flow features for function: ";
    static final String DEPENDS_ON = "  Depends on:   ";

    private final PrintWriter out;

    public FeatureReportWriter(Writer out) {
        this.out = out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
    }

    public void write(RoutineFeatures routineFeatures) {
        out.println(HEADER + routineFeatures.routine().name());
        for (Block block : routineFeatures.routine().blocks()) {
            out.println(routineFeatures.labels().get(block) + ":");
            for (Instruction instruction : block.instructions()) {
                StringBuilder line = new StringBuilder();
                Long branchId = routineFeatures.branchIdOf(instruction);
                if (branchId != null) {
                    line.append("BranchID: ").append(Long.toUnsignedString(branchId)).append("   ");
                }
                line.append(instruction).append(": ").append(format(routineFeatures.featuresOf(instruction)));
                out.println(line);

                Set<Instruction> producers = routineFeatures.dependenciesOf(instruction);
                if (!producers.isEmpty()) {
                    out.println(DEPENDS_ON + producers.stream()
                            .map(Instruction::toString)
                            .collect(Collectors.joining(", ")));
                }
            }
        }
        out.println();
        out.flush();
    }

    static String format(FeatureRecord r) {
        return "[in_loop: " + r.inLoop
                + ", dist_to_control_flow: " + r.distToControlFlow
                + ", num_preds_BB: " + r.numPredsOfBlock
                + ", num_succs_BB: " + r.numSuccsOfBlock
                + ", loop_depth_BB: " + r.loopDepth
                + ", op_is_mem_access: " + bit(r.memoryAccess)
                + ", op_is_reg_operand: " + bit(r.registerOperand)
                + ", op_is_immediate: " + bit(r.immediate)
                + ", num_operands: " + r.numOperands + "]";
    }

    private static int bit(boolean b) {
        return b ? 1 : 0;
    }
}
