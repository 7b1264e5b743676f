package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Operand;
import com.branchfeatures.adapter.ir.Routine;
import com.branchfeatures.adapter.static_analysis.ExtractorOptions.DependencyOrder;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Consumer-to-producer edges between instructions of the same routine. Parameters, globals and
 * constants produce no edge.
 */
public class DataDependencyTracker {

    private final DependencyOrder order;

    public DataDependencyTracker(DependencyOrder order) {
        this.order = order;
    }

    /** Producers per consumer; instructions without producers are absent. */
    public Map<Instruction, Set<Instruction>> track(Routine routine) {
        Map<Instruction, Set<Instruction>> dependencies = new LinkedHashMap<>();
        for (Instruction consumer : routine.instructions()) {
            Set<Instruction> producers = order == DependencyOrder.PROGRAM_ORDER
                    ? new TreeSet<>(Comparator.comparingInt(Instruction::index))
                    : new HashSet<>();
            for (Operand operand : consumer.operands()) {
                if (operand.kind() != Operand.Kind.INSTRUCTION) continue;
                for (Instruction producer : operand.producers()) {
                    if (producer.routine() == routine) {
                        producers.add(producer);
                    }
                }
            }
            if (!producers.isEmpty()) {
                dependencies.put(consumer, producers);
            }
        }
        return dependencies;
    }
}
