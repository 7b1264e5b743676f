package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Routine;

import java.util.LinkedHashMap;
import java.util.Map;

/** One {@link FeatureRecord} per instruction of a routine, created up front. */
public class FeatureTable {

    private final Map<Instruction, FeatureRecord> records = new LinkedHashMap<>();

    public FeatureTable(Routine routine) {
        for (Instruction instruction : routine.instructions()) {
            records.put(instruction, new FeatureRecord());
        }
    }

    public FeatureRecord of(Instruction instruction) {
        return records.computeIfAbsent(instruction, i -> new FeatureRecord());
    }
}
