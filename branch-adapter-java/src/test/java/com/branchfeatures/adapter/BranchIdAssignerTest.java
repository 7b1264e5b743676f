package com.branchfeatures.adapter;

import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Routine;
import com.branchfeatures.adapter.static_analysis.AnalysisContext;
import com.branchfeatures.adapter.static_analysis.BranchIdAssigner;
import com.branchfeatures.fixture.BinarySearch;
import com.branchfeatures.fixture.LinearSearch;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.branchfeatures.adapter.RoutineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BranchIdAssignerTest {

    private final BranchIdAssigner assigner = new BranchIdAssigner();

    @Test
    void diamondBranchGetsZero() {
        Routine routine = diamond();
        Map<Instruction, Long> ids = assigner.assign(routine, new AnalysisContext());

        assertEquals(Map.of(routine.blocks().get(0).terminator(), 0L), ids);
    }

    @Test
    void conditionalTerminatorsAreNumberedInBlockOrder() throws Exception {
        Routine routine = routine(LinearSearch.class, "linearSearch");
        Map<Instruction, Long> ids = assigner.assign(routine, new AnalysisContext());

        assertEquals(2, ids.size());
        assertEquals(0L, ids.get(find(routine, "IF_ICMPGE")));
        assertEquals(1L, ids.get(find(routine, "IF_ICMPNE")));
        assertNull(ids.get(find(routine, "GOTO")));
    }

    @Test
    void counterContinuesAcrossRoutinesAndRepeatedRuns() throws Exception {
        AnalysisContext context = new AnalysisContext();
        Routine linear = routine(LinearSearch.class, "linearSearch");
        Routine binary = routine(BinarySearch.class, "binarySearch");

        List<Long> seen = new ArrayList<>();
        seen.addAll(assigner.assign(linear, context).values());
        seen.addAll(assigner.assign(binary, context).values());
        seen.addAll(assigner.assign(linear, context).values());

        for (int i = 0; i < seen.size(); i++) {
            assertEquals((long) i, seen.get(i));
        }
        assertEquals(seen.size(), context.assignedBranchIds());
        assertEquals(List.of(0L, 1L), seen.subList(0, 2));
    }

    @Test
    void separateContextsNumberIndependently() throws Exception {
        Routine linear = routine(LinearSearch.class, "linearSearch");
        assigner.assign(linear, new AnalysisContext());

        Map<Instruction, Long> fresh = assigner.assign(linear, new AnalysisContext());
        assertEquals(List.of(0L, 1L), new ArrayList<>(fresh.values()));
    }
}
