package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Routine;

import java.io.PrintStream;
import java.util.Map;
import java.util.Set;

/**
 * Runs the feature passes over a routine: block labels, loops, control-flow distances,
 * branch IDs, operand features and data dependencies.
 *
 * Not thread-safe: routines sharing one {@link AnalysisContext} must be extracted one at a time
 * for their BranchIDs to follow extraction order.
 */
public class ControlFlowExtractor {

    private final AnalysisContext context;
    private final BlockLabeler labeler;
    private final LoopAnalyzer loopAnalyzer = new LoopAnalyzer();
    private final ControlFlowDistanceCalculator distanceCalculator;
    private final BranchIdAssigner branchIdAssigner = new BranchIdAssigner();
    private final OperandFeatureCollector operandCollector = new OperandFeatureCollector();
    private final DataDependencyTracker dependencyTracker;

    /**
     * @param diagnostics receives one {@code BB:} line per block; null silences it
     */
    public ControlFlowExtractor(AnalysisContext context, ExtractorOptions options, PrintStream diagnostics) {
        this.context = context;
        this.labeler = new BlockLabeler(diagnostics);
        this.distanceCalculator = new ControlFlowDistanceCalculator(options.propagation());
        this.dependencyTracker = new DataDependencyTracker(options.dependencyOrder());
    }

    public RoutineFeatures extract(Routine routine) {
        Map<Block, String> labels = labeler.label(routine);
        FeatureTable features = new FeatureTable(routine);
        loopAnalyzer.analyze(routine, features);
        distanceCalculator.compute(routine, features);
        Map<Instruction, Long> branchIds = branchIdAssigner.assign(routine, context);
        operandCollector.collect(routine, features);
        Map<Instruction, Set<Instruction>> dependencies = dependencyTracker.track(routine);
        return new RoutineFeatures(routine, labels, features, branchIds, dependencies);
    }
}
