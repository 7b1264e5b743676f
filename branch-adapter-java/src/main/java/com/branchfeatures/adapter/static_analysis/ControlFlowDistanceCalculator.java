package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.Routine;
import com.branchfeatures.adapter.static_analysis.ExtractorOptions.PropagationMode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@code dist_to_control_flow}: how many instructions separate an instruction from the
 * next control point (branch, call, return, indirect branch or switch).
 *
 * <p>Within a block the distance is counted backwards from each control point. Instructions
 * after the block's last control point fall back to the block distance, which is a breadth-first
 * distance over the CFG from the nearest block whose terminator is a control point. Anything
 * out of reach stays at {@link #MAX_DISTANCE}.
 */
public class ControlFlowDistanceCalculator {

    public static final int MAX_DISTANCE = 999;

    private final PropagationMode mode;

    public ControlFlowDistanceCalculator(PropagationMode mode) {
        this.mode = mode;
    }

    public void compute(Routine routine, FeatureTable features) {
        Map<Block, Integer> blockDistances = blockDistances(routine);
        for (Block block : routine.blocks()) {
            List<Instruction> instructions = block.instructions();
            int fallback = blockDistances.get(block);
            // Only instructions after the last control point take the block distance;
            // a counter saturated at MAX_DISTANCE keeps its value.
            boolean seenControlPoint = false;
            int running = MAX_DISTANCE;
            for (int k = instructions.size() - 1; k >= 0; k--) {
                Instruction instruction = instructions.get(k);
                FeatureRecord record = features.of(instruction);
                if (instruction.isControlPoint()) {
                    record.distToControlFlow = 0;
                    seenControlPoint = true;
                    running = 1;
                } else if (!seenControlPoint) {
                    record.distToControlFlow = fallback;
                } else {
                    record.distToControlFlow = running;
                    if (running < MAX_DISTANCE) running++;
                }
            }
        }
    }

    public Map<Block, Integer> blockDistances(Routine routine) {
        Map<Block, Integer> distances = new LinkedHashMap<>();
        Deque<Block> queue = new ArrayDeque<>();
        for (Block block : routine.blocks()) {
            Instruction terminator = block.terminator();
            if (terminator != null && terminator.isControlPoint()) {
                distances.put(block, 0);
                queue.add(block);
            } else {
                distances.put(block, MAX_DISTANCE);
            }
        }
        while (!queue.isEmpty()) {
            Block block = queue.poll();
            int next = Math.min(distances.get(block) + 1, MAX_DISTANCE);
            for (Block pred : block.predecessors()) {
                relax(pred, next, distances, queue);
            }
            if (mode == PropagationMode.BIDIRECTIONAL) {
                for (Block succ : block.successors()) {
                    relax(succ, next, distances, queue);
                }
            }
        }
        return distances;
    }

    private static void relax(Block block, int distance, Map<Block, Integer> distances, Deque<Block> queue) {
        Integer current = distances.get(block);
        if (current != null && current > distance) {
            distances.put(block, distance);
            queue.add(block);
        }
    }
}
