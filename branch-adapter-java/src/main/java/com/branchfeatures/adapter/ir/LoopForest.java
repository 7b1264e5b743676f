package com.branchfeatures.adapter.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loop-nest forest of a routine: its outermost loops, each owning its nested sub-loops.
 */
public class LoopForest {

    private static final LoopForest EMPTY = new LoopForest(List.of());

    private final List<Loop> topLevelLoops;
    private final Map<Block, Loop> innermost = new HashMap<>();

    public LoopForest(List<Loop> topLevelLoops) {
        this.topLevelLoops = List.copyOf(topLevelLoops);
        for (Loop loop : this.topLevelLoops) {
            index(loop);
        }
    }

    public static LoopForest empty() {
        return EMPTY;
    }

    public List<Loop> topLevelLoops() { return topLevelLoops; }

    /** Innermost loop containing the block, or null when the block is in no loop. */
    public Loop loopFor(Block block) {
        return innermost.get(block);
    }

    public List<Loop> allLoops() {
        List<Loop> all = new ArrayList<>();
        for (Loop loop : topLevelLoops) {
            collect(loop, all);
        }
        return Collections.unmodifiableList(all);
    }

    // Parents are indexed before children so the deepest loop wins.
    private void index(Loop loop) {
        for (Block block : loop.blocks()) {
            innermost.put(block, loop);
        }
        for (Loop sub : loop.subLoops()) {
            index(sub);
        }
    }

    private static void collect(Loop loop, List<Loop> out) {
        out.add(loop);
        for (Loop sub : loop.subLoops()) {
            collect(sub, out);
        }
    }
}
