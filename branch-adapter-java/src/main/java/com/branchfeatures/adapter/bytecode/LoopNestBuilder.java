package com.branchfeatures.adapter.bytecode;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Loop;
import com.branchfeatures.adapter.ir.LoopForest;
import com.branchfeatures.adapter.ir.Routine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Natural-loop forest of a routine's control-flow graph.
 *
 * <p>Dominators are computed iteratively over the blocks reachable from the entry. Every edge
 * {@code tail -> header} where the header dominates the tail is a back edge; back edges sharing
 * a header form one loop. A loop's parent is the smallest other loop containing all its blocks.
 */
public class LoopNestBuilder {

    public LoopForest build(Routine routine) {
        List<Block> blocks = routine.blocks();
        if (blocks.isEmpty()) {
            return LoopForest.empty();
        }
        Map<Block, Integer> position = new HashMap<>();
        for (int i = 0; i < blocks.size(); i++) {
            position.put(blocks.get(i), i);
        }

        List<Block> reachable = reachableFrom(routine.entry());
        Set<Block> reachableSet = new LinkedHashSet<>(reachable);
        Map<Block, BitSet> dominators = dominators(routine.entry(), reachable, reachableSet, position);

        Map<Block, Set<Block>> bodies = new LinkedHashMap<>();
        for (Block tail : reachable) {
            for (Block header : tail.successors()) {
                if (reachableSet.contains(header) && dominators.get(tail).get(position.get(header))) {
                    Set<Block> body = bodies.computeIfAbsent(header, h -> new LinkedHashSet<>(List.of(h)));
                    collectBody(tail, body, reachableSet);
                }
            }
        }

        List<Loop> loops = new ArrayList<>();
        bodies.forEach((header, body) -> loops.add(new Loop(header, body)));
        loops.sort(Comparator.comparingInt((Loop l) -> position.get(l.header())));

        List<Loop> bySize = new ArrayList<>(loops);
        bySize.sort(Comparator.comparingInt((Loop l) -> l.blocks().size()));
        List<Loop> topLevel = new ArrayList<>();
        for (Loop loop : loops) {
            Loop parent = null;
            for (Loop candidate : bySize) {
                if (candidate.contains(loop)) {
                    parent = candidate;
                    break;
                }
            }
            if (parent == null) {
                topLevel.add(loop);
            } else {
                parent.addSubLoop(loop);
            }
        }
        return new LoopForest(topLevel);
    }

    private static List<Block> reachableFrom(Block entry) {
        List<Block> order = new ArrayList<>();
        Set<Block> seen = new LinkedHashSet<>();
        Deque<Block> work = new ArrayDeque<>();
        work.push(entry);
        seen.add(entry);
        while (!work.isEmpty()) {
            Block block = work.pop();
            order.add(block);
            for (Block succ : block.successors()) {
                if (seen.add(succ)) {
                    work.push(succ);
                }
            }
        }
        return order;
    }

    private static Map<Block, BitSet> dominators(Block entry, List<Block> reachable, Set<Block> reachableSet,
                                                 Map<Block, Integer> position) {
        Map<Block, BitSet> dom = new HashMap<>();
        BitSet all = new BitSet();
        reachable.forEach(b -> all.set(position.get(b)));
        for (Block block : reachable) {
            BitSet set = new BitSet();
            if (block == entry) {
                set.set(position.get(entry));
            } else {
                set.or(all);
            }
            dom.put(block, set);
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Block block : reachable) {
                if (block == entry) continue;
                BitSet next = null;
                for (Block pred : block.predecessors()) {
                    if (!reachableSet.contains(pred)) continue;
                    if (next == null) {
                        next = (BitSet) dom.get(pred).clone();
                    } else {
                        next.and(dom.get(pred));
                    }
                }
                if (next == null) {
                    next = new BitSet();
                }
                next.set(position.get(block));
                if (!next.equals(dom.get(block))) {
                    dom.put(block, next);
                    changed = true;
                }
            }
        }
        return dom;
    }

    // Walk predecessors back from the tail; the header is already in the body and stops the walk.
    private static void collectBody(Block tail, Set<Block> body, Set<Block> reachableSet) {
        Deque<Block> work = new ArrayDeque<>();
        if (body.add(tail)) {
            work.push(tail);
        }
        while (!work.isEmpty()) {
            Block block = work.pop();
            for (Block pred : block.predecessors()) {
                if (reachableSet.contains(pred) && body.add(pred)) {
                    work.push(pred);
                }
            }
        }
    }
}
