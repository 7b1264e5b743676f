package com.branchfeatures.adapter.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One function body under analysis. Owns its blocks in layout order and the loop-nest forest
 * the host computed for it.
 */
public class Routine {

    private final String name;
    private final List<Block> blocks = new ArrayList<>();
    private LoopForest loops = LoopForest.empty();

    public Routine(String name) {
        this.name = name;
    }

    public String name() { return name; }
    public List<Block> blocks() { return Collections.unmodifiableList(blocks); }
    public LoopForest loops() { return loops; }

    public Routine addBlock(Block block) {
        block.setRoutine(this);
        blocks.add(block);
        return this;
    }

    public void setLoops(LoopForest loops) {
        this.loops = loops == null ? LoopForest.empty() : loops;
    }

    public Block entry() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /** All instructions, block by block. */
    public List<Instruction> instructions() {
        List<Instruction> all = new ArrayList<>();
        for (Block block : blocks) {
            all.addAll(block.instructions());
        }
        return all;
    }

    @Override
    public String toString() {
        return name;
    }
}
