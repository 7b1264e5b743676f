package com.branchfeatures.adapter.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Natural loop: a header block plus every block that reaches a back edge into it without
 * passing through the header. Member blocks include those of nested sub-loops.
 */
public class Loop {

    private final Block header;
    private final Set<Block> blocks;
    private final List<Loop> subLoops = new ArrayList<>();
    private Loop parent;

    public Loop(Block header, Set<Block> blocks) {
        this.header = header;
        this.blocks = new LinkedHashSet<>(blocks);
        this.blocks.add(header);
    }

    public Block header() { return header; }
    public Set<Block> blocks() { return Collections.unmodifiableSet(blocks); }
    public List<Loop> subLoops() { return Collections.unmodifiableList(subLoops); }
    public Loop parent() { return parent; }

    public void addSubLoop(Loop loop) {
        loop.parent = this;
        subLoops.add(loop);
    }

    /** Nesting depth; 1 for an outermost loop. */
    public int depth() {
        int depth = 1;
        for (Loop p = parent; p != null; p = p.parent) {
            depth++;
        }
        return depth;
    }

    public boolean contains(Block block) {
        return blocks.contains(block);
    }

    public boolean contains(Loop other) {
        return other != this && blocks.containsAll(other.blocks);
    }

    @Override
    public String toString() {
        return "loop@" + header + " depth=" + depth() + " blocks=" + blocks.size();
    }
}
