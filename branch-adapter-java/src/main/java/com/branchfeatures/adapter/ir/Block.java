package com.branchfeatures.adapter.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Straight-line instruction sequence with a single entry. The last instruction is the terminator.
 * Predecessor and successor sets hold distinct blocks in insertion order.
 */
public class Block {

    private final int index;
    private final String name;
    private final List<Instruction> instructions = new ArrayList<>();
    private final Set<Block> predecessors = new LinkedHashSet<>();
    private final Set<Block> successors = new LinkedHashSet<>();
    private Routine routine;

    /**
     * @param index layout position within the routine
     * @param name  name the host declared for the block; empty when it has none
     */
    public Block(int index, String name) {
        this.index = index;
        this.name = name == null ? "" : name;
    }

    public int index() { return index; }
    public String name() { return name; }
    public Routine routine() { return routine; }
    public List<Instruction> instructions() { return Collections.unmodifiableList(instructions); }
    public Set<Block> predecessors() { return Collections.unmodifiableSet(predecessors); }
    public Set<Block> successors() { return Collections.unmodifiableSet(successors); }

    public Block addInstruction(Instruction instruction) {
        instruction.setBlock(this);
        instructions.add(instruction);
        return this;
    }

    /** Adds the edge {@code this -> successor} and its reverse predecessor link. */
    public Block addSuccessor(Block successor) {
        successors.add(successor);
        successor.predecessors.add(this);
        return this;
    }

    public Instruction terminator() {
        return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1);
    }

    public Instruction firstInstruction() {
        return instructions.isEmpty() ? null : instructions.get(0);
    }

    void setRoutine(Routine routine) {
        this.routine = routine;
    }

    @Override
    public String toString() {
        return "block" + index + (name.isEmpty() ? "" : "(" + name + ")");
    }
}
