package com.branchfeatures.adapter.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Atomic operation of a routine. Identified by its position in the routine ({@link #index()}).
 */
public class Instruction {

    private final int index;
    private final InstructionKind kind;
    private final boolean conditional;
    private final String text;
    private final List<Operand> operands = new ArrayList<>();
    private final List<Operand> condition = new ArrayList<>();
    private List<Block> targets = Collections.emptyList();
    private List<String> targetLabels;
    private Block block;

    public Instruction(int index, InstructionKind kind, boolean conditional, String text) {
        this.index = index;
        this.kind = kind;
        this.conditional = conditional;
        this.text = text;
    }

    public Instruction(int index, InstructionKind kind, String text) {
        this(index, kind, false, text);
    }

    public int index() { return index; }
    public InstructionKind kind() { return kind; }
    public String text() { return text; }
    public List<Operand> operands() { return Collections.unmodifiableList(operands); }

    /** Operands that decide a branch or switch; also present in {@link #operands()}. */
    public List<Operand> condition() { return Collections.unmodifiableList(condition); }

    public Block block() { return block; }

    public Routine routine() {
        return block == null ? null : block.routine();
    }

    public boolean isControlPoint() {
        return kind.isControlPoint();
    }

    public boolean isConditionalBranch() {
        return kind == InstructionKind.BRANCH && conditional;
    }

    public Instruction addOperand(Operand operand) {
        operands.add(operand);
        return this;
    }

    public Instruction addConditionOperand(Operand operand) {
        operands.add(operand);
        condition.add(operand);
        return this;
    }

    /**
     * Successor blocks in successor-position order (for a conditional branch: taken, then
     * fall-through). Empty when the host did not supply a structured successor list.
     */
    public List<Block> targets() { return targets; }

    /**
     * Symbolic names of {@link #targets()}, position for position; entries may be null.
     * Null when the host supplies no structured names and they must be read from {@link #text()}.
     */
    public List<String> targetLabels() { return targetLabels; }

    public void setTargets(List<Block> targets, List<String> targetLabels) {
        this.targets = List.copyOf(targets);
        this.targetLabels = targetLabels == null ? null : Collections.unmodifiableList(new ArrayList<>(targetLabels));
    }

    void setBlock(Block block) {
        this.block = block;
    }

    @Override
    public String toString() {
        return "#" + index + " " + text;
    }
}
