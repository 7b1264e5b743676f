package com.branchfeatures.adapter.ir;

import java.util.List;

/**
 * One input of an instruction: a value produced by other instructions, a routine parameter,
 * a global symbol, a literal, or a branch target label.
 */
public final class Operand {

    public enum Kind {
        INSTRUCTION,
        PARAMETER,
        GLOBAL,
        INT_CONSTANT,
        FLOAT_CONSTANT,
        LABEL,
        OTHER
    }

    private final Kind kind;
    private final List<Instruction> producers;
    private final boolean pointer;
    private final String text;

    private Operand(Kind kind, List<Instruction> producers, boolean pointer, String text) {
        this.kind = kind;
        this.producers = producers;
        this.pointer = pointer;
        this.text = text;
    }

    public static Operand produced(List<Instruction> producers, boolean pointer) {
        return new Operand(Kind.INSTRUCTION, List.copyOf(producers), pointer, "value");
    }

    public static Operand parameter(int index, boolean pointer) {
        return new Operand(Kind.PARAMETER, List.of(), pointer, "param" + index);
    }

    /** Address of a global symbol (field, method, string or class constant). */
    public static Operand global(String name) {
        return new Operand(Kind.GLOBAL, List.of(), true, name);
    }

    public static Operand intConstant(long value) {
        return new Operand(Kind.INT_CONSTANT, List.of(), false, Long.toString(value));
    }

    public static Operand floatConstant(double value) {
        return new Operand(Kind.FLOAT_CONSTANT, List.of(), false, Double.toString(value));
    }

    public static Operand label(String name) {
        return new Operand(Kind.LABEL, List.of(), false, name);
    }

    public static Operand other(String text, boolean pointer) {
        return new Operand(Kind.OTHER, List.of(), pointer, text);
    }

    public Kind kind() { return kind; }

    /** Instructions whose result may flow into this operand; empty unless kind is INSTRUCTION. */
    public List<Instruction> producers() { return producers; }

    /** Whether the operand's static type is a pointer/reference. */
    public boolean isPointer() { return pointer; }

    public String text() { return text; }

    /** Produced by another instruction or a routine parameter. */
    public boolean isRegister() {
        return kind == Kind.INSTRUCTION || kind == Kind.PARAMETER;
    }

    /** Literal integer or floating-point constant. */
    public boolean isImmediate() {
        return kind == Kind.INT_CONSTANT || kind == Kind.FLOAT_CONSTANT;
    }

    @Override
    public String toString() {
        return kind + ":" + text;
    }
}
