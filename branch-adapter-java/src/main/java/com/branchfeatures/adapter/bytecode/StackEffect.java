package com.branchfeatures.adapter.bytecode;

import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MultiANewArrayInsnNode;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.tree.analysis.Value;

import static org.objectweb.asm.Opcodes.*;

/**
 * Number of operand-stack values an instruction pops, counted in values rather than slots.
 * The DUP and POP families depend on the size of the values on the stack, read from the
 * frame before the instruction.
 */
final class StackEffect {

    private StackEffect() {}

    static <V extends Value> int consumedValues(AbstractInsnNode node, Frame<V> before) {
        int opcode = node.getOpcode();
        return switch (opcode) {
            case IALOAD, LALOAD, FALOAD, DALOAD, AALOAD, BALOAD, CALOAD, SALOAD -> 2;
            case ISTORE, LSTORE, FSTORE, DSTORE, ASTORE -> 1;
            case IASTORE, LASTORE, FASTORE, DASTORE, AASTORE, BASTORE, CASTORE, SASTORE -> 3;
            case POP, DUP -> 1;
            case POP2, DUP2 -> sizeAt(before, 0) == 2 ? 1 : 2;
            case DUP_X1, SWAP -> 2;
            case DUP_X2 -> sizeAt(before, 1) == 2 ? 2 : 3;
            case DUP2_X1 -> sizeAt(before, 0) == 2 ? 2 : 3;
            case DUP2_X2 -> {
                if (sizeAt(before, 0) == 2) {
                    yield sizeAt(before, 1) == 2 ? 2 : 3;
                }
                yield sizeAt(before, 2) == 2 ? 3 : 4;
            }
            case INEG, LNEG, FNEG, DNEG -> 1;
            case IFEQ, IFNE, IFLT, IFGE, IFGT, IFLE, IFNULL, IFNONNULL -> 1;
            case IF_ICMPEQ, IF_ICMPNE, IF_ICMPLT, IF_ICMPGE, IF_ICMPGT, IF_ICMPLE, IF_ACMPEQ, IF_ACMPNE -> 2;
            case TABLESWITCH, LOOKUPSWITCH -> 1;
            case IRETURN, LRETURN, FRETURN, DRETURN, ARETURN -> 1;
            case GETFIELD, PUTSTATIC -> 1;
            case PUTFIELD -> 2;
            case INVOKEVIRTUAL, INVOKESPECIAL, INVOKEINTERFACE ->
                    Type.getArgumentTypes(((MethodInsnNode) node).desc).length + 1;
            case INVOKESTATIC -> Type.getArgumentTypes(((MethodInsnNode) node).desc).length;
            case INVOKEDYNAMIC -> Type.getArgumentTypes(((InvokeDynamicInsnNode) node).desc).length;
            case NEWARRAY, ANEWARRAY, ARRAYLENGTH, ATHROW, CHECKCAST, INSTANCEOF, MONITORENTER, MONITOREXIT -> 1;
            case MULTIANEWARRAY -> ((MultiANewArrayInsnNode) node).dims;
            default -> rangeEffect(opcode);
        };
    }

    private static int rangeEffect(int opcode) {
        if (opcode >= IADD && opcode <= DREM) return 2;
        if (opcode >= ISHL && opcode <= LXOR) return 2;
        if (opcode >= I2L && opcode <= I2S) return 1;
        if (opcode >= LCMP && opcode <= DCMPG) return 2;
        // constants, loads, IINC, GOTO, JSR, RET, GETSTATIC, NEW, RETURN
        return 0;
    }

    private static <V extends Value> int sizeAt(Frame<V> frame, int fromTop) {
        if (frame == null || frame.getStackSize() <= fromTop) {
            return 1;
        }
        return frame.getStack(frame.getStackSize() - 1 - fromTop).getSize();
    }
}
