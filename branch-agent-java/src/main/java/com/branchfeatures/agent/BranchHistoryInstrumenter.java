package com.branchfeatures.agent;

import net.bytebuddy.asm.AsmVisitorWrapper;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.implementation.Implementation;
import net.bytebuddy.jar.asm.Label;
import net.bytebuddy.jar.asm.MethodVisitor;
import net.bytebuddy.jar.asm.Opcodes;
import net.bytebuddy.pool.TypePool;
import net.bytebuddy.utility.OpenedClassReader;

import java.util.concurrent.atomic.AtomicLong;

import static net.bytebuddy.matcher.ElementMatchers.any;

/**
 * Rewrites methods so that every two-way conditional jump reports its outcome at runtime.
 *
 * Before each {@code if*} instruction the compared operand(s) are duplicated, the branch ID is
 * pushed as a {@code long} constant and the matching {@link BranchProbe} method is invoked.
 * The probe consumes the copies, so the jump sees the operand stack it saw before.
 * No labels or branches are added, so existing stack map frames stay valid.
 *
 * Branch IDs come from this instance's own counter, starting at 0 and increasing in class,
 * method and bytecode order. They are not coordinated with the IDs the static extractor assigns.
 */
public class BranchHistoryInstrumenter implements AsmVisitorWrapper.ForDeclaredMethods.MethodVisitorWrapper {

    // DUP2 of two references (2 slots) plus the long branch ID (2 slots)
    static final int EXTRA_STACK = 4;

    private static final String INT_PROBE = "(IJ)V";
    private static final String INT_PAIR_PROBE = "(IIJ)V";
    private static final String REFERENCE_PROBE = "(Ljava/lang/Object;J)V";
    private static final String REFERENCE_PAIR_PROBE = "(Ljava/lang/Object;Ljava/lang/Object;J)V";

    private final AtomicLong branchCounter = new AtomicLong();

    /** Visitor wrapper applying this instrumenter to every method and constructor of a type. */
    public AsmVisitorWrapper asVisitorWrapper() {
        return new AsmVisitorWrapper.ForDeclaredMethods().invokable(any(), this);
    }

    /** Number of branch IDs handed out so far, which is also the next ID. */
    public long instrumentedBranches() {
        return branchCounter.get();
    }

    @Override
    public MethodVisitor wrap(TypeDescription instrumentedType,
                              MethodDescription instrumentedMethod,
                              MethodVisitor methodVisitor,
                              Implementation.Context implementationContext,
                              TypePool typePool,
                              int writerFlags,
                              int readerFlags) {
        return new BranchLoggingMethodVisitor(methodVisitor);
    }

    /** Probe call for a conditional jump opcode, or null for {@code goto}/{@code jsr}. */
    static Probe probeFor(int opcode) {
        return switch (opcode) {
            case Opcodes.IFEQ      -> new Probe("ifeq", INT_PROBE, 1);
            case Opcodes.IFNE      -> new Probe("ifne", INT_PROBE, 1);
            case Opcodes.IFLT      -> new Probe("iflt", INT_PROBE, 1);
            case Opcodes.IFGE      -> new Probe("ifge", INT_PROBE, 1);
            case Opcodes.IFGT      -> new Probe("ifgt", INT_PROBE, 1);
            case Opcodes.IFLE      -> new Probe("ifle", INT_PROBE, 1);
            case Opcodes.IF_ICMPEQ -> new Probe("ifIcmpeq", INT_PAIR_PROBE, 2);
            case Opcodes.IF_ICMPNE -> new Probe("ifIcmpne", INT_PAIR_PROBE, 2);
            case Opcodes.IF_ICMPLT -> new Probe("ifIcmplt", INT_PAIR_PROBE, 2);
            case Opcodes.IF_ICMPGE -> new Probe("ifIcmpge", INT_PAIR_PROBE, 2);
            case Opcodes.IF_ICMPGT -> new Probe("ifIcmpgt", INT_PAIR_PROBE, 2);
            case Opcodes.IF_ICMPLE -> new Probe("ifIcmple", INT_PAIR_PROBE, 2);
            case Opcodes.IF_ACMPEQ -> new Probe("ifAcmpeq", REFERENCE_PAIR_PROBE, 2);
            case Opcodes.IF_ACMPNE -> new Probe("ifAcmpne", REFERENCE_PAIR_PROBE, 2);
            case Opcodes.IFNULL    -> new Probe("ifNull", REFERENCE_PROBE, 1);
            case Opcodes.IFNONNULL -> new Probe("ifNonNull", REFERENCE_PROBE, 1);
            default -> null;
        };
    }

    record Probe(String methodName, String descriptor, int operands) {}

    private final class BranchLoggingMethodVisitor extends MethodVisitor {

        BranchLoggingMethodVisitor(MethodVisitor delegate) {
            super(OpenedClassReader.ASM_API, delegate);
        }

        @Override
        public void visitJumpInsn(int opcode, Label label) {
            Probe probe = probeFor(opcode);
            if (probe != null) {
                super.visitInsn(probe.operands() == 2 ? Opcodes.DUP2 : Opcodes.DUP);
                super.visitLdcInsn(branchCounter.getAndIncrement());
                super.visitMethodInsn(Opcodes.INVOKESTATIC, BranchProbe.INTERNAL_NAME,
                        probe.methodName(), probe.descriptor(), false);
            }
            super.visitJumpInsn(opcode, label);
        }

        @Override
        public void visitMaxs(int maxStack, int maxLocals) {
            super.visitMaxs(maxStack + EXTRA_STACK, maxLocals);
        }
    }
}
