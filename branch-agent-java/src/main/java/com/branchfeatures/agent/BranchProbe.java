package com.branchfeatures.agent;

/**
 * Static probes invoked by instrumented bytecode immediately before a conditional jump.
 *
 * Each probe receives a copy of the operand(s) the jump is about to compare plus the branch ID,
 * evaluates the same comparison the jump will evaluate, and forwards the outcome
 * (true = jump taken) to {@link BranchLog#logBranchOutcome(long, boolean)}.
 *
 * Method names and descriptors are referenced from {@link BranchHistoryInstrumenter}; they
 * must stay public static for the injected call sites to link.
 */
public final class BranchProbe {

    static final String INTERNAL_NAME = "com/branchfeatures/agent/BranchProbe";

    private BranchProbe() {}

    // -----------------------------------------------------------------------
    // Single int operand (IFEQ .. IFLE)
    // -----------------------------------------------------------------------

    public static void ifeq(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value == 0);
    }

    public static void ifne(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value != 0);
    }

    public static void iflt(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value < 0);
    }

    public static void ifge(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value >= 0);
    }

    public static void ifgt(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value > 0);
    }

    public static void ifle(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value <= 0);
    }

    // -----------------------------------------------------------------------
    // Two int operands (IF_ICMPEQ .. IF_ICMPLE)
    // -----------------------------------------------------------------------

    public static void ifIcmpeq(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left == right);
    }

    public static void ifIcmpne(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left != right);
    }

    public static void ifIcmplt(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left < right);
    }

    public static void ifIcmpge(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left >= right);
    }

    public static void ifIcmpgt(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left > right);
    }

    public static void ifIcmple(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left <= right);
    }

    // -----------------------------------------------------------------------
    // References (IF_ACMPEQ, IF_ACMPNE, IFNULL, IFNONNULL)
    // -----------------------------------------------------------------------

    public static void ifAcmpeq(Object left, Object right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left == right);
    }

    public static void ifAcmpne(Object left, Object right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left != right);
    }

    public static void ifNull(Object value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value == null);
    }

    public static void ifNonNull(Object value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value != null);
    }
}
