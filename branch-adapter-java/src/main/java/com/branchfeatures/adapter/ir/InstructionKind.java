package com.branchfeatures.adapter.ir;

/**
 * Coarse role of an instruction in the control-flow and data-flow graph.
 */
public enum InstructionKind {
    BRANCH,
    SWITCH,
    INDIRECT_BRANCH,
    CALL,
    RETURN,
    LOAD,
    STORE,
    THROW,
    OTHER;

    /** Branch, call, return, indirect branch or switch. */
    public boolean isControlPoint() {
        return this == BRANCH || this == SWITCH || this == INDIRECT_BRANCH
            || this == CALL || this == RETURN;
    }

    public boolean isMemoryAccess() {
        return this == LOAD || this == STORE;
    }
}
