package com.branchfeatures.adapter.static_analysis;

/**
 * Per-instruction feature tuple. All fields start at zero/false.
 */
public class FeatureRecord {
    public int inLoop;
    public int distToControlFlow;
    public int numPredsOfBlock;
    public int numSuccsOfBlock;
    public int loopDepth;
    public boolean memoryAccess;
    public boolean registerOperand;
    public boolean immediate;
    public int numOperands;
}
