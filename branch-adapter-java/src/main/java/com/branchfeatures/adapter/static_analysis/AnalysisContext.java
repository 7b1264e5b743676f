package com.branchfeatures.adapter.static_analysis;

import java.util.concurrent.atomic.AtomicLong;

/**
 * State shared by every routine extracted in one run. Owns the BranchID counter, which starts at
 * 0 and is never reset between routines, so re-extracting a routine in the same run yields new IDs.
 */
public class AnalysisContext {

    private final AtomicLong branchIds = new AtomicLong();

    public long nextBranchId() {
        return branchIds.getAndIncrement();
    }

    /** Number of BranchIDs handed out so far. */
    public long assignedBranchIds() {
        return branchIds.get();
    }
}
