package com.branchfeatures.adapter.history;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns per-branch outcome sequences into history features: overall taken probability, the
 * taken fraction over the last 4 outcomes, and a geometric summary over the last 2, 4 and 8.
 * A window longer than the history uses the whole history.
 */
public class BranchHistorySummarizer {

    static final int RECENT_WINDOW = 4;
    static final int[] GEOMETRIC_WINDOWS = {2, 4, 8};

    public List<BranchHistorySummary> summarize(Map<Long, List<Boolean>> outcomes) {
        List<BranchHistorySummary> summaries = new ArrayList<>();
        for (Map.Entry<Long, List<Boolean>> entry : outcomes.entrySet()) {
            summaries.add(summarize(entry.getKey(), entry.getValue()));
        }
        return summaries;
    }

    public BranchHistorySummary summarize(long branchId, List<Boolean> outcomes) {
        BranchHistorySummary summary = new BranchHistorySummary();
        summary.branchId = Long.toUnsignedString(branchId);
        summary.events = outcomes.size();
        summary.takenProbability = takenFraction(outcomes, outcomes.size());
        summary.last4Outcomes = takenFraction(outcomes, RECENT_WINDOW);
        summary.geometricSummary = new ArrayList<>();
        for (int window : GEOMETRIC_WINDOWS) {
            summary.geometricSummary.add(takenFraction(outcomes, window));
        }
        return summary;
    }

    static double takenFraction(List<Boolean> outcomes, int window) {
        int n = outcomes.size();
        if (n == 0) return 0.0;
        int length = Math.min(window, n);
        int taken = 0;
        for (Boolean outcome : outcomes.subList(n - length, n)) {
            if (outcome) taken++;
        }
        return (double) taken / length;
    }
}
