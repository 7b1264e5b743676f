package com.branchfeatures.adapter.history;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/** History features of one branch. */
public class BranchHistorySummary {
    @SerializedName("branch_id")         public String branchId;
    @SerializedName("events")            public int events;
    @SerializedName("taken_prob")        public double takenProbability;
    @SerializedName("last_4_outcomes")   public double last4Outcomes;
    @SerializedName("geometric_summary") public List<Double> geometricSummary;

    @Override
    public String toString() {
        return "Branch " + branchId + ": [events: " + events
                + ", taken_prob: " + takenProbability
                + ", last_4_outcomes: " + last4Outcomes
                + ", geometric_summary: " + geometricSummary + "]";
    }
}
