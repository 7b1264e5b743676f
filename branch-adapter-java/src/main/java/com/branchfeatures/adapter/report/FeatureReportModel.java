package com.branchfeatures.adapter.report;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * POJOs of the JSON feature report.
 * Field names use @SerializedName for snake_case keys matching the text report.
 */
public final class FeatureReportModel {

    private FeatureReportModel() {}

    public static class ReportRoot {
        @SerializedName("report_version") public String reportVersion;
        @SerializedName("source")         public String source;
        @SerializedName("routines")       public List<ReportRoutine> routines;
    }

    public static class ReportRoutine {
        @SerializedName("name")   public String name;
        @SerializedName("blocks") public List<ReportBlock> blocks;
    }

    public static class ReportBlock {
        @SerializedName("label")        public String label;
        @SerializedName("predecessors") public List<String> predecessors;
        @SerializedName("successors")   public List<String> successors;
        @SerializedName("instructions") public List<ReportInstruction> instructions;
    }

    public static class ReportInstruction {
        @SerializedName("index")      public int index;
        @SerializedName("text")       public String text;
        @SerializedName("branch_id")  public Long branchId;   // nullable
        @SerializedName("features")   public ReportFeatures features;
        @SerializedName("depends_on") public List<Integer> dependsOn;
    }

    public static class ReportFeatures {
        @SerializedName("in_loop")              public int inLoop;
        @SerializedName("dist_to_control_flow") public int distToControlFlow;
        @SerializedName("num_preds_BB")         public int numPredsBb;
        @SerializedName("num_succs_BB")         public int numSuccsBb;
        @SerializedName("loop_depth_BB")        public int loopDepthBb;
        @SerializedName("op_is_mem_access")     public int opIsMemAccess;
        @SerializedName("op_is_reg_operand")    public int opIsRegOperand;
        @SerializedName("op_is_immediate")      public int opIsImmediate;
        @SerializedName("num_operands")         public int numOperands;
    }
}
