package com.branchfeatures.adapter.report;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.static_analysis.FeatureRecord;
import com.branchfeatures.adapter.static_analysis.RoutineFeatures;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON rendering of the feature report, one document per class file.
 */
public class FeatureJsonSerializer {

    static final String REPORT_VERSION = "0.1";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    public FeatureReportModel.ReportRoot toModel(String source, List<RoutineFeatures> routines) {
        FeatureReportModel.ReportRoot root = new FeatureReportModel.ReportRoot();
        root.reportVersion = REPORT_VERSION;
        root.source = source;
        root.routines = new ArrayList<>();
        for (RoutineFeatures rf : routines) {
            root.routines.add(toRoutine(rf));
        }
        return root;
    }

    public void write(FeatureReportModel.ReportRoot root, Writer out) {
        GSON.toJson(root, out);
        try {
            out.flush();
        } catch (IOException e) {
            throw new SerializerException("Failed to write feature report: " + e.getMessage(), e);
        }
    }

    public void write(FeatureReportModel.ReportRoot root, Path file) {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(root, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    private FeatureReportModel.ReportRoutine toRoutine(RoutineFeatures rf) {
        FeatureReportModel.ReportRoutine routine = new FeatureReportModel.ReportRoutine();
        routine.name = rf.routine().name();
        routine.blocks = new ArrayList<>();
        for (Block block : rf.routine().blocks()) {
            FeatureReportModel.ReportBlock b = new FeatureReportModel.ReportBlock();
            b.label = rf.labels().get(block);
            b.predecessors = new ArrayList<>();
            block.predecessors().forEach(p -> b.predecessors.add(rf.labels().get(p)));
            b.successors = new ArrayList<>();
            block.successors().forEach(s -> b.successors.add(rf.labels().get(s)));
            b.instructions = new ArrayList<>();
            for (Instruction instruction : block.instructions()) {
                b.instructions.add(toInstruction(rf, instruction));
            }
            routine.blocks.add(b);
        }
        return routine;
    }

    private FeatureReportModel.ReportInstruction toInstruction(RoutineFeatures rf, Instruction instruction) {
        FeatureReportModel.ReportInstruction i = new FeatureReportModel.ReportInstruction();
        i.index = instruction.index();
        i.text = instruction.text();
        i.branchId = rf.branchIdOf(instruction);
        i.features = toFeatures(rf.featuresOf(instruction));
        i.dependsOn = new ArrayList<>();
        for (Instruction producer : rf.dependenciesOf(instruction)) {
            i.dependsOn.add(producer.index());
        }
        return i;
    }

    private static FeatureReportModel.ReportFeatures toFeatures(FeatureRecord r) {
        FeatureReportModel.ReportFeatures f = new FeatureReportModel.ReportFeatures();
        f.inLoop = r.inLoop;
        f.distToControlFlow = r.distToControlFlow;
        f.numPredsBb = r.numPredsOfBlock;
        f.numSuccsBb = r.numSuccsOfBlock;
        f.loopDepthBb = r.loopDepth;
        f.opIsMemAccess = r.memoryAccess ? 1 : 0;
        f.opIsRegOperand = r.registerOperand ? 1 : 0;
        f.opIsImmediate = r.immediate ? 1 : 0;
        f.numOperands = r.numOperands;
        return f;
    }
}
