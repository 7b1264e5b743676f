package com.branchfeatures.adapter;

import com.branchfeatures.adapter.bytecode.ClassFileLoader;
import com.branchfeatures.adapter.bytecode.ClassFileLoader.ClassFileEntry;
import com.branchfeatures.adapter.bytecode.RoutineBuilder;
import com.branchfeatures.adapter.history.BranchHistoryReader;
import com.branchfeatures.adapter.history.BranchHistorySummarizer;
import com.branchfeatures.adapter.history.BranchHistorySummary;
import com.branchfeatures.adapter.ir.Routine;
import com.branchfeatures.adapter.report.FeatureJsonSerializer;
import com.branchfeatures.adapter.report.FeatureReportWriter;
import com.branchfeatures.adapter.static_analysis.AnalysisContext;
import com.branchfeatures.adapter.static_analysis.ControlFlowExtractor;
import com.branchfeatures.adapter.static_analysis.ExtractorOptions;
import com.branchfeatures.adapter.static_analysis.ExtractorOptions.DependencyOrder;
import com.branchfeatures.adapter.static_analysis.ExtractorOptions.PropagationMode;
import com.branchfeatures.adapter.static_analysis.RoutineFeatures;
import com.branchfeatures.agent.BranchHistoryInstrumenter;
import com.branchfeatures.agent.ClassInstrumenter;
import com.google.gson.GsonBuilder;
import org.objectweb.asm.tree.ClassNode;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the branch-adapter-java command line.
 *
 * Usage:
 *   java -jar branch-adapter-java.jar extract --input <class|dir|jar> [--output <dir>]
 *       [--format text|json] [--propagation backward|bidirectional] [--dependency-order program|unordered]
 *   java -jar branch-adapter-java.jar instrument --input <class|dir|jar> --output <dir>
 *   java -jar branch-adapter-java.jar summarize --log <file> [--format text|json]
 */
public class AdapterMain {

    static final String REPORT_SUFFIX = "_control_flow_features";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[branch-adapter] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar branch-adapter-java.jar extract --input <path> [--output <dir>]"
                    + " [--format text|json] [--propagation backward|bidirectional]"
                    + " [--dependency-order program|unordered]");
            System.err.println("       java -jar branch-adapter-java.jar instrument --input <path> --output <dir>");
            System.err.println("       java -jar branch-adapter-java.jar summarize --log <file> [--format text|json]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[branch-adapter] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        run(args, System.out);
    }

    static void run(String[] args, PrintStream stdout) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        switch (args[0]) {
            case "extract" -> extract(args, stdout);
            case "instrument" -> instrument(args);
            case "summarize" -> summarize(args, stdout);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    // -----------------------------------------------------------------------
    // extract
    // -----------------------------------------------------------------------

    private static void extract(String[] args, PrintStream stdout) {
        String input = null;
        String outputDir = null;
        String format = "text";
        PropagationMode propagation = PropagationMode.BACKWARD;
        DependencyOrder dependencyOrder = DependencyOrder.PROGRAM_ORDER;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"  -> input     = requireNext(args, i++, "--input");
                case "--output" -> outputDir = requireNext(args, i++, "--output");
                case "--format" -> format    = requireFormat(requireNext(args, i++, "--format"));
                case "--propagation" -> propagation = switch (requireNext(args, i++, "--propagation")) {
                    case "backward" -> PropagationMode.BACKWARD;
                    case "bidirectional" -> PropagationMode.BIDIRECTIONAL;
                    default -> throw new UsageException("--propagation must be backward or bidirectional");
                };
                case "--dependency-order" -> dependencyOrder = switch (requireNext(args, i++, "--dependency-order")) {
                    case "program" -> DependencyOrder.PROGRAM_ORDER;
                    case "unordered" -> DependencyOrder.UNORDERED;
                    default -> throw new UsageException("--dependency-order must be program or unordered");
                };
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (input == null) throw new UsageException("--input is required");

        ClassFileLoader loader = new ClassFileLoader();
        System.err.println("[branch-adapter] Reading class files: " + input);
        List<ClassFileEntry> entries = loader.load(Paths.get(input));

        Path output = outputDir == null ? null : Paths.get(outputDir);
        if (output != null) {
            createDirectories(output);
        }

        AnalysisContext context = new AnalysisContext();
        ControlFlowExtractor extractor = new ControlFlowExtractor(
                context, new ExtractorOptions(propagation, dependencyOrder), System.err);
        RoutineBuilder builder = new RoutineBuilder();
        FeatureJsonSerializer json = new FeatureJsonSerializer();
        int routineCount = 0;

        for (ClassFileEntry entry : entries) {
            ClassNode classNode;
            try {
                classNode = loader.parse(entry);
            } catch (RuntimeException e) {
                System.err.println("[branch-adapter] Warning: skipping " + entry.relativePath() + ": " + e);
                continue;
            }
            List<RoutineFeatures> results = new ArrayList<>();
            for (Routine routine : builder.build(classNode)) {
                results.add(extractor.extract(routine));
            }
            routineCount += results.size();

            if (output == null) {
                Writer out = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
                if (format.equals("json")) {
                    json.write(json.toModel(entry.typeName(), results), out);
                    stdout.println();
                } else {
                    FeatureReportWriter writer = new FeatureReportWriter(out);
                    results.forEach(writer::write);
                }
                continue;
            }

            Path file = output.resolve(entry.typeName() + REPORT_SUFFIX + (format.equals("json") ? ".json" : ".txt"));
            if (format.equals("json")) {
                json.write(json.toModel(entry.typeName(), results), file);
            } else {
                try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                    FeatureReportWriter writer = new FeatureReportWriter(w);
                    results.forEach(writer::write);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to write " + file, e);
                }
            }
            System.err.println("[branch-adapter] Report written: " + file);
        }

        System.err.println("[branch-adapter] Extraction complete: " + entries.size() + " classes, "
                + routineCount + " routines, " + context.assignedBranchIds() + " conditional branches");
    }

    // -----------------------------------------------------------------------
    // instrument
    // -----------------------------------------------------------------------

    private static void instrument(String[] args) {
        String input = null;
        String outputDir = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"  -> input     = requireNext(args, i++, "--input");
                case "--output" -> outputDir = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (input == null)     throw new UsageException("--input is required");
        if (outputDir == null) throw new UsageException("--output is required");

        System.err.println("[branch-adapter] Reading class files: " + input);
        List<ClassFileEntry> entries = new ClassFileLoader().load(Paths.get(input));
        Map<String, byte[]> corpus = new LinkedHashMap<>();
        entries.forEach(e -> corpus.put(e.typeName(), e.bytes()));

        Path output = Paths.get(outputDir);
        ClassInstrumenter instrumenter = new ClassInstrumenter(new BranchHistoryInstrumenter(), corpus);
        int written = 0;
        for (ClassFileEntry entry : entries) {
            byte[] instrumented;
            try {
                instrumented = instrumenter.instrument(entry.typeName(), entry.bytes());
            } catch (ClassInstrumenter.InstrumentationException e) {
                System.err.println("[branch-adapter] Warning: " + e.getMessage());
                continue;
            }
            Path target = output.resolve(entry.typeName().replace('.', '/') + ".class");
            createDirectories(target.getParent());
            try {
                Files.write(target, instrumented);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + target, e);
            }
            written++;
        }
        System.err.println("[branch-adapter] Instrumented " + written + " of " + entries.size()
                + " classes, " + instrumenter.instrumenter().instrumentedBranches() + " conditional branches");
    }

    // -----------------------------------------------------------------------
    // summarize
    // -----------------------------------------------------------------------

    private static void summarize(String[] args, PrintStream stdout) {
        String log = null;
        String format = "text";
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--log"    -> log    = requireNext(args, i++, "--log");
                case "--format" -> format = requireFormat(requireNext(args, i++, "--format"));
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (log == null) throw new UsageException("--log is required");

        Map<Long, List<Boolean>> outcomes = new BranchHistoryReader().read(Paths.get(log));
        List<BranchHistorySummary> summaries = new BranchHistorySummarizer().summarize(outcomes);
        if (format.equals("json")) {
            stdout.println(new GsonBuilder().setPrettyPrinting().create().toJson(summaries));
        } else {
            summaries.forEach(stdout::println);
        }
        stdout.flush();
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static String requireFormat(String format) {
        if (!format.equals("text") && !format.equals("json")) {
            throw new UsageException("--format must be text or json");
        }
        return format;
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create output directory: " + dir, e);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
