package com.branchfeatures.adapter;

import com.branchfeatures.fixture.BinarySearch;
import com.branchfeatures.fixture.LinearSearch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static com.branchfeatures.adapter.RoutineFixtures.classBytes;
import static org.junit.jupiter.api.Assertions.*;

class AdapterMainTest {

    // --- Usage errors ---

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class, () -> AdapterMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"record"}));
    }

    @Test
    void extractRequiresInput() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"extract", "--output", "/tmp/out"}));
    }

    @Test
    void instrumentRequiresOutput() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"instrument", "--input", "/tmp/in"}));
    }

    @Test
    void summarizeRequiresLog() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"summarize", "--format", "json"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        Exception ex = assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"extract", "--input"}));
        assertEquals("--input requires an argument", ex.getMessage());
    }

    @Test
    void badEnumValuesThrowUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"extract", "--input", "x", "--format", "xml"}));
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"extract", "--input", "x", "--propagation", "sideways"}));
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"extract", "--input", "x", "--dependency-order", "random"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"summarize", "--foo", "bar"}));
    }

    // --- Subcommands ---

    @Test
    void extractWritesOneReportPerClass(@TempDir Path tmp) throws Exception {
        Path input = corpus(tmp);
        Path output = tmp.resolve("reports");

        AdapterMain.run(new String[]{"extract", "--input", input.toString(), "--output", output.toString()});

        Path linear = output.resolve("com.branchfeatures.fixture.LinearSearch_control_flow_features.txt");
        Path binary = output.resolve("com.branchfeatures.fixture.BinarySearch_control_flow_features.txt");
        assertTrue(Files.exists(linear));
        assertTrue(Files.exists(binary));

        String report = Files.readString(linear, StandardCharsets.UTF_8);
        assertTrue(report.contains(
                "Control-flow features for function: com.branchfeatures.fixture.LinearSearch.linearSearch([III)Z"));
        assertTrue(report.contains("BranchID: "));
        assertTrue(report.contains("  Depends on:   "));
    }

    @Test
    void branchIdsContinueAcrossClassesInOneRun(@TempDir Path tmp) throws Exception {
        Path input = corpus(tmp);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        AdapterMain.run(new String[]{"extract", "--input", input.toString()},
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String report = buffer.toString(StandardCharsets.UTF_8);
        // BinarySearch (3 in binarySearch, 1 in main) is read first, so LinearSearch starts at 4
        int linearStart = report.indexOf("com.branchfeatures.fixture.LinearSearch.linearSearch");
        assertTrue(linearStart > 0);
        assertTrue(report.indexOf("BranchID: 4   ", linearStart) > 0);
        assertTrue(report.indexOf("BranchID: 0   ") < linearStart);
    }

    @Test
    void extractAsJson(@TempDir Path tmp) throws Exception {
        Path input = corpus(tmp);
        Path output = tmp.resolve("reports");

        AdapterMain.run(new String[]{"extract", "--input", input.toString(), "--output", output.toString(),
                "--format", "json", "--dependency-order", "unordered", "--propagation", "bidirectional"});

        Path json = output.resolve("com.branchfeatures.fixture.LinearSearch_control_flow_features.json");
        String content = Files.readString(json, StandardCharsets.UTF_8);
        assertTrue(content.contains("\"source\": \"com.branchfeatures.fixture.LinearSearch\""));
    }

    @Test
    void instrumentWritesClassesUnderPackagePath(@TempDir Path tmp) throws Exception {
        Path input = corpus(tmp);
        Path output = tmp.resolve("instrumented");

        AdapterMain.run(new String[]{"instrument", "--input", input.toString(), "--output", output.toString()});

        Path rewritten = output.resolve("com/branchfeatures/fixture/LinearSearch.class");
        assertTrue(Files.exists(rewritten));
        byte[] bytes = Files.readAllBytes(rewritten);
        assertFalse(Arrays.equals(classBytes(LinearSearch.class), bytes));
        assertTrue(new String(bytes, StandardCharsets.ISO_8859_1).contains("com/branchfeatures/agent/BranchProbe"));
    }

    @Test
    void summarizePrintsOneLinePerBranch(@TempDir Path tmp) throws Exception {
        Path log = tmp.resolve("prog_branch_history.log");
        Files.writeString(log, "0,1\n1,0\n0,0\n0,1\n");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        AdapterMain.run(new String[]{"summarize", "--log", log.toString()},
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("Branch 0: [events: 3, "));
        assertTrue(lines[1].startsWith("Branch 1: [events: 1, taken_prob: 0.0"));
    }

    @Test
    void summarizeAsJson(@TempDir Path tmp) throws Exception {
        Path log = tmp.resolve("prog_branch_history.log");
        Files.writeString(log, "5,1\n5,1\n");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        AdapterMain.run(new String[]{"summarize", "--log", log.toString(), "--format", "json"},
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String json = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\"branch_id\": \"5\""));
        assertTrue(json.contains("\"geometric_summary\""));
    }

    private static Path corpus(Path tmp) throws Exception {
        Path root = tmp.resolve("classes");
        Path pkg = Files.createDirectories(root.resolve("com/branchfeatures/fixture"));
        Files.write(pkg.resolve("LinearSearch.class"), classBytes(LinearSearch.class));
        Files.write(pkg.resolve("BinarySearch.class"), classBytes(BinarySearch.class));
        return root;
    }
}
