package com.branchfeatures.adapter.history;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a branch-history log ({@code <branchId>,<0|1>} per line) into per-branch outcome
 * sequences, keyed by unsigned branch ID in ascending order. Malformed lines are skipped with a
 * warning; blank lines are ignored.
 */
public class BranchHistoryReader {

    public static class HistoryReadException extends RuntimeException {
        public HistoryReadException(String message) { super(message); }
        public HistoryReadException(String message, Throwable cause) { super(message, cause); }
    }

    public Map<Long, List<Boolean>> read(Path log) {
        if (!Files.isRegularFile(log)) {
            throw new HistoryReadException("Branch history log not found: " + log);
        }
        Map<Long, List<Boolean>> outcomes = new TreeMap<>(Long::compareUnsigned);
        try (BufferedReader reader = Files.newBufferedReader(log, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) continue;
                int comma = trimmed.indexOf(',');
                if (comma < 0) {
                    warn(log, lineNumber, line);
                    continue;
                }
                String id = trimmed.substring(0, comma).trim();
                String taken = trimmed.substring(comma + 1).trim();
                long branchId;
                try {
                    branchId = Long.parseUnsignedLong(id);
                } catch (NumberFormatException e) {
                    warn(log, lineNumber, line);
                    continue;
                }
                if (!taken.equals("0") && !taken.equals("1")) {
                    warn(log, lineNumber, line);
                    continue;
                }
                outcomes.computeIfAbsent(branchId, k -> new ArrayList<>()).add(taken.equals("1"));
            }
        } catch (IOException e) {
            throw new HistoryReadException("Failed to read " + log + ": " + e.getMessage(), e);
        }
        return outcomes;
    }

    private static void warn(Path log, int lineNumber, String line) {
        System.err.println("[branch-adapter] Warning: skipping malformed line " + lineNumber
                + " of " + log + ": '" + line + "'");
    }
}
