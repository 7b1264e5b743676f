package com.branchfeatures.agent;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.function.Function;

/**
 * Append target for branch-outcome events.
 *
 * One instance is installed process-wide and reached by instrumented code through the static
 * {@link #logBranchOutcome(long, boolean)} hook. Each instance owns one output stream, opened
 * lazily on the first event at {@code <directory>/<program>_branch_history.log} and truncated
 * at that moment. Events arriving after {@link #close()} reopen the same file for append.
 * Every event is written as {@code <branchId>,<0|1>} and flushed immediately.
 *
 * Program identity resolution order: {@link #setProgramName(String)}, then the
 * {@code PROGRAM_NAME} environment variable, then {@code "unknown"}.
 *
 * Failures never propagate into the instrumented program: a missing directory only warns,
 * and a file that fails to open drops the event and is retried on the next one.
 */
public final class BranchLog {

    public static final String DEFAULT_DIRECTORY = "branch_history_logs";
    public static final String PROGRAM_NAME_ENV = "PROGRAM_NAME";
    public static final String UNKNOWN_PROGRAM = "unknown";
    static final String FILE_SUFFIX = "_branch_history.log";
    static final String PROBE_FILE = ".test";

    private static final Object INSTALL_LOCK = new Object();
    private static volatile BranchLog installed;

    private final Path directory;
    private final Function<String, String> environment;

    // Guarded by this
    private String programName;
    private Writer out;
    private Path openedPath;
    private Path truncatedPath;

    public BranchLog(Path directory, Function<String, String> environment) {
        this.directory = directory;
        this.environment = environment;
    }

    /** Sink writing under {@code branch_history_logs/} of the working directory. */
    public static BranchLog withDefaults() {
        return new BranchLog(Paths.get(DEFAULT_DIRECTORY), System::getenv);
    }

    // -----------------------------------------------------------------------
    // Process-wide hook (called from instrumented bytecode)
    // -----------------------------------------------------------------------

    public static void logBranchOutcome(long branchId, boolean taken) {
        try {
            global().log(branchId, taken);
        } catch (RuntimeException e) {
            System.err.println("[branch-agent] ERROR logging branch " + Long.toUnsignedString(branchId)
                + ": " + e);
        }
    }

    /** Explicit program identity; takes precedence over {@code PROGRAM_NAME}. */
    public static void setProgramName(String name) {
        global().programName(name);
    }

    public static BranchLog global() {
        BranchLog log = installed;
        if (log == null) {
            synchronized (INSTALL_LOCK) {
                log = installed;
                if (log == null) {
                    log = withDefaults();
                    installed = log;
                }
            }
        }
        return log;
    }

    /** Replaces the process-wide sink, closing the previous one. */
    public static void install(BranchLog log) {
        BranchLog previous;
        synchronized (INSTALL_LOCK) {
            previous = installed;
            installed = log;
        }
        if (previous != null && previous != log) {
            previous.close();
        }
    }

    /** Closes and forgets the process-wide sink; the next event creates a fresh one. */
    public static void reset() {
        install(null);
    }

    // -----------------------------------------------------------------------
    // Instance API
    // -----------------------------------------------------------------------

    public synchronized void programName(String name) {
        this.programName = name;
    }

    public synchronized void log(long branchId, boolean taken) {
        if (out == null && !open()) {
            return;
        }
        try {
            out.write(Long.toUnsignedString(branchId) + "," + (taken ? 1 : 0) + "\n");
            out.flush();
        } catch (IOException e) {
            System.err.println("[branch-agent] ERROR writing " + openedPath + ": " + e.getMessage());
        }
    }

    public synchronized void close() {
        if (out == null) return;
        try {
            out.close();
        } catch (IOException e) {
            System.err.println("[branch-agent] ERROR closing " + openedPath + ": " + e.getMessage());
        } finally {
            out = null;
        }
    }

    /** Path the sink writes to, resolved with the current program identity. */
    public synchronized Path logPath() {
        return directory.resolve(resolveProgramName() + FILE_SUFFIX);
    }

    synchronized boolean isOpen() {
        return out != null;
    }

    private boolean open() {
        Path logPath = logPath();
        probeDirectory();
        try {
            if (logPath.equals(truncatedPath)) {
                out = Files.newBufferedWriter(logPath, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                out = Files.newBufferedWriter(logPath, StandardCharsets.UTF_8);
                truncatedPath = logPath;
            }
            openedPath = logPath;
            return true;
        } catch (IOException e) {
            System.err.println("[branch-agent] Failed to open " + logPath + ": " + e.getMessage());
            return false;
        }
    }

    private String resolveProgramName() {
        if (programName != null) return programName;
        String fromEnv = environment.apply(PROGRAM_NAME_ENV);
        return fromEnv != null ? fromEnv : UNKNOWN_PROGRAM;
    }

    // Create and delete a throwaway file; never creates the directory itself.
    private void probeDirectory() {
        Path probe = directory.resolve(PROBE_FILE);
        try {
            Files.newOutputStream(probe).close();
            Files.deleteIfExists(probe);
        } catch (IOException e) {
            System.err.println("[branch-agent] Warning: " + directory + " directory may not exist");
        }
    }
}
