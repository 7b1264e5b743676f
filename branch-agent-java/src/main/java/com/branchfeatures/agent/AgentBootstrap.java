package com.branchfeatures.agent;

import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;
import java.nio.file.Paths;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the target application JVM via:
 *   java -javaagent:branch-agent-java.jar=program=linear_search,namespace=com.myapp -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   program  : program identity used in the log file name (default: PROGRAM_NAME, then "unknown")
 *   namespace: class name prefix to instrument, e.g. "com.company" (default: "com.")
 *   logdir   : directory holding the branch history logs (default: "branch_history_logs")
 */
public class AgentBootstrap {

    static final String AGENT_PACKAGE = "com.branchfeatures.agent";

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        // Allow ByteBuddy to process Java versions beyond its officially supported range.
        System.setProperty("net.bytebuddy.experimental", "true");

        AgentConfig config = parseArgs(agentArgs);
        BranchLog log = installLog(config);
        System.err.println("[branch-agent] attaching to namespace: " + config.namespace());
        System.err.println("[branch-agent] branch history: " + log.logPath());

        // Register shutdown hook first so the log is closed even if instrumentation fails
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(log)));

        BranchHistoryInstrumenter instrumenter = new BranchHistoryInstrumenter();
        new AgentBuilder.Default()
            // Only the declared methods' code is rewritten; no members are added
            .with(AgentBuilder.TypeStrategy.Default.DECORATE)
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[branch-agent] TRANSFORM ERROR for " + typeName
                        + ": " + throwable);
                }
            })
            // Never instrument the agent itself: the probes would recurse into the log sink.
            .type(
                nameStartsWith(config.namespace())
                    .and(not(nameStartsWith(AGENT_PACKAGE)))
                    .and(not(nameContains("$$Lambda")))
            )
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                builder.visit(instrumenter.asVisitorWrapper())
            )
            .installOn(instrumentation);

        System.err.println("[branch-agent] instrumentation installed");
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static BranchLog installLog(AgentConfig config) {
        BranchLog log = new BranchLog(Paths.get(config.logDirectory()), System::getenv);
        if (config.programName() != null) {
            log.programName(config.programName());
        }
        BranchLog.install(log);
        return log;
    }

    static AgentConfig parseArgs(String agentArgs) {
        String programName = null;
        String namespace = "com.";
        String logDirectory = BranchLog.DEFAULT_DIRECTORY;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    String value = kv[1].trim();
                    switch (kv[0].trim()) {
                        case "program"   -> programName  = value.isEmpty() ? null : value;
                        case "namespace" -> namespace    = value;
                        case "logdir"    -> logDirectory = value;
                        default -> System.err.println("[branch-agent] ignoring unknown agent arg: " + kv[0].trim());
                    }
                }
            }
        }
        return new AgentConfig(programName, namespace, logDirectory);
    }

    record AgentConfig(
        String programName,
        String namespace,
        String logDirectory
    ) {}
}
