package com.branchfeatures.agent;

/**
 * Closes the branch history log on JVM shutdown.
 * Registered via Runtime.getRuntime().addShutdownHook().
 */
public class ShutdownHook implements Runnable {

    private final BranchLog log;

    public ShutdownHook(BranchLog log) {
        this.log = log;
    }

    @Override
    public void run() {
        try {
            boolean wasOpen = log.isOpen();
            log.close();
            if (wasOpen) {
                System.err.println("[branch-agent] branch history written: " + log.logPath());
            }
        } catch (Exception e) {
            System.err.println("[branch-agent] ERROR closing branch history: " + e.getMessage());
        }
    }
}
