package com.vidnyan.swivel.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Port for spawning the sandboxed child process.
 * Implementations differ in how much isolation the platform lets them enforce.
 */
public interface ProcessLauncher {

    /**
     * Start the command with an empty environment and {@code workingDirectory} as its cwd. Its
     * output is copied to the request's files, at most {@code outputLimit} bytes per stream; the
     * rest is read and discarded.
     * @throws IOException when the process cannot be started
     */
    LaunchedProcess spawn(LaunchRequest request) throws IOException;

    /**
     * Whether the launcher applies OS resource ceilings (CPU time, file size, core dumps) to the child.
     */
    boolean enforcesResourceLimits();

    /**
     * Short human-readable name for logs and metadata.
     */
    String describe();

    /**
     * Launch parameters.
     */
    record LaunchRequest(
        List<String> command,
        Path workingDirectory,
        Path stdout,
        Path stderr,
        Duration cpuBudget,
        long outputLimit
    ) {
        public LaunchRequest {
            command = List.copyOf(command);
            Objects.requireNonNull(workingDirectory, "workingDirectory");
            Objects.requireNonNull(stdout, "stdout");
            Objects.requireNonNull(stderr, "stderr");
            Objects.requireNonNull(cpuBudget, "cpuBudget");
            if (command.isEmpty()) {
                throw new IllegalArgumentException("Empty command");
            }
            if (outputLimit <= 0) {
                throw new IllegalArgumentException("Output limit must be positive: " + outputLimit);
            }
        }
    }

    /**
     * Handle to a running child.
     */
    interface LaunchedProcess {

        /**
         * Wait up to {@code timeout}; true when the process exited in time. Once true, the output
         * files hold everything that was kept.
         */
        boolean waitFor(Duration timeout) throws InterruptedException;

        /**
         * Forcibly stop the process and all of its descendants.
         */
        void terminate();

        /**
         * Exit status; only meaningful after {@link #waitFor} returned true.
         */
        int exitCode();
    }
}
