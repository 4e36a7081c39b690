package com.vidnyan.swivel.adapter.out.sandbox;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the command under {@code /bin/sh} with {@code ulimit} ceilings: CPU seconds from the
 * request's budget, a cap on the size of any file the child writes, and no core dumps. The shell {@code exec}s the command, so the child keeps a
 * single process identity.
 */
public class PosixProcessLauncher extends BasicProcessLauncher {

    static final String SHELL = "/bin/sh";

    /**
     * Floor for the file-size ceiling; the JVM itself maps a small perf-data file on start.
     */
    static final long MIN_FILE_SIZE = 4L * 1024 * 1024;

    // ulimit -f counts 512-byte blocks in POSIX sh; shells that count 1024 only make it looser
    private static final long BLOCK_SIZE = 512;

    @Override
    protected List<String> command(LaunchRequest request) {
        long cpuSeconds = Math.max(1, request.cpuBudget().toSeconds());
        List<String> command = new ArrayList<>();
        command.add(SHELL);
        command.add("-c");
        command.add("ulimit -t " + cpuSeconds + "; ulimit -f " + fileBlocks(request)
                + "; ulimit -c 0; exec \"$@\"");
        command.add("sh");
        command.addAll(request.command());
        return command;
    }

    static long fileBlocks(LaunchRequest request) {
        long bytes = Math.max(MIN_FILE_SIZE, 2 * request.outputLimit());
        return (bytes + BLOCK_SIZE - 1) / BLOCK_SIZE;
    }

    @Override
    public boolean enforcesResourceLimits() {
        return true;
    }

    @Override
    public String describe() {
        return "posix launcher (ulimit)";
    }
}
