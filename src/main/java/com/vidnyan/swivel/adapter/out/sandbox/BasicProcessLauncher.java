package com.vidnyan.swivel.adapter.out.sandbox;

import com.vidnyan.swivel.application.port.out.ProcessLauncher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Launches the command directly with {@link ProcessBuilder}: empty environment, scratch working
 * directory, stdin closed. Output is drained from pipes into the request's files up to the
 * request's limit and discarded past it, so a flooding child cannot fill the disk. No OS resource
 * ceilings.
 */
@Slf4j
public class BasicProcessLauncher implements ProcessLauncher {

    private static final Duration REAP_TIMEOUT = Duration.ofSeconds(5);
    private static final int BUFFER_SIZE = 8192;

    @Override
    public LaunchedProcess spawn(LaunchRequest request) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command(request));
        builder.environment().clear();
        builder.directory(request.workingDirectory().toFile());

        Process process = builder.start();
        process.getOutputStream().close();
        Thread stdout = drain(process.getInputStream(), request.stdout(), request.outputLimit(), process.pid(), "out");
        Thread stderr = drain(process.getErrorStream(), request.stderr(), request.outputLimit(), process.pid(), "err");
        log.debug("Started sandbox process {} in {}", process.pid(), request.workingDirectory());
        return new JdkProcess(process, stdout, stderr);
    }

    /**
     * Command line actually executed for a request.
     */
    protected List<String> command(LaunchRequest request) {
        return request.command();
    }

    @Override
    public boolean enforcesResourceLimits() {
        return false;
    }

    @Override
    public String describe() {
        return "basic launcher";
    }

    private static Thread drain(InputStream source, Path target, long limit, long pid, String stream) {
        Thread thread = new Thread(() -> {
            try (InputStream in = source; OutputStream out = Files.newOutputStream(target)) {
                copyBounded(in, out, limit);
            } catch (IOException e) {
                log.debug("Std{} of sandbox process {} closed: {}", stream, pid, e.getMessage());
            }
        }, "sandbox-" + pid + "-" + stream);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Copy {@code in} to {@code out} until end of stream, writing at most {@code limit} bytes and
     * reading past it without keeping anything.
     * @return bytes written
     */
    static long copyBounded(InputStream in, OutputStream out, long limit) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long written = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            if (written < limit) {
                int keep = (int) Math.min(read, limit - written);
                out.write(buffer, 0, keep);
                written += keep;
            }
        }
        out.flush();
        return written;
    }

    /**
     * {@link Process} behind the launcher port.
     */
    static final class JdkProcess implements LaunchedProcess {

        private final Process process;
        private final Thread stdout;
        private final Thread stderr;

        JdkProcess(Process process, Thread stdout, Thread stderr) {
            this.process = process;
            this.stdout = stdout;
            this.stderr = stderr;
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return false;
            }
            awaitDrains();
            return true;
        }

        @Override
        public void terminate() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            try {
                // reap so the output files are released before the work dir is deleted
                if (!process.waitFor(REAP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Sandbox process {} did not exit after forcible termination", process.pid());
                }
                awaitDrains();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while reaping sandbox process {}", process.pid());
            }
        }

        @Override
        public int exitCode() {
            return process.exitValue();
        }

        // a descendant that inherited the pipes can keep them open; do not wait for it forever
        private void awaitDrains() throws InterruptedException {
            stdout.join(REAP_TIMEOUT.toMillis());
            stderr.join(REAP_TIMEOUT.toMillis());
            if (stdout.isAlive() || stderr.isAlive()) {
                log.warn("Output of sandbox process {} still open after exit", process.pid());
            }
        }
    }
}
