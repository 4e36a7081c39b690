package com.vidnyan.swivel.application.validation;

import com.vidnyan.swivel.application.port.out.ProcessLauncher;
import com.vidnyan.swivel.application.port.out.ProcessLauncher.LaunchRequest;
import com.vidnyan.swivel.application.port.out.ProcessLauncher.LaunchedProcess;
import com.vidnyan.swivel.domain.exception.SandboxException;
import com.vidnyan.swivel.domain.model.ErrorCodes;
import com.vidnyan.swivel.domain.model.Severity;
import com.vidnyan.swivel.domain.model.TierReport;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationLevel;
import com.vidnyan.swivel.domain.source.ParsedSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * L4: runs the candidate in a child JVM through the JDK source launcher, headless, with an empty
 * environment and a scratch working directory, under a wall-clock limit.
 * <p>
 * Program faults (compile errors, uncaught exceptions, timeouts) are findings. Failing to prepare,
 * start or observe the child is an infrastructure fault and surfaces as {@link SandboxException}.
 */
@Slf4j
public class SandboxExecutor {

    private static final int MAX_FAULT_TEXT = 200;
    private static final Duration MIN_CPU_BUDGET = Duration.ofSeconds(30);
    private static final Pattern UNCAUGHT = Pattern.compile(
            "Exception in thread \"([^\"]*)\" ([\\w.$]+)(?::\\s*([^\\r\\n]*))?");
    private static final String HEADLESS = "java.awt.HeadlessException";

    /**
     * @param defaultTimeout  wall-clock limit when the caller gives none
     * @param maxHeap         value for {@code -Xmx}
     * @param captureLimit    bytes of stdout/stderr kept per stream; the child's output beyond it is discarded
     * @param javaExecutable  the {@code java} launcher to run
     */
    public record Settings(Duration defaultTimeout, String maxHeap, int captureLimit, Path javaExecutable) {

        public Settings {
            Objects.requireNonNull(defaultTimeout, "defaultTimeout");
            Objects.requireNonNull(maxHeap, "maxHeap");
            Objects.requireNonNull(javaExecutable, "javaExecutable");
            if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
                throw new IllegalArgumentException("Sandbox timeout must be positive: " + defaultTimeout);
            }
            if (captureLimit <= 0) {
                throw new IllegalArgumentException("Capture limit must be positive: " + captureLimit);
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(10), "256m", 64 * 1024, currentJava());
        }

        /**
         * The launcher of the JDK running this process.
         */
        public static Path currentJava() {
            String executable = System.getProperty("os.name", "").toLowerCase().startsWith("windows")
                    ? "java.exe" : "java";
            return Path.of(System.getProperty("java.home"), "bin", executable);
        }
    }

    private final ProcessLauncher launcher;
    private final Settings settings;

    public SandboxExecutor(ProcessLauncher launcher, Settings settings) {
        this.launcher = launcher;
        this.settings = settings;
    }

    public SandboxExecutor(ProcessLauncher launcher) {
        this(launcher, Settings.defaults());
    }

    public ProcessLauncher launcher() {
        return launcher;
    }

    /**
     * Run the program and classify how it ended.
     * @param timeout wall-clock limit, or null for the configured default
     * @throws SandboxException when the child cannot be prepared, started or observed
     */
    public TierReport execute(ParsedSource source, Duration timeout) {
        List<String> notes = new ArrayList<>();
        if (!launcher.enforcesResourceLimits()) {
            notes.add("reduced isolation: " + launcher.describe() + " cannot enforce resource limits");
        }
        if (!source.hasEntryPoint()) {
            return TierReport.of(ValidationLevel.SANDBOX, List.of(ValidationError.builder()
                    .code(ErrorCodes.NO_ENTRY_POINT)
                    .severity(Severity.WARNING)
                    .message("No 'public static void main(String[] args)' in " + source.primaryTypeName()
                            + "; the program was not executed")
                    .fixSuggestion("Add a main method to the first top-level class")
                    .llmAction("Add 'public static void main(String[] args)' to " + source.primaryTypeName()
                            + " that builds the UI and returns")
                    .build()), notes);
        }

        Duration limit = timeout != null ? timeout : settings.defaultTimeout();
        Path workDir = createWorkDir();
        try {
            String fileName = source.primaryTypeName() + ".java";
            Files.writeString(workDir.resolve(fileName), source.text(), StandardCharsets.UTF_8);
            Path stdout = workDir.resolve("stdout.log");
            Path stderr = workDir.resolve("stderr.log");
            LaunchRequest request = new LaunchRequest(command(fileName), workDir, stdout, stderr,
                    cpuBudget(limit), settings.captureLimit());

            log.debug("L4 launching {} via {} (timeout {})", fileName, launcher.describe(), limit);
            LaunchedProcess process = launcher.spawn(request);
            if (!awaitExit(process, limit)) {
                process.terminate();
                log.info("L4 timed out after {}", limit);
                return TierReport.of(ValidationLevel.SANDBOX, List.of(timedOut(limit)), notes);
            }
            int exitCode = process.exitCode();
            String errors = capture(stderr);
            log.debug("L4 exited with {} ({} bytes of stderr)", exitCode, errors.length());
            return TierReport.of(ValidationLevel.SANDBOX, classify(exitCode, errors, fileName), notes);
        } catch (IOException e) {
            throw new SandboxException("Sandbox I/O failed: " + e.getMessage(), e);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private List<String> command(String fileName) {
        return List.of(
                settings.javaExecutable().toString(),
                "-Djava.awt.headless=true",
                "-Xmx" + settings.maxHeap(),
                "-Dfile.encoding=UTF-8",
                fileName);
    }

    private static Duration cpuBudget(Duration limit) {
        Duration scaled = limit.multipliedBy(4);
        return scaled.compareTo(MIN_CPU_BUDGET) > 0 ? scaled : MIN_CPU_BUDGET;
    }

    private static boolean awaitExit(LaunchedProcess process, Duration limit) {
        try {
            return process.waitFor(limit);
        } catch (InterruptedException e) {
            process.terminate();
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while waiting for the sandboxed program", e);
        }
    }

    /**
     * Turn the exit status and captured stderr into findings.
     */
    List<ValidationError> classify(int exitCode, String stderr, String fileName) {
        Pattern compileError = Pattern.compile("^" + Pattern.quote(fileName) + ":(\\d+): error: (.*)$", Pattern.MULTILINE);
        Matcher compile = compileError.matcher(stderr);
        if (compile.find()) {
            int line = Integer.parseInt(compile.group(1));
            String detail = truncate(stderr.substring(compile.start()));
            return List.of(ValidationError.builder()
                    .code(ErrorCodes.SANDBOX_RUNTIME)
                    .message("Compilation failed at line " + line + ": " + detail)
                    .line(line)
                    .fixSuggestion("Fix the compile error: " + compile.group(2))
                    .llmAction("Fix the compile error on line " + line + ": " + compile.group(2))
                    .context(Map.of("phase", "compile"))
                    .build());
        }

        Matcher uncaught = UNCAUGHT.matcher(stderr);
        List<ValidationError> faults = new ArrayList<>();
        boolean headless = false;
        while (uncaught.find()) {
            String exception = uncaught.group(2);
            if (exception.equals(HEADLESS)) {
                headless = true;
                continue;
            }
            if (faults.isEmpty()) {
                faults.add(uncaughtException(uncaught, stderr, fileName));
            }
        }
        if (!faults.isEmpty()) {
            return faults;
        }
        if (headless) {
            return List.of(ValidationError.builder()
                    .code(ErrorCodes.HEADLESS_DISPLAY)
                    .severity(Severity.WARNING)
                    .message("The program needs a display: java.awt.HeadlessException in the headless sandbox")
                    .fixSuggestion("Build the component tree in main without showing windows, or guard setVisible with GraphicsEnvironment.isHeadless()")
                    .llmAction("Avoid showing windows when GraphicsEnvironment.isHeadless() is true")
                    .build());
        }
        if (exitCode != 0) {
            String detail = stderr.isBlank() ? "no diagnostic output" : truncate(stderr.strip());
            return List.of(ValidationError.builder()
                    .code(ErrorCodes.SANDBOX_RUNTIME)
                    .message("Program exited with status " + exitCode + ": " + detail)
                    .fixSuggestion("Make main complete normally")
                    .llmAction("Fix the runtime error so the program exits with status 0: " + detail)
                    .context(Map.of("phase", "run", "exit_code", Integer.toString(exitCode)))
                    .build());
        }
        return List.of();
    }

    private ValidationError uncaughtException(Matcher uncaught, String stderr, String fileName) {
        String thread = uncaught.group(1);
        String exception = uncaught.group(2);
        Matcher frame = Pattern.compile("\\(" + Pattern.quote(fileName) + ":(\\d+)\\)").matcher(stderr);
        Integer line = frame.find(uncaught.end()) ? Integer.valueOf(frame.group(1)) : null;
        String detail = truncate(stderr.substring(uncaught.start()));
        String where = line == null ? "" : " at line " + line;
        return ValidationError.builder()
                .code(ErrorCodes.SANDBOX_RUNTIME)
                .message("Uncaught " + exception + " in thread '" + thread + "'" + where + ": " + detail)
                .line(line)
                .fixSuggestion("Handle or prevent the " + simpleName(exception) + where)
                .llmAction("Fix the " + simpleName(exception) + " thrown" + where + " in thread '" + thread + "'")
                .context(Map.of("phase", "run", "exception", exception, "thread", thread))
                .build();
    }

    private static ValidationError timedOut(Duration limit) {
        return ValidationError.builder()
                .code(ErrorCodes.SANDBOX_TIMEOUT)
                .message("Execution timed out after " + limit.toMillis() + "ms; possible infinite loop or a program that never returns")
                .fixSuggestion("Let main return once the UI is built; stop timers and background threads")
                .llmAction("Check for infinite loops and make sure no timer or thread keeps the program alive")
                .context(Map.of("timeout_ms", Long.toString(limit.toMillis())))
                .build();
    }

    private String capture(Path file) throws IOException {
        if (!Files.exists(file)) {
            return "";
        }
        try (InputStream in = Files.newInputStream(file)) {
            return new String(in.readNBytes(settings.captureLimit()), StandardCharsets.UTF_8);
        }
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("swivel-sandbox-");
        } catch (IOException e) {
            throw new SandboxException("Could not create sandbox directory: " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete sandbox file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up sandbox directory {}: {}", dir, e.getMessage());
        }
    }

    private static String truncate(String text) {
        String flat = text.strip();
        return flat.length() > MAX_FAULT_TEXT ? flat.substring(0, MAX_FAULT_TEXT) : flat;
    }

    private static String simpleName(String qualified) {
        return qualified.substring(qualified.lastIndexOf('.') + 1);
    }
}
