package com.vidnyan.swivel.adapter.out.sandbox;

import com.vidnyan.swivel.application.port.out.ProcessLauncher;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Picks the strongest launcher the platform supports.
 */
@Slf4j
public final class ProcessLaunchers {

    private ProcessLaunchers() {
    }

    public static ProcessLauncher forCurrentPlatform() {
        return forPlatform(System.getProperty("os.name", ""), Files.isExecutable(Path.of(PosixProcessLauncher.SHELL)));
    }

    static ProcessLauncher forPlatform(String osName, boolean shellAvailable) {
        if (!osName.toLowerCase().startsWith("windows") && shellAvailable) {
            return new PosixProcessLauncher();
        }
        log.warn("No POSIX shell on {}; the sandbox runs with reduced isolation", osName);
        return new BasicProcessLauncher();
    }
}
