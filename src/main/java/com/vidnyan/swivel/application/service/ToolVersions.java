package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.application.port.out.FrameworkRuntime;

/**
 * Versions and platform stamped into every result.
 */
public record ToolVersions(String tool, String java, String framework, String platform) {

    static final String UNKNOWN = "unknown";

    public static ToolVersions detect(FrameworkRuntime runtime) {
        String tool = ToolVersions.class.getPackage().getImplementationVersion();
        return new ToolVersions(
                tool != null ? tool : "dev",
                System.getProperty("java.version", UNKNOWN),
                runtime.isAvailable() ? runtime.version().orElse(UNKNOWN) : null,
                System.getProperty("os.name", UNKNOWN) + " " + System.getProperty("os.arch", ""));
    }
}
