package com.vidnyan.swivel.application.port.in;

import java.util.List;

/**
 * Reports what the validator knows about the UI framework on this machine.
 */
public interface DescribeFrameworkUseCase {

    FrameworkInfo describe();

    /**
     * @param available         whether the Swing runtime can be loaded
     * @param javaVersion       version of the running JDK
     * @param frameworkVersion  version of the {@code java.desktop} module, null when unavailable
     * @param platform          operating system and architecture
     * @param components        catalogue kinds that are neither containers nor layouts
     * @param containers        catalogue container kinds
     * @param layouts           catalogue layout managers
     * @param unresolved        catalogue entries the runtime cannot load
     */
    record FrameworkInfo(
        boolean available,
        String javaVersion,
        String frameworkVersion,
        String platform,
        List<String> components,
        List<String> containers,
        List<String> layouts,
        List<String> unresolved
    ) {
        public FrameworkInfo {
            components = List.copyOf(components);
            containers = List.copyOf(containers);
            layouts = List.copyOf(layouts);
            unresolved = List.copyOf(unresolved);
        }
    }
}
