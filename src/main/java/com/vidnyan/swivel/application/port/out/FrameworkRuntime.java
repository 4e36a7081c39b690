package com.vidnyan.swivel.application.port.out;

import java.util.Optional;

/**
 * Port onto the UI framework as installed in the running JDK.
 * L3 resolves declared component types through it and is skipped when it is unavailable.
 */
public interface FrameworkRuntime {

    boolean isAvailable();

    /**
     * Version of the framework module, if it can be determined.
     */
    Optional<String> version();

    /**
     * Load a class by qualified name without initializing it.
     */
    Optional<Class<?>> loadClass(String qualifiedName);

    /**
     * True when the class is a component that can be placed in a container.
     */
    boolean isComponent(Class<?> type);

    boolean isLayoutManager(Class<?> type);
}
