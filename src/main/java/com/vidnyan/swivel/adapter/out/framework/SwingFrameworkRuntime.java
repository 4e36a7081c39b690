package com.vidnyan.swivel.adapter.out.framework;

import com.vidnyan.swivel.application.port.out.FrameworkRuntime;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Swing as installed in the running JDK ({@code java.desktop} module).
 * Classes are looked up reflectively and never initialized, so nothing here needs a display.
 */
@Slf4j
public class SwingFrameworkRuntime implements FrameworkRuntime {

    static final String MODULE = "java.desktop";

    private final ClassLoader loader;
    private final Class<?> componentType;
    private final Class<?> layoutManagerType;
    private final boolean available;

    public SwingFrameworkRuntime() {
        this(SwingFrameworkRuntime.class.getClassLoader());
    }

    public SwingFrameworkRuntime(ClassLoader loader) {
        this.loader = loader;
        this.componentType = find("java.awt.Component", loader).orElse(null);
        this.layoutManagerType = find("java.awt.LayoutManager", loader).orElse(null);
        this.available = componentType != null && layoutManagerType != null
                && find("javax.swing.JComponent", loader).isPresent();
        if (!available) {
            log.warn("Swing classes are not loadable; structural validation will be skipped");
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public Optional<String> version() {
        return ModuleLayer.boot().findModule(MODULE)
                .flatMap(module -> module.getDescriptor().rawVersion());
    }

    @Override
    public Optional<Class<?>> loadClass(String qualifiedName) {
        return find(qualifiedName, loader);
    }

    private static Optional<Class<?>> find(String qualifiedName, ClassLoader loader) {
        try {
            return Optional.of(Class.forName(qualifiedName, false, loader));
        } catch (ClassNotFoundException | LinkageError e) {
            log.trace("Cannot load {}: {}", qualifiedName, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public boolean isComponent(Class<?> type) {
        return componentType != null && componentType.isAssignableFrom(type);
    }

    @Override
    public boolean isLayoutManager(Class<?> type) {
        return layoutManagerType != null && layoutManagerType.isAssignableFrom(type);
    }
}
