package com.vidnyan.swivel.domain.policy;

import java.util.List;
import java.util.Optional;

/**
 * APIs a candidate program may not touch: OS and file access, process spawning, raw sockets and
 * dynamic code evaluation. Each group carries the alternative suggested to the generator.
 */
public final class ForbiddenApis {

    /**
     * A family of forbidden types and packages.
     *
     * @param label        short description used in messages
     * @param types        fully qualified type names
     * @param packages     package names; every type below them is forbidden
     * @param alternative  what to do instead
     */
    public record Group(String label, List<String> types, List<String> packages, String alternative) {

        public boolean covers(String name) {
            for (String type : types) {
                if (name.equals(type) || name.startsWith(type + ".")) {
                    return true;
                }
            }
            for (String pkg : packages) {
                if (name.equals(pkg) || name.startsWith(pkg + ".")) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Forbidden type of this group with the given simple name inside {@code packageName}.
         */
        public boolean hasType(String packageName, String simpleName) {
            return types.contains(packageName + "." + simpleName) || packages.contains(packageName);
        }
    }

    public static final Group FILE_SYSTEM = new Group("file system access",
            List.of("java.io.File", "java.io.FileInputStream", "java.io.FileOutputStream",
                    "java.io.FileReader", "java.io.FileWriter", "java.io.RandomAccessFile"),
            List.of("java.nio.file"),
            "Keep data in memory and load bundled resources with getClass().getResourceAsStream(...)");

    public static final Group PROCESS = new Group("process control",
            List.of("java.lang.ProcessBuilder", "java.lang.Runtime", "java.lang.ProcessHandle"),
            List.of(),
            "Do the work in-process; run background tasks with SwingWorker");

    public static final Group NETWORK = new Group("raw socket access",
            List.of("java.net.Socket", "java.net.ServerSocket", "java.net.DatagramSocket",
                    "java.net.MulticastSocket"),
            List.of("java.nio.channels"),
            "Remove socket code; a UI program should receive its data from in-memory models");

    public static final Group DYNAMIC_CODE = new Group("dynamic code evaluation",
            List.of("java.lang.ClassLoader", "java.net.URLClassLoader"),
            List.of("javax.script", "javax.tools", "jdk.jshell", "java.lang.reflect", "java.lang.invoke"),
            "Call the code directly instead of loading or evaluating it at runtime");

    public static final List<Group> GROUPS = List.of(FILE_SYSTEM, PROCESS, NETWORK, DYNAMIC_CODE);

    private ForbiddenApis() {
    }

    /**
     * Group covering an import or qualified name, if any.
     */
    public static Optional<Group> groupOf(String qualifiedName) {
        return GROUPS.stream().filter(group -> group.covers(qualifiedName)).findFirst();
    }

    /**
     * Group owning a forbidden type reached through an on-demand import of {@code packageName}.
     */
    public static Optional<Group> groupOf(String packageName, String simpleName) {
        return GROUPS.stream().filter(group -> group.hasType(packageName, simpleName)).findFirst();
    }
}
