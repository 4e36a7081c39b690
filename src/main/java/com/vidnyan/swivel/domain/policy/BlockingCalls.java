package com.vidnyan.swivel.domain.policy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Calls that park the calling thread. On the event dispatch thread they freeze the UI.
 */
public final class BlockingCalls {

    /**
     * @param label        how the call is named in messages
     * @param alternative  the non-blocking replacement
     */
    public record BlockingCall(String label, String alternative) {
    }

    private static final String TIMER = "Schedule the delayed work with a javax.swing.Timer";
    private static final String WORKER = "Move the wait into SwingWorker.doInBackground() and update the UI in done()";

    private static final Map<String, BlockingCall> BY_QUALIFIED_NAME = new LinkedHashMap<>();

    static {
        register("java.lang.Thread.sleep", "Thread.sleep", TIMER);
        register("java.util.concurrent.TimeUnit.sleep", "TimeUnit.sleep", TIMER);
        register("java.lang.Thread.join", "Thread.join", WORKER);
        register("java.lang.Object.wait", "Object.wait", WORKER);
        register("java.util.concurrent.Future.get", "Future.get", WORKER);
        register("java.util.concurrent.FutureTask.get", "FutureTask.get", WORKER);
        register("java.util.concurrent.CompletableFuture.get", "CompletableFuture.get", WORKER);
        register("java.util.concurrent.CompletableFuture.join", "CompletableFuture.join", WORKER);
        register("java.util.concurrent.CountDownLatch.await", "CountDownLatch.await", WORKER);
        register("java.net.http.HttpClient.send", "HttpClient.send",
                "Use HttpClient.sendAsync(...) and apply the response with SwingUtilities.invokeLater");
        register("java.net.URL.openStream", "URL.openStream", "Load the resource in a SwingWorker");
        register("java.net.URLConnection.getInputStream", "URLConnection.getInputStream",
                "Load the resource in a SwingWorker");
    }

    private BlockingCalls() {
    }

    private static void register(String qualifiedName, String label, String alternative) {
        BY_QUALIFIED_NAME.put(qualifiedName, new BlockingCall(label, alternative));
    }

    /**
     * Lookup by resolved method name, e.g. {@code java.lang.Thread.sleep}.
     */
    public static Optional<BlockingCall> byQualifiedName(String qualifiedMethodName) {
        return Optional.ofNullable(BY_QUALIFIED_NAME.get(qualifiedMethodName));
    }

    /**
     * Lookup for calls the symbol solver could not resolve. Only static forms are recognised
     * textually: {@code Thread.sleep(..)} and {@code TimeUnit.X.sleep(..)}.
     */
    public static Optional<BlockingCall> byScopeAndName(String scope, String methodName) {
        if (!methodName.equals("sleep")) {
            return Optional.empty();
        }
        if (scope.equals("Thread") || scope.equals("java.lang.Thread")) {
            return byQualifiedName("java.lang.Thread.sleep");
        }
        if (scope.matches("(java\\.util\\.concurrent\\.)?TimeUnit\\.[A-Z]+")) {
            return byQualifiedName("java.util.concurrent.TimeUnit.sleep");
        }
        return Optional.empty();
    }
}
