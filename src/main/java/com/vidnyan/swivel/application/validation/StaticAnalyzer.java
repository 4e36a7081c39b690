package com.vidnyan.swivel.application.validation;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.TypeParameter;
import com.vidnyan.swivel.domain.exception.SwivelException;
import com.vidnyan.swivel.domain.framework.FrameworkCatalogue;
import com.vidnyan.swivel.domain.model.ErrorCodes;
import com.vidnyan.swivel.domain.model.Severity;
import com.vidnyan.swivel.domain.model.TierReport;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationLevel;
import com.vidnyan.swivel.domain.policy.BlockingCalls;
import com.vidnyan.swivel.domain.policy.BlockingCalls.BlockingCall;
import com.vidnyan.swivel.domain.policy.ForbiddenApis;
import com.vidnyan.swivel.domain.policy.ForbiddenApis.Group;
import com.vidnyan.swivel.domain.source.ParsedSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * L2: one pre-order walk over the tree with an event-dispatch-thread flag.
 * <p>
 * Reports forbidden APIs (E201), blocking calls reachable on the EDT (E202), catalogue types used
 * without an import (W203), programs that never touch Swing (W204) and unused single-type imports
 * (W205). The tree is never modified.
 */
@Slf4j
public class StaticAnalyzer {

    private static final Set<String> CALLBACKS = Set.of(
            "actionPerformed", "stateChanged", "itemStateChanged", "valueChanged", "propertyChange",
            "caretUpdate", "insertUpdate", "removeUpdate", "changedUpdate", "tableChanged",
            "paintComponent", "paint");
    private static final Pattern CALLBACK_FAMILY = Pattern.compile("(mouse|key|focus|window)[A-Z]\\w*");
    private static final Set<String> WORKER_CALLBACKS = Set.of("done", "process");

    private static final Pattern LISTENER_REGISTRATION = Pattern.compile("add\\w*Listener");
    private static final Set<String> EDT_HANDOFFS = Set.of("invokeLater", "invokeAndWait");
    private static final Set<String> WORKER_HANDOFFS = Set.of(
            "execute", "submit", "runAsync", "supplyAsync", "schedule", "scheduleAtFixedRate",
            "scheduleWithFixedDelay", "startVirtualThread");

    // only these names are worth a symbol-solver round trip
    private static final Set<String> BLOCKING_NAMES = Set.of(
            "sleep", "join", "wait", "get", "await", "send", "openStream", "getInputStream");

    private final Severity blockingCallSeverity;

    public StaticAnalyzer() {
        this(Severity.ERROR);
    }

    public StaticAnalyzer(Severity blockingCallSeverity) {
        this.blockingCallSeverity = blockingCallSeverity;
    }

    public TierReport analyze(ParsedSource source) {
        Scan scan = new Scan(source.compilationUnit());
        try {
            walk(source.compilationUnit(), false, scan);
        } catch (StackOverflowError e) {
            throw new SwivelException("Static analysis ran out of stack: syntax tree nested too deeply");
        }
        scan.finish();
        log.debug("L2 produced {} finding(s)", scan.findings.size());
        return TierReport.of(ValidationLevel.STATIC, scan.findings);
    }

    private void walk(Node node, boolean edt, Scan scan) {
        inspect(node, edt, scan);
        for (Node child : node.getChildNodes()) {
            walk(child, contextFor(node, child, edt), scan);
        }
    }

    /**
     * Whether {@code child} of {@code parent} runs on the event dispatch thread.
     */
    private boolean contextFor(Node parent, Node child, boolean edt) {
        if (parent instanceof MethodDeclaration method) {
            if (isCallback(method)) {
                return true;
            }
            if (method.getNameAsString().equals("doInBackground") && declaredInSwingWorker(method)) {
                return false;
            }
            return edt && method.getParentNode().filter(ObjectCreationExpr.class::isInstance).isPresent();
        }
        if (parent instanceof TypeDeclaration<?> || parent instanceof ConstructorDeclaration
                || parent instanceof InitializerDeclaration) {
            return false;
        }
        if (parent instanceof MethodCallExpr call && isArgument(call.getArguments(), child)) {
            String name = call.getNameAsString();
            if (LISTENER_REGISTRATION.matcher(name).matches() || EDT_HANDOFFS.contains(name)) {
                return true;
            }
            if (WORKER_HANDOFFS.contains(name)) {
                return false;
            }
        }
        if (parent instanceof ObjectCreationExpr creation && isArgument(creation.getArguments(), child)) {
            String type = creation.getType().getNameWithScope();
            if (type.equals("Timer") || type.equals("javax.swing.Timer")) {
                return true;
            }
            if (type.equals("Thread") || type.equals("java.lang.Thread")) {
                return false;
            }
        }
        return edt;
    }

    private static boolean isArgument(List<? extends Node> arguments, Node child) {
        return arguments.stream().anyMatch(argument -> argument == child);
    }

    private static boolean isCallback(MethodDeclaration method) {
        String name = method.getNameAsString();
        if (CALLBACKS.contains(name) || CALLBACK_FAMILY.matcher(name).matches()) {
            return true;
        }
        return WORKER_CALLBACKS.contains(name) && declaredInSwingWorker(method);
    }

    private static boolean declaredInSwingWorker(MethodDeclaration method) {
        Optional<Node> owner = method.getParentNode();
        if (owner.isPresent() && owner.get() instanceof ObjectCreationExpr creation) {
            return creation.getType().getNameAsString().equals("SwingWorker");
        }
        if (owner.isPresent() && owner.get() instanceof ClassOrInterfaceDeclaration declaration) {
            return declaration.getExtendedTypes().stream()
                    .anyMatch(type -> type.getNameAsString().equals("SwingWorker"));
        }
        return false;
    }

    private void inspect(Node node, boolean edt, Scan scan) {
        if (node instanceof ImportDeclaration imp) {
            scan.onImport(imp);
        } else if (node instanceof ClassOrInterfaceType type) {
            scan.onType(type);
        } else if (node instanceof NameExpr name) {
            scan.onName(name);
        } else if (node instanceof AnnotationExpr annotation) {
            String qualified = annotation.getNameAsString();
            int dot = qualified.indexOf('.');
            scan.referenced.add(dot < 0 ? qualified : qualified.substring(0, dot));
        } else if (node instanceof ObjectCreationExpr creation) {
            String type = creation.getType().getNameWithScope();
            if (type.equals("ProcessBuilder") || type.equals("java.lang.ProcessBuilder")) {
                scan.dangerousCall(creation, "new ProcessBuilder(...)", ForbiddenApis.PROCESS);
            }
        } else if (node instanceof MethodCallExpr call) {
            scan.onCall(call);
            if (edt) {
                blockingCall(call).ifPresent(blocking -> scan.blockingCall(call, blocking, blockingCallSeverity));
            }
        }
    }

    private Optional<BlockingCall> blockingCall(MethodCallExpr call) {
        String name = call.getNameAsString();
        String scope = call.getScope().map(Node::toString).orElse("");
        Optional<BlockingCall> textual = BlockingCalls.byScopeAndName(scope, name);
        if (textual.isPresent() || !BLOCKING_NAMES.contains(name)) {
            return textual;
        }
        try {
            return BlockingCalls.byQualifiedName(call.resolve().getQualifiedName());
        } catch (RuntimeException e) {
            log.trace("Could not resolve {}: {}", call, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Per-run accumulator. Never shared between analyses.
     */
    private static final class Scan {

        private final List<ValidationError> findings = new ArrayList<>();
        private final Set<String> reportedUsages = new HashSet<>();
        private final Set<String> referenced = new HashSet<>();
        private final Set<String> missingReported = new HashSet<>();
        private final Set<String> localTypes = new HashSet<>();
        private final Map<String, ImportDeclaration> singleImports = new HashMap<>();
        private final List<ImportDeclaration> checkedImports = new ArrayList<>();
        private final Set<String> onDemandPackages = new LinkedHashSet<>();
        private boolean swingImported;
        private boolean frameworkReferenced;

        Scan(CompilationUnit unit) {
            unit.findAll(TypeDeclaration.class).forEach(type -> localTypes.add(type.getNameAsString()));
            unit.findAll(TypeParameter.class).forEach(param -> localTypes.add(param.getNameAsString()));
            for (ImportDeclaration imp : unit.getImports()) {
                if (imp.isAsterisk()) {
                    if (!imp.isStatic()) {
                        onDemandPackages.add(imp.getNameAsString());
                    }
                } else {
                    singleImports.putIfAbsent(imp.getName().getIdentifier(), imp);
                }
            }
            onDemandPackages.add("java.lang");
        }

        void onImport(ImportDeclaration imp) {
            String name = imp.getNameAsString();
            if (name.equals(FrameworkCatalogue.SWING) || name.startsWith(FrameworkCatalogue.SWING + ".")) {
                swingImported = true;
            }
            Optional<Group> group = ForbiddenApis.groupOf(name);
            if (group.isPresent()) {
                String written = (imp.isStatic() ? "static " : "") + name + (imp.isAsterisk() ? ".*" : "");
                findings.add(at(imp, ValidationError.builder()
                        .code(ErrorCodes.FORBIDDEN_IMPORT)
                        .message("Forbidden import '" + written + "' (" + group.get().label() + ")")
                        .fixSuggestion("Remove the import and the code that depends on it")
                        .llmAction("Remove the '" + written + "' import. " + group.get().alternative())
                        .context(importContext(imp))));
                return;
            }
            if (!imp.isAsterisk()) {
                checkedImports.add(imp);
            }
        }

        void onType(ClassOrInterfaceType type) {
            if (type.getScope().isPresent()) {
                String qualified = type.getNameWithScope();
                if (FrameworkCatalogue.isFrameworkType(qualified)) {
                    frameworkReferenced = true;
                }
                ForbiddenApis.groupOf(qualified)
                        .ifPresent(group -> forbiddenUsage(type, qualified, group));
                return;
            }
            String simple = type.getNameAsString();
            referenced.add(simple);
            onSimpleTypeName(type, simple);
        }

        void onName(NameExpr name) {
            String simple = name.getNameAsString();
            referenced.add(simple);
            boolean usedAsScope = name.getParentNode()
                    .filter(parent -> parent instanceof MethodCallExpr || parent instanceof FieldAccessExpr)
                    .isPresent();
            if (usedAsScope && !simple.isEmpty() && Character.isUpperCase(simple.charAt(0))) {
                onSimpleTypeName(name, simple);
            }
        }

        void onCall(MethodCallExpr call) {
            String name = call.getNameAsString();
            if (call.getScope().isEmpty()) {
                referenced.add(name);
                return;
            }
            Node scope = call.getScope().get();
            String scopeText = scope.toString();
            if (scope instanceof FieldAccessExpr) {
                ForbiddenApis.groupOf(scopeText).ifPresent(group -> forbiddenUsage(call, scopeText, group));
            }
            if (name.equals("exec") && scopeText.endsWith("getRuntime()")) {
                dangerousCall(call, "Runtime.exec(...)", ForbiddenApis.PROCESS);
            } else if (name.equals("forName") && (scopeText.equals("Class") || scopeText.equals("java.lang.Class"))) {
                dangerousCall(call, "Class.forName(...)", ForbiddenApis.DYNAMIC_CODE);
            } else if ((name.equals("load") || name.equals("loadLibrary"))
                    && (scopeText.equals("System") || scopeText.equals("java.lang.System")
                    || scopeText.endsWith("getRuntime()"))) {
                dangerousCall(call, "System." + name + "(...)", ForbiddenApis.DYNAMIC_CODE);
            } else if (name.equals("eval") && resolvesInto(call, "javax.script.")) {
                dangerousCall(call, "ScriptEngine.eval(...)", ForbiddenApis.DYNAMIC_CODE);
            }
        }

        private void onSimpleTypeName(Node node, String simple) {
            if (localTypes.contains(simple)) {
                return;
            }
            if (FrameworkCatalogue.qualifiedNameOf(simple).isPresent()) {
                frameworkReferenced = true;
                checkImported(node, simple, FrameworkCatalogue.qualifiedNameOf(simple).get());
            }
            if (singleImports.containsKey(simple)) {
                return;
            }
            for (String pkg : onDemandPackages) {
                Optional<Group> group = ForbiddenApis.groupOf(pkg, simple);
                if (group.isPresent()) {
                    forbiddenUsage(node, pkg + "." + simple, group.get());
                    return;
                }
            }
        }

        private void checkImported(Node node, String simple, String qualified) {
            if (singleImports.containsKey(simple) || missingReported.contains(simple)) {
                return;
            }
            String pkg = qualified.substring(0, qualified.lastIndexOf('.'));
            if (onDemandPackages.contains(pkg)) {
                return;
            }
            missingReported.add(simple);
            findings.add(at(node, ValidationError.builder()
                    .code(ErrorCodes.MISSING_IMPORT)
                    .severity(Severity.WARNING)
                    .message("Type '" + simple + "' is used but not imported")
                    .fixSuggestion("Add 'import " + qualified + ";'")
                    .llmAction("Add the import statement 'import " + qualified + ";'")
                    .context(Map.of("import", qualified, "type", simple))));
        }

        private void forbiddenUsage(Node node, String qualified, Group group) {
            ValidationError.Builder builder = ValidationError.builder()
                    .code(ErrorCodes.FORBIDDEN_IMPORT)
                    .message("Use of forbidden type '" + qualified + "' (" + group.label() + ")")
                    .fixSuggestion("Remove the code that uses " + qualified)
                    .llmAction("Stop using " + qualified + ". " + group.alternative())
                    .context(Map.of("type", qualified));
            addOncePerLine(at(node, builder));
        }

        void dangerousCall(Node node, String call, Group group) {
            ValidationError.Builder builder = ValidationError.builder()
                    .code(ErrorCodes.FORBIDDEN_IMPORT)
                    .message("Dangerous call " + call + " (" + group.label() + ")")
                    .fixSuggestion("Remove the " + call + " call")
                    .llmAction("Remove the " + call + " call. " + group.alternative())
                    .context(Map.of("call", call));
            addOncePerLine(at(node, builder));
        }

        void blockingCall(MethodCallExpr call, BlockingCall blocking, Severity severity) {
            String where = call.getBegin().map(p -> " on line " + p.line).orElse("");
            findings.add(at(call, ValidationError.builder()
                    .code(ErrorCodes.BLOCKING_CALL)
                    .severity(severity)
                    .message("Blocking call " + blocking.label() + "() on the event dispatch thread freezes the UI")
                    .fixSuggestion(blocking.alternative())
                    .llmAction("Replace " + blocking.label() + "()" + where + ". " + blocking.alternative())
                    .context(Map.of("call", blocking.label()))));
        }

        void finish() {
            if (!swingImported && !frameworkReferenced) {
                findings.add(ValidationError.builder()
                        .code(ErrorCodes.MISSING_FRAMEWORK_IMPORT)
                        .severity(Severity.WARNING)
                        .message("No javax.swing import found and no Swing type is used")
                        .fixSuggestion("Build the UI from javax.swing components")
                        .llmAction("Import the javax.swing types the program needs and build the UI with them")
                        .build());
            }
            for (ImportDeclaration imp : checkedImports) {
                if (referenced.contains(imp.getName().getIdentifier())) {
                    continue;
                }
                String name = imp.getNameAsString();
                findings.add(at(imp, ValidationError.builder()
                        .code(ErrorCodes.UNUSED_IMPORT)
                        .severity(Severity.WARNING)
                        .message("Unused import '" + name + "'")
                        .fixSuggestion("Remove the import")
                        .llmAction("Remove the unused import '" + name + "'")
                        .context(importContext(imp))));
            }
        }

        private void addOncePerLine(ValidationError error) {
            if (reportedUsages.add(error.dedupKey())) {
                findings.add(error);
            }
        }

        private static boolean resolvesInto(MethodCallExpr call, String packagePrefix) {
            try {
                return call.resolve().getQualifiedName().startsWith(packagePrefix);
            } catch (RuntimeException e) {
                log.trace("Could not resolve {}: {}", call, e.getMessage());
                return false;
            }
        }

        private static Map<String, String> importContext(ImportDeclaration imp) {
            return Map.of(
                    "import", imp.getNameAsString(),
                    "static", Boolean.toString(imp.isStatic()),
                    "asterisk", Boolean.toString(imp.isAsterisk()));
        }

        private static ValidationError at(Node node, ValidationError.Builder builder) {
            Optional<Position> begin = node.getBegin();
            return builder
                    .line(begin.map(p -> p.line).orElse(null))
                    .column(begin.map(p -> p.column).orElse(null))
                    .build();
        }
    }
}
