package com.vidnyan.swivel.application.validation;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.vidnyan.swivel.application.port.out.FrameworkRuntime;
import com.vidnyan.swivel.domain.framework.ComponentKind;
import com.vidnyan.swivel.domain.framework.FrameworkCatalogue;
import com.vidnyan.swivel.domain.model.ErrorCodes;
import com.vidnyan.swivel.domain.model.Severity;
import com.vidnyan.swivel.domain.model.TierReport;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationLevel;
import com.vidnyan.swivel.domain.source.ParsedSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * L3: checks the declared component tree against the catalogue and the Swing runtime.
 * <p>
 * Component kinds come from {@code new X(...)} expressions. X is resolved through single-type
 * imports, on-demand imports of framework packages, fully qualified names and local classes
 * (following {@code extends}). Interactive components and containers must be bound to a variable
 * or field that receives {@code setName("literal")}; identifiers must be unique; layout managers
 * must come from the catalogue.
 */
@Slf4j
public class StructuralValidator {

    public static final String BINDING_LOCAL = "LOCAL";
    public static final String BINDING_FIELD = "FIELD";
    public static final String BINDING_ASSIGN = "ASSIGN";
    public static final String BINDING_INLINE = "INLINE";

    private static final int MAX_EXTENDS_DEPTH = 8;

    private final FrameworkRuntime runtime;

    public StructuralValidator(FrameworkRuntime runtime) {
        this.runtime = runtime;
    }

    public TierReport validate(ParsedSource source) {
        if (!runtime.isAvailable()) {
            log.warn("Swing runtime unavailable, skipping L3");
            return TierReport.skipped(ValidationLevel.STRUCTURE,
                    "L3 skipped: the Swing runtime (java.desktop) is not available");
        }
        Tree tree = new Tree(source.compilationUnit());
        tree.check();
        log.debug("L3 resolved {} component(s), {} finding(s)", tree.componentCount, tree.findings.size());
        return TierReport.of(ValidationLevel.STRUCTURE, tree.findings);
    }

    /**
     * What a {@code new X(...)} expression creates.
     *
     * @param kind          catalogue kind, null when X is not (or does not extend) a catalogue type
     * @param problem       why X is an invalid component, null when it is fine
     * @param localClass    the local class X, when X is declared in the program
     */
    private record Resolution(ComponentKind kind, String problem, ClassOrInterfaceDeclaration localClass) {

        static final Resolution NONE = new Resolution(null, null, null);

        static Resolution of(ComponentKind kind) {
            return new Resolution(kind, null, null);
        }

        static Resolution invalid(String problem) {
            return new Resolution(null, problem, null);
        }

        Resolution declaredBy(ClassOrInterfaceDeclaration local) {
            return new Resolution(kind, problem, local);
        }

        boolean isComponent() {
            return kind != null && !kind.isLayout();
        }
    }

    /**
     * Per-run state for one compilation unit.
     */
    private final class Tree {

        private final CompilationUnit unit;
        private final List<ValidationError> findings = new ArrayList<>();
        private final Map<String, String> singleImports = new HashMap<>();
        private final Set<String> onDemandPackages = new LinkedHashSet<>();
        private final Map<String, ClassOrInterfaceDeclaration> localClasses = new HashMap<>();
        private final Map<Node, Integer> scopeIds = new IdentityHashMap<>();
        private final Set<String> identifiedBindings = new HashSet<>();
        private final Set<Node> selfIdentifying = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<String> literals = new HashSet<>();
        private final Set<String> componentBindings = new HashSet<>();
        private final Set<String> suggested = new HashSet<>();
        private final Map<String, Integer> firstUse = new LinkedHashMap<>();
        private final Set<String> reportedPositions = new HashSet<>();
        private int componentCount;

        Tree(CompilationUnit unit) {
            this.unit = unit;
            for (ImportDeclaration imp : unit.getImports()) {
                if (imp.isStatic()) {
                    continue;
                }
                if (imp.isAsterisk()) {
                    onDemandPackages.add(imp.getNameAsString());
                } else {
                    singleImports.put(imp.getName().getIdentifier(), imp.getNameAsString());
                }
            }
            unit.findAll(ClassOrInterfaceDeclaration.class)
                    .forEach(decl -> localClasses.putIfAbsent(decl.getNameAsString(), decl));
        }

        void check() {
            collectIdentifiers();
            unit.walk(Node.TreeTraversal.PREORDER, node -> {
                if (node instanceof ObjectCreationExpr creation) {
                    checkCreation(creation);
                } else if (node instanceof MethodCallExpr call) {
                    if (isSetName(call)) {
                        if (namesComponent(call)) {
                            checkDuplicate(call);
                        }
                    } else if (call.getNameAsString().equals("setLayout") && call.getArguments().size() == 1) {
                        checkLayout(call, call.getArgument(0));
                    }
                }
            });
            if (componentCount == 0) {
                findings.add(ValidationError.builder()
                        .code(ErrorCodes.NO_COMPONENT_TREE)
                        .severity(Severity.WARNING)
                        .message("No Swing component is created; the program declares no component tree")
                        .fixSuggestion("Create a root container (JFrame or JPanel) and add components to it")
                        .llmAction("Build the UI as a tree of Swing components rooted in a JFrame or JPanel")
                        .build());
            }
        }

        // identifiers are collected up front so a setName after the creation still counts
        private void collectIdentifiers() {
            collectComponentBindings();
            for (MethodCallExpr call : unit.findAll(MethodCallExpr.class)) {
                if (!isSetName(call)) {
                    continue;
                }
                literals.add(call.getArgument(0).asStringLiteralExpr().asString());
                Optional<Expression> scope = call.getScope();
                if (scope.isEmpty() || scope.get() instanceof ThisExpr) {
                    markSelfIdentifying(call);
                } else if (scope.get() instanceof NameExpr name) {
                    identifiedBindings.add(bindingKey(name, name.getNameAsString()));
                } else if (scope.get() instanceof FieldAccessExpr access && access.getScope() instanceof ThisExpr) {
                    enclosingType(access).ifPresent(owner ->
                            identifiedBindings.add(fieldKey(owner, access.getNameAsString())));
                }
            }
        }

        /**
         * Variables, fields and parameters that hold a component, by declared type or by the
         * creation stored in them.
         */
        private void collectComponentBindings() {
            for (ObjectCreationExpr creation : unit.findAll(ObjectCreationExpr.class)) {
                if (isComponentType(resolve(creation.getType(), 0))) {
                    binding(creation).ifPresent(b -> componentBindings.add(b.key()));
                }
            }
            for (VariableDeclarator declarator : unit.findAll(VariableDeclarator.class)) {
                if (!declarator.getType().isClassOrInterfaceType()
                        || !isComponentType(resolve(declarator.getType().asClassOrInterfaceType(), 0))) {
                    continue;
                }
                String name = declarator.getNameAsString();
                Optional<Node> holder = declarator.getParentNode();
                if (holder.isPresent() && holder.get() instanceof FieldDeclaration field) {
                    field.getParentNode().ifPresent(owner -> componentBindings.add(fieldKey(owner, name)));
                } else if (holder.isPresent() && holder.get() instanceof VariableDeclarationExpr) {
                    enclosingScope(declarator).ifPresent(scope -> componentBindings.add(localKey(scope, name)));
                }
            }
            for (Parameter parameter : unit.findAll(Parameter.class)) {
                if (parameter.getType().isClassOrInterfaceType()
                        && isComponentType(resolve(parameter.getType().asClassOrInterfaceType(), 0))) {
                    parameter.getParentNode().ifPresent(owner ->
                            componentBindings.add(localKey(owner, parameter.getNameAsString())));
                }
            }
        }

        /**
         * Whether the receiver of a {@code setName} call is a component; other named objects such as
         * threads do not take part in the identifier namespace.
         */
        private boolean namesComponent(MethodCallExpr call) {
            Optional<Expression> scope = call.getScope();
            if (scope.isEmpty() || scope.get() instanceof ThisExpr) {
                return enclosingType(call).map(this::isComponentClass).orElse(false);
            }
            if (scope.get() instanceof NameExpr name) {
                return componentBindings.contains(bindingKey(name, name.getNameAsString()));
            }
            if (scope.get() instanceof FieldAccessExpr access && access.getScope() instanceof ThisExpr) {
                return enclosingType(access)
                        .map(owner -> componentBindings.contains(fieldKey(owner, access.getNameAsString())))
                        .orElse(false);
            }
            if (scope.get() instanceof ObjectCreationExpr creation) {
                return isComponentType(resolve(creation.getType(), 0));
            }
            return false;
        }

        private boolean isComponentClass(Node type) {
            if (type instanceof ObjectCreationExpr anonymous) {
                return isComponentType(resolve(anonymous.getType(), 0));
            }
            if (type instanceof ClassOrInterfaceDeclaration declaration && !declaration.getExtendedTypes().isEmpty()) {
                return isComponentType(resolve(declaration.getExtendedTypes(0), 0));
            }
            return false;
        }

        // framework components outside the catalogue still share the identifier namespace
        private boolean isComponentType(Resolution resolution) {
            return resolution.isComponent() || resolution.problem() != null;
        }

        private void markSelfIdentifying(MethodCallExpr call) {
            Optional<Node> member = call.findAncestor(BodyDeclaration.class).map(Node.class::cast);
            boolean construction = member.isPresent()
                    && (member.get() instanceof ConstructorDeclaration || member.get() instanceof InitializerDeclaration);
            if (construction) {
                member.get().getParentNode().ifPresent(selfIdentifying::add);
            }
        }

        private void checkCreation(ObjectCreationExpr creation) {
            Resolution resolution = resolve(creation.getType(), 0);
            if (resolution.problem() != null) {
                findings.add(at(creation, ValidationError.builder()
                        .code(ErrorCodes.INVALID_COMPONENT)
                        .message(resolution.problem())
                        .fixSuggestion("Use a catalogue component such as JPanel, JButton or JLabel")
                        .llmAction("Replace '" + creation.getType().getNameWithScope() + "'"
                                + lineSuffix(creation) + " with a supported Swing component")
                        .context(Map.of("type", creation.getType().getNameWithScope()))));
                return;
            }
            if (!resolution.isComponent()) {
                return;
            }
            componentCount++;
            if (!resolution.kind().requiresIdentifier() || isIdentified(creation, resolution)) {
                return;
            }
            String position = creation.getBegin().map(p -> p.line + ":" + p.column).orElse("?");
            if (reportedPositions.add(position)) {
                reportMissingIdentifier(creation, resolution.kind());
            }
        }

        private boolean isIdentified(ObjectCreationExpr creation, Resolution resolution) {
            if (creation.getAnonymousClassBody().isPresent() && selfIdentifying.contains(creation)) {
                return true;
            }
            ClassOrInterfaceDeclaration local = resolution.localClass();
            int depth = 0;
            while (local != null && depth++ < MAX_EXTENDS_DEPTH) {
                if (selfIdentifying.contains(local)) {
                    return true;
                }
                local = local.getExtendedTypes().isEmpty() || local.getExtendedTypes(0).getScope().isPresent()
                        ? null
                        : localClasses.get(local.getExtendedTypes(0).getNameAsString());
            }
            return binding(creation).map(b -> identifiedBindings.contains(b.key())).orElse(false);
        }

        private void reportMissingIdentifier(ObjectCreationExpr creation, ComponentKind kind) {
            Optional<Binding> binding = binding(creation);
            String id = suggestId(binding.map(Binding::name).orElse(null), kind, creation);
            Map<String, String> context = new LinkedHashMap<>();
            context.put("kind", kind.simpleName());
            context.put("suggested_id", id);
            context.put("binding_kind", binding.map(Binding::kind).orElse(BINDING_INLINE));
            binding.ifPresent(b -> {
                context.put("binding", b.name());
                context.put("static", Boolean.toString(b.isStatic()));
            });

            String subject = kind.simpleName() + binding.map(b -> " '" + b.name() + "'").orElse("");
            String call = binding.map(b -> b.name() + ".setName(\"" + id + "\")")
                    .orElse("setName(\"" + id + "\") on it");
            findings.add(at(creation, ValidationError.builder()
                    .code(ErrorCodes.MISSING_IDENTIFIER)
                    .message(subject + " has no identifier")
                    .fixSuggestion(binding.isPresent()
                            ? "Call " + call
                            : "Assign the component to a variable and call setName(\"" + id + "\") on it")
                    .llmAction("Give the " + kind.simpleName() + lineSuffix(creation) + " an identifier: " + call)
                    .context(context)));
        }

        private String suggestId(String bindingName, ComponentKind kind, ObjectCreationExpr creation) {
            String base = bindingName != null
                    ? bindingName
                    : kind.simpleName().replaceFirst("^J", "").toLowerCase()
                        + creation.getBegin().map(p -> "-" + p.line).orElse("");
            String id = base;
            int n = 2;
            while (literals.contains(id) || suggested.contains(id)) {
                id = base + "-" + n++;
            }
            suggested.add(id);
            return id;
        }

        private void checkDuplicate(MethodCallExpr call) {
            String literal = call.getArgument(0).asStringLiteralExpr().asString();
            int line = call.getBegin().map(p -> p.line).orElse(0);
            Integer first = firstUse.putIfAbsent(literal, line);
            if (first == null) {
                return;
            }
            findings.add(at(call, ValidationError.builder()
                    .code(ErrorCodes.DUPLICATE_IDENTIFIER)
                    .message("Duplicate identifier '" + literal + "' at lines " + first + " and " + line)
                    .fixSuggestion("Give each component a unique name")
                    .llmAction("Rename the identifier '" + literal + "' on line " + line
                            + " so it differs from the one on line " + first)
                    .context(Map.of("id", literal, "first_line", Integer.toString(first)))));
        }

        private void checkLayout(MethodCallExpr call, Expression argument) {
            Expression layout = unwrap(argument);
            if (layout instanceof NullLiteralExpr) {
                findings.add(at(call, ValidationError.builder()
                        .code(ErrorCodes.INVALID_LAYOUT)
                        .message("setLayout(null) uses absolute positioning, which is not a supported layout")
                        .fixSuggestion("Use a catalogue layout manager such as BorderLayout or GridBagLayout")
                        .llmAction("Replace setLayout(null)" + lineSuffix(call) + " with a layout manager such as BorderLayout")
                        .context(Map.of("layout", "null"))));
                return;
            }
            if (!(layout instanceof ObjectCreationExpr creation)) {
                return;
            }
            Resolution resolution = resolve(creation.getType(), 0);
            if (resolution.localClass() != null) {
                return;
            }
            if (resolution.kind() != null && resolution.kind().isLayout()) {
                return;
            }
            String name = creation.getType().getNameWithScope();
            findings.add(at(call, ValidationError.builder()
                    .code(ErrorCodes.INVALID_LAYOUT)
                    .message("Layout manager '" + name + "' is not in the supported catalogue")
                    .fixSuggestion("Use BorderLayout, FlowLayout, GridLayout, GridBagLayout, CardLayout, BoxLayout, GroupLayout or SpringLayout")
                    .llmAction("Replace the '" + name + "' layout" + lineSuffix(call) + " with a catalogue layout manager")
                    .context(Map.of("layout", name))));
        }

        private Resolution resolve(ClassOrInterfaceType type, int depth) {
            String simple = type.getNameAsString();
            if (type.getScope().isPresent()) {
                return resolveQualified(type.getNameWithScope(), true);
            }
            ClassOrInterfaceDeclaration local = localClasses.get(simple);
            if (local != null) {
                if (local.getExtendedTypes().isEmpty() || depth >= MAX_EXTENDS_DEPTH) {
                    return Resolution.NONE.declaredBy(local);
                }
                return resolve(local.getExtendedTypes(0), depth + 1).declaredBy(local);
            }
            String imported = singleImports.get(simple);
            if (imported != null) {
                return resolveQualified(imported, true);
            }
            for (String pkg : onDemandPackages) {
                if (!FrameworkCatalogue.isFrameworkPackage(pkg)) {
                    continue;
                }
                String candidate = pkg + "." + simple;
                Optional<ComponentKind> kind = FrameworkCatalogue.byQualifiedName(candidate);
                if (kind.isPresent()) {
                    return Resolution.of(kind.get());
                }
                if (runtime.loadClass(candidate).isPresent()) {
                    return resolveQualified(candidate, false);
                }
            }
            // unresolved but named like a catalogue type; the missing import is an L2 concern
            return FrameworkCatalogue.bySimpleName(simple).map(Resolution::of).orElse(Resolution.NONE);
        }

        private Resolution resolveQualified(String qualifiedName, boolean explicit) {
            Optional<ComponentKind> kind = FrameworkCatalogue.byQualifiedName(qualifiedName);
            if (kind.isPresent()) {
                return Resolution.of(kind.get());
            }
            if (!FrameworkCatalogue.isFrameworkType(qualifiedName)) {
                return Resolution.NONE;
            }
            Optional<Class<?>> loaded = runtime.loadClass(qualifiedName);
            if (loaded.isEmpty()) {
                return explicit
                        ? Resolution.invalid("Component type '" + qualifiedName + "' cannot be resolved by the Swing runtime")
                        : Resolution.NONE;
            }
            if (runtime.isComponent(loaded.get())) {
                return Resolution.invalid("Component type '" + qualifiedName + "' is not in the supported catalogue");
            }
            return Resolution.NONE;
        }

        private record Binding(String name, String kind, String key, boolean isStatic) {
        }

        /**
         * The variable or field a creation is stored in, if any.
         */
        private Optional<Binding> binding(ObjectCreationExpr creation) {
            Node child = creation;
            Node parent = creation.getParentNode().orElse(null);
            while (parent instanceof EnclosedExpr || parent instanceof CastExpr) {
                child = parent;
                parent = parent.getParentNode().orElse(null);
            }
            if (parent instanceof VariableDeclarator declarator) {
                String name = declarator.getNameAsString();
                Optional<Node> holder = declarator.getParentNode();
                if (holder.isPresent() && holder.get() instanceof FieldDeclaration field) {
                    return field.getParentNode()
                            .map(owner -> new Binding(name, BINDING_FIELD, fieldKey(owner, name), field.isStatic()));
                }
                if (holder.isPresent() && holder.get() instanceof VariableDeclarationExpr) {
                    return enclosingScope(declarator)
                            .map(scope -> new Binding(name, BINDING_LOCAL, localKey(scope, name), false));
                }
                return Optional.empty();
            }
            if (parent instanceof AssignExpr assign && assign.getValue() == child
                    && assign.getOperator() == AssignExpr.Operator.ASSIGN
                    && assign.getParentNode().filter(ExpressionStmt.class::isInstance).isPresent()) {
                Expression target = assign.getTarget();
                if (target instanceof NameExpr name) {
                    return Optional.of(new Binding(name.getNameAsString(), BINDING_ASSIGN,
                            bindingKey(name, name.getNameAsString()), false));
                }
                if (target instanceof FieldAccessExpr access && access.getScope() instanceof ThisExpr) {
                    String fieldName = access.getNameAsString();
                    return enclosingType(access).map(owner -> new Binding("this." + fieldName, BINDING_ASSIGN,
                            fieldKey(owner, fieldName), false));
                }
            }
            return Optional.empty();
        }

        /**
         * Key of the declaration a simple name refers to, following Java's scoping outward.
         */
        private String bindingKey(Node usage, String name) {
            Optional<Node> scope = enclosingScope(usage);
            while (scope.isPresent()) {
                Node current = scope.get();
                if (current instanceof TypeDeclaration<?> type) {
                    if (type.getFieldByName(name).isPresent()) {
                        return fieldKey(type, name);
                    }
                } else if (current instanceof ObjectCreationExpr anonymous) {
                    if (declaresField(anonymous, name)) {
                        return fieldKey(anonymous, name);
                    }
                } else if (declaresLocal(current, name)) {
                    return localKey(current, name);
                }
                scope = enclosingScope(current);
            }
            return "unbound:" + name;
        }

        private boolean declaresLocal(Node scope, String name) {
            if (scope instanceof CallableDeclaration<?> callable
                    && callable.getParameters().stream().anyMatch(p -> p.getNameAsString().equals(name))) {
                return true;
            }
            if (scope instanceof LambdaExpr lambda
                    && lambda.getParameters().stream().anyMatch(p -> p.getNameAsString().equals(name))) {
                return true;
            }
            return scope.findAll(VariableDeclarator.class).stream()
                    .filter(declarator -> declarator.getNameAsString().equals(name))
                    .filter(declarator -> declarator.getParentNode().filter(VariableDeclarationExpr.class::isInstance).isPresent())
                    .anyMatch(declarator -> enclosingScope(declarator).filter(found -> found == scope).isPresent());
        }

        private boolean declaresField(ObjectCreationExpr anonymous, String name) {
            return anonymous.getAnonymousClassBody().stream()
                    .flatMap(List::stream)
                    .filter(FieldDeclaration.class::isInstance)
                    .map(FieldDeclaration.class::cast)
                    .flatMap(field -> field.getVariables().stream())
                    .anyMatch(variable -> variable.getNameAsString().equals(name));
        }

        private Optional<Node> enclosingScope(Node node) {
            Node current = node.getParentNode().orElse(null);
            while (current != null && !isScope(current)) {
                current = current.getParentNode().orElse(null);
            }
            return Optional.ofNullable(current);
        }

        private boolean isScope(Node node) {
            return node instanceof CallableDeclaration<?>
                    || node instanceof InitializerDeclaration
                    || node instanceof LambdaExpr
                    || node instanceof TypeDeclaration<?>
                    || node instanceof ObjectCreationExpr creation && creation.getAnonymousClassBody().isPresent();
        }

        private Optional<Node> enclosingType(Node node) {
            Optional<Node> scope = enclosingScope(node);
            while (scope.isPresent() && !(scope.get() instanceof TypeDeclaration<?>)
                    && !(scope.get() instanceof ObjectCreationExpr)) {
                scope = enclosingScope(scope.get());
            }
            return scope;
        }

        private String fieldKey(Node owner, String name) {
            return "field:" + idOf(owner) + ":" + name;
        }

        private String localKey(Node scope, String name) {
            return "local:" + idOf(scope) + ":" + name;
        }

        private int idOf(Node node) {
            return scopeIds.computeIfAbsent(node, n -> scopeIds.size() + 1);
        }
    }

    public static boolean isSetName(MethodCallExpr call) {
        return call.getNameAsString().equals("setName")
                && call.getArguments().size() == 1
                && call.getArgument(0) instanceof StringLiteralExpr;
    }

    private static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (current instanceof EnclosedExpr enclosed) {
            current = enclosed.getInner();
        }
        return current;
    }

    private static String lineSuffix(Node node) {
        return node.getBegin().map(p -> " on line " + p.line).orElse("");
    }

    private static ValidationError at(Node node, ValidationError.Builder builder) {
        Optional<Position> begin = node.getBegin();
        return builder
                .line(begin.map(p -> p.line).orElse(null))
                .column(begin.map(p -> p.column).orElse(null))
                .build();
    }
}
