package com.vidnyan.swivel.domain.source;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;

import java.util.Objects;
import java.util.Optional;

/**
 * Candidate source text together with the tree L1 parsed from it.
 * Later tiers only read the tree.
 */
public record ParsedSource(String text, CompilationUnit compilationUnit) {

    public ParsedSource {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(compilationUnit, "compilationUnit");
    }

    /**
     * First top-level type; the JDK source launcher runs its {@code main}.
     */
    public Optional<TypeDeclaration<?>> primaryType() {
        return compilationUnit.getTypes().getFirst();
    }

    public String primaryTypeName() {
        return primaryType().map(TypeDeclaration::getNameAsString).orElse("Candidate");
    }

    public boolean hasEntryPoint() {
        return primaryType()
                .map(type -> type.getMethodsByName("main").stream().anyMatch(ParsedSource::isMain))
                .orElse(false);
    }

    private static boolean isMain(MethodDeclaration method) {
        if (!method.isStatic() || !method.getType().isVoidType() || method.getParameters().size() != 1) {
            return false;
        }
        Parameter parameter = method.getParameter(0);
        String type = parameter.getType().asString();
        return parameter.isVarArgs()
                ? type.equals("String") || type.equals("java.lang.String")
                : type.equals("String[]") || type.equals("java.lang.String[]");
    }
}
