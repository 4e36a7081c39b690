package com.vidnyan.swivel.adapter.out.rule;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;

import java.util.Optional;

/**
 * Parsing for correction rules. Rules re-read the snapshot they patch; the tree L1 produced may
 * belong to an older snapshot.
 */
final class SourceTrees {

    private SourceTrees() {
    }

    static Optional<CompilationUnit> parse(String source) {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        try {
            ParseResult<CompilationUnit> result = new JavaParser(config).parse(source);
            return result.isSuccessful() ? result.getResult() : Optional.empty();
        } catch (StackOverflowError e) {
            return Optional.empty();
        }
    }
}
