package com.vidnyan.swivel.application.validation;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import com.vidnyan.swivel.domain.model.ErrorCodes;
import com.vidnyan.swivel.domain.model.TierReport;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationLevel;
import com.vidnyan.swivel.domain.source.ParsedSource;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * L1: parse the candidate into a {@link CompilationUnit}. Fails fast on the first problem.
 * <p>
 * Each parse gets its own parser and symbol solver; the reflection type solver caches per instance
 * and is not safe to share between threads.
 */
@Slf4j
public class SyntaxValidator {

    private static final int MAX_MESSAGE = 200;

    /**
     * L1 outcome plus the tree later tiers read when parsing succeeded.
     */
    public record SyntaxReport(TierReport report, Optional<ParsedSource> parsed) {

        public static SyntaxReport failed(ValidationError error) {
            return new SyntaxReport(TierReport.of(ValidationLevel.SYNTAX, List.of(error)), Optional.empty());
        }
    }

    /**
     * Outcome of strict UTF-8 decoding: either text or the finding explaining why there is none.
     */
    public record Decoded(String text, ValidationError error) {

        public boolean ok() {
            return error == null;
        }
    }

    public SyntaxReport validate(String source) {
        if (source == null || source.isBlank()) {
            return SyntaxReport.failed(ValidationError.builder()
                    .code(ErrorCodes.EMPTY_SOURCE)
                    .message("Source cannot be empty")
                    .fixSuggestion("Provide a complete Java program")
                    .llmAction("Write a Java class with a main method that builds the Swing component tree")
                    .build());
        }

        ParseResult<CompilationUnit> result;
        try {
            result = newParser().parse(source);
        } catch (StackOverflowError e) {
            log.debug("L1 ran out of stack on {} chars of source", source.length());
            return SyntaxReport.failed(ValidationError.builder()
                    .code(ErrorCodes.SYNTAX_ERROR)
                    .message("Syntax error: nesting too deep to parse")
                    .fixSuggestion("Flatten deeply nested expressions or blocks")
                    .llmAction("Split the deeply nested expression into local variables or helper methods")
                    .context(Map.of("reason", "nesting"))
                    .build());
        }
        if (result.isSuccessful() && result.getResult().isPresent()) {
            log.debug("L1 parsed {} top-level type(s)", result.getResult().get().getTypes().size());
            ParsedSource parsed = new ParsedSource(source, result.getResult().get());
            return new SyntaxReport(TierReport.of(ValidationLevel.SYNTAX, List.of()), Optional.of(parsed));
        }

        List<Problem> problems = result.getProblems();
        Problem first = problems.get(0);
        Optional<Range> range = first.getLocation().flatMap(TokenRange::toRange);
        Integer line = range.map(r -> r.begin.line).orElse(null);
        Integer column = range.map(r -> r.begin.column).orElse(null);
        String detail = summarize(first.getMessage());
        log.debug("L1 found {} parse problem(s), first at line {}: {}", problems.size(), line, detail);

        String where = line == null ? "" : " at line " + line;
        return SyntaxReport.failed(ValidationError.builder()
                .code(ErrorCodes.SYNTAX_ERROR)
                .message("Syntax error" + where + ": " + detail)
                .line(line)
                .column(column)
                .fixSuggestion("Correct the syntax" + where)
                .llmAction("Fix the syntax error" + where + ": " + detail)
                .build());
    }

    /**
     * Decode bytes strictly as UTF-8. A leading byte order mark is dropped.
     */
    public Decoded decode(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
            if (text.startsWith("\uFEFF")) {
                text = text.substring(1);
            }
            return new Decoded(text, null);
        } catch (CharacterCodingException e) {
            log.debug("Source is not valid UTF-8: {}", e.toString());
            return new Decoded(null, ValidationError.builder()
                    .code(ErrorCodes.ENCODING_ERROR)
                    .message("Encoding error: source is not valid UTF-8 (" + e.getClass().getSimpleName() + ")")
                    .fixSuggestion("Save the file as UTF-8")
                    .llmAction("Ensure the file is UTF-8 encoded")
                    .build());
        }
    }

    private static JavaParser newParser() {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(new JavaSymbolSolver(new ReflectionTypeSolver()));
        return new JavaParser(config);
    }

    private static String summarize(String message) {
        String firstLine = message.lines().findFirst().orElse(message).trim();
        return firstLine.length() > MAX_MESSAGE ? firstLine.substring(0, MAX_MESSAGE) : firstLine;
    }
}
