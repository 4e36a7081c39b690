package com.vidnyan.swivel.adapter.out.rule;

import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.PackageDeclaration;
import com.vidnyan.swivel.domain.rule.TextEdit;
import com.vidnyan.swivel.domain.rule.TextSpan;
import com.vidnyan.swivel.domain.source.LineIndex;

import java.util.List;
import java.util.Optional;

/**
 * The import section of a snapshot. Every import rule claims the whole section, so two import
 * rules never patch the same snapshot.
 */
final class ImportBlock {

    private final String source;
    private final CompilationUnit unit;
    private final LineIndex index;

    private ImportBlock(String source, CompilationUnit unit) {
        this.source = source;
        this.unit = unit;
        this.index = new LineIndex(source);
    }

    static Optional<ImportBlock> of(String source) {
        return SourceTrees.parse(source).map(unit -> new ImportBlock(source, unit));
    }

    CompilationUnit unit() {
        return unit;
    }

    List<ImportDeclaration> imports() {
        return unit.getImports();
    }

    /**
     * From the start of the first import line to the end of the last one; empty at the insertion
     * point when there are no imports.
     */
    TextSpan span() {
        List<ImportDeclaration> imports = imports();
        if (imports.isEmpty()) {
            return TextSpan.at(insertionOffset());
        }
        int first = imports.get(0).getBegin().orElseThrow().line;
        int last = imports.get(imports.size() - 1).getEnd().orElseThrow().line;
        return new TextSpan(index.lineStart(first), index.nextLineStart(last));
    }

    /**
     * Where new import lines go: after the last import, else after the package declaration, else
     * at the top of the file.
     */
    int insertionOffset() {
        List<ImportDeclaration> imports = imports();
        if (!imports.isEmpty()) {
            return index.nextLineStart(imports.get(imports.size() - 1).getEnd().orElseThrow().line);
        }
        return unit.getPackageDeclaration()
                .flatMap(PackageDeclaration::getEnd)
                .map(end -> index.nextLineStart(end.line))
                .orElse(0);
    }

    Optional<ImportDeclaration> find(String name, boolean isStatic, boolean asterisk) {
        return imports().stream()
                .filter(imp -> imp.getNameAsString().equals(name)
                        && imp.isStatic() == isStatic
                        && imp.isAsterisk() == asterisk)
                .findFirst();
    }

    /**
     * Delete an import together with its line when nothing else shares the line.
     */
    TextEdit removal(ImportDeclaration imp) {
        Range range = imp.getRange().orElseThrow();
        int start = index.offsetOf(range.begin);
        int end = index.endOffsetOf(range);
        if (range.begin.line == range.end.line && index.occupiesWholeLine(range.begin.line, start, end)) {
            return TextEdit.delete(index.lineStart(range.begin.line), index.nextLineStart(range.end.line));
        }
        return TextEdit.delete(start, end);
    }

    /**
     * Insert {@code lines} (without separators) as import statements at the insertion point.
     */
    TextEdit insertion(List<String> qualifiedNames) {
        String separator = index.lineSeparator();
        int offset = insertionOffset();
        StringBuilder text = new StringBuilder();
        if (offset == source.length() && !source.isEmpty() && !source.endsWith("\n") && !source.endsWith("\r")) {
            text.append(separator);
        }
        boolean afterPackage = imports().isEmpty() && unit.getPackageDeclaration().isPresent();
        if (afterPackage) {
            text.append(separator);
        }
        for (String name : qualifiedNames) {
            text.append("import ").append(name).append(';').append(separator);
        }
        if (imports().isEmpty() && !afterPackage) {
            text.append(separator);
        }
        return TextEdit.insert(offset, text.toString());
    }
}
