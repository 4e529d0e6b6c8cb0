package io.github.cobfuscator.ast;

import java.util.Collections;
import java.util.List;

public final class TranslationUnit {

    private final String fileName;
    private final List<String> includes;
    private final List<Decl> declarations;

    public TranslationUnit(String fileName, List<String> includes, List<Decl> declarations) {
        this.fileName = fileName;
        this.includes = Collections.unmodifiableList(includes);
        this.declarations = Collections.unmodifiableList(declarations);
    }

    public String getFileName() {
        return fileName;
    }

    /** Built-in headers included by the unit, in include order. */
    public List<String> getIncludes() {
        return includes;
    }

    public List<Decl> getDeclarations() {
        return declarations;
    }

    public TranslationUnit withDeclarations(List<Decl> declarations) {
        return new TranslationUnit(fileName, includes, declarations);
    }
}
