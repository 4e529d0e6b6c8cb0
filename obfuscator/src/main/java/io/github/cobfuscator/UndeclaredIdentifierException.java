package io.github.cobfuscator;

import io.github.cobfuscator.parser.SourceLocation;

public class UndeclaredIdentifierException extends CompilationException {

    private static final long serialVersionUID = -1780143546318372640L;

    private final String name;

    public UndeclaredIdentifierException(String name, SourceLocation location) {
        super("undeclared identifier '" + name + "'", location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
