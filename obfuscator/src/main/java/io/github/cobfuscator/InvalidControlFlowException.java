package io.github.cobfuscator;

import io.github.cobfuscator.parser.SourceLocation;

/**
 * A {@code break} or {@code continue} with no enclosing construct it could leave.
 */
public class InvalidControlFlowException extends CompilationException {

    private static final long serialVersionUID = 2905316646215713925L;

    private final String kind;

    public InvalidControlFlowException(String kind, SourceLocation location) {
        super("'" + kind + "' outside of " + ("continue".equals(kind) ? "a loop" : "a loop or switch"), location);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
