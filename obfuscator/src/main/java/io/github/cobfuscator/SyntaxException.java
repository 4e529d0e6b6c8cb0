package io.github.cobfuscator;

import io.github.cobfuscator.parser.SourceLocation;

public class SyntaxException extends CompilationException {

    private static final long serialVersionUID = -3318957130541866201L;

    private final String expected;
    private final String found;

    public SyntaxException(SourceLocation location, String expected, String found) {
        super("syntax error: expected " + expected + " but found " + found, location);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
