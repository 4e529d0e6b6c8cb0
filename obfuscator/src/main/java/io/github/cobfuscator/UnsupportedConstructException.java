package io.github.cobfuscator;

import io.github.cobfuscator.parser.SourceLocation;

/**
 * Valid C that lies outside the supported subset.
 */
public class UnsupportedConstructException extends CompilationException {

    private static final long serialVersionUID = 4471962035378810242L;

    private final String nodeKind;

    public UnsupportedConstructException(String nodeKind, SourceLocation location) {
        super("unsupported construct: " + nodeKind, location);
        this.nodeKind = nodeKind;
    }

    public String getNodeKind() {
        return nodeKind;
    }
}
