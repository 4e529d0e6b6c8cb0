package io.github.cobfuscator.ast;

import io.github.cobfuscator.parser.SourceLocation;

/**
 * Root of the syntax tree. Nodes are immutable and own their children; passes produce
 * rewritten copies.
 */
public abstract class Node {

    public final SourceLocation location;

    protected Node(SourceLocation location) {
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }
}
