package io.github.cobfuscator.symbols;

import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.parser.SourceLocation;

public class Symbol {

    public enum Kind {
        FUNCTION,
        GLOBAL,
        ENUM_CONSTANT,
        TYPEDEF,
        BUILTIN_FUNCTION,
        BUILTIN_OBJECT
    }

    private final String name;
    private final Kind kind;
    private final CType type;
    private final int arity;
    private final boolean variadic;
    private final boolean defined;
    private final SourceLocation location;

    public Symbol(String name, Kind kind, CType type, int arity, boolean variadic, boolean defined,
                  SourceLocation location) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.arity = arity;
        this.variadic = variadic;
        this.defined = defined;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Declared type: the return type for functions, null for builtins.
     */
    public CType getType() {
        return type;
    }

    public int getArity() {
        return arity;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public boolean isDefined() {
        return defined;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isFunction() {
        return kind == Kind.FUNCTION || kind == Kind.BUILTIN_FUNCTION;
    }

    Symbol markDefined(CType type, SourceLocation location) {
        return new Symbol(name, kind, type, arity, variadic, true, location);
    }

    @Override
    public String toString() {
        return String.format("Symbol{%s %s, arity=%d%s%s}", kind, name, arity,
                variadic ? ", variadic" : "", defined ? ", defined" : "");
    }
}
