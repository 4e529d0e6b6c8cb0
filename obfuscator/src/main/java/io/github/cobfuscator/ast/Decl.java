package io.github.cobfuscator.ast;

import io.github.cobfuscator.parser.SourceLocation;

import java.util.Collections;
import java.util.List;

public abstract class Decl extends Node {

    protected Decl(SourceLocation location) {
        super(location);
    }

    public static final class Param {
        public final CType type;
        /** Null in prototypes that omit the name. */
        public final String name;

        public Param(CType type, String name) {
            this.type = type;
            this.name = name;
        }
    }

    public static final class Function extends Decl {
        public final CType returnType;
        public final String name;
        public final List<Param> params;
        public final boolean variadic;
        /** True for {@code int f()} where the parameter list is left unspecified. */
        public final boolean unprototyped;
        public final Storage storage;
        public final boolean inline;
        /** Null for a prototype. */
        public final Stmt.Block body;

        public Function(CType returnType, String name, List<Param> params, boolean variadic, boolean unprototyped,
                        Storage storage, boolean inline, Stmt.Block body, SourceLocation location) {
            super(location);
            this.returnType = returnType;
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.variadic = variadic;
            this.unprototyped = unprototyped;
            this.storage = storage;
            this.inline = inline;
            this.body = body;
        }

        public boolean isDefinition() {
            return body != null;
        }

        public Function withBody(Stmt.Block body) {
            return new Function(returnType, name, params, variadic, unprototyped, storage, inline, body, location);
        }
    }

    /** A struct or union definition standing on its own: {@code struct Point { ... };}. */
    public static final class Struct extends Decl {
        public final CType.Struct type;

        public Struct(CType.Struct type, SourceLocation location) {
            super(location);
            this.type = type;
        }
    }

    public static final class Enum extends Decl {
        public final CType.Enum type;

        public Enum(CType.Enum type, SourceLocation location) {
            super(location);
            this.type = type;
        }
    }

    public static final class Typedef extends Decl {
        public final String name;
        public final CType type;

        public Typedef(String name, CType type, SourceLocation location) {
            super(location);
            this.name = name;
            this.type = type;
        }
    }

    public static final class GlobalVar extends Decl {
        public final CType type;
        public final String name;
        /** May be null. */
        public final Expr init;
        public final Storage storage;

        public GlobalVar(CType type, String name, Expr init, Storage storage, SourceLocation location) {
            super(location);
            this.type = type;
            this.name = name;
            this.init = init;
            this.storage = storage;
        }
    }
}
