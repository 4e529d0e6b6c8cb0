package io.github.cobfuscator.ast;

import io.github.cobfuscator.parser.SourceLocation;

import java.util.Collections;
import java.util.List;

public abstract class Stmt extends Node {

    protected Stmt(SourceLocation location) {
        super(location);
    }

    public static final class Block extends Stmt {
        public final List<Stmt> statements;

        public Block(List<Stmt> statements, SourceLocation location) {
            super(location);
            this.statements = Collections.unmodifiableList(statements);
        }
    }

    public static final class If extends Stmt {
        public final Expr condition;
        public final Stmt thenBranch;
        /** May be null. */
        public final Stmt elseBranch;

        public If(Expr condition, Stmt thenBranch, Stmt elseBranch, SourceLocation location) {
            super(location);
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
    }

    public static final class For extends Stmt {
        /** Declarations or a single expression statement; empty when omitted. */
        public final List<Stmt> init;
        public final Expr condition;
        public final Expr update;
        public final Stmt body;

        public For(List<Stmt> init, Expr condition, Expr update, Stmt body, SourceLocation location) {
            super(location);
            this.init = Collections.unmodifiableList(init);
            this.condition = condition;
            this.update = update;
            this.body = body;
        }
    }

    public static final class While extends Stmt {
        public final Expr condition;
        public final Stmt body;

        public While(Expr condition, Stmt body, SourceLocation location) {
            super(location);
            this.condition = condition;
            this.body = body;
        }
    }

    public static final class DoWhile extends Stmt {
        public final Stmt body;
        public final Expr condition;

        public DoWhile(Stmt body, Expr condition, SourceLocation location) {
            super(location);
            this.body = body;
            this.condition = condition;
        }
    }

    /** One {@code case} (or {@code default} when {@code label} is null) and the statements up to the next label. */
    public static final class SwitchCase extends Node {
        public final Expr label;
        public final List<Stmt> body;

        public SwitchCase(Expr label, List<Stmt> body, SourceLocation location) {
            super(location);
            this.label = label;
            this.body = Collections.unmodifiableList(body);
        }

        public boolean isDefault() {
            return label == null;
        }
    }

    public static final class Switch extends Stmt {
        public final Expr value;
        /** In source order; the default case, if any, keeps its position for fallthrough. */
        public final List<SwitchCase> cases;

        public Switch(Expr value, List<SwitchCase> cases, SourceLocation location) {
            super(location);
            this.value = value;
            this.cases = Collections.unmodifiableList(cases);
        }
    }

    public static final class Break extends Stmt {
        public Break(SourceLocation location) {
            super(location);
        }
    }

    public static final class Continue extends Stmt {
        public Continue(SourceLocation location) {
            super(location);
        }
    }

    public static final class Return extends Stmt {
        /** May be null. */
        public final Expr value;

        public Return(Expr value, SourceLocation location) {
            super(location);
            this.value = value;
        }
    }

    public static final class ExprStmt extends Stmt {
        public final Expr expr;

        public ExprStmt(Expr expr, SourceLocation location) {
            super(location);
            this.expr = expr;
        }

        public static ExprStmt of(Expr expr) {
            return new ExprStmt(expr, expr.location);
        }
    }

    public static final class VarDecl extends Stmt {
        public final CType type;
        public final String name;
        /** May be null. */
        public final Expr init;
        public final Storage storage;

        public VarDecl(CType type, String name, Expr init, Storage storage, SourceLocation location) {
            super(location);
            this.type = type;
            this.name = name;
            this.init = init;
            this.storage = storage;
        }
    }

    public static final class Empty extends Stmt {
        public Empty(SourceLocation location) {
            super(location);
        }
    }

    /**
     * Fills the char array {@code target} of {@code size} bytes from {@code literal}, padding
     * with NULs or truncating exactly like a {@code char a[size] = "..."} initializer.
     */
    public static final class StringInit extends Stmt {
        public final Expr target;
        public final Expr.StringLit literal;
        public final int size;

        public StringInit(Expr target, Expr.StringLit literal, int size, SourceLocation location) {
            super(location);
            this.target = target;
            this.literal = literal;
            this.size = size;
        }

        /** The bytes the array holds after initialization. */
        public byte[] contents() {
            byte[] source = literal.bytes();
            byte[] result = new byte[size];
            System.arraycopy(source, 0, result, 0, Math.min(size, source.length));
            return result;
        }
    }

    /** Sets every byte of the aggregate object {@code target} to zero. */
    public static final class ZeroFill extends Stmt {
        public final Expr target;

        public ZeroFill(Expr target, SourceLocation location) {
            super(location);
            this.target = target;
        }
    }
}
