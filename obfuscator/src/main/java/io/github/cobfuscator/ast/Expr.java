package io.github.cobfuscator.ast;

import io.github.cobfuscator.parser.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public abstract class Expr extends Node {

    protected Expr(SourceLocation location) {
        super(location);
    }

    public static final class IntLit extends Expr {
        /** Source spelling, kept so suffixes and radix survive emission. */
        public final String text;
        public final long value;

        public IntLit(String text, long value, SourceLocation location) {
            super(location);
            this.text = text;
            this.value = value;
        }

        public static IntLit of(long value) {
            return new IntLit(Long.toString(value), value, SourceLocation.UNKNOWN);
        }
    }

    public static final class FloatLit extends Expr {
        public final String text;

        public FloatLit(String text, SourceLocation location) {
            super(location);
            this.text = text;
        }
    }

    public static final class CharLit extends Expr {
        public final String text;
        public final long value;

        public CharLit(String text, long value, SourceLocation location) {
            super(location);
            this.text = text;
            this.value = value;
        }
    }

    public static final class StringLit extends Expr {
        private final byte[] bytes;

        public StringLit(byte[] bytes, SourceLocation location) {
            super(location);
            this.bytes = bytes.clone();
        }

        /** Literal contents without the terminating NUL. */
        public byte[] bytes() {
            return bytes.clone();
        }

        public int length() {
            return bytes.length;
        }
    }

    public static final class Ident extends Expr {
        public final String name;

        public Ident(String name, SourceLocation location) {
            super(location);
            this.name = name;
        }
    }

    public static final class Binary extends Expr {
        public final String op;
        public final Expr left;
        public final Expr right;

        public Binary(String op, Expr left, Expr right, SourceLocation location) {
            super(location);
            this.op = op;
            this.left = left;
            this.right = right;
        }
    }

    public enum UnaryOp {
        NEGATE("-", true),
        PLUS("+", true),
        NOT("!", true),
        BIT_NOT("~", true),
        ADDRESS_OF("&", true),
        PRE_INC("++", true),
        PRE_DEC("--", true),
        POST_INC("++", false),
        POST_DEC("--", false);

        public final String symbol;
        public final boolean prefix;

        UnaryOp(String symbol, boolean prefix) {
            this.symbol = symbol;
            this.prefix = prefix;
        }
    }

    public static final class Unary extends Expr {
        public final UnaryOp op;
        public final Expr operand;

        public Unary(UnaryOp op, Expr operand, SourceLocation location) {
            super(location);
            this.op = op;
            this.operand = operand;
        }
    }

    public static final class Call extends Expr {
        public final Expr callee;
        public final List<Expr> args;

        public Call(Expr callee, List<Expr> args, SourceLocation location) {
            super(location);
            this.callee = callee;
            this.args = Collections.unmodifiableList(args);
        }

        public static Call of(String function, Expr... args) {
            return new Call(new Ident(function, SourceLocation.UNKNOWN), Arrays.asList(args), SourceLocation.UNKNOWN);
        }
    }

    public static final class Index extends Expr {
        public final Expr array;
        public final Expr index;

        public Index(Expr array, Expr index, SourceLocation location) {
            super(location);
            this.array = array;
            this.index = index;
        }
    }

    public static final class Member extends Expr {
        public final Expr object;
        public final String name;
        public final boolean arrow;

        public Member(Expr object, String name, boolean arrow, SourceLocation location) {
            super(location);
            this.object = object;
            this.name = name;
            this.arrow = arrow;
        }
    }

    public static final class Deref extends Expr {
        public final Expr operand;

        public Deref(Expr operand, SourceLocation location) {
            super(location);
            this.operand = operand;
        }
    }

    public static final class Ternary extends Expr {
        public final Expr condition;
        public final Expr whenTrue;
        public final Expr whenFalse;

        public Ternary(Expr condition, Expr whenTrue, Expr whenFalse, SourceLocation location) {
            super(location);
            this.condition = condition;
            this.whenTrue = whenTrue;
            this.whenFalse = whenFalse;
        }
    }

    /** {@code sizeof(type)} when {@code type} is set, {@code sizeof expr} otherwise. */
    public static final class Sizeof extends Expr {
        public final CType type;
        public final Expr operand;

        public Sizeof(CType type, Expr operand, SourceLocation location) {
            super(location);
            this.type = type;
            this.operand = operand;
        }
    }

    public static final class Assign extends Expr {
        /** "=" or a compound operator such as "+=". */
        public final String op;
        public final Expr target;
        public final Expr value;

        public Assign(String op, Expr target, Expr value, SourceLocation location) {
            super(location);
            this.op = op;
            this.target = target;
            this.value = value;
        }

        public static Assign simple(Expr target, Expr value) {
            return new Assign("=", target, value, target.location);
        }
    }

    public static final class Cast extends Expr {
        public final CType type;
        public final Expr operand;

        public Cast(CType type, Expr operand, SourceLocation location) {
            super(location);
            this.type = type;
            this.operand = operand;
        }
    }

    public static final class Comma extends Expr {
        public final Expr left;
        public final Expr right;

        public Comma(Expr left, Expr right, SourceLocation location) {
            super(location);
            this.left = left;
            this.right = right;
        }
    }

    public static final class InitList extends Expr {
        public final List<Expr> elements;

        public InitList(List<Expr> elements, SourceLocation location) {
            super(location);
            this.elements = Collections.unmodifiableList(elements);
        }
    }

    public static final class CompoundLiteral extends Expr {
        public final CType type;
        public final InitList init;

        public CompoundLiteral(CType type, InitList init, SourceLocation location) {
            super(location);
            this.type = type;
            this.init = init;
        }
    }
}
