package io.github.cobfuscator.ast;

import io.github.cobfuscator.parser.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * C types as written in declarations. Qualifiers apply to the outermost level only;
 * a pointer's {@code const} is the {@code * const} form.
 */
public abstract class CType {

    public final boolean isConst;
    public final boolean isVolatile;

    protected CType(boolean isConst, boolean isVolatile) {
        this.isConst = isConst;
        this.isVolatile = isVolatile;
    }

    public abstract CType withQualifiers(boolean isConst, boolean isVolatile);

    public CType unqualified() {
        return isConst || isVolatile ? withQualifiers(false, false) : this;
    }

    /** Drops {@code const} only; {@code volatile} accesses stay observable. */
    public CType withoutConst() {
        return isConst ? withQualifiers(false, isVolatile) : this;
    }

    public boolean isVoid() {
        return false;
    }

    /** Named base type: builtin specifiers ("unsigned long") or a typedef name. */
    public static final class Base extends CType {
        public final String name;
        public final boolean typedefName;

        public Base(String name, boolean typedefName, boolean isConst, boolean isVolatile) {
            super(isConst, isVolatile);
            this.name = name;
            this.typedefName = typedefName;
        }

        public Base(String name) {
            this(name, false, false, false);
        }

        @Override
        public CType withQualifiers(boolean isConst, boolean isVolatile) {
            return new Base(name, typedefName, isConst, isVolatile);
        }

        @Override
        public boolean isVoid() {
            return "void".equals(name);
        }

        public boolean isChar() {
            return "char".equals(name) || "signed char".equals(name) || "unsigned char".equals(name);
        }
    }

    public static final class Field {
        public final CType type;
        public final String name;

        public Field(CType type, String name) {
            this.type = type;
            this.name = name;
        }
    }

    /** Struct or union; {@code fields} is null for a plain reference to the tag. */
    public static final class Struct extends CType {
        public final boolean union;
        public final String tag;
        public final List<Field> fields;

        public Struct(boolean union, String tag, List<Field> fields, boolean isConst, boolean isVolatile) {
            super(isConst, isVolatile);
            this.union = union;
            this.tag = tag;
            this.fields = fields == null ? null : Collections.unmodifiableList(fields);
        }

        public boolean isDefinition() {
            return fields != null;
        }

        public Struct reference() {
            return new Struct(union, tag, null, isConst, isVolatile);
        }

        @Override
        public CType withQualifiers(boolean isConst, boolean isVolatile) {
            return new Struct(union, tag, fields, isConst, isVolatile);
        }
    }

    public static final class Enumerator {
        public final String name;
        public final Expr value;
        public final SourceLocation location;

        public Enumerator(String name, Expr value, SourceLocation location) {
            this.name = name;
            this.value = value;
            this.location = location;
        }
    }

    /** Enum; {@code enumerators} is null for a plain reference to the tag. */
    public static final class Enum extends CType {
        public final String tag;
        public final List<Enumerator> enumerators;

        public Enum(String tag, List<Enumerator> enumerators, boolean isConst, boolean isVolatile) {
            super(isConst, isVolatile);
            this.tag = tag;
            this.enumerators = enumerators == null ? null : Collections.unmodifiableList(enumerators);
        }

        public boolean isDefinition() {
            return enumerators != null;
        }

        public Enum reference() {
            return new Enum(tag, null, isConst, isVolatile);
        }

        @Override
        public CType withQualifiers(boolean isConst, boolean isVolatile) {
            return new Enum(tag, enumerators, isConst, isVolatile);
        }
    }

    public static final class Pointer extends CType {
        public final CType target;

        public Pointer(CType target, boolean isConst, boolean isVolatile) {
            super(isConst, isVolatile);
            this.target = target;
        }

        public Pointer(CType target) {
            this(target, false, false);
        }

        @Override
        public CType withQualifiers(boolean isConst, boolean isVolatile) {
            return new Pointer(target, isConst, isVolatile);
        }
    }

    /** Array; {@code size} is null for {@code []}. */
    public static final class Array extends CType {
        public final CType element;
        public final Expr size;

        public Array(CType element, Expr size) {
            super(false, false);
            this.element = element;
            this.size = size;
        }

        @Override
        public CType withQualifiers(boolean isConst, boolean isVolatile) {
            return new Array(element.withQualifiers(isConst, isVolatile), size);
        }

        @Override
        public CType unqualified() {
            return new Array(element.unqualified(), size);
        }

        @Override
        public CType withoutConst() {
            return new Array(element.withoutConst(), size);
        }

        public Array withSize(Expr size) {
            return new Array(element, size);
        }
    }

    /** Innermost non-array, non-pointer type. */
    public static CType base(CType type) {
        CType current = type;
        while (true) {
            if (current instanceof Array array) {
                current = array.element;
            } else if (current instanceof Pointer pointer) {
                current = pointer.target;
            } else {
                return current;
            }
        }
    }

    public static boolean isCharArray(CType type) {
        return type instanceof Array array && array.element.unqualified() instanceof Base base && base.isChar();
    }
}
