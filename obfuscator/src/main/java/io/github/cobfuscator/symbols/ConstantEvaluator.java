package io.github.cobfuscator.symbols;

import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Expr;

import java.util.Map;

/**
 * Folds integer constant expressions: enum values, array sizes, case labels.
 */
public final class ConstantEvaluator {

    private ConstantEvaluator() {
    }

    /**
     * @return the value, or null when {@code expr} is not an integer constant expression
     */
    public static Long evaluate(Expr expr, Map<String, Long> constants) {
        if (expr instanceof Expr.IntLit lit) {
            return lit.value;
        }
        if (expr instanceof Expr.CharLit lit) {
            return lit.value;
        }
        if (expr instanceof Expr.Ident ident) {
            return constants.get(ident.name);
        }
        if (expr instanceof Expr.Cast cast) {
            Long value = evaluate(cast.operand, constants);
            if (value == null || !(cast.type instanceof CType.Base base)) {
                return null;
            }
            return truncate(value, base.name);
        }
        if (expr instanceof Expr.Unary unary) {
            Long value = evaluate(unary.operand, constants);
            if (value == null) {
                return null;
            }
            switch (unary.op) {
                case NEGATE:
                    return -value;
                case PLUS:
                    return value;
                case NOT:
                    return value == 0 ? 1L : 0L;
                case BIT_NOT:
                    return ~value;
                default:
                    return null;
            }
        }
        if (expr instanceof Expr.Ternary ternary) {
            Long condition = evaluate(ternary.condition, constants);
            if (condition == null) {
                return null;
            }
            return evaluate(condition != 0 ? ternary.whenTrue : ternary.whenFalse, constants);
        }
        if (expr instanceof Expr.Sizeof sizeof && sizeof.type != null) {
            return sizeOf(sizeof.type, constants);
        }
        if (expr instanceof Expr.Binary binary) {
            Long left = evaluate(binary.left, constants);
            Long right = evaluate(binary.right, constants);
            if (left == null || right == null) {
                return null;
            }
            return apply(binary.op, left, right);
        }
        return null;
    }

    private static Long apply(String op, long l, long r) {
        switch (op) {
            case "+": return l + r;
            case "-": return l - r;
            case "*": return l * r;
            case "/": return r == 0 ? null : l / r;
            case "%": return r == 0 ? null : l % r;
            case "<<": return l << r;
            case ">>": return l >> r;
            case "&": return l & r;
            case "|": return l | r;
            case "^": return l ^ r;
            case "<": return l < r ? 1L : 0L;
            case ">": return l > r ? 1L : 0L;
            case "<=": return l <= r ? 1L : 0L;
            case ">=": return l >= r ? 1L : 0L;
            case "==": return l == r ? 1L : 0L;
            case "!=": return l != r ? 1L : 0L;
            case "&&": return l != 0 && r != 0 ? 1L : 0L;
            case "||": return l != 0 || r != 0 ? 1L : 0L;
            default: return null;
        }
    }

    /**
     * Size in bytes on an LP64 target, or null for aggregates whose layout is not computed.
     */
    public static Long sizeOf(CType type, Map<String, Long> constants) {
        if (type instanceof CType.Pointer) {
            return 8L;
        }
        if (type instanceof CType.Enum) {
            return 4L;
        }
        if (type instanceof CType.Array array) {
            Long element = sizeOf(array.element, constants);
            Long count = array.size == null ? null : evaluate(array.size, constants);
            return element == null || count == null ? null : element * count;
        }
        if (type instanceof CType.Base base) {
            return scalarSize(base.name);
        }
        return null;
    }

    static Long scalarSize(String name) {
        switch (name) {
            case "char": case "signed char": case "unsigned char": case "_Bool":
                return 1L;
            case "short": case "short int": case "signed short": case "unsigned short": case "unsigned short int":
                return 2L;
            case "int": case "signed": case "signed int": case "unsigned": case "unsigned int": case "float":
                return 4L;
            case "long": case "long int": case "unsigned long": case "unsigned long int": case "signed long":
            case "long long": case "unsigned long long": case "double": case "size_t":
                return 8L;
            default:
                return null;
        }
    }

    /** Reduces {@code value} to the range of the named integer type. */
    public static long truncate(long value, String typeName) {
        boolean unsigned = typeName.startsWith("unsigned") || "size_t".equals(typeName) || "_Bool".equals(typeName);
        if ("_Bool".equals(typeName)) {
            return value != 0 ? 1 : 0;
        }
        Long size = scalarSize(typeName);
        if (size == null || size >= 8 || typeName.equals("float") || typeName.equals("double")) {
            return value;
        }
        int bits = (int) (size * 8);
        long mask = (1L << bits) - 1;
        long truncated = value & mask;
        if (!unsigned && (truncated & (1L << (bits - 1))) != 0) {
            truncated |= ~mask;
        }
        return truncated;
    }
}
