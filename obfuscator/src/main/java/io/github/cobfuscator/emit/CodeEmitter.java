package io.github.cobfuscator.emit;

import io.github.cobfuscator.InternalInvariantException;
import io.github.cobfuscator.Util;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.Storage;
import io.github.cobfuscator.ast.TranslationUnit;
import io.github.cobfuscator.strings.StringEncryptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a translation unit back to C source. Parentheses are inserted from operator
 * precedence, so the tree shape alone decides evaluation order.
 */
public class CodeEmitter {

    public static final String ZERO_FUNCTION = "__cobf_zero";
    public static final String DECRYPT_FUNCTION = StringEncryptor.DECRYPT_FUNCTION;

    private static final String INDENT = "    ";

    private static final int PREC_COMMA = 1;
    private static final int PREC_ASSIGN = 2;
    private static final int PREC_TERNARY = 3;
    private static final int PREC_UNARY = 14;
    private static final int PREC_POSTFIX = 15;
    private static final int PREC_PRIMARY = 16;

    private final StringBuilder out = new StringBuilder();
    private boolean zeroUsed;
    private boolean decryptUsed;

    /**
     * Emits {@code unit}; the runtime helpers are included only when the output calls them.
     */
    public static String emit(TranslationUnit unit) {
        return new CodeEmitter().emitUnit(unit);
    }

    private String emitUnit(TranslationUnit unit) {
        emitDeclarations(unit);
        StringBuilder result = new StringBuilder();
        result.append(Util.dynamicFormat(Util.readResource("sources/header.c"),
                Util.createMap("source", unit.getFileName())));
        for (String include : unit.getIncludes()) {
            result.append("#include <").append(include).append(">\n");
        }
        result.append('\n');
        if (zeroUsed) {
            result.append(Util.readResource("sources/cobf_zero.c")).append('\n');
        }
        if (decryptUsed) {
            result.append(Util.readResource("sources/cobf_decrypt.c")).append('\n');
        }
        return result.append(out).toString();
    }

    private void emitDeclarations(TranslationUnit unit) {
        Decl previous = null;
        for (Decl decl : unit.getDeclarations()) {
            if (previous != null && (decl instanceof Decl.Function || previous instanceof Decl.Function
                    || decl.getClass() != previous.getClass())) {
                out.append('\n');
            }
            emitDecl(decl);
            previous = decl;
        }
    }

    // ---------------------------------------------------------------- declarations

    private void emitDecl(Decl decl) {
        if (decl instanceof Decl.Function f) {
            StringBuilder signature = new StringBuilder();
            signature.append(storagePrefix(f.storage));
            if (f.inline) {
                signature.append("inline ");
            }
            List<String> params = new ArrayList<>();
            for (Decl.Param param : f.params) {
                params.add(declaration(param.type, param.name == null ? "" : param.name, 0));
            }
            if (f.variadic) {
                params.add("...");
            }
            String paramList = params.isEmpty() && !f.unprototyped ? "void" : String.join(", ", params);
            signature.append(declaration(f.returnType, f.name + "(" + paramList + ")", 0));
            out.append(signature);
            if (f.body == null) {
                out.append(";\n");
            } else {
                out.append('\n');
                emitBlock(f.body, 0);
            }
        } else if (decl instanceof Decl.Struct s) {
            out.append(specifiers(s.type, 0)).append(";\n");
        } else if (decl instanceof Decl.Enum e) {
            out.append(specifiers(e.type, 0)).append(";\n");
        } else if (decl instanceof Decl.Typedef t) {
            out.append("typedef ").append(declaration(t.type, t.name, 0)).append(";\n");
        } else if (decl instanceof Decl.GlobalVar g) {
            out.append(storagePrefix(g.storage)).append(declaration(g.type, g.name, 0));
            if (g.init != null) {
                out.append(" = ").append(expr(g.init, PREC_ASSIGN));
            }
            out.append(";\n");
        } else {
            throw new InternalInvariantException("cannot emit declaration " + decl.getClass().getSimpleName());
        }
    }

    private static String storagePrefix(Storage storage) {
        return storage == Storage.NONE ? "" : storage.getKeyword() + " ";
    }

    /** Full declaration of {@code inner} (a name, or empty for a type name) with type {@code type}. */
    String declaration(CType type, String inner, int indent) {
        String declarator = declarator(type, inner);
        String spec = specifiers(innermost(type), indent);
        return declarator.isEmpty() ? spec : spec + " " + declarator;
    }

    private static CType innermost(CType type) {
        CType current = type;
        while (true) {
            if (current instanceof CType.Pointer p) {
                current = p.target;
            } else if (current instanceof CType.Array a) {
                current = a.element;
            } else {
                return current;
            }
        }
    }

    private String declarator(CType type, String inner) {
        if (type instanceof CType.Pointer p) {
            StringBuilder s = new StringBuilder("*");
            if (p.isConst) {
                s.append("const ");
            }
            if (p.isVolatile) {
                s.append("volatile ");
            }
            String result = s + inner;
            if (p.isConst || p.isVolatile) {
                result = result.trim();
            }
            if (p.target instanceof CType.Array) {
                result = "(" + result + ")";
            }
            return declarator(p.target, result);
        }
        if (type instanceof CType.Array a) {
            return declarator(a.element, inner + "[" + (a.size == null ? "" : expr(a.size, PREC_COMMA)) + "]");
        }
        return inner;
    }

    private String specifiers(CType type, int indent) {
        StringBuilder s = new StringBuilder();
        if (type.isConst) {
            s.append("const ");
        }
        if (type.isVolatile) {
            s.append("volatile ");
        }
        if (type instanceof CType.Base base) {
            s.append(base.name);
        } else if (type instanceof CType.Struct struct) {
            s.append(struct.union ? "union" : "struct");
            if (struct.tag != null) {
                s.append(' ').append(struct.tag);
            }
            if (struct.isDefinition()) {
                s.append(" {\n");
                for (CType.Field field : struct.fields) {
                    indent(s, indent + 1);
                    s.append(declaration(field.type, field.name, indent + 1)).append(";\n");
                }
                indent(s, indent);
                s.append('}');
            }
        } else if (type instanceof CType.Enum enumType) {
            s.append("enum");
            if (enumType.tag != null) {
                s.append(' ').append(enumType.tag);
            }
            if (enumType.isDefinition()) {
                s.append(" {\n");
                for (int i = 0; i < enumType.enumerators.size(); i++) {
                    CType.Enumerator enumerator = enumType.enumerators.get(i);
                    indent(s, indent + 1);
                    s.append(enumerator.name);
                    if (enumerator.value != null) {
                        s.append(" = ").append(expr(enumerator.value, PREC_TERNARY));
                    }
                    s.append(i + 1 < enumType.enumerators.size() ? ",\n" : "\n");
                }
                indent(s, indent);
                s.append('}');
            }
        } else {
            throw new InternalInvariantException("unexpected type " + type.getClass().getSimpleName());
        }
        return s.toString();
    }

    private static void indent(StringBuilder s, int level) {
        for (int i = 0; i < level; i++) {
            s.append(INDENT);
        }
    }

    // ---------------------------------------------------------------- statements

    private void emitBlock(Stmt.Block block, int level) {
        indent(out, level);
        out.append("{\n");
        for (Stmt statement : block.statements) {
            emitStmt(statement, level + 1);
        }
        indent(out, level);
        out.append("}\n");
    }

    /** Emits {@code body} as the braced body of a control statement whose header is already written. */
    private void emitBody(Stmt body, int level) {
        out.append("{\n");
        if (body instanceof Stmt.Block block) {
            for (Stmt statement : block.statements) {
                emitStmt(statement, level + 1);
            }
        } else {
            emitStmt(body, level + 1);
        }
        indent(out, level);
        out.append('}');
    }

    private void emitStmt(Stmt stmt, int level) {
        if (stmt instanceof Stmt.Block block) {
            emitBlock(block, level);
            return;
        }
        indent(out, level);
        if (stmt instanceof Stmt.If s) {
            emitIf(s, level);
        } else if (stmt instanceof Stmt.While s) {
            out.append("while (").append(expr(s.condition, PREC_COMMA)).append(") ");
            emitBody(s.body, level);
            out.append('\n');
        } else if (stmt instanceof Stmt.DoWhile s) {
            out.append("do ");
            emitBody(s.body, level);
            out.append(" while (").append(expr(s.condition, PREC_COMMA)).append(");\n");
        } else if (stmt instanceof Stmt.For s) {
            out.append("for (").append(forInit(s.init)).append(';');
            if (s.condition != null) {
                out.append(' ').append(expr(s.condition, PREC_COMMA));
            }
            out.append(';');
            if (s.update != null) {
                out.append(' ').append(expr(s.update, PREC_COMMA));
            }
            out.append(") ");
            emitBody(s.body, level);
            out.append('\n');
        } else if (stmt instanceof Stmt.Switch s) {
            out.append("switch (").append(expr(s.value, PREC_COMMA)).append(") {\n");
            for (Stmt.SwitchCase c : s.cases) {
                indent(out, level);
                if (c.isDefault()) {
                    out.append("default:\n");
                } else {
                    out.append("case ").append(expr(c.label, PREC_TERNARY)).append(":\n");
                }
                for (Stmt statement : c.body) {
                    emitStmt(statement, level + 1);
                }
            }
            indent(out, level);
            out.append("}\n");
        } else if (stmt instanceof Stmt.Break) {
            out.append("break;\n");
        } else if (stmt instanceof Stmt.Continue) {
            out.append("continue;\n");
        } else if (stmt instanceof Stmt.Return s) {
            out.append(s.value == null ? "return;\n" : "return " + expr(s.value, PREC_COMMA) + ";\n");
        } else if (stmt instanceof Stmt.ExprStmt s) {
            out.append(expr(s.expr, PREC_COMMA)).append(";\n");
        } else if (stmt instanceof Stmt.VarDecl s) {
            out.append(varDecl(s)).append(";\n");
        } else if (stmt instanceof Stmt.Empty) {
            out.append(";\n");
        } else if (stmt instanceof Stmt.StringInit s) {
            emitStringInit(s, level);
        } else if (stmt instanceof Stmt.ZeroFill s) {
            out.append(zeroFill(s.target)).append(";\n");
        } else {
            throw new InternalInvariantException("cannot emit statement " + stmt.getClass().getSimpleName());
        }
    }

    private String zeroFill(Expr target) {
        Expr call = Expr.Call.of(ZERO_FUNCTION,
                new Expr.Unary(Expr.UnaryOp.ADDRESS_OF, target, target.location),
                new Expr.Sizeof(null, target, target.location));
        return expr(call, PREC_COMMA);
    }

    private void emitIf(Stmt.If s, int level) {
        out.append("if (").append(expr(s.condition, PREC_COMMA)).append(") ");
        emitBody(s.thenBranch, level);
        if (s.elseBranch == null) {
            out.append('\n');
        } else if (s.elseBranch instanceof Stmt.If elseIf) {
            out.append(" else ");
            emitIf(elseIf, level);
        } else {
            out.append(" else ");
            emitBody(s.elseBranch, level);
            out.append('\n');
        }
    }

    private String varDecl(Stmt.VarDecl s) {
        String text = storagePrefix(s.storage) + declaration(s.type, s.name, 0);
        return s.init == null ? text : text + " = " + expr(s.init, PREC_ASSIGN);
    }

    private String forInit(List<Stmt> init) {
        if (init.isEmpty()) {
            return "";
        }
        if (init.get(0) instanceof Stmt.VarDecl first) {
            StringBuilder s = new StringBuilder(varDecl(first));
            for (int i = 1; i < init.size(); i++) {
                Stmt.VarDecl next = (Stmt.VarDecl) init.get(i);
                s.append(", ").append(declarator(next.type, next.name));
                if (next.init != null) {
                    s.append(" = ").append(expr(next.init, PREC_ASSIGN));
                }
            }
            return s.toString();
        }
        List<String> parts = new ArrayList<>();
        for (Stmt statement : init) {
            parts.add(expr(((Stmt.ExprStmt) statement).expr, PREC_ASSIGN));
        }
        return String.join(", ", parts);
    }

    /**
     * Plain-text char array initialization, one byte per assignment. A long run of
     * trailing NULs is cleared with the zeroing helper instead.
     */
    private void emitStringInit(Stmt.StringInit s, int level) {
        byte[] contents = s.contents();
        int end = contents.length;
        int last = contents.length - 1;
        while (last >= 0 && contents[last] == 0) {
            last--;
        }
        boolean first = true;
        if (contents.length - (last + 1) > 8) {
            out.append(zeroFill(s.target)).append(";\n");
            end = last + 1;
            first = false;
        }
        String target = expr(s.target, PREC_POSTFIX);
        for (int i = 0; i < end; i++) {
            if (!first) {
                indent(out, level);
            }
            first = false;
            out.append(target).append('[').append(i).append("] = ").append(charConstant(contents[i])).append(";\n");
        }
        if (first) {
            out.append(";\n");
        }
    }

    private static String charConstant(byte b) {
        if (b >= 0x20 && b < 0x7F) {
            if (b == '\'' || b == '\\') {
                return "'\\" + (char) b + "'";
            }
            return "'" + (char) b + "'";
        }
        return Integer.toString(b);
    }

    // ---------------------------------------------------------------- expressions

    private static int precedence(Expr expr) {
        if (expr instanceof Expr.Comma) {
            return PREC_COMMA;
        }
        if (expr instanceof Expr.Assign) {
            return PREC_ASSIGN;
        }
        if (expr instanceof Expr.Ternary) {
            return PREC_TERNARY;
        }
        if (expr instanceof Expr.Binary binary) {
            switch (binary.op) {
                case "||": return 4;
                case "&&": return 5;
                case "|": return 6;
                case "^": return 7;
                case "&": return 8;
                case "==": case "!=": return 9;
                case "<": case ">": case "<=": case ">=": return 10;
                case "<<": case ">>": return 11;
                case "+": case "-": return 12;
                case "*": case "/": case "%": return 13;
                default:
                    throw new InternalInvariantException("unknown binary operator " + binary.op);
            }
        }
        if (expr instanceof Expr.Unary unary) {
            return unary.op.prefix ? PREC_UNARY : PREC_POSTFIX;
        }
        if (expr instanceof Expr.Cast || expr instanceof Expr.Deref || expr instanceof Expr.Sizeof) {
            return PREC_UNARY;
        }
        if (expr instanceof Expr.Call || expr instanceof Expr.Index || expr instanceof Expr.Member
                || expr instanceof Expr.CompoundLiteral) {
            return PREC_POSTFIX;
        }
        if (expr instanceof Expr.IntLit lit && lit.text.startsWith("-")) {
            return PREC_UNARY;
        }
        return PREC_PRIMARY;
    }

    String expr(Expr expr, int minPrecedence) {
        String text = render(expr);
        return precedence(expr) < minPrecedence ? "(" + text + ")" : text;
    }

    private String render(Expr expr) {
        if (expr instanceof Expr.IntLit e) {
            return e.text;
        } else if (expr instanceof Expr.FloatLit e) {
            return e.text;
        } else if (expr instanceof Expr.CharLit e) {
            return e.text;
        } else if (expr instanceof Expr.StringLit e) {
            return stringLiteral(e.bytes());
        } else if (expr instanceof Expr.Ident e) {
            return e.name;
        } else if (expr instanceof Expr.Binary e) {
            int p = precedence(e);
            return expr(e.left, p) + " " + e.op + " " + expr(e.right, p + 1);
        } else if (expr instanceof Expr.Unary e) {
            if (e.op.prefix) {
                String operand = expr(e.operand, PREC_UNARY);
                String separator = !operand.isEmpty() && "+-&".indexOf(operand.charAt(0)) >= 0
                        && e.op.symbol.charAt(e.op.symbol.length() - 1) == operand.charAt(0) ? " " : "";
                return e.op.symbol + separator + operand;
            }
            return expr(e.operand, PREC_POSTFIX) + e.op.symbol;
        } else if (expr instanceof Expr.Call e) {
            if (e.callee instanceof Expr.Ident callee) {
                zeroUsed |= ZERO_FUNCTION.equals(callee.name);
                decryptUsed |= DECRYPT_FUNCTION.equals(callee.name);
            }
            List<String> args = new ArrayList<>(e.args.size());
            for (Expr arg : e.args) {
                args.add(expr(arg, PREC_ASSIGN));
            }
            return expr(e.callee, PREC_POSTFIX) + "(" + String.join(", ", args) + ")";
        } else if (expr instanceof Expr.Index e) {
            return expr(e.array, PREC_POSTFIX) + "[" + expr(e.index, PREC_COMMA) + "]";
        } else if (expr instanceof Expr.Member e) {
            return expr(e.object, PREC_POSTFIX) + (e.arrow ? "->" : ".") + e.name;
        } else if (expr instanceof Expr.Deref e) {
            String operand = expr(e.operand, PREC_UNARY);
            return operand.startsWith("*") ? "* " + operand : "*" + operand;
        } else if (expr instanceof Expr.Ternary e) {
            return expr(e.condition, PREC_TERNARY + 1) + " ? " + expr(e.whenTrue, PREC_COMMA)
                    + " : " + expr(e.whenFalse, PREC_TERNARY);
        } else if (expr instanceof Expr.Sizeof e) {
            if (e.type != null) {
                return "sizeof(" + declaration(e.type, "", 0) + ")";
            }
            return "sizeof(" + expr(e.operand, PREC_COMMA) + ")";
        } else if (expr instanceof Expr.Assign e) {
            return expr(e.target, PREC_UNARY) + " " + e.op + " " + expr(e.value, PREC_ASSIGN);
        } else if (expr instanceof Expr.Cast e) {
            return "(" + declaration(e.type, "", 0) + ")" + expr(e.operand, PREC_UNARY);
        } else if (expr instanceof Expr.Comma e) {
            return expr(e.left, PREC_COMMA) + ", " + expr(e.right, PREC_ASSIGN);
        } else if (expr instanceof Expr.InitList e) {
            if (e.elements.isEmpty()) {
                return "{ 0 }";
            }
            List<String> elements = new ArrayList<>(e.elements.size());
            for (Expr element : e.elements) {
                elements.add(expr(element, PREC_ASSIGN));
            }
            return "{ " + String.join(", ", elements) + " }";
        } else if (expr instanceof Expr.CompoundLiteral e) {
            return "(" + declaration(e.type, "", 0) + ")" + render(e.init);
        }
        throw new InternalInvariantException("cannot emit expression " + expr.getClass().getSimpleName());
    }

    static String stringLiteral(byte[] bytes) {
        StringBuilder s = new StringBuilder("\"");
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            switch (b) {
                case '"': s.append("\\\""); break;
                case '\\': s.append("\\\\"); break;
                case '\n': s.append("\\n"); break;
                case '\t': s.append("\\t"); break;
                case '\r': s.append("\\r"); break;
                case '?':
                    s.append(i > 0 && bytes[i - 1] == '?' ? "\\?" : "?");
                    break;
                default:
                    if (b >= 0x20 && b < 0x7F) {
                        s.append((char) b);
                    } else {
                        s.append(String.format("\\%03o", b));
                    }
                    break;
            }
        }
        return s.append('"').toString();
    }
}
