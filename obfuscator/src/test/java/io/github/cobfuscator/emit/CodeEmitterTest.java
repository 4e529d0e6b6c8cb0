package io.github.cobfuscator.emit;

import io.github.cobfuscator.CObfuscator;
import io.github.cobfuscator.FunctionFilter;
import io.github.cobfuscator.ProtectionConfig;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodeEmitterTest {

    private final CodeEmitter emitter = new CodeEmitter();

    private static Expr ident(String name) {
        return new Expr.Ident(name, null);
    }

    private static Expr binary(String op, Expr left, Expr right) {
        return new Expr.Binary(op, left, right, null);
    }

    @Test
    public void testParenthesesFollowPrecedence() {
        assertEquals("(a + b) * c", emitter.expr(binary("*", binary("+", ident("a"), ident("b")), ident("c")), 1));
        assertEquals("a + b * c", emitter.expr(binary("+", ident("a"), binary("*", ident("b"), ident("c"))), 1));
        assertEquals("a - (b - c)", emitter.expr(binary("-", ident("a"), binary("-", ident("b"), ident("c"))), 1));
        assertEquals("a - b - c", emitter.expr(binary("-", binary("-", ident("a"), ident("b")), ident("c")), 1));

        Expr ternary = new Expr.Ternary(ident("c"), ident("x"), new Expr.Ternary(ident("d"), ident("y"), ident("z"), null), null);
        assertEquals("c ? x : d ? y : z", emitter.expr(ternary, 1));
        Expr assign = Expr.Assign.simple(ident("a"), Expr.Assign.simple(ident("b"), Expr.IntLit.of(1)));
        assertEquals("a = b = 1", emitter.expr(assign, 1));
        assertEquals("f((a, b))", emitter.expr(new Expr.Call(ident("f"),
                List.of(new Expr.Comma(ident("a"), ident("b"), null)), null), 1));
    }

    @Test
    public void testAdjacentOperatorsAreSeparated() {
        Expr negate = new Expr.Unary(Expr.UnaryOp.NEGATE, new Expr.Unary(Expr.UnaryOp.NEGATE, ident("x"), null), null);
        assertEquals("- -x", emitter.expr(negate, 1));
        Expr preDec = new Expr.Unary(Expr.UnaryOp.NEGATE, new Expr.Unary(Expr.UnaryOp.PRE_DEC, ident("x"), null), null);
        assertEquals("- --x", emitter.expr(preDec, 1));
        assertEquals("x - -5", emitter.expr(binary("-", ident("x"), Expr.IntLit.of(-5)), 1));
        Expr deref = new Expr.Deref(new Expr.Deref(ident("p"), null), null);
        assertEquals("* *p", emitter.expr(deref, 1));
        Expr address = new Expr.Unary(Expr.UnaryOp.ADDRESS_OF, new Expr.Unary(Expr.UnaryOp.ADDRESS_OF, ident("x"), null), null);
        assertEquals("& &x", emitter.expr(address, 1));
    }

    @Test
    public void testDeclarators() {
        CType charType = new CType.Base("char");
        assertEquals("char *argv[4]", emitter.declaration(new CType.Array(new CType.Pointer(charType), Expr.IntLit.of(4)), "argv", 0));
        assertEquals("int (*p)[3]", emitter.declaration(new CType.Pointer(new CType.Array(new CType.Base("int"), Expr.IntLit.of(3))), "p", 0));
        assertEquals("char *const p", emitter.declaration(new CType.Pointer(charType, true, false), "p", 0));
        assertEquals("const char *", emitter.declaration(new CType.Pointer(new CType.Base("char", false, true, false)), "", 0));
    }

    @Test
    public void testStringLiteralEscapes() {
        byte[] bytes = {'a', '"', '\\', '\n', 1, '?', '?', '=', (byte) 0xE9};
        assertEquals("\"a\\\"\\\\\\n\\001?\\?=\\351\"", CodeEmitter.stringLiteral(bytes));
        assertEquals("\"\"", CodeEmitter.stringLiteral(new byte[0]));
    }

    @Test
    public void testHelpersOnlyWhenUsed() {
        String plain = CodeEmitter.emit(Parser.parse("plain.c", "#include <stdio.h>\nint main() { return 0; }"));
        assertTrue(plain.startsWith("/* Obfuscated by c-obfuscator from plain.c. */"));
        assertTrue(plain.contains("#include <stdio.h>\n"));
        assertFalse(plain.contains(CodeEmitter.ZERO_FUNCTION));
        assertFalse(plain.contains(CodeEmitter.DECRYPT_FUNCTION));

        CObfuscator obfuscator = new CObfuscator(new ProtectionConfig(false, true, 3L),
                new FunctionFilter(new ArrayList<>(), null), 1);
        String encrypted = obfuscator.obfuscate("enc.c", "#include <stdio.h>\nint main() { puts(\"hi\"); return 0; }");
        assertTrue(encrypted.contains("static char *__cobf_decrypt("));
        assertFalse(encrypted.contains(CodeEmitter.ZERO_FUNCTION));
        assertFalse(encrypted.contains("\"hi\""));
    }

    @Test
    public void testLongTrailingZerosAreCleared() {
        CObfuscator obfuscator = new CObfuscator(new ProtectionConfig(true, false, 3L, 0, false),
                new FunctionFilter(new ArrayList<>(), null), 1);
        String output = obfuscator.obfuscate("zero.c", "int main() { char buf[32] = \"hi\"; char s[4] = \"ab\"; return buf[0] + s[3]; }");
        assertTrue(output.contains("static void __cobf_zero("));
        assertTrue(output.contains("__cobf_zero(&buf, sizeof(buf));"));
        assertTrue(output.contains("buf[0] = 'h';"));
        assertTrue(output.contains("buf[1] = 'i';"));
        assertFalse(output.contains("buf[2] = "));
        assertTrue(output.contains("s[3] = 0;"));
        assertFalse(output.contains("__cobf_zero(&s"));
    }

    @Test
    public void testCharConstantsAreEscaped() {
        CObfuscator obfuscator = new CObfuscator(new ProtectionConfig(true, false, 3L, 0, false),
                new FunctionFilter(new ArrayList<>(), null), 1);
        String output = obfuscator.obfuscate("chars.c", "int main() { char q[3] = \"'\\\\\"; return q[0]; }");
        assertTrue(output.contains("q[0] = '\\'';"), output);
        assertTrue(output.contains("q[1] = '\\\\';"), output);
        assertFalse(output.contains("\"'\\\\\""));
    }
}
