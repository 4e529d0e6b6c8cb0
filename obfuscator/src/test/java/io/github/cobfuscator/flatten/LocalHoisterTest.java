package io.github.cobfuscator.flatten;

import io.github.cobfuscator.CObfuscator;
import io.github.cobfuscator.FunctionContext;
import io.github.cobfuscator.FunctionFilter;
import io.github.cobfuscator.ProtectionConfig;
import io.github.cobfuscator.UnsupportedConstructException;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.Storage;
import io.github.cobfuscator.ast.TranslationUnit;
import io.github.cobfuscator.parser.Parser;
import io.github.cobfuscator.symbols.SymbolResolver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LocalHoisterTest {

    private static FunctionContext context(String source, String name, boolean renameLocals) {
        TranslationUnit unit = Parser.parse("hoist.c", source);
        ProtectionConfig config = new ProtectionConfig(true, false, 1L, 0, renameLocals);
        List<Decl> decls = unit.getDeclarations();
        for (int i = 0; i < decls.size(); i++) {
            if (decls.get(i) instanceof Decl.Function f && f.name.equals(name) && f.isDefinition()) {
                return new FunctionContext(f, i, SymbolResolver.resolve(unit), config);
            }
        }
        throw new AssertionError("no definition of " + name);
    }

    private static List<String> names(List<Stmt.VarDecl> decls) {
        List<String> names = new ArrayList<>();
        for (Stmt.VarDecl decl : decls) {
            names.add(decl.name);
        }
        return names;
    }

    @Test
    public void testShadowedLocalsGetUniqueNames() {
        FunctionContext ctx = context("int x;\n"
                + "int f(int a) { int x = 1; { int x = 2; a += x; } return x + a; }", "f", false);
        List<Stmt> body = LocalHoister.hoist(ctx);
        assertEquals(List.of("x_1", "x_2"), names(ctx.hoisted));
        for (Stmt.VarDecl decl : ctx.hoisted) {
            assertNull(decl.init);
        }

        Expr.Assign first = (Expr.Assign) ((Stmt.ExprStmt) body.get(0)).expr;
        assertEquals("x_1", ((Expr.Ident) first.target).name);
        Stmt.Block inner = (Stmt.Block) body.get(1);
        Expr.Assign compound = (Expr.Assign) ((Stmt.ExprStmt) inner.statements.get(1)).expr;
        assertEquals("x_2", ((Expr.Ident) compound.value).name);
        Expr.Binary result = (Expr.Binary) ((Stmt.Return) body.get(2)).value;
        assertEquals("x_1", ((Expr.Ident) result.left).name);
        assertEquals("a", ((Expr.Ident) result.right).name);
    }

    @Test
    public void testRenameLocals() {
        FunctionContext ctx = context("int f(int a) { int total = a; int count = 2; return total * count; }", "f", true);
        LocalHoister.hoist(ctx);
        assertEquals(List.of("__cobf_v0", "__cobf_v1"), names(ctx.hoisted));
    }

    @Test
    public void testArraySizesAreCompleted() {
        FunctionContext ctx = context("void f() { int a[] = {1, 2, 3}; char s[] = \"hi\"; }", "f", false);
        List<Stmt> body = LocalHoister.hoist(ctx);
        CType.Array a = (CType.Array) ctx.hoisted.get(0).type;
        assertEquals(3, ((Expr.IntLit) a.size).value);
        CType.Array s = (CType.Array) ctx.hoisted.get(1).type;
        assertEquals(3, ((Expr.IntLit) s.size).value);

        assertInstanceOf(Stmt.ZeroFill.class, body.get(0));
        for (int i = 1; i <= 3; i++) {
            Expr.Assign assign = (Expr.Assign) ((Stmt.ExprStmt) body.get(i)).expr;
            assertEquals(i - 1, ((Expr.IntLit) ((Expr.Index) assign.target).index).value);
        }
        Stmt.StringInit init = (Stmt.StringInit) body.get(4);
        assertEquals(3, init.size);
        assertEquals(5, body.size());
    }

    @Test
    public void testDeclarationInLoopIsReinitialized() {
        FunctionContext ctx = context("int f() { int s = 0; for (int i = 0; i < 3; i++) { int t = i; s += t; } return s; }",
                "f", false);
        List<Stmt> body = LocalHoister.hoist(ctx);
        assertEquals(List.of("s", "i", "t"), names(ctx.hoisted));
        Stmt.For loop = (Stmt.For) body.get(1);
        assertEquals(1, loop.init.size());
        Stmt.Block loopBody = (Stmt.Block) loop.body;
        Expr.Assign reset = (Expr.Assign) ((Stmt.ExprStmt) loopBody.statements.get(0)).expr;
        assertEquals("t", ((Expr.Ident) reset.target).name);
        assertEquals("i", ((Expr.Ident) reset.value).name);
    }

    @Test
    public void testVolatileSurvivesHoisting() {
        FunctionContext ctx = context("int f(int n) { volatile int v = n; const int c = 2; "
                + "const volatile char tag[4] = \"ab\"; return v + c + tag[0]; }", "f", false);
        LocalHoister.hoist(ctx);

        CType v = ctx.hoisted.get(0).type;
        assertTrue(v.isVolatile);
        assertFalse(v.isConst);
        assertFalse(ctx.hoisted.get(1).type.isConst);
        CType.Array tag = (CType.Array) ctx.hoisted.get(2).type;
        assertTrue(tag.element.isVolatile);
        assertFalse(tag.element.isConst);
    }

    @Test
    public void testVolatileInFlattenedOutput() {
        CObfuscator obfuscator = new CObfuscator(new ProtectionConfig(true, false, 4L),
                new FunctionFilter(new ArrayList<>(), null), 1);
        String output = obfuscator.obfuscate("vol.c", "int f(int n) { volatile int v = n; "
                + "while (n-- > 0) { volatile int w = n; v += w; } return v; }");
        assertTrue(output.contains("volatile int v;"), output);
        assertTrue(output.contains("volatile int w;"), output);
    }

    @Test
    public void testStaticLocalKeepsInitializer() {
        FunctionContext ctx = context("int f() { static int calls = 5; calls++; return calls; }", "f", false);
        List<Stmt> body = LocalHoister.hoist(ctx);
        Stmt.VarDecl calls = ctx.hoisted.get(0);
        assertEquals(Storage.STATIC, calls.storage);
        assertEquals(5, ((Expr.IntLit) calls.init).value);
        assertEquals(2, body.size());
    }

    @Test
    public void testStructInitializerBecomesCompoundLiteral() {
        FunctionContext ctx = context("struct P { int x; int y; };\nint f() { struct P p = {1, 2}; return p.y; }", "f", false);
        List<Stmt> body = LocalHoister.hoist(ctx);
        Expr.Assign assign = (Expr.Assign) ((Stmt.ExprStmt) body.get(0)).expr;
        assertInstanceOf(Expr.CompoundLiteral.class, assign.value);
    }

    @Test
    public void testVariableLengthArray() {
        FunctionContext ctx = context("void f(int n) { int a[n]; a[0] = 1; }", "f", false);
        UnsupportedConstructException ex = assertThrows(UnsupportedConstructException.class, () -> LocalHoister.hoist(ctx));
        assertEquals("variable-length array", ex.getNodeKind());
    }

    @Test
    public void testBraceElidedInitializer() {
        FunctionContext ctx = context("void f() { int m[2][2] = {1, 2, 3, 4}; }", "f", false);
        assertThrows(UnsupportedConstructException.class, () -> LocalHoister.hoist(ctx));
    }
}
