package io.github.cobfuscator.flatten;

import io.github.cobfuscator.FastRandom;
import io.github.cobfuscator.FunctionContext;
import io.github.cobfuscator.InternalInvariantException;
import io.github.cobfuscator.ProtectionConfig;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.TranslationUnit;
import io.github.cobfuscator.cfg.CfgBuilder;
import io.github.cobfuscator.cfg.CfgSimplifier;
import io.github.cobfuscator.cfg.FunctionCfg;
import io.github.cobfuscator.parser.Parser;
import io.github.cobfuscator.symbols.SymbolResolver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowFlattenerTest {

    private static final String SOURCE = "int pick(int x) {\n"
            + "  int r = 0;\n"
            + "  if (x > 0) { r = 1; } else { r = 2; }\n"
            + "  while (x > 10) x--;\n"
            + "  return r + x;\n"
            + "}\n"
            + "void touch(int *p) { if (p) *p = 1; }\n";

    private static FunctionContext context(String name, int bogusStates) {
        return context(name, bogusStates, ControlFlowFlattener.DEFAULT_STRATEGY);
    }

    private static FunctionContext context(String name, int bogusStates,
                                           ControlFlowFlattener.StateObfuscationStrategy strategy) {
        TranslationUnit unit = Parser.parse("flat.c", SOURCE);
        ProtectionConfig config = new ProtectionConfig(true, false, 42L, bogusStates, false);
        List<Decl> decls = unit.getDeclarations();
        for (int i = 0; i < decls.size(); i++) {
            if (decls.get(i) instanceof Decl.Function f && f.name.equals(name)) {
                return new FunctionContext(f, i, SymbolResolver.resolve(unit), config, strategy);
            }
        }
        throw new AssertionError("no definition of " + name);
    }

    private static FunctionCfg cfg(FunctionContext ctx) {
        return CfgSimplifier.simplify(CfgBuilder.build(ctx.function, LocalHoister.hoist(ctx)));
    }

    @Test
    public void testDispatcherShape() {
        FunctionContext ctx = context("pick", 3);
        FunctionCfg cfg = cfg(ctx);
        Stmt.Block body = ControlFlowFlattener.flatten(cfg, ctx);
        List<Stmt> statements = body.statements;

        assertEquals("r", ((Stmt.VarDecl) statements.get(0)).name);
        Stmt.VarDecl ret = (Stmt.VarDecl) statements.get(1);
        assertEquals(ControlFlowFlattener.RETURN_VAR, ret.name);
        Stmt.VarDecl state = (Stmt.VarDecl) statements.get(2);
        assertEquals(ControlFlowFlattener.STATE_VAR, state.name);
        assertTrue(state.type.isVolatile);
        assertInstanceOf(Stmt.ExprStmt.class, statements.get(3));

        Stmt.While loop = (Stmt.While) statements.get(4);
        Expr.Binary running = (Expr.Binary) loop.condition;
        assertEquals("!=", running.op);
        long exitState = ((Expr.IntLit) running.right).value;

        Stmt.Switch dispatcher = (Stmt.Switch) ((Stmt.Block) loop.body).statements.get(0);
        assertEquals(cfg.size() - 1 + 3 + 1, dispatcher.cases.size());
        assertTrue(dispatcher.cases.get(dispatcher.cases.size() - 1).isDefault());

        Set<Long> labels = new HashSet<>();
        for (Stmt.SwitchCase c : dispatcher.cases) {
            if (!c.isDefault()) {
                assertTrue(labels.add(((Expr.IntLit) c.label).value), "duplicate state label");
            }
        }
        assertFalse(labels.contains(exitState));

        Stmt.Return last = (Stmt.Return) statements.get(statements.size() - 1);
        assertEquals(ControlFlowFlattener.RETURN_VAR, ((Expr.Ident) last.value).name);
    }

    @Test
    public void testVoidFunctionHasNoReturnSlot() {
        FunctionContext ctx = context("touch", 0);
        Stmt.Block body = ControlFlowFlattener.flatten(cfg(ctx), ctx);
        for (Stmt statement : body.statements) {
            if (statement instanceof Stmt.VarDecl decl) {
                assertNotEquals(ControlFlowFlattener.RETURN_VAR, decl.name);
            }
        }
        Stmt.Return last = (Stmt.Return) body.statements.get(body.statements.size() - 1);
        assertNull(last.value);
    }

    @Test
    public void testSameSeedSameOutput() {
        FunctionContext first = context("pick", 2);
        FunctionContext second = context("pick", 2);
        Stmt.Block a = ControlFlowFlattener.flatten(cfg(first), first);
        Stmt.Block b = ControlFlowFlattener.flatten(cfg(second), second);
        Stmt.Switch switchA = (Stmt.Switch) ((Stmt.Block) ((Stmt.While) a.statements.get(4)).body).statements.get(0);
        Stmt.Switch switchB = (Stmt.Switch) ((Stmt.Block) ((Stmt.While) b.statements.get(4)).body).statements.get(0);
        for (int i = 0; i < switchA.cases.size() - 1; i++) {
            assertEquals(((Expr.IntLit) switchA.cases.get(i).label).value, ((Expr.IntLit) switchB.cases.get(i).label).value);
        }
    }

    @Test
    public void testDefaultEncodingIsInjective() {
        for (long seed = 0; seed < 8; seed++) {
            ControlFlowFlattener.StateObfuscation encoding =
                    new ControlFlowFlattener.DefaultStateObfuscation(new FastRandom(seed));
            Set<Integer> seen = new HashSet<>();
            for (int state = 0; state < 4096; state++) {
                assertTrue(seen.add(encoding.encodeCase(state)), "collision for seed " + seed);
            }
        }
    }

    @Test
    public void testUnusableEncodingIsRejected() {
        ControlFlowFlattener.StateObfuscationStrategy broken = (name, random) -> raw -> Integer.MIN_VALUE;
        assertThrows(InternalInvariantException.class,
                () -> ControlFlowFlattener.createObfuscation(broken, "f", new FastRandom(1), 4));

        FunctionContext ctx = context("pick", 1, broken);
        assertThrows(InternalInvariantException.class, () -> ControlFlowFlattener.flatten(cfg(ctx), ctx));
    }

    @Test
    public void testStrategyComesFromContext() {
        List<String> seen = new ArrayList<>();
        FunctionContext ctx = context("touch", 0, (name, random) -> {
            seen.add(name);
            return raw -> raw + 100;
        });
        Stmt.Block body = ControlFlowFlattener.flatten(cfg(ctx), ctx);
        assertEquals(List.of("touch"), seen);
        Stmt.Switch dispatcher = (Stmt.Switch) ((Stmt.Block) ((Stmt.While) body.statements.get(2)).body).statements.get(0);
        for (Stmt.SwitchCase c : dispatcher.cases) {
            if (!c.isDefault()) {
                assertTrue(((Expr.IntLit) c.label).value >= 100);
            }
        }
    }

    @Test
    public void testStateVariableIsInt() {
        FunctionContext ctx = context("touch", 1);
        Stmt.Block body = ControlFlowFlattener.flatten(cfg(ctx), ctx);
        Stmt.VarDecl state = (Stmt.VarDecl) body.statements.get(0);
        assertEquals("int", ((CType.Base) state.type).name);
    }
}
