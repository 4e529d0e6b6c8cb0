package io.github.cobfuscator.symbols;

import io.github.cobfuscator.UndeclaredIdentifierException;
import io.github.cobfuscator.UnsupportedConstructException;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolResolverTest {

    private static SymbolTable resolve(String source) {
        return SymbolResolver.resolve(Parser.parse("test.c", source));
    }

    @Test
    public void testGlobalsFunctionsAndBuiltins() {
        SymbolTable table = resolve("#include <stdio.h>\n"
                + "int counter = 3;\n"
                + "int add(int a, int b);\n"
                + "int main() { printf(\"%d\", add(counter, 1)); return 0; }\n"
                + "int add(int a, int b) { return a + b; }\n");
        assertEquals(Symbol.Kind.GLOBAL, table.lookup("counter").getKind());
        Symbol add = table.lookup("add");
        assertEquals(Symbol.Kind.FUNCTION, add.getKind());
        assertTrue(add.isDefined());
        assertEquals(2, add.getArity());
        assertEquals(5, add.getLocation().getLine());
        Symbol printf = table.lookup("printf");
        assertEquals(Symbol.Kind.BUILTIN_FUNCTION, printf.getKind());
        assertTrue(printf.isVariadic());
        assertEquals(Symbol.Kind.BUILTIN_OBJECT, table.lookup("stdout").getKind());
        assertNull(table.lookup("strlen"));
    }

    @Test
    public void testPrototypeWithoutDefinition() {
        SymbolTable table = resolve("int later(void);\nint main() { return later(); }\n");
        assertFalse(table.lookup("later").isDefined());
    }

    @Test
    public void testEnumValues() {
        SymbolTable table = resolve("enum Color { RED, GREEN, BLUE = 5, YELLOW, MASK = 1 << 4, LAST = MASK - 1 };\n"
                + "int pick() { return YELLOW; }\n");
        assertEquals(0L, table.getEnumValues().get("RED"));
        assertEquals(1L, table.getEnumValues().get("GREEN"));
        assertEquals(5L, table.getEnumValues().get("BLUE"));
        assertEquals(6L, table.getEnumValues().get("YELLOW"));
        assertEquals(15L, table.getEnumValues().get("LAST"));
        assertEquals(Symbol.Kind.ENUM_CONSTANT, table.lookup("YELLOW").getKind());
        assertNotNull(table.getEnum("Color"));
    }

    @Test
    public void testNonConstantEnumerator() {
        assertThrows(UnsupportedConstructException.class, () -> resolve("int x = 1;\nenum E { A = x };"));
    }

    @Test
    public void testTypedefAndStructResolution() {
        SymbolTable table = resolve("struct Point { int x; int y; };\n"
                + "typedef struct Point Pt;\n"
                + "typedef Pt Alias;\n");
        CType resolved = table.resolve(new CType.Base("Alias", true, false, false));
        assertInstanceOf(CType.Struct.class, resolved);
        assertTrue(((CType.Struct) resolved).isDefinition());
        assertEquals(2, table.getStruct("Point").fields.size());
    }

    @Test
    public void testUndeclaredIdentifier() {
        UndeclaredIdentifierException ex = assertThrows(UndeclaredIdentifierException.class,
                () -> resolve("int main() {\n  return missing + 1;\n}\n"));
        assertEquals("missing", ex.getName());
        assertEquals(2, ex.getLocation().getLine());
    }

    @Test
    public void testImplicitFunctionDeclarationIsRejected() {
        assertThrows(UndeclaredIdentifierException.class, () -> resolve("int main() { return helper(); }\n"));
    }

    @Test
    public void testUseBeforeGlobalDeclaration() {
        assertThrows(UndeclaredIdentifierException.class,
                () -> resolve("int main() { return later; }\nint later = 1;\n"));
    }

    @Test
    public void testScopesEndWithTheirBlock() {
        assertThrows(UndeclaredIdentifierException.class,
                () -> resolve("int main() { { int inner = 1; } return inner; }\n"));
        assertThrows(UndeclaredIdentifierException.class,
                () -> resolve("int main() { for (int i = 0; i < 3; i++) { } return i; }\n"));
        assertDoesNotThrow(() -> resolve("int main() { int i = 0; for (int i = 0; i < 3; i++) { } return i; }\n"));
    }

    @Test
    public void testTypedefNameIsNotAValue() {
        assertThrows(UndeclaredIdentifierException.class,
                () -> resolve("typedef int T;\nint main() { return T; }\n"));
    }

    @Test
    public void testReservedPrefix() {
        assertThrows(UnsupportedConstructException.class, () -> resolve("int __cobf_state = 0;"));
        assertThrows(UnsupportedConstructException.class, () -> resolve("int f() { int __cobf_x = 1; return __cobf_x; }"));
        assertThrows(UnsupportedConstructException.class, () -> resolve("int f(int __cobf_p) { return __cobf_p; }"));
    }

    @Test
    public void testCallGraph() {
        SymbolTable table = resolve("int fib(int n) { return n < 2 ? n : fib(n - 1) + fib(n - 2); }\n"
                + "int odd(int n);\n"
                + "int even(int n) { return n == 0 ? 1 : odd(n - 1); }\n"
                + "int odd(int n) { return n == 0 ? 0 : even(n - 1); }\n"
                + "int main() { return fib(5) + even(4); }\n");
        CallGraph graph = table.getCallGraph();
        assertEquals(Set.of("fib", "even"), graph.getCallees("main"));
        assertTrue(table.isRecursive("fib"));
        assertTrue(table.isRecursive("even"));
        assertTrue(table.isRecursive("odd"));
        assertFalse(table.isRecursive("main"));
        assertEquals(Set.of("fib", "even", "odd"), graph.getRecursiveFunctions());
    }

    @Test
    public void testLongCallChain() {
        CallGraph graph = new CallGraph();
        int length = 20000;
        for (int i = 0; i < length; i++) {
            graph.addCall("f" + i, "f" + (i + 1));
        }
        graph.addCall("leaf", "leaf");
        assertEquals(Set.of("leaf"), graph.getRecursiveFunctions());

        graph.addCall("f" + length, "f0");
        assertTrue(graph.isRecursive("f0"));
        assertTrue(graph.isRecursive("f" + (length / 2)));
        assertFalse(graph.isRecursive("f" + (length + 1)));
        assertEquals(length + 2, graph.getRecursiveFunctions().size());
    }
}
