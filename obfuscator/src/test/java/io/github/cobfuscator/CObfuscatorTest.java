package io.github.cobfuscator;

import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.TranslationUnit;
import io.github.cobfuscator.flatten.ControlFlowFlattener;
import io.github.cobfuscator.helpers.Corpus;
import io.github.cobfuscator.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CObfuscatorTest {

    private static final String PROGRAM = "#include <stdio.h>\n"
            + "int helper(int x) { if (x > 2) return x * 2; return x; }\n"
            + "int main() {\n"
            + "  int i;\n"
            + "  for (i = 0; i < 4; i++) printf(\"%d\\n\", helper(i));\n"
            + "  return 0;\n"
            + "}\n";

    private static CObfuscator obfuscator(ProtectionConfig config, List<String> blackList, int threads) {
        return new CObfuscator(config, new FunctionFilter(blackList, null), threads);
    }

    private static Decl.Function function(TranslationUnit unit, String name) {
        for (Decl decl : unit.getDeclarations()) {
            if (decl instanceof Decl.Function f && f.name.equals(name) && f.isDefinition()) {
                return f;
            }
        }
        throw new AssertionError("no definition of " + name);
    }

    private static boolean isFlattened(Decl.Function function) {
        for (Stmt statement : function.body.statements) {
            if (statement instanceof Stmt.VarDecl decl && decl.name.equals(ControlFlowFlattener.STATE_VAR)) {
                return true;
            }
        }
        return false;
    }

    @Test
    public void testOutputIsDeterministicAcrossThreadCounts() {
        ProtectionConfig config = new ProtectionConfig(true, true, 1234L);
        String single = obfuscator(config, new ArrayList<>(), 1).obfuscate("p.c", PROGRAM);
        String parallel = obfuscator(config, new ArrayList<>(), 4).obfuscate("p.c", PROGRAM);
        assertEquals(single, parallel);

        String otherSeed = obfuscator(new ProtectionConfig(true, true, 99L), new ArrayList<>(), 1).obfuscate("p.c", PROGRAM);
        assertNotEquals(single, otherSeed);
    }

    @Test
    public void testOutputParsesAgain() {
        String output = obfuscator(new ProtectionConfig(true, true, 5L), new ArrayList<>(), 2).obfuscate("p.c", PROGRAM);
        TranslationUnit unit = Parser.parse("p.c", output);
        assertTrue(isFlattened(function(unit, "helper")));
        assertTrue(isFlattened(function(unit, "main")));
        assertFalse(output.contains("\"%d\\n\""));
        assertTrue(output.indexOf("__cobf_f1_lit_0[") < output.indexOf("int main("));
        assertTrue(output.indexOf("int helper(") < output.indexOf("__cobf_f1_lit_0["));
    }

    @Test
    public void testBlackListedFunctionIsUntouched() {
        String output = obfuscator(new ProtectionConfig(true, true, 5L), List.of("help*"), 1).obfuscate("p.c", PROGRAM);
        TranslationUnit unit = Parser.parse("p.c", output);
        Decl.Function helper = function(unit, "helper");
        assertFalse(isFlattened(helper));
        assertEquals(2, helper.body.statements.size());
        assertTrue(isFlattened(function(unit, "main")));
    }

    @Test
    public void testWhiteList() {
        CObfuscator whiteListed = new CObfuscator(new ProtectionConfig(true, false, 5L),
                new FunctionFilter(new ArrayList<>(), List.of("helper")), 1);
        TranslationUnit unit = Parser.parse("p.c", whiteListed.obfuscate("p.c", PROGRAM));
        assertTrue(isFlattened(function(unit, "helper")));
        assertFalse(isFlattened(function(unit, "main")));
    }

    @Test
    public void testNothingEnabled() {
        String output = obfuscator(new ProtectionConfig(false, false, 5L), new ArrayList<>(), 1).obfuscate("p.c", PROGRAM);
        assertFalse(output.contains("__cobf_"));
        assertTrue(output.contains("\"%d\\n\""));
    }

    @Test
    public void testErrorsCarryTheFileName() {
        CObfuscator obfuscator = obfuscator(new ProtectionConfig(true, true, 5L), new ArrayList<>(), 2);
        UndeclaredIdentifierException undeclared = assertThrows(UndeclaredIdentifierException.class,
                () -> obfuscator.obfuscate("bad.c", "int f() {\n  return missing;\n}\n"));
        assertEquals("bad.c", undeclared.getFileName());
        assertTrue(undeclared.getMessage().startsWith("bad.c:2:"), undeclared.getMessage());

        InvalidControlFlowException orphan = assertThrows(InvalidControlFlowException.class,
                () -> obfuscator.obfuscate("loop.c", "int ok() { return 1; }\nvoid f() { break; }\n"));
        assertEquals("loop.c", orphan.getFileName());
    }

    @Test
    public void testFilteredFunctionsAreStillChecked() {
        CObfuscator obfuscator = obfuscator(new ProtectionConfig(true, true, 5L), List.of("f"), 1);
        assertThrows(InvalidControlFlowException.class, () -> obfuscator.obfuscate("loop.c", "void f() { continue; }\n"));
    }

    @Test
    public void testInvalidThreadCount() {
        assertThrows(IllegalArgumentException.class, () -> obfuscator(ProtectionConfig.createDefault(), new ArrayList<>(), 0));
    }

    @Test
    public void testCorpusRoundTrip() {
        ProtectionConfig[] configs = {
                new ProtectionConfig(true, true, 7L),
                new ProtectionConfig(true, false, 8L, 0, true),
                new ProtectionConfig(false, true, 9L)
        };
        for (String program : Corpus.PROGRAMS) {
            for (ProtectionConfig config : configs) {
                String output = obfuscator(config, new ArrayList<>(), 2).obfuscate(program, Corpus.read(program));
                assertDoesNotThrow(() -> Parser.parse(program, output), program + " with " + config);
            }
        }
    }

    @Test
    public void testProcessSkipsFailingUnits(@TempDir Path dir) throws IOException {
        Path good = dir.resolve("good.c");
        Path bad = dir.resolve("bad.c");
        Files.writeString(good, PROGRAM);
        Files.writeString(bad, "int f() { return nope; }\n");
        Path out = dir.resolve("out");

        ObfuscatorConfig config = new ObfuscatorConfig.Builder()
                .setInputs(List.of(good, bad))
                .setOutput(out)
                .setThreads(2)
                .setProtectionConfig(new ProtectionConfig(true, true, 3L))
                .build();
        assertEquals(1, CObfuscator.process(config));
        assertTrue(Files.exists(out.resolve("good.c")));
        assertFalse(Files.exists(out.resolve("bad.c")));
    }

    @Test
    public void testSingleInputWithFileOutput(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("prog.c");
        Files.writeString(input, PROGRAM);
        Path output = dir.resolve("nested").resolve("obf.c");

        ObfuscatorConfig config = new ObfuscatorConfig.Builder()
                .setInputs(List.of(input))
                .setOutput(output)
                .setProtectionConfig(new ProtectionConfig(true, true, 3L))
                .build();
        assertEquals(output, CObfuscator.resolveOutput(config, input));
        assertEquals(0, CObfuscator.process(config));
        assertTrue(Files.readString(output).startsWith("/* Obfuscated by c-obfuscator from prog.c. */"));
    }

    @Test
    public void testMissingInputIsReported(@TempDir Path dir) {
        ObfuscatorConfig config = new ObfuscatorConfig.Builder()
                .setInputs(List.of(dir.resolve("absent.c")))
                .setOutput(dir.resolve("out"))
                .build();
        assertEquals(1, CObfuscator.process(config));
    }
}
