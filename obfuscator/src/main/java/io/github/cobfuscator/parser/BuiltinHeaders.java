package io.github.cobfuscator.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The fixed set of system headers a translation unit may include. Their declarations are
 * known to the resolver without being parsed; the {@code #include} lines are passed
 * through to the output unchanged so the real headers are used when it is compiled.
 */
public final class BuiltinHeaders {

    public enum Kind { FUNCTION, OBJECT, TYPE }

    public static final class Builtin {
        private final String name;
        private final Kind kind;
        private final int arity;
        private final boolean variadic;

        Builtin(String name, Kind kind, int arity, boolean variadic) {
            this.name = name;
            this.kind = kind;
            this.arity = arity;
            this.variadic = variadic;
        }

        public String getName() {
            return name;
        }

        public Kind getKind() {
            return kind;
        }

        public int getArity() {
            return arity;
        }

        public boolean isVariadic() {
            return variadic;
        }
    }

    private static final Map<String, Map<String, Builtin>> HEADERS = new LinkedHashMap<>();

    static {
        Map<String, Builtin> stdio = new LinkedHashMap<>();
        function(stdio, "printf", 1, true);
        function(stdio, "fprintf", 2, true);
        function(stdio, "sprintf", 2, true);
        function(stdio, "snprintf", 3, true);
        function(stdio, "scanf", 1, true);
        function(stdio, "puts", 1, false);
        function(stdio, "putchar", 1, false);
        function(stdio, "getchar", 0, false);
        function(stdio, "fputs", 2, false);
        function(stdio, "fflush", 1, false);
        object(stdio, "stdin");
        object(stdio, "stdout");
        object(stdio, "stderr");
        object(stdio, "EOF");
        object(stdio, "NULL");
        type(stdio, "FILE");
        type(stdio, "size_t");
        HEADERS.put("stdio.h", Collections.unmodifiableMap(stdio));

        Map<String, Builtin> string = new LinkedHashMap<>();
        function(string, "strcmp", 2, false);
        function(string, "strncmp", 3, false);
        function(string, "strcpy", 2, false);
        function(string, "strncpy", 3, false);
        function(string, "strcat", 2, false);
        function(string, "strlen", 1, false);
        function(string, "memcpy", 3, false);
        function(string, "memset", 3, false);
        function(string, "memcmp", 3, false);
        object(string, "NULL");
        type(string, "size_t");
        HEADERS.put("string.h", Collections.unmodifiableMap(string));

        Map<String, Builtin> stdlib = new LinkedHashMap<>();
        function(stdlib, "malloc", 1, false);
        function(stdlib, "calloc", 2, false);
        function(stdlib, "free", 1, false);
        function(stdlib, "exit", 1, false);
        function(stdlib, "abs", 1, false);
        function(stdlib, "atoi", 1, false);
        object(stdlib, "NULL");
        object(stdlib, "EXIT_SUCCESS");
        object(stdlib, "EXIT_FAILURE");
        type(stdlib, "size_t");
        HEADERS.put("stdlib.h", Collections.unmodifiableMap(stdlib));
    }

    private BuiltinHeaders() {
    }

    private static void function(Map<String, Builtin> header, String name, int arity, boolean variadic) {
        header.put(name, new Builtin(name, Kind.FUNCTION, arity, variadic));
    }

    private static void object(Map<String, Builtin> header, String name) {
        header.put(name, new Builtin(name, Kind.OBJECT, 0, false));
    }

    private static void type(Map<String, Builtin> header, String name) {
        header.put(name, new Builtin(name, Kind.TYPE, 0, false));
    }

    public static boolean isKnown(String header) {
        return HEADERS.containsKey(header);
    }

    public static Map<String, Builtin> declarations(String header) {
        Map<String, Builtin> declarations = HEADERS.get(header);
        if (declarations == null) {
            throw new IllegalArgumentException("Unknown built-in header: " + header);
        }
        return declarations;
    }
}
