package io.github.cobfuscator.symbols;

import io.github.cobfuscator.UndeclaredIdentifierException;
import io.github.cobfuscator.UnsupportedConstructException;
import io.github.cobfuscator.ast.AstRewriter;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.TranslationUnit;
import io.github.cobfuscator.parser.BuiltinHeaders;
import io.github.cobfuscator.parser.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Walks the declarations of a translation unit in file order, builds its
 * {@link SymbolTable} and checks that every identifier used in a function body is
 * declared before use.
 */
public class SymbolResolver {

    private static final Logger logger = LoggerFactory.getLogger(SymbolResolver.class);

    /** Prefix of every identifier the obfuscator introduces. */
    public static final String RESERVED_PREFIX = "__cobf_";

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Map<String, CType.Struct> structs = new LinkedHashMap<>();
    private final Map<String, CType.Enum> enums = new LinkedHashMap<>();
    private final Map<String, Long> enumValues = new LinkedHashMap<>();
    private final CallGraph callGraph = new CallGraph();

    public static SymbolTable resolve(TranslationUnit unit) {
        return new SymbolResolver().resolveUnit(unit);
    }

    private SymbolTable resolveUnit(TranslationUnit unit) {
        for (String header : unit.getIncludes()) {
            for (BuiltinHeaders.Builtin builtin : BuiltinHeaders.declarations(header).values()) {
                switch (builtin.getKind()) {
                    case FUNCTION:
                        symbols.put(builtin.getName(), new Symbol(builtin.getName(), Symbol.Kind.BUILTIN_FUNCTION, null,
                                builtin.getArity(), builtin.isVariadic(), true, SourceLocation.UNKNOWN));
                        break;
                    case OBJECT:
                        symbols.put(builtin.getName(), new Symbol(builtin.getName(), Symbol.Kind.BUILTIN_OBJECT, null,
                                0, false, true, SourceLocation.UNKNOWN));
                        break;
                    default:
                        symbols.put(builtin.getName(), new Symbol(builtin.getName(), Symbol.Kind.TYPEDEF,
                                new CType.Base(builtin.getName()), 0, false, true, SourceLocation.UNKNOWN));
                        break;
                }
            }
        }
        for (Decl decl : unit.getDeclarations()) {
            if (decl instanceof Decl.Function function) {
                declareFunction(function);
            } else if (decl instanceof Decl.GlobalVar global) {
                registerType(global.type);
                checkReserved(global.name, global.location);
                symbols.put(global.name, new Symbol(global.name, Symbol.Kind.GLOBAL, global.type, 0, false,
                        global.init != null, global.location));
                if (global.init != null) {
                    new BodyChecker(null).rewrite(global.init);
                }
            } else if (decl instanceof Decl.Typedef typedef) {
                registerType(typedef.type);
                checkReserved(typedef.name, typedef.location);
                symbols.put(typedef.name, new Symbol(typedef.name, Symbol.Kind.TYPEDEF, typedef.type, 0, false,
                        true, typedef.location));
            } else if (decl instanceof Decl.Struct struct) {
                registerType(struct.type);
            } else if (decl instanceof Decl.Enum enumDecl) {
                registerType(enumDecl.type);
            }
        }
        SymbolTable table = new SymbolTable(symbols, structs, enums, enumValues, callGraph);
        logger.debug("{}: {} symbols, recursive functions {}", unit.getFileName(), symbols.size(),
                callGraph.getRecursiveFunctions());
        return table;
    }

    private void declareFunction(Decl.Function function) {
        checkReserved(function.name, function.location);
        registerType(function.returnType);
        Symbol existing = symbols.get(function.name);
        Symbol symbol;
        if (existing != null && existing.getKind() == Symbol.Kind.FUNCTION) {
            symbol = function.isDefinition() ? existing.markDefined(function.returnType, function.location) : existing;
        } else {
            symbol = new Symbol(function.name, Symbol.Kind.FUNCTION, function.returnType, function.params.size(),
                    function.variadic, function.isDefinition(), function.location);
        }
        symbols.put(function.name, symbol);
        callGraph.addFunction(function.name);
        if (!function.isDefinition()) {
            return;
        }
        BodyChecker checker = new BodyChecker(function.name);
        Set<String> params = new HashSet<>();
        for (Decl.Param param : function.params) {
            if (param.name != null) {
                checkReserved(param.name, function.location);
                params.add(param.name);
            }
            checker.rewriteType(param.type);
        }
        checker.scopes.push(params);
        checker.rewriteBlock(function.body);
    }

    private void registerType(CType type) {
        if (type instanceof CType.Struct struct && struct.isDefinition()) {
            if (struct.tag != null) {
                structs.put(struct.tag, struct);
            }
            for (CType.Field field : struct.fields) {
                registerType(field.type);
            }
        } else if (type instanceof CType.Enum enumType && enumType.isDefinition()) {
            if (enumType.tag != null) {
                enums.put(enumType.tag, enumType);
            }
            long next = 0;
            for (CType.Enumerator enumerator : enumType.enumerators) {
                checkReserved(enumerator.name, enumerator.location);
                if (enumerator.value != null) {
                    Long value = ConstantEvaluator.evaluate(enumerator.value, enumValues);
                    if (value == null) {
                        throw new UnsupportedConstructException("non-constant enumerator value", enumerator.location);
                    }
                    next = value;
                }
                enumValues.put(enumerator.name, next);
                symbols.put(enumerator.name, new Symbol(enumerator.name, Symbol.Kind.ENUM_CONSTANT, enumType.reference(),
                        0, false, true, enumerator.location));
                next++;
            }
        } else if (type instanceof CType.Pointer pointer) {
            registerType(pointer.target);
        } else if (type instanceof CType.Array array) {
            registerType(array.element);
        }
    }

    private static void checkReserved(String name, SourceLocation location) {
        if (name.startsWith(RESERVED_PREFIX)) {
            throw new UnsupportedConstructException("identifier with reserved prefix " + RESERVED_PREFIX, location);
        }
    }

    /** Scope checker; the rebuilt tree is discarded. */
    private final class BodyChecker extends AstRewriter {
        private final String function;
        private final Deque<Set<String>> scopes = new ArrayDeque<>();

        BodyChecker(String function) {
            this.function = function;
        }

        @Override
        public Stmt.Block rewriteBlock(Stmt.Block block) {
            scopes.push(new HashSet<>());
            try {
                return super.rewriteBlock(block);
            } finally {
                scopes.pop();
            }
        }

        @Override
        protected Stmt rewriteFor(Stmt.For s) {
            scopes.push(new HashSet<>());
            try {
                return super.rewriteFor(s);
            } finally {
                scopes.pop();
            }
        }

        @Override
        protected Stmt rewriteSwitch(Stmt.Switch s) {
            scopes.push(new HashSet<>());
            try {
                return super.rewriteSwitch(s);
            } finally {
                scopes.pop();
            }
        }

        @Override
        protected Stmt rewriteVarDecl(Stmt.VarDecl s) {
            checkReserved(s.name, s.location);
            if (s.type instanceof CType.Struct struct && struct.isDefinition()) {
                throw new UnsupportedConstructException("struct definition inside a function", s.location);
            }
            scopes.peek().add(s.name);
            return super.rewriteVarDecl(s);
        }

        @Override
        protected Expr rewriteIdent(Expr.Ident ident) {
            for (Set<String> scope : scopes) {
                if (scope.contains(ident.name)) {
                    return ident;
                }
            }
            Symbol symbol = symbols.get(ident.name);
            if (symbol == null || symbol.getKind() == Symbol.Kind.TYPEDEF) {
                throw new UndeclaredIdentifierException(ident.name, ident.location);
            }
            if (symbol.getKind() == Symbol.Kind.FUNCTION && function != null) {
                callGraph.addCall(function, ident.name);
            }
            return ident;
        }
    }
}
