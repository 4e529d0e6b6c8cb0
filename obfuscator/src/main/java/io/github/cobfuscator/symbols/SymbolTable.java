package io.github.cobfuscator.symbols;

import io.github.cobfuscator.ast.CType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * File-scope declarations of one translation unit. Built once by {@link SymbolResolver}
 * and only read afterwards, so function jobs share it across threads.
 */
public class SymbolTable {

    private final Map<String, Symbol> symbols;
    private final Map<String, CType.Struct> structs;
    private final Map<String, CType.Enum> enums;
    private final Map<String, Long> enumValues;
    private final CallGraph callGraph;

    SymbolTable(Map<String, Symbol> symbols, Map<String, CType.Struct> structs, Map<String, CType.Enum> enums,
                Map<String, Long> enumValues, CallGraph callGraph) {
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
        this.structs = Collections.unmodifiableMap(new LinkedHashMap<>(structs));
        this.enums = Collections.unmodifiableMap(new LinkedHashMap<>(enums));
        this.enumValues = Collections.unmodifiableMap(new LinkedHashMap<>(enumValues));
        this.callGraph = callGraph;
    }

    /** @return the symbol, or null */
    public Symbol lookup(String name) {
        return symbols.get(name);
    }

    public Map<String, Symbol> getSymbols() {
        return symbols;
    }

    /** @return the struct or union definition for a tag, or null */
    public CType.Struct getStruct(String tag) {
        return structs.get(tag);
    }

    public CType.Enum getEnum(String tag) {
        return enums.get(tag);
    }

    /** Values of every enumeration constant, usable with {@link ConstantEvaluator}. */
    public Map<String, Long> getEnumValues() {
        return enumValues;
    }

    /**
     * Follows typedef names and struct tag references to the type they stand for. Types
     * that cannot be resolved further are returned unchanged.
     */
    public CType resolve(CType type) {
        CType current = type;
        for (int depth = 0; depth < 32; depth++) {
            if (current instanceof CType.Base base && base.typedefName) {
                Symbol symbol = symbols.get(base.name);
                if (symbol == null || symbol.getKind() != Symbol.Kind.TYPEDEF || symbol.getType() == null) {
                    return current;
                }
                current = symbol.getType();
            } else if (current instanceof CType.Struct struct && !struct.isDefinition() && struct.tag != null
                    && structs.containsKey(struct.tag)) {
                return structs.get(struct.tag);
            } else {
                return current;
            }
        }
        return current;
    }

    public CallGraph getCallGraph() {
        return callGraph;
    }

    public boolean isRecursive(String function) {
        return callGraph.isRecursive(function);
    }
}
