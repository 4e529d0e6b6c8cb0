package io.github.cobfuscator;

import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.flatten.ControlFlowFlattener;
import io.github.cobfuscator.strings.EncryptedLiteral;
import io.github.cobfuscator.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-function state of one transformation job. Nothing here is shared between jobs.
 */
public class FunctionContext {

    public final Decl.Function function;
    public final int functionIndex;
    public final SymbolTable symbols;
    public final ProtectionConfig protectionConfig;
    public final FastRandom random;

    /** Produces the state encoding of the flattened dispatcher. */
    public final ControlFlowFlattener.StateObfuscationStrategy stateObfuscationStrategy;

    /** Declarations moved to the top of the body by the local hoister. */
    public List<Stmt.VarDecl> hoisted;

    public final List<EncryptedLiteral> literals = new ArrayList<>();

    /** File-scope declarations emitted right before the function. */
    public final List<Decl> preamble = new ArrayList<>();

    public FunctionContext(Decl.Function function, int functionIndex, SymbolTable symbols,
                           ProtectionConfig protectionConfig) {
        this(function, functionIndex, symbols, protectionConfig, ControlFlowFlattener.DEFAULT_STRATEGY);
    }

    public FunctionContext(Decl.Function function, int functionIndex, SymbolTable symbols,
                           ProtectionConfig protectionConfig,
                           ControlFlowFlattener.StateObfuscationStrategy stateObfuscationStrategy) {
        this.function = function;
        this.functionIndex = functionIndex;
        this.symbols = symbols;
        this.protectionConfig = protectionConfig;
        this.stateObfuscationStrategy = stateObfuscationStrategy;
        this.random = FastRandom.forFunction(protectionConfig.getSeed(), functionIndex);
    }
}
