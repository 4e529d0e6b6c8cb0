package io.github.cobfuscator;

import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.TranslationUnit;
import io.github.cobfuscator.cfg.CfgBuilder;
import io.github.cobfuscator.cfg.CfgSimplifier;
import io.github.cobfuscator.cfg.FunctionCfg;
import io.github.cobfuscator.emit.CodeEmitter;
import io.github.cobfuscator.flatten.ControlFlowFlattener;
import io.github.cobfuscator.flatten.LocalHoister;
import io.github.cobfuscator.parser.Parser;
import io.github.cobfuscator.strings.StringEncryptor;
import io.github.cobfuscator.symbols.SymbolResolver;
import io.github.cobfuscator.symbols.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives the whole pipeline. Every translation unit is parsed and resolved on the calling
 * thread, then its function definitions are transformed in parallel and reassembled in
 * declaration order before the unit is emitted.
 */
public class CObfuscator {

    private static final Logger logger = LoggerFactory.getLogger(CObfuscator.class);

    private final ProtectionConfig protectionConfig;
    private final FunctionFilter functionFilter;
    private final int threads;

    public CObfuscator(ProtectionConfig protectionConfig, FunctionFilter functionFilter, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive");
        }
        this.protectionConfig = protectionConfig;
        this.functionFilter = functionFilter;
        this.threads = threads;
    }

    public CObfuscator(ObfuscatorConfig config) {
        this(config.getProtectionConfig(), new FunctionFilter(config.getBlackList(), config.getWhiteList()),
                config.getThreads());
    }

    /**
     * Processes every input of the configuration. A unit that fails to compile is reported
     * and skipped; no output is written for it.
     *
     * @return the number of units that failed
     */
    public static int process(ObfuscatorConfig config) {
        CObfuscator obfuscator = new CObfuscator(config);
        int failures = 0;
        for (Path input : config.getInputs()) {
            Path output = resolveOutput(config, input);
            logger.info("Processing {}...", input);
            try {
                String source = Files.readString(input, StandardCharsets.UTF_8);
                String result = obfuscator.obfuscate(input.getFileName().toString(), source);
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(output, result, StandardCharsets.UTF_8);
                logger.info("Wrote {}", output);
            } catch (CompilationException ex) {
                logger.error("{}", ex.getMessage());
                logger.debug("Failure details for {}", input, ex);
                failures++;
            } catch (IOException ex) {
                logger.error("Error while processing {}", input, ex);
                failures++;
            }
        }
        if (failures > 0) {
            logger.error("{} of {} translation unit(s) failed", failures, config.getInputs().size());
        }
        return failures;
    }

    static Path resolveOutput(ObfuscatorConfig config, Path input) {
        Path output = config.getOutput();
        if (config.getInputs().size() == 1 && !Files.isDirectory(output)
                && output.getFileName().toString().endsWith(".c")) {
            return output;
        }
        return output.resolve(input.getFileName().toString());
    }

    /** Obfuscates one translation unit held in memory. */
    public String obfuscate(String fileName, String source) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            return CodeEmitter.emit(transform(Parser.parse(fileName, source), executor));
        } catch (CompilationException ex) {
            throw ex.withFileName(fileName);
        } finally {
            executor.shutdownNow();
        }
    }

    TranslationUnit transform(TranslationUnit unit, ExecutorService executor) {
        SymbolTable symbols = SymbolResolver.resolve(unit);
        List<Decl> declarations = unit.getDeclarations();

        List<Future<FunctionResult>> futures = new ArrayList<>();
        List<Integer> futureIndices = new ArrayList<>();
        for (int i = 0; i < declarations.size(); i++) {
            Decl decl = declarations.get(i);
            if (decl instanceof Decl.Function function && function.isDefinition()) {
                futures.add(executor.submit(new FunctionJob(function, i, symbols)));
                futureIndices.add(i);
            } else if (decl instanceof Decl.GlobalVar global && global.init != null
                    && protectionConfig.isStringEncryptionEnabled() && StringEncryptor.containsString(global.init)) {
                logger.debug("String literals in the initializer of global '{}' are kept in plaintext", global.name);
            }
        }

        FunctionResult[] results = new FunctionResult[declarations.size()];
        for (int i = 0; i < futures.size(); i++) {
            try {
                results[futureIndices.get(i)] = futures.get(i).get();
            } catch (ExecutionException ex) {
                futures.forEach(f -> f.cancel(true));
                throw unwrap(ex.getCause());
            } catch (InterruptedException ex) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new InternalInvariantException("interrupted while transforming " + unit.getFileName());
            }
        }

        List<Decl> transformed = new ArrayList<>(declarations.size());
        for (int i = 0; i < declarations.size(); i++) {
            FunctionResult result = results[i];
            if (result == null) {
                transformed.add(declarations.get(i));
            } else {
                transformed.addAll(result.preamble);
                transformed.add(result.function);
            }
        }
        return unit.withDeclarations(transformed);
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        InternalInvariantException wrapped = new InternalInvariantException("function job failed: " + cause);
        wrapped.initCause(cause);
        return wrapped;
    }

    private static final class FunctionResult {
        private final Decl.Function function;
        private final List<Decl> preamble;

        private FunctionResult(Decl.Function function, List<Decl> preamble) {
            this.function = function;
            this.preamble = preamble;
        }
    }

    private final class FunctionJob implements Callable<FunctionResult> {
        private final Decl.Function function;
        private final int index;
        private final SymbolTable symbols;

        private FunctionJob(Decl.Function function, int index, SymbolTable symbols) {
            this.function = function;
            this.index = index;
            this.symbols = symbols;
        }

        @Override
        public FunctionResult call() {
            if (!functionFilter.shouldProcess(function.name)) {
                // still lowered so that malformed control flow is reported for every function
                CfgBuilder.build(function);
                logger.info("Skipping {}", function.name);
                return new FunctionResult(function, List.of());
            }
            FunctionContext context = new FunctionContext(function, index, symbols, protectionConfig);
            Stmt.Block body = function.body;
            if (protectionConfig.isControlFlowFlatteningEnabled()) {
                List<Stmt> lowered = LocalHoister.hoist(context);
                FunctionCfg cfg = CfgSimplifier.simplify(CfgBuilder.build(function, lowered));
                body = ControlFlowFlattener.flatten(cfg, context);
                logger.debug("Flattened {} into {} states", function.name, cfg.size());
            } else {
                CfgBuilder.build(function);
            }
            if (protectionConfig.isStringEncryptionEnabled()) {
                body = StringEncryptor.encrypt(body, context);
                if (!context.literals.isEmpty()) {
                    logger.debug("Encrypted {} literal(s) in {}", context.literals.size(), function.name);
                }
            }
            return new FunctionResult(function.withBody(body), new ArrayList<>(context.preamble));
        }
    }
}
