package io.github.cobfuscator.flatten;

import io.github.cobfuscator.FastRandom;
import io.github.cobfuscator.FunctionContext;
import io.github.cobfuscator.InternalInvariantException;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.Storage;
import io.github.cobfuscator.cfg.BasicBlock;
import io.github.cobfuscator.cfg.FunctionCfg;
import io.github.cobfuscator.cfg.Terminator;
import io.github.cobfuscator.parser.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rewrites a function's control-flow graph into a single dispatcher loop:
 * every basic block becomes one case of a switch over an encoded state variable, and
 * each terminator becomes an assignment of the next state.
 */
public class ControlFlowFlattener {

    public static final String STATE_VAR = "__cobf_state";
    public static final String RETURN_VAR = "__cobf_ret";
    private static final String JUNK_VAR = "__cobf_junk";
    private static final int MAX_ENCODING_ATTEMPTS = 64;

    /**
     * Strategy factory used to produce control-flow state encoders.
     */
    public interface StateObfuscationStrategy {
        StateObfuscation create(String functionName, FastRandom random);
    }

    /**
     * Maps raw block ids to the values stored in the state variable. Must be injective.
     */
    public interface StateObfuscation {
        int encodeCase(int rawState);
    }

    public static final StateObfuscationStrategy DEFAULT_STRATEGY =
            (functionName, random) -> new DefaultStateObfuscation(random);

    /**
     * Multiply by an odd constant, xor a mask, rotate, xor a bias. Each step is a
     * bijection on 32-bit values, so distinct states never collide.
     */
    static final class DefaultStateObfuscation implements StateObfuscation {
        private final int xorMask;
        private final int multiplier;
        private final int bias;
        private final int rotation;

        DefaultStateObfuscation(FastRandom random) {
            this.xorMask = random.nextInt();
            int candidate;
            do {
                candidate = random.nextInt();
            } while ((candidate & 1) == 0);
            this.multiplier = candidate;
            this.bias = random.nextInt();
            this.rotation = 1 + random.nextInt(31);
        }

        @Override
        public int encodeCase(int rawState) {
            long value = Integer.toUnsignedLong(rawState);
            long mul = Integer.toUnsignedLong(multiplier);
            value = (value * mul) & 0xFFFFFFFFL;
            value ^= Integer.toUnsignedLong(xorMask);
            int rotated = Integer.rotateLeft((int) value, rotation);
            return rotated ^ bias;
        }
    }

    /**
     * Draws encodings until none of the {@code stateCount} states maps to
     * {@link Integer#MIN_VALUE}, which has no plain C literal spelling.
     */
    static StateObfuscation createObfuscation(StateObfuscationStrategy strategy, String functionName, FastRandom random,
                                              int stateCount) {
        for (int attempt = 0; attempt < MAX_ENCODING_ATTEMPTS; attempt++) {
            StateObfuscation candidate = strategy.create(functionName, random);
            boolean usable = true;
            for (int state = 0; state < stateCount && usable; state++) {
                usable = candidate.encodeCase(state) != Integer.MIN_VALUE;
            }
            if (usable) {
                return candidate;
            }
        }
        throw new InternalInvariantException("no usable state encoding for " + functionName);
    }

    private final FunctionCfg cfg;
    private final FunctionContext context;
    private final StateObfuscation obfuscation;
    private final boolean returnsValue;
    private final SourceLocation location;

    private ControlFlowFlattener(FunctionCfg cfg, FunctionContext context) {
        this.cfg = cfg;
        this.context = context;
        int states = cfg.size() + context.protectionConfig.getBogusStates();
        this.obfuscation = createObfuscation(context.stateObfuscationStrategy, cfg.getFunction().name,
                context.random, states);
        this.returnsValue = !cfg.getFunction().returnType.isVoid();
        this.location = cfg.getFunction().location;
    }

    /**
     * Builds the flattened body. Hoisted declarations from {@code context.hoisted} are
     * placed first.
     */
    public static Stmt.Block flatten(FunctionCfg cfg, FunctionContext context) {
        return new ControlFlowFlattener(cfg, context).build();
    }

    private Stmt.Block build() {
        List<Stmt> body = new ArrayList<>();
        if (context.hoisted != null) {
            body.addAll(context.hoisted);
        }
        if (returnsValue) {
            body.add(new Stmt.VarDecl(cfg.getFunction().returnType.unqualified(), RETURN_VAR, null, Storage.NONE, location));
        }
        body.add(new Stmt.VarDecl(new CType.Base("int", false, false, true), STATE_VAR, null, Storage.NONE, location));
        body.add(assignState(cfg.getEntry()));

        List<Stmt.SwitchCase> cases = new ArrayList<>();
        for (BasicBlock block : cfg.getBlocks()) {
            if (block.getId() != cfg.getExit()) {
                cases.add(realCase(block));
            }
        }
        int bogus = context.protectionConfig.getBogusStates();
        for (int i = 0; i < bogus; i++) {
            cases.add(bogusCase(cfg.size() + i));
        }
        shuffle(cases);
        cases.add(new Stmt.SwitchCase(null, List.of(new Stmt.Block(
                List.of(assignState(cfg.getExit()), new Stmt.Break(location)), location)), location));

        Stmt dispatcher = new Stmt.Switch(state(), cases, location);
        Expr running = new Expr.Binary("!=", state(), encoded(cfg.getExit()), location);
        body.add(new Stmt.While(running, new Stmt.Block(List.of(dispatcher), location), location));
        body.add(new Stmt.Return(returnsValue ? new Expr.Ident(RETURN_VAR, location) : null, location));
        return new Stmt.Block(body, location);
    }

    private Stmt.SwitchCase realCase(BasicBlock block) {
        List<Stmt> statements = new ArrayList<>(block.getStatements());
        Terminator terminator = block.getTerminator();
        if (terminator instanceof Terminator.Fallthrough t) {
            statements.add(assignState(t.target));
        } else if (terminator instanceof Terminator.Branch t) {
            Expr next = new Expr.Ternary(t.condition, encoded(t.whenTrue), encoded(t.whenFalse), t.condition.location);
            statements.add(Stmt.ExprStmt.of(Expr.Assign.simple(state(), next)));
        } else if (terminator instanceof Terminator.Return t) {
            if (t.value != null) {
                statements.add(returnsValue
                        ? Stmt.ExprStmt.of(Expr.Assign.simple(new Expr.Ident(RETURN_VAR, location), t.value))
                        : new Stmt.ExprStmt(t.value, t.value.location));
            }
            statements.add(assignState(t.exit));
        } else if (terminator instanceof Terminator.SwitchDispatch t) {
            statements.add(dispatch(t));
        } else {
            throw new InternalInvariantException("block " + block.getId() + " of " + cfg.getFunction().name
                    + " cannot be a dispatcher case: " + terminator);
        }
        statements.add(new Stmt.Break(location));
        return new Stmt.SwitchCase(encoded(block.getId()), List.of(new Stmt.Block(statements, location)), location);
    }

    /** Nested switch on the original value; its labels are kept as written. */
    private Stmt dispatch(Terminator.SwitchDispatch t) {
        List<Stmt.SwitchCase> cases = new ArrayList<>(t.cases.size() + 1);
        for (Terminator.SwitchCase c : t.cases) {
            cases.add(new Stmt.SwitchCase(c.label, List.of(assignState(c.target), new Stmt.Break(location)), c.label.location));
        }
        cases.add(new Stmt.SwitchCase(null, List.of(assignState(t.defaultTarget), new Stmt.Break(location)), location));
        return new Stmt.Switch(t.value, cases, t.value.location);
    }

    /** A state nothing assigns: junk arithmetic followed by a jump to a real block. */
    private Stmt.SwitchCase bogusCase(int rawState) {
        FastRandom random = context.random;
        List<Stmt> statements = new ArrayList<>();
        statements.add(new Stmt.VarDecl(new CType.Base("int", false, false, true), JUNK_VAR,
                Expr.IntLit.of(random.nextInt() & 0x7FFFFFFF), Storage.NONE, location));
        Expr junk = new Expr.Ident(JUNK_VAR, location);
        int operations = 2 + random.nextInt(3);
        for (int i = 0; i < operations; i++) {
            switch (random.nextInt(4)) {
                case 0:
                    statements.add(Stmt.ExprStmt.of(Expr.Assign.simple(junk,
                            new Expr.Binary("^", junk, Expr.IntLit.of(random.nextInt() & 0x7FFFFFFF), location))));
                    break;
                case 1:
                    statements.add(Stmt.ExprStmt.of(Expr.Assign.simple(junk, new Expr.Binary("+",
                            new Expr.Binary("&", junk, Expr.IntLit.of(0xFFFF), location),
                            Expr.IntLit.of(random.nextInt(0x7FFF)), location))));
                    break;
                case 2:
                    statements.add(Stmt.ExprStmt.of(Expr.Assign.simple(junk, new Expr.Binary("^", junk,
                            new Expr.Binary("&", state(), Expr.IntLit.of(0xFF), location), location))));
                    break;
                default:
                    statements.add(new Stmt.If(
                            new Expr.Binary("==", junk, Expr.IntLit.of(random.nextInt() & 0x7FFFFFFF), location),
                            Stmt.ExprStmt.of(new Expr.Assign("^=", junk, Expr.IntLit.of(random.nextInt() & 0x7FFFFFFF), location)),
                            null, location));
                    break;
            }
        }
        int target = random.nextInt(cfg.size());
        statements.add(assignState(target));
        statements.add(new Stmt.Break(location));
        return new Stmt.SwitchCase(encoded(rawState), List.of(new Stmt.Block(statements, location)), location);
    }

    private void shuffle(List<Stmt.SwitchCase> cases) {
        for (int i = cases.size() - 1; i > 0; i--) {
            Collections.swap(cases, i, context.random.nextInt(i + 1));
        }
    }

    private Expr state() {
        return new Expr.Ident(STATE_VAR, location);
    }

    private Expr encoded(int rawState) {
        return Expr.IntLit.of(obfuscation.encodeCase(rawState));
    }

    private Stmt assignState(int rawState) {
        return Stmt.ExprStmt.of(Expr.Assign.simple(state(), encoded(rawState)));
    }
}
