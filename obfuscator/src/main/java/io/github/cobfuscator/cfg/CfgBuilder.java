package io.github.cobfuscator.cfg;

import io.github.cobfuscator.InvalidControlFlowException;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lowers a structured function body to basic blocks. Every {@code break} and
 * {@code continue} becomes an explicit edge; statements after a jump land in a fresh
 * block that nothing reaches, which {@link CfgSimplifier} later removes.
 */
public class CfgBuilder {

    private static final class JumpTargets {
        final int breakTarget;
        /** Null for a switch, which passes {@code continue} through to the enclosing loop. */
        final Integer continueTarget;

        JumpTargets(int breakTarget, Integer continueTarget) {
            this.breakTarget = breakTarget;
            this.continueTarget = continueTarget;
        }
    }

    private final Decl.Function function;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Deque<JumpTargets> targets = new ArrayDeque<>();
    private int exit;
    private BasicBlock current;

    private CfgBuilder(Decl.Function function) {
        this.function = function;
    }

    public static FunctionCfg build(Decl.Function function) {
        return new CfgBuilder(function).buildFunction(function.body.statements);
    }

    /** Builds the graph for {@code body}, which replaces the function's own body. */
    public static FunctionCfg build(Decl.Function function, List<Stmt> body) {
        return new CfgBuilder(function).buildFunction(body);
    }

    private FunctionCfg buildFunction(List<Stmt> body) {
        BasicBlock exitBlock = newBlock();
        exitBlock.terminate(Terminator.Exit.INSTANCE);
        exit = exitBlock.getId();
        BasicBlock entry = newBlock();
        current = entry;
        for (Stmt statement : body) {
            lower(statement);
        }
        current.terminate(new Terminator.Return(implicitReturnValue(), exit));
        return new FunctionCfg(function, entry.getId(), exit, blocks);
    }

    private Expr implicitReturnValue() {
        if ("main".equals(function.name) && function.returnType instanceof CType.Base base && "int".equals(base.name)) {
            return Expr.IntLit.of(0);
        }
        return null;
    }

    private BasicBlock newBlock() {
        BasicBlock block = new BasicBlock(blocks.size());
        blocks.add(block);
        return block;
    }

    private void jumpTo(BasicBlock target) {
        current.terminate(new Terminator.Fallthrough(target.getId()));
        current = target;
    }

    private void lower(Stmt stmt) {
        if (stmt instanceof Stmt.Block block) {
            for (Stmt statement : block.statements) {
                lower(statement);
            }
        } else if (stmt instanceof Stmt.If s) {
            lowerIf(s);
        } else if (stmt instanceof Stmt.While s) {
            lowerWhile(s);
        } else if (stmt instanceof Stmt.DoWhile s) {
            lowerDoWhile(s);
        } else if (stmt instanceof Stmt.For s) {
            lowerFor(s);
        } else if (stmt instanceof Stmt.Switch s) {
            lowerSwitch(s);
        } else if (stmt instanceof Stmt.Break) {
            JumpTargets enclosing = targets.peek();
            if (enclosing == null) {
                throw new InvalidControlFlowException("break", stmt.location);
            }
            current.terminate(new Terminator.Fallthrough(enclosing.breakTarget));
            current = newBlock();
        } else if (stmt instanceof Stmt.Continue) {
            Integer target = null;
            for (JumpTargets enclosing : targets) {
                if (enclosing.continueTarget != null) {
                    target = enclosing.continueTarget;
                    break;
                }
            }
            if (target == null) {
                throw new InvalidControlFlowException("continue", stmt.location);
            }
            current.terminate(new Terminator.Fallthrough(target));
            current = newBlock();
        } else if (stmt instanceof Stmt.Return s) {
            current.terminate(new Terminator.Return(s.value, exit));
            current = newBlock();
        } else if (!(stmt instanceof Stmt.Empty)) {
            current.add(stmt);
        }
    }

    private void lowerIf(Stmt.If s) {
        BasicBlock thenBlock = newBlock();
        BasicBlock elseBlock = s.elseBranch == null ? null : newBlock();
        BasicBlock join = newBlock();
        current.terminate(new Terminator.Branch(s.condition, thenBlock.getId(),
                elseBlock == null ? join.getId() : elseBlock.getId()));
        current = thenBlock;
        lower(s.thenBranch);
        jumpTo(join);
        if (elseBlock != null) {
            current = elseBlock;
            lower(s.elseBranch);
            jumpTo(join);
        }
        current = join;
    }

    private void lowerWhile(Stmt.While s) {
        BasicBlock header = newBlock();
        BasicBlock body = newBlock();
        BasicBlock join = newBlock();
        jumpTo(header);
        header.terminate(new Terminator.Branch(s.condition, body.getId(), join.getId()));
        lowerLoopBody(s.body, body, header, join);
        jumpTo(header);
        current = join;
    }

    private void lowerDoWhile(Stmt.DoWhile s) {
        BasicBlock body = newBlock();
        BasicBlock check = newBlock();
        BasicBlock join = newBlock();
        jumpTo(body);
        lowerLoopBody(s.body, body, check, join);
        jumpTo(check);
        check.terminate(new Terminator.Branch(s.condition, body.getId(), join.getId()));
        current = join;
    }

    private void lowerFor(Stmt.For s) {
        for (Stmt init : s.init) {
            lower(init);
        }
        BasicBlock header = newBlock();
        BasicBlock body = newBlock();
        BasicBlock update = newBlock();
        BasicBlock join = newBlock();
        jumpTo(header);
        header.terminate(s.condition == null
                ? new Terminator.Fallthrough(body.getId())
                : new Terminator.Branch(s.condition, body.getId(), join.getId()));
        lowerLoopBody(s.body, body, update, join);
        jumpTo(update);
        if (s.update != null) {
            update.add(new Stmt.ExprStmt(s.update, s.update.location));
        }
        update.terminate(new Terminator.Fallthrough(header.getId()));
        current = join;
    }

    private void lowerLoopBody(Stmt body, BasicBlock start, BasicBlock continueTarget, BasicBlock breakTarget) {
        targets.push(new JumpTargets(breakTarget.getId(), continueTarget.getId()));
        try {
            current = start;
            lower(body);
        } finally {
            targets.pop();
        }
    }

    private void lowerSwitch(Stmt.Switch s) {
        BasicBlock dispatch = current;
        List<BasicBlock> caseBlocks = new ArrayList<>(s.cases.size());
        for (int i = 0; i < s.cases.size(); i++) {
            caseBlocks.add(newBlock());
        }
        BasicBlock join = newBlock();
        List<Terminator.SwitchCase> labels = new ArrayList<>();
        int defaultTarget = join.getId();
        for (int i = 0; i < s.cases.size(); i++) {
            Stmt.SwitchCase c = s.cases.get(i);
            if (c.isDefault()) {
                defaultTarget = caseBlocks.get(i).getId();
            } else {
                labels.add(new Terminator.SwitchCase(c.label, caseBlocks.get(i).getId()));
            }
        }
        dispatch.terminate(new Terminator.SwitchDispatch(s.value, labels, defaultTarget));

        targets.push(new JumpTargets(join.getId(), null));
        try {
            for (int i = 0; i < s.cases.size(); i++) {
                current = caseBlocks.get(i);
                for (Stmt statement : s.cases.get(i).body) {
                    lower(statement);
                }
                jumpTo(i + 1 < caseBlocks.size() ? caseBlocks.get(i + 1) : join);
            }
        } finally {
            targets.pop();
        }
        current = join;
    }
}
