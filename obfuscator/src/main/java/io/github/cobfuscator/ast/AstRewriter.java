package io.github.cobfuscator.ast;

import io.github.cobfuscator.InternalInvariantException;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a tree bottom-up. Subclasses override the hooks for the nodes they change;
 * every other node is copied with its rewritten children.
 */
public abstract class AstRewriter {

    public Stmt.Block rewriteBlock(Stmt.Block block) {
        return new Stmt.Block(rewriteStatements(block.statements), block.location);
    }

    /** Rewrites a statement sequence; a hook may expand one statement into several. */
    public List<Stmt> rewriteStatements(List<Stmt> statements) {
        List<Stmt> result = new ArrayList<>(statements.size());
        for (Stmt statement : statements) {
            result.addAll(rewriteInList(statement));
        }
        return result;
    }

    protected List<Stmt> rewriteInList(Stmt statement) {
        return List.of(rewrite(statement));
    }

    public Stmt rewrite(Stmt stmt) {
        if (stmt instanceof Stmt.Block block) {
            return rewriteBlock(block);
        } else if (stmt instanceof Stmt.If s) {
            return new Stmt.If(rewrite(s.condition), rewrite(s.thenBranch),
                    s.elseBranch == null ? null : rewrite(s.elseBranch), s.location);
        } else if (stmt instanceof Stmt.For s) {
            return rewriteFor(s);
        } else if (stmt instanceof Stmt.While s) {
            return new Stmt.While(rewrite(s.condition), rewrite(s.body), s.location);
        } else if (stmt instanceof Stmt.DoWhile s) {
            return new Stmt.DoWhile(rewrite(s.body), rewrite(s.condition), s.location);
        } else if (stmt instanceof Stmt.Switch s) {
            return rewriteSwitch(s);
        } else if (stmt instanceof Stmt.Return s) {
            return new Stmt.Return(s.value == null ? null : rewrite(s.value), s.location);
        } else if (stmt instanceof Stmt.ExprStmt s) {
            return new Stmt.ExprStmt(rewrite(s.expr), s.location);
        } else if (stmt instanceof Stmt.VarDecl s) {
            return rewriteVarDecl(s);
        } else if (stmt instanceof Stmt.StringInit s) {
            return rewriteStringInit(s);
        } else if (stmt instanceof Stmt.ZeroFill s) {
            return new Stmt.ZeroFill(rewrite(s.target), s.location);
        } else if (stmt instanceof Stmt.Break || stmt instanceof Stmt.Continue || stmt instanceof Stmt.Empty) {
            return stmt;
        }
        throw new InternalInvariantException("unknown statement " + stmt.getClass().getSimpleName());
    }

    protected Stmt rewriteFor(Stmt.For s) {
        return new Stmt.For(rewriteStatements(s.init),
                s.condition == null ? null : rewrite(s.condition),
                s.update == null ? null : rewrite(s.update),
                rewrite(s.body), s.location);
    }

    protected Stmt rewriteSwitch(Stmt.Switch s) {
        Expr value = rewrite(s.value);
        List<Stmt.SwitchCase> cases = new ArrayList<>(s.cases.size());
        for (Stmt.SwitchCase c : s.cases) {
            cases.add(new Stmt.SwitchCase(c.label == null ? null : rewrite(c.label), rewriteStatements(c.body), c.location));
        }
        return new Stmt.Switch(value, cases, s.location);
    }

    protected Stmt rewriteVarDecl(Stmt.VarDecl s) {
        return new Stmt.VarDecl(rewriteType(s.type), s.name, s.init == null ? null : rewrite(s.init), s.storage, s.location);
    }

    protected Stmt rewriteStringInit(Stmt.StringInit s) {
        return new Stmt.StringInit(rewrite(s.target), s.literal, s.size, s.location);
    }

    public CType rewriteType(CType type) {
        if (type instanceof CType.Array array) {
            CType element = rewriteType(array.element);
            Expr size = array.size == null ? null : rewrite(array.size);
            return new CType.Array(element, size);
        }
        if (type instanceof CType.Pointer pointer) {
            return new CType.Pointer(rewriteType(pointer.target), pointer.isConst, pointer.isVolatile);
        }
        return type;
    }

    public Expr rewrite(Expr expr) {
        if (expr instanceof Expr.Ident e) {
            return rewriteIdent(e);
        } else if (expr instanceof Expr.StringLit e) {
            return rewriteString(e);
        } else if (expr instanceof Expr.IntLit || expr instanceof Expr.FloatLit || expr instanceof Expr.CharLit) {
            return expr;
        } else if (expr instanceof Expr.Binary e) {
            return new Expr.Binary(e.op, rewrite(e.left), rewrite(e.right), e.location);
        } else if (expr instanceof Expr.Unary e) {
            return new Expr.Unary(e.op, rewrite(e.operand), e.location);
        } else if (expr instanceof Expr.Call e) {
            List<Expr> args = new ArrayList<>(e.args.size());
            for (Expr arg : e.args) {
                args.add(rewrite(arg));
            }
            return new Expr.Call(rewrite(e.callee), args, e.location);
        } else if (expr instanceof Expr.Index e) {
            return new Expr.Index(rewrite(e.array), rewrite(e.index), e.location);
        } else if (expr instanceof Expr.Member e) {
            return new Expr.Member(rewrite(e.object), e.name, e.arrow, e.location);
        } else if (expr instanceof Expr.Deref e) {
            return new Expr.Deref(rewrite(e.operand), e.location);
        } else if (expr instanceof Expr.Ternary e) {
            return new Expr.Ternary(rewrite(e.condition), rewrite(e.whenTrue), rewrite(e.whenFalse), e.location);
        } else if (expr instanceof Expr.Sizeof e) {
            return rewriteSizeof(e);
        } else if (expr instanceof Expr.Assign e) {
            return new Expr.Assign(e.op, rewrite(e.target), rewrite(e.value), e.location);
        } else if (expr instanceof Expr.Cast e) {
            return new Expr.Cast(rewriteType(e.type), rewrite(e.operand), e.location);
        } else if (expr instanceof Expr.Comma e) {
            return new Expr.Comma(rewrite(e.left), rewrite(e.right), e.location);
        } else if (expr instanceof Expr.InitList e) {
            return rewriteInitList(e);
        } else if (expr instanceof Expr.CompoundLiteral e) {
            return new Expr.CompoundLiteral(rewriteType(e.type), rewriteInitList(e.init), e.location);
        }
        throw new InternalInvariantException("unknown expression " + expr.getClass().getSimpleName());
    }

    protected Expr.InitList rewriteInitList(Expr.InitList list) {
        List<Expr> elements = new ArrayList<>(list.elements.size());
        for (Expr element : list.elements) {
            elements.add(rewrite(element));
        }
        return new Expr.InitList(elements, list.location);
    }

    protected Expr rewriteIdent(Expr.Ident ident) {
        return ident;
    }

    protected Expr rewriteString(Expr.StringLit literal) {
        return literal;
    }

    protected Expr rewriteSizeof(Expr.Sizeof sizeof) {
        if (sizeof.type != null) {
            return new Expr.Sizeof(rewriteType(sizeof.type), null, sizeof.location);
        }
        return new Expr.Sizeof(null, rewrite(sizeof.operand), sizeof.location);
    }
}
