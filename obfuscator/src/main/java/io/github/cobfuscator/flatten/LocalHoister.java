package io.github.cobfuscator.flatten;

import io.github.cobfuscator.FunctionContext;
import io.github.cobfuscator.UnsupportedConstructException;
import io.github.cobfuscator.ast.AstRewriter;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.Storage;
import io.github.cobfuscator.parser.SourceLocation;
import io.github.cobfuscator.symbols.ConstantEvaluator;
import io.github.cobfuscator.symbols.SymbolTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves every local declaration of a function to the top of its body so that the
 * dispatcher can jump between blocks freely. Each local gets a name unique within the
 * function; initializers become assignments at the original position, so a declaration
 * inside a loop is still re-initialized on every iteration.
 */
public class LocalHoister extends AstRewriter {

    private final FunctionContext context;
    private final SymbolTable symbols;
    private final Set<String> usedNames = new HashSet<>();
    private final Deque<Map<String, String>> scopes = new ArrayDeque<>();
    private final List<Stmt.VarDecl> hoisted = new ArrayList<>();
    private int renameCounter;

    private LocalHoister(FunctionContext context) {
        this.context = context;
        this.symbols = context.symbols;
    }

    /**
     * Rewrites the body of {@code context.function}; the hoisted declarations are stored
     * in {@code context.hoisted} and the remaining statements returned.
     */
    public static List<Stmt> hoist(FunctionContext context) {
        LocalHoister hoister = new LocalHoister(context);
        hoister.usedNames.addAll(context.symbols.getSymbols().keySet());
        Map<String, String> params = new HashMap<>();
        for (Decl.Param param : context.function.params) {
            if (param.name != null) {
                params.put(param.name, param.name);
                hoister.usedNames.add(param.name);
            }
        }
        hoister.scopes.push(params);
        List<Stmt> body = hoister.rewriteBlock(context.function.body).statements;
        context.hoisted = hoister.hoisted;
        return body;
    }

    private String declare(String name) {
        String unique;
        if (context.protectionConfig.isRenameLocals()) {
            do {
                unique = "__cobf_v" + renameCounter++;
            } while (usedNames.contains(unique));
        } else {
            unique = name;
            for (int n = 1; usedNames.contains(unique); n++) {
                unique = name + "_" + n;
            }
        }
        usedNames.add(unique);
        scopes.peek().put(name, unique);
        return unique;
    }

    @Override
    public Stmt.Block rewriteBlock(Stmt.Block block) {
        scopes.push(new HashMap<>());
        try {
            return super.rewriteBlock(block);
        } finally {
            scopes.pop();
        }
    }

    @Override
    protected Stmt rewriteFor(Stmt.For s) {
        scopes.push(new HashMap<>());
        try {
            return super.rewriteFor(s);
        } finally {
            scopes.pop();
        }
    }

    @Override
    protected Stmt rewriteSwitch(Stmt.Switch s) {
        scopes.push(new HashMap<>());
        try {
            return super.rewriteSwitch(s);
        } finally {
            scopes.pop();
        }
    }

    @Override
    protected Expr rewriteIdent(Expr.Ident ident) {
        for (Map<String, String> scope : scopes) {
            String renamed = scope.get(ident.name);
            if (renamed != null) {
                return renamed.equals(ident.name) ? ident : new Expr.Ident(renamed, ident.location);
            }
        }
        return ident;
    }

    @Override
    protected List<Stmt> rewriteInList(Stmt statement) {
        if (statement instanceof Stmt.VarDecl decl) {
            return lowerDeclaration(decl);
        }
        return super.rewriteInList(statement);
    }

    @Override
    protected Stmt rewriteVarDecl(Stmt.VarDecl s) {
        // only reached for a declaration that is the whole body of an if or loop
        List<Stmt> lowered = lowerDeclaration(s);
        if (lowered.size() == 1) {
            return lowered.get(0);
        }
        return new Stmt.Block(lowered, s.location);
    }

    private List<Stmt> lowerDeclaration(Stmt.VarDecl decl) {
        CType type = rewriteType(decl.type).withoutConst();
        type = completeArrayType(type, decl.init, decl.location);
        checkConstantSizes(type, decl.location);
        String name = declare(decl.name);

        if (decl.storage == Storage.STATIC) {
            hoisted.add(new Stmt.VarDecl(type, name, decl.init, Storage.STATIC, decl.location));
            return List.of();
        }
        hoisted.add(new Stmt.VarDecl(type, name, null, Storage.NONE, decl.location));
        if (decl.init == null) {
            return List.of();
        }
        Expr init = rewrite(decl.init);
        List<Stmt> out = new ArrayList<>();
        lowerInitializer(new Expr.Ident(name, decl.location), type, init, true, decl.location, out);
        return out;
    }

    private void lowerInitializer(Expr target, CType declared, Expr init, boolean topLevel, SourceLocation location,
                                  List<Stmt> out) {
        CType type = symbols.resolve(declared);
        if (type instanceof CType.Array array) {
            if (init instanceof Expr.StringLit literal && CType.isCharArray(array)) {
                out.add(new Stmt.StringInit(target, literal, arrayLength(array, location), location));
                return;
            }
            if (!(init instanceof Expr.InitList list)) {
                throw new UnsupportedConstructException("array initialized from an expression", location);
            }
            if (topLevel) {
                out.add(new Stmt.ZeroFill(target, location));
            }
            if (list.elements.size() > arrayLength(array, location)) {
                throw new UnsupportedConstructException("excess elements in array initializer", location);
            }
            for (int i = 0; i < list.elements.size(); i++) {
                Expr element = list.elements.get(i);
                CType elementType = symbols.resolve(array.element);
                if (elementType instanceof CType.Array && !(element instanceof Expr.InitList)
                        && !(element instanceof Expr.StringLit)) {
                    throw new UnsupportedConstructException("brace-elided initializer", element.location);
                }
                lowerInitializer(new Expr.Index(target, Expr.IntLit.of(i), element.location), array.element,
                        element, false, location, out);
            }
            return;
        }
        if (type instanceof CType.Struct) {
            if (init instanceof Expr.InitList list) {
                out.add(Stmt.ExprStmt.of(Expr.Assign.simple(target,
                        new Expr.CompoundLiteral(declared.unqualified(), list, list.location))));
            } else {
                out.add(Stmt.ExprStmt.of(Expr.Assign.simple(target, init)));
            }
            return;
        }
        Expr value = init;
        if (value instanceof Expr.InitList list) {
            if (list.elements.size() != 1) {
                throw new UnsupportedConstructException("braced scalar initializer", list.location);
            }
            value = list.elements.get(0);
        }
        out.add(Stmt.ExprStmt.of(Expr.Assign.simple(target, value)));
    }

    /** Fills in {@code []} from the initializer. */
    private CType completeArrayType(CType type, Expr init, SourceLocation location) {
        if (!(type instanceof CType.Array array) || array.size != null) {
            return type;
        }
        if (init instanceof Expr.InitList list) {
            return array.withSize(Expr.IntLit.of(list.elements.size()));
        }
        if (init instanceof Expr.StringLit literal) {
            return array.withSize(Expr.IntLit.of(literal.length() + 1L));
        }
        throw new UnsupportedConstructException("array without a size", location);
    }

    private void checkConstantSizes(CType type, SourceLocation location) {
        if (type instanceof CType.Array array) {
            if (array.size == null || ConstantEvaluator.evaluate(array.size, symbols.getEnumValues()) == null) {
                throw new UnsupportedConstructException("variable-length array", location);
            }
            checkConstantSizes(array.element, location);
        }
    }

    private int arrayLength(CType.Array array, SourceLocation location) {
        Long length = array.size == null ? null : ConstantEvaluator.evaluate(array.size, symbols.getEnumValues());
        if (length == null) {
            throw new UnsupportedConstructException("variable-length array", location);
        }
        return length.intValue();
    }
}
