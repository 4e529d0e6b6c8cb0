package io.github.cobfuscator.strings;

import io.github.cobfuscator.FunctionContext;
import io.github.cobfuscator.ast.AstRewriter;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.Storage;
import io.github.cobfuscator.parser.SourceLocation;
import io.github.cobfuscator.symbols.ConstantEvaluator;
import io.github.cobfuscator.symbols.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces the string literals of one function body with run-time decryption.
 * Cipher text and masked key material go to file-scope arrays in
 * {@code context.preamble}; every literal gets its own static plaintext buffer.
 */
public class StringEncryptor extends AstRewriter {

    private static final Logger logger = LoggerFactory.getLogger(StringEncryptor.class);

    public static final String DECRYPT_FUNCTION = "__cobf_decrypt";
    private static final CType CONST_BYTE = new CType.Base("unsigned char", false, true, false);

    private final FunctionContext context;
    private final SymbolTable symbols;
    private final List<Stmt> buffers = new ArrayList<>();

    private StringEncryptor(FunctionContext context) {
        this.context = context;
        this.symbols = context.symbols;
    }

    public static Stmt.Block encrypt(Stmt.Block body, FunctionContext context) {
        StringEncryptor encryptor = new StringEncryptor(context);
        List<Stmt> statements = encryptor.rewriteStatements(body.statements);
        if (encryptor.buffers.isEmpty()) {
            return new Stmt.Block(statements, body.location);
        }
        List<Stmt> result = new ArrayList<>(encryptor.buffers);
        result.addAll(statements);
        return new Stmt.Block(result, body.location);
    }

    private EncryptedLiteral record(byte[] plaintext, boolean withBuffer) {
        int n = context.literals.size();
        String prefix = "__cobf_f" + context.functionIndex + "_";
        byte[] key = new byte[ChaCha20.KEY_LENGTH];
        byte[] nonce = new byte[ChaCha20.NONCE_LENGTH];
        context.random.nextBytes(key);
        context.random.nextBytes(nonce);
        int seed = context.random.nextInt();
        EncryptedLiteral literal = new EncryptedLiteral(plaintext, key, nonce, seed,
                prefix + "lit_" + n, prefix + "key_" + n, withBuffer ? "__cobf_b" + n : null);
        context.literals.add(literal);

        context.preamble.add(byteArray(literal.getCipherName(), literal.getCipher()));
        context.preamble.add(byteArray(literal.getKeyName(), literal.getMaskedKeyMaterial()));
        if (withBuffer) {
            buffers.add(new Stmt.VarDecl(new CType.Array(new CType.Base("char"), Expr.IntLit.of(plaintext.length)),
                    literal.getBufferName(), null, Storage.STATIC, SourceLocation.UNKNOWN));
        }
        return literal;
    }

    private static Decl byteArray(String name, byte[] bytes) {
        List<Expr> elements = new ArrayList<>(bytes.length);
        for (byte b : bytes) {
            elements.add(Expr.IntLit.of(b & 0xFF));
        }
        return new Decl.GlobalVar(new CType.Array(CONST_BYTE, Expr.IntLit.of(bytes.length)), name,
                new Expr.InitList(elements, SourceLocation.UNKNOWN), Storage.STATIC, SourceLocation.UNKNOWN);
    }

    private static Expr decryptCall(Expr target, EncryptedLiteral literal) {
        long seed = Integer.toUnsignedLong(literal.getSeed());
        return Expr.Call.of(DECRYPT_FUNCTION,
                target,
                new Expr.Ident(literal.getCipherName(), SourceLocation.UNKNOWN),
                new Expr.IntLit(literal.getLength() + "UL", literal.getLength(), SourceLocation.UNKNOWN),
                new Expr.Ident(literal.getKeyName(), SourceLocation.UNKNOWN),
                new Expr.IntLit(String.format("0x%08XUL", seed), seed, SourceLocation.UNKNOWN));
    }

    @Override
    protected Expr rewriteString(Expr.StringLit literal) {
        byte[] plaintext = new byte[literal.length() + 1];
        System.arraycopy(literal.bytes(), 0, plaintext, 0, literal.length());
        EncryptedLiteral encrypted = record(plaintext, true);
        return decryptCall(new Expr.Ident(encrypted.getBufferName(), literal.location), encrypted);
    }

    @Override
    protected Stmt rewriteStringInit(Stmt.StringInit s) {
        Expr target = rewrite(s.target);
        EncryptedLiteral encrypted = record(s.contents(), false);
        return new Stmt.ExprStmt(decryptCall(target, encrypted), s.location);
    }

    @Override
    protected Expr rewriteSizeof(Expr.Sizeof sizeof) {
        if (sizeof.operand instanceof Expr.StringLit literal) {
            CType type = new CType.Array(new CType.Base("char"), Expr.IntLit.of(literal.length() + 1L));
            return new Expr.Sizeof(type, null, sizeof.location);
        }
        return super.rewriteSizeof(sizeof);
    }

    @Override
    public Expr rewrite(Expr expr) {
        if (expr instanceof Expr.CompoundLiteral literal) {
            Expr.InitList init = (Expr.InitList) rewriteInitializer(literal.type, literal.init);
            return new Expr.CompoundLiteral(rewriteType(literal.type), init, literal.location);
        }
        return super.rewrite(expr);
    }

    @Override
    protected Stmt rewriteFor(Stmt.For s) {
        List<Stmt> init = new ArrayList<>(s.init.size());
        for (Stmt statement : s.init) {
            init.add(rewrite(statement));
        }
        return new Stmt.For(init,
                s.condition == null ? null : rewrite(s.condition),
                s.update == null ? null : rewrite(s.update),
                rewrite(s.body), s.location);
    }

    @Override
    protected List<Stmt> rewriteInList(Stmt statement) {
        if (statement instanceof Stmt.VarDecl decl && decl.storage != Storage.STATIC
                && decl.init instanceof Expr.StringLit literal && CType.isCharArray(decl.type)) {
            CType.Array array = (CType.Array) decl.type.withoutConst();
            Long size = array.size == null
                    ? Long.valueOf(literal.length() + 1L)
                    : ConstantEvaluator.evaluate(array.size, symbols.getEnumValues());
            if (size != null) {
                Stmt.VarDecl declaration = new Stmt.VarDecl(array.withSize(Expr.IntLit.of(size)), decl.name, null,
                        decl.storage, decl.location);
                Expr target = new Expr.Ident(decl.name, decl.location);
                return List.of(declaration,
                        rewriteStringInit(new Stmt.StringInit(target, literal, size.intValue(), decl.location)));
            }
        }
        return super.rewriteInList(statement);
    }

    @Override
    protected Stmt rewriteVarDecl(Stmt.VarDecl s) {
        if (s.init == null) {
            return super.rewriteVarDecl(s);
        }
        if (s.storage == Storage.STATIC) {
            if (containsString(s.init)) {
                logger.debug("{}: literal in the static initializer of '{}' stays plaintext", context.function.name, s.name);
            }
            return s;
        }
        return new Stmt.VarDecl(rewriteType(s.type), s.name, rewriteInitializer(s.type, s.init), s.storage, s.location);
    }

    /**
     * Rewrites an initializer knowing the type it initializes. A literal that fills a
     * char array in place has to remain a literal.
     */
    private Expr rewriteInitializer(CType declared, Expr init) {
        CType type = declared == null ? null : symbols.resolve(declared);
        if (init instanceof Expr.InitList list) {
            List<Expr> elements = new ArrayList<>(list.elements.size());
            for (int i = 0; i < list.elements.size(); i++) {
                elements.add(rewriteInitializer(elementType(type, i), list.elements.get(i)));
            }
            return new Expr.InitList(elements, list.location);
        }
        if (init instanceof Expr.StringLit literal && (type == null || CType.isCharArray(type))) {
            logger.debug("{}: literal initializing a char array in braces stays plaintext", context.function.name);
            return literal;
        }
        return rewrite(init);
    }

    private static CType elementType(CType type, int index) {
        if (type instanceof CType.Array array) {
            return array.element;
        }
        if (type instanceof CType.Struct struct && struct.isDefinition()) {
            if (struct.union ? index == 0 : index < struct.fields.size()) {
                return struct.fields.get(index).type;
            }
        }
        return null;
    }

    /** True if {@code expr} contains a string literal anywhere. */
    public static boolean containsString(Expr expr) {
        boolean[] found = {false};
        new AstRewriter() {
            @Override
            protected Expr rewriteString(Expr.StringLit literal) {
                found[0] = true;
                return literal;
            }
        }.rewrite(expr);
        return found[0];
    }
}
