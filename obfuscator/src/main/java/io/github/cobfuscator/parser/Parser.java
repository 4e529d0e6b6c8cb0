package io.github.cobfuscator.parser;

import io.github.cobfuscator.SyntaxException;
import io.github.cobfuscator.UnsupportedConstructException;
import io.github.cobfuscator.ast.CType;
import io.github.cobfuscator.ast.Decl;
import io.github.cobfuscator.ast.Expr;
import io.github.cobfuscator.ast.Stmt;
import io.github.cobfuscator.ast.Storage;
import io.github.cobfuscator.ast.TranslationUnit;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the supported C subset. One instance parses one
 * translation unit.
 */
public class Parser {

    private static final Set<String> PRIMITIVE_SPECIFIERS = Set.of(
            "void", "char", "short", "int", "long", "float", "double", "signed", "unsigned", "_Bool");
    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=");
    private static final String[][] BINARY_LEVELS = {
            {"||"},
            {"&&"},
            {"|"},
            {"^"},
            {"&"},
            {"==", "!="},
            {"<", ">", "<=", ">="},
            {"<<", ">>"},
            {"+", "-"},
            {"*", "/", "%"}
    };

    private final String fileName;
    private final List<Token> tokens;
    private final List<String> includes;
    private final Set<String> typedefNames = new HashSet<>();
    private int pos;

    public Parser(String fileName, List<Token> tokens, List<String> includes) {
        this.fileName = fileName;
        this.tokens = tokens;
        this.includes = includes;
        for (String header : includes) {
            BuiltinHeaders.declarations(header).values().stream()
                    .filter(b -> b.getKind() == BuiltinHeaders.Kind.TYPE)
                    .forEach(b -> typedefNames.add(b.getName()));
        }
    }

    /**
     * Preprocesses, tokenizes and parses {@code source} as one translation unit.
     */
    public static TranslationUnit parse(String fileName, String source) {
        Preprocessor.Result preprocessed = new Preprocessor().process(source);
        List<Token> tokens = new Lexer(preprocessed.getText(), preprocessed.getMacros()).tokenize();
        return new Parser(fileName, tokens, preprocessed.getIncludes()).parseTranslationUnit();
    }

    public TranslationUnit parseTranslationUnit() {
        List<Decl> declarations = new ArrayList<>();
        while (peek().getType() != TokenType.EOF) {
            parseExternalDeclaration(declarations);
        }
        return new TranslationUnit(fileName, includes, declarations);
    }

    // ---------------------------------------------------------------- declarations

    private static final class DeclSpec {
        Storage storage = Storage.NONE;
        boolean isTypedef;
        boolean isInline;
        CType type;
        SourceLocation location;
    }

    private static final class Declarator {
        String name;
        CType type;
        SourceLocation location;
        List<Decl.Param> params;
        boolean variadic;
        boolean unprototyped;

        boolean isFunction() {
            return params != null;
        }
    }

    private void parseExternalDeclaration(List<Decl> out) {
        DeclSpec spec = parseDeclSpec(true);
        if (spec == null) {
            throw new SyntaxException(peek().getLocation(), "a declaration", peek().describe());
        }
        if (accept(";")) {
            if (spec.isTypedef) {
                throw new SyntaxException(spec.location, "a typedef name", "';'");
            }
            if (spec.type instanceof CType.Struct struct && struct.isDefinition()) {
                out.add(new Decl.Struct(struct, spec.location));
            } else if (spec.type instanceof CType.Enum enumType && enumType.isDefinition()) {
                out.add(new Decl.Enum(enumType, spec.location));
            }
            return;
        }
        CType baseType = spec.type;
        boolean first = true;
        while (true) {
            Declarator declarator = parseDeclarator(first ? baseType : referenceOnly(baseType, spec.location), false);
            if (declarator.isFunction()) {
                if (spec.isTypedef) {
                    throw new UnsupportedConstructException("function typedef", declarator.location);
                }
                if (first && peek().isPunct("{")) {
                    Stmt.Block body = parseBlock();
                    out.add(new Decl.Function(declarator.type, declarator.name, declarator.params, declarator.variadic,
                            declarator.unprototyped, spec.storage, spec.isInline, body, declarator.location));
                    return;
                }
                out.add(new Decl.Function(declarator.type, declarator.name, declarator.params, declarator.variadic,
                        declarator.unprototyped, spec.storage, spec.isInline, null, declarator.location));
            } else if (spec.isTypedef) {
                typedefNames.add(declarator.name);
                out.add(new Decl.Typedef(declarator.name, declarator.type, declarator.location));
            } else {
                Expr init = null;
                if (accept("=")) {
                    init = parseInitializer();
                }
                out.add(new Decl.GlobalVar(declarator.type, declarator.name, init, spec.storage, declarator.location));
            }
            first = false;
            if (accept(";")) {
                return;
            }
            expect(",");
        }
    }

    /** A second declarator sharing an inline struct/enum definition refers to it by tag. */
    private static CType referenceOnly(CType type, SourceLocation location) {
        if (type instanceof CType.Struct struct && struct.isDefinition()) {
            if (struct.tag == null) {
                throw new UnsupportedConstructException("several declarators of an anonymous struct", location);
            }
            return struct.reference();
        }
        if (type instanceof CType.Enum enumType && enumType.isDefinition()) {
            if (enumType.tag == null) {
                return new CType.Base("int", false, enumType.isConst, enumType.isVolatile);
            }
            return enumType.reference();
        }
        return type;
    }

    private boolean isDeclarationStart() {
        Token t = peek();
        if (t.getType() == TokenType.KEYWORD) {
            switch (t.getText()) {
                case "typedef": case "static": case "extern": case "register": case "auto": case "inline":
                case "const": case "volatile": case "restrict": case "struct": case "union": case "enum":
                    return true;
                default:
                    return PRIMITIVE_SPECIFIERS.contains(t.getText());
            }
        }
        return t.getType() == TokenType.IDENTIFIER && typedefNames.contains(t.getText())
                && !peek(1).isPunct("=") && !peek(1).isPunct("(") && !peek(1).isPunct(".") && !peek(1).isPunct("->");
    }

    private boolean isTypeNameStart(Token t) {
        if (t.getType() == TokenType.KEYWORD) {
            switch (t.getText()) {
                case "const": case "volatile": case "struct": case "union": case "enum":
                    return true;
                default:
                    return PRIMITIVE_SPECIFIERS.contains(t.getText());
            }
        }
        return t.getType() == TokenType.IDENTIFIER && typedefNames.contains(t.getText());
    }

    /** Returns null when no specifier is present. */
    private DeclSpec parseDeclSpec(boolean allowDefinitions) {
        DeclSpec spec = new DeclSpec();
        spec.location = peek().getLocation();
        List<String> words = new ArrayList<>();
        boolean isConst = false;
        boolean isVolatile = false;
        CType tagged = null;
        String typedefName = null;
        boolean any = false;
        while (true) {
            Token t = peek();
            if (t.getType() == TokenType.KEYWORD) {
                String kw = t.getText();
                if ("typedef".equals(kw)) {
                    spec.isTypedef = true;
                } else if ("static".equals(kw)) {
                    spec.storage = Storage.STATIC;
                } else if ("extern".equals(kw)) {
                    spec.storage = Storage.EXTERN;
                } else if ("register".equals(kw)) {
                    spec.storage = Storage.REGISTER;
                } else if ("auto".equals(kw) || "restrict".equals(kw)) {
                    // no effect on the emitted program
                } else if ("inline".equals(kw)) {
                    spec.isInline = true;
                } else if ("const".equals(kw)) {
                    isConst = true;
                } else if ("volatile".equals(kw)) {
                    isVolatile = true;
                } else if (PRIMITIVE_SPECIFIERS.contains(kw) && tagged == null && typedefName == null) {
                    words.add(kw);
                } else if (("struct".equals(kw) || "union".equals(kw)) && words.isEmpty() && tagged == null && typedefName == null) {
                    advance();
                    tagged = parseStructSpecifier("union".equals(kw), t.getLocation(), allowDefinitions);
                    any = true;
                    continue;
                } else if ("enum".equals(kw) && words.isEmpty() && tagged == null && typedefName == null) {
                    advance();
                    tagged = parseEnumSpecifier(t.getLocation(), allowDefinitions);
                    any = true;
                    continue;
                } else {
                    break;
                }
                advance();
                any = true;
                continue;
            }
            if (t.getType() == TokenType.IDENTIFIER && typedefNames.contains(t.getText())
                    && words.isEmpty() && tagged == null && typedefName == null) {
                typedefName = t.getText();
                advance();
                any = true;
                continue;
            }
            break;
        }
        if (!any) {
            return null;
        }
        if (tagged != null) {
            spec.type = tagged.withQualifiers(isConst, isVolatile);
        } else if (typedefName != null) {
            spec.type = new CType.Base(typedefName, true, isConst, isVolatile);
        } else if (!words.isEmpty()) {
            spec.type = new CType.Base(String.join(" ", words), false, isConst, isVolatile);
        } else {
            // "const x;" and "unsigned;" style implicit int
            spec.type = new CType.Base("int", false, isConst, isVolatile);
        }
        return spec;
    }

    private CType parseStructSpecifier(boolean union, SourceLocation location, boolean allowDefinitions) {
        String tag = null;
        if (peek().getType() == TokenType.IDENTIFIER) {
            tag = advance().getText();
        }
        if (!peek().isPunct("{")) {
            if (tag == null) {
                throw new SyntaxException(peek().getLocation(), "a struct tag or '{'", peek().describe());
            }
            return new CType.Struct(union, tag, null, false, false);
        }
        if (!allowDefinitions) {
            throw new UnsupportedConstructException((union ? "union" : "struct") + " definition inside a function", location);
        }
        expect("{");
        List<CType.Field> fields = new ArrayList<>();
        while (!accept("}")) {
            DeclSpec fieldSpec = parseDeclSpec(true);
            if (fieldSpec == null || fieldSpec.isTypedef || fieldSpec.storage != Storage.NONE) {
                throw new SyntaxException(peek().getLocation(), "a field declaration", peek().describe());
            }
            boolean first = true;
            do {
                Declarator declarator = parseDeclarator(first ? fieldSpec.type : referenceOnly(fieldSpec.type, fieldSpec.location), false);
                if (declarator.isFunction()) {
                    throw new UnsupportedConstructException("function member", declarator.location);
                }
                if (peek().isPunct(":")) {
                    throw new UnsupportedConstructException("bit-field", peek().getLocation());
                }
                fields.add(new CType.Field(declarator.type, declarator.name));
                first = false;
            } while (accept(","));
            expect(";");
        }
        return new CType.Struct(union, tag, fields, false, false);
    }

    private CType parseEnumSpecifier(SourceLocation location, boolean allowDefinitions) {
        String tag = null;
        if (peek().getType() == TokenType.IDENTIFIER) {
            tag = advance().getText();
        }
        if (!peek().isPunct("{")) {
            if (tag == null) {
                throw new SyntaxException(peek().getLocation(), "an enum tag or '{'", peek().describe());
            }
            return new CType.Enum(tag, null, false, false);
        }
        if (!allowDefinitions) {
            throw new UnsupportedConstructException("enum definition inside a function", location);
        }
        expect("{");
        List<CType.Enumerator> enumerators = new ArrayList<>();
        while (!accept("}")) {
            Token name = expectIdentifier();
            Expr value = null;
            if (accept("=")) {
                value = parseConditional();
            }
            enumerators.add(new CType.Enumerator(name.getText(), value, name.getLocation()));
            if (!accept(",")) {
                expect("}");
                break;
            }
        }
        return new CType.Enum(tag, enumerators, false, false);
    }

    private Declarator parseDeclarator(CType base, boolean abstractAllowed) {
        Declarator declarator = new Declarator();
        CType type = base;
        while (peek().isPunct("*")) {
            advance();
            boolean isConst = false;
            boolean isVolatile = false;
            while (peek().isKeyword("const") || peek().isKeyword("volatile") || peek().isKeyword("restrict")) {
                String kw = advance().getText();
                isConst |= "const".equals(kw);
                isVolatile |= "volatile".equals(kw);
            }
            type = new CType.Pointer(type, isConst, isVolatile);
        }
        declarator.location = peek().getLocation();
        if (peek().isPunct("(")) {
            throw new UnsupportedConstructException("parenthesized declarator (function pointer)", peek().getLocation());
        }
        if (peek().getType() == TokenType.IDENTIFIER) {
            declarator.name = advance().getText();
        } else if (!abstractAllowed) {
            throw new SyntaxException(peek().getLocation(), "an identifier", peek().describe());
        }
        if (peek().isPunct("(") && declarator.name != null) {
            advance();
            parseParameters(declarator);
            declarator.type = type;
            if (peek().isPunct("[") || peek().isPunct("(")) {
                throw new UnsupportedConstructException("function returning array or function", peek().getLocation());
            }
            return declarator;
        }
        List<Expr> dims = new ArrayList<>();
        while (accept("[")) {
            if (accept("]")) {
                dims.add(null);
            } else {
                dims.add(parseConditional());
                expect("]");
            }
        }
        for (int i = dims.size() - 1; i >= 0; i--) {
            type = new CType.Array(type, dims.get(i));
        }
        declarator.type = type;
        return declarator;
    }

    private void parseParameters(Declarator declarator) {
        List<Decl.Param> params = new ArrayList<>();
        declarator.params = params;
        if (accept(")")) {
            declarator.unprototyped = true;
            return;
        }
        if (peek().isKeyword("void") && peek(1).isPunct(")")) {
            advance();
            advance();
            return;
        }
        while (true) {
            if (accept("...")) {
                declarator.variadic = true;
                expect(")");
                return;
            }
            DeclSpec spec = parseDeclSpec(false);
            if (spec == null) {
                throw new SyntaxException(peek().getLocation(), "a parameter declaration", peek().describe());
            }
            Declarator param = parseDeclarator(spec.type, true);
            if (param.isFunction()) {
                throw new UnsupportedConstructException("function parameter", param.location);
            }
            params.add(new Decl.Param(param.type, param.name));
            if (accept(")")) {
                return;
            }
            expect(",");
        }
    }

    private CType parseTypeName() {
        DeclSpec spec = parseDeclSpec(false);
        if (spec == null || spec.isTypedef || spec.storage != Storage.NONE) {
            throw new SyntaxException(peek().getLocation(), "a type name", peek().describe());
        }
        Declarator declarator = parseDeclarator(spec.type, true);
        if (declarator.name != null) {
            throw new SyntaxException(declarator.location, "an abstract type name", "'" + declarator.name + "'");
        }
        return declarator.type;
    }

    private Expr parseInitializer() {
        if (peek().isPunct("{")) {
            SourceLocation location = advance().getLocation();
            List<Expr> elements = new ArrayList<>();
            while (!accept("}")) {
                if (peek().isPunct(".") || peek().isPunct("[")) {
                    throw new UnsupportedConstructException("designated initializer", peek().getLocation());
                }
                elements.add(parseInitializer());
                if (!accept(",")) {
                    expect("}");
                    break;
                }
            }
            return new Expr.InitList(elements, location);
        }
        return parseAssignment();
    }

    // ---------------------------------------------------------------- statements

    private Stmt.Block parseBlock() {
        SourceLocation location = expect("{").getLocation();
        List<Stmt> statements = new ArrayList<>();
        while (!accept("}")) {
            if (peek().getType() == TokenType.EOF) {
                throw new SyntaxException(peek().getLocation(), "'}'", peek().describe());
            }
            parseBlockItem(statements);
        }
        return new Stmt.Block(statements, location);
    }

    private void parseBlockItem(List<Stmt> out) {
        if (isDeclarationStart()) {
            out.addAll(parseLocalDeclaration());
        } else {
            out.add(parseStatement());
        }
    }

    private List<Stmt> parseLocalDeclaration() {
        DeclSpec spec = parseDeclSpec(false);
        if (spec.isTypedef) {
            throw new UnsupportedConstructException("typedef inside a function", spec.location);
        }
        if (spec.storage == Storage.EXTERN) {
            throw new UnsupportedConstructException("extern declaration inside a function", spec.location);
        }
        List<Stmt> declarations = new ArrayList<>();
        if (accept(";")) {
            return declarations;
        }
        do {
            Declarator declarator = parseDeclarator(spec.type, false);
            if (declarator.isFunction()) {
                throw new UnsupportedConstructException("function declaration inside a function", declarator.location);
            }
            Expr init = null;
            if (accept("=")) {
                init = parseInitializer();
            }
            declarations.add(new Stmt.VarDecl(declarator.type, declarator.name, init, spec.storage, declarator.location));
        } while (accept(","));
        expect(";");
        return declarations;
    }

    private Stmt parseStatement() {
        Token t = peek();
        SourceLocation location = t.getLocation();
        if (t.isPunct("{")) {
            return parseBlock();
        }
        if (t.isPunct(";")) {
            advance();
            return new Stmt.Empty(location);
        }
        if (t.getType() == TokenType.KEYWORD) {
            switch (t.getText()) {
                case "if": {
                    advance();
                    expect("(");
                    Expr condition = parseExpression();
                    expect(")");
                    Stmt thenBranch = parseStatement();
                    Stmt elseBranch = accept("else") ? parseStatement() : null;
                    return new Stmt.If(condition, thenBranch, elseBranch, location);
                }
                case "while": {
                    advance();
                    expect("(");
                    Expr condition = parseExpression();
                    expect(")");
                    return new Stmt.While(condition, parseStatement(), location);
                }
                case "do": {
                    advance();
                    Stmt body = parseStatement();
                    expectKeyword("while");
                    expect("(");
                    Expr condition = parseExpression();
                    expect(")");
                    expect(";");
                    return new Stmt.DoWhile(body, condition, location);
                }
                case "for":
                    return parseFor();
                case "switch":
                    return parseSwitch();
                case "break":
                    advance();
                    expect(";");
                    return new Stmt.Break(location);
                case "continue":
                    advance();
                    expect(";");
                    return new Stmt.Continue(location);
                case "return": {
                    advance();
                    Expr value = peek().isPunct(";") ? null : parseExpression();
                    expect(";");
                    return new Stmt.Return(value, location);
                }
                case "goto":
                    throw new UnsupportedConstructException("goto", location);
                case "case":
                case "default":
                    throw new UnsupportedConstructException("case label nested inside a statement", location);
                default:
                    break;
            }
        }
        if (t.getType() == TokenType.IDENTIFIER && peek(1).isPunct(":")) {
            throw new UnsupportedConstructException("labeled statement", location);
        }
        Expr expr = parseExpression();
        expect(";");
        return new Stmt.ExprStmt(expr, location);
    }

    private Stmt parseFor() {
        SourceLocation location = advance().getLocation();
        expect("(");
        List<Stmt> init = new ArrayList<>();
        if (isDeclarationStart()) {
            init.addAll(parseLocalDeclaration());
        } else if (!accept(";")) {
            Expr expr = parseExpression();
            init.add(new Stmt.ExprStmt(expr, expr.location));
            expect(";");
        }
        Expr condition = peek().isPunct(";") ? null : parseExpression();
        expect(";");
        Expr update = peek().isPunct(")") ? null : parseExpression();
        expect(")");
        return new Stmt.For(init, condition, update, parseStatement(), location);
    }

    private Stmt parseSwitch() {
        SourceLocation location = advance().getLocation();
        expect("(");
        Expr value = parseExpression();
        expect(")");
        if (!peek().isPunct("{")) {
            throw new UnsupportedConstructException("switch without a braced body", peek().getLocation());
        }
        advance();
        List<Stmt.SwitchCase> cases = new ArrayList<>();
        Expr label = null;
        SourceLocation caseLocation = null;
        List<Stmt> body = null;
        boolean sawDefault = false;
        while (!accept("}")) {
            Token t = peek();
            if (t.isKeyword("case") || t.isKeyword("default")) {
                if (body != null) {
                    cases.add(new Stmt.SwitchCase(label, body, caseLocation));
                }
                advance();
                caseLocation = t.getLocation();
                if (t.isKeyword("case")) {
                    label = parseConditional();
                } else {
                    if (sawDefault) {
                        throw new SyntaxException(t.getLocation(), "a single default label", "a second 'default'");
                    }
                    sawDefault = true;
                    label = null;
                }
                expect(":");
                body = new ArrayList<>();
                continue;
            }
            if (t.getType() == TokenType.EOF) {
                throw new SyntaxException(t.getLocation(), "'}'", t.describe());
            }
            if (body == null) {
                throw new UnsupportedConstructException("statement before the first case label", t.getLocation());
            }
            parseBlockItem(body);
        }
        if (body != null) {
            cases.add(new Stmt.SwitchCase(label, body, caseLocation));
        }
        return new Stmt.Switch(value, cases, location);
    }

    // ---------------------------------------------------------------- expressions

    public Expr parseExpression() {
        Expr expr = parseAssignment();
        while (peek().isPunct(",")) {
            SourceLocation location = advance().getLocation();
            expr = new Expr.Comma(expr, parseAssignment(), location);
        }
        return expr;
    }

    private Expr parseAssignment() {
        Expr left = parseConditional();
        Token t = peek();
        if (t.getType() == TokenType.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(t.getText())) {
            advance();
            Expr right = parseAssignment();
            return new Expr.Assign(t.getText(), left, right, t.getLocation());
        }
        return left;
    }

    private Expr parseConditional() {
        Expr condition = parseBinary(0);
        if (peek().isPunct("?")) {
            SourceLocation location = advance().getLocation();
            Expr whenTrue = parseExpression();
            expect(":");
            Expr whenFalse = parseConditional();
            return new Expr.Ternary(condition, whenTrue, whenFalse, location);
        }
        return condition;
    }

    private Expr parseBinary(int level) {
        if (level == BINARY_LEVELS.length) {
            return parseCast();
        }
        Expr left = parseBinary(level + 1);
        while (true) {
            Token t = peek();
            String op = null;
            if (t.getType() == TokenType.PUNCTUATOR) {
                for (String candidate : BINARY_LEVELS[level]) {
                    if (candidate.equals(t.getText())) {
                        op = candidate;
                        break;
                    }
                }
            }
            if (op == null) {
                return left;
            }
            advance();
            left = new Expr.Binary(op, left, parseBinary(level + 1), t.getLocation());
        }
    }

    private Expr parseCast() {
        if (peek().isPunct("(") && isTypeNameStart(peek(1))) {
            SourceLocation location = advance().getLocation();
            CType type = parseTypeName();
            expect(")");
            if (peek().isPunct("{")) {
                Expr.InitList init = (Expr.InitList) parseInitializer();
                return parsePostfixSuffixes(new Expr.CompoundLiteral(type, init, location));
            }
            return new Expr.Cast(type, parseCast(), location);
        }
        return parseUnary();
    }

    private Expr parseUnary() {
        Token t = peek();
        SourceLocation location = t.getLocation();
        if (t.getType() == TokenType.PUNCTUATOR) {
            switch (t.getText()) {
                case "++":
                    advance();
                    return new Expr.Unary(Expr.UnaryOp.PRE_INC, parseUnary(), location);
                case "--":
                    advance();
                    return new Expr.Unary(Expr.UnaryOp.PRE_DEC, parseUnary(), location);
                case "&":
                    advance();
                    return new Expr.Unary(Expr.UnaryOp.ADDRESS_OF, parseCast(), location);
                case "*":
                    advance();
                    return new Expr.Deref(parseCast(), location);
                case "-":
                    advance();
                    return new Expr.Unary(Expr.UnaryOp.NEGATE, parseCast(), location);
                case "+":
                    advance();
                    return new Expr.Unary(Expr.UnaryOp.PLUS, parseCast(), location);
                case "!":
                    advance();
                    return new Expr.Unary(Expr.UnaryOp.NOT, parseCast(), location);
                case "~":
                    advance();
                    return new Expr.Unary(Expr.UnaryOp.BIT_NOT, parseCast(), location);
                default:
                    break;
            }
        }
        if (t.isKeyword("sizeof")) {
            advance();
            if (peek().isPunct("(") && isTypeNameStart(peek(1))) {
                advance();
                CType type = parseTypeName();
                expect(")");
                return new Expr.Sizeof(type, null, location);
            }
            return new Expr.Sizeof(null, parseUnary(), location);
        }
        return parsePostfixSuffixes(parsePrimary());
    }

    private Expr parsePostfixSuffixes(Expr expr) {
        while (true) {
            Token t = peek();
            SourceLocation location = t.getLocation();
            if (t.isPunct("[")) {
                advance();
                Expr index = parseExpression();
                expect("]");
                expr = new Expr.Index(expr, index, location);
            } else if (t.isPunct("(")) {
                advance();
                List<Expr> args = new ArrayList<>();
                if (!accept(")")) {
                    do {
                        args.add(parseAssignment());
                    } while (accept(","));
                    expect(")");
                }
                expr = new Expr.Call(expr, args, location);
            } else if (t.isPunct(".") || t.isPunct("->")) {
                advance();
                expr = new Expr.Member(expr, expectIdentifier().getText(), t.isPunct("->"), location);
            } else if (t.isPunct("++")) {
                advance();
                expr = new Expr.Unary(Expr.UnaryOp.POST_INC, expr, location);
            } else if (t.isPunct("--")) {
                advance();
                expr = new Expr.Unary(Expr.UnaryOp.POST_DEC, expr, location);
            } else {
                return expr;
            }
        }
    }

    private Expr parsePrimary() {
        Token t = peek();
        SourceLocation location = t.getLocation();
        switch (t.getType()) {
            case IDENTIFIER:
                advance();
                return new Expr.Ident(t.getText(), location);
            case INT_LITERAL:
                advance();
                return new Expr.IntLit(t.getText(), t.getValue(), location);
            case FLOAT_LITERAL:
                advance();
                return new Expr.FloatLit(t.getText(), location);
            case CHAR_LITERAL:
                advance();
                return new Expr.CharLit(t.getText(), t.getValue(), location);
            case STRING_LITERAL: {
                ByteArrayOutputStream bytes = new ByteArrayOutputStream();
                while (peek().getType() == TokenType.STRING_LITERAL) {
                    byte[] part = advance().getBytes();
                    bytes.write(part, 0, part.length);
                }
                return new Expr.StringLit(bytes.toByteArray(), location);
            }
            case PUNCTUATOR:
                if (t.isPunct("(")) {
                    advance();
                    Expr inner = parseExpression();
                    expect(")");
                    return inner;
                }
                break;
            default:
                break;
        }
        throw new SyntaxException(location, "an expression", t.describe());
    }

    // ---------------------------------------------------------------- token helpers

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (t.getType() != TokenType.EOF) {
            pos++;
        }
        return t;
    }

    private boolean accept(String text) {
        Token t = peek();
        if ((t.getType() == TokenType.PUNCTUATOR || t.getType() == TokenType.KEYWORD) && t.getText().equals(text)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(String punct) {
        Token t = peek();
        if (!t.isPunct(punct)) {
            throw new SyntaxException(t.getLocation(), "'" + punct + "'", t.describe());
        }
        return advance();
    }

    private Token expectKeyword(String keyword) {
        Token t = peek();
        if (!t.isKeyword(keyword)) {
            throw new SyntaxException(t.getLocation(), "'" + keyword + "'", t.describe());
        }
        return advance();
    }

    private Token expectIdentifier() {
        Token t = peek();
        if (t.getType() != TokenType.IDENTIFIER) {
            throw new SyntaxException(t.getLocation(), "an identifier", t.describe());
        }
        return advance();
    }
}
