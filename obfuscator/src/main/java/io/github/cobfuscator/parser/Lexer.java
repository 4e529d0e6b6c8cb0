package io.github.cobfuscator.parser;

import io.github.cobfuscator.SyntaxException;
import io.github.cobfuscator.UnsupportedConstructException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Lexer {

    public static final Set<String> KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "return", "short", "signed", "sizeof", "static", "struct", "switch",
            "typedef", "union", "unsigned", "void", "volatile", "while", "_Bool", "restrict");

    private static final String[] PUNCTUATORS = {
            "...", "<<=", ">>=",
            "->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "{", "}", "[", "]", "(", ")", ";", ",", ":", "?", ".",
            "+", "-", "*", "/", "%", "<", ">", "=", "!", "~", "&", "|", "^"
    };

    private final String source;
    private final Map<String, String> macros;
    private int pos;
    private int line = 1;
    private int column = 1;

    public Lexer(String source) {
        this(source, Collections.emptyMap());
    }

    public Lexer(String source, Map<String, String> macros) {
        this.source = source;
        this.macros = macros;
    }

    public List<Token> tokenize() {
        List<Token> raw = new ArrayList<>();
        Token token;
        do {
            token = next();
            raw.add(token);
        } while (token.getType() != TokenType.EOF);
        if (macros.isEmpty()) {
            return raw;
        }
        List<Token> expanded = new ArrayList<>(raw.size());
        for (Token t : raw) {
            expand(t, t.getLocation(), new HashSet<>(), expanded);
        }
        return expanded;
    }

    private void expand(Token token, SourceLocation at, Set<String> active, List<Token> out) {
        if (token.getType() != TokenType.IDENTIFIER || !macros.containsKey(token.getText())
                || active.contains(token.getText())) {
            out.add(token.getLocation() == at ? token : token.relocate(at));
            return;
        }
        String name = token.getText();
        List<Token> body = new Lexer(macros.get(name)).tokenize();
        active.add(name);
        for (Token t : body) {
            if (t.getType() != TokenType.EOF) {
                expand(t, at, active, out);
            }
        }
        active.remove(name);
    }

    private Token next() {
        skipWhitespaceAndComments();
        SourceLocation location = new SourceLocation(line, column);
        if (pos >= source.length()) {
            return new Token(TokenType.EOF, "", location);
        }
        char c = source.charAt(pos);
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                advance();
            }
            String text = source.substring(start, pos);
            return new Token(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER, text, location);
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return number(location);
        }
        if (c == '"') {
            return string(location);
        }
        if (c == '\'') {
            return character(location);
        }
        for (String punct : PUNCTUATORS) {
            if (source.startsWith(punct, pos)) {
                for (int i = 0; i < punct.length(); i++) {
                    advance();
                }
                return new Token(TokenType.PUNCTUATOR, punct, location);
            }
        }
        if (c == '#') {
            throw new UnsupportedConstructException("preprocessor directive inside a declaration", location);
        }
        throw new SyntaxException(location, "a token", "'" + c + "'");
    }

    private Token number(SourceLocation location) {
        int start = pos;
        boolean isFloat = false;
        if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
            advance();
            advance();
            while (pos < source.length() && isHexDigit(source.charAt(pos))) {
                advance();
            }
        } else {
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                advance();
            }
            if (pos < source.length() && source.charAt(pos) == '.') {
                isFloat = true;
                advance();
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    advance();
                }
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                isFloat = true;
                advance();
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    advance();
                }
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    advance();
                }
            }
        }
        int digitsEnd = pos;
        while (pos < source.length() && "uUlLfF".indexOf(source.charAt(pos)) >= 0) {
            advance();
        }
        String text = source.substring(start, pos);
        if (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw new SyntaxException(location, "a number", "'" + text + source.charAt(pos) + "'");
        }
        if (isFloat || text.toLowerCase().endsWith("f") && !text.toLowerCase().startsWith("0x")) {
            return new Token(TokenType.FLOAT_LITERAL, text, location);
        }
        String digits = source.substring(start, digitsEnd);
        long value;
        try {
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                value = Long.parseUnsignedLong(digits.substring(2), 16);
            } else if (digits.length() > 1 && digits.startsWith("0")) {
                value = Long.parseUnsignedLong(digits.substring(1), 8);
            } else {
                value = Long.parseUnsignedLong(digits);
            }
        } catch (NumberFormatException e) {
            throw new SyntaxException(location, "an integer constant", "'" + text + "'");
        }
        return new Token(TokenType.INT_LITERAL, text, location, null, value);
    }

    private Token string(SourceLocation location) {
        int start = pos;
        advance();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw new SyntaxException(location, "closing '\"'", "end of line");
            }
            char c = source.charAt(pos);
            if (c == '"') {
                advance();
                break;
            }
            if (c == '\\') {
                bytes.write(escape(location));
            } else {
                advance();
                byte[] encoded = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                bytes.write(encoded, 0, encoded.length);
            }
        }
        return new Token(TokenType.STRING_LITERAL, source.substring(start, pos), location, bytes.toByteArray(), 0);
    }

    private Token character(SourceLocation location) {
        int start = pos;
        advance();
        if (pos >= source.length() || source.charAt(pos) == '\'' || source.charAt(pos) == '\n') {
            throw new SyntaxException(location, "a character", "empty character constant");
        }
        int value;
        if (source.charAt(pos) == '\\') {
            value = escape(location);
        } else {
            char c = source.charAt(pos);
            if (c > 0x7F) {
                throw new UnsupportedConstructException("multi-byte character constant", location);
            }
            value = c;
            advance();
        }
        if (pos >= source.length() || source.charAt(pos) != '\'') {
            throw new UnsupportedConstructException("multi-character constant", location);
        }
        advance();
        // plain char is signed on the targets we care about
        return new Token(TokenType.CHAR_LITERAL, source.substring(start, pos), location, null, (byte) value);
    }

    private int escape(SourceLocation location) {
        advance();
        if (pos >= source.length()) {
            throw new SyntaxException(location, "an escape sequence", "end of input");
        }
        char c = source.charAt(pos);
        advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case 'a': return 7;
            case 'b': return '\b';
            case 'f': return '\f';
            case 'v': return 11;
            case '\\': return '\\';
            case '\'': return '\'';
            case '"': return '"';
            case '?': return '?';
            case 'x': {
                int value = 0;
                int digits = 0;
                while (pos < source.length() && isHexDigit(source.charAt(pos))) {
                    value = value * 16 + Character.digit(source.charAt(pos), 16);
                    advance();
                    digits++;
                }
                if (digits == 0) {
                    throw new SyntaxException(location, "hex digits", "'\\x'");
                }
                return value & 0xFF;
            }
            default:
                if (c >= '0' && c <= '7') {
                    int value = c - '0';
                    for (int i = 0; i < 2 && pos < source.length() && source.charAt(pos) >= '0' && source.charAt(pos) <= '7'; i++) {
                        value = value * 8 + (source.charAt(pos) - '0');
                        advance();
                    }
                    return value & 0xFF;
                }
                throw new SyntaxException(location, "a valid escape sequence", "'\\" + c + "'");
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (source.startsWith("//", pos)) {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (source.startsWith("/*", pos)) {
                SourceLocation start = new SourceLocation(line, column);
                advance();
                advance();
                while (pos < source.length() && !source.startsWith("*/", pos)) {
                    advance();
                }
                if (pos >= source.length()) {
                    throw new SyntaxException(start, "'*/'", "end of input");
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
