package io.github.cobfuscator.parser;

import java.util.Arrays;

public final class Token {

    private final TokenType type;
    private final String text;
    private final SourceLocation location;
    /** Decoded bytes of a string literal, without the terminating NUL. */
    private final byte[] bytes;
    /** Numeric value of int and char literals. */
    private final long value;

    public Token(TokenType type, String text, SourceLocation location) {
        this(type, text, location, null, 0);
    }

    public Token(TokenType type, String text, SourceLocation location, byte[] bytes, long value) {
        this.type = type;
        this.text = text;
        this.location = location;
        this.bytes = bytes;
        this.value = value;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public byte[] getBytes() {
        return bytes == null ? null : Arrays.copyOf(bytes, bytes.length);
    }

    public long getValue() {
        return value;
    }

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isPunct(String text) {
        return is(TokenType.PUNCTUATOR, text);
    }

    public boolean isKeyword(String text) {
        return is(TokenType.KEYWORD, text);
    }

    public Token relocate(SourceLocation location) {
        return new Token(type, text, location, bytes, value);
    }

    public String describe() {
        switch (type) {
            case EOF:
                return "end of input";
            case STRING_LITERAL:
                return "string literal";
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + location;
    }
}
