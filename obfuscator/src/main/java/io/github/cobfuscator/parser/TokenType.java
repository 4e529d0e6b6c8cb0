package io.github.cobfuscator.parser;

public enum TokenType {
    IDENTIFIER,
    KEYWORD,
    INT_LITERAL,
    FLOAT_LITERAL,
    CHAR_LITERAL,
    STRING_LITERAL,
    PUNCTUATOR,
    EOF
}
