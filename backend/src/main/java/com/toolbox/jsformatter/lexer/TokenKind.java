package com.toolbox.jsformatter.lexer;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    NUMBER,
    STRING,
    REGEX,
    OPERATOR,
    PUNCTUATION,
    COMMENT,
    WHITESPACE;

    public boolean isWordLike() {
        return this == KEYWORD || this == IDENTIFIER || this == NUMBER;
    }

    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
