package com.toolbox.jsformatter.lexer;

import java.util.Objects;

/**
 * A classified slice of the source. {@code terminated} is false for a string,
 * template literal or block comment whose closing delimiter was never found.
 */
public record Token(
        TokenKind kind,
        String text,
        int line,
        int column,
        boolean terminated) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public Token(TokenKind kind, String text, int line, int column) {
        this(kind, text, line, column, true);
    }

    public boolean is(TokenKind expectedKind, String expectedText) {
        return kind == expectedKind && text.equals(expectedText);
    }

    public boolean isPunctuation(String expectedText) {
        return is(TokenKind.PUNCTUATION, expectedText);
    }

    public boolean isKeyword(String expectedText) {
        return is(TokenKind.KEYWORD, expectedText);
    }

    public boolean isOperator(String expectedText) {
        return is(TokenKind.OPERATOR, expectedText);
    }

    public boolean isTrivia() {
        return kind.isTrivia();
    }

    public boolean isLineComment() {
        return kind == TokenKind.COMMENT && text.startsWith("//");
    }

    public ScannerState end() {
        return new ScannerState(0, line, column).advance(text);
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + line + ":" + column;
    }
}
