package com.toolbox.jsformatter.lexer;

import java.util.List;

public final class TokenStreams {

    private TokenStreams() {
    }

    public static Token nextSignificant(List<Token> tokens, int index) {
        for (int i = index + 1; i < tokens.size(); i++) {
            if (!tokens.get(i).isTrivia()) {
                return tokens.get(i);
            }
        }
        return null;
    }

    public static List<Token> significant(List<Token> tokens) {
        return tokens.stream()
                .filter(token -> !token.isTrivia())
                .toList();
    }

    public static long count(List<Token> tokens, TokenKind kind, String text) {
        return tokens.stream()
                .filter(token -> token.is(kind, text))
                .count();
    }
}
