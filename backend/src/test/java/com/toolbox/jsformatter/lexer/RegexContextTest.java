package com.toolbox.jsformatter.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegexContextTest {

    static Stream<Arguments> previousTokens() {
        return Stream.of(
                Arguments.of(new Token(TokenKind.PUNCTUATION, "(", 1, 1), true),
                Arguments.of(new Token(TokenKind.PUNCTUATION, ",", 1, 1), true),
                Arguments.of(new Token(TokenKind.PUNCTUATION, ")", 1, 1), false),
                Arguments.of(new Token(TokenKind.PUNCTUATION, "]", 1, 1), false),
                Arguments.of(new Token(TokenKind.OPERATOR, "=", 1, 1), true),
                Arguments.of(new Token(TokenKind.OPERATOR, "&&", 1, 1), true),
                Arguments.of(new Token(TokenKind.OPERATOR, "=>", 1, 1), true),
                Arguments.of(new Token(TokenKind.OPERATOR, "++", 1, 1), false),
                Arguments.of(new Token(TokenKind.KEYWORD, "return", 1, 1), true),
                Arguments.of(new Token(TokenKind.KEYWORD, "typeof", 1, 1), true),
                Arguments.of(new Token(TokenKind.KEYWORD, "this", 1, 1), false),
                Arguments.of(new Token(TokenKind.IDENTIFIER, "a", 1, 1), false),
                Arguments.of(new Token(TokenKind.NUMBER, "1", 1, 1), false),
                Arguments.of(new Token(TokenKind.REGEX, "/a/", 1, 1), false));
    }

    @ParameterizedTest
    @MethodSource("previousTokens")
    void decidesFromPreviousToken(Token previous, boolean expected) {
        assertEquals(expected, RegexContext.allowsRegexAfter(previous));
    }

    @Test
    void startOfInputAllowsRegex() {
        assertTrue(RegexContext.allowsRegexAfter(null));
    }
}
