package com.toolbox.jsformatter.format;

import com.toolbox.jsformatter.lexer.Lexicon;
import com.toolbox.jsformatter.lexer.Token;
import com.toolbox.jsformatter.lexer.TokenKind;

/**
 * Answers whether two tokens that were apart in the source would lex
 * differently if written next to each other.
 */
public final class TokenSeparation {

    private TokenSeparation() {
    }

    public static boolean needsSpace(Token left, Token right) {
        if (left == null || right == null) {
            return false;
        }

        TokenKind leftKind = left.kind();
        TokenKind rightKind = right.kind();

        if (leftKind.isWordLike() && rightKind.isWordLike()) {
            return true;
        }
        // /re/ in x would read the "i" as a flag
        if (leftKind == TokenKind.REGEX && rightKind.isWordLike()) {
            return true;
        }
        // 1 .toString()
        if (leftKind == TokenKind.NUMBER && right.text().startsWith(".")) {
            return true;
        }

        // a / /* c */ b would open a line comment
        if (left.text().endsWith("/") && (right.text().startsWith("/") || right.text().startsWith("*"))) {
            return true;
        }

        if (leftKind == TokenKind.OPERATOR && (rightKind == TokenKind.OPERATOR || rightKind == TokenKind.REGEX)) {
            String joined = left.text() + right.text();
            return Lexicon.operatorLengthAt(joined, 0) > left.text().length();
        }

        return false;
    }
}
