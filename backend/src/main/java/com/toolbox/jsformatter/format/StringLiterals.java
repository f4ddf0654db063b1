package com.toolbox.jsformatter.format;

import com.toolbox.jsformatter.lexer.Token;
import com.toolbox.jsformatter.lexer.TokenKind;

public final class StringLiterals {

    private StringLiterals() {
    }

    /**
     * Re-wraps a quoted string literal in the target quote. Template literals,
     * unterminated strings and literals already using the target quote come
     * back unchanged.
     */
    public static String normalizeQuotes(Token token, QuoteStyle style) {
        String literal = token.text();

        if (token.kind() != TokenKind.STRING || style == QuoteStyle.PRESERVE
                || !token.terminated() || literal.length() < 2) {
            return literal;
        }

        char source = literal.charAt(0);
        char target = style.quote();
        if ((source != '\'' && source != '"') || source == target) {
            return literal;
        }

        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(literal.length() + 4).append(target);

        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char escaped = body.charAt(++i);
                if (escaped != source) {
                    sb.append('\\');
                }
                sb.append(escaped);
                continue;
            }
            if (c == target) {
                sb.append('\\');
            }
            sb.append(c);
        }

        return sb.append(target).toString();
    }
}
