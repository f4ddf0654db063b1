package com.toolbox.jsformatter.lexer;

import java.util.Set;

/**
 * Decides whether a {@code /} opens a regular expression literal or is the
 * division operator, by looking at the previous significant token.
 *
 * <p>Most symbols of {@link #PRECEDING_PUNCTUATION} are lexed as operators
 * ({@code = + ! ...}), so any operator other than the postfix-capable
 * {@code ++}/{@code --} also opens a regex.
 */
public final class RegexContext {

    public static final Set<String> PRECEDING_PUNCTUATION = Set.of(
            "(", "[", "{", ",", ";", ":", "!", "&", "|", "?", "+", "-", "*", "=", "<", ">");

    public static final Set<String> PRECEDING_KEYWORDS = Set.of(
            "return", "case", "in", "of", "delete", "void", "typeof", "new", "instanceof");

    public static final Set<String> POSTFIX_OPERATORS = Set.of("++", "--");

    private RegexContext() {
    }

    public static boolean allowsRegexAfter(Token previous) {
        if (previous == null) {
            return true;
        }

        return switch (previous.kind()) {
            case PUNCTUATION -> PRECEDING_PUNCTUATION.contains(previous.text());
            case OPERATOR -> !POSTFIX_OPERATORS.contains(previous.text());
            case KEYWORD -> PRECEDING_KEYWORDS.contains(previous.text());
            case IDENTIFIER, NUMBER, STRING, REGEX, COMMENT, WHITESPACE -> false;
        };
    }
}
