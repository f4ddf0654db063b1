package com.toolbox.jsformatter.lexer;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class JsTokenizer {

    private static final String REGEX_FLAGS = "dgimsuy";

    private record Span(int end, boolean terminated) {
    }

    public List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        ScannerState state = ScannerState.start();
        Token previousSignificant = null;

        while (state.offset() < source.length()) {
            Token token = scanToken(source, state, previousSignificant);
            tokens.add(token);

            if (!token.isTrivia()) {
                previousSignificant = token;
            }
            state = state.advance(token.text());
        }

        return tokens;
    }

    private Token scanToken(String source, ScannerState state, Token previous) {
        int start = state.offset();
        char c = source.charAt(start);
        char next = start + 1 < source.length() ? source.charAt(start + 1) : '\0';

        if (isWhitespace(c)) {
            return token(TokenKind.WHITESPACE, source, state, new Span(scanWhitespace(source, start), true));
        }

        if (c == '/' && next == '/') {
            return token(TokenKind.COMMENT, source, state, new Span(scanLineComment(source, start), true));
        }
        if (c == '/' && next == '*') {
            return token(TokenKind.COMMENT, source, state, scanBlockComment(source, start));
        }

        if (c == '"' || c == '\'') {
            return token(TokenKind.STRING, source, state, scanQuoted(source, start));
        }
        if (c == '`') {
            return token(TokenKind.STRING, source, state, scanTemplate(source, start));
        }

        if (c == '/' && RegexContext.allowsRegexAfter(previous)) {
            int end = scanRegex(source, start);
            if (end > 0) {
                return token(TokenKind.REGEX, source, state, new Span(end, true));
            }
        }

        if (isDigit(c) || (c == '.' && isDigit(next))) {
            return token(TokenKind.NUMBER, source, state, new Span(scanNumber(source, start), true));
        }

        int operatorLength = Lexicon.operatorLengthAt(source, start);
        if (operatorLength > 0) {
            return token(TokenKind.OPERATOR, source, state, new Span(start + operatorLength, true));
        }

        if (Lexicon.isPunctuation(c)) {
            return token(TokenKind.PUNCTUATION, source, state, new Span(start + 1, true));
        }

        if (isIdentifierStart(c)) {
            int end = scanIdentifier(source, start);
            String word = source.substring(start, end);
            TokenKind kind = Lexicon.isKeyword(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
            return new Token(kind, word, state.line(), state.column());
        }

        return token(TokenKind.PUNCTUATION, source, state, new Span(start + 1, true));
    }

    private Token token(TokenKind kind, String source, ScannerState state, Span span) {
        return new Token(
                kind,
                source.substring(state.offset(), span.end()),
                state.line(),
                state.column(),
                span.terminated());
    }

    private int scanWhitespace(String source, int start) {
        int i = start;
        while (i < source.length() && isWhitespace(source.charAt(i))) {
            i++;
        }
        return i;
    }

    private int scanLineComment(String source, int start) {
        int i = start + 2;
        while (i < source.length() && source.charAt(i) != '\n') {
            i++;
        }
        return i;
    }

    private Span scanBlockComment(String source, int start) {
        int close = source.indexOf("*/", start + 2);
        if (close < 0) {
            return new Span(source.length(), false);
        }
        return new Span(close + 2, true);
    }

    private Span scanQuoted(String source, int start) {
        char quote = source.charAt(start);
        int i = start + 1;

        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += escapeLength(source, i);
                continue;
            }
            if (c == quote) {
                return new Span(i + 1, true);
            }
            if (c == '\n') {
                return new Span(i, false);
            }
            i++;
        }

        return new Span(source.length(), false);
    }

    private Span scanTemplate(String source, int start) {
        int i = start + 1;

        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += escapeLength(source, i);
                continue;
            }
            if (c == '`') {
                return new Span(i + 1, true);
            }
            if (c == '$' && i + 1 < source.length() && source.charAt(i + 1) == '{') {
                i = skipTemplateExpression(source, i + 2);
                continue;
            }
            i++;
        }

        return new Span(source.length(), false);
    }

    // Expression holes are not tokenized, only brace-balanced.
    private int skipTemplateExpression(String source, int start) {
        int depth = 1;
        int i = start;

        while (i < source.length() && depth > 0) {
            char c = source.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            i++;
        }

        return i;
    }

    private int escapeLength(String source, int backslash) {
        if (backslash + 2 < source.length()
                && source.charAt(backslash + 1) == '\r'
                && source.charAt(backslash + 2) == '\n') {
            return 3;
        }
        return Math.min(2, source.length() - backslash);
    }

    /**
     * Returns the end offset of the regex literal at {@code start}, or -1 when a
     * line break or the end of input comes before the closing slash.
     */
    private int scanRegex(String source, int start) {
        int i = start + 1;
        boolean inClass = false;

        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                return -1;
            }
            if (c == '\\') {
                if (i + 1 >= source.length() || source.charAt(i + 1) == '\n' || source.charAt(i + 1) == '\r') {
                    return -1;
                }
                i += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                i++;
                while (i < source.length() && REGEX_FLAGS.indexOf(source.charAt(i)) >= 0) {
                    i++;
                }
                return i;
            }
            i++;
        }

        return -1;
    }

    private int scanNumber(String source, int start) {
        int i = start;

        if (source.charAt(i) == '0' && i + 2 < source.length()
                && "xXbBoO".indexOf(source.charAt(i + 1)) >= 0
                && Character.digit(source.charAt(i + 2), 16) >= 0) {
            i += 2;
            while (i < source.length()
                    && (Character.digit(source.charAt(i), 16) >= 0 || isSeparator(source, i, 16))) {
                i++;
            }
            return scanBigIntSuffix(source, i);
        }

        boolean seenDot = false;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (isDigit(c) || isSeparator(source, i, 10)) {
                i++;
            } else if (c == '.' && !seenDot) {
                seenDot = true;
                i++;
            } else {
                break;
            }
        }

        if (i < source.length() && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < source.length() && (source.charAt(j) == '+' || source.charAt(j) == '-')) {
                j++;
            }
            if (j < source.length() && isDigit(source.charAt(j))) {
                i = j;
                while (i < source.length() && isDigit(source.charAt(i))) {
                    i++;
                }
                return i;
            }
        }

        return seenDot ? i : scanBigIntSuffix(source, i);
    }

    private int scanBigIntSuffix(String source, int i) {
        return i < source.length() && source.charAt(i) == 'n' ? i + 1 : i;
    }

    // 1_000: an underscore only counts between two digits
    private boolean isSeparator(String source, int i, int radix) {
        return source.charAt(i) == '_'
                && i > 0 && Character.digit(source.charAt(i - 1), radix) >= 0
                && i + 1 < source.length() && Character.digit(source.charAt(i + 1), radix) >= 0;
    }

    private int scanIdentifier(String source, int start) {
        int i = start + 1;
        while (i < source.length() && isIdentifierPart(source.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
