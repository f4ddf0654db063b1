package com.toolbox.jsformatter.format;

import com.toolbox.jsformatter.lexer.Token;
import com.toolbox.jsformatter.lexer.TokenKind;
import com.toolbox.jsformatter.lexer.TokenStreams;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

@Component
public class JsBeautifier {

    private static final Set<String> SPACED_KEYWORDS = Set.of(
            "if", "while", "for", "switch", "catch", "function", "return", "throw", "new",
            "typeof", "delete", "void", "var", "let", "const", "case", "do", "else", "try",
            "await", "yield", "in", "of", "instanceof");

    private static final Set<String> BLOCK_CONTINUATION_KEYWORDS = Set.of("else", "catch", "finally", "while");

    private static final Set<String> BLOCK_CONTINUATION_PUNCTUATION = Set.of(")", "]", ",", ";", ".");

    private static final Set<String> TIGHT_OPERATORS = Set.of("++", "--", "!", "~", "?.");

    private static final Set<String> POSTFIX_OPERATORS = Set.of("++", "--");

    private static final Set<String> CLOSING_BRACKETS = Set.of(")", "]", "}");

    private static final Set<String> VALUE_KEYWORDS = Set.of("this", "super", "null", "true", "false", "arguments");

    public String beautify(List<Token> tokens, FormatOptions options) {
        Layout layout = new Layout(options);

        for (int i = 0; i < tokens.size(); i++) {
            layout.accept(tokens.get(i), TokenStreams.nextSignificant(tokens, i));
        }

        return layout.finish();
    }

    private record Frame(int parenDepth, int ternaryDepth) {
    }

    private static final class Layout {
        private final FormatOptions options;
        private final String indentUnit;
        private final List<String> lines = new ArrayList<>();
        private final StringBuilder line = new StringBuilder();
        private final Deque<Frame> frames = new ArrayDeque<>();

        private int indent;
        private int lineIndent;
        private int parenDepth;
        private int ternaryDepth;
        private boolean afterClosingBrace;
        private Token previous;

        Layout(FormatOptions options) {
            this.options = options;
            this.indentUnit = options.indentUnit();
        }

        void accept(Token token, Token next) {
            switch (token.kind()) {
                case WHITESPACE -> whitespace(token, next);
                case COMMENT -> comment(token, next);
                case STRING, REGEX, NUMBER -> literal(token);
                case KEYWORD -> keyword(token);
                case IDENTIFIER -> identifier(token);
                case OPERATOR -> operator(token);
                case PUNCTUATION -> punctuation(token, next);
            }

            if (!token.isTrivia()) {
                previous = token;
            }
        }

        String finish() {
            flush();

            List<String> result = new ArrayList<>();
            for (String candidate : lines) {
                boolean blank = candidate.isBlank();
                if (blank && (result.isEmpty() || result.get(result.size() - 1).isEmpty())) {
                    continue;
                }
                result.add(blank ? "" : candidate);
            }
            while (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
                result.remove(result.size() - 1);
            }

            return String.join("\n", result);
        }

        private void whitespace(Token token, Token next) {
            long breaks = token.text().chars().filter(c -> c == '\n').count();

            if (breaks >= 2 && options.preserveEmptyLines()) {
                flush();
                lines.add("");
            } else if (breaks > 0) {
                flush();
            } else {
                separate(next);
            }
        }

        private void comment(Token token, Token next) {
            if (!options.preserveComments()) {
                separate(next);
                return;
            }

            if (token.isLineComment()) {
                flush();
                append(token.text());
                flush();
                return;
            }

            if (hasContent() && !endsWithSpace()) {
                line.append(' ');
            }
            append(token.text());
            line.append(' ');
        }

        private void literal(Token token) {
            startSignificant(token);
            spaceAfterCloseParen();

            String text = token.kind() == TokenKind.STRING
                    ? StringLiterals.normalizeQuotes(token, options.quoteStyle())
                    : token.text();
            append(text);
        }

        private void keyword(Token token) {
            startSignificant(token);

            if (BLOCK_CONTINUATION_KEYWORDS.contains(token.text()) && hasContent() && !endsWithSpace()) {
                line.append(' ');
            }
            spaceAfterCloseParen();
            append(token.text());

            if (options.insertSpaceAfterKeywords() && SPACED_KEYWORDS.contains(token.text())) {
                line.append(' ');
            }
        }

        private void identifier(Token token) {
            startSignificant(token);
            spaceAfterCloseParen();
            append(token.text());
        }

        private void operator(Token token) {
            startSignificant(token);
            String op = token.text();

            if (op.equals("?")) {
                ternaryDepth++;
            } else if (op.equals(":")) {
                if (ternaryDepth == 0) {
                    // object key, label or case
                    trimTrailingSpace();
                    append(": ");
                    return;
                }
                ternaryDepth--;
            }

            boolean unary = (op.equals("+") || op.equals("-")) && isUnaryPosition(previous);
            if (TIGHT_OPERATORS.contains(op) || unary) {
                append(op);
                return;
            }

            if (hasContent() && !endsWithSpace()) {
                line.append(' ');
            }
            append(op);
            line.append(' ');
        }

        private void punctuation(Token token, Token next) {
            switch (token.text()) {
                case "{" -> openBrace(token);
                case "}" -> closeBrace();
                case "(" -> openParen(token);
                case ")" -> closeParen(token);
                case ";" -> semicolon(token);
                case "," -> comma(token, next);
                default -> {
                    startSignificant(token);
                    append(token.text());
                }
            }
        }

        private void openBrace(Token token) {
            startSignificant(token);

            if (options.insertNewLineBeforeOpeningBrace()) {
                flush();
            } else if (options.insertSpaceBeforeOpeningBrace() && hasContent() && !endsWithSpace()
                    && !endsWith('(') && !endsWith('[')) {
                line.append(' ');
            }
            append("{");

            if (options.insertNewLineAfterOpeningBrace()) {
                flush();
            }

            frames.push(new Frame(parenDepth, ternaryDepth));
            parenDepth = 0;
            ternaryDepth = 0;
            indent++;
        }

        private void closeBrace() {
            afterClosingBrace = false;

            if (options.insertNewLineBeforeClosingBrace() || !hasContent()) {
                flush();
            } else if (!endsWithSpace()) {
                line.append(' ');
            }

            indent = Math.max(0, indent - 1);
            Frame frame = frames.poll();
            if (frame != null) {
                parenDepth = frame.parenDepth();
                ternaryDepth = frame.ternaryDepth();
            }

            append("}");
            afterClosingBrace = true;
        }

        private void openParen(Token token) {
            startSignificant(token);

            if (options.insertSpaceBeforeFunctionParen() && previous != null
                    && (previous.isKeyword("function") || previous.kind() == TokenKind.IDENTIFIER)
                    && hasContent() && !endsWithSpace()) {
                line.append(' ');
            }
            append("(");
            parenDepth++;
        }

        private void closeParen(Token token) {
            startSignificant(token);

            if (previous == null || !previous.isPunctuation(",")) {
                trimTrailingSpace();
            }
            append(")");
            parenDepth = Math.max(0, parenDepth - 1);

            if (options.insertSpaceAfterFunctionParen()) {
                line.append(' ');
            }
        }

        private void semicolon(Token token) {
            startSignificant(token);
            trimTrailingSpace();
            append(";");

            if (parenDepth > 0) {
                line.append(' ');
            } else {
                ternaryDepth = 0;
                flush();
            }
        }

        private void comma(Token token, Token next) {
            startSignificant(token);

            if (previous == null || !previous.isPunctuation(",")) {
                trimTrailingSpace();
            }
            append(",");

            boolean closesList = next != null && (next.isPunctuation("}") || next.isPunctuation("]"));
            if (options.trailingCommas() || !closesList) {
                line.append(' ');
            }
        }

        private void startSignificant(Token token) {
            if (!afterClosingBrace) {
                return;
            }
            afterClosingBrace = false;

            if (!continuesClosedBlock(token)) {
                flush();
            }
        }

        private boolean continuesClosedBlock(Token token) {
            return switch (token.kind()) {
                case OPERATOR -> true;
                case PUNCTUATION -> BLOCK_CONTINUATION_PUNCTUATION.contains(token.text());
                case KEYWORD -> BLOCK_CONTINUATION_KEYWORDS.contains(token.text());
                case IDENTIFIER, NUMBER, STRING, REGEX, COMMENT, WHITESPACE -> false;
            };
        }

        private boolean isUnaryPosition(Token before) {
            if (before == null) {
                return true;
            }

            return switch (before.kind()) {
                case OPERATOR -> !POSTFIX_OPERATORS.contains(before.text());
                case PUNCTUATION -> !CLOSING_BRACKETS.contains(before.text());
                case KEYWORD -> !VALUE_KEYWORDS.contains(before.text());
                case IDENTIFIER, NUMBER, STRING, REGEX, COMMENT, WHITESPACE -> false;
            };
        }

        private void separate(Token next) {
            if (hasContent() && !endsWithSpace() && TokenSeparation.needsSpace(previous, next)) {
                line.append(' ');
            }
        }

        private void spaceAfterCloseParen() {
            if (endsWith(')')) {
                line.append(' ');
            }
        }

        private void append(String text) {
            if (line.length() == 0) {
                lineIndent = indent;
            }
            line.append(text);
        }

        private void flush() {
            String content = line.toString().strip();
            if (!content.isEmpty()) {
                lines.add(indentUnit.repeat(lineIndent) + content);
            }
            line.setLength(0);
        }

        private void trimTrailingSpace() {
            while (endsWithSpace()) {
                line.setLength(line.length() - 1);
            }
        }

        private boolean hasContent() {
            return line.length() > 0;
        }

        private boolean endsWithSpace() {
            return endsWith(' ');
        }

        private boolean endsWith(char c) {
            return line.length() > 0 && line.charAt(line.length() - 1) == c;
        }
    }
}
