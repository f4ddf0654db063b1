package com.toolbox.jsformatter.validation;

import com.toolbox.jsformatter.lexer.Token;
import com.toolbox.jsformatter.lexer.TokenKind;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class JsSyntaxValidator {

    public static final String UNEXPECTED_CLOSING = "unexpected-closing";
    public static final String MISMATCHED_BRACKET = "mismatched-bracket";
    public static final String UNCLOSED_BRACKET = "unclosed-bracket";
    public static final String MISSING_PAREN = "missing-paren";
    public static final String UNTERMINATED_STRING = "unterminated-string";
    public static final String UNTERMINATED_TEMPLATE = "unterminated-template";
    public static final String UNTERMINATED_COMMENT = "unterminated-comment";

    private static final Map<String, String> BRACKET_PAIRS = Map.of("(", ")", "[", "]", "{", "}");

    private static final Set<String> CLOSING_BRACKETS = Set.of(")", "]", "}");

    private static final Set<String> PARENTHESIZED_KEYWORDS = Set.of("if", "while", "for");

    public List<ValidationError> validate(List<Token> tokens) {
        List<ValidationError> issues = new ArrayList<>();
        Deque<Token> openBrackets = new ArrayDeque<>();
        Token previous = null;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);

            if (token.kind() == TokenKind.WHITESPACE) {
                continue;
            }
            if (!token.terminated()) {
                issues.add(unterminated(token));
            }
            if (token.kind() == TokenKind.COMMENT) {
                continue;
            }

            if (token.kind() == TokenKind.PUNCTUATION) {
                checkBracket(token, openBrackets, issues);
            }

            // obj.if is a property access, not a statement
            boolean propertyName = previous != null && previous.isPunctuation(".");
            if (token.kind() == TokenKind.KEYWORD && PARENTHESIZED_KEYWORDS.contains(token.text()) && !propertyName) {
                checkOpeningParen(tokens, i, issues);
            }

            previous = token;
        }

        Iterator<Token> unclosed = openBrackets.descendingIterator();
        while (unclosed.hasNext()) {
            Token bracket = unclosed.next();
            issues.add(ValidationError.error(bracket, "Unclosed " + bracket.text(), UNCLOSED_BRACKET));
        }

        return issues;
    }

    private void checkBracket(Token token, Deque<Token> openBrackets, List<ValidationError> issues) {
        String text = token.text();

        if (BRACKET_PAIRS.containsKey(text)) {
            openBrackets.push(token);
            return;
        }
        if (!CLOSING_BRACKETS.contains(text)) {
            return;
        }

        if (openBrackets.isEmpty()) {
            issues.add(ValidationError.error(token, "Unexpected closing " + text, UNEXPECTED_CLOSING));
            return;
        }

        String expected = BRACKET_PAIRS.get(openBrackets.pop().text());
        if (!expected.equals(text)) {
            issues.add(ValidationError.error(token,
                    "Mismatched bracket: expected " + expected + " but found " + text, MISMATCHED_BRACKET));
        }
    }

    private void checkOpeningParen(List<Token> tokens, int index, List<ValidationError> issues) {
        Token keyword = tokens.get(index);
        int j = skipTrivia(tokens, index + 1);

        if (keyword.isKeyword("for") && j < tokens.size() && tokens.get(j).isKeyword("await")) {
            j = skipTrivia(tokens, j + 1);
        }

        if (j >= tokens.size() || !tokens.get(j).isPunctuation("(")) {
            issues.add(ValidationError.warning(keyword,
                    keyword.text() + " statement missing opening parenthesis", MISSING_PAREN));
        }
    }

    private int skipTrivia(List<Token> tokens, int from) {
        int j = from;
        while (j < tokens.size() && tokens.get(j).isTrivia()) {
            j++;
        }
        return j;
    }

    private ValidationError unterminated(Token token) {
        if (token.kind() == TokenKind.COMMENT) {
            return ValidationError.error(token, "Unterminated block comment", UNTERMINATED_COMMENT);
        }
        if (token.text().startsWith("`")) {
            return ValidationError.error(token, "Unterminated template literal", UNTERMINATED_TEMPLATE);
        }
        return ValidationError.error(token, "Unterminated string literal", UNTERMINATED_STRING);
    }
}
