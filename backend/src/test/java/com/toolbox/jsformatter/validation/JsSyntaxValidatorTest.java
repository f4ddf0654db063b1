package com.toolbox.jsformatter.validation;

import com.toolbox.jsformatter.lexer.JsTokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsSyntaxValidatorTest {

    private final JsTokenizer tokenizer = new JsTokenizer();
    private final JsSyntaxValidator validator = new JsSyntaxValidator();

    @Test
    void missingClosingBraceIsOneUnclosedBracket() {
        List<ValidationError> issues = validate("function f() {");

        assertEquals(1, issues.size());
        ValidationError issue = issues.get(0);
        assertEquals(JsSyntaxValidator.UNCLOSED_BRACKET, issue.code());
        assertEquals(Severity.ERROR, issue.severity());
        assertEquals("Unclosed {", issue.message());
        assertEquals(1, issue.line());
        assertEquals(14, issue.column());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{}",
            "function calculate(a,b){if(a>b){return a+b;}else{return a-b;}}",
            "const s = '(['; // ]",
            "obj.if = 1; obj.for = 2;",
            "for await (const x of xs) {}",
            "if /* why */ (a) {}"
    })
    void wellFormedSourcesHaveNoFindings(String source) {
        assertTrue(validate(source).isEmpty(), () -> String.valueOf(validate(source)));
    }

    @Test
    void strayClosingBracket() {
        List<ValidationError> issues = validate("a)");

        assertEquals(1, issues.size());
        assertEquals(JsSyntaxValidator.UNEXPECTED_CLOSING, issues.get(0).code());
        assertEquals("Unexpected closing )", issues.get(0).message());
    }

    @Test
    void mismatchedBracketConsumesTheOpener() {
        List<ValidationError> issues = validate("(]");

        assertEquals(1, issues.size());
        assertEquals(JsSyntaxValidator.MISMATCHED_BRACKET, issues.get(0).code());
        assertEquals("Mismatched bracket: expected ) but found ]", issues.get(0).message());
    }

    @Test
    void unclosedBracketsAreReportedInSourceOrder() {
        List<ValidationError> issues = validate("([{");

        assertEquals(List.of("Unclosed (", "Unclosed [", "Unclosed {"),
                issues.stream().map(ValidationError::message).toList());
        assertEquals(List.of(1, 2, 3), issues.stream().map(ValidationError::column).toList());
    }

    @Test
    void controlKeywordWithoutParenthesisIsOnlyAWarning() {
        List<ValidationError> issues = validate("if x { }");

        assertEquals(1, issues.size());
        assertEquals(Severity.WARNING, issues.get(0).severity());
        assertEquals(JsSyntaxValidator.MISSING_PAREN, issues.get(0).code());
        assertEquals("if statement missing opening parenthesis", issues.get(0).message());
    }

    @Test
    void unterminatedLiteralsAreErrors() {
        assertEquals(JsSyntaxValidator.UNTERMINATED_STRING, validate("x = 'abc").get(0).code());
        assertEquals(JsSyntaxValidator.UNTERMINATED_TEMPLATE, validate("x = `abc").get(0).code());
        assertEquals(JsSyntaxValidator.UNTERMINATED_COMMENT, validate("x /* abc").get(0).code());
    }

    private List<ValidationError> validate(String source) {
        return validator.validate(tokenizer.tokenize(source));
    }
}
