package com.toolbox.jsformatter.service;

import com.toolbox.jsformatter.config.FormatterProperties;
import com.toolbox.jsformatter.dto.SyntaxAnalysisRequest;
import com.toolbox.jsformatter.dto.SyntaxAnalysisResponse;
import com.toolbox.jsformatter.dto.SyntaxToken;
import com.toolbox.jsformatter.lexer.JsTokenizer;
import com.toolbox.jsformatter.validation.JsSyntaxValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsSyntaxAnalysisServiceTest {

    private final JsSyntaxAnalysisService service = new JsSyntaxAnalysisService(
            new JsTokenizer(), new JsSyntaxValidator(), FormatterProperties.standard());

    @Test
    void listsSignificantTokensByDefault() {
        SyntaxAnalysisResponse response = service.analyzeSyntax(new SyntaxAnalysisRequest("let x = 1;", null));

        assertTrue(response.success());
        assertEquals(List.of("KEYWORD", "IDENTIFIER", "OPERATOR", "NUMBER", "PUNCTUATION"),
                response.tokens().stream().map(SyntaxToken::tokenType).toList());
        assertTrue(response.diagnostics().isEmpty());
    }

    @Test
    void includesTriviaOnRequest() {
        SyntaxAnalysisResponse response = service.analyzeSyntax(new SyntaxAnalysisRequest("let x = 1;", true));

        assertEquals(8, response.tokens().size());
        assertEquals("WHITESPACE", response.tokens().get(1).tokenType());
    }

    @Test
    void normalizesLineEndingsBeforeScanning() {
        SyntaxAnalysisResponse response = service.analyzeSyntax(
                new SyntaxAnalysisRequest("a\r\n/* two\r\nlines */\0b", true));

        SyntaxToken comment = response.tokens().get(2);
        assertEquals("/* two\nlines */", comment.value());
        assertEquals(2, comment.startLine());
        assertEquals(1, comment.startColumn());
        assertEquals(3, comment.endLine());
        assertEquals(9, comment.endColumn());
        assertEquals("b", response.tokens().get(3).value());
    }

    @Test
    void reportsDiagnostics() {
        SyntaxAnalysisResponse response = service.analyzeSyntax(new SyntaxAnalysisRequest("f(", false));

        assertTrue(response.success());
        assertEquals("unclosed-bracket", response.diagnostics().get(0).code());
    }

    @Test
    void rejectsSourceOverConfiguredLimit() {
        JsSyntaxAnalysisService limited = new JsSyntaxAnalysisService(new JsTokenizer(), new JsSyntaxValidator(),
                new FormatterProperties(5, FormatterProperties.Defaults.standard()));

        SyntaxAnalysisResponse response = limited.analyzeSyntax(new SyntaxAnalysisRequest("let x = 1;", false));

        assertFalse(response.success());
        assertEquals("Source code exceeds the maximum length of 5 characters", response.error());
        assertTrue(response.tokens().isEmpty());
    }
}
