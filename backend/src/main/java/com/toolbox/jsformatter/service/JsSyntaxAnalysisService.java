package com.toolbox.jsformatter.service;

import com.toolbox.jsformatter.config.FormatterProperties;
import com.toolbox.jsformatter.dto.SyntaxAnalysisRequest;
import com.toolbox.jsformatter.dto.SyntaxAnalysisResponse;
import com.toolbox.jsformatter.dto.SyntaxToken;
import com.toolbox.jsformatter.lexer.JsTokenizer;
import com.toolbox.jsformatter.lexer.Token;
import com.toolbox.jsformatter.validation.JsSyntaxValidator;
import com.toolbox.jsformatter.validation.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Token listing for editor highlighting, with the validator's diagnostics
 * attached.
 */
@Service
public class JsSyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(JsSyntaxAnalysisService.class);

    private final JsTokenizer tokenizer;
    private final JsSyntaxValidator validator;
    private final FormatterProperties properties;

    public JsSyntaxAnalysisService(
            JsTokenizer tokenizer,
            JsSyntaxValidator validator,
            FormatterProperties properties) {
        this.tokenizer = tokenizer;
        this.validator = validator;
        this.properties = properties;
    }

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();

        try {
            String source = request.sanitizedSourceCode();
            if (source.length() > properties.maxSourceLength()) {
                logger.warn("Rejected source of {} characters (limit {})",
                        source.length(), properties.maxSourceLength());
                return SyntaxAnalysisResponse.error("Source code exceeds the maximum length of "
                        + properties.maxSourceLength() + " characters", System.currentTimeMillis() - startTime);
            }

            List<Token> tokens = tokenizer.tokenize(source);
            List<ValidationError> diagnostics = validator.validate(tokens);

            List<SyntaxToken> syntaxTokens = tokens.stream()
                    .filter(token -> request.includesTrivia() || !token.isTrivia())
                    .map(SyntaxToken::from)
                    .toList();

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Analyzed {} characters: {} tokens, {} diagnostics in {} ms",
                    source.length(), syntaxTokens.size(), diagnostics.size(), analysisTime);

            return SyntaxAnalysisResponse.success(syntaxTokens, diagnostics, analysisTime);

        } catch (RuntimeException e) {
            logger.error("Syntax analysis failed: {}", e.getMessage(), e);
            return SyntaxAnalysisResponse.error("Syntax analysis failed: " + e.getMessage(),
                    System.currentTimeMillis() - startTime);
        }
    }
}
