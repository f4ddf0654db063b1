package com.toolbox.jsformatter.service;

import com.toolbox.jsformatter.config.FormatterProperties;
import com.toolbox.jsformatter.dto.FormatResult;
import com.toolbox.jsformatter.dto.FormatStats;
import com.toolbox.jsformatter.format.FormatOptions;
import com.toolbox.jsformatter.format.JsBeautifier;
import com.toolbox.jsformatter.format.JsMinifier;
import com.toolbox.jsformatter.lexer.JsTokenizer;
import com.toolbox.jsformatter.lexer.Token;
import com.toolbox.jsformatter.lexer.TokenKind;
import com.toolbox.jsformatter.lexer.TokenStreams;
import com.toolbox.jsformatter.validation.JsSyntaxValidator;
import com.toolbox.jsformatter.validation.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class JsFormatterService {

    private static final Logger logger = LoggerFactory.getLogger(JsFormatterService.class);

    static final String EMPTY_INPUT_MESSAGE = "Please provide JavaScript content to process";

    private final JsTokenizer tokenizer;
    private final JsSyntaxValidator validator;
    private final JsBeautifier beautifier;
    private final JsMinifier minifier;
    private final FormatterProperties properties;

    public JsFormatterService(
            JsTokenizer tokenizer,
            JsSyntaxValidator validator,
            JsBeautifier beautifier,
            JsMinifier minifier,
            FormatterProperties properties) {
        this.tokenizer = tokenizer;
        this.validator = validator;
        this.beautifier = beautifier;
        this.minifier = minifier;
        this.properties = properties;
    }

    public FormatOptions defaultOptions() {
        return properties.defaultOptions();
    }

    public FormatResult process(String source, FormatOptions options) {
        if (source == null || source.isBlank()) {
            return FormatResult.failure(EMPTY_INPUT_MESSAGE);
        }
        if (source.length() > properties.maxSourceLength()) {
            logger.warn("Rejected source of {} characters (limit {})", source.length(), properties.maxSourceLength());
            return FormatResult.failure("Source code exceeds the maximum length of "
                    + properties.maxSourceLength() + " characters");
        }

        try {
            long startTime = System.currentTimeMillis();

            List<Token> tokens = tokenizer.tokenize(source);
            logger.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());

            List<ValidationError> diagnostics = options.validateSyntax()
                    ? validator.validate(tokens)
                    : List.of();

            String output = switch (options.mode()) {
                case BEAUTIFY -> beautifier.beautify(tokens, options);
                case MINIFY -> minifier.minify(tokens, options);
            };

            FormatStats stats = FormatStats.of(
                    source,
                    output,
                    TokenStreams.count(tokens, TokenKind.KEYWORD, "function"),
                    countDeclarations(tokens),
                    diagnostics);

            logger.debug("{} finished in {} ms: {} -> {} characters, {} errors, {} warnings",
                    options.mode(), System.currentTimeMillis() - startTime,
                    stats.originalSize(), stats.processedSize(),
                    stats.errors().size(), stats.warnings().size());

            return FormatResult.success(output, stats);

        } catch (RuntimeException e) {
            logger.error("Formatting failed: {}", e.getMessage(), e);
            return FormatResult.failure("Formatting failed: " + e.getMessage());
        }
    }

    private long countDeclarations(List<Token> tokens) {
        return TokenStreams.count(tokens, TokenKind.KEYWORD, "var")
                + TokenStreams.count(tokens, TokenKind.KEYWORD, "let")
                + TokenStreams.count(tokens, TokenKind.KEYWORD, "const");
    }
}
