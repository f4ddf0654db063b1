package com.toolbox.jsformatter.dto;

import com.toolbox.jsformatter.exception.InvalidOptionsException;
import com.toolbox.jsformatter.format.FormatMode;
import com.toolbox.jsformatter.format.FormatOptions;
import com.toolbox.jsformatter.format.IndentType;
import com.toolbox.jsformatter.format.QuoteStyle;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Locale;
import java.util.function.Consumer;

/**
 * Body of {@code POST /api/format}. Every option is optional; unset fields
 * fall back to the configured defaults. The source length limit is
 * {@code formatter.max-source-length}, checked by the service.
 */
public record FormatRequest(
    @NotNull(message = "Source code cannot be null")
    String sourceCode,

    String mode,

    @Min(value = FormatOptions.MIN_INDENT_SIZE, message = "Indent size must be at least 1")
    @Max(value = FormatOptions.MAX_INDENT_SIZE, message = "Indent size cannot exceed 16")
    Integer indentSize,

    String indentType,
    Boolean insertSpaceAfterKeywords,
    Boolean insertSpaceBeforeFunctionParen,
    Boolean insertSpaceAfterFunctionParen,
    Boolean insertSpaceBeforeOpeningBrace,
    Boolean insertNewLineBeforeOpeningBrace,
    Boolean insertNewLineAfterOpeningBrace,
    Boolean insertNewLineBeforeClosingBrace,
    Boolean preserveComments,
    Boolean preserveEmptyLines,
    Boolean addSemicolons,
    String quoteStyle,
    Boolean trailingCommas,
    Boolean validateSyntax,
    Boolean preserveImportantComments,
    Boolean removeDebugger
) {

    public static FormatRequest of(String sourceCode) {
        return new FormatRequest(sourceCode, null, null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null);
    }

    public FormatOptions toOptions(FormatOptions defaults) throws InvalidOptionsException {
        FormatOptions.Builder builder = defaults.toBuilder();

        if (mode != null) {
            builder.mode(parse(FormatMode.class, "mode", mode));
        }
        if (indentType != null) {
            builder.indentType(parse(IndentType.class, "indentType", indentType));
        }
        if (quoteStyle != null) {
            builder.quoteStyle(parse(QuoteStyle.class, "quoteStyle", quoteStyle));
        }
        if (indentSize != null) {
            builder.indentSize(indentSize);
        }

        apply(insertSpaceAfterKeywords, builder::insertSpaceAfterKeywords);
        apply(insertSpaceBeforeFunctionParen, builder::insertSpaceBeforeFunctionParen);
        apply(insertSpaceAfterFunctionParen, builder::insertSpaceAfterFunctionParen);
        apply(insertSpaceBeforeOpeningBrace, builder::insertSpaceBeforeOpeningBrace);
        apply(insertNewLineBeforeOpeningBrace, builder::insertNewLineBeforeOpeningBrace);
        apply(insertNewLineAfterOpeningBrace, builder::insertNewLineAfterOpeningBrace);
        apply(insertNewLineBeforeClosingBrace, builder::insertNewLineBeforeClosingBrace);
        apply(preserveComments, builder::preserveComments);
        apply(preserveEmptyLines, builder::preserveEmptyLines);
        apply(addSemicolons, builder::addSemicolons);
        apply(trailingCommas, builder::trailingCommas);
        apply(validateSyntax, builder::validateSyntax);
        apply(preserveImportantComments, builder::preserveImportantComments);
        apply(removeDebugger, builder::removeDebugger);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException(e.getMessage(), e);
        }
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String field, String value)
            throws InvalidOptionsException {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException("Unsupported " + field + ": " + value, e);
        }
    }

    private static void apply(Boolean value, Consumer<Boolean> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
