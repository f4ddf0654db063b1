package com.toolbox.jsformatter.config;

import com.toolbox.jsformatter.format.FormatMode;
import com.toolbox.jsformatter.format.FormatOptions;
import com.toolbox.jsformatter.format.IndentType;
import com.toolbox.jsformatter.format.QuoteStyle;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "formatter")
@Validated
public record FormatterProperties(
    @Positive
    @DefaultValue("500000")
    Integer maxSourceLength,

    @Valid
    @DefaultValue
    Defaults defaults
) {

    public static final int DEFAULT_MAX_SOURCE_LENGTH = 500_000;

    public static FormatterProperties standard() {
        return new FormatterProperties(DEFAULT_MAX_SOURCE_LENGTH, Defaults.standard());
    }

    /**
     * Options applied when a request leaves a field unset.
     */
    public FormatOptions defaultOptions() {
        return FormatOptions.builder()
            .mode(defaults.mode())
            .indentSize(defaults.indentSize())
            .indentType(defaults.indentType())
            .quoteStyle(defaults.quoteStyle())
            .preserveComments(defaults.preserveComments())
            .validateSyntax(defaults.validateSyntax())
            .build();
    }

    public record Defaults(
        @NotNull
        @DefaultValue("beautify")
        FormatMode mode,

        @Min(FormatOptions.MIN_INDENT_SIZE)
        @Max(FormatOptions.MAX_INDENT_SIZE)
        @DefaultValue("2")
        int indentSize,

        @NotNull
        @DefaultValue("spaces")
        IndentType indentType,

        @NotNull
        @DefaultValue("preserve")
        QuoteStyle quoteStyle,

        @DefaultValue("true")
        boolean preserveComments,

        @DefaultValue("true")
        boolean validateSyntax
    ) {

        public static Defaults standard() {
            return new Defaults(FormatMode.BEAUTIFY, 2, IndentType.SPACES, QuoteStyle.PRESERVE, true, true);
        }
    }
}
