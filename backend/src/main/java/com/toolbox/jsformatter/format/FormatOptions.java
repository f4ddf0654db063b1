package com.toolbox.jsformatter.format;

import java.util.Objects;

/**
 * Options shared by the beautifier and the minifier.
 *
 * <p>Defaults (see {@link #defaults()}): beautify, two spaces, space after
 * keywords and before {@code {}, line break after {@code {} and before
 * {@code }}, comments kept, blank lines dropped, no semicolon insertion, quotes
 * preserved, no trailing-comma space, validation on. The minifier-only flags
 * {@code preserveImportantComments} and {@code removeDebugger} are off.
 */
public record FormatOptions(
        FormatMode mode,
        int indentSize,
        IndentType indentType,
        boolean insertSpaceAfterKeywords,
        boolean insertSpaceBeforeFunctionParen,
        boolean insertSpaceAfterFunctionParen,
        boolean insertSpaceBeforeOpeningBrace,
        boolean insertNewLineBeforeOpeningBrace,
        boolean insertNewLineAfterOpeningBrace,
        boolean insertNewLineBeforeClosingBrace,
        boolean preserveComments,
        boolean preserveEmptyLines,
        boolean addSemicolons,
        QuoteStyle quoteStyle,
        boolean trailingCommas,
        boolean validateSyntax,
        boolean preserveImportantComments,
        boolean removeDebugger) {

    public static final int MIN_INDENT_SIZE = 1;
    public static final int MAX_INDENT_SIZE = 16;

    public FormatOptions {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(indentType, "indentType");
        Objects.requireNonNull(quoteStyle, "quoteStyle");

        if (indentSize < MIN_INDENT_SIZE || indentSize > MAX_INDENT_SIZE) {
            throw new IllegalArgumentException(
                    "indentSize must be between " + MIN_INDENT_SIZE + " and " + MAX_INDENT_SIZE
                            + " but was " + indentSize);
        }
    }

    public static FormatOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .indentSize(indentSize)
                .indentType(indentType)
                .insertSpaceAfterKeywords(insertSpaceAfterKeywords)
                .insertSpaceBeforeFunctionParen(insertSpaceBeforeFunctionParen)
                .insertSpaceAfterFunctionParen(insertSpaceAfterFunctionParen)
                .insertSpaceBeforeOpeningBrace(insertSpaceBeforeOpeningBrace)
                .insertNewLineBeforeOpeningBrace(insertNewLineBeforeOpeningBrace)
                .insertNewLineAfterOpeningBrace(insertNewLineAfterOpeningBrace)
                .insertNewLineBeforeClosingBrace(insertNewLineBeforeClosingBrace)
                .preserveComments(preserveComments)
                .preserveEmptyLines(preserveEmptyLines)
                .addSemicolons(addSemicolons)
                .quoteStyle(quoteStyle)
                .trailingCommas(trailingCommas)
                .validateSyntax(validateSyntax)
                .preserveImportantComments(preserveImportantComments)
                .removeDebugger(removeDebugger);
    }

    public String indentUnit() {
        return indentType.unit(indentSize);
    }

    public static final class Builder {
        private FormatMode mode = FormatMode.BEAUTIFY;
        private int indentSize = 2;
        private IndentType indentType = IndentType.SPACES;
        private boolean insertSpaceAfterKeywords = true;
        private boolean insertSpaceBeforeFunctionParen = false;
        private boolean insertSpaceAfterFunctionParen = false;
        private boolean insertSpaceBeforeOpeningBrace = true;
        private boolean insertNewLineBeforeOpeningBrace = false;
        private boolean insertNewLineAfterOpeningBrace = true;
        private boolean insertNewLineBeforeClosingBrace = true;
        private boolean preserveComments = true;
        private boolean preserveEmptyLines = false;
        private boolean addSemicolons = false;
        private QuoteStyle quoteStyle = QuoteStyle.PRESERVE;
        private boolean trailingCommas = false;
        private boolean validateSyntax = true;
        private boolean preserveImportantComments = false;
        private boolean removeDebugger = false;

        private Builder() {
        }

        public Builder mode(FormatMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder indentSize(int indentSize) {
            this.indentSize = indentSize;
            return this;
        }

        public Builder indentType(IndentType indentType) {
            this.indentType = indentType;
            return this;
        }

        public Builder insertSpaceAfterKeywords(boolean value) {
            this.insertSpaceAfterKeywords = value;
            return this;
        }

        public Builder insertSpaceBeforeFunctionParen(boolean value) {
            this.insertSpaceBeforeFunctionParen = value;
            return this;
        }

        public Builder insertSpaceAfterFunctionParen(boolean value) {
            this.insertSpaceAfterFunctionParen = value;
            return this;
        }

        public Builder insertSpaceBeforeOpeningBrace(boolean value) {
            this.insertSpaceBeforeOpeningBrace = value;
            return this;
        }

        public Builder insertNewLineBeforeOpeningBrace(boolean value) {
            this.insertNewLineBeforeOpeningBrace = value;
            return this;
        }

        public Builder insertNewLineAfterOpeningBrace(boolean value) {
            this.insertNewLineAfterOpeningBrace = value;
            return this;
        }

        public Builder insertNewLineBeforeClosingBrace(boolean value) {
            this.insertNewLineBeforeClosingBrace = value;
            return this;
        }

        public Builder preserveComments(boolean value) {
            this.preserveComments = value;
            return this;
        }

        public Builder preserveEmptyLines(boolean value) {
            this.preserveEmptyLines = value;
            return this;
        }

        public Builder addSemicolons(boolean value) {
            this.addSemicolons = value;
            return this;
        }

        public Builder quoteStyle(QuoteStyle quoteStyle) {
            this.quoteStyle = quoteStyle;
            return this;
        }

        public Builder trailingCommas(boolean value) {
            this.trailingCommas = value;
            return this;
        }

        public Builder validateSyntax(boolean value) {
            this.validateSyntax = value;
            return this;
        }

        public Builder preserveImportantComments(boolean value) {
            this.preserveImportantComments = value;
            return this;
        }

        public Builder removeDebugger(boolean value) {
            this.removeDebugger = value;
            return this;
        }

        public FormatOptions build() {
            return new FormatOptions(
                    mode,
                    indentSize,
                    indentType,
                    insertSpaceAfterKeywords,
                    insertSpaceBeforeFunctionParen,
                    insertSpaceAfterFunctionParen,
                    insertSpaceBeforeOpeningBrace,
                    insertNewLineBeforeOpeningBrace,
                    insertNewLineAfterOpeningBrace,
                    insertNewLineBeforeClosingBrace,
                    preserveComments,
                    preserveEmptyLines,
                    addSemicolons,
                    quoteStyle,
                    trailingCommas,
                    validateSyntax,
                    preserveImportantComments,
                    removeDebugger);
        }
    }
}
