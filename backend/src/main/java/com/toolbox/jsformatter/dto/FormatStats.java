package com.toolbox.jsformatter.dto;

import com.toolbox.jsformatter.validation.ValidationError;

import java.util.List;

public record FormatStats(
        int originalSize,
        int processedSize,
        int savedBytes,
        double compressionRatio,
        int lineCount,
        long functionCount,
        long variableCount,
        List<ValidationError> errors,
        List<ValidationError> warnings) {

    public static FormatStats of(
            String original,
            String processed,
            long functionCount,
            long variableCount,
            List<ValidationError> diagnostics) {

        int originalSize = original.length();
        int processedSize = processed.length();
        double compressionRatio = originalSize > 0 ? (double) processedSize / originalSize : 1.0;
        int lineCount = (int) processed.chars().filter(c -> c == '\n').count() + 1;

        List<ValidationError> errors = diagnostics.stream()
                .filter(ValidationError::isError)
                .toList();
        List<ValidationError> warnings = diagnostics.stream()
                .filter(issue -> !issue.isError())
                .toList();

        return new FormatStats(
                originalSize,
                processedSize,
                originalSize - processedSize,
                compressionRatio,
                lineCount,
                functionCount,
                variableCount,
                errors,
                warnings);
    }
}
