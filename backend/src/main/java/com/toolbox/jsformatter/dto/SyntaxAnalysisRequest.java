package com.toolbox.jsformatter.dto;

import jakarta.validation.constraints.NotNull;

public record SyntaxAnalysisRequest(
        @NotNull(message = "Source code cannot be null")
        String sourceCode,
        Boolean includeTrivia) {

    public boolean includesTrivia() {
        return Boolean.TRUE.equals(includeTrivia);
    }

    // Not trimmed: token positions must match the caller's editor.
    public String sanitizedSourceCode() {
        if (sourceCode == null) {
            return "";
        }

        return sourceCode
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
