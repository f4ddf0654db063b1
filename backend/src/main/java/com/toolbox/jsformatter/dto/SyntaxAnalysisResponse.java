package com.toolbox.jsformatter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.toolbox.jsformatter.validation.ValidationError;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxAnalysisResponse(
        boolean success,
        List<SyntaxToken> tokens,
        List<ValidationError> diagnostics,
        String error,
        long analysisTimeMs) {

    public static SyntaxAnalysisResponse success(
            List<SyntaxToken> tokens, List<ValidationError> diagnostics, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(true, tokens, diagnostics, null, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse error(String error, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(false, List.of(), List.of(), error, analysisTimeMs);
    }
}
