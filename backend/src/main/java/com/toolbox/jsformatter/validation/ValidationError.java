package com.toolbox.jsformatter.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.toolbox.jsformatter.lexer.Token;

public record ValidationError(
        int line,
        int column,
        String message,
        Severity severity,
        String code) {

    public static ValidationError error(Token at, String message, String code) {
        return new ValidationError(at.line(), at.column(), message, Severity.ERROR, code);
    }

    public static ValidationError warning(Token at, String message, String code) {
        return new ValidationError(at.line(), at.column(), message, Severity.WARNING, code);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
