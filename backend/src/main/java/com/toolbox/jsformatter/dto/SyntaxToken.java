package com.toolbox.jsformatter.dto;

import com.toolbox.jsformatter.lexer.ScannerState;
import com.toolbox.jsformatter.lexer.Token;

public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value
) {

    public static SyntaxToken from(Token token) {
        ScannerState end = token.end();
        return new SyntaxToken(
            token.line(),
            token.column(),
            end.line(),
            end.column(),
            token.kind().name(),
            token.text());
    }
}
