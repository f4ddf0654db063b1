package com.toolbox.jsformatter.lexer;

/**
 * Immutable scan cursor. Each sub-scan hands back the lexeme it consumed and the
 * tokenizer derives the next state from it, so no counters are shared between
 * branches.
 */
public record ScannerState(int offset, int line, int column) {

    public static ScannerState start() {
        return new ScannerState(0, 1, 1);
    }

    public ScannerState advance(String lexeme) {
        int nextLine = line;
        int nextColumn = column;

        for (int i = 0; i < lexeme.length(); i++) {
            if (lexeme.charAt(i) == '\n') {
                nextLine++;
                nextColumn = 1;
            } else {
                nextColumn++;
            }
        }

        return new ScannerState(offset + lexeme.length(), nextLine, nextColumn);
    }
}
