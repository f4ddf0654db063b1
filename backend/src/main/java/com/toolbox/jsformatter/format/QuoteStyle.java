package com.toolbox.jsformatter.format;

public enum QuoteStyle {
    SINGLE('\''),
    DOUBLE('"'),
    PRESERVE('\0');

    private final char quote;

    QuoteStyle(char quote) {
        this.quote = quote;
    }

    public char quote() {
        return quote;
    }
}
