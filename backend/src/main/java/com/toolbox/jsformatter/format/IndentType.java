package com.toolbox.jsformatter.format;

public enum IndentType {
    SPACES,
    TABS;

    public String unit(int indentSize) {
        return this == TABS ? "\t" : " ".repeat(indentSize);
    }
}
