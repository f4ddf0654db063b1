package com.toolbox.jsformatter.format;

public enum FormatMode {
    BEAUTIFY,
    MINIFY
}
