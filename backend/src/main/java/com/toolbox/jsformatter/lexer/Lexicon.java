package com.toolbox.jsformatter.lexer;

import java.util.Set;

public final class Lexicon {

    public static final Set<String> KEYWORDS = Set.of(
            "abstract", "arguments", "await", "boolean", "break", "byte", "case", "catch",
            "char", "class", "const", "continue", "debugger", "default", "delete", "do",
            "double", "else", "enum", "eval", "export", "extends", "false", "final",
            "finally", "float", "for", "function", "goto", "if", "implements", "import",
            "in", "instanceof", "int", "interface", "let", "long", "native", "new",
            "null", "package", "private", "protected", "public", "return", "short",
            "static", "super", "switch", "synchronized", "this", "throw", "throws",
            "transient", "true", "try", "typeof", "var", "void", "volatile", "while",
            "with", "yield", "async", "of");

    public static final Set<String> OPERATORS = Set.of(
            "+", "-", "*", "/", "%", "**", "++", "--", "=", "+=", "-=", "*=", "/=",
            "%=", "**=", "==", "===", "!=", "!==", "<", ">", "<=", ">=", "&&", "||",
            "!", "&", "|", "^", "~", "<<", ">>", ">>>", "&=", "|=", "^=", "<<=",
            ">>=", ">>>=", "?", ":", "=>", "?.", "??", "??=", "&&=", "||=");

    public static final String PUNCTUATION = "{}()[];,.";

    public static final int MAX_OPERATOR_LENGTH = 4;

    private Lexicon() {
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    public static boolean isPunctuation(char c) {
        return PUNCTUATION.indexOf(c) >= 0;
    }

    /**
     * Length of the longest operator starting at {@code offset}, or 0 when none does.
     */
    public static int operatorLengthAt(CharSequence source, int offset) {
        int available = Math.min(MAX_OPERATOR_LENGTH, source.length() - offset);

        for (int length = available; length >= 1; length--) {
            String candidate = source.subSequence(offset, offset + length).toString();
            if (!OPERATORS.contains(candidate)) {
                continue;
            }
            // a?.5:0 is a conditional, not optional chaining
            if (candidate.equals("?.") && offset + 2 < source.length()
                    && Character.isDigit(source.charAt(offset + 2))) {
                continue;
            }
            return length;
        }

        return 0;
    }
}
