package com.toolbox.jsformatter.format;

import com.toolbox.jsformatter.lexer.JsTokenizer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsBeautifierTest {

    private final JsTokenizer tokenizer = new JsTokenizer();
    private final JsBeautifier beautifier = new JsBeautifier();

    @Test
    void indentsNestedBlocks() {
        String source = "function calculate(a,b){if(a>b){return a+b;}else{return a-b;}}";

        assertEquals("""
                function calculate(a, b) {
                  if (a > b) {
                    return a + b;
                  } else {
                    return a - b;
                  }
                }""", beautify(source, FormatOptions.defaults()));
    }

    @Test
    void usesConfiguredIndentUnit() {
        String source = "if(a){b();}";
        FormatOptions tabs = FormatOptions.builder().indentType(IndentType.TABS).build();
        FormatOptions four = FormatOptions.builder().indentSize(4).build();

        assertEquals("if (a) {\n\tb();\n}", beautify(source, tabs));
        assertEquals("if (a) {\n    b();\n}", beautify(source, four));
    }

    @Test
    void collapsesBlankLinesUnlessPreserved() {
        String source = "const x = 1;\n\n\nconst y = 2;";

        assertEquals("const x = 1;\nconst y = 2;", beautify(source, FormatOptions.defaults()));
        assertEquals("const x = 1;\n\nconst y = 2;",
                beautify(source, FormatOptions.builder().preserveEmptyLines(true).build()));
    }

    @Test
    void keepsLineCommentsOnTheirOwnLine() {
        String source = "// setup\nlet a = 1;";

        assertEquals("// setup\nlet a = 1;", beautify(source, FormatOptions.defaults()));
        assertEquals("let a = 1;", beautify(source, FormatOptions.builder().preserveComments(false).build()));
    }

    @Test
    void forHeaderStaysOnOneLine() {
        assertEquals("for (let i = 0; i < n; i++) {\n  total += i;\n}",
                beautify("for(let i=0;i<n;i++){total+=i;}", FormatOptions.defaults()));
    }

    @Test
    void unaryMinusStaysAttached() {
        assertEquals("x = -1;", beautify("x=-1;", FormatOptions.defaults()));
    }

    @Test
    void normalizesQuotes() {
        FormatOptions doubleQuotes = FormatOptions.builder().quoteStyle(QuoteStyle.DOUBLE).build();

        assertEquals("\"hello\"", beautify("'hello'", doubleQuotes));
    }

    @Test
    void braceOnItsOwnLine() {
        FormatOptions allman = FormatOptions.builder().insertNewLineBeforeOpeningBrace(true).build();

        assertEquals("if (a)\n{\n  b();\n}", beautify("if(a){b();}", allman));
    }

    private String beautify(String source, FormatOptions options) {
        return beautifier.beautify(tokenizer.tokenize(source), options);
    }
}
