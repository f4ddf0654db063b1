package com.toolbox.jsformatter.format;

import com.toolbox.jsformatter.lexer.JsTokenizer;
import com.toolbox.jsformatter.lexer.Token;
import com.toolbox.jsformatter.lexer.TokenKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsMinifierTest {

    private final JsTokenizer tokenizer = new JsTokenizer();
    private final JsMinifier minifier = new JsMinifier();
    private final JsBeautifier beautifier = new JsBeautifier();

    private static final FormatOptions MINIFY = FormatOptions.builder()
            .mode(FormatMode.MINIFY)
            .preserveComments(false)
            .build();

    static Stream<Arguments> safetyCases() {
        List<String> sources = List.of(
                "function calculate(a,b){if(a>b){return a+b;}else{return a-b;}}",
                "var a = b + +c; let d = e - -1;",
                "const re = /ab+c/i; if (re.test(s)) { x++; }",
                "typeof x === 'string' && y instanceof Foo",
                "n = 1 .toString()",
                "x = a / /re/.source",
                "x = a ? .5 : 1",
                "return /abc/g.test(s) // done",
                "let total = items /* all */ .length",
                "x = a / /* half */ b;",
                "x = a / // rest\nb;",
                "x = 'abc\ny = 1;",
                "s = \"open\ncall();");

        return sources.stream()
                .flatMap(source -> Stream.of(Arguments.of(source, false), Arguments.of(source, true)));
    }

    @ParameterizedTest
    @MethodSource("safetyCases")
    void minifiedOutputKeepsTheSameTokens(String source, boolean preserveComments) {
        FormatOptions options = MINIFY.toBuilder().preserveComments(preserveComments).build();
        String minified = minifier.minify(tokenizer.tokenize(source), options);

        assertEquals(code(source, preserveComments), code(minified, preserveComments), minified);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "function calculate(a,b){if(a>b){return a+b;}else{return a-b;}}",
            "// header\nconst x = { a: 1, b: [1, 2, 3] };\n\n\nfunction f() { return x.a; }",
            "if (a) b(); else c();"
    })
    void minifiedIsNeverLongerThanBeautified(String source) {
        List<Token> tokens = tokenizer.tokenize(source);
        FormatOptions defaults = FormatOptions.defaults();

        String beautified = beautifier.beautify(tokens, defaults);
        String minified = minifier.minify(tokens, defaults.toBuilder().mode(FormatMode.MINIFY).build());

        assertTrue(minified.length() <= beautified.length(), minified + " vs " + beautified);
    }

    @Test
    void dropsWhitespaceAndComments() {
        assertEquals("function f(a,b){return a*b;}",
                minify("function f ( a , b ) {\n  // product\n  return a * b;\n}", MINIFY));
    }

    @Test
    void keptLineCommentEndsTheLine() {
        FormatOptions keepComments = MINIFY.toBuilder().preserveComments(true).build();

        assertEquals("x;// note\ny;", minify("x; // note\ny;", keepComments));
    }

    @Test
    void keepsImportantCommentsOnly() {
        FormatOptions important = MINIFY.toBuilder().preserveImportantComments(true).build();

        assertEquals("/*! license */a;b;", minify("/*! license */ a; /* drop */ b;", important));
    }

    @Test
    void removesDebuggerStatements() {
        FormatOptions options = MINIFY.toBuilder().removeDebugger(true).build();

        assertEquals("a();b();", minify("a();\ndebugger;\nb();", options));
        assertEquals("a();debugger;b();", minify("a();\ndebugger;\nb();", MINIFY));
    }

    @Test
    void insertsSemicolonAfterBlockFollowedByStatement() {
        FormatOptions options = MINIFY.toBuilder().addSemicolons(true).build();

        assertEquals("function f(){};f()", minify("function f() {}\nf()", options));
        assertEquals("if(a){}else{}", minify("if (a) {} else {}", options));
    }

    @Test
    void slashBeforeKeptCommentStaysApart() {
        FormatOptions keepComments = MINIFY.toBuilder().preserveComments(true).build();

        assertEquals("x=a/ /* half */b;", minify("x = a / /* half */ b;", keepComments));
    }

    @Test
    void unterminatedStringKeepsItsLineBreak() {
        assertEquals("x='abc\ny=1;", minify("x = 'abc\ny = 1;", MINIFY));
    }

    @Test
    void normalizesQuotes() {
        FormatOptions single = MINIFY.toBuilder().quoteStyle(QuoteStyle.SINGLE).build();

        assertEquals("a='x';", minify("a = \"x\";", single));
    }

    private String minify(String source, FormatOptions options) {
        return minifier.minify(tokenizer.tokenize(source), options);
    }

    private List<String> code(String source, boolean withComments) {
        return tokenizer.tokenize(source).stream()
                .filter(token -> withComments ? token.kind() != TokenKind.WHITESPACE : !token.isTrivia())
                .map(token -> token.kind() == TokenKind.STRING ? "S" + token.text() : token.kind() + token.text())
                .toList();
    }
}
