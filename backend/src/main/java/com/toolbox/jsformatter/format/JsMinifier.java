package com.toolbox.jsformatter.format;

import com.toolbox.jsformatter.lexer.Token;
import com.toolbox.jsformatter.lexer.TokenKind;
import com.toolbox.jsformatter.lexer.TokenStreams;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
public class JsMinifier {

    private static final Set<String> BLOCK_CONTINUATION_KEYWORDS = Set.of("else", "catch", "finally", "while");

    public String minify(List<Token> tokens, FormatOptions options) {
        StringBuilder out = new StringBuilder();
        Token lastEmitted = null;
        boolean separated = false;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);

            if (options.removeDebugger() && token.isKeyword("debugger")) {
                int j = i + 1;
                while (j < tokens.size() && tokens.get(j).isTrivia()) {
                    j++;
                }
                if (j < tokens.size() && tokens.get(j).isPunctuation(";")) {
                    i = j;
                }
                separated = true;
                continue;
            }

            String fragment = switch (token.kind()) {
                case WHITESPACE -> null;
                case COMMENT -> keepsComment(token, options) ? token.text() : null;
                case STRING -> StringLiterals.normalizeQuotes(token, options.quoteStyle());
                case KEYWORD, IDENTIFIER, NUMBER, REGEX, OPERATOR, PUNCTUATION -> token.text();
            };

            if (fragment == null) {
                separated = true;
                continue;
            }

            if (separated && TokenSeparation.needsSpace(lastEmitted, token)) {
                out.append(' ');
            }
            separated = false;
            out.append(fragment);
            lastEmitted = token;

            // an unclosed quote ends at the line break, so the break has to stay
            if (token.isLineComment() || isUnterminatedQuote(token)) {
                out.append('\n');
            } else if (options.addSemicolons() && token.isPunctuation("}")
                    && startsStatement(TokenStreams.nextSignificant(tokens, i))) {
                out.append(';');
            }
        }

        return out.toString();
    }

    private boolean keepsComment(Token comment, FormatOptions options) {
        return options.preserveComments()
                || (options.preserveImportantComments() && comment.text().startsWith("/*!"));
    }

    private boolean isUnterminatedQuote(Token token) {
        return token.kind() == TokenKind.STRING && !token.terminated() && !token.text().startsWith("`");
    }

    private boolean startsStatement(Token next) {
        if (next == null) {
            return false;
        }
        if (next.kind() == TokenKind.PUNCTUATION || next.kind() == TokenKind.OPERATOR) {
            return false;
        }
        return !(next.kind() == TokenKind.KEYWORD && BLOCK_CONTINUATION_KEYWORDS.contains(next.text()));
    }
}
