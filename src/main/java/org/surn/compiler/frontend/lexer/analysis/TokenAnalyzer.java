package org.surn.compiler.frontend.lexer.analysis;

import org.surn.compiler.diagnostics.DiagnosticsEngine;
import org.surn.compiler.frontend.lexer.Token;
import org.surn.compiler.frontend.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Looks for obvious mistakes in a token list before it is parsed and reports them as warnings:
 * two identifiers separated only by whitespace or comments, and brackets that are never closed
 * or never opened.
 * <p>
 * The analyzer never stops the compilation; the parser reports the real error if there is one.
 */
public class TokenAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final String fileName;

    /**
     * @param diagnostics The engine the findings are reported to.
     * @param fileName The file name used in the findings.
     */
    public TokenAnalyzer(DiagnosticsEngine diagnostics, String fileName) {
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Analyzes the tokens of one file.
     * @param tokens The tokens, trivia included.
     * @return The number of findings reported.
     */
    public int analyze(List<Token> tokens) {
        return checkIdentifiers(tokens) + checkBrackets(tokens);
    }

    private int checkIdentifiers(List<Token> tokens) {
        int findings = 0;
        Token lastSignificant = null;
        for (Token token : tokens) {
            if (token.isTrivia()) {
                continue;
            }
            if (lastSignificant != null && lastSignificant.is(TokenType.IDENTIFIER) && token.is(TokenType.IDENTIFIER)) {
                diagnostics.reportWarning(String.format(
                        "Identifiers can never be next to each-other in this context: \"%s\" at %s is next to \"%s\" at %s.",
                        lastSignificant.value(), lastSignificant.position(), token.value(), token.position()),
                        fileName, token.position().line(), token.range());
                findings++;
            }
            lastSignificant = token;
        }
        return findings;
    }

    private int checkBrackets(List<Token> tokens) {
        int findings = 0;
        Deque<Token> open = new ArrayDeque<>();
        for (Token token : tokens) {
            TokenType type = token.type();
            if (isOpening(type)) {
                open.push(token);
            } else if (isClosing(type)) {
                if (!open.isEmpty() && closerOf(open.peek().type()) == type) {
                    open.pop();
                } else {
                    diagnostics.reportWarning(String.format("%s at %s is never opened.", describe(type), token.position()),
                            fileName, token.position().line(), token.range());
                    findings++;
                }
            }
        }
        // The deque iterates from the innermost bracket outwards; report in source order.
        while (!open.isEmpty()) {
            Token token = open.removeLast();
            diagnostics.reportWarning(String.format("%s at %s is never closed.", describe(token.type()), token.position()),
                    fileName, token.position().line(), token.range());
            findings++;
        }
        return findings;
    }

    private static boolean isOpening(TokenType type) {
        return type == TokenType.LEFT_PARENTHESIS || type == TokenType.LEFT_BRACKET || type == TokenType.LEFT_BRACE;
    }

    private static boolean isClosing(TokenType type) {
        return type == TokenType.RIGHT_PARENTHESIS || type == TokenType.RIGHT_BRACKET || type == TokenType.RIGHT_BRACE;
    }

    private static TokenType closerOf(TokenType opening) {
        switch (opening) {
            case LEFT_PARENTHESIS: return TokenType.RIGHT_PARENTHESIS;
            case LEFT_BRACKET: return TokenType.RIGHT_BRACKET;
            default: return TokenType.RIGHT_BRACE;
        }
    }

    private static String describe(TokenType type) {
        switch (type) {
            case LEFT_PARENTHESIS:
            case RIGHT_PARENTHESIS:
                return "Parenthesis";
            case LEFT_BRACKET:
            case RIGHT_BRACKET:
                return "Bracket";
            default:
                return "Brace";
        }
    }
}
