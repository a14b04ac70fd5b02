package org.surn.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The Tokenizer (also known as Lexer or Scanner) converts source text into a flat
 * sequence of {@link Token}s.
 * <p>
 * At every position the lexical rules are tried in a fixed order and the first one
 * that matches consumes its characters:
 * whitespace, comment, operator, keyword, boolean, identifier, number, string,
 * colon/accessor/range, single-character punctuation. A character no rule accepts is
 * skipped and reported as a {@link LexicalError}.
 */
public class Tokenizer {

    private final Cursor cursor;
    private final List<Token> tokens = new ArrayList<>();
    private final List<LexicalError> errors = new ArrayList<>();
    private int start = 0;
    private Position startPosition = Position.START;

    /**
     * Creates a new Tokenizer.
     * @param source The source code as a single string.
     */
    public Tokenizer(String source) {
        this.cursor = new Cursor(source);
    }

    /**
     * Tokenizes the given source and drops the lexical errors.
     * @param source The source code.
     * @return The recognized tokens.
     */
    public static List<Token> tokenize(String source) {
        return new Tokenizer(source).scanTokens().tokens();
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens together with every lexical problem found.
     */
    public TokenizeResult scanTokens() {
        while (!cursor.isEof()) {
            start = cursor.getOffset();
            startPosition = cursor.getPosition();
            scanToken();
        }
        return new TokenizeResult(tokens, errors);
    }

    private void scanToken() {
        if (whitespace() || comment() || operator() || keyword() || bool() || identifier()
                || number() || string() || valueReserved() || reserved()) {
            return;
        }
        char c = cursor.peek();
        report(LexicalError.Kind.UNKNOWN_CHARACTER, "Unexpected character: '" + c + "'");
    }

    private boolean whitespace() {
        String run = cursor.eatWhile(Tokenizer::isWhitespace);
        if (run.isEmpty()) {
            return false;
        }
        addToken(TokenType.WHITESPACE, run);
        return true;
    }

    private boolean comment() {
        if (cursor.first() != '/') {
            return false;
        }
        if (cursor.second() == '/') {
            String text = cursor.eatWhile(c -> c != '\n');
            addToken(TokenType.COMMENT, text);
            return true;
        }
        if (cursor.second() != '*') {
            return false;
        }

        cursor.advance(2);
        int[] depth = {1};
        cursor.eatWhileCursor((c, next) -> {
            if (depth[0] == 0) {
                return false;
            }
            if (next == '/' && c.second() == '*') {
                c.peek();
                depth[0]++;
            } else if (next == '*' && c.second() == '/') {
                c.peek();
                depth[0]--;
            }
            return true;
        });
        if (depth[0] > 0) {
            report(LexicalError.Kind.UNTERMINATED_COMMENT, "Block comment is never closed.");
        }
        addToken(TokenType.COMMENT, currentText());
        return true;
    }

    private boolean operator() {
        char c = cursor.first();
        if (isOperatorChar(c)) {
            cursor.peek();
            addToken(TokenType.OPERATOR, String.valueOf(c));
            return true;
        }
        return word("or", TokenType.OPERATOR) || word("and", TokenType.OPERATOR);
    }

    private boolean keyword() {
        int length = 0;
        while (length <= Keyword.MAX_LENGTH && isAlpha(cursor.nthChar(length))) {
            length++;
        }
        if (length == 0 || length > Keyword.MAX_LENGTH) {
            return false;
        }
        // Keywords only count when followed by whitespace; "if(" is not a keyword.
        if (!isWhitespace(cursor.nthChar(length))) {
            return false;
        }
        String candidate = cursor.getSource().substring(cursor.getOffset(), cursor.getOffset() + length);
        Optional<Keyword> keyword = Keyword.fromText(candidate);
        if (keyword.isEmpty()) {
            return false;
        }
        cursor.advance(length);
        tokens.add(new Token(TokenType.KEYWORD, keyword.get(), currentRange(), null, startPosition));
        return true;
    }

    private boolean bool() {
        return word("true", TokenType.BOOLEAN) || word("false", TokenType.BOOLEAN);
    }

    private boolean identifier() {
        char c = cursor.first();
        if (!isAlpha(c) && c != '_') {
            return false;
        }
        String name = cursor.eatWhile(Tokenizer::isIdentifierChar);
        addToken(TokenType.IDENTIFIER, name);
        return true;
    }

    private boolean number() {
        if (!isDigit(cursor.first())) {
            return false;
        }
        cursor.eatWhile(Tokenizer::isDigit);
        // A dot belongs to the number only when a digit follows, so "1..5" and "1.foo" keep their dots.
        if (cursor.first() == '.' && isDigit(cursor.second())) {
            cursor.peek();
            cursor.eatWhile(Tokenizer::isDigit);
        }
        addToken(TokenType.NUMBER, currentText());
        return true;
    }

    private boolean string() {
        char delimiter = cursor.first();
        if (delimiter != '"' && delimiter != '\'' && delimiter != '`') {
            return false;
        }
        cursor.peek();
        String content = cursor.eatWhile(c -> c != delimiter);
        if (cursor.isEof()) {
            report(LexicalError.Kind.UNTERMINATED_STRING, "String literal is never closed, expected " + delimiter + ".");
        } else {
            cursor.peek();
        }
        addToken(TokenType.STRING_LITERAL, content);
        return true;
    }

    private boolean valueReserved() {
        switch (cursor.first()) {
            case ':':
                if (cursor.second() == ':') {
                    cursor.advance(2);
                    addToken(TokenType.ACCESSOR, "::");
                } else {
                    cursor.peek();
                    addToken(TokenType.COLON, ":");
                }
                return true;
            case '.':
                if (cursor.second() == '.') {
                    cursor.advance(2);
                    addToken(TokenType.RANGE, "..");
                } else {
                    cursor.peek();
                    addToken(TokenType.ACCESSOR, ".");
                }
                return true;
            default:
                return false;
        }
    }

    private boolean reserved() {
        TokenType type;
        switch (cursor.first()) {
            case '[': type = TokenType.LEFT_BRACKET; break;
            case ']': type = TokenType.RIGHT_BRACKET; break;
            case '(': type = TokenType.LEFT_PARENTHESIS; break;
            case ')': type = TokenType.RIGHT_PARENTHESIS; break;
            case '{': type = TokenType.LEFT_BRACE; break;
            case '}': type = TokenType.RIGHT_BRACE; break;
            case ';': type = TokenType.STATEMENT_END; break;
            case ',': type = TokenType.COMMA; break;
            case '\\': type = TokenType.BACKSLASH; break;
            default: return false;
        }
        cursor.peek();
        addToken(type, null);
        return true;
    }

    /**
     * Matches a fixed word that must not run on into an identifier, so "order" stays one identifier.
     */
    private boolean word(String text, TokenType type) {
        for (int i = 0; i < text.length(); i++) {
            if (cursor.nthChar(i) != text.charAt(i)) {
                return false;
            }
        }
        if (isIdentifierChar(cursor.nthChar(text.length()))) {
            return false;
        }
        cursor.advance(text.length());
        addToken(type, text);
        return true;
    }

    private void addToken(TokenType type, String value) {
        tokens.add(new Token(type, null, currentRange(), value, startPosition));
    }

    private void report(LexicalError.Kind kind, String message) {
        errors.add(new LexicalError(kind, message, currentRange(), startPosition));
    }

    private TextRange currentRange() {
        return new TextRange(start, cursor.getOffset());
    }

    private String currentText() {
        return cursor.getSource().substring(start, cursor.getOffset());
    }

    private static boolean isOperatorChar(char c) {
        switch (c) {
            case '+': case '-': case '*': case '/': case '%': case '=':
            case '<': case '>': case '&': case '|': case '^': case '~':
                return true;
            default:
                return false;
        }
    }

    /**
     * Unicode White_Space, which also covers the no-break spaces and NEL that
     * {@link Character#isWhitespace(char)} leaves out.
     */
    static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isIdentifierChar(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }
}
