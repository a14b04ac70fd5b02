package org.surn.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Tokenizer}.
 * These tests verify that source text is split into the right tokens, in the right order,
 * with ranges that map back onto the source.
 */
public class TokenizerTest {

    /**
     * Verifies that a simple variable declaration produces keyword, identifier, operator,
     * number and statement end tokens with whitespace kept in between.
     */
    @Test
    @Tag("unit")
    void testVariableDeclaration() {
        // Arrange
        String source = "var x = 5;";

        // Act
        TokenizeResult result = new Tokenizer(source).scanTokens();
        List<Token> tokens = result.tokens();

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.KEYWORD, TokenType.WHITESPACE, TokenType.IDENTIFIER, TokenType.WHITESPACE,
                TokenType.OPERATOR, TokenType.WHITESPACE, TokenType.NUMBER, TokenType.STATEMENT_END);
        assertThat(tokens.get(0).keyword()).isEqualTo(Keyword.VAR);
        assertThat(tokens.get(0).range()).isEqualTo(new TextRange(0, 3));
        assertThat(tokens.get(2).value()).isEqualTo("x");
        assertThat(tokens.get(6).value()).isEqualTo("5");
        assertThat(tokens.get(7).range()).isEqualTo(new TextRange(9, 10));
    }

    @Test
    @Tag("unit")
    void testEmptyAndWhitespaceSources() {
        assertThat(Tokenizer.tokenize("")).isEmpty();

        List<Token> tokens = Tokenizer.tokenize("  \n\t ");
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.WHITESPACE);
        assertThat(tokens.get(0).range()).isEqualTo(new TextRange(0, 5));
    }

    /**
     * Verifies that the token ranges, concatenated in order, reproduce the source exactly.
     */
    @Test
    @Tag("unit")
    void testRangesCoverSourceWithoutGaps() {
        // Arrange
        String source = String.join("\n",
                "namespace app\\core;",
                "// helpers",
                "public function add(a: int, b: int): int {",
                "    return a + b; /* sum */",
                "}",
                "const names: array<string> = [\"a\", 'b'];");

        // Act
        TokenizeResult result = new Tokenizer(source).scanTokens();

        // Assert
        assertThat(result.hasErrors()).isFalse();
        String rebuilt = result.tokens().stream()
                .map(t -> source.substring(t.range().start(), t.range().end()))
                .collect(Collectors.joining());
        assertThat(rebuilt).isEqualTo(source);
    }

    /**
     * Verifies that a keyword must be followed by whitespace; otherwise the word is an identifier.
     */
    @Test
    @Tag("unit")
    void testKeywordNeedsTrailingWhitespace() {
        // Act
        List<Token> atEnd = Tokenizer.tokenize("var");
        List<Token> beforeParen = Tokenizer.tokenize("if(x)");
        List<Token> beforeSpace = Tokenizer.tokenize("return x");

        // Assert
        assertThat(atEnd).extracting(Token::type).containsExactly(TokenType.IDENTIFIER);
        assertThat(beforeParen.get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.IDENTIFIER, "if");
        assertThat(beforeSpace.get(0).isKeyword(Keyword.RETURN)).isTrue();
    }

    /**
     * Verifies that words starting with a word operator or boolean stay identifiers.
     */
    @Test
    @Tag("unit")
    void testWordOperatorsAndBooleansRespectIdentifierBoundaries() {
        // Act
        List<Token> tokens = Tokenizer.tokenize("order or android and trueish true");

        // Assert
        List<Token> significant = tokens.stream().filter(t -> !t.isTrivia()).collect(Collectors.toList());
        assertThat(significant).extracting(Token::type, Token::value).containsExactly(
                tuple(TokenType.IDENTIFIER, "order"),
                tuple(TokenType.OPERATOR, "or"),
                tuple(TokenType.IDENTIFIER, "android"),
                tuple(TokenType.OPERATOR, "and"),
                tuple(TokenType.IDENTIFIER, "trueish"),
                tuple(TokenType.BOOLEAN, "true"));
    }

    /**
     * Verifies that a number only takes a dot when a digit follows, so ranges and member access keep their dots.
     */
    @Test
    @Tag("unit")
    void testNumbersAndRanges() {
        // Act
        List<Token> range = Tokenizer.tokenize("1..5");
        List<Token> decimal = Tokenizer.tokenize("3.14");
        List<Token> member = Tokenizer.tokenize("a.b::c");

        // Assert
        assertThat(range).extracting(Token::type).containsExactly(TokenType.NUMBER, TokenType.RANGE, TokenType.NUMBER);
        assertThat(range.get(1).range()).isEqualTo(new TextRange(1, 3));
        assertThat(decimal).extracting(Token::value).containsExactly("3.14");
        assertThat(member).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.ACCESSOR, TokenType.IDENTIFIER, TokenType.ACCESSOR, TokenType.IDENTIFIER);
        assertThat(member.get(3).value()).isEqualTo("::");
    }

    /**
     * Verifies that string values exclude the delimiters while the range includes them.
     */
    @Test
    @Tag("unit")
    void testStringLiterals() {
        // Act
        List<Token> tokens = Tokenizer.tokenize("\"hi there\"`raw`");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.STRING_LITERAL, TokenType.STRING_LITERAL);
        assertThat(tokens.get(0).value()).isEqualTo("hi there");
        assertThat(tokens.get(0).range()).isEqualTo(new TextRange(0, 10));
        assertThat(tokens.get(1).value()).isEqualTo("raw");
    }

    @Test
    @Tag("unit")
    void testUnterminatedStringIsReported() {
        TokenizeResult result = new Tokenizer("\"abc").scanTokens();

        assertThat(result.errors()).extracting(LexicalError::kind).containsExactly(LexicalError.Kind.UNTERMINATED_STRING);
        assertThat(result.tokens()).hasSize(1);
        assertThat(result.tokens().get(0).value()).isEqualTo("abc");
    }

    /**
     * Verifies line comments stop before the newline, nested block comments are one token,
     * and positions after a newline start on the next line.
     */
    @Test
    @Tag("unit")
    void testComments() {
        // Act
        List<Token> tokens = Tokenizer.tokenize("// note\n/* a /* b */ c */x");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.COMMENT, TokenType.WHITESPACE, TokenType.COMMENT, TokenType.IDENTIFIER);
        assertThat(tokens.get(0).value()).isEqualTo("// note");
        assertThat(tokens.get(2).range()).isEqualTo(new TextRange(8, 25));
        assertThat(tokens.get(3).position()).isEqualTo(new Position(2, 17));
    }

    @Test
    @Tag("unit")
    void testUnterminatedBlockCommentIsReported() {
        TokenizeResult result = new Tokenizer("/* open /* nested */").scanTokens();

        assertThat(result.errors()).extracting(LexicalError::kind).containsExactly(LexicalError.Kind.UNTERMINATED_COMMENT);
        assertThat(result.tokens()).extracting(Token::type).containsExactly(TokenType.COMMENT);
    }

    /**
     * Verifies that a character no rule accepts is skipped and reported instead of silently dropped.
     */
    @Test
    @Tag("unit")
    void testUnknownCharacterIsReported() {
        // Act
        TokenizeResult result = new Tokenizer("a @ b").scanTokens();

        // Assert
        assertThat(result.errors()).hasSize(1);
        LexicalError error = result.errors().get(0);
        assertThat(error.kind()).isEqualTo(LexicalError.Kind.UNKNOWN_CHARACTER);
        assertThat(error.range()).isEqualTo(new TextRange(2, 3));
        assertThat(result.tokens().stream().filter(t -> t.is(TokenType.IDENTIFIER))).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testPunctuation() {
        List<Token> tokens = Tokenizer.tokenize("([{}]),;\\:");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LEFT_PARENTHESIS, TokenType.LEFT_BRACKET, TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE,
                TokenType.RIGHT_BRACKET, TokenType.RIGHT_PARENTHESIS, TokenType.COMMA, TokenType.STATEMENT_END,
                TokenType.BACKSLASH, TokenType.COLON);
    }

    /**
     * Verifies that Unicode spaces outside {@link Character#isWhitespace(char)} separate tokens
     * and end keywords like ordinary spaces.
     */
    @Test
    @Tag("unit")
    void testUnicodeWhitespace() {
        // Act
        TokenizeResult result = new Tokenizer("var\u00A0x\u00A0=\u00A01;").scanTokens();
        TokenizeResult spacesOnly = new Tokenizer("\u00A0\u2007\u202F\u0085").scanTokens();

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.tokens()).extracting(Token::type).containsExactly(
                TokenType.KEYWORD, TokenType.WHITESPACE, TokenType.IDENTIFIER, TokenType.WHITESPACE,
                TokenType.OPERATOR, TokenType.WHITESPACE, TokenType.NUMBER, TokenType.STATEMENT_END);
        assertThat(result.tokens().get(0).keyword()).isEqualTo(Keyword.VAR);
        assertThat(spacesOnly.hasErrors()).isFalse();
        assertThat(spacesOnly.tokens()).extracting(Token::type).containsExactly(TokenType.WHITESPACE);
    }

    @Test
    @Tag("unit")
    void testBlockCommentEdges() {
        List<Token> tokens = Tokenizer.tokenize("/**/x/* **/y");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.COMMENT, TokenType.IDENTIFIER, TokenType.COMMENT, TokenType.IDENTIFIER);
        assertThat(tokens.get(0).range()).isEqualTo(new TextRange(0, 4));
        assertThat(tokens.get(2).range()).isEqualTo(new TextRange(5, 11));
    }
}
