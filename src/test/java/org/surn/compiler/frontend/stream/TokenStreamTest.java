package org.surn.compiler.frontend.stream;

import org.surn.compiler.frontend.lexer.Token;
import org.surn.compiler.frontend.lexer.TokenType;
import org.surn.compiler.frontend.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link TokenStream}.
 */
public class TokenStreamTest {

    /**
     * Verifies that lookahead leaves the stream untouched and peek consumes exactly one token.
     */
    @Test
    @Tag("unit")
    void testLookaheadAndPeek() {
        // Arrange
        TokenStream stream = new TokenStream(Tokenizer.tokenize("a b"));

        // Act
        Optional<Token> first = stream.first();
        Optional<Token> second = stream.second();
        Optional<Token> consumed = stream.peek();

        // Assert
        assertThat(first).get().extracting(Token::value).isEqualTo("a");
        assertThat(second).get().extracting(Token::type).isEqualTo(TokenType.WHITESPACE);
        assertThat(consumed).isEqualTo(first);
        assertThat(stream.previous()).isEqualTo(first);
        assertThat(stream.eaten()).isEqualTo(1);
        assertThat(stream.remaining()).isEqualTo(2);
    }

    /**
     * Verifies that findAfter skips the allowed tokens and stops at the first token matching neither predicate.
     */
    @Test
    @Tag("unit")
    void testFindAfterSkipsOnlyAllowedTokens() {
        // Arrange
        TokenStream stream = new TokenStream(Tokenizer.tokenize("  /* c */ x ; y"));

        // Act
        Optional<TokenStream.Match> identifier = stream.findAfter(t -> t.is(TokenType.IDENTIFIER), Token::isTrivia);
        Optional<TokenStream.Match> blocked = stream.findAfterNth(identifier.get().distance() + 1,
                t -> t.value() != null && t.value().equals("y"), Token::isTrivia);

        // Assert
        assertThat(identifier).get().extracting(TokenStream.Match::distance).isEqualTo(3);
        assertThat(blocked).isEmpty();
        assertThat(stream.eaten()).isZero();
    }

    /**
     * Verifies that peekUntil consumes everything before the found token but leaves the token itself.
     */
    @Test
    @Tag("unit")
    void testPeekUntilLeavesFoundTokenAtHead() {
        // Arrange
        TokenStream stream = new TokenStream(Tokenizer.tokenize("   x"));

        // Act
        Optional<Token> found = stream.peekUntil(t -> !t.isTrivia());

        // Assert
        assertThat(found).get().extracting(Token::value).isEqualTo("x");
        assertThat(stream.first()).isEqualTo(found);
        assertThat(stream.eaten()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testExhaustedStream() {
        TokenStream stream = new TokenStream(Tokenizer.tokenize("a"));

        stream.advance(5);

        assertThat(stream.isEof()).isTrue();
        assertThat(stream.peek()).isEmpty();
        assertThat(stream.peekUntil(t -> true)).isEmpty();
        assertThat(stream.previous()).get().extracting(Token::value).isEqualTo("a");
        assertThat(stream.nth(-1)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testPeekIfOnlyConsumesMatchingToken() {
        TokenStream stream = new TokenStream(Tokenizer.tokenize("; x"));

        assertThat(stream.peekIf(t -> t.is(TokenType.COMMA))).isEmpty();
        assertThat(stream.peekIf(t -> t.is(TokenType.STATEMENT_END))).isPresent();
        assertThat(stream.firstIf(Token::isTrivia)).isPresent();
        assertThat(stream.secondIf(t -> t.is(TokenType.IDENTIFIER))).isPresent();
        assertThat(stream.nthIf(1, t -> t.is(TokenType.COMMA))).isEmpty();
    }
}
