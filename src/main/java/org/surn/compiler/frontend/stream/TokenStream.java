package org.surn.compiler.frontend.stream;

import org.surn.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A buffered lookahead and consumption wrapper over a token list. This is the only
 * token-level API the parser uses.
 * <p>
 * {@link #first()}, {@link #second()}, {@link #nth(int)} and the {@code find*} methods never
 * consume; {@link #peek()} always consumes exactly one token.
 */
public class TokenStream {

    /**
     * A token located ahead of the stream head.
     *
     * @param distance The number of tokens between the head and the found token; 0 is the head itself.
     * @param token    The found token.
     */
    public record Match(int distance, Token token) {
    }

    private final List<Token> tokens;
    private int current = 0;
    private Token previous;

    /**
     * Creates a stream positioned at the first token.
     * @param tokens The tokens to stream.
     */
    public TokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * @return {@code true} once every token has been consumed.
     */
    public boolean isEof() {
        return current >= tokens.size();
    }

    /**
     * @return The next token, or empty if the stream is exhausted.
     */
    public Optional<Token> first() {
        return nth(0);
    }

    /**
     * @return The token after the next one, or empty.
     */
    public Optional<Token> second() {
        return nth(1);
    }

    /**
     * Looks ahead without consuming.
     * @param n The distance from the head, 0 being the next token.
     * @return The token, or empty past the end.
     */
    public Optional<Token> nth(int n) {
        int index = current + n;
        if (n < 0 || index >= tokens.size()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(index));
    }

    /**
     * @param predicate The condition.
     * @return The next token if it exists and satisfies the predicate, without consuming it.
     */
    public Optional<Token> firstIf(Predicate<Token> predicate) {
        return first().filter(predicate);
    }

    /**
     * @param predicate The condition.
     * @return The second token if it exists and satisfies the predicate, without consuming it.
     */
    public Optional<Token> secondIf(Predicate<Token> predicate) {
        return second().filter(predicate);
    }

    /**
     * @param n The distance from the head.
     * @param predicate The condition.
     * @return The n-th token if it exists and satisfies the predicate, without consuming it.
     */
    public Optional<Token> nthIf(int n, Predicate<Token> predicate) {
        return nth(n).filter(predicate);
    }

    /**
     * Consumes exactly one token and records it as {@link #previous()}.
     * @return The consumed token, or empty if the stream is exhausted.
     */
    public Optional<Token> peek() {
        if (isEof()) {
            return Optional.empty();
        }
        previous = tokens.get(current++);
        return Optional.of(previous);
    }

    /**
     * Consumes the next token only if it satisfies the predicate.
     * @param predicate The condition.
     * @return The consumed token, or empty if nothing was consumed.
     */
    public Optional<Token> peekIf(Predicate<Token> predicate) {
        if (firstIf(predicate).isEmpty()) {
            return Optional.empty();
        }
        return peek();
    }

    /**
     * Consumes tokens as long as the predicate is false and returns the first token for
     * which it holds. That token stays at the head of the stream.
     * @param predicate The condition to stop at.
     * @return The token satisfying the predicate, or empty if the stream ran out first.
     */
    public Optional<Token> peekUntil(Predicate<Token> predicate) {
        while (!isEof()) {
            Token token = tokens.get(current);
            if (predicate.test(token)) {
                return Optional.of(token);
            }
            peek();
        }
        return Optional.empty();
    }

    /**
     * Scans ahead without consuming, skipping tokens that match {@code after}, and returns the
     * first token matching {@code find}. Scanning stops at the first token that matches neither.
     * @param find The token to look for.
     * @param after The tokens that may be skipped on the way.
     * @return The match with its distance from the head, or empty.
     */
    public Optional<Match> findAfter(Predicate<Token> find, Predicate<Token> after) {
        return findAfterNth(0, find, after);
    }

    /**
     * Like {@link #findAfter(Predicate, Predicate)} but starts scanning {@code n} tokens ahead.
     * @param n The distance to start at.
     * @param find The token to look for.
     * @param after The tokens that may be skipped on the way.
     * @return The match with its distance from the head, or empty.
     */
    public Optional<Match> findAfterNth(int n, Predicate<Token> find, Predicate<Token> after) {
        for (int distance = Math.max(0, n); current + distance < tokens.size(); distance++) {
            Token token = tokens.get(current + distance);
            if (find.test(token)) {
                return Optional.of(new Match(distance, token));
            }
            if (!after.test(token)) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Consumes up to {@code n} tokens.
     * @param n The number of tokens to consume.
     */
    public void advance(int n) {
        for (int i = 0; i < n && !isEof(); i++) {
            peek();
        }
    }

    /**
     * @return The number of tokens consumed so far.
     */
    public int eaten() {
        return current;
    }

    /**
     * @return The number of tokens not yet consumed.
     */
    public int remaining() {
        return tokens.size() - current;
    }

    /**
     * @return The last consumed token, or empty before the first {@link #peek()}.
     */
    public Optional<Token> previous() {
        return Optional.ofNullable(previous);
    }

    /**
     * @return Every token of the stream, consumed ones included.
     */
    public List<Token> items() {
        return tokens;
    }
}
