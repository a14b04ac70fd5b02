package org.surn.compiler.api;

/**
 * Thrown when a source cannot be compiled.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * The message is the rendered report of the first error.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
