package org.surn.compiler.frontend.parser;

/**
 * Thrown by a parser production that has committed to a construct and cannot complete it.
 * Sibling productions never catch it; it ends the parse of the file.
 */
public class ParserException extends Exception {

    private final ParseError error;

    /**
     * @param error The error being raised.
     */
    public ParserException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    /**
     * @return The error being raised.
     */
    public ParseError getError() {
        return error;
    }
}
