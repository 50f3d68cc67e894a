package com.exprgraph.parse;

/**
 * Thrown when expression text cannot be parsed.
 *
 * Parse failures are always recoverable: the caller keeps its previous
 * compiled state. The {@link #kind()} distinguishes the failure for hosts that
 * report it to the user, and {@link #position()} is the character offset of the
 * offending token.
 */
public class ExpressionParseException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final ParseErrorKind kind;
    private final int position;

    public ExpressionParseException(ParseErrorKind kind, String message, int position) {
        super(message + " at pos " + position);
        this.kind = kind;
        this.position = position;
    }

    public ParseErrorKind kind() {
        return kind;
    }

    public int position() {
        return position;
    }
}
