package com.libragraph.boxes.core.text;

/**
 * Thrown when box text does not match the grammar.
 */
public class ParseException extends RuntimeException {

    private final int position;
    private final String reason;

    public ParseException(int position, String reason) {
        this(position, reason, null);
    }

    public ParseException(int position, String reason, Throwable cause) {
        super("Parse error at offset " + position + ": " + reason, cause);
        this.position = position;
        this.reason = reason;
    }

    /**
     * Zero-based character offset where parsing failed.
     */
    public int position() {
        return position;
    }

    public String reason() {
        return reason;
    }
}
