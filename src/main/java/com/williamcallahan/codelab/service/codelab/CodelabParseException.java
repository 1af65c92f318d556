package com.williamcallahan.codelab.service.codelab;

import java.util.Objects;

/**
 * Signals a fatal failure while parsing a codelab document or fragment.
 */
public class CodelabParseException extends IllegalStateException {

    private final ParseFailure failure;

    /**
     * Creates a parse exception for a named failure.
     *
     * @param failure failure condition
     * @param detail additional context appended to the message, may be null
     */
    public CodelabParseException(ParseFailure failure, String detail) {
        super(message(failure, detail));
        this.failure = Objects.requireNonNull(failure, "Parse failure cannot be null");
    }

    /**
     * Creates a parse exception wrapping a collaborator failure.
     *
     * @param failure failure condition
     * @param cause the underlying failure
     */
    public CodelabParseException(ParseFailure failure, Throwable cause) {
        super(message(failure, cause == null ? null : cause.getMessage()), cause);
        this.failure = Objects.requireNonNull(failure, "Parse failure cannot be null");
    }

    public ParseFailure failure() {
        return failure;
    }

    private static String message(ParseFailure failure, String detail) {
        if (detail == null || detail.isBlank()) {
            return failure.description();
        }
        return failure.description() + ": " + detail;
    }
}
