package com.williamcallahan.codelab.service.codelab;

/**
 * Signals a request for a codelab format no registered parser handles.
 */
public class UnknownCodelabFormatException extends IllegalArgumentException {

    private final String format;

    public UnknownCodelabFormatException(String format) {
        super("Unknown codelab format: " + format);
        this.format = format;
    }

    public String format() {
        return format;
    }
}
