package com.paymentsengine.common.exception;

/**
 * Thrown when the transaction source cannot be opened or read.
 * This is the only fatal error of a run.
 */
public class InputSourceException extends PaymentsEngineException {

    private final String source;

    public InputSourceException(String source, String reason) {
        super(String.format("Cannot read transactions from '%s': %s", source, reason));
        this.source = source;
    }

    public InputSourceException(String source, String reason, Throwable cause) {
        super(String.format("Cannot read transactions from '%s': %s", source, reason), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
