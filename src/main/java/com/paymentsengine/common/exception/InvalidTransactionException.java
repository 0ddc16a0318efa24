package com.paymentsengine.common.exception;

/**
 * Thrown when an input record cannot be turned into a transaction.
 */
public class InvalidTransactionException extends PaymentsEngineException {

    public InvalidTransactionException(String message) {
        super(message);
    }

    public InvalidTransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
