package com.paymentsengine.common.exception;

/**
 * Base exception for all payments engine exceptions.
 */
public class PaymentsEngineException extends RuntimeException {

    public PaymentsEngineException(String message) {
        super(message);
    }

    public PaymentsEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
