package com.bank.txnrisk.exception;

/**
 * The request cannot be scored: a required field is missing or a field is
 * outside its domain. Never turned into a decision.
 */
public class InvalidTransactionException extends RuntimeException {

    private final String field;

    public InvalidTransactionException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
