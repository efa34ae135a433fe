package com.casebattle.ledger.exception;

/**
 * Thrown when user-supplied amount text is not a decimal numeral or is not strictly positive.
 * Callers report the rejection and ask for a new amount; the ledger is never touched.
 */
public class InvalidAmountException extends RuntimeException {

    private final String rawAmount;

    public InvalidAmountException(String rawAmount, String message) {
        super(message);
        this.rawAmount = rawAmount;
    }

    public InvalidAmountException(String rawAmount, String message, Throwable cause) {
        super(message, cause);
        this.rawAmount = rawAmount;
    }

    public String getRawAmount() {
        return rawAmount;
    }
}
