package com.coinbase.x402quote.model;

/** Thrown when a money amount cannot be parsed or represented in token base units. */
public class InvalidAmountException extends RuntimeException {
    public InvalidAmountException(String message) {
        super(message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(message, cause);
    }
}
