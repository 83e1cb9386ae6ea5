package com.polymix.arb.core;

public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
