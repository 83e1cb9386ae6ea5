package com.polymix.arb.core;

public class VenueClientException extends RuntimeException {

    public VenueClientException(String message) {
        super(message);
    }

    public VenueClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
