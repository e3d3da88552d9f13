package com.example.readrouting.exception;

/**
 * Base type for every failure surfaced by the read-routing core.
 */
public class ReadRoutingException extends RuntimeException {

    public ReadRoutingException(String message) {
        super(message);
    }

    public ReadRoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
