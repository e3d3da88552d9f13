package com.example.readrouting.exception;

/**
 * Invalid topology or routing setup, e.g. an empty replica set handed to the sticky router.
 */
public class RoutingConfigurationException extends ReadRoutingException {

    public RoutingConfigurationException(String message) {
        super(message);
    }

    public RoutingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
