package com.routewise.core.engine;

/**
 * Base for errors raised by the routing core.
 */
public class RoutingException extends RuntimeException {
    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
