package com.rex.gate;

/**
 * A listening port could not be bound, the process can not continue
 */
public class GateStartException extends RuntimeException {

    public GateStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
