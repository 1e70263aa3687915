package com.xammer.costhub.exception;

public class CircuitOpenException extends RuntimeException {

    private final String circuitName;

    public CircuitOpenException(String circuitName) {
        super("Circuit breaker is open for " + circuitName + ", call rejected");
        this.circuitName = circuitName;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
