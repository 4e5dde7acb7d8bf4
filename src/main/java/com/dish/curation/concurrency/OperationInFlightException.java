package com.dish.curation.concurrency;

/**
 * Thrown when an operation is submitted while an identical one has not settled yet.
 */
public class OperationInFlightException extends RuntimeException {

    private final String operationKey;

    public OperationInFlightException(String operationKey) {
        super("Operation already in flight: " + operationKey);
        this.operationKey = operationKey;
    }

    public String getOperationKey() {
        return operationKey;
    }
}
