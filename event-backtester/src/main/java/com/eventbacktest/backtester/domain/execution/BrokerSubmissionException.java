package com.eventbacktest.backtester.domain.execution;

/**
 * Thrown when an order cannot be handed to the broker.
 */
public class BrokerSubmissionException extends RuntimeException {

    private final int orderId;

    public BrokerSubmissionException(int orderId, String message) {
        super(String.format("Order %d submission failed: %s", orderId, message));
        this.orderId = orderId;
    }

    public BrokerSubmissionException(int orderId, String message, Throwable cause) {
        super(String.format("Order %d submission failed: %s", orderId, message), cause);
        this.orderId = orderId;
    }

    public int getOrderId() {
        return orderId;
    }
}
