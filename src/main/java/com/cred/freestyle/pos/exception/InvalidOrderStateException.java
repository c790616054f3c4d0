package com.cred.freestyle.pos.exception;

/**
 * Exception thrown when an operation does not apply to the order it targets,
 * e.g. job order completion requested for an order without job order items.
 *
 * @author POS Team
 */
public class InvalidOrderStateException extends RuntimeException {

    private final Long orderId;

    public InvalidOrderStateException(Long orderId, String message) {
        super(message);
        this.orderId = orderId;
    }

    public Long getOrderId() {
        return orderId;
    }
}
