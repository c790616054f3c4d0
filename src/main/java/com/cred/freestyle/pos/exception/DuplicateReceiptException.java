package com.cred.freestyle.pos.exception;

/**
 * Exception thrown when a receipt (OR) number is already held by another order.
 *
 * @author POS Team
 */
public class DuplicateReceiptException extends RuntimeException {

    private final String receiptNumber;
    private final Long orderId;

    public DuplicateReceiptException(String receiptNumber, Long orderId) {
        super(String.format("Receipt number %s is not unique", receiptNumber));
        this.receiptNumber = receiptNumber;
        this.orderId = orderId;
    }

    public String getReceiptNumber() {
        return receiptNumber;
    }

    /**
     * @return The order the receipt was being assigned to
     */
    public Long getOrderId() {
        return orderId;
    }
}
