package com.cred.freestyle.pos.exception;

/**
 * Exception thrown when an item's stock cannot cover the quantity a sale needs.
 * Raised under the item row lock; the surrounding transaction is rolled back
 * so no partial deduction survives.
 *
 * @author POS Team
 */
public class InsufficientStockException extends RuntimeException {

    private final Long itemId;
    private final Integer requestedQuantity;
    private final Integer availableQuantity;

    public InsufficientStockException(Long itemId, Integer requestedQuantity, Integer availableQuantity) {
        super(String.format("Insufficient stock for item %d. Requested: %d, Available: %d",
                itemId, requestedQuantity, availableQuantity));
        this.itemId = itemId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public Long getItemId() {
        return itemId;
    }

    public Integer getRequestedQuantity() {
        return requestedQuantity;
    }

    public Integer getAvailableQuantity() {
        return availableQuantity;
    }
}
