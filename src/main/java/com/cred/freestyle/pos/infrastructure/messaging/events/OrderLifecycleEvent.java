package com.cred.freestyle.pos.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event describing a change in an order's lifecycle.
 * Published to Kafka after the change commits; consumed by activity logging
 * and reporting.
 *
 * Event Types:
 * - SALE_CREATED: Draft sale recorded (no stock impact)
 * - ORDER_FINALIZED: Receipt number assigned
 * - JOB_ORDER_FINALIZED: Job order completion date set
 * - ORDER_DELETED: Order and its lines removed
 *
 * @author POS Team
 */
public class OrderLifecycleEvent {

    private Long orderId;
    private EventType eventType;
    private String receiptNumber;
    private BigDecimal totalPrice;
    private boolean stockDeducted;
    private String actor;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public OrderLifecycleEvent() {
    }

    public OrderLifecycleEvent(
            Long orderId,
            EventType eventType,
            String receiptNumber,
            BigDecimal totalPrice,
            boolean stockDeducted,
            String actor
    ) {
        this.orderId = orderId;
        this.eventType = eventType;
        this.receiptNumber = receiptNumber;
        this.totalPrice = totalPrice;
        this.stockDeducted = stockDeducted;
        this.actor = actor;
        this.timestamp = Instant.now();
    }

    public Long getOrderId() {
        return orderId;
    }

    public void setOrderId(Long orderId) {
        this.orderId = orderId;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getReceiptNumber() {
        return receiptNumber;
    }

    public void setReceiptNumber(String receiptNumber) {
        this.receiptNumber = receiptNumber;
    }

    public BigDecimal getTotalPrice() {
        return totalPrice;
    }

    public void setTotalPrice(BigDecimal totalPrice) {
        this.totalPrice = totalPrice;
    }

    public boolean isStockDeducted() {
        return stockDeducted;
    }

    public void setStockDeducted(boolean stockDeducted) {
        this.stockDeducted = stockDeducted;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public enum EventType {
        SALE_CREATED,
        ORDER_FINALIZED,
        JOB_ORDER_FINALIZED,
        ORDER_DELETED
    }
}
