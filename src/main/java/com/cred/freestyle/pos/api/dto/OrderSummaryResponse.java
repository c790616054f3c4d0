package com.cred.freestyle.pos.api.dto;

import com.cred.freestyle.pos.domain.model.Order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order header as shown in transaction lists and finalization responses.
 *
 * @author POS Team
 */
public class OrderSummaryResponse {

    private Long orderId;
    private String receiptNumber;
    private String customerName;
    private BigDecimal totalPrice;
    private Instant completedAt;
    private String status;
    private String username;

    public OrderSummaryResponse() {
    }

    /**
     * Create response from Order entity.
     *
     * @param order Order entity
     * @return OrderSummaryResponse
     */
    public static OrderSummaryResponse fromEntity(Order order) {
        OrderSummaryResponse response = new OrderSummaryResponse();
        response.setOrderId(order.getOrderId());
        response.setReceiptNumber(order.getReceiptNumber());
        response.setCustomerName(order.getCustomerName());
        response.setTotalPrice(order.getTotalPrice());
        response.setCompletedAt(order.getCompletedAt());
        response.setStatus(order.getStatus().name());
        if (order.getUser() != null) {
            response.setUsername(order.getUser().getUsername());
        }
        return response;
    }

    // Getters and setters
    public Long getOrderId() {
        return orderId;
    }

    public void setOrderId(Long orderId) {
        this.orderId = orderId;
    }

    public String getReceiptNumber() {
        return receiptNumber;
    }

    public void setReceiptNumber(String receiptNumber) {
        this.receiptNumber = receiptNumber;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }

    public BigDecimal getTotalPrice() {
        return totalPrice;
    }

    public void setTotalPrice(BigDecimal totalPrice) {
        this.totalPrice = totalPrice;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }
}
