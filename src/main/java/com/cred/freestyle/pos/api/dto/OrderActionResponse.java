package com.cred.freestyle.pos.api.dto;

/**
 * Acknowledgement of an order mutation, with the resulting order when there is one.
 *
 * @author POS Team
 */
public class OrderActionResponse {

    private String message;
    private OrderSummaryResponse order;

    public OrderActionResponse() {
    }

    public OrderActionResponse(String message, OrderSummaryResponse order) {
        this.message = message;
        this.order = order;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public OrderSummaryResponse getOrder() {
        return order;
    }

    public void setOrder(OrderSummaryResponse order) {
        this.order = order;
    }
}
