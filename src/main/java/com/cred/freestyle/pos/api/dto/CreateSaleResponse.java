package com.cred.freestyle.pos.api.dto;

import com.cred.freestyle.pos.domain.model.Order;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a recorded draft sale.
 *
 * @author POS Team
 */
public class CreateSaleResponse {

    private Long saleId;
    private BigDecimal totalPrice;
    private List<SaleItemRequest> items;

    public CreateSaleResponse() {
    }

    /**
     * Create response from the saved draft order, echoing its lines.
     *
     * @param order Draft order
     * @return CreateSaleResponse
     */
    public static CreateSaleResponse fromEntity(Order order) {
        CreateSaleResponse response = new CreateSaleResponse();
        response.setSaleId(order.getOrderId());
        response.setTotalPrice(order.getTotalPrice());
        response.setItems(order.getLines().stream()
                .map(line -> new SaleItemRequest(line.getItemId(), line.getQuantity()))
                .collect(Collectors.toList()));
        return response;
    }

    public Long getSaleId() {
        return saleId;
    }

    public void setSaleId(Long saleId) {
        this.saleId = saleId;
    }

    public BigDecimal getTotalPrice() {
        return totalPrice;
    }

    public void setTotalPrice(BigDecimal totalPrice) {
        this.totalPrice = totalPrice;
    }

    public List<SaleItemRequest> getItems() {
        return items;
    }

    public void setItems(List<SaleItemRequest> items) {
        this.items = items;
    }
}
