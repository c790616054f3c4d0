package com.cred.freestyle.pos.api.dto;

import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.OrderLine;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Sale header plus its lines.
 *
 * @author POS Team
 */
public class SaleDetailResponse {

    private OrderSummaryResponse order;
    private List<Line> lines;

    public SaleDetailResponse() {
    }

    /**
     * Create response from an order whose lines and items are loaded.
     *
     * @param order Order entity
     * @return SaleDetailResponse
     */
    public static SaleDetailResponse fromEntity(Order order) {
        SaleDetailResponse response = new SaleDetailResponse();
        response.setOrder(OrderSummaryResponse.fromEntity(order));
        response.setLines(order.getLines().stream()
                .map(Line::fromEntity)
                .collect(Collectors.toList()));
        return response;
    }

    public OrderSummaryResponse getOrder() {
        return order;
    }

    public void setOrder(OrderSummaryResponse order) {
        this.order = order;
    }

    public List<Line> getLines() {
        return lines;
    }

    public void setLines(List<Line> lines) {
        this.lines = lines;
    }

    /**
     * One sale line with the item's current name and price.
     */
    public static class Line {

        private Long orderLineId;
        private Long itemId;
        private String name;
        private BigDecimal price;
        private Integer quantity;

        public static Line fromEntity(OrderLine orderLine) {
            Line line = new Line();
            line.setOrderLineId(orderLine.getOrderLineId());
            line.setItemId(orderLine.getItemId());
            line.setName(orderLine.getItem().getName());
            line.setPrice(orderLine.getItem().getPrice());
            line.setQuantity(orderLine.getQuantity());
            return line;
        }

        public Long getOrderLineId() {
            return orderLineId;
        }

        public void setOrderLineId(Long orderLineId) {
            this.orderLineId = orderLineId;
        }

        public Long getItemId() {
            return itemId;
        }

        public void setItemId(Long itemId) {
            this.itemId = itemId;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public BigDecimal getPrice() {
            return price;
        }

        public void setPrice(BigDecimal price) {
            this.price = price;
        }

        public Integer getQuantity() {
            return quantity;
        }

        public void setQuantity(Integer quantity) {
            this.quantity = quantity;
        }
    }
}
