package com.cred.freestyle.pos.api.dto;

import com.cred.freestyle.pos.domain.model.Item;

import java.math.BigDecimal;

/**
 * Minimal item view for point-of-sale selects.
 *
 * @author POS Team
 */
public class CatalogItemResponse {

    private Long itemId;
    private String name;
    private BigDecimal price;
    private Integer stockQuantity;

    public CatalogItemResponse() {
    }

    public static CatalogItemResponse fromEntity(Item item) {
        CatalogItemResponse response = new CatalogItemResponse();
        response.setItemId(item.getItemId());
        response.setName(item.getName());
        response.setPrice(item.getPrice());
        response.setStockQuantity(item.getStockQuantity());
        return response;
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

    public Integer getStockQuantity() {
        return stockQuantity;
    }

    public void setStockQuantity(Integer stockQuantity) {
        this.stockQuantity = stockQuantity;
    }
}
