package com.cred.freestyle.pos.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Catalog item and its stock balance.
 * The stock quantity is the ledger balance mutated by order finalization and
 * must never go negative.
 *
 * @author POS Team
 */
@Entity
@Table(name = "items", indexes = {
    @Index(name = "idx_item_category", columnList = "category"),
    @Index(name = "idx_item_name", columnList = "name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Item {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * Unit of measure (e.g., "pcs", "box"). Reports fall back to "pcs" when unset.
     */
    @Column(name = "unit", length = 50)
    private String unit;

    /**
     * Item category. One configured category marks deferred-fulfillment (job order) items.
     */
    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "stock_quantity", nullable = false)
    private Integer stockQuantity;

    @Column(name = "reorder_level")
    private Integer reorderLevel;

    /**
     * Check whether the current balance covers the requested quantity.
     *
     * @param quantity Requested quantity, strictly positive
     * @return true if stock_quantity >= quantity
     * @throws IllegalArgumentException if the quantity is not positive
     */
    public boolean hasStockFor(int quantity) {
        requirePositive(quantity);
        return stockQuantity != null && stockQuantity >= quantity;
    }

    /**
     * Remove units from the balance.
     *
     * @param quantity Units to remove, strictly positive
     * @throws IllegalArgumentException if the quantity is not positive
     * @throws IllegalStateException if the balance would go negative
     */
    public void deductStock(int quantity) {
        if (!hasStockFor(quantity)) {
            throw new IllegalStateException(
                    "Stock for item " + itemId + " would go negative: " + stockQuantity + " - " + quantity);
        }
        this.stockQuantity = stockQuantity - quantity;
    }

    /**
     * Return units to the balance.
     *
     * @param quantity Units to return, strictly positive
     * @throws IllegalArgumentException if the quantity is not positive
     */
    public void restoreStock(int quantity) {
        requirePositive(quantity);
        this.stockQuantity = Math.addExact(stockQuantity == null ? 0 : stockQuantity, quantity);
    }

    public boolean isBelowReorderLevel() {
        return reorderLevel != null && stockQuantity != null && stockQuantity <= reorderLevel;
    }

    private void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive for item " + itemId + ": " + quantity);
        }
    }
}
