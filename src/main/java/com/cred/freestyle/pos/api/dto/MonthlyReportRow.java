package com.cred.freestyle.pos.api.dto;

import com.cred.freestyle.pos.domain.model.Item;
import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.OrderLine;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One line of a monthly sales report.
 *
 * @author POS Team
 */
public class MonthlyReportRow {

    private static final String DEFAULT_UNIT = "pcs";

    private Long orderId;
    private String receiptNumber;
    private String payer;
    private Instant date;
    private Integer qtySold;
    private String unit;
    private String description;
    private BigDecimal unitCost;
    private BigDecimal totalCost;

    public MonthlyReportRow() {
    }

    /**
     * Create a row from an order line whose order and item are loaded.
     * Costs use the item's current price.
     *
     * @param line Order line
     * @return MonthlyReportRow
     */
    public static MonthlyReportRow fromLine(OrderLine line) {
        Order order = line.getOrder();
        Item item = line.getItem();

        MonthlyReportRow row = new MonthlyReportRow();
        row.setOrderId(order.getOrderId());
        row.setReceiptNumber(order.getReceiptNumber());
        row.setPayer(order.getCustomerName());
        row.setDate(order.getCompletedAt());
        row.setQtySold(line.getQuantity());
        row.setUnit(item.getUnit() != null ? item.getUnit() : DEFAULT_UNIT);
        row.setDescription(item.getName());
        row.setUnitCost(item.getPrice());
        row.setTotalCost(item.getPrice().multiply(BigDecimal.valueOf(line.getQuantity())));
        return row;
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

    public String getPayer() {
        return payer;
    }

    public void setPayer(String payer) {
        this.payer = payer;
    }

    public Instant getDate() {
        return date;
    }

    public void setDate(Instant date) {
        this.date = date;
    }

    public Integer getQtySold() {
        return qtySold;
    }

    public void setQtySold(Integer qtySold) {
        this.qtySold = qtySold;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getUnitCost() {
        return unitCost;
    }

    public void setUnitCost(BigDecimal unitCost) {
        this.unitCost = unitCost;
    }

    public BigDecimal getTotalCost() {
        return totalCost;
    }

    public void setTotalCost(BigDecimal totalCost) {
        this.totalCost = totalCost;
    }
}
