package com.cred.freestyle.pos.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sale header.
 *
 * Lifecycle:
 * - Created as DRAFT by sale intake (no receipt, no completion timestamp, no stock impact)
 * - Moved to FINALIZED exactly once by whichever finalizer runs first
 * - Deleted at any time together with its lines
 *
 * The status is FINALIZED if and only if completedAt is set.
 *
 * @author POS Team
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_receipt_number_unique", columnList = "receipt_number", unique = true),
    @Index(name = "idx_completed_at", columnList = "completed_at"),
    @Index(name = "idx_order_user_id", columnList = "user_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"lines", "user", "deductedLineIds"})
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id", nullable = false)
    private Long orderId;

    /**
     * Staff account that rang up the sale.
     */
    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    /**
     * Payer name printed on the receipt.
     */
    @Column(name = "customer_name", nullable = false, length = 255)
    private String customerName;

    /**
     * Sum of price x quantity over all lines, fixed at intake.
     */
    @Column(name = "total_price", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal totalPrice;

    /**
     * Official receipt (OR) number. Unique among non-null values, set only by
     * receipt-based finalization.
     */
    @Column(name = "receipt_number", length = 100, unique = true)
    private String receiptNumber;

    @Column(name = "student_id", length = 50)
    private String studentId;

    @Column(name = "course", length = 100)
    private String course;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private OrderStatus status = OrderStatus.DRAFT;

    /**
     * Transaction date. Set once, by the first successful finalization.
     */
    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Which finalization path deducted this order's stock, if any.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "deduction_path", length = 20)
    private DeductionPath deductionPath;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("orderLineId ASC")
    @Builder.Default
    private List<OrderLine> lines = new ArrayList<>();

    /**
     * Lines whose quantities were taken from stock at finalization.
     */
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "order_deducted_lines", joinColumns = @JoinColumn(name = "order_id"))
    @Column(name = "order_line_id", nullable = false)
    @Builder.Default
    private Set<Long> deductedLineIds = new HashSet<>();

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (status == null) {
            status = OrderStatus.DRAFT;
        }
    }

    /**
     * Attach a line to this order.
     *
     * @param item Item sold
     * @param quantity Units sold, strictly positive
     * @return The new line
     */
    public OrderLine addLine(Item item, int quantity) {
        OrderLine line = new OrderLine(null, this, item, quantity);
        lines.add(line);
        return line;
    }

    public boolean isFinalized() {
        return status == OrderStatus.FINALIZED;
    }

    /**
     * Move DRAFT to FINALIZED. Must run while the order row is locked.
     * A FINALIZED order is left untouched, including its completion timestamp.
     *
     * @param completionTime Completion timestamp to record
     * @return true if this call performed the transition
     */
    public boolean complete(Instant completionTime) {
        if (status == OrderStatus.FINALIZED) {
            return false;
        }
        this.status = OrderStatus.FINALIZED;
        this.completedAt = completionTime;
        return true;
    }

    public boolean isStockDeducted() {
        return deductionPath != null;
    }

    /**
     * Record which path deducted stock and exactly which lines it took.
     * Must run in the same transaction as the deduction.
     *
     * @param path Finalization path that deducted
     * @param deductedLines Lines whose quantities were deducted
     */
    public void recordDeduction(DeductionPath path, Collection<OrderLine> deductedLines) {
        this.deductionPath = path;
        deductedLineIds.clear();
        for (OrderLine line : deductedLines) {
            deductedLineIds.add(line.getOrderLineId());
        }
    }

    /**
     * @return Lines deducted at finalization, empty if nothing was deducted
     */
    public List<OrderLine> getDeductedLines() {
        return lines.stream()
                .filter(line -> deductedLineIds.contains(line.getOrderLineId()))
                .collect(Collectors.toList());
    }

    /**
     * Order completion state.
     */
    public enum OrderStatus {
        DRAFT,      // Validated, priced, no stock impact
        FINALIZED   // Completed; applicable stock deducted
    }

    /**
     * Finalization path that applied the stock deduction.
     */
    public enum DeductionPath {
        NORMAL,     // Receipt-based, all lines of a non-deferred order
        JOB_ORDER   // Timestamp-based, deferred-category lines only
    }
}
