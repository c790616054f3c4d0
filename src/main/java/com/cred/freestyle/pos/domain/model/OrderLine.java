package com.cred.freestyle.pos.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

/**
 * One line of a sale. Never updated after insert; removed only with its order.
 *
 * @author POS Team
 */
@Entity
@Immutable
@Table(name = "order_lines", indexes = {
    @Index(name = "idx_order_line_order_id", columnList = "order_id"),
    @Index(name = "idx_order_line_item_id", columnList = "item_id")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"order", "item"})
public class OrderLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_line_id", nullable = false)
    private Long orderLineId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "item_id", nullable = false)
    private Item item;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    public Long getItemId() {
        return item.getItemId();
    }
}
