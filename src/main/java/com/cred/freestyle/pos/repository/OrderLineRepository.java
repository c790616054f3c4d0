package com.cred.freestyle.pos.repository;

import com.cred.freestyle.pos.domain.model.OrderLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for OrderLine entity.
 * Backs the monthly sales reports.
 *
 * @author POS Team
 */
@Repository
public interface OrderLineRepository extends JpaRepository<OrderLine, Long> {

    /**
     * Lines of receipted orders completed in [start, end) that contain no line in the category.
     *
     * @param start Inclusive lower bound on completion time
     * @param end Exclusive upper bound on completion time
     * @param category Deferred-fulfillment category
     * @return Lines ordered by completion time, order ID, line ID
     */
    @Query("SELECT l FROM OrderLine l JOIN FETCH l.order o JOIN FETCH l.item i " +
           "WHERE o.completedAt >= :start AND o.completedAt < :end " +
           "AND o.receiptNumber IS NOT NULL " +
           "AND NOT EXISTS (SELECT l2.orderLineId FROM OrderLine l2 " +
           "WHERE l2.order = o AND l2.item.category = :category) " +
           "ORDER BY o.completedAt, o.orderId, l.orderLineId")
    List<OrderLine> findNormalReportLines(
            @Param("start") Instant start,
            @Param("end") Instant end,
            @Param("category") String category
    );

    /**
     * Category lines of orders completed in [start, end). No receipt requirement.
     *
     * @param start Inclusive lower bound on completion time
     * @param end Exclusive upper bound on completion time
     * @param category Deferred-fulfillment category
     * @return Lines ordered by completion time, order ID, line ID
     */
    @Query("SELECT l FROM OrderLine l JOIN FETCH l.order o JOIN FETCH l.item i " +
           "WHERE o.completedAt >= :start AND o.completedAt < :end " +
           "AND i.category = :category " +
           "ORDER BY o.completedAt, o.orderId, l.orderLineId")
    List<OrderLine> findJobOrderReportLines(
            @Param("start") Instant start,
            @Param("end") Instant end,
            @Param("category") String category
    );
}
