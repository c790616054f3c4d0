package com.cred.freestyle.pos.repository;

import com.cred.freestyle.pos.domain.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Order entity.
 * Provides the order-row lock that serializes finalization of the same order.
 *
 * @author POS Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * Find order by ID with pessimistic write lock.
     * Held until the surrounding transaction commits or rolls back; a second
     * finalization of the same order blocks here and then sees the committed state.
     *
     * @param orderId Order ID
     * @return Optional containing the order if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLock(@Param("orderId") Long orderId);

    /**
     * Find order with its lines and their items loaded.
     *
     * @param orderId Order ID
     * @return Optional containing the order if found
     */
    @Query("SELECT DISTINCT o FROM Order o LEFT JOIN FETCH o.lines l LEFT JOIN FETCH l.item " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findWithLinesById(@Param("orderId") Long orderId);

    /**
     * Check whether another order already holds a receipt number.
     *
     * @param receiptNumber Receipt (OR) number
     * @param orderId Order to exclude from the check
     * @return true if a different order has this receipt number
     */
    boolean existsByReceiptNumberAndOrderIdNot(String receiptNumber, Long orderId);

    /**
     * Orders without any line in the given category (normal point-of-sale transactions).
     *
     * @param category Deferred-fulfillment category
     * @return Orders, newest completion first, drafts last
     */
    @Query("SELECT o FROM Order o WHERE NOT EXISTS (" +
           "SELECT l.orderLineId FROM OrderLine l WHERE l.order = o AND l.item.category = :category) " +
           "ORDER BY o.completedAt DESC NULLS LAST, o.orderId DESC")
    List<Order> findOrdersWithoutCategory(@Param("category") String category);

    /**
     * Orders with at least one line in the given category (job orders).
     *
     * @param category Deferred-fulfillment category
     * @return Orders, newest completion first, drafts last
     */
    @Query("SELECT o FROM Order o WHERE EXISTS (" +
           "SELECT l.orderLineId FROM OrderLine l WHERE l.order = o AND l.item.category = :category) " +
           "ORDER BY o.completedAt DESC NULLS LAST, o.orderId DESC")
    List<Order> findOrdersWithCategory(@Param("category") String category);
}
