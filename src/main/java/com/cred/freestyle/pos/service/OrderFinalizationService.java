package com.cred.freestyle.pos.service;

import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.Order.DeductionPath;
import com.cred.freestyle.pos.domain.model.OrderLine;
import com.cred.freestyle.pos.exception.DuplicateReceiptException;
import com.cred.freestyle.pos.exception.InsufficientStockException;
import com.cred.freestyle.pos.exception.InvalidOrderStateException;
import com.cred.freestyle.pos.exception.ResourceNotFoundException;
import com.cred.freestyle.pos.infrastructure.ledger.ItemLedger;
import com.cred.freestyle.pos.infrastructure.messaging.OrderEventPublisher;
import com.cred.freestyle.pos.infrastructure.messaging.events.OrderLifecycleEvent;
import com.cred.freestyle.pos.infrastructure.metrics.PosMetricsService;
import com.cred.freestyle.pos.repository.OrderRepository;
import com.cred.freestyle.pos.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Completes draft orders and applies their stock deduction exactly once.
 *
 * Two paths:
 * - Receipt path: assigns the official receipt number; deducts every line of a
 *   normal order on its first completion
 * - Job order path: sets the completion date only; deducts the deferred-category
 *   lines on first completion
 *
 * Each call is one transaction. The order row is locked first, then item rows.
 * Whether stock is deducted is decided by the order's status read under the
 * order lock, so a repeated or concurrent call for the same order never deducts
 * again.
 *
 * @author POS Team
 */
@Service
public class OrderFinalizationService {

    private static final Logger logger = LoggerFactory.getLogger(OrderFinalizationService.class);

    private final OrderRepository orderRepository;
    private final ItemLedger itemLedger;
    private final FulfillmentClassifier classifier;
    private final OrderEventPublisher eventPublisher;
    private final PosMetricsService metricsService;

    public OrderFinalizationService(
            OrderRepository orderRepository,
            ItemLedger itemLedger,
            FulfillmentClassifier classifier,
            OrderEventPublisher eventPublisher,
            PosMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.itemLedger = itemLedger;
        this.classifier = classifier;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Assign a receipt number and complete the order:
     * 1. Reject the receipt number if another order holds it
     * 2. Lock the order row
     * 3. If the order is still DRAFT and has no deferred-category line: lock its
     *    items, verify every line is covered, deduct every line
     * 4. Set the receipt number; record the completion date if this call completed it
     *
     * Calling again on a FINALIZED order only replaces the receipt number.
     * A job order is completed here without any deduction.
     *
     * @param orderId Order ID
     * @param receiptNumber Official receipt number
     * @return Updated order
     * @throws IllegalArgumentException if the receipt number is blank
     * @throws DuplicateReceiptException if another order holds the receipt number
     * @throws ResourceNotFoundException if the order does not exist
     * @throws InsufficientStockException if a line is not covered; nothing is changed
     */
    @Transactional
    public Order finalizeWithReceipt(Long orderId, String receiptNumber) {
        long startTime = System.currentTimeMillis();

        if (receiptNumber == null || receiptNumber.isBlank()) {
            throw new IllegalArgumentException("Receipt number is required.");
        }
        String receipt = receiptNumber.trim();
        logger.info("Assigning receipt {} to order {}", receipt, orderId);

        if (orderRepository.existsByReceiptNumberAndOrderIdNot(receipt, orderId)) {
            logger.warn("Receipt {} already used by another order, rejecting for order {}", receipt, orderId);
            metricsService.recordRejection("finalize_normal", "DUPLICATE_RECEIPT");
            throw new DuplicateReceiptException(receipt, orderId);
        }

        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));

        boolean alreadyCompleted = order.isFinalized();
        boolean deferredOrder = classifier.requiresDeferredPath(order);
        boolean deducted = false;

        if (!alreadyCompleted && !deferredOrder) {
            List<OrderLine> lines = classifier.normalPathLines(order);
            deductOrReject(lines, "finalize_normal");
            order.recordDeduction(DeductionPath.NORMAL, lines);
            deducted = true;
        } else if (alreadyCompleted) {
            logger.info("Order {} already completed at {}, replacing receipt only", orderId, order.getCompletedAt());
        } else {
            logger.info("Order {} contains job order items, completing without stock deduction", orderId);
        }

        order.setReceiptNumber(receipt);
        order.complete(Instant.now());

        try {
            order = orderRepository.saveAndFlush(order);
        } catch (DataIntegrityViolationException e) {
            // Concurrent assignment of the same receipt to another order
            logger.warn("Receipt {} taken concurrently, rejecting for order {}", receipt, orderId);
            metricsService.recordRejection("finalize_normal", "DUPLICATE_RECEIPT");
            throw new DuplicateReceiptException(receipt, orderId);
        }

        logger.info("Order {} finalized with receipt {}, stock deducted: {}", orderId, receipt, deducted);

        eventPublisher.publish(new OrderLifecycleEvent(
                orderId,
                OrderLifecycleEvent.EventType.ORDER_FINALIZED,
                receipt,
                order.getTotalPrice(),
                deducted,
                SecurityUtils.currentActor()
        ));
        metricsService.recordFinalization(DeductionPath.NORMAL.name(), deducted);
        metricsService.recordLatency("finalize_normal", System.currentTimeMillis() - startTime);
        return order;
    }

    /**
     * Complete a job order by date:
     * 1. Lock the order row
     * 2. Require at least one deferred-category line
     * 3. If the order is still DRAFT: lock the deferred-category items, verify
     *    each line is covered, deduct exactly those lines
     * 4. Record the completion date if it is not set yet
     *
     * The receipt number is not required or touched. Calling again after
     * success changes nothing.
     *
     * @param orderId Order ID
     * @return Updated order
     * @throws ResourceNotFoundException if the order does not exist
     * @throws InvalidOrderStateException if the order has no deferred-category line
     * @throws InsufficientStockException if a line is not covered; nothing is changed
     */
    @Transactional
    public Order finalizeJobOrder(Long orderId) {
        long startTime = System.currentTimeMillis();
        logger.info("Setting job order completion date for order {}", orderId);

        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));

        boolean hadCompletionBefore = order.isFinalized();

        if (!classifier.requiresDeferredPath(order)) {
            logger.warn("Order {} has no '{}' items, job order completion not applicable",
                    orderId, classifier.getDeferredCategory());
            metricsService.recordRejection("finalize_job_order", "NOT_A_JOB_ORDER");
            throw new InvalidOrderStateException(orderId,
                    "Order does not contain any '" + classifier.getDeferredCategory() + "' items");
        }

        boolean deducted = false;
        if (!hadCompletionBefore) {
            List<OrderLine> lines = classifier.deferredLines(order);
            deductOrReject(lines, "finalize_job_order");
            order.recordDeduction(DeductionPath.JOB_ORDER, lines);
            deducted = true;
        } else {
            logger.info("Job order {} already completed at {}, nothing to deduct", orderId, order.getCompletedAt());
        }

        order.complete(Instant.now());
        order = orderRepository.save(order);

        logger.info("Job order {} finalized, stock deducted: {}", orderId, deducted);

        eventPublisher.publish(new OrderLifecycleEvent(
                orderId,
                OrderLifecycleEvent.EventType.JOB_ORDER_FINALIZED,
                order.getReceiptNumber(),
                order.getTotalPrice(),
                deducted,
                SecurityUtils.currentActor()
        ));
        metricsService.recordFinalization(DeductionPath.JOB_ORDER.name(), deducted);
        metricsService.recordLatency("finalize_job_order", System.currentTimeMillis() - startTime);
        return order;
    }

    private void deductOrReject(List<OrderLine> lines, String operation) {
        try {
            itemLedger.deduct(lines);
        } catch (InsufficientStockException e) {
            metricsService.recordRejection(operation, "INSUFFICIENT_STOCK");
            throw e;
        }
    }
}
