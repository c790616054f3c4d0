package com.cred.freestyle.pos.service;

import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.OrderLine;
import com.cred.freestyle.pos.exception.ResourceNotFoundException;
import com.cred.freestyle.pos.infrastructure.ledger.ItemLedger;
import com.cred.freestyle.pos.infrastructure.messaging.OrderEventPublisher;
import com.cred.freestyle.pos.infrastructure.messaging.events.OrderLifecycleEvent;
import com.cred.freestyle.pos.infrastructure.metrics.PosMetricsService;
import com.cred.freestyle.pos.repository.OrderRepository;
import com.cred.freestyle.pos.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Order deletion and transaction listings.
 *
 * @author POS Team
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final ItemLedger itemLedger;
    private final FulfillmentClassifier classifier;
    private final OrderEventPublisher eventPublisher;
    private final PosMetricsService metricsService;
    private final boolean restockFinalized;

    public OrderService(
            OrderRepository orderRepository,
            ItemLedger itemLedger,
            FulfillmentClassifier classifier,
            OrderEventPublisher eventPublisher,
            PosMetricsService metricsService,
            @Value("${pos.orders.deletion.restock-finalized:false}") boolean restockFinalized
    ) {
        this.orderRepository = orderRepository;
        this.itemLedger = itemLedger;
        this.classifier = classifier;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.restockFinalized = restockFinalized;
    }

    /**
     * Delete an order and all of its lines.
     *
     * Stock is left as is unless restocking of finalized orders is enabled, in
     * which case exactly the lines recorded at finalization are returned, even if
     * an item's category has changed since.
     * A draft never deducted anything, so deleting it never touches stock.
     *
     * @param orderId Order ID
     * @throws ResourceNotFoundException if the order does not exist
     */
    @Transactional
    public void deleteOrder(Long orderId) {
        logger.info("Deleting order: {}", orderId);

        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));

        boolean restocked = false;
        if (restockFinalized && order.isStockDeducted()) {
            List<OrderLine> deductedLines = order.getDeductedLines();
            itemLedger.restore(deductedLines);
            restocked = true;
            logger.info("Restored stock for {} lines of order {}", deductedLines.size(), orderId);
        } else if (order.isStockDeducted()) {
            logger.info("Order {} was finalized via {}, deducted stock is not restored",
                    orderId, order.getDeductionPath());
        }

        orderRepository.delete(order);
        logger.info("Deleted order: {}", orderId);

        eventPublisher.publish(new OrderLifecycleEvent(
                orderId,
                OrderLifecycleEvent.EventType.ORDER_DELETED,
                order.getReceiptNumber(),
                order.getTotalPrice(),
                false,
                SecurityUtils.currentActor()
        ));
        metricsService.recordOrderDeleted(restocked);
    }

    /**
     * Point-of-sale transactions: orders with no deferred-category line.
     *
     * @return Orders, newest completion first, drafts last
     */
    @Transactional(readOnly = true)
    public List<Order> getTransactions() {
        return orderRepository.findOrdersWithoutCategory(classifier.getDeferredCategory());
    }

    /**
     * Job order transactions: orders with at least one deferred-category line.
     *
     * @return Orders, newest completion first, drafts last
     */
    @Transactional(readOnly = true)
    public List<Order> getJobOrderTransactions() {
        return orderRepository.findOrdersWithCategory(classifier.getDeferredCategory());
    }
}
