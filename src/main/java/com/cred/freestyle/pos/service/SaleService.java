package com.cred.freestyle.pos.service;

import com.cred.freestyle.pos.api.dto.CreateSaleRequest;
import com.cred.freestyle.pos.api.dto.SaleItemRequest;
import com.cred.freestyle.pos.domain.model.Item;
import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.Order.OrderStatus;
import com.cred.freestyle.pos.domain.model.User;
import com.cred.freestyle.pos.exception.InsufficientStockException;
import com.cred.freestyle.pos.exception.ResourceNotFoundException;
import com.cred.freestyle.pos.infrastructure.ledger.ItemLedger;
import com.cred.freestyle.pos.infrastructure.messaging.OrderEventPublisher;
import com.cred.freestyle.pos.infrastructure.messaging.events.OrderLifecycleEvent;
import com.cred.freestyle.pos.infrastructure.metrics.PosMetricsService;
import com.cred.freestyle.pos.repository.ItemRepository;
import com.cred.freestyle.pos.repository.OrderRepository;
import com.cred.freestyle.pos.repository.UserRepository;
import com.cred.freestyle.pos.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Records draft sales and serves sale lookups.
 *
 * A draft sale is validated and priced against current stock but has no stock
 * impact: deduction happens only when the order is finalized.
 *
 * @author POS Team
 */
@Service
public class SaleService {

    private static final Logger logger = LoggerFactory.getLogger(SaleService.class);

    private final OrderRepository orderRepository;
    private final ItemRepository itemRepository;
    private final UserRepository userRepository;
    private final ItemLedger itemLedger;
    private final OrderEventPublisher eventPublisher;
    private final PosMetricsService metricsService;

    public SaleService(
            OrderRepository orderRepository,
            ItemRepository itemRepository,
            UserRepository userRepository,
            ItemLedger itemLedger,
            OrderEventPublisher eventPublisher,
            PosMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.itemRepository = itemRepository;
        this.userRepository = userRepository;
        this.itemLedger = itemLedger;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Record a draft sale:
     * 1. Validate the request and sum quantities per item (before any lock is taken)
     * 2. Resolve the owning user
     * 3. Lock item rows and check stock covers the summed quantity per item
     * 4. Compute total = sum of price x quantity
     * 5. Insert the order header (DRAFT, no receipt, no completion date) and its lines
     *
     * Runs in one transaction; any failure leaves no header or line behind.
     *
     * @param request Sale request
     * @return Saved draft order with its lines
     * @throws IllegalArgumentException if the item list is empty, a quantity is not positive,
     *         or an item's summed quantity does not fit in an int
     * @throws ResourceNotFoundException if the user or an item does not exist
     * @throws InsufficientStockException if stock does not cover a requested quantity
     */
    @Transactional
    public Order createDraftSale(CreateSaleRequest request) {
        long startTime = System.currentTimeMillis();

        if (request.getUserId() == null) {
            throw new IllegalArgumentException("User ID is required.");
        }
        Map<Long, Integer> demand = demandOf(request.getItems());
        logger.info("Creating draft sale for customer: {}, user: {}, lines: {}",
                request.getCustomerName(), request.getUserId(), request.getItems().size());

        if (request.getReceiptNumber() != null && !request.getReceiptNumber().isBlank()) {
            logger.debug("Ignoring receipt number {} on draft sale; assigned at finalization",
                    request.getReceiptNumber());
        }

        User user = userRepository.findById(request.getUserId())
                .orElseThrow(() -> new ResourceNotFoundException("User", request.getUserId()));

        Map<Long, Item> items;
        try {
            items = itemLedger.lockAndVerify(demand);
        } catch (InsufficientStockException e) {
            metricsService.recordRejection("create_sale", "INSUFFICIENT_STOCK");
            throw e;
        }

        BigDecimal total = BigDecimal.ZERO;
        for (SaleItemRequest line : request.getItems()) {
            BigDecimal price = items.get(line.getItemId()).getPrice();
            total = total.add(price.multiply(BigDecimal.valueOf(line.getQuantity())));
        }

        Order order = Order.builder()
                .user(user)
                .customerName(request.getCustomerName())
                .studentId(request.getStudentId())
                .course(request.getCourse())
                .totalPrice(total.setScale(2, RoundingMode.HALF_UP))
                .status(OrderStatus.DRAFT)
                .build();
        for (SaleItemRequest line : request.getItems()) {
            order.addLine(items.get(line.getItemId()), line.getQuantity());
        }

        order = orderRepository.save(order);
        logger.info("Created draft sale: {}, total: {}", order.getOrderId(), order.getTotalPrice());

        eventPublisher.publish(new OrderLifecycleEvent(
                order.getOrderId(),
                OrderLifecycleEvent.EventType.SALE_CREATED,
                null,
                order.getTotalPrice(),
                false,
                SecurityUtils.currentActor()
        ));
        metricsService.recordSaleCreated();
        metricsService.recordLatency("create_sale", System.currentTimeMillis() - startTime);
        return order;
    }

    /**
     * Find a sale with its lines and items.
     *
     * @param orderId Order ID
     * @return Order with lines loaded
     * @throws ResourceNotFoundException if the order does not exist
     */
    @Transactional(readOnly = true)
    public Order getSale(Long orderId) {
        return orderRepository.findWithLinesById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Sale", orderId));
    }

    /**
     * @return All items ordered by name
     */
    @Transactional(readOnly = true)
    public List<Item> getCatalog() {
        return itemRepository.findAllByOrderByNameAsc();
    }

    /**
     * Validate the requested lines and sum their quantities per item.
     */
    private Map<Long, Integer> demandOf(List<SaleItemRequest> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("No items provided.");
        }
        Map<Long, Integer> demand = new TreeMap<>();
        for (SaleItemRequest line : items) {
            if (line.getItemId() == null) {
                throw new IllegalArgumentException("Item ID is required.");
            }
            if (line.getQuantity() == null || line.getQuantity() <= 0) {
                throw new IllegalArgumentException("Quantities must be positive.");
            }
            ItemLedger.addDemand(demand, line.getItemId(), line.getQuantity());
        }
        return demand;
    }
}
