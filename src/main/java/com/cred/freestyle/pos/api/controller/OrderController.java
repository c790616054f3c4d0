package com.cred.freestyle.pos.api.controller;

import com.cred.freestyle.pos.api.dto.OrderActionResponse;
import com.cred.freestyle.pos.api.dto.OrderSummaryResponse;
import com.cred.freestyle.pos.api.dto.ReceiptRequest;
import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.security.SecurityUtils;
import com.cred.freestyle.pos.service.OrderFinalizationService;
import com.cred.freestyle.pos.service.OrderService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for order finalization, deletion and transaction listings.
 *
 * Finalization endpoints are safe to retry: stock is deducted at most once per
 * order no matter how many times they are called.
 *
 * @author POS Team
 */
@RestController
@RequestMapping("/api")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderFinalizationService finalizationService;
    private final OrderService orderService;

    public OrderController(
            OrderFinalizationService finalizationService,
            OrderService orderService
    ) {
        this.finalizationService = finalizationService;
        this.orderService = orderService;
    }

    /**
     * Assign the official receipt number, completing the order.
     * First completion of a normal order deducts all of its lines; later
     * calls only replace the receipt number.
     *
     * @param orderId Order ID
     * @param request Receipt number
     * @return Updated order
     */
    @PostMapping("/orders/{orderId}/receipt")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderActionResponse> assignReceipt(
            @PathVariable Long orderId,
            @Valid @RequestBody ReceiptRequest request
    ) {
        logger.info("Receipt update for order {} requested by {}", orderId, SecurityUtils.currentActor());

        Order order = finalizationService.finalizeWithReceipt(orderId, request.getReceiptNumber());
        return ResponseEntity.ok(new OrderActionResponse("OR updated", OrderSummaryResponse.fromEntity(order)));
    }

    /**
     * Set the completion date of a job order.
     * First completion deducts the job order items; later calls change nothing.
     *
     * @param orderId Order ID
     * @return Updated order
     */
    @PostMapping("/orders/{orderId}/job-order-completion")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderActionResponse> completeJobOrder(@PathVariable Long orderId) {
        logger.info("Job order completion for order {} requested by {}", orderId, SecurityUtils.currentActor());

        Order order = finalizationService.finalizeJobOrder(orderId);
        return ResponseEntity.ok(new OrderActionResponse(
                "Job order finalized", OrderSummaryResponse.fromEntity(order)));
    }

    @DeleteMapping("/orders/{orderId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderActionResponse> deleteOrder(@PathVariable Long orderId) {
        logger.info("Deletion of order {} requested by {}", orderId, SecurityUtils.currentActor());

        orderService.deleteOrder(orderId);
        return ResponseEntity.ok(new OrderActionResponse("Order deleted", null));
    }

    /**
     * Normal point-of-sale transactions, newest first.
     */
    @GetMapping("/transactions")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<OrderSummaryResponse>> getTransactions() {
        return ResponseEntity.ok(toSummaries(orderService.getTransactions()));
    }

    /**
     * Job order transactions, newest first.
     */
    @GetMapping("/job-orders/transactions")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<OrderSummaryResponse>> getJobOrderTransactions() {
        return ResponseEntity.ok(toSummaries(orderService.getJobOrderTransactions()));
    }

    private List<OrderSummaryResponse> toSummaries(List<Order> orders) {
        return orders.stream()
                .map(OrderSummaryResponse::fromEntity)
                .collect(Collectors.toList());
    }
}
