package com.cred.freestyle.pos.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for sales and order finalization, recorded through Micrometer.
 * Published to CloudWatch when the CloudWatch registry is enabled.
 *
 * Key Metrics:
 * - Draft sales created
 * - Finalizations per path, and whether they deducted stock
 * - Insufficient stock and duplicate receipt rejections
 * - Lock conflicts
 * - Operation latency
 *
 * @author POS Team
 */
@Service
public class PosMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(PosMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "pos.";
    private static final String SALE_PREFIX = METRIC_PREFIX + "sale.";
    private static final String ORDER_PREFIX = METRIC_PREFIX + "order.";
    private static final String STOCK_PREFIX = METRIC_PREFIX + "stock.";

    public PosMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordSaleCreated() {
        Counter.builder(SALE_PREFIX + "created")
                .description("Draft sales created")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a successful finalization call.
     *
     * @param path "NORMAL" or "JOB_ORDER"
     * @param stockDeducted Whether this call deducted stock (false on repeat calls)
     */
    public void recordFinalization(String path, boolean stockDeducted) {
        Counter.builder(ORDER_PREFIX + "finalized")
                .tag("path", path)
                .tag("stock_deducted", String.valueOf(stockDeducted))
                .description("Order finalization calls")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded finalization, path: {}, deducted: {}", path, stockDeducted);
    }

    /**
     * Record a rejected operation.
     *
     * @param operation Operation name (e.g., "create_sale", "finalize_normal")
     * @param reason Rejection reason (e.g., "INSUFFICIENT_STOCK", "DUPLICATE_RECEIPT")
     */
    public void recordRejection(String operation, String reason) {
        Counter.builder(ORDER_PREFIX + "rejected")
                .tag("operation", operation)
                .tag("reason", reason)
                .description("Rejected sale and order operations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded rejection for {}: {}", operation, reason);
    }

    public void recordOrderDeleted(boolean restocked) {
        Counter.builder(ORDER_PREFIX + "deleted")
                .tag("restocked", String.valueOf(restocked))
                .description("Deleted orders")
                .register(meterRegistry)
                .increment();
    }

    public void recordLockConflict(String operation) {
        Counter.builder(STOCK_PREFIX + "lock.conflict")
                .tag("operation", operation)
                .description("Row lock waits that timed out")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record operation latency.
     *
     * @param operation Operation name
     * @param durationMs Duration in milliseconds
     */
    public void recordLatency(String operation, long durationMs) {
        Timer.builder(METRIC_PREFIX + "operation.latency")
                .tag("operation", operation)
                .description("Sale and order operation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
