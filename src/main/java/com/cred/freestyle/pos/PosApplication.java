package com.cred.freestyle.pos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the point-of-sale order service.
 *
 * System Overview:
 * - Draft sales are validated and priced against the item ledger without
 *   touching stock
 * - Orders are completed either by receipt number (normal sales) or by
 *   completion date (job orders for deferred-fulfillment items)
 * - Stock is deducted exactly once per order, at its first completion, under
 *   row locks taken in a fixed order
 * - Lifecycle events are published to Kafka after commit
 * - Micrometer metrics, optionally shipped to CloudWatch
 *
 * @author POS Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class PosApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosApplication.class, args);
    }
}
