package com.cred.freestyle.pos.infrastructure.ledger;

import com.cred.freestyle.pos.api.dto.CreateSaleRequest;
import com.cred.freestyle.pos.api.dto.SaleItemRequest;
import com.cred.freestyle.pos.domain.model.Item;
import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.User;
import com.cred.freestyle.pos.exception.InsufficientStockException;
import com.cred.freestyle.pos.infrastructure.messaging.OrderEventPublisher;
import com.cred.freestyle.pos.repository.ItemRepository;
import com.cred.freestyle.pos.repository.OrderRepository;
import com.cred.freestyle.pos.repository.UserRepository;
import com.cred.freestyle.pos.service.OrderFinalizationService;
import com.cred.freestyle.pos.service.SaleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.cred.freestyle.pos.testutil.TestDataBuilder.anItem;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Row locking tests against a real PostgreSQL database using Testcontainers.
 * Skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PostgreSQL Row Locking Tests")
class ItemLedgerPostgresTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("pos_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private SaleService saleService;

    @Autowired
    private OrderFinalizationService finalizationService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private UserRepository userRepository;

    @MockBean
    private OrderEventPublisher eventPublisher;

    private User cashier;

    @BeforeEach
    void setUp() {
        orderRepository.deleteAll();
        itemRepository.deleteAll();
        userRepository.deleteAll();
        cashier = userRepository.save(User.builder().username("cashier").build());
    }

    @Test
    @DisplayName("Job orders racing for the same deferred item never oversell")
    void concurrentJobOrders_NeverOversell() throws Exception {
        // Given
        Item mug = itemRepository.save(anItem().name("Mug").deferred().stock(5).build());
        List<Long> orderIds = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            orderIds.add(createSale(mug, 2));
        }

        // When
        ExecutorService executor = Executors.newFixedThreadPool(orderIds.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Order>> futures = new ArrayList<>();
        for (Long orderId : orderIds) {
            futures.add(executor.submit(() -> {
                start.await();
                return finalizationService.finalizeJobOrder(orderId);
            }));
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // Then
        int succeeded = 0;
        for (Future<Order> future : futures) {
            try {
                future.get();
                succeeded++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(InsufficientStockException.class);
            }
        }
        assertThat(succeeded).isEqualTo(2);
        assertThat(itemRepository.findById(mug.getItemId()).orElseThrow().getStockQuantity()).isEqualTo(1);
    }

    @Test
    @DisplayName("Repeated receipt finalization on PostgreSQL deducts once")
    void repeatedReceipt_DeductsOnce() {
        // Given
        Item pen = itemRepository.save(anItem().name("Pen").stock(10).build());
        Long orderId = createSale(pen, 4);

        // When
        finalizationService.finalizeWithReceipt(orderId, "PG-1");
        finalizationService.finalizeWithReceipt(orderId, "PG-2");

        // Then
        assertThat(itemRepository.findById(pen.getItemId()).orElseThrow().getStockQuantity()).isEqualTo(6);
        assertThat(orderRepository.findById(orderId).orElseThrow().getReceiptNumber()).isEqualTo("PG-2");
    }

    private Long createSale(Item item, int quantity) {
        return saleService.createDraftSale(new CreateSaleRequest(cashier.getUserId(), "Maria Santos", List.of(
                new SaleItemRequest(item.getItemId(), quantity)
        ))).getOrderId();
    }
}
