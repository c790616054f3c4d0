package com.cred.freestyle.pos.api.controller;

import com.cred.freestyle.pos.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.pos.domain.model.Item;
import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.Order.DeductionPath;
import com.cred.freestyle.pos.exception.DuplicateReceiptException;
import com.cred.freestyle.pos.exception.InvalidOrderStateException;
import com.cred.freestyle.pos.exception.ResourceNotFoundException;
import com.cred.freestyle.pos.infrastructure.metrics.PosMetricsService;
import com.cred.freestyle.pos.service.OrderFinalizationService;
import com.cred.freestyle.pos.service.OrderService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.cred.freestyle.pos.testutil.TestDataBuilder.anItem;
import static com.cred.freestyle.pos.testutil.TestDataBuilder.anOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for OrderController using MockMvc.
 */
@WebMvcTest(OrderController.class)
@ContextConfiguration(classes = {OrderController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("OrderController Tests")
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OrderFinalizationService finalizationService;

    @MockBean
    private OrderService orderService;

    @MockBean
    private PosMetricsService metricsService;

    private final Item pen = anItem().itemId(1L).name("Pen").build();
    private final Item mug = anItem().itemId(2L).name("Mug").deferred().build();

    // ========================================
    // POST /api/orders/{id}/receipt Tests
    // ========================================

    @Test
    @DisplayName("POST /receipt - Valid receipt returns 200 with finalized order")
    void assignReceipt_Valid_Returns200() throws Exception {
        // Given
        Order order = anOrder().orderId(10L).line(pen, 2).finalized("R1", DeductionPath.NORMAL).build();
        when(finalizationService.finalizeWithReceipt(10L, "R1")).thenReturn(order);

        // When / Then
        mockMvc.perform(post("/api/orders/10/receipt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"OR_number\": \"R1\" }"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("OR updated"))
                .andExpect(jsonPath("$.order.orderId").value(10))
                .andExpect(jsonPath("$.order.receiptNumber").value("R1"))
                .andExpect(jsonPath("$.order.status").value("FINALIZED"))
                .andExpect(jsonPath("$.order.completedAt").exists());
    }

    @Test
    @DisplayName("POST /receipt - Missing receipt returns 400")
    void assignReceipt_Missing_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/orders/10/receipt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ }"))
                .andExpect(status().isBadRequest());

        verify(finalizationService, never()).finalizeWithReceipt(any(), any());
    }

    @Test
    @DisplayName("POST /receipt - Duplicate receipt returns 409")
    void assignReceipt_Duplicate_Returns409() throws Exception {
        // Given
        when(finalizationService.finalizeWithReceipt(11L, "R1"))
                .thenThrow(new DuplicateReceiptException("R1", 11L));

        // When / Then
        mockMvc.perform(post("/api/orders/11/receipt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"receiptNumber\": \"R1\" }"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Duplicate Receipt"))
                .andExpect(jsonPath("$.details.receiptNumber").value("R1"));
    }

    @Test
    @DisplayName("POST /receipt - Lock timeout returns 409 marked retryable")
    void assignReceipt_LockTimeout_Returns409Retryable() throws Exception {
        // Given
        when(finalizationService.finalizeWithReceipt(10L, "R1"))
                .thenThrow(new CannotAcquireLockException("lock wait timeout"));

        // When / Then
        mockMvc.perform(post("/api/orders/10/receipt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"receiptNumber\": \"R1\" }"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.retryable").value(true));

        verify(metricsService).recordLockConflict(anyString());
    }

    @Test
    @DisplayName("POST /receipt - Database unavailable returns 503 marked retryable")
    void assignReceipt_StoreUnavailable_Returns503() throws Exception {
        // Given
        when(finalizationService.finalizeWithReceipt(10L, "R1"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When / Then
        mockMvc.perform(post("/api/orders/10/receipt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"receiptNumber\": \"R1\" }"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.retryable").value(true));
    }

    // ========================================
    // POST /api/orders/{id}/job-order-completion Tests
    // ========================================

    @Test
    @DisplayName("POST /job-order-completion - Returns 200 with completion date")
    void completeJobOrder_Returns200() throws Exception {
        // Given
        Order order = anOrder().orderId(20L).line(mug, 1).finalized(null, DeductionPath.JOB_ORDER).build();
        when(finalizationService.finalizeJobOrder(20L)).thenReturn(order);

        // When / Then
        mockMvc.perform(post("/api/orders/20/job-order-completion"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Job order finalized"))
                .andExpect(jsonPath("$.order.completedAt").exists());
    }

    @Test
    @DisplayName("POST /job-order-completion - Order without job order items returns 400")
    void completeJobOrder_NotJobOrder_Returns400() throws Exception {
        // Given
        when(finalizationService.finalizeJobOrder(21L))
                .thenThrow(new InvalidOrderStateException(21L, "Order does not contain any 'Souvenir' items"));

        // When / Then
        mockMvc.perform(post("/api/orders/21/job-order-completion"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Order State"))
                .andExpect(jsonPath("$.details.orderId").value(21));
    }

    @Test
    @DisplayName("POST /job-order-completion - Unknown order returns 404")
    void completeJobOrder_NotFound_Returns404() throws Exception {
        // Given
        when(finalizationService.finalizeJobOrder(99L)).thenThrow(new ResourceNotFoundException("Order", 99L));

        // When / Then
        mockMvc.perform(post("/api/orders/99/job-order-completion"))
                .andExpect(status().isNotFound());
    }

    // ========================================
    // DELETE and listing Tests
    // ========================================

    @Test
    @DisplayName("DELETE /api/orders/{id} - Returns 200 with message")
    void deleteOrder_Returns200() throws Exception {
        // When / Then
        mockMvc.perform(delete("/api/orders/30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Order deleted"));

        verify(orderService).deleteOrder(30L);
    }

    @Test
    @DisplayName("GET /api/transactions - Returns normal transactions")
    void getTransactions_ReturnsList() throws Exception {
        // Given
        when(orderService.getTransactions()).thenReturn(List.of(
                anOrder().orderId(1L).line(pen, 1).finalized("R1", DeductionPath.NORMAL).build(),
                anOrder().orderId(2L).line(pen, 1).build()
        ));

        // When / Then
        mockMvc.perform(get("/api/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].receiptNumber").value("R1"))
                .andExpect(jsonPath("$[0].username").value("cashier"));
    }

    @Test
    @DisplayName("GET /api/job-orders/transactions - Returns job orders")
    void getJobOrderTransactions_ReturnsList() throws Exception {
        // Given
        when(orderService.getJobOrderTransactions()).thenReturn(List.of(
                anOrder().orderId(3L).line(mug, 1).build()
        ));

        // When / Then
        mockMvc.perform(get("/api/job-orders/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].orderId").value(3));
    }
}
