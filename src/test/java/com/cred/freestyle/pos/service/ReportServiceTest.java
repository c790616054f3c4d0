package com.cred.freestyle.pos.service;

import com.cred.freestyle.pos.api.dto.MonthlyReportRow;
import com.cred.freestyle.pos.domain.model.Item;
import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.domain.model.Order.DeductionPath;
import com.cred.freestyle.pos.repository.OrderLineRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static com.cred.freestyle.pos.testutil.TestDataBuilder.anItem;
import static com.cred.freestyle.pos.testutil.TestDataBuilder.anOrder;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReportService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ReportService Unit Tests")
class ReportServiceTest {

    @Mock
    private OrderLineRepository orderLineRepository;

    private final FulfillmentClassifier classifier = new FulfillmentClassifier("Souvenir");

    @Test
    @DisplayName("getMonthlyReport - Queries the month's bounds in UTC and maps rows")
    void getMonthlyReport_Success() {
        // Given
        ReportService reportService = new ReportService(orderLineRepository, classifier, "UTC");
        Item pen = anItem().itemId(1L).name("Pen").unit(null).price("12.50").build();
        Order order = anOrder().orderId(7L).customerName("Ana Reyes").line(pen, 4)
                .finalized("R-100", DeductionPath.NORMAL).build();

        when(orderLineRepository.findNormalReportLines(
                Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z"), "Souvenir"))
                .thenReturn(order.getLines());

        // When
        List<MonthlyReportRow> rows = reportService.getMonthlyReport(2024, 3);

        // Then
        assertThat(rows).hasSize(1);
        MonthlyReportRow row = rows.get(0);
        assertThat(row.getReceiptNumber()).isEqualTo("R-100");
        assertThat(row.getPayer()).isEqualTo("Ana Reyes");
        assertThat(row.getQtySold()).isEqualTo(4);
        assertThat(row.getUnit()).isEqualTo("pcs");
        assertThat(row.getDescription()).isEqualTo("Pen");
        assertThat(row.getTotalCost()).isEqualByComparingTo("50.00");
    }

    @Test
    @DisplayName("getJobOrderMonthlyReport - December rolls over into the next year in the configured zone")
    void getJobOrderMonthlyReport_DecemberInManila() {
        // Given
        ReportService reportService = new ReportService(orderLineRepository, classifier, "Asia/Manila");
        when(orderLineRepository.findJobOrderReportLines(any(), any(), eq("Souvenir"))).thenReturn(List.of());

        // When
        List<MonthlyReportRow> rows = reportService.getJobOrderMonthlyReport(2023, 12);

        // Then
        assertThat(rows).isEmpty();
        verify(orderLineRepository).findJobOrderReportLines(
                Instant.parse("2023-11-30T16:00:00Z"), Instant.parse("2023-12-31T16:00:00Z"), "Souvenir");
    }

    @Test
    @DisplayName("getMonthlyReport - Month outside 1..12 is rejected")
    void getMonthlyReport_InvalidMonth() {
        // Given
        ReportService reportService = new ReportService(orderLineRepository, classifier, "UTC");

        // When / Then
        assertThatThrownBy(() -> reportService.getMonthlyReport(2024, 13))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("13");
        verifyNoInteractions(orderLineRepository);
    }
}
