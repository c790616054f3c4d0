package com.cred.freestyle.pos.service;

import com.cred.freestyle.pos.api.dto.MonthlyReportRow;
import com.cred.freestyle.pos.repository.OrderLineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Monthly sales reports, one row per order line.
 * Months are resolved in the configured reporting time zone.
 *
 * @author POS Team
 */
@Service
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    private final OrderLineRepository orderLineRepository;
    private final FulfillmentClassifier classifier;
    private final ZoneId reportingZone;

    public ReportService(
            OrderLineRepository orderLineRepository,
            FulfillmentClassifier classifier,
            @Value("${pos.reporting.time-zone:UTC}") String reportingZone
    ) {
        this.orderLineRepository = orderLineRepository;
        this.classifier = classifier;
        this.reportingZone = ZoneId.of(reportingZone);
    }

    /**
     * Lines of receipted normal orders completed in the given month.
     *
     * @param year Calendar year
     * @param month Month, 1 to 12
     * @return Report rows ordered by completion time
     * @throws IllegalArgumentException if the month is out of range
     */
    @Transactional(readOnly = true)
    public List<MonthlyReportRow> getMonthlyReport(int year, int month) {
        YearMonth period = toPeriod(year, month);
        logger.debug("Building monthly report for {}", period);

        return orderLineRepository.findNormalReportLines(
                        startOf(period), startOf(period.plusMonths(1)), classifier.getDeferredCategory())
                .stream()
                .map(MonthlyReportRow::fromLine)
                .collect(Collectors.toList());
    }

    /**
     * Deferred-category lines of job orders completed in the given month.
     *
     * @param year Calendar year
     * @param month Month, 1 to 12
     * @return Report rows ordered by completion time
     * @throws IllegalArgumentException if the month is out of range
     */
    @Transactional(readOnly = true)
    public List<MonthlyReportRow> getJobOrderMonthlyReport(int year, int month) {
        YearMonth period = toPeriod(year, month);
        logger.debug("Building job order monthly report for {}", period);

        return orderLineRepository.findJobOrderReportLines(
                        startOf(period), startOf(period.plusMonths(1)), classifier.getDeferredCategory())
                .stream()
                .map(MonthlyReportRow::fromLine)
                .collect(Collectors.toList());
    }

    private YearMonth toPeriod(int year, int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be between 1 and 12, got " + month);
        }
        return YearMonth.of(year, month);
    }

    private Instant startOf(YearMonth period) {
        return period.atDay(1).atStartOfDay(reportingZone).toInstant();
    }
}
