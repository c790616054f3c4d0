package com.cred.freestyle.pos.api.controller;

import com.cred.freestyle.pos.api.dto.MonthlyReportRow;
import com.cred.freestyle.pos.service.ReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for monthly sales reports.
 *
 * @author POS Team
 */
@RestController
@RequestMapping("/api/monthly-report")
public class ReportController {

    private static final Logger logger = LoggerFactory.getLogger(ReportController.class);

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<MonthlyReportRow>> getMonthlyReport(
            @RequestParam int year,
            @RequestParam int month
    ) {
        logger.debug("Monthly report requested for {}-{}", year, month);
        return ResponseEntity.ok(reportService.getMonthlyReport(year, month));
    }

    @GetMapping("/job-orders")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<MonthlyReportRow>> getJobOrderMonthlyReport(
            @RequestParam int year,
            @RequestParam int month
    ) {
        logger.debug("Job order monthly report requested for {}-{}", year, month);
        return ResponseEntity.ok(reportService.getJobOrderMonthlyReport(year, month));
    }
}
