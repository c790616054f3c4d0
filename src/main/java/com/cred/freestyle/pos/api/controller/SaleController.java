package com.cred.freestyle.pos.api.controller;

import com.cred.freestyle.pos.api.dto.CatalogItemResponse;
import com.cred.freestyle.pos.api.dto.CreateSaleRequest;
import com.cred.freestyle.pos.api.dto.CreateSaleResponse;
import com.cred.freestyle.pos.api.dto.SaleDetailResponse;
import com.cred.freestyle.pos.domain.model.Order;
import com.cred.freestyle.pos.security.SecurityUtils;
import com.cred.freestyle.pos.service.SaleService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for sale intake.
 * Sales are recorded as drafts; stock moves only when the order is finalized.
 *
 * @author POS Team
 */
@RestController
@RequestMapping("/api/sales")
public class SaleController {

    private static final Logger logger = LoggerFactory.getLogger(SaleController.class);

    private final SaleService saleService;

    public SaleController(SaleService saleService) {
        this.saleService = saleService;
    }

    /**
     * Record a draft sale (normal sale or job order).
     *
     * @param request Sale with its item lines
     * @return Sale ID, total price and the accepted lines
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CreateSaleResponse> createSale(@Valid @RequestBody CreateSaleRequest request) {
        logger.info("Create sale requested by {} for customer: {}",
                SecurityUtils.currentActor(), request.getCustomerName());

        Order order = saleService.createDraftSale(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(CreateSaleResponse.fromEntity(order));
    }

    /**
     * Item catalog with current balances. Public.
     */
    @GetMapping("/catalog")
    public ResponseEntity<List<CatalogItemResponse>> getCatalog() {
        List<CatalogItemResponse> items = saleService.getCatalog()
                .stream()
                .map(CatalogItemResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(items);
    }

    @GetMapping("/{saleId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SaleDetailResponse> getSale(@PathVariable Long saleId) {
        logger.debug("Fetching sale: {}", saleId);
        return ResponseEntity.ok(SaleDetailResponse.fromEntity(saleService.getSale(saleId)));
    }
}
