package com.cred.freestyle.pos.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for recording a draft sale.
 * Used by both normal sales and job orders; stock is validated but not deducted.
 *
 * @author POS Team
 */
public class CreateSaleRequest {

    @NotNull(message = "User ID is required")
    @JsonAlias("user_id")
    private Long userId;

    @NotBlank(message = "Customer name is required")
    @JsonAlias("customer_name")
    private String customerName;

    /**
     * Accepted for compatibility with older clients. Receipt numbers are only
     * assigned at finalization.
     */
    @JsonAlias("OR_number")
    private String receiptNumber;

    @JsonAlias("student_id")
    private String studentId;

    private String course;

    @NotEmpty(message = "No items provided")
    @Valid
    private List<SaleItemRequest> items = new ArrayList<>();

    public CreateSaleRequest() {
    }

    public CreateSaleRequest(Long userId, String customerName, List<SaleItemRequest> items) {
        this.userId = userId;
        this.customerName = customerName;
        this.items = items;
    }

    // Getters and setters
    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }

    public String getReceiptNumber() {
        return receiptNumber;
    }

    public void setReceiptNumber(String receiptNumber) {
        this.receiptNumber = receiptNumber;
    }

    public String getStudentId() {
        return studentId;
    }

    public void setStudentId(String studentId) {
        this.studentId = studentId;
    }

    public String getCourse() {
        return course;
    }

    public void setCourse(String course) {
        this.course = course;
    }

    public List<SaleItemRequest> getItems() {
        return items;
    }

    public void setItems(List<SaleItemRequest> items) {
        this.items = items;
    }
}
