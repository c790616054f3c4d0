package com.cred.freestyle.pos.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for assigning an official receipt (OR) number.
 *
 * @author POS Team
 */
public class ReceiptRequest {

    @NotBlank(message = "Receipt number is required")
    @Size(max = 100, message = "Receipt number must be at most 100 characters")
    @JsonAlias("OR_number")
    private String receiptNumber;

    public ReceiptRequest() {
    }

    public ReceiptRequest(String receiptNumber) {
        this.receiptNumber = receiptNumber;
    }

    public String getReceiptNumber() {
        return receiptNumber;
    }

    public void setReceiptNumber(String receiptNumber) {
        this.receiptNumber = receiptNumber;
    }
}
