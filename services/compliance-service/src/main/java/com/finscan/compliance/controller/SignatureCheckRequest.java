package com.finscan.compliance.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record SignatureCheckRequest(
    @NotBlank(message = "pdf_path must not be blank")
    @JsonProperty("pdf_path")
    String pdfPath,

    @NotBlank(message = "doc_type must not be blank")
    @JsonProperty("doc_type")
    String docType,

    @PositiveOrZero(message = "invoice_amount must not be negative")
    @JsonProperty("invoice_amount")
    Double invoiceAmount
) {
}
