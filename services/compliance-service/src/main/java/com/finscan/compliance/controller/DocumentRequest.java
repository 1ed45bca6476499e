package com.finscan.compliance.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record DocumentRequest(
    @NotBlank(message = "pdf_path must not be blank")
    @JsonProperty("pdf_path")
    String pdfPath
) {
}
