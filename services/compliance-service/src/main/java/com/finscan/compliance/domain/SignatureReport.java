package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record SignatureReport(
    boolean success,
    @JsonProperty("signature_requirements") Requirements signatureRequirements
) {

    public record Requirements(
        @JsonProperty("doc_type") String docType,
        @JsonProperty("invoice_amount") Double invoiceAmount,
        @JsonProperty("required_signatures") List<String> requiredSignatures,
        @JsonProperty("found_signatures") List<SignatureFinding> foundSignatures,
        @JsonProperty("missing_signatures") List<String> missingSignatures,
        @JsonProperty("compliance_status") ComplianceStatus complianceStatus
    ) {
    }
}
