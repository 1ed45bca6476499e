package com.finscan.compliance.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SignatureFinding(
    @JsonProperty("type") SignatureKind kind,
    @JsonProperty("signer") String role,
    int page,
    String excerpt
) {
}
