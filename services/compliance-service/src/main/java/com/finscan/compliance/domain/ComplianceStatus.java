package com.finscan.compliance.domain;

public enum ComplianceStatus {
    COMPLETE,
    INCOMPLETE
}
