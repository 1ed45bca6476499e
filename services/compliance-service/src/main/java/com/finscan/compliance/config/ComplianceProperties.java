package com.finscan.compliance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "compliance")
public class ComplianceProperties {

    private boolean remoteDocumentsEnabled = true;
    private String userAgent = "FinscanComplianceAnalyzer/1.0";
    private int remoteMaxInMemoryMb = 32;
    private float tableColumnGap = 12.0f;

    public boolean isRemoteDocumentsEnabled() {
        return remoteDocumentsEnabled;
    }

    public void setRemoteDocumentsEnabled(boolean remoteDocumentsEnabled) {
        this.remoteDocumentsEnabled = remoteDocumentsEnabled;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getRemoteMaxInMemoryMb() {
        return remoteMaxInMemoryMb;
    }

    public void setRemoteMaxInMemoryMb(int remoteMaxInMemoryMb) {
        this.remoteMaxInMemoryMb = remoteMaxInMemoryMb;
    }

    public float getTableColumnGap() {
        return tableColumnGap;
    }

    public void setTableColumnGap(float tableColumnGap) {
        this.tableColumnGap = tableColumnGap;
    }
}
