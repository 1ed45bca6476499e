package com.finscan.compliance.controller;

import com.finscan.compliance.domain.ComparativeReport;
import com.finscan.compliance.domain.RedFlagReport;
import com.finscan.compliance.domain.SectionReport;
import com.finscan.compliance.domain.SignatureReport;
import com.finscan.compliance.domain.StatementReport;
import com.finscan.compliance.domain.ValidationReport;
import com.finscan.compliance.service.ComplianceAnalysisService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnalysisController {

    private final ComplianceAnalysisService analysisService;

    public AnalysisController(ComplianceAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
            "status", "ok",
            "service", "compliance-service"
        );
    }

    @PostMapping("/v1/analysis/regulatory-sections")
    public SectionReport regulatorySections(@Valid @RequestBody TypedDocumentRequest request) {
        return analysisService.findRegulatorySections(request.pdfPath(), request.docType());
    }

    @PostMapping("/v1/analysis/financial-statements")
    public StatementReport financialStatements(@Valid @RequestBody DocumentRequest request) {
        return analysisService.extractFinancialStatements(request.pdfPath());
    }

    @PostMapping("/v1/analysis/financial-math")
    public ValidationReport financialMath(@Valid @RequestBody DocumentRequest request) {
        return analysisService.validateFinancialMath(request.pdfPath());
    }

    @PostMapping("/v1/analysis/signatures")
    public SignatureReport signatures(@Valid @RequestBody SignatureCheckRequest request) {
        return analysisService.checkRequiredSignatures(request.pdfPath(), request.docType(), request.invoiceAmount());
    }

    @PostMapping("/v1/analysis/red-flags")
    public RedFlagReport redFlags(@Valid @RequestBody DocumentRequest request) {
        return analysisService.detectComplianceRedFlags(request.pdfPath());
    }

    @PostMapping("/v1/analysis/comparative-periods")
    public ComparativeReport comparativePeriods(@Valid @RequestBody DocumentRequest request) {
        return analysisService.extractComparativePeriods(request.pdfPath());
    }
}
