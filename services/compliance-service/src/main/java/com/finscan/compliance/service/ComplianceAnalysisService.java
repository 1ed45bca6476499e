package com.finscan.compliance.service;

import com.finscan.compliance.document.AnalyzableDocument;
import com.finscan.compliance.document.DocumentPage;
import com.finscan.compliance.document.DocumentSource;
import com.finscan.compliance.document.Table;
import com.finscan.compliance.domain.ClassifiedStatement;
import com.finscan.compliance.domain.ComparativeReport;
import com.finscan.compliance.domain.ComplianceStatus;
import com.finscan.compliance.domain.Discrepancy;
import com.finscan.compliance.domain.PeriodChange;
import com.finscan.compliance.domain.RedFlagFinding;
import com.finscan.compliance.domain.RedFlagReport;
import com.finscan.compliance.domain.SearchHit;
import com.finscan.compliance.domain.SectionReport;
import com.finscan.compliance.domain.SectionRequirement;
import com.finscan.compliance.domain.SignatureFinding;
import com.finscan.compliance.domain.SignatureReport;
import com.finscan.compliance.domain.StatementReport;
import com.finscan.compliance.domain.ValidationReport;
import com.finscan.compliance.engine.ComparativePeriodEngine;
import com.finscan.compliance.engine.FinancialMathValidator;
import com.finscan.compliance.engine.RedFlagDetector;
import com.finscan.compliance.engine.SectionCatalog;
import com.finscan.compliance.engine.SignatureDetector;
import com.finscan.compliance.engine.StatementClassifier;
import com.finscan.compliance.engine.TermLocator;
import com.finscan.compliance.exception.AnalysisFailureException;
import com.finscan.compliance.exception.DocumentOpenException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The document analysis operations. Each call opens its document, walks the pages in order and
 * closes the document before returning or failing.
 */
@Service
public class ComplianceAnalysisService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ComplianceAnalysisService.class);

    private final DocumentSource documentSource;
    private final SectionCatalog sectionCatalog;
    private final TermLocator termLocator;
    private final StatementClassifier statementClassifier;
    private final FinancialMathValidator mathValidator;
    private final ComparativePeriodEngine comparativeEngine;
    private final SignatureDetector signatureDetector;
    private final RedFlagDetector redFlagDetector;

    public ComplianceAnalysisService(
        DocumentSource documentSource,
        SectionCatalog sectionCatalog,
        TermLocator termLocator,
        StatementClassifier statementClassifier,
        FinancialMathValidator mathValidator,
        ComparativePeriodEngine comparativeEngine,
        SignatureDetector signatureDetector,
        RedFlagDetector redFlagDetector
    ) {
        this.documentSource = documentSource;
        this.sectionCatalog = sectionCatalog;
        this.termLocator = termLocator;
        this.statementClassifier = statementClassifier;
        this.mathValidator = mathValidator;
        this.comparativeEngine = comparativeEngine;
        this.signatureDetector = signatureDetector;
        this.redFlagDetector = redFlagDetector;
    }

    public SectionReport findRegulatorySections(String documentRef, String docType) {
        return analyze(documentRef, "find regulatory sections", document -> {
            List<SectionRequirement> requirements = sectionCatalog.requirementsFor(docType);
            Map<String, SectionReport.SectionStatus> sections = new LinkedHashMap<>();
            List<String> missingCritical = new ArrayList<>();
            int found = 0;

            for (SectionRequirement requirement : requirements) {
                SearchHit hit = termLocator.locate(document.pages(), requirement.searchTerms());
                sections.put(requirement.name(), SectionReport.SectionStatus.of(requirement, hit));
                if (hit.found()) {
                    found++;
                } else if (requirement.critical()) {
                    missingCritical.add(requirement.name());
                }
            }

            LOGGER.info("Sections for {} ({}): {}/{} found, {} critical missing",
                documentRef, docType, found, requirements.size(), missingCritical.size());
            return new SectionReport(
                true,
                docType,
                sections,
                new SectionReport.Summary(requirements.size(), found, missingCritical)
            );
        });
    }

    public StatementReport extractFinancialStatements(String documentRef) {
        return analyze(documentRef, "extract financial statements", document -> {
            List<ClassifiedStatement> statements = new ArrayList<>();
            for (DocumentPage page : document.pages()) {
                statements.addAll(statementClassifier.extract(page));
            }
            LOGGER.info("Extracted {} statements from {}", statements.size(), documentRef);
            return new StatementReport(true, statements);
        });
    }

    public ValidationReport validateFinancialMath(String documentRef) {
        return analyze(documentRef, "validate financial math", document -> {
            List<Discrepancy> errors = new ArrayList<>();
            int tablesChecked = 0;

            for (DocumentPage page : document.pages()) {
                List<Table> tables = page.tables();
                for (int i = 0; i < tables.size(); i++) {
                    tablesChecked++;
                    errors.addAll(mathValidator.validate(page.number(), page.text(), i + 1, tables.get(i)));
                }
            }

            LOGGER.info("Validated {} tables in {}: {} discrepancies", tablesChecked, documentRef, errors.size());
            return new ValidationReport(true, new ValidationReport.Validation(tablesChecked, errors, List.of()));
        });
    }

    public SignatureReport checkRequiredSignatures(String documentRef, String docType, Double invoiceAmount) {
        return analyze(documentRef, "check signatures", document -> {
            List<SignatureFinding> found = signatureDetector.detect(document.pages());
            List<String> required = signatureDetector.requiredSignatures(docType, invoiceAmount);
            List<String> missing = signatureDetector.missingSignatures(required, found);
            ComplianceStatus status = missing.isEmpty() ? ComplianceStatus.COMPLETE : ComplianceStatus.INCOMPLETE;

            LOGGER.info("Signatures for {} ({}): {} found, {} of {} required missing",
                documentRef, docType, found.size(), missing.size(), required.size());
            return new SignatureReport(true, new SignatureReport.Requirements(
                docType,
                invoiceAmount,
                required,
                found,
                missing,
                status
            ));
        });
    }

    public RedFlagReport detectComplianceRedFlags(String documentRef) {
        return analyze(documentRef, "detect red flags", document -> {
            List<RedFlagFinding> flags = redFlagDetector.detect(document.pages());
            RedFlagReport.Summary summary = RedFlagReport.Summary.of(flags);
            LOGGER.info("Red flags in {}: {} total, {} critical", documentRef, summary.totalFlags(), summary.critical());
            return new RedFlagReport(true, flags, summary);
        });
    }

    public ComparativeReport extractComparativePeriods(String documentRef) {
        return analyze(documentRef, "extract comparative periods", document -> {
            List<PeriodChange> comparatives = new ArrayList<>();
            for (DocumentPage page : document.pages()) {
                for (Table table : page.tables()) {
                    comparatives.addAll(comparativeEngine.compare(page.number(), table));
                }
            }
            LOGGER.info("Comparative rows in {}: {}", documentRef, comparatives.size());
            return new ComparativeReport(true, comparatives);
        });
    }

    private <T> T analyze(String documentRef, String operation, Function<AnalyzableDocument, T> analysis) {
        AnalyzableDocument document;
        try {
            document = documentSource.open(documentRef);
        } catch (DocumentOpenException ex) {
            LOGGER.warn("Could not open {} to {}: {}", documentRef, operation, ex.getMessage());
            throw ex;
        }

        try (document) {
            LOGGER.debug("Opened {} with {} pages for {}", documentRef, document.pages().size(), operation);
            return analysis.apply(document);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to {} for {}", operation, documentRef, ex);
            throw new AnalysisFailureException(operation, ex);
        }
    }
}
