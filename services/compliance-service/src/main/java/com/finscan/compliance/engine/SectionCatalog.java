package com.finscan.compliance.engine;

import com.finscan.compliance.domain.DocumentType;
import com.finscan.compliance.domain.SectionRequirement;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Sections each filing type must contain, with the phrases that identify them.
 */
@Component
public class SectionCatalog {

    private static final Map<DocumentType, List<SectionRequirement>> REQUIREMENTS = new EnumMap<>(DocumentType.class);

    static {
        REQUIREMENTS.put(DocumentType.TEN_K, List.of(
            SectionRequirement.optional("Item 1: Business", "item 1", "business"),
            SectionRequirement.critical("Item 1A: Risk Factors", "item 1a", "risk factors"),
            SectionRequirement.critical("Item 7: MD&A", "item 7", "management's discussion", "md&a"),
            SectionRequirement.critical("Item 8: Financial Statements", "item 8", "financial statements"),
            SectionRequirement.critical("Item 9A: Controls and Procedures", "item 9a", "controls and procedures")
        ));
        REQUIREMENTS.put(DocumentType.SOX_404, List.of(
            SectionRequirement.critical("IT General Controls", "it general controls", "itgc", "it controls"),
            SectionRequirement.critical("Access Controls", "access controls", "access management"),
            SectionRequirement.optional("Change Management", "change management", "change controls"),
            SectionRequirement.critical("Management Assessment", "management assessment", "management certification")
        ));
        REQUIREMENTS.put(DocumentType.EIGHT_K, List.of(
            SectionRequirement.critical("Item 1.01: Material Agreements",
                "item 1.01", "material definitive agreement", "material agreement"),
            SectionRequirement.critical("Item 2.01: Acquisition/Disposition",
                "item 2.01", "acquisition", "disposition of assets"),
            SectionRequirement.optional("Item 5.02: Officer Changes",
                "item 5.02", "departure of directors", "officer changes"),
            SectionRequirement.critical("Item 9.01: Financial Statements/Exhibits",
                "item 9.01", "financial statements and exhibits"),
            SectionRequirement.critical("Filing Timeliness", "date of report", "date of earliest event")
        ));
        REQUIREMENTS.put(DocumentType.INVOICE, List.of(
            SectionRequirement.critical("Invoice Number", "invoice number", "invoice #", "inv #", "invoice no"),
            SectionRequirement.critical("Date", "date", "invoice date"),
            SectionRequirement.critical("Line Items", "description", "line items", "item"),
            SectionRequirement.critical("Total", "total", "amount due", "balance due"),
            SectionRequirement.optional("Payment Terms", "payment terms", "due date", "net 30", "net 60")
        ));
    }

    public List<SectionRequirement> requirementsFor(DocumentType type) {
        return REQUIREMENTS.getOrDefault(type, List.of());
    }

    public List<SectionRequirement> requirementsFor(String docTypeLabel) {
        return DocumentType.fromLabel(docTypeLabel)
            .map(this::requirementsFor)
            .orElse(List.of());
    }
}
