package com.finscan.compliance.engine;

import com.finscan.compliance.document.DocumentPage;
import com.finscan.compliance.document.SignatureWidget;
import com.finscan.compliance.domain.DocumentType;
import com.finscan.compliance.domain.SignatureFinding;
import com.finscan.compliance.domain.SignatureKind;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Finds signatures (digital signature fields and textual sign-off mentions) and decides which
 * signatures a document type requires.
 */
@Component
public class SignatureDetector {

    public static final double INVOICE_APPROVAL_THRESHOLD = 10_000;
    public static final String INVOICE_APPROVER = "Authorized Approver";

    private static final int EXCERPT_BEFORE = 50;
    private static final int EXCERPT_AFTER = 100;

    private static final List<SignaturePhrase> PHRASES = List.of(
        new SignaturePhrase("CFO", "CFO"),
        new SignaturePhrase("CEO", "CEO"),
        new SignaturePhrase("Chief Financial Officer", "CFO"),
        new SignaturePhrase("Chief Executive Officer", "CEO"),
        new SignaturePhrase("Chief Accounting Officer", "CAO"),
        new SignaturePhrase("signed by", "Authorized Signer"),
        new SignaturePhrase("approved by", "Approver"),
        new SignaturePhrase("certified by", "Certifier")
    );

    private static final Map<DocumentType, List<String>> REQUIRED = new EnumMap<>(DocumentType.class);

    static {
        REQUIRED.put(DocumentType.SOX_404, List.of("CFO Certification", "CEO Certification"));
        REQUIRED.put(DocumentType.TEN_K, List.of("CEO Signature", "CFO Signature", "CAO Signature"));
        REQUIRED.put(DocumentType.EIGHT_K, List.of("Authorized Signer"));
        REQUIRED.put(DocumentType.INVOICE, List.of());
    }

    public List<SignatureFinding> detect(List<? extends DocumentPage> pages) {
        List<SignatureFinding> findings = new ArrayList<>();
        Set<FindingKey> seen = new HashSet<>();

        for (DocumentPage page : pages) {
            for (SignatureWidget widget : page.signatureWidgets()) {
                if (!widget.isSignature()) {
                    continue;
                }
                String role = widget.fieldName() == null || widget.fieldName().isBlank() ? "Unknown" : widget.fieldName();
                if (seen.add(new FindingKey(role, page.number()))) {
                    findings.add(new SignatureFinding(
                        SignatureKind.DIGITAL,
                        role,
                        page.number(),
                        "Digital signature field: " + role
                    ));
                }
            }

            String text = page.text() == null ? "" : page.text();
            String lower = text.toLowerCase(Locale.ROOT);
            for (SignaturePhrase phrase : PHRASES) {
                int position = lower.indexOf(phrase.text().toLowerCase(Locale.ROOT));
                if (position < 0) {
                    continue;
                }
                if (seen.add(new FindingKey(phrase.role(), page.number()))) {
                    findings.add(new SignatureFinding(
                        SignatureKind.TEXTUAL,
                        phrase.role(),
                        page.number(),
                        TextWindows.around(text, position, EXCERPT_BEFORE, EXCERPT_AFTER)
                    ));
                }
            }
        }
        return findings;
    }

    public List<String> requiredSignatures(String docTypeLabel, Double invoiceAmount) {
        return DocumentType.fromLabel(docTypeLabel)
            .map(type -> requiredSignatures(type, invoiceAmount))
            .orElse(List.of());
    }

    public List<String> requiredSignatures(DocumentType type, Double invoiceAmount) {
        List<String> required = new ArrayList<>(REQUIRED.getOrDefault(type, List.of()));
        if (type == DocumentType.INVOICE && invoiceAmount != null && invoiceAmount > INVOICE_APPROVAL_THRESHOLD) {
            required.add(INVOICE_APPROVER);
        }
        return required;
    }

    public List<String> missingSignatures(List<String> required, List<SignatureFinding> found) {
        List<String> missing = new ArrayList<>();
        for (String requirement : required) {
            boolean satisfied = found.stream().anyMatch(finding -> satisfies(requirement, finding.role()));
            if (!satisfied) {
                missing.add(requirement);
            }
        }
        return missing;
    }

    // "CEO" satisfies "CEO Signature": any requirement word found in the role
    public static boolean satisfies(String requirement, String role) {
        String upperRole = role.toUpperCase(Locale.ROOT);
        for (String word : requirement.strip().toUpperCase(Locale.ROOT).split("\\s+")) {
            if (!word.isEmpty() && upperRole.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private record SignaturePhrase(String text, String role) {
    }

    private record FindingKey(String role, int page) {
    }
}
