package com.finscan.compliance.document;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;

/**
 * Builds small PDFs for tests. Each page is a list of positioned text runs.
 */
public final class TestPdfs {

    private final List<List<Run>> pages = new ArrayList<>();
    private final List<Signature> signatures = new ArrayList<>();

    public static TestPdfs builder() {
        return new TestPdfs();
    }

    public TestPdfs page(Run... runs) {
        pages.add(List.of(runs));
        return this;
    }

    /** Adds a signature field on the given 1-based page. */
    public TestPdfs signatureField(int page, String name) {
        signatures.add(new Signature(page, name));
        return this;
    }

    public static Run text(float x, float y, String text) {
        return new Run(x, y, text);
    }

    /** One table row with cells at fixed, widely spaced columns. */
    public static Run[] row(float y, String... cells) {
        float[] columns = {72f, 300f, 420f, 500f};
        Run[] runs = new Run[cells.length];
        for (int i = 0; i < cells.length; i++) {
            runs[i] = new Run(columns[i], y, cells[i]);
        }
        return runs;
    }

    public Path writeTo(Path file) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            List<PDPage> created = new ArrayList<>();
            for (List<Run> runs : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                created.add(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    for (Run run : runs) {
                        content.beginText();
                        content.setFont(font, 10);
                        content.newLineAtOffset(run.x(), run.y());
                        content.showText(run.text());
                        content.endText();
                    }
                }
            }

            if (!signatures.isEmpty()) {
                PDAcroForm form = new PDAcroForm(document);
                document.getDocumentCatalog().setAcroForm(form);
                List<PDField> fields = new ArrayList<>();
                for (Signature signature : signatures) {
                    PDPage page = created.get(signature.page() - 1);
                    PDSignatureField field = new PDSignatureField(form);
                    field.setPartialName(signature.name());
                    PDAnnotationWidget widget = field.getWidgets().get(0);
                    widget.setRectangle(new PDRectangle(72, 72, 200, 40));
                    widget.setPage(page);
                    List<PDAnnotation> annotations = new ArrayList<>(page.getAnnotations());
                    annotations.add(widget);
                    page.setAnnotations(annotations);
                    fields.add(field);
                }
                form.setFields(fields);
            }
            document.save(file.toFile());
        }
        return file;
    }

    public record Run(float x, float y, String text) {
    }

    private record Signature(int page, String name) {
    }
}
