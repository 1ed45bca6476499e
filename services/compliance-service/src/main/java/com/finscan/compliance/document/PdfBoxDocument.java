package com.finscan.compliance.document;

import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTerminalField;

/**
 * PDFBox-backed document. Page content is decoded lazily, once per page, and kept only for the
 * lifetime of this object.
 */
final class PdfBoxDocument implements AnalyzableDocument {

    private final String reference;
    private final PDDocument document;
    private final TableAssembler tableAssembler;
    private final Map<COSDictionary, SignatureWidget> widgetsByAnnotation;
    private final List<DocumentPage> pages;

    PdfBoxDocument(String reference, PDDocument document, float columnGap) {
        this.reference = reference;
        this.document = document;
        this.tableAssembler = new TableAssembler(columnGap);
        this.widgetsByAnnotation = indexFormWidgets(document);
        List<DocumentPage> result = new ArrayList<>();
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            result.add(new PdfBoxPage(i + 1));
        }
        this.pages = List.copyOf(result);
    }

    @Override
    public String reference() {
        return reference;
    }

    @Override
    public List<DocumentPage> pages() {
        return pages;
    }

    @Override
    public void close() {
        try {
            document.close();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to close document " + reference, e);
        }
    }

    private static Map<COSDictionary, SignatureWidget> indexFormWidgets(PDDocument document) {
        Map<COSDictionary, SignatureWidget> index = new IdentityHashMap<>();
        PDAcroForm form = document.getDocumentCatalog().getAcroForm();
        if (form == null) {
            return index;
        }
        for (PDField field : form.getFieldTree()) {
            if (!(field instanceof PDTerminalField)) {
                continue;
            }
            SignatureWidget widget = new SignatureWidget(field.getFieldType(), field.getFullyQualifiedName());
            for (PDAnnotationWidget annotation : field.getWidgets()) {
                index.put(annotation.getCOSObject(), widget);
            }
        }
        return index;
    }

    private final class PdfBoxPage implements DocumentPage {

        private final int number;
        private String text;
        private List<Table> tables;

        private PdfBoxPage(int number) {
            this.number = number;
        }

        @Override
        public int number() {
            return number;
        }

        @Override
        public String text() {
            extract();
            return text;
        }

        @Override
        public List<Table> tables() {
            extract();
            return tables;
        }

        @Override
        public List<SignatureWidget> signatureWidgets() {
            if (widgetsByAnnotation.isEmpty()) {
                return List.of();
            }
            PDPage page = document.getPage(number - 1);
            try {
                List<SignatureWidget> widgets = new ArrayList<>();
                for (PDAnnotation annotation : page.getAnnotations()) {
                    SignatureWidget widget = widgetsByAnnotation.get(annotation.getCOSObject());
                    if (widget != null) {
                        widgets.add(widget);
                    }
                }
                return widgets;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read annotations on page " + number, e);
            }
        }

        private void extract() {
            if (text != null) {
                return;
            }
            try {
                PositionalTextStripper stripper = new PositionalTextStripper();
                stripper.setStartPage(number);
                stripper.setEndPage(number);
                String pageText = stripper.getText(document);
                tables = List.copyOf(tableAssembler.assemble(stripper.lines()));
                text = pageText;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to extract text from page " + number, e);
            }
        }
    }
}
