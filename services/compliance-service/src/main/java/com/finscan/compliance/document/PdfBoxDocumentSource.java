package com.finscan.compliance.document;

import com.finscan.compliance.exception.DocumentOpenException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * Opens local PDF files, and remote ones when a {@link RemoteDocumentFetcher} is configured.
 */
public class PdfBoxDocumentSource implements DocumentSource {

    private final RemoteDocumentFetcher remoteFetcher;
    private final float columnGap;

    public PdfBoxDocumentSource(RemoteDocumentFetcher remoteFetcher, float columnGap) {
        this.remoteFetcher = remoteFetcher;
        this.columnGap = columnGap;
    }

    @Override
    public AnalyzableDocument open(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new DocumentOpenException("document reference is blank");
        }
        PDDocument document = RemoteDocumentFetcher.isRemote(reference)
            ? loadRemote(reference)
            : loadLocal(reference);
        try {
            return createDocument(reference, document);
        } catch (RuntimeException e) {
            DocumentOpenException failure = new DocumentOpenException("unreadable document structure in " + reference, e);
            try {
                document.close();
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
    }

    AnalyzableDocument createDocument(String reference, PDDocument document) {
        return new PdfBoxDocument(reference, document, columnGap);
    }

    private PDDocument loadRemote(String url) {
        if (remoteFetcher == null) {
            throw new DocumentOpenException("remote documents are disabled: " + url);
        }
        byte[] bytes = remoteFetcher.fetch(url);
        try {
            return Loader.loadPDF(bytes);
        } catch (IOException e) {
            throw new DocumentOpenException(e.getMessage(), e);
        }
    }

    private PDDocument loadLocal(String reference) {
        Path path;
        try {
            path = Path.of(reference);
        } catch (InvalidPathException e) {
            throw new DocumentOpenException("invalid path " + reference, e);
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new DocumentOpenException("no readable file at " + reference);
        }
        try {
            return Loader.loadPDF(path.toFile());
        } catch (IOException e) {
            throw new DocumentOpenException(e.getMessage(), e);
        }
    }
}
