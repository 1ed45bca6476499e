package com.finscan.compliance.document;

import java.util.List;

/**
 * An opened document, held for the duration of one analysis operation.
 */
public interface AnalyzableDocument extends AutoCloseable {

    String reference();

    List<DocumentPage> pages();

    @Override
    void close();
}
