package com.finscan.compliance.document;

import com.finscan.compliance.exception.DocumentOpenException;

public interface DocumentSource {

    AnalyzableDocument open(String reference);
}
