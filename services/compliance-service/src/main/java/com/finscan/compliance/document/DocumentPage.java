package com.finscan.compliance.document;

import java.util.List;

public interface DocumentPage {

    int number();

    String text();

    List<Table> tables();

    List<SignatureWidget> signatureWidgets();
}
