package com.finscan.compliance.document;

/**
 * A form widget found on a page. {@code fieldType} is the PDF field type name
 * ({@code Sig}, {@code Tx}, {@code Btn}, {@code Ch}).
 */
public record SignatureWidget(String fieldType, String fieldName) {

    public static final String SIGNATURE_FIELD_TYPE = "Sig";

    public static SignatureWidget signature(String fieldName) {
        return new SignatureWidget(SIGNATURE_FIELD_TYPE, fieldName);
    }

    public boolean isSignature() {
        return SIGNATURE_FIELD_TYPE.equals(fieldType);
    }
}
