package it.autograph.asn1;

public enum DecodeError {
    TRUNCATED_HEADER,
    UNSUPPORTED_LONG_FORM_TAG,
    INDEFINITE_LENGTH_UNSUPPORTED,
    TRUNCATED_LENGTH,
    LENGTH_OVERFLOW,
    TRUNCATED_CONTENT,
    RECURSION_LIMIT_EXCEEDED,
    TOO_MANY_ELEMENTS,
    MALFORMED_OID
}
