package it.autograph.domain;

import java.util.Arrays;
import java.util.Optional;

public enum CertificateAttribute {
    COMMON_NAME("2.5.4.3", "Common Name"),
    COUNTRY_NAME("2.5.4.6", "Country Name"),
    LOCALITY_NAME("2.5.4.7", "Locality Name"),
    ORGANIZATION_NAME("2.5.4.10", "Organization Name"),
    EMAIL_ADDRESS("1.2.840.113549.1.9.1", "Email Address");

    private final String oid;
    private final String displayName;

    CertificateAttribute(String oid, String displayName) {
        this.oid = oid;
        this.displayName = displayName;
    }

    public String oid() {
        return oid;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<CertificateAttribute> fromOid(String oid) {
        return Arrays.stream(values())
            .filter(attribute -> attribute.oid.equals(oid))
            .findFirst();
    }
}
