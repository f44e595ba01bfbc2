package it.autograph.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Presence and value of each required signer attribute. A value is only recorded for a present attribute.
 */
public final class ValidationResult {

    private static final ValidationResult EMPTY = new ValidationResult(Map.of());

    private final Map<CertificateAttribute, String> values;

    private ValidationResult(Map<CertificateAttribute, String> values) {
        EnumMap<CertificateAttribute, String> copy = new EnumMap<>(CertificateAttribute.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    public static ValidationResult of(Map<CertificateAttribute, String> values) {
        return values.isEmpty() ? EMPTY : new ValidationResult(values);
    }

    public static ValidationResult empty() {
        return EMPTY;
    }

    public boolean has(CertificateAttribute attribute) {
        return values.containsKey(attribute);
    }

    public Optional<String> value(CertificateAttribute attribute) {
        return Optional.ofNullable(values.get(attribute));
    }

    public boolean isValid() {
        return values.size() == CertificateAttribute.values().length;
    }

    public Set<CertificateAttribute> missing() {
        return Arrays.stream(CertificateAttribute.values())
            .filter(attribute -> !values.containsKey(attribute))
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(CertificateAttribute.class)));
    }

    public boolean hasCommonName() {
        return has(CertificateAttribute.COMMON_NAME);
    }

    public Optional<String> commonName() {
        return value(CertificateAttribute.COMMON_NAME);
    }

    public boolean hasCountryName() {
        return has(CertificateAttribute.COUNTRY_NAME);
    }

    public Optional<String> countryName() {
        return value(CertificateAttribute.COUNTRY_NAME);
    }

    public boolean hasLocalityName() {
        return has(CertificateAttribute.LOCALITY_NAME);
    }

    public Optional<String> localityName() {
        return value(CertificateAttribute.LOCALITY_NAME);
    }

    public boolean hasOrganizationName() {
        return has(CertificateAttribute.ORGANIZATION_NAME);
    }

    public Optional<String> organizationName() {
        return value(CertificateAttribute.ORGANIZATION_NAME);
    }

    public boolean hasEmailAddress() {
        return has(CertificateAttribute.EMAIL_ADDRESS);
    }

    public Optional<String> emailAddress() {
        return value(CertificateAttribute.EMAIL_ADDRESS);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ValidationResult && ((ValidationResult) other).values.equals(values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ValidationResult" + values;
    }
}
