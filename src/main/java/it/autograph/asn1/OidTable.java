package it.autograph.asn1;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Display names for the object identifiers commonly found in code-signing structures.
 */
public final class OidTable {

    private static final Map<String, String> NAMES = Map.ofEntries(
        // signature and key algorithms
        Map.entry("1.2.840.113549.1.1.1", "rsaEncryption"),
        Map.entry("1.2.840.113549.1.1.5", "sha1WithRSAEncryption"),
        Map.entry("1.2.840.113549.1.1.10", "rsassa-pss"),
        Map.entry("1.2.840.113549.1.1.11", "sha256WithRSAEncryption"),
        Map.entry("1.2.840.113549.1.1.12", "sha384WithRSAEncryption"),
        Map.entry("1.2.840.113549.1.1.13", "sha512WithRSAEncryption"),
        Map.entry("1.2.840.10045.2.1", "ecPublicKey"),
        Map.entry("1.2.840.10045.3.1.7", "prime256v1"),
        Map.entry("1.3.132.0.34", "secp384r1"),
        Map.entry("1.2.840.10045.4.3.2", "ecdsa-with-SHA256"),
        Map.entry("1.2.840.10045.4.3.3", "ecdsa-with-SHA384"),
        // digests
        Map.entry("1.3.14.3.2.26", "sha1"),
        Map.entry("2.16.840.1.101.3.4.2.1", "sha256"),
        Map.entry("2.16.840.1.101.3.4.2.2", "sha384"),
        Map.entry("2.16.840.1.101.3.4.2.3", "sha512"),
        // PKCS#7 / CMS
        Map.entry("1.2.840.113549.1.7.1", "data"),
        Map.entry("1.2.840.113549.1.7.2", "signedData"),
        Map.entry("1.2.840.113549.1.9.3", "contentType"),
        Map.entry("1.2.840.113549.1.9.4", "messageDigest"),
        Map.entry("1.2.840.113549.1.9.5", "signingTime"),
        Map.entry("1.2.840.113549.1.9.6", "countersignature"),
        // Authenticode
        Map.entry("1.3.6.1.4.1.311.2.1.4", "spcIndirectDataContext"),
        Map.entry("1.3.6.1.4.1.311.2.1.11", "spcStatementType"),
        Map.entry("1.3.6.1.4.1.311.2.1.12", "spcSpOpusInfo"),
        Map.entry("1.3.6.1.4.1.311.2.1.15", "spcPeImageData"),
        Map.entry("1.3.6.1.4.1.311.2.1.21", "individualCodeSigning"),
        // X.509 extensions
        Map.entry("2.5.29.14", "subjectKeyIdentifier"),
        Map.entry("2.5.29.15", "keyUsage"),
        Map.entry("2.5.29.19", "basicConstraints"),
        Map.entry("2.5.29.35", "authorityKeyIdentifier"),
        Map.entry("2.5.29.37", "extKeyUsage"),
        Map.entry("1.3.6.1.5.5.7.3.3", "codeSigning"),
        // distinguished name attributes
        Map.entry("2.5.4.3", "commonName"),
        Map.entry("2.5.4.6", "countryName"),
        Map.entry("2.5.4.7", "localityName"),
        Map.entry("2.5.4.8", "stateOrProvinceName"),
        Map.entry("2.5.4.10", "organizationName"),
        Map.entry("2.5.4.11", "organizationalUnitName"),
        Map.entry("1.2.840.113549.1.9.1", "emailAddress")
    );

    private OidTable() {
    }

    public static Optional<String> nameOf(String dottedOid) {
        return Optional.ofNullable(NAMES.get(dottedOid));
    }

    /**
     * All known identifiers, ordered by dotted form.
     */
    public static Map<String, String> entries() {
        return Collections.unmodifiableMap(new TreeMap<>(NAMES));
    }

    public static int size() {
        return NAMES.size();
    }
}
