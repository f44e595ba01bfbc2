package it.autograph.cli;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;

import it.autograph.asn1.OidTable;
import it.autograph.domain.CertificateAttribute;
import it.autograph.domain.SignatureMatch;
import it.autograph.domain.ValidationResult;
import it.autograph.service.SignatureAnalysisService.AnalysisReport;

public class AnalysisReportPrinter {

    static final String SEPARATOR = "========================================";

    private final PrintStream out;

    public AnalysisReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void printHeader(String filePath) {
        out.println("Analyzing file: " + filePath);
        out.println(SEPARATOR);
    }

    public void print(AnalysisReport report) {
        SignatureMatch match = report.match();
        out.println("Valid ASN.1 signature found at offset " + match.offset());
        out.println("Structure size: " + match.size() + " bytes");

        printValidation(match.validation());
        out.println(SEPARATOR);

        report.structure().forEach(out::println);

        if (report.keySizeBits() > 0) {
            out.println("Key size calculation: " + report.keySizeBits() + " bits");
        } else {
            out.println("Key size calculation: N/A (no OCTET STRING found as final element)");
        }
        out.println(SEPARATOR);
    }

    public void printValidation(ValidationResult validation) {
        out.println(SEPARATOR);
        out.println("Signature Validation:");
        for (CertificateAttribute attribute : CertificateAttribute.values()) {
            StringBuilder line = new StringBuilder("  ")
                .append(attribute.displayName())
                .append(": ")
                .append(validation.has(attribute));
            validation.value(attribute)
                .filter(value -> !value.isEmpty())
                .ifPresent(value -> line.append(" (").append(value).append(')'));
            out.println(line);
        }

        if (validation.isValid()) {
            out.println("✓ Valid signature - all required fields present");
        } else {
            out.println("✗ Invalid signature - missing required fields");
        }
    }

    public void printOidTable() {
        out.println("Supported OIDs:");
        for (Map.Entry<String, String> entry : OidTable.entries().entrySet()) {
            out.println(String.format(Locale.ROOT, "  %-26s %s", entry.getKey(), entry.getValue()));
        }
        out.println("Total supported OIDs: " + OidTable.size());
    }
}
