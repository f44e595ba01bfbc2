package it.autograph.asn1;

import java.math.BigInteger;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.text.ParsePosition;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.HexFormat;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Human-readable rendering of element tags and primitive contents.
 */
public final class ContentFormatter {

    static final int HEX_PREVIEW_BYTES = 32;

    private static final HexFormat HEX = HexFormat.of();
    private static final Charset UTF_32BE = Charset.forName("UTF-32BE");
    private static final Date TWO_DIGIT_YEAR_START = new Date(-631152000000L); // 1950-01-01T00:00:00Z

    private ContentFormatter() {
    }

    public static String tagName(Asn1Element element) {
        int tag = element.tagNumber();
        switch (element.tagClass()) {
            case CONTEXT_SPECIFIC:
                return "[" + tag + "]";
            case APPLICATION:
                return "APPLICATION [" + tag + "]";
            case PRIVATE:
                return "PRIVATE [" + tag + "]";
            default:
                break;
        }

        if (element.constructed()) {
            switch (tag) {
                case Asn1Tags.SEQUENCE:
                    return "SEQUENCE";
                case Asn1Tags.SET:
                    return "SET";
                default:
                    return "CONSTRUCTED [" + tag + "]";
            }
        }

        switch (tag) {
            case Asn1Tags.BOOLEAN:
                return "BOOLEAN";
            case Asn1Tags.INTEGER:
                return "INTEGER";
            case Asn1Tags.BIT_STRING:
                return "BIT STRING";
            case Asn1Tags.OCTET_STRING:
                return "OCTET STRING";
            case Asn1Tags.NULL:
                return "NULL";
            case Asn1Tags.OBJECT_IDENTIFIER:
                return "OBJECT IDENTIFIER";
            case Asn1Tags.ENUMERATED:
                return "ENUMERATED";
            case Asn1Tags.UTF8_STRING:
                return "UTF8String";
            case Asn1Tags.NUMERIC_STRING:
                return "NumericString";
            case Asn1Tags.PRINTABLE_STRING:
                return "PrintableString";
            case Asn1Tags.T61_STRING:
                return "T61String";
            case Asn1Tags.IA5_STRING:
                return "IA5String";
            case Asn1Tags.UTC_TIME:
                return "UTCTime";
            case Asn1Tags.GENERALIZED_TIME:
                return "GeneralizedTime";
            case Asn1Tags.VISIBLE_STRING:
                return "VisibleString";
            case Asn1Tags.UNIVERSAL_STRING:
                return "UniversalString";
            case Asn1Tags.BMP_STRING:
                return "BMPString";
            default:
                return "PRIMITIVE [" + tag + "]";
        }
    }

    /**
     * Formats a primitive's content. Constructed and empty elements give an empty string.
     */
    public static String format(Asn1Element element) {
        if (element.constructed() || element.contentLength() == 0) {
            return "";
        }
        if (!element.isUniversal()) {
            return hexPreview(element.contentBytes());
        }

        switch (element.tagNumber()) {
            case Asn1Tags.BOOLEAN:
                return formatBoolean(element.contentBytes());
            case Asn1Tags.INTEGER:
            case Asn1Tags.ENUMERATED:
                return formatInteger(element.contentBytes());
            case Asn1Tags.BIT_STRING:
                return formatBitString(element.contentBytes());
            case Asn1Tags.OCTET_STRING:
                return hexPreview(element.contentBytes());
            case Asn1Tags.NULL:
                return "";
            case Asn1Tags.OBJECT_IDENTIFIER:
                return formatOid(element);
            case Asn1Tags.UTF8_STRING:
            case Asn1Tags.NUMERIC_STRING:
            case Asn1Tags.PRINTABLE_STRING:
            case Asn1Tags.T61_STRING:
            case Asn1Tags.IA5_STRING:
            case Asn1Tags.VISIBLE_STRING:
            case Asn1Tags.UNIVERSAL_STRING:
            case Asn1Tags.BMP_STRING:
                return quote(decodeText(element));
            case Asn1Tags.UTC_TIME:
            case Asn1Tags.GENERALIZED_TIME:
                return formatTime(element);
            default:
                return hexPreview(element.contentBytes());
        }
    }

    /**
     * Decodes a primitive's content as text, picking the charset from the string type.
     */
    public static String decodeText(Asn1Element element) {
        return new String(element.contentBytes(), charsetFor(element));
    }

    public static String hex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    public static String hexPreview(byte[] bytes) {
        if (bytes.length > HEX_PREVIEW_BYTES) {
            return HEX.formatHex(bytes, 0, HEX_PREVIEW_BYTES) + "... (" + bytes.length + " bytes)";
        }
        return HEX.formatHex(bytes);
    }

    private static Charset charsetFor(Asn1Element element) {
        if (!element.isUniversal()) {
            return StandardCharsets.UTF_8;
        }
        switch (element.tagNumber()) {
            case Asn1Tags.BMP_STRING:
                return StandardCharsets.UTF_16BE;
            case Asn1Tags.UNIVERSAL_STRING:
                return UTF_32BE;
            case Asn1Tags.NUMERIC_STRING:
            case Asn1Tags.PRINTABLE_STRING:
            case Asn1Tags.T61_STRING:
            case Asn1Tags.IA5_STRING:
            case Asn1Tags.VISIBLE_STRING:
                return StandardCharsets.ISO_8859_1;
            default:
                return StandardCharsets.UTF_8;
        }
    }

    private static String formatBoolean(byte[] content) {
        if (content.length == 1) {
            return content[0] == 0 ? "FALSE" : "TRUE";
        }
        return hex(content);
    }

    private static String formatInteger(byte[] content) {
        if (content.length <= 8) {
            return new BigInteger(content) + " (0x" + HexFormat.of().withUpperCase().formatHex(content) + ")";
        }
        return hex(content);
    }

    private static String formatBitString(byte[] content) {
        int unusedBits = content[0] & 0xFF;
        byte[] data = new byte[content.length - 1];
        System.arraycopy(content, 1, data, 0, data.length);
        return "unused bits: " + unusedBits + ", data: " + hexPreview(data);
    }

    private static String formatOid(Asn1Element element) {
        String oid = ObjectIdentifiers.toDottedString(element.rawContent());
        if (!ObjectIdentifiers.isWellFormed(element.rawContent())) {
            return oid + " (malformed)";
        }
        return OidTable.nameOf(oid)
            .map(name -> oid + " (" + name + ")")
            .orElse(oid);
    }

    private static String formatTime(Asn1Element element) {
        String value = new String(element.contentBytes(), StandardCharsets.US_ASCII);
        String[] patterns = element.tagNumber() == Asn1Tags.UTC_TIME
            ? new String[] {"yyMMddHHmmss'Z'", "yyMMddHHmm'Z'"}
            : new String[] {"yyyyMMddHHmmss'Z'", "yyyyMMddHHmmss.SSS'Z'"};
        for (String pattern : patterns) {
            SimpleDateFormat format = new SimpleDateFormat(pattern, Locale.ROOT);
            format.setTimeZone(TimeZone.getTimeZone("UTC"));
            format.setLenient(false);
            format.set2DigitYearStart(TWO_DIGIT_YEAR_START);
            ParsePosition position = new ParsePosition(0);
            Date parsed = format.parse(value, position);
            if (parsed != null && position.getIndex() == value.length()) {
                return quote(value) + " (" + parsed.toInstant() + ")";
            }
        }
        return quote(value);
    }

    private static String quote(String text) {
        StringBuilder quoted = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                quoted.append('\\').append(c);
            } else if (c < 0x20 || c == 0x7F) {
                quoted.append(String.format(Locale.ROOT, "\\x%02x", (int) c));
            } else {
                quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }
}
