package it.autograph.asn1;

import java.nio.ByteBuffer;

/**
 * One decoded TLV unit. {@code rawContent} is a view into the caller's buffer, never a copy.
 */
public record Asn1Element(
    TagClass tagClass,
    int tagNumber,
    boolean constructed,
    int depth,
    int offset,
    int headerLength,
    int contentLength,
    ByteBuffer rawContent
) {

    public Asn1Element {
        if (tagClass == null) {
            throw new IllegalArgumentException("ASN.1 tag class is mandatory");
        }
        if (tagNumber < 0) {
            throw new IllegalArgumentException("Invalid ASN.1 tag number: " + tagNumber);
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Invalid ASN.1 depth: " + depth);
        }
        if (contentLength < 0) {
            throw new IllegalArgumentException("Invalid ASN.1 length: " + contentLength);
        }
        if (rawContent == null || rawContent.remaining() != contentLength) {
            throw new IllegalArgumentException("ASN.1 value length mismatch");
        }
    }

    @Override
    public ByteBuffer rawContent() {
        return rawContent.duplicate();
    }

    /**
     * Copies the content octets; intended for the small primitives that end up as text or numbers.
     */
    public byte[] contentBytes() {
        byte[] copy = new byte[contentLength];
        rawContent.duplicate().get(copy);
        return copy;
    }

    public int totalLength() {
        return headerLength + contentLength;
    }

    public boolean isUniversal() {
        return tagClass == TagClass.UNIVERSAL;
    }

    public boolean isContextSpecific() {
        return tagClass == TagClass.CONTEXT_SPECIFIC;
    }

    public boolean isUniversalPrimitive(int universalTag) {
        return isUniversal() && !constructed && tagNumber == universalTag;
    }
}
