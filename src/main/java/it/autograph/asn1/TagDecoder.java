package it.autograph.asn1;

import java.nio.ByteBuffer;

/**
 * Decodes exactly one TLV header from a byte window. Only the short tag form and definite lengths are accepted.
 */
public final class TagDecoder {

    private TagDecoder() {
    }

    /**
     * Decodes the element starting at the window's current position.
     *
     * @param window bytes available to the element; the element may not extend past its limit
     * @param depth nesting level recorded on the element
     * @param offset absolute position of the window's first byte in the original buffer
     */
    public static DecodedElement decode(ByteBuffer window, int depth, int offset) {
        return decodeAt(window.slice(), 0, depth, offset);
    }

    /**
     * Decodes the element at {@code index} of {@code region}, using absolute buffer indices.
     * {@code baseOffset} is the position of the region's index 0 in the original buffer.
     */
    static DecodedElement decodeAt(ByteBuffer region, int index, int depth, int baseOffset) {
        int limit = region.limit();
        int start = index;
        int absolute = baseOffset + start;
        if (limit - start < 2) {
            throw new Asn1DecodeException(DecodeError.TRUNCATED_HEADER, absolute, "Missing ASN.1 BER tag and length");
        }

        int identifier = region.get(index++) & 0xFF;
        TagClass tagClass = TagClass.fromBits(identifier >> 6);
        boolean constructed = (identifier & 0x20) != 0;
        int tagNumber = identifier & 0x1F;
        if (tagNumber == Asn1Tags.LONG_FORM_TAG) {
            throw new Asn1DecodeException(DecodeError.UNSUPPORTED_LONG_FORM_TAG, absolute, "High-tag-number form is not supported");
        }

        int firstLengthOctet = region.get(index++) & 0xFF;
        long valueLength;
        if ((firstLengthOctet & 0x80) == 0) {
            valueLength = firstLengthOctet;
        } else {
            int numberOfLengthOctets = firstLengthOctet & 0x7F;
            if (numberOfLengthOctets == 0) {
                throw new Asn1DecodeException(DecodeError.INDEFINITE_LENGTH_UNSUPPORTED, absolute, "Indefinite BER length is not supported");
            }
            if (numberOfLengthOctets > limit - index) {
                throw new Asn1DecodeException(DecodeError.TRUNCATED_LENGTH, absolute, "Truncated BER length");
            }
            valueLength = 0;
            for (int i = 0; i < numberOfLengthOctets; i++) {
                if ((valueLength >>> 56) != 0) {
                    throw new Asn1DecodeException(DecodeError.LENGTH_OVERFLOW, absolute, "BER length does not fit in 64 bits");
                }
                valueLength = (valueLength << 8) | (region.get(index++) & 0xFF);
            }
        }

        int headerLength = index - start;
        int available = limit - index;
        if (Long.compareUnsigned(valueLength, available) > 0) {
            throw new Asn1DecodeException(DecodeError.TRUNCATED_CONTENT, absolute,
                "BER value length " + Long.toUnsignedString(valueLength) + " exceeds " + available + " available bytes");
        }

        int contentLength = (int) valueLength;
        ByteBuffer content = region.slice(index, contentLength);
        Asn1Element element = new Asn1Element(tagClass, tagNumber, constructed, depth, absolute, headerLength, contentLength, content);
        return new DecodedElement(element, headerLength + contentLength);
    }
}
