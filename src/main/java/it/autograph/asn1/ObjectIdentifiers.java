package it.autograph.asn1;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * OBJECT IDENTIFIER content to dotted-decimal text.
 */
public final class ObjectIdentifiers {

    private static final BigInteger EIGHTY = BigInteger.valueOf(80);

    private ObjectIdentifiers() {
    }

    /**
     * Best-effort form: a trailing sub-identifier whose continuation bit never clears is dropped. Empty content
     * gives an empty string.
     */
    public static String toDottedString(ByteBuffer content) {
        return join(decodeArcs(content.duplicate()));
    }

    public static String toDottedString(byte[] content) {
        return toDottedString(ByteBuffer.wrap(content));
    }

    /**
     * Strict form used for matching.
     *
     * @throws Asn1DecodeException with {@link DecodeError#MALFORMED_OID} if the last sub-identifier is incomplete
     */
    public static String parse(ByteBuffer content) {
        Arcs arcs = decodeArcs(content.duplicate());
        if (!arcs.complete()) {
            throw new Asn1DecodeException(DecodeError.MALFORMED_OID, arcs.incompleteAt(), "Unterminated OBJECT IDENTIFIER sub-identifier");
        }
        return join(arcs);
    }

    public static String parse(byte[] content) {
        return parse(ByteBuffer.wrap(content));
    }

    public static boolean isWellFormed(ByteBuffer content) {
        return decodeArcs(content.duplicate()).complete();
    }

    private static Arcs decodeArcs(ByteBuffer content) {
        List<BigInteger> subIdentifiers = new ArrayList<>();
        int read = 0;
        long value = 0;
        BigInteger wide = null;
        boolean pending = false;
        int pendingStart = 0;
        while (content.hasRemaining()) {
            if (!pending) {
                pendingStart = read;
            }
            int octet = content.get() & 0xFF;
            read++;
            pending = true;
            if (wide == null && (value >>> 56) != 0) {
                wide = BigInteger.valueOf(value);
            }
            if (wide != null) {
                wide = wide.shiftLeft(7).or(BigInteger.valueOf(octet & 0x7F));
            } else {
                value = (value << 7) | (octet & 0x7F);
            }
            if ((octet & 0x80) == 0) {
                subIdentifiers.add(wide != null ? wide : BigInteger.valueOf(value));
                value = 0;
                wide = null;
                pending = false;
            }
        }

        List<String> arcs = new ArrayList<>();
        if (!subIdentifiers.isEmpty()) {
            BigInteger first = subIdentifiers.get(0);
            if (first.compareTo(EIGHTY) < 0) {
                int small = first.intValue();
                arcs.add(String.valueOf(small / 40));
                arcs.add(String.valueOf(small % 40));
            } else {
                arcs.add("2");
                arcs.add(first.subtract(EIGHTY).toString());
            }
            for (int i = 1; i < subIdentifiers.size(); i++) {
                arcs.add(subIdentifiers.get(i).toString());
            }
        }
        return new Arcs(arcs, !pending, pendingStart);
    }

    private static String join(Arcs arcs) {
        return String.join(".", arcs.values());
    }

    private record Arcs(List<String> values, boolean complete, int incompleteAt) {
    }
}
