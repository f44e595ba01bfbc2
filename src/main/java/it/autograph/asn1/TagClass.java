package it.autograph.asn1;

public enum TagClass {
    UNIVERSAL,
    APPLICATION,
    CONTEXT_SPECIFIC,
    PRIVATE;

    private static final TagClass[] BY_BITS = values();

    /**
     * Maps the two high-order bits of an identifier octet, already shifted down to 0..3.
     */
    public static TagClass fromBits(int bits) {
        return BY_BITS[bits & 0x03];
    }
}
