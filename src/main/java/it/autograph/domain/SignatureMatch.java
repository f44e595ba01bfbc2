package it.autograph.domain;

import java.nio.ByteBuffer;

/**
 * An accepted signature block: where it starts, the exact header+content bytes, and the attributes found in it.
 */
public record SignatureMatch(int offset, ByteBuffer fullBytes, ValidationResult validation) {

    public SignatureMatch {
        if (offset < 0) {
            throw new IllegalArgumentException("Invalid signature offset: " + offset);
        }
        if (fullBytes == null || validation == null) {
            throw new IllegalArgumentException("Signature bytes and validation are mandatory");
        }
        fullBytes = fullBytes.asReadOnlyBuffer();
    }

    @Override
    public ByteBuffer fullBytes() {
        return fullBytes.duplicate();
    }

    public int size() {
        return fullBytes.remaining();
    }
}
