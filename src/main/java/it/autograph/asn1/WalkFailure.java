package it.autograph.asn1;

import java.nio.ByteBuffer;

/**
 * A region that stopped decoding. {@code remainder} views the bytes of the region that were not decoded.
 */
public record WalkFailure(DecodeError error, int offset, int depth, String message, ByteBuffer remainder) {

    @Override
    public ByteBuffer remainder() {
        return remainder.duplicate();
    }
}
