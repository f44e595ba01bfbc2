package it.autograph.service;

import java.nio.ByteBuffer;

import org.springframework.stereotype.Component;

import it.autograph.asn1.Asn1Element;
import it.autograph.asn1.Asn1Tags;
import it.autograph.asn1.TreeWalker;

/**
 * Estimates the signing key size from the last element of the structure.
 * <p>
 * This is a heuristic, not a cryptographic fact: signature blocks conventionally end with the signature value,
 * whose length tracks the key modulus. If the last element visited in depth-first document order is an
 * OCTET STRING its length in bits is returned, otherwise 0.
 */
@Component
public class KeySizeEstimator {

    private final TreeWalker treeWalker;

    public KeySizeEstimator(TreeWalker treeWalker) {
        this.treeWalker = treeWalker;
    }

    public long estimate(ByteBuffer bytes) {
        Asn1Element[] last = new Asn1Element[1];
        treeWalker.walk(bytes, 0, element -> last[0] = element);
        if (last[0] == null || !last[0].isUniversalPrimitive(Asn1Tags.OCTET_STRING)) {
            return 0;
        }
        return last[0].contentLength() * 8L;
    }

    public long estimate(byte[] bytes) {
        return estimate(ByteBuffer.wrap(bytes).asReadOnlyBuffer());
    }
}
