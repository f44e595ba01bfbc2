package it.autograph.asn1;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-first, document-order decoder shared by field extraction, key-size inference and the structure dump.
 * <p>
 * Nesting is bounded by {@code maxRecursionDepth} and the number of siblings in one region by
 * {@code maxElementsPerLevel}. Failures never propagate: they end the region that produced them, are handed to the
 * visitor and are collected in the returned {@link WalkResult}.
 */
public class TreeWalker {

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 50;
    public static final int DEFAULT_MAX_ELEMENTS_PER_LEVEL = 10_000;

    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    private final int maxRecursionDepth;
    private final int maxElementsPerLevel;

    public TreeWalker() {
        this(DEFAULT_MAX_RECURSION_DEPTH, DEFAULT_MAX_ELEMENTS_PER_LEVEL);
    }

    public TreeWalker(int maxRecursionDepth, int maxElementsPerLevel) {
        if (maxRecursionDepth < 1) {
            throw new IllegalArgumentException("Maximum recursion depth must be positive");
        }
        if (maxElementsPerLevel < 1) {
            throw new IllegalArgumentException("Maximum elements per level must be positive");
        }
        this.maxRecursionDepth = maxRecursionDepth;
        this.maxElementsPerLevel = maxElementsPerLevel;
    }

    public int maxRecursionDepth() {
        return maxRecursionDepth;
    }

    public int maxElementsPerLevel() {
        return maxElementsPerLevel;
    }

    /**
     * Walks every element of {@code region}, from its position to its limit.
     *
     * @param baseOffset absolute position of the region's first byte, used for reported offsets
     */
    public WalkResult walk(ByteBuffer region, int baseOffset, ElementVisitor visitor) {
        Walk walk = new Walk(visitor);
        walk.region(region.slice(), baseOffset, 0);
        return new WalkResult(walk.elementCount, walk.failures);
    }

    public WalkResult walk(byte[] region, ElementVisitor visitor) {
        return walk(ByteBuffer.wrap(region).asReadOnlyBuffer(), 0, visitor);
    }

    private final class Walk {

        private final ElementVisitor visitor;
        private final List<WalkFailure> failures = new ArrayList<>();
        private int elementCount;

        private Walk(ElementVisitor visitor) {
            this.visitor = visitor;
        }

        private void region(ByteBuffer region, int baseOffset, int depth) {
            int index = 0;
            int siblings = 0;
            while (index < region.limit()) {
                if (siblings == maxElementsPerLevel) {
                    fail(DecodeError.TOO_MANY_ELEMENTS, region, index, baseOffset, depth,
                        "Region holds more than " + maxElementsPerLevel + " elements");
                    return;
                }

                DecodedElement decoded;
                try {
                    decoded = TagDecoder.decodeAt(region, index, depth, baseOffset);
                } catch (Asn1DecodeException ex) {
                    fail(ex.error(), region, index, baseOffset, depth, ex.getMessage());
                    return;
                }

                Asn1Element element = decoded.element();
                siblings++;
                elementCount++;
                visitor.visit(element);
                if (element.constructed()) {
                    descend(element);
                }
                index += decoded.bytesConsumed();
            }
        }

        private void descend(Asn1Element element) {
            // rawContent was bounded by TagDecoder against the enclosing region
            ByteBuffer content = element.rawContent();
            int contentOffset = element.offset() + element.headerLength();
            if (element.depth() >= maxRecursionDepth) {
                fail(DecodeError.RECURSION_LIMIT_EXCEEDED, content, 0, contentOffset, element.depth() + 1,
                    "Nesting deeper than " + maxRecursionDepth + " levels");
                return;
            }
            region(content, contentOffset, element.depth() + 1);
        }

        private void fail(DecodeError error, ByteBuffer region, int index, int baseOffset, int depth, String message) {
            ByteBuffer remainder = region.slice(index, region.limit() - index);
            WalkFailure failure = new WalkFailure(error, baseOffset + index, depth, message, remainder);
            logger.debug("ASN.1 walk stopped at offset {} depth {}: {} ({})", failure.offset(), depth, error, message);
            failures.add(failure);
            visitor.onFailure(failure);
        }
    }
}
