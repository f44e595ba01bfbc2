package it.autograph.asn1;

import static it.autograph.asn1.DerFixtures.concat;
import static it.autograph.asn1.DerFixtures.integer;
import static it.autograph.asn1.DerFixtures.nested;
import static it.autograph.asn1.DerFixtures.nullValue;
import static it.autograph.asn1.DerFixtures.oid;
import static it.autograph.asn1.DerFixtures.sequence;
import static it.autograph.asn1.DerFixtures.signatureBlock;
import static it.autograph.asn1.DerFixtures.defaultSignerName;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

class TreeWalkerTest {

    private final TreeWalker walker = new TreeWalker();

    @Test
    void shouldVisitInDepthFirstDocumentOrder() {
        byte[] encoded = sequence(sequence(integer(1), integer(2)), oid("2.5.4.3"));
        List<Asn1Element> visited = new ArrayList<>();

        WalkResult result = walker.walk(encoded, visited::add);

        assertTrue(result.isComplete());
        assertEquals(5, result.elementCount());
        assertEquals(List.of(0, 1, 2, 2, 1), visited.stream().map(Asn1Element::depth).toList());
        assertEquals(List.of(0, 2, 4, 7, 10), visited.stream().map(Asn1Element::offset).toList());
        assertEquals(Asn1Tags.OBJECT_IDENTIFIER, visited.get(4).tagNumber());
    }

    @Test
    void shouldReportOffsetsRelativeToBase() {
        List<Asn1Element> visited = new ArrayList<>();

        walker.walk(ByteBuffer.wrap(sequence(nullValue())), 1000, visited::add);

        assertEquals(1000, visited.get(0).offset());
        assertEquals(1002, visited.get(1).offset());
    }

    @Test
    void shouldDecodeNestingUpToTheLimit() {
        WalkResult result = walker.walk(nested(TreeWalker.DEFAULT_MAX_RECURSION_DEPTH), element -> { });

        assertTrue(result.isComplete());
        assertEquals(TreeWalker.DEFAULT_MAX_RECURSION_DEPTH, result.elementCount());
    }

    @Test
    void shouldRejectSubTreeOneLevelPastTheLimit() {
        WalkResult result = walker.walk(nested(TreeWalker.DEFAULT_MAX_RECURSION_DEPTH + 1), element -> { });

        assertEquals(1, result.failures().size());
        WalkFailure failure = result.failures().get(0);
        assertEquals(DecodeError.RECURSION_LIMIT_EXCEEDED, failure.error());
        assertEquals(TreeWalker.DEFAULT_MAX_RECURSION_DEPTH + 1, failure.depth());
        assertEquals(TreeWalker.DEFAULT_MAX_RECURSION_DEPTH + 1, result.elementCount());
    }

    @Test
    void shouldKeepSiblingsOfRejectedSubTree() {
        TreeWalker shallow = new TreeWalker(2, 100);
        byte[] encoded = sequence(nested(3), integer(7));
        List<Asn1Element> visited = new ArrayList<>();

        WalkResult result = shallow.walk(encoded, visited::add);

        assertEquals(DecodeError.RECURSION_LIMIT_EXCEEDED, result.failures().get(0).error());
        Asn1Element last = visited.get(visited.size() - 1);
        assertTrue(last.isUniversalPrimitive(Asn1Tags.INTEGER));
        assertEquals(1, last.depth());
    }

    @Test
    void shouldStopRegionWithTooManyElements() {
        TreeWalker limited = new TreeWalker(50, 3);
        byte[] encoded = sequence(nullValue(), nullValue(), nullValue(), nullValue());
        List<WalkFailure> reported = new ArrayList<>();

        WalkResult result = limited.walk(ByteBuffer.wrap(encoded), 0, new ElementVisitor() {
            @Override
            public void visit(Asn1Element element) {
            }

            @Override
            public void onFailure(WalkFailure failure) {
                reported.add(failure);
            }
        });

        assertEquals(4, result.elementCount());
        assertEquals(DecodeError.TOO_MANY_ELEMENTS, result.failures().get(0).error());
        assertEquals(8, result.failures().get(0).offset());
        assertEquals(result.failures(), reported);
    }

    @Test
    void shouldKeepDecodedElementsWhenRegionIsCorrupt() {
        // inner SEQUENCE holds an INTEGER claiming five content bytes but only one is present
        byte[] encoded = concat(sequence(new byte[] {0x02, 0x05, 0x01}), integer(9));
        List<Asn1Element> visited = new ArrayList<>();

        WalkResult result = walker.walk(encoded, visited::add);

        assertFalse(result.isComplete());
        WalkFailure failure = result.failures().get(0);
        assertEquals(DecodeError.TRUNCATED_CONTENT, failure.error());
        assertEquals(2, failure.offset());
        assertEquals(1, failure.depth());
        assertEquals(3, failure.remainder().remaining());
        assertEquals(2, visited.size());
        assertEquals(9, visited.get(1).contentBytes()[0]);
    }

    @Test
    void shouldSurviveEveryTruncation() {
        byte[] encoded = signatureBlock(defaultSignerName(), 256);
        for (int length = 0; length <= encoded.length; length++) {
            ByteBuffer truncated = ByteBuffer.wrap(encoded, 0, length);
            assertDoesNotThrow(() -> walker.walk(truncated, 0, element -> { }));
        }
    }

    @Test
    void shouldSurviveRandomInput() {
        Random random = new Random(20261019L);
        for (int run = 0; run < 500; run++) {
            byte[] noise = new byte[1 + random.nextInt(512)];
            random.nextBytes(noise);
            assertDoesNotThrow(() -> walker.walk(noise, element -> { }));
        }
    }

    @Test
    void shouldBoundSelfSimilarNesting() {
        // 200 levels of SEQUENCE, each declaring exactly the rest of the buffer
        byte[] encoded = new byte[0];
        for (int i = 0; i < 200; i++) {
            encoded = DerFixtures.tlv(DerFixtures.UNIVERSAL, true, Asn1Tags.SEQUENCE, encoded);
        }
        byte[] deep = encoded;

        WalkResult result = assertDoesNotThrow(() -> walker.walk(deep, element -> { }));

        assertEquals(DecodeError.RECURSION_LIMIT_EXCEEDED, result.failures().get(0).error());
        assertEquals(TreeWalker.DEFAULT_MAX_RECURSION_DEPTH + 1, result.elementCount());
    }
}
