package it.autograph.service;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import it.autograph.asn1.Asn1Element;
import it.autograph.asn1.ContentFormatter;
import it.autograph.asn1.ElementVisitor;
import it.autograph.asn1.TreeWalker;
import it.autograph.asn1.WalkFailure;

/**
 * Renders a decoded structure one element per line, in the layout of {@code openssl asn1parse}. A region that
 * stops decoding is shown as a hex dump of its undecoded bytes.
 */
@Component
public class StructureDumper {

    private final TreeWalker treeWalker;

    public StructureDumper(TreeWalker treeWalker) {
        this.treeWalker = treeWalker;
    }

    public List<ElementDescription> describe(ByteBuffer bytes, int baseOffset) {
        List<ElementDescription> elements = new ArrayList<>();
        treeWalker.walk(bytes, baseOffset, element -> elements.add(ElementDescription.of(element)));
        return elements;
    }

    public List<String> render(ByteBuffer bytes, int baseOffset) {
        List<String> lines = new ArrayList<>();
        treeWalker.walk(bytes, baseOffset, new ElementVisitor() {
            @Override
            public void visit(Asn1Element element) {
                lines.add(ElementDescription.of(element).toLine());
            }

            @Override
            public void onFailure(WalkFailure failure) {
                lines.add(hexDumpLine(failure));
            }
        });
        return lines;
    }

    public List<String> render(byte[] bytes) {
        return render(ByteBuffer.wrap(bytes).asReadOnlyBuffer(), 0);
    }

    static String hexDumpLine(WalkFailure failure) {
        ByteBuffer remainder = failure.remainder();
        byte[] undecoded = new byte[remainder.remaining()];
        remainder.get(undecoded);
        return "  ".repeat(failure.depth()) + "[HEX DUMP]: " + ContentFormatter.hex(undecoded) + "  (" + failure.error() + ")";
    }
}
