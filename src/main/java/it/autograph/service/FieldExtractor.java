package it.autograph.service;

import java.nio.ByteBuffer;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import it.autograph.asn1.Asn1DecodeException;
import it.autograph.asn1.Asn1Element;
import it.autograph.asn1.Asn1Tags;
import it.autograph.asn1.ContentFormatter;
import it.autograph.asn1.ElementVisitor;
import it.autograph.asn1.ObjectIdentifiers;
import it.autograph.asn1.TreeWalker;
import it.autograph.asn1.WalkFailure;
import it.autograph.domain.CertificateAttribute;
import it.autograph.domain.ValidationResult;

/**
 * Collects the signer's distinguished-name attributes: each recognised attribute OID takes the value of the
 * primitive sibling that immediately follows it. When an attribute repeats, the last occurrence wins.
 */
@Component
public class FieldExtractor {

    private final TreeWalker treeWalker;

    public FieldExtractor(TreeWalker treeWalker) {
        this.treeWalker = treeWalker;
    }

    public ValidationResult extract(ByteBuffer bytes) {
        AttributeCollector collector = new AttributeCollector();
        treeWalker.walk(bytes, 0, collector);
        return ValidationResult.of(collector.values);
    }

    public ValidationResult extract(byte[] bytes) {
        return extract(ByteBuffer.wrap(bytes).asReadOnlyBuffer());
    }

    private static final class AttributeCollector implements ElementVisitor {

        private final Map<CertificateAttribute, String> values = new EnumMap<>(CertificateAttribute.class);
        private CertificateAttribute pendingAttribute;
        private int pendingDepth;

        @Override
        public void visit(Asn1Element element) {
            // in document order the element right after a primitive at the same depth is its next sibling
            if (pendingAttribute != null && element.depth() == pendingDepth
                && !element.constructed() && element.contentLength() > 0) {
                values.put(pendingAttribute, ContentFormatter.decodeText(element));
            }
            pendingAttribute = null;

            if (element.isUniversalPrimitive(Asn1Tags.OBJECT_IDENTIFIER) && element.contentLength() > 0) {
                matchAttribute(element).ifPresent(attribute -> {
                    pendingAttribute = attribute;
                    pendingDepth = element.depth();
                });
            }
        }

        @Override
        public void onFailure(WalkFailure failure) {
            pendingAttribute = null;
        }

        private Optional<CertificateAttribute> matchAttribute(Asn1Element oidElement) {
            try {
                return CertificateAttribute.fromOid(ObjectIdentifiers.parse(oidElement.rawContent()));
            } catch (Asn1DecodeException ex) {
                return Optional.empty();
            }
        }
    }
}
