package it.autograph.asn1;

/**
 * Receives decoded elements in depth-first document order.
 */
@FunctionalInterface
public interface ElementVisitor {

    void visit(Asn1Element element);

    /**
     * Called, in document order, when a region stops decoding. The elements already visited stay valid.
     */
    default void onFailure(WalkFailure failure) {
    }
}
