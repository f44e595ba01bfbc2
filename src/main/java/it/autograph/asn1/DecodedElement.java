package it.autograph.asn1;

public record DecodedElement(Asn1Element element, int bytesConsumed) {
}
