package it.autograph.asn1;

import static it.autograph.asn1.DerFixtures.CONTEXT;
import static it.autograph.asn1.DerFixtures.UNIVERSAL;
import static it.autograph.asn1.DerFixtures.tlv;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class ContentFormatterTest {

    @Test
    void shouldNameUniversalTypes() {
        assertEquals("SEQUENCE", ContentFormatter.tagName(element(DerFixtures.sequence())));
        assertEquals("SET", ContentFormatter.tagName(element(DerFixtures.set())));
        assertEquals("CONSTRUCTED [4]", ContentFormatter.tagName(element(tlv(UNIVERSAL, true, Asn1Tags.OCTET_STRING, new byte[0]))));
        assertEquals("OBJECT IDENTIFIER", ContentFormatter.tagName(element(DerFixtures.oid("2.5.4.3"))));
        assertEquals("PrintableString", ContentFormatter.tagName(element(DerFixtures.printable("IT"))));
        assertEquals("PRIMITIVE [15]", ContentFormatter.tagName(element(tlv(UNIVERSAL, false, 15, new byte[] {1}))));
    }

    @Test
    void shouldNameNonUniversalClasses() {
        assertEquals("[0]", ContentFormatter.tagName(element(DerFixtures.contextConstructed(0))));
        assertEquals("APPLICATION [1]", ContentFormatter.tagName(element(new byte[] {0x41, 0x01, 0x00})));
        assertEquals("PRIVATE [2]", ContentFormatter.tagName(element(new byte[] {(byte) 0xC2, 0x00})));
    }

    @Test
    void shouldFormatNumbersAndBooleans() {
        assertEquals("1 (0x01)", ContentFormatter.format(element(DerFixtures.integer(1))));
        assertEquals("-1 (0xFF)", ContentFormatter.format(element(DerFixtures.integer(-1))));
        assertEquals("TRUE", ContentFormatter.format(element(new byte[] {0x01, 0x01, (byte) 0xFF})));
        assertEquals("FALSE", ContentFormatter.format(element(new byte[] {0x01, 0x01, 0x00})));
    }

    @Test
    void shouldPrintLongIntegersAsHex() {
        byte[] serial = new byte[] {0x02, 0x09, 0x01, 0x02, 0x03, 0x04, 0x05, 0x06, 0x07, 0x08, 0x09};

        assertEquals("010203040506070809", ContentFormatter.format(element(serial)));
    }

    @Test
    void shouldFormatBitString() {
        byte[] bits = new byte[] {0x03, 0x03, 0x04, (byte) 0xAB, (byte) 0xC0};

        assertEquals("unused bits: 4, data: abc0", ContentFormatter.format(element(bits)));
    }

    @Test
    void shouldTruncateLongOctetStrings() {
        String formatted = ContentFormatter.format(element(DerFixtures.octetString(40)));

        assertEquals("ab".repeat(ContentFormatter.HEX_PREVIEW_BYTES) + "... (40 bytes)", formatted);
    }

    @Test
    void shouldAnnotateKnownAndMalformedOids() {
        assertEquals("2.5.4.3 (commonName)", ContentFormatter.format(element(DerFixtures.oid("2.5.4.3"))));
        assertEquals("1.2.3.4", ContentFormatter.format(element(DerFixtures.oid("1.2.3.4"))));
        assertEquals("2.5.4 (malformed)", ContentFormatter.format(element(new byte[] {0x06, 0x03, 0x55, 0x04, (byte) 0x83})));
    }

    @Test
    void shouldQuoteAndEscapeStrings() {
        assertEquals("\"Test Signer\"", ContentFormatter.format(element(DerFixtures.utf8("Test Signer"))));
        assertEquals("\"a\\\"b\\\\c\\x0a\"", ContentFormatter.format(element(DerFixtures.utf8("a\"b\\c\n"))));
    }

    @Test
    void shouldDecodeTextByStringType() {
        byte[] bmp = tlv(UNIVERSAL, false, Asn1Tags.BMP_STRING, "Zoë".getBytes(StandardCharsets.UTF_16BE));
        byte[] latin = tlv(UNIVERSAL, false, Asn1Tags.T61_STRING, new byte[] {'M', (byte) 0xFC, 'n'});

        assertEquals("Zoë", ContentFormatter.decodeText(TagDecoder.decode(ByteBuffer.wrap(bmp), 0, 0).element()));
        assertEquals("Mün", ContentFormatter.decodeText(TagDecoder.decode(ByteBuffer.wrap(latin), 0, 0).element()));
        assertEquals("Zoë", ContentFormatter.decodeText(element(DerFixtures.utf8("Zoë"))));
    }

    @Test
    void shouldFormatTimes() {
        byte[] utc = tlv(UNIVERSAL, false, Asn1Tags.UTC_TIME, "250101120000Z".getBytes(StandardCharsets.US_ASCII));
        byte[] utcLastCentury = tlv(UNIVERSAL, false, Asn1Tags.UTC_TIME, "991231235959Z".getBytes(StandardCharsets.US_ASCII));
        byte[] generalized = tlv(UNIVERSAL, false, Asn1Tags.GENERALIZED_TIME, "20300615080000Z".getBytes(StandardCharsets.US_ASCII));
        byte[] garbage = tlv(UNIVERSAL, false, Asn1Tags.UTC_TIME, "not a time".getBytes(StandardCharsets.US_ASCII));

        assertEquals("\"250101120000Z\" (2025-01-01T12:00:00Z)", ContentFormatter.format(element(utc)));
        assertEquals("\"991231235959Z\" (1999-12-31T23:59:59Z)", ContentFormatter.format(element(utcLastCentury)));
        assertEquals("\"20300615080000Z\" (2030-06-15T08:00:00Z)", ContentFormatter.format(element(generalized)));
        assertEquals("\"not a time\"", ContentFormatter.format(element(garbage)));
    }

    @Test
    void shouldShowNonUniversalPrimitivesAsHex() {
        assertEquals("0a0b", ContentFormatter.format(element(tlv(CONTEXT, false, 1, new byte[] {0x0A, 0x0B}))));
    }

    @Test
    void shouldLeaveConstructedAndEmptyElementsBlank() {
        assertEquals("", ContentFormatter.format(element(DerFixtures.sequence(DerFixtures.integer(1)))));
        assertEquals("", ContentFormatter.format(element(DerFixtures.nullValue())));
    }

    private static Asn1Element element(byte[] encoded) {
        return TagDecoder.decode(ByteBuffer.wrap(encoded), 0, 0).element();
    }
}
