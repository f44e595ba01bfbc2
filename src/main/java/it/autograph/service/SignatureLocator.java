package it.autograph.service;

import java.nio.ByteBuffer;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import it.autograph.asn1.Asn1DecodeException;
import it.autograph.asn1.DecodedElement;
import it.autograph.asn1.TagDecoder;
import it.autograph.domain.SignatureMatch;
import it.autograph.domain.ValidationResult;

/**
 * Finds a signature block appended to a file.
 * <p>
 * The buffer is scanned backwards for a SEQUENCE tag carrying a two-octet long-form length ({@code 30 82}).
 * Each candidate must decode as a complete TLV and hold every required signer attribute; otherwise scanning
 * resumes one byte earlier. The first acceptable candidate is the rightmost one, which is not necessarily the only
 * plausible block when signatures are nested or overlap.
 */
@Service
public class SignatureLocator {

    static final byte MARKER_TAG = 0x30;
    static final byte MARKER_LENGTH = (byte) 0x82;

    private static final Logger logger = LoggerFactory.getLogger(SignatureLocator.class);

    private final FieldExtractor fieldExtractor;

    public SignatureLocator(FieldExtractor fieldExtractor) {
        this.fieldExtractor = fieldExtractor;
    }

    /**
     * @throws SignatureNotFoundException when no candidate decodes and validates
     */
    public SignatureMatch locate(ByteBuffer buffer) {
        return find(buffer)
            .orElseThrow(() -> new SignatureNotFoundException("no valid signature found"));
    }

    public SignatureMatch locate(byte[] buffer) {
        return locate(ByteBuffer.wrap(buffer));
    }

    public Optional<SignatureMatch> find(ByteBuffer buffer) {
        ByteBuffer data = buffer.slice().asReadOnlyBuffer();
        int candidates = 0;
        for (int i = data.limit() - 2; i >= 0; i--) {
            if (data.get(i) != MARKER_TAG || data.get(i + 1) != MARKER_LENGTH) {
                continue;
            }
            candidates++;
            Optional<SignatureMatch> match = tryCandidate(data, i);
            if (match.isPresent()) {
                logger.debug("Accepted signature at offset {} ({} bytes) after {} candidate(s)", i, match.get().size(), candidates);
                return match;
            }
        }
        logger.debug("No signature accepted among {} candidate(s) in {} bytes", candidates, data.limit());
        return Optional.empty();
    }

    public Optional<SignatureMatch> find(byte[] buffer) {
        return find(ByteBuffer.wrap(buffer));
    }

    private Optional<SignatureMatch> tryCandidate(ByteBuffer data, int offset) {
        DecodedElement decoded;
        try {
            decoded = TagDecoder.decode(data.slice(offset, data.limit() - offset), 0, offset);
        } catch (Asn1DecodeException ex) {
            logger.debug("Rejected candidate at offset {}: {}", offset, ex.error());
            return Optional.empty();
        }

        ByteBuffer fullBytes = data.slice(offset, decoded.bytesConsumed());
        ValidationResult validation = fieldExtractor.extract(fullBytes);
        if (!validation.isValid()) {
            logger.debug("Rejected candidate at offset {}: missing {}", offset, validation.missing());
            return Optional.empty();
        }
        return Optional.of(new SignatureMatch(offset, fullBytes, validation));
    }
}
