package it.autograph.service;

import java.nio.ByteBuffer;
import java.util.List;

import org.springframework.stereotype.Service;

import it.autograph.domain.SignatureMatch;

@Service
public class SignatureAnalysisService {

    private final SignatureLocator signatureLocator;
    private final KeySizeEstimator keySizeEstimator;
    private final StructureDumper structureDumper;

    public SignatureAnalysisService(SignatureLocator signatureLocator, KeySizeEstimator keySizeEstimator, StructureDumper structureDumper) {
        this.signatureLocator = signatureLocator;
        this.keySizeEstimator = keySizeEstimator;
        this.structureDumper = structureDumper;
    }

    /**
     * @throws SignatureNotFoundException when the buffer holds no acceptable signature block
     */
    public AnalysisReport analyze(ByteBuffer buffer) {
        SignatureMatch match = signatureLocator.locate(buffer);
        long keySizeBits = keySizeEstimator.estimate(match.fullBytes());
        List<String> structure = structureDumper.render(match.fullBytes(), match.offset());
        return new AnalysisReport(match, keySizeBits, structure);
    }

    public record AnalysisReport(SignatureMatch match, long keySizeBits, List<String> structure) {

        public AnalysisReport {
            structure = List.copyOf(structure);
        }
    }
}
