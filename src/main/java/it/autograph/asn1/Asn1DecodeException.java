package it.autograph.asn1;

/**
 * Raised when a byte window does not hold a structure the decoder accepts.
 * Always local to one candidate offset or one sub-tree.
 */
public class Asn1DecodeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final DecodeError error;
    private final int offset;

    public Asn1DecodeException(DecodeError error, int offset, String message) {
        super(message + " at offset " + offset);
        this.error = error;
        this.offset = offset;
    }

    public DecodeError error() {
        return error;
    }

    public int offset() {
        return offset;
    }
}
