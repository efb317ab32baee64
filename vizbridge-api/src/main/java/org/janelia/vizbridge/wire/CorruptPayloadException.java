package org.janelia.vizbridge.wire;

/**
 * A wire payload cannot be decoded: the compressed stream is damaged or does not match
 * its header, or the header itself is inconsistent.
 */
public class CorruptPayloadException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public CorruptPayloadException(String message) {
        super(message);
    }

    public CorruptPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
