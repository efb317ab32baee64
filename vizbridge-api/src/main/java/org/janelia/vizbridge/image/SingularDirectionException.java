package org.janelia.vizbridge.image;

/**
 * The direction matrix of an image cannot be inverted.
 */
public class SingularDirectionException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public SingularDirectionException(String message) {
        super(message);
    }

    public SingularDirectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
