package org.janelia.vizbridge.model;

/**
 * Raised when a component type symbol or array type name has no canonical counterpart.
 */
public class UnsupportedComponentTypeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public UnsupportedComponentTypeException(String message) {
        super(message);
    }
}
