package org.janelia.vizbridge.image;

/**
 * Whether a canonical image may alias the source memory or must own a copy of it.
 */
public enum BufferOwnership {
    VIEW,
    COPY
}
