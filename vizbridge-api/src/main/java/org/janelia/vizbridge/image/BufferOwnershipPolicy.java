package org.janelia.vizbridge.image;

/**
 * Decides per source if a zero-copy view of its pixel memory is allowed.
 * Implementations must answer {@link BufferOwnership#COPY} whenever ownership cannot be established.
 */
public interface BufferOwnershipPolicy {
    BufferOwnership decide(Object source);
}
