package org.janelia.vizbridge.capability;

/**
 * Raised when an input was recognized but converting it needs an integration that is not available.
 */
public class MissingCapabilityException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Capability capability;

    public MissingCapabilityException(Capability capability, String reason) {
        super(reason + " requires " + capability + " which is not available - add " + capability.getProvider() + " to the class path");
        this.capability = capability;
    }

    public Capability getCapability() {
        return capability;
    }
}
