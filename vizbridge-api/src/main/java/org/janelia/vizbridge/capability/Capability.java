package org.janelia.vizbridge.capability;

/**
 * Optional peer ecosystems the normalizers can integrate with.
 */
public enum Capability {
    IMAGEJ("ij.ImagePlus", false, "net.imagej:ij"),
    IMAGEJ_SESSION("ij.WindowManager", false, "net.imagej:ij"),
    AWT("java.awt.image.BufferedImage", false, "the java.desktop module"),
    JTS("org.locationtech.jts.geom.Geometry", false, "org.locationtech.jts:jts-core"),
    JGRAPHT("org.jgrapht.Graph", false, "org.jgrapht:jgrapht-core"),
    SURFACE_EXTRACTION("org.janelia.vizbridge.geometry.SurfaceExtractor", true, "org.janelia.vizbridge:vizbridge-surface");

    private final String probeClassName;
    private final boolean service;
    private final String provider;

    Capability(String probeClassName, boolean service, String provider) {
        this.probeClassName = probeClassName;
        this.service = service;
        this.provider = provider;
    }

    /**
     * @return the class whose presence reveals the capability or, for service capabilities,
     * the service interface that must have at least one implementation
     */
    String getProbeClassName() {
        return probeClassName;
    }

    boolean isService() {
        return service;
    }

    /**
     * @return what has to be added to the class path to get this capability
     */
    public String getProvider() {
        return provider;
    }
}
