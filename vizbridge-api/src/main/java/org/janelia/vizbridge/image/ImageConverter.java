package org.janelia.vizbridge.image;

import java.util.Optional;

import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.SpatialImage;

/**
 * One conversion strategy of the {@link ImageNormalizer}.
 */
public interface ImageConverter {

    /**
     * @return the capability this converter needs or null if it only relies on the core libraries
     */
    Capability getRequiredCapability();

    boolean accepts(Object source);

    /**
     * Convert an accepted source. An empty result means the source was recognized but
     * does not designate any image data.
     */
    Optional<SpatialImage> convert(Object source);
}
