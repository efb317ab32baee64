package org.janelia.vizbridge.geometry;

import java.util.Optional;

import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.PolyData;

/**
 * One conversion strategy of the {@link GeometryNormalizer}.
 */
public interface GeometryConverter {

    /**
     * @return the capability this converter needs or null if it only relies on the core libraries
     */
    Capability getRequiredCapability();

    boolean accepts(Object source);

    /**
     * @return true if the accepted source only carries points (no lines or surfaces)
     */
    boolean isPointSet(Object source);

    Optional<PolyData> convert(Object source);
}
