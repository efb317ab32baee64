package org.janelia.vizbridge.geometry;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.capability.MissingCapabilityException;
import org.janelia.vizbridge.model.PolyData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts vtk.js grid documents by extracting their boundary surface and converting the
 * resulting {@code vtkPolyData} document.
 */
public class VtkJsGridConverter extends AbstractGeometryConverter<JsonNode> {

    private static final Logger LOG = LoggerFactory.getLogger(VtkJsGridConverter.class);

    public static final Set<String> GRID_CLASSES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "vtkImageData", "vtkStructuredGrid", "vtkRectilinearGrid", "vtkUnstructuredGrid")));

    private final SurfaceExtractor surfaceExtractor;
    private final VtkJsPolyDataConverter polyDataConverter;

    /**
     * @param surfaceExtractor the extractor or null if none is available
     */
    public VtkJsGridConverter(SurfaceExtractor surfaceExtractor, VtkJsPolyDataConverter polyDataConverter) {
        super(JsonNode.class, Capability.SURFACE_EXTRACTION);
        this.surfaceExtractor = surfaceExtractor;
        this.polyDataConverter = polyDataConverter;
    }

    @Override
    protected boolean acceptsSource(JsonNode source) {
        return GRID_CLASSES.contains(VtkJsPolyDataConverter.getVtkClass(source));
    }

    @Override
    public boolean isPointSet(Object source) {
        return false;
    }

    @Override
    protected PolyData convertSource(JsonNode source) {
        String vtkClass = VtkJsPolyDataConverter.getVtkClass(source);
        if (surfaceExtractor == null) {
            throw new MissingCapabilityException(Capability.SURFACE_EXTRACTION, "Converting a " + vtkClass);
        }
        long startTime = System.currentTimeMillis();
        JsonNode surface = surfaceExtractor.extractSurface(source);
        if (!polyDataConverter.accepts(surface)) {
            throw new IllegalStateException(surfaceExtractor.getClass().getName() + " returned a "
                    + VtkJsPolyDataConverter.getVtkClass(surface) + " instead of a " + VtkJsPolyDataConverter.POLY_DATA_CLASS);
        }
        LOG.debug("Extracted the surface of a {} in {}ms", vtkClass, System.currentTimeMillis() - startTime);
        return polyDataConverter.convertSource(surface);
    }
}
