package org.janelia.vizbridge.geometry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Service that reduces a vtk.js grid document ({@code vtkImageData}, {@code vtkStructuredGrid},
 * {@code vtkRectilinearGrid} or {@code vtkUnstructuredGrid}) to its polygonal boundary.
 * Implementations are discovered with {@link java.util.ServiceLoader}.
 */
public interface SurfaceExtractor {

    /**
     * @return a {@code vtkPolyData} document
     */
    ObjectNode extractSurface(JsonNode gridDocument);
}
