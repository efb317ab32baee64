package org.janelia.vizbridge.image;

import java.nio.Buffer;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import org.janelia.vizbridge.geometry.VtkJsArrays;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.SpatialImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the point scalars of a vtk.js {@code vtkImageData} document. The image always has the
 * three vtk axes, reversed to z, y, x. The origin is the position of the first point of the extent
 * and the column-major vtk.js direction is reordered to the canonical axis order.
 */
public class VtkJsImageDataConverter extends AbstractImageConverter<JsonNode> {

    private static final Logger LOG = LoggerFactory.getLogger(VtkJsImageDataConverter.class);

    static final String IMAGE_DATA_CLASS = "vtkImageData";

    public VtkJsImageDataConverter() {
        super(JsonNode.class, null);
    }

    @Override
    public boolean accepts(Object source) {
        return super.accepts(source) && IMAGE_DATA_CLASS.equals(((JsonNode) source).path("vtkClass").asText());
    }

    @Override
    protected Optional<SpatialImage> convertSource(JsonNode document) {
        JsonNode scalarsNode = getScalars(document.path("pointData"));
        if (scalarsNode == null) {
            LOG.debug("{} has no point scalars", IMAGE_DATA_CLASS);
            return Optional.empty();
        }
        long[] vtkDims = new long[3];
        long[] minIndex = new long[3];
        readExtent(document, vtkDims, minIndex);
        double[] vtkSpacing = readVector(document.get("spacing"), 3, 1.);
        double[] vtkOrigin = readVector(document.get("origin"), 3, 0.);
        double[] vtkDirection = document.has("direction")
                ? readVector(document.get("direction"), 9, 0.)
                : new double[] {1, 0, 0, 0, 1, 0, 0, 0, 1};

        ComponentType componentType = VtkJsArrays.getDataType(scalarsNode);
        Buffer values = VtkJsArrays.readValues(scalarsNode, componentType);
        int componentsPerPixel = scalarsNode.path("numberOfComponents").asInt(1);
        long[] dims = reversed(vtkDims);
        int nElements = checkedBufferSize(dims, componentsPerPixel);
        if (values.limit() != nElements) {
            throw new IllegalArgumentException("Scalars " + VtkJsArrays.getName(scalarsNode) + " hold " + values.limit()
                    + " values but the image needs " + nElements);
        }

        // position of the first point: origin + direction * (minIndex * spacing)
        double[] firstPoint = new double[3];
        for (int r = 0; r < 3; r++) {
            firstPoint[r] = vtkOrigin[r];
            for (int c = 0; c < 3; c++) {
                firstPoint[r] += vtkDirection[3 * c + r] * minIndex[c] * vtkSpacing[c];
            }
        }
        double[] direction = new double[9];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                direction[3 * r + c] = vtkDirection[3 * (2 - c) + (2 - r)];
            }
        }
        return Optional.of(SpatialImage.builder()
                .dims(dims)
                .spacing(reversed(vtkSpacing))
                .origin(reversed(firstPoint))
                .direction(direction)
                .pixelType(pixelTypeForComponents(componentsPerPixel))
                .componentType(componentType)
                .componentsPerPixel(componentsPerPixel)
                .buffer(values)
                .build());
    }

    /**
     * @return the active scalars or the only point array, or null if neither exists
     */
    private static JsonNode getScalars(JsonNode pointData) {
        JsonNode arrays = pointData.path("arrays");
        if (!arrays.isArray() || arrays.size() == 0) {
            return null;
        }
        JsonNode activeScalars = pointData.get("activeScalars");
        JsonNode arrayNode;
        if (activeScalars != null && activeScalars.canConvertToInt()
                && activeScalars.asInt() >= 0 && activeScalars.asInt() < arrays.size()) {
            arrayNode = arrays.get(activeScalars.asInt());
        } else if (arrays.size() == 1) {
            arrayNode = arrays.get(0);
        } else {
            return null;
        }
        return arrayNode.has("data") && arrayNode.get("data").isObject() ? arrayNode.get("data") : arrayNode;
    }

    private static void readExtent(JsonNode document, long[] dims, long[] minIndex) {
        JsonNode extent = document.get("extent");
        if (extent != null && extent.isArray() && extent.size() == 6) {
            for (int d = 0; d < 3; d++) {
                minIndex[d] = extent.get(2 * d).asLong();
                dims[d] = extent.get(2 * d + 1).asLong() - minIndex[d] + 1;
            }
        } else {
            JsonNode dimensions = document.get("dimensions");
            if (dimensions == null || !dimensions.isArray()) {
                throw new IllegalArgumentException(IMAGE_DATA_CLASS + " has neither an extent nor dimensions");
            }
            for (int d = 0; d < 3; d++) {
                dims[d] = dimensions.path(d).asLong(1);
            }
        }
        for (long d : dims) {
            if (d < 1) {
                throw new IllegalArgumentException("Empty " + IMAGE_DATA_CLASS);
            }
        }
    }

    private static double[] readVector(JsonNode node, int n, double defaultValue) {
        double[] v = new double[n];
        for (int i = 0; i < n; i++) {
            v[i] = node == null ? defaultValue : node.path(i).asDouble(defaultValue);
        }
        return v;
    }
}
