package org.janelia.vizbridge.geometry;

import java.io.IOException;
import java.nio.Buffer;
import java.nio.IntBuffer;
import java.util.Iterator;

import com.fasterxml.jackson.databind.JsonNode;
import org.janelia.vizbridge.model.AttributeRole;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.DataArray;
import org.janelia.vizbridge.model.DataSetAttributes;
import org.janelia.vizbridge.model.PolyData;
import org.janelia.vizbridge.model.TypedBuffers;

/**
 * Readers for the typed arrays of vtk.js data set documents. Values may be given as a JSON
 * numeric array, as binary content or as base64 text holding little endian bytes.
 */
public class VtkJsArrays {

    public static ComponentType getDataType(JsonNode arrayNode) {
        JsonNode dataType = arrayNode.get("dataType");
        if (dataType == null || !dataType.isTextual()) {
            throw new IllegalArgumentException("Array " + getName(arrayNode) + " has no dataType");
        }
        return ComponentType.fromArrayTypeName(dataType.asText());
    }

    public static String getName(JsonNode arrayNode) {
        JsonNode name = arrayNode.get("name");
        return name == null || name.isNull() ? null : name.asText();
    }

    /**
     * Read the values of a typed array. 64-bit integers are returned as they are.
     */
    public static Buffer readValues(JsonNode arrayNode, ComponentType dataType) {
        JsonNode valuesNode = arrayNode.get("values");
        if (valuesNode == null || valuesNode.isNull()) {
            throw new IllegalArgumentException("Array " + getName(arrayNode) + " has no values");
        }
        Buffer values;
        if (valuesNode.isArray()) {
            values = TypedBuffers.allocate(dataType, valuesNode.size());
            int i = 0;
            for (Iterator<JsonNode> it = valuesNode.elements(); it.hasNext(); i++) {
                JsonNode v = it.next();
                if (!v.isNumber()) {
                    throw new IllegalArgumentException("Non numeric value " + v + " in array " + getName(arrayNode));
                }
                if (dataType.isInteger()) {
                    if (!v.isIntegralNumber() && v.asDouble() != Math.rint(v.asDouble())) {
                        throw new IllegalArgumentException("Non integer value " + v + " in " + dataType + " array " + getName(arrayNode));
                    }
                    long lv = v.isBigInteger() ? v.bigIntegerValue().longValue() : v.asLong();
                    TypedBuffers.putLong(values, dataType, i, lv);
                } else {
                    TypedBuffers.put(values, dataType, i, v.asDouble());
                }
            }
        } else if (valuesNode.isBinary() || valuesNode.isTextual()) {
            byte[] bytes;
            try {
                bytes = valuesNode.binaryValue().clone();
            } catch (IOException | IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid binary values in array " + getName(arrayNode), e);
            }
            if (bytes.length % dataType.getByteWidth() != 0) {
                throw new IllegalArgumentException("Array " + getName(arrayNode) + " has " + bytes.length
                        + " bytes which is not a multiple of the " + dataType + " width");
            }
            values = TypedBuffers.fromLittleEndianBytes(bytes, dataType);
        } else {
            throw new IllegalArgumentException("Unsupported values of array " + getName(arrayNode) + ": " + valuesNode.getNodeType());
        }
        JsonNode sizeNode = arrayNode.get("size");
        if (sizeNode != null && sizeNode.isNumber() && sizeNode.asLong() != values.limit()) {
            throw new IllegalArgumentException("Array " + getName(arrayNode) + " declares " + sizeNode.asLong()
                    + " values but holds " + values.limit());
        }
        return values;
    }

    /**
     * Narrow a 64-bit integer buffer to 32 bits.
     *
     * @throws ValueOutOfRangeException if any value does not fit the 32-bit type of the same signedness
     */
    public static IntBuffer narrow(String arrayName, Buffer values, ComponentType dataType) {
        ComponentType target = dataType.narrowed();
        int n = values.limit();
        IntBuffer narrowed = IntBuffer.allocate(n);
        if (n == 0) {
            return narrowed;
        }
        long min = TypedBuffers.getLong(values, dataType, 0);
        long max = min;
        for (int i = 0; i < n; i++) {
            long v = TypedBuffers.getLong(values, dataType, i);
            if (dataType.isSigned()) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            } else {
                min = Long.compareUnsigned(v, min) < 0 ? v : min;
                max = Long.compareUnsigned(v, max) > 0 ? v : max;
            }
            narrowed.put(i, (int) v);
        }
        boolean inRange = dataType.isSigned()
                ? min >= target.getMinIntegerValue() && max <= target.getMaxIntegerValue()
                : Long.compareUnsigned(max, target.getMaxIntegerValue()) <= 0;
        if (!inRange) {
            String range = dataType.isSigned()
                    ? "[" + min + ", " + max + "]"
                    : "[" + Long.toUnsignedString(min) + ", " + Long.toUnsignedString(max) + "]";
            throw new ValueOutOfRangeException(arrayName, range, target);
        }
        return narrowed;
    }

    /**
     * Read a data array, narrowing 64-bit integers to 32 bits.
     *
     * @param arrayNode either the array itself or the {@code {data: array}} wrapper used in attribute lists
     */
    public static DataArray readDataArray(JsonNode arrayNode) {
        JsonNode node = arrayNode.has("data") && arrayNode.get("data").isObject() ? arrayNode.get("data") : arrayNode;
        String name = getName(node);
        ComponentType dataType = getDataType(node);
        Buffer values = readValues(node, dataType);
        if (dataType.is64BitInteger()) {
            values = narrow(name, values, dataType);
            dataType = dataType.narrowed();
        }
        int numberOfComponents = node.path("numberOfComponents").asInt(1);
        return new DataArray(name, numberOfComponents, dataType, values);
    }

    /**
     * Read a point array as float32 xyz triples. 2-D points get {@link PolyData#PLANAR_Z}.
     */
    public static float[] readPoints(JsonNode pointsNode) {
        ComponentType dataType = getDataType(pointsNode);
        Buffer values = readValues(pointsNode, dataType);
        int nComponents = pointsNode.path("numberOfComponents").asInt(3);
        if (nComponents != 2 && nComponents != 3) {
            throw new IllegalArgumentException("Points must have 2 or 3 components but have " + nComponents);
        }
        int n = values.limit();
        if (n % nComponents != 0) {
            throw new IllegalArgumentException(n + " point coordinates is not a multiple of " + nComponents);
        }
        int nPoints = n / nComponents;
        float[] points = new float[3 * nPoints];
        for (int p = 0; p < nPoints; p++) {
            points[3 * p] = (float) TypedBuffers.getDouble(values, dataType, nComponents * p);
            points[3 * p + 1] = (float) TypedBuffers.getDouble(values, dataType, nComponents * p + 1);
            points[3 * p + 2] = nComponents == 3 ? (float) TypedBuffers.getDouble(values, dataType, nComponents * p + 2) : PolyData.PLANAR_Z;
        }
        return points;
    }

    /**
     * Read count prefixed connectivity as unsigned 32-bit values.
     */
    public static int[] readConnectivity(String cellKind, JsonNode cellsNode) {
        ComponentType dataType = getDataType(cellsNode);
        if (!dataType.isInteger()) {
            throw new IllegalArgumentException("Connectivity of " + cellKind + " must be integer but is " + dataType);
        }
        Buffer values = readValues(cellsNode, dataType);
        if (dataType.is64BitInteger()) {
            values = narrow(cellKind, values, dataType);
            dataType = dataType.narrowed();
        }
        int[] connectivity = new int[values.limit()];
        for (int i = 0; i < connectivity.length; i++) {
            long v = TypedBuffers.getLong(values, dataType, i);
            if (v < 0) {
                throw new IllegalArgumentException("Negative value " + v + " in " + cellKind + " connectivity");
            }
            connectivity[i] = (int) v;
        }
        return connectivity;
    }

    /**
     * Read a {@code vtkDataSetAttributes} document. Active roles keep the index the document designates.
     */
    public static DataSetAttributes readAttributes(JsonNode attributesNode) {
        if (attributesNode == null || attributesNode.isNull() || attributesNode.isMissingNode()) {
            return DataSetAttributes.empty();
        }
        DataSetAttributes.Builder builder = DataSetAttributes.builder();
        JsonNode arraysNode = attributesNode.path("arrays");
        int nArrays = 0;
        for (JsonNode arrayNode : arraysNode) {
            builder.addArray(readDataArray(arrayNode));
            nArrays++;
        }
        for (AttributeRole role : AttributeRole.values()) {
            JsonNode activeNode = attributesNode.get(role.getKey());
            if (activeNode == null || !activeNode.canConvertToInt()) {
                continue;
            }
            int activeIndex = activeNode.asInt();
            if (activeIndex < 0 || activeIndex >= nArrays) {
                continue;
            }
            builder.setActive(role, activeIndex);
        }
        return builder.build();
    }
}
