package org.janelia.vizbridge.wire;

import java.nio.IntBuffer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.janelia.vizbridge.geometry.ValueOutOfRangeException;
import org.janelia.vizbridge.geometry.VtkJsPolyDataConverter;
import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.DataArray;
import org.janelia.vizbridge.model.DataSetAttributes;
import org.janelia.vizbridge.model.PolyData;
import org.janelia.vizbridge.model.TypedBuffers;

/**
 * Encodes {@link PolyData} as a vtk.js {@code vtkPolyData} document with little endian binary
 * values and decodes such documents back.
 */
public class GeometryWireCodec {

    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;
    private final VtkJsPolyDataConverter polyDataConverter = new VtkJsPolyDataConverter();

    public ObjectNode encodeGeometry(PolyData polyData) {
        ObjectNode document = nodeFactory.objectNode();
        document.put("vtkClass", VtkJsPolyDataConverter.POLY_DATA_CLASS);

        ObjectNode points = document.putObject("points");
        points.put("vtkClass", "vtkPoints");
        points.put("numberOfComponents", 3);
        points.put("dataType", ComponentType.FLOAT32.getArrayTypeName());
        points.put("size", 3 * polyData.getNumberOfPoints());
        points.put("values", TypedBuffers.toLittleEndianBytes(polyData.getPoints()));

        for (CellType cellType : polyData.getCellTypes()) {
            IntBuffer connectivity = polyData.getCells(cellType);
            ObjectNode cells = document.putObject(cellType.getKey());
            cells.put("vtkClass", "vtkCellArray");
            cells.put("numberOfComponents", 1);
            cells.put("dataType", ComponentType.UINT32.getArrayTypeName());
            cells.put("size", connectivity.remaining());
            cells.put("values", TypedBuffers.toLittleEndianBytes(connectivity));
        }
        if (!polyData.getPointData().isEmpty()) {
            document.set("pointData", encodeAttributes(polyData.getPointData()));
        }
        if (!polyData.getCellData().isEmpty()) {
            document.set("cellData", encodeAttributes(polyData.getCellData()));
        }
        return document;
    }

    private ObjectNode encodeAttributes(DataSetAttributes attributes) {
        ObjectNode attributesNode = nodeFactory.objectNode();
        attributesNode.put("vtkClass", "vtkDataSetAttributes");
        attributes.getActiveRoles().forEach((role, index) -> attributesNode.put(role.getKey(), index));
        ArrayNode arrays = attributesNode.putArray("arrays");
        for (DataArray dataArray : attributes.getArrays()) {
            ObjectNode data = arrays.addObject().putObject("data");
            data.put("vtkClass", "vtkDataArray");
            data.put("name", dataArray.getName());
            data.put("numberOfComponents", dataArray.getNumberOfComponents());
            data.put("size", dataArray.getSize());
            data.put("dataType", dataArray.getDataType().getArrayTypeName());
            data.put("values", TypedBuffers.toLittleEndianBytes(dataArray.getValues()));
        }
        return attributesNode;
    }

    /**
     * @throws CorruptPayloadException if the document is not a consistent poly data document
     * @throws ValueOutOfRangeException if a 64-bit integer array does not fit in 32 bits
     */
    public PolyData decodeGeometry(JsonNode document) {
        if (document == null || !polyDataConverter.accepts(document)) {
            throw new CorruptPayloadException("Not a " + VtkJsPolyDataConverter.POLY_DATA_CLASS + " document");
        }
        try {
            return polyDataConverter.convert(document)
                    .orElseThrow(() -> new CorruptPayloadException("Empty geometry document"));
        } catch (ValueOutOfRangeException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new CorruptPayloadException("Invalid geometry document: " + e.getMessage(), e);
        }
    }
}
