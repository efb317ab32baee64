package org.janelia.vizbridge.geometry;

import com.fasterxml.jackson.databind.JsonNode;
import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.PolyData;

/**
 * Converts a vtk.js {@code vtkPolyData} state document. Points of any numeric type become float32,
 * native connectivity is kept as is and the point and cell attributes are carried over.
 */
public class VtkJsPolyDataConverter extends AbstractGeometryConverter<JsonNode> {

    public static final String POLY_DATA_CLASS = "vtkPolyData";

    public VtkJsPolyDataConverter() {
        super(JsonNode.class, null);
    }

    static String getVtkClass(JsonNode document) {
        return document.path("vtkClass").asText("");
    }

    @Override
    protected boolean acceptsSource(JsonNode source) {
        return POLY_DATA_CLASS.equals(getVtkClass(source));
    }

    @Override
    public boolean isPointSet(Object source) {
        JsonNode document = (JsonNode) source;
        return !document.has(CellType.LINES.getKey())
                && !document.has(CellType.POLYS.getKey())
                && !document.has(CellType.STRIPS.getKey());
    }

    @Override
    protected PolyData convertSource(JsonNode document) {
        JsonNode pointsNode = document.get("points");
        float[] points = pointsNode == null || pointsNode.isNull() ? new float[0] : VtkJsArrays.readPoints(pointsNode);
        PolyData.Builder builder = PolyData.builder().points(points);
        for (CellType cellType : CellType.values()) {
            JsonNode cellsNode = document.get(cellType.getKey());
            if (cellsNode != null && cellsNode.isObject()) {
                builder.cells(cellType, VtkJsArrays.readConnectivity(cellType.getKey(), cellsNode));
            }
        }
        return builder
                .pointData(VtkJsArrays.readAttributes(document.get("pointData")))
                .cellData(VtkJsArrays.readAttributes(document.get("cellData")))
                .build();
    }
}
