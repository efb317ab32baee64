package org.janelia.vizbridge.surface;

import java.math.BigInteger;
import java.nio.Buffer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.janelia.vizbridge.geometry.SurfaceExtractor;
import org.janelia.vizbridge.geometry.VtkJsArrays;
import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.TypedBuffers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the external faces of vtk.js grid documents.
 *
 * Image data, rectilinear and structured grids are made of implicit cells: vertices, lines, pixels or
 * voxels depending on how many axes have more than one point. Unstructured grids list their cells
 * explicitly. Faces of 3-D cells are kept only when they belong to a single cell; lower dimensional
 * cells pass through. All points and point data are kept and every output cell gets the cell data
 * of the cell it comes from.
 */
public class ExternalFacesExtractor implements SurfaceExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ExternalFacesExtractor.class);

    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

    @Override
    public ObjectNode extractSurface(JsonNode grid) {
        String vtkClass = grid.path("vtkClass").asText("");
        JsonNode pointsNode;
        BoundaryCollector boundary = new BoundaryCollector();
        switch (vtkClass) {
            case "vtkImageData": {
                int[] dims = getStructuredDims(grid);
                pointsNode = createPointsNode(imageDataPoints(grid, dims));
                addStructuredCells(dims, boundary);
                break;
            }
            case "vtkRectilinearGrid": {
                int[] dims = getStructuredDims(grid);
                pointsNode = createPointsNode(rectilinearPoints(grid, dims));
                addStructuredCells(dims, boundary);
                break;
            }
            case "vtkStructuredGrid": {
                int[] dims = getStructuredDims(grid);
                pointsNode = getRequired(grid, "points");
                checkNumberOfPoints(pointsNode, (long) dims[0] * dims[1] * dims[2]);
                addStructuredCells(dims, boundary);
                break;
            }
            case "vtkUnstructuredGrid":
                pointsNode = getRequired(grid, "points");
                addUnstructuredCells(grid, boundary);
                break;
            default:
                throw new IllegalArgumentException("Cannot extract the surface of a " + vtkClass);
        }

        ObjectNode polyData = nodeFactory.objectNode();
        polyData.put("vtkClass", "vtkPolyData");
        polyData.set("points", pointsNode.deepCopy());
        for (CellType cellType : CellType.values()) {
            int[] connectivity = boundary.getConnectivity(cellType);
            if (connectivity.length > 0) {
                ObjectNode cells = polyData.putObject(cellType.getKey());
                cells.put("vtkClass", "vtkCellArray");
                cells.put("numberOfComponents", 1);
                cells.put("dataType", ComponentType.UINT32.getArrayTypeName());
                cells.put("size", connectivity.length);
                ArrayNode values = cells.putArray("values");
                for (int v : connectivity) {
                    values.add(v);
                }
            }
        }
        JsonNode pointData = grid.get("pointData");
        if (pointData != null && pointData.isObject()) {
            polyData.set("pointData", pointData.deepCopy());
        }
        JsonNode cellData = grid.get("cellData");
        if (cellData != null && cellData.isObject()) {
            polyData.set("cellData", remapCellData(cellData, boundary.getSourceCells()));
        }
        LOG.debug("Extracted {} boundary cells from a {}", boundary.getSourceCells().length, vtkClass);
        return polyData;
    }

    private static JsonNode getRequired(JsonNode document, String field) {
        JsonNode node = document.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException(document.path("vtkClass").asText() + " has no " + field);
        }
        return node;
    }

    /**
     * Number of points along x, y and z from either the {@code extent} or the {@code dimensions}.
     */
    private static int[] getStructuredDims(JsonNode grid) {
        JsonNode extent = grid.get("extent");
        int[] dims = new int[3];
        if (extent != null && extent.isArray() && extent.size() == 6) {
            for (int d = 0; d < 3; d++) {
                dims[d] = extent.get(2 * d + 1).asInt() - extent.get(2 * d).asInt() + 1;
            }
        } else {
            JsonNode dimensions = getRequired(grid, "dimensions");
            for (int d = 0; d < 3; d++) {
                dims[d] = dimensions.path(d).asInt(1);
            }
        }
        for (int d : dims) {
            if (d < 1) {
                throw new IllegalArgumentException("Empty grid");
            }
        }
        return dims;
    }

    private static double[] getVector(JsonNode node, int n, double defaultValue) {
        double[] v = new double[n];
        for (int i = 0; i < n; i++) {
            v[i] = node == null ? defaultValue : node.path(i).asDouble(defaultValue);
        }
        return v;
    }

    /**
     * Point positions of image data. The direction matrix is column-major, as vtk.js stores it.
     */
    private static double[] imageDataPoints(JsonNode grid, int[] dims) {
        double[] origin = getVector(grid.get("origin"), 3, 0.);
        double[] spacing = getVector(grid.get("spacing"), 3, 1.);
        double[] direction = grid.has("direction") ? getVector(grid.get("direction"), 9, 0.) : new double[] {1, 0, 0, 0, 1, 0, 0, 0, 1};
        int[] minIndex = new int[3];
        JsonNode extent = grid.get("extent");
        if (extent != null && extent.isArray() && extent.size() == 6) {
            for (int d = 0; d < 3; d++) {
                minIndex[d] = extent.get(2 * d).asInt();
            }
        }
        double[] points = new double[3 * dims[0] * dims[1] * dims[2]];
        int p = 0;
        for (int k = 0; k < dims[2]; k++) {
            for (int j = 0; j < dims[1]; j++) {
                for (int i = 0; i < dims[0]; i++) {
                    double[] scaled = {
                            (minIndex[0] + i) * spacing[0],
                            (minIndex[1] + j) * spacing[1],
                            (minIndex[2] + k) * spacing[2]
                    };
                    for (int r = 0; r < 3; r++) {
                        points[p++] = origin[r]
                                + direction[r] * scaled[0]
                                + direction[3 + r] * scaled[1]
                                + direction[6 + r] * scaled[2];
                    }
                }
            }
        }
        return points;
    }

    private static double[] rectilinearPoints(JsonNode grid, int[] dims) {
        double[][] coordinates = new double[3][];
        String[] fields = {"xCoordinates", "yCoordinates", "zCoordinates"};
        for (int d = 0; d < 3; d++) {
            JsonNode coordsNode = getRequired(grid, fields[d]);
            ComponentType dataType = VtkJsArrays.getDataType(coordsNode);
            Buffer values = VtkJsArrays.readValues(coordsNode, dataType);
            if (values.limit() != dims[d]) {
                throw new IllegalArgumentException(fields[d] + " has " + values.limit() + " values for " + dims[d] + " points");
            }
            coordinates[d] = new double[dims[d]];
            for (int i = 0; i < dims[d]; i++) {
                coordinates[d][i] = TypedBuffers.getDouble(values, dataType, i);
            }
        }
        double[] points = new double[3 * dims[0] * dims[1] * dims[2]];
        int p = 0;
        for (int k = 0; k < dims[2]; k++) {
            for (int j = 0; j < dims[1]; j++) {
                for (int i = 0; i < dims[0]; i++) {
                    points[p++] = coordinates[0][i];
                    points[p++] = coordinates[1][j];
                    points[p++] = coordinates[2][k];
                }
            }
        }
        return points;
    }

    private ObjectNode createPointsNode(double[] points) {
        ObjectNode pointsNode = nodeFactory.objectNode();
        pointsNode.put("vtkClass", "vtkPoints");
        pointsNode.put("numberOfComponents", 3);
        pointsNode.put("dataType", ComponentType.FLOAT64.getArrayTypeName());
        pointsNode.put("size", points.length);
        ArrayNode values = pointsNode.putArray("values");
        for (double v : points) {
            values.add(v);
        }
        return pointsNode;
    }

    private static void checkNumberOfPoints(JsonNode pointsNode, long expectedPoints) {
        Buffer values = VtkJsArrays.readValues(pointsNode, VtkJsArrays.getDataType(pointsNode));
        int nComponents = pointsNode.path("numberOfComponents").asInt(3);
        if (values.limit() != expectedPoints * nComponents) {
            throw new IllegalArgumentException("Structured grid has " + values.limit() / nComponents
                    + " points but its dimensions require " + expectedPoints);
        }
    }

    private static void addStructuredCells(int[] dims, BoundaryCollector boundary) {
        int[] axes = new int[3];
        int nAxes = 0;
        for (int d = 0; d < 3; d++) {
            if (dims[d] > 1) {
                axes[nAxes++] = d;
            }
        }
        int[] cellDims = new int[3];
        for (int d = 0; d < 3; d++) {
            cellDims[d] = Math.max(dims[d] - 1, 1);
        }
        int cell = 0;
        for (int k = 0; k < cellDims[2]; k++) {
            for (int j = 0; j < cellDims[1]; j++) {
                for (int i = 0; i < cellDims[0]; i++, cell++) {
                    int[] base = {i, j, k};
                    switch (nAxes) {
                        case 0:
                            boundary.addCell(cell, VtkCellType.VERTEX, new int[] {0});
                            break;
                        case 1:
                            boundary.addCell(cell, VtkCellType.LINE, new int[] {
                                    pointId(dims, base, axes[0], 0, -1, 0),
                                    pointId(dims, base, axes[0], 1, -1, 0)
                            });
                            break;
                        case 2:
                            boundary.addCell(cell, VtkCellType.PIXEL, new int[] {
                                    pointId(dims, base, axes[0], 0, axes[1], 0),
                                    pointId(dims, base, axes[0], 1, axes[1], 0),
                                    pointId(dims, base, axes[0], 0, axes[1], 1),
                                    pointId(dims, base, axes[0], 1, axes[1], 1)
                            });
                            break;
                        default:
                            int[] voxel = new int[8];
                            for (int v = 0; v < 8; v++) {
                                voxel[v] = (i + (v & 1)) + dims[0] * ((j + ((v >> 1) & 1)) + dims[1] * (k + ((v >> 2) & 1)));
                            }
                            boundary.addCell(cell, VtkCellType.VOXEL, voxel);
                    }
                }
            }
        }
    }

    private static int pointId(int[] dims, int[] base, int axis1, int offset1, int axis2, int offset2) {
        int[] ijk = base.clone();
        ijk[axis1] += offset1;
        if (axis2 >= 0) {
            ijk[axis2] += offset2;
        }
        return ijk[0] + dims[0] * (ijk[1] + dims[1] * ijk[2]);
    }

    private static void addUnstructuredCells(JsonNode grid, BoundaryCollector boundary) {
        int[] connectivity = VtkJsArrays.readConnectivity("cells", getRequired(grid, "cells"));
        JsonNode cellTypesNode = getRequired(grid, "cellTypes");
        ComponentType cellTypesDataType = VtkJsArrays.getDataType(cellTypesNode);
        Buffer cellTypes = VtkJsArrays.readValues(cellTypesNode, cellTypesDataType);
        int pos = 0;
        for (int cell = 0; cell < cellTypes.limit(); cell++) {
            if (pos >= connectivity.length) {
                throw new IllegalArgumentException("Unstructured grid has " + cellTypes.limit() + " cell types but only " + cell + " cells");
            }
            int n = connectivity[pos];
            if (n < 0 || pos + n >= connectivity.length) {
                throw new IllegalArgumentException("Truncated cell " + cell);
            }
            int[] pointIds = new int[n];
            System.arraycopy(connectivity, pos + 1, pointIds, 0, n);
            boundary.addCell(cell, (int) TypedBuffers.getLong(cellTypes, cellTypesDataType, cell), pointIds);
            pos += n + 1;
        }
    }

    private ObjectNode remapCellData(JsonNode cellData, int[] sourceCells) {
        ObjectNode remapped = cellData.deepCopy();
        ArrayNode arrays = remapped.putArray("arrays");
        for (JsonNode arrayEntry : cellData.path("arrays")) {
            JsonNode array = arrayEntry.has("data") ? arrayEntry.get("data") : arrayEntry;
            ComponentType dataType = VtkJsArrays.getDataType(array);
            Buffer values = VtkJsArrays.readValues(array, dataType);
            int nComponents = array.path("numberOfComponents").asInt(1);
            ObjectNode remappedArray = array.deepCopy();
            ArrayNode remappedValues = remappedArray.putArray("values");
            for (int sourceCell : sourceCells) {
                for (int c = 0; c < nComponents; c++) {
                    int index = sourceCell * nComponents + c;
                    if (index >= values.limit()) {
                        throw new IllegalArgumentException("Cell data " + VtkJsArrays.getName(array) + " has no value for cell " + sourceCell);
                    }
                    if (dataType == ComponentType.UINT64) {
                        remappedValues.add(new BigInteger(Long.toUnsignedString(TypedBuffers.getLong(values, dataType, index))));
                    } else if (dataType.isInteger()) {
                        remappedValues.add(TypedBuffers.getLong(values, dataType, index));
                    } else {
                        remappedValues.add(TypedBuffers.getDouble(values, dataType, index));
                    }
                }
            }
            remappedArray.put("size", sourceCells.length * nComponents);
            arrays.addObject().set("data", remappedArray);
        }
        return remapped;
    }
}
