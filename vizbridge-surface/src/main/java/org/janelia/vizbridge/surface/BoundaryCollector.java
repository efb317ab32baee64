package org.janelia.vizbridge.surface;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.janelia.vizbridge.model.CellType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the boundary cells of a grid. Faces of 3-D cells are kept only if no other
 * 3-D cell has the same face; every other cell passes through.
 */
class BoundaryCollector {

    private static final Logger LOG = LoggerFactory.getLogger(BoundaryCollector.class);

    private static class Entry {
        final int[] pointIds;
        final int sourceCell;
        final String faceKey;

        Entry(int[] pointIds, int sourceCell, String faceKey) {
            this.pointIds = pointIds;
            this.sourceCell = sourceCell;
            this.faceKey = faceKey;
        }
    }

    private final Map<CellType, List<Entry>> entries = new EnumMap<>(CellType.class);
    private final Map<String, Integer> faceUses = new HashMap<>();

    BoundaryCollector() {
        for (CellType cellType : CellType.values()) {
            entries.put(cellType, new ArrayList<>());
        }
    }

    void addCell(int sourceCell, int vtkCellType, int[] pointIds) {
        int expectedPoints = VtkCellType.getNumberOfPoints(vtkCellType);
        if (expectedPoints > 0 && pointIds.length != expectedPoints) {
            throw new IllegalArgumentException("Cell " + sourceCell + " of type " + vtkCellType + " has "
                    + pointIds.length + " points instead of " + expectedPoints);
        }
        int[][] faces = VtkCellType.getFaces(vtkCellType);
        if (faces != null) {
            for (int[] face : faces) {
                int[] facePoints = new int[face.length];
                for (int i = 0; i < face.length; i++) {
                    facePoints[i] = pointIds[face[i]];
                }
                addFace(sourceCell, facePoints);
            }
            return;
        }
        switch (vtkCellType) {
            case VtkCellType.VERTEX:
            case VtkCellType.POLY_VERTEX:
                add(CellType.VERTS, sourceCell, pointIds);
                break;
            case VtkCellType.LINE:
            case VtkCellType.POLY_LINE:
                add(CellType.LINES, sourceCell, pointIds);
                break;
            case VtkCellType.TRIANGLE:
            case VtkCellType.POLYGON:
            case VtkCellType.QUAD:
                add(CellType.POLYS, sourceCell, pointIds);
                break;
            case VtkCellType.PIXEL:
                add(CellType.POLYS, sourceCell, new int[] {pointIds[0], pointIds[1], pointIds[3], pointIds[2]});
                break;
            case VtkCellType.TRIANGLE_STRIP:
                add(CellType.STRIPS, sourceCell, pointIds);
                break;
            default:
                LOG.warn("Skip cell {} of unsupported type {}", sourceCell, vtkCellType);
        }
    }

    private void add(CellType cellType, int sourceCell, int[] pointIds) {
        entries.get(cellType).add(new Entry(pointIds, sourceCell, null));
    }

    private void addFace(int sourceCell, int[] facePoints) {
        int[] sorted = facePoints.clone();
        Arrays.sort(sorted);
        String key = Arrays.toString(sorted);
        if (faceUses.merge(key, 1, Integer::sum) == 1) {
            entries.get(CellType.POLYS).add(new Entry(facePoints, sourceCell, key));
        }
    }

    private boolean isBoundary(Entry entry) {
        return entry.faceKey == null || faceUses.get(entry.faceKey) == 1;
    }

    /**
     * @return count prefixed connectivity of the kept cells of the given kind
     */
    int[] getConnectivity(CellType cellType) {
        List<Integer> connectivity = new ArrayList<>();
        for (Entry entry : entries.get(cellType)) {
            if (isBoundary(entry)) {
                connectivity.add(entry.pointIds.length);
                for (int pointId : entry.pointIds) {
                    connectivity.add(pointId);
                }
            }
        }
        return connectivity.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * @return the source cell of every kept cell in the order of the poly data cells (verts, lines, polys, strips)
     */
    int[] getSourceCells() {
        List<Integer> sourceCells = new ArrayList<>();
        for (CellType cellType : CellType.values()) {
            for (Entry entry : entries.get(cellType)) {
                if (isBoundary(entry)) {
                    sourceCells.add(entry.sourceCell);
                }
            }
        }
        return sourceCells.stream().mapToInt(Integer::intValue).toArray();
    }
}
