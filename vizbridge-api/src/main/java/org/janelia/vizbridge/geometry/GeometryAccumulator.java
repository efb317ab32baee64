package org.janelia.vizbridge.geometry;

import java.util.ArrayList;
import java.util.List;

import com.google.common.primitives.Floats;
import com.google.common.primitives.Ints;
import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.PolyData;

/**
 * Collects points and count prefixed cells while a source geometry is traversed.
 */
class GeometryAccumulator {

    private final List<Float> points = new ArrayList<>();
    private final List<Integer> verts = new ArrayList<>();
    private final List<Integer> lines = new ArrayList<>();
    private final List<Integer> polys = new ArrayList<>();

    int getNumberOfPoints() {
        return points.size() / 3;
    }

    /**
     * @return the index of the new point
     */
    int addPoint(double x, double y, double z) {
        points.add((float) x);
        points.add((float) y);
        points.add((float) z);
        return getNumberOfPoints() - 1;
    }

    /**
     * Embed a 2-D point in the {@link PolyData#PLANAR_Z} plane.
     */
    int addPlanarPoint(double x, double y) {
        return addPoint(x, y, PolyData.PLANAR_Z);
    }

    /**
     * @param coords 2 or 3 coordinates
     */
    int addPoint(double[] coords) {
        return coords.length > 2 ? addPoint(coords[0], coords[1], coords[2]) : addPlanarPoint(coords[0], coords[1]);
    }

    void addVertex(int pointIndex) {
        verts.add(1);
        verts.add(pointIndex);
    }

    void addLine(int from, int to) {
        lines.add(2);
        lines.add(from);
        lines.add(to);
    }

    /**
     * A vertex cell for every path point and a line cell for every consecutive pair.
     */
    void addPath(List<Integer> path) {
        path.forEach(this::addVertex);
        for (int i = 0; i + 1 < path.size(); i++) {
            addLine(path.get(i), path.get(i + 1));
        }
    }

    void addPolygon(List<Integer> pointIndexes) {
        polys.add(pointIndexes.size());
        polys.addAll(pointIndexes);
    }

    PolyData build() {
        return PolyData.builder()
                .points(Floats.toArray(points))
                .cells(CellType.VERTS, Ints.toArray(verts))
                .cells(CellType.LINES, Ints.toArray(lines))
                .cells(CellType.POLYS, Ints.toArray(polys))
                .build();
    }
}
