package org.janelia.vizbridge.geometry;

import java.util.Optional;

import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.PolyData;

/**
 * Converts N x 2 or N x 3 {@code float[][]} or {@code double[][]} coordinate arrays into points
 * with one vertex cell each.
 */
public class CoordinateArrayConverter implements GeometryConverter {

    @Override
    public Capability getRequiredCapability() {
        return null;
    }

    @Override
    public boolean accepts(Object source) {
        int columns;
        if (source instanceof float[][]) {
            float[][] rows = (float[][]) source;
            if (rows.length == 0 || rows[0] == null) return false;
            columns = rows[0].length;
            for (float[] row : rows) {
                if (row == null || row.length != columns) return false;
            }
        } else if (source instanceof double[][]) {
            double[][] rows = (double[][]) source;
            if (rows.length == 0 || rows[0] == null) return false;
            columns = rows[0].length;
            for (double[] row : rows) {
                if (row == null || row.length != columns) return false;
            }
        } else {
            return false;
        }
        return columns == 2 || columns == 3;
    }

    @Override
    public boolean isPointSet(Object source) {
        return true;
    }

    @Override
    public Optional<PolyData> convert(Object source) {
        GeometryAccumulator geometry = new GeometryAccumulator();
        if (source instanceof float[][]) {
            for (float[] row : (float[][]) source) {
                geometry.addVertex(row.length > 2 ? geometry.addPoint(row[0], row[1], row[2]) : geometry.addPlanarPoint(row[0], row[1]));
            }
        } else {
            for (double[] row : (double[][]) source) {
                geometry.addVertex(geometry.addPoint(row));
            }
        }
        return Optional.of(geometry.build());
    }
}
