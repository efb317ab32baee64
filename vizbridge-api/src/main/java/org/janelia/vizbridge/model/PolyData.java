package org.janelia.vizbridge.model;

import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Canonical point set / mesh representation.
 *
 * Points are float32 triples. Each cell array uses the count prefixed layout
 * {@code [n, i0, ..., in-1, m, j0, ...]} where the values are unsigned 32-bit integers.
 */
public class PolyData {

    /**
     * Z coordinate given to points that only have x and y.
     */
    public static final float PLANAR_Z = -5.0e-6f;

    private final float[] points;
    private final Map<CellType, int[]> cells;
    private final DataSetAttributes pointData;
    private final DataSetAttributes cellData;

    private PolyData(Builder builder) {
        Preconditions.checkNotNull(builder.points, "Points are required");
        Preconditions.checkArgument(builder.points.length % 3 == 0,
                "Points buffer length %s is not a multiple of 3", builder.points.length);
        this.points = builder.points;
        int nPoints = points.length / 3;
        Map<CellType, int[]> cellsByType = new EnumMap<>(CellType.class);
        builder.cells.forEach((cellType, connectivity) -> {
            checkConnectivity(cellType, connectivity, nPoints);
            cellsByType.put(cellType, connectivity);
        });
        this.cells = Collections.unmodifiableMap(cellsByType);
        this.pointData = builder.pointData;
        this.cellData = builder.cellData;
    }

    private static void checkConnectivity(CellType cellType, int[] connectivity, int nPoints) {
        int pos = 0;
        while (pos < connectivity.length) {
            long cellSize = Integer.toUnsignedLong(connectivity[pos]);
            Preconditions.checkArgument(pos + cellSize < connectivity.length,
                    "Truncated %s cell at offset %s: %s vertices announced but only %s values left",
                    cellType.getKey(), pos, cellSize, connectivity.length - pos - 1);
            for (int i = 1; i <= cellSize; i++) {
                long pointIndex = Integer.toUnsignedLong(connectivity[pos + i]);
                Preconditions.checkArgument(pointIndex < nPoints,
                        "%s cell at offset %s references point %s but there are only %s points",
                        cellType.getKey(), pos, pointIndex, nPoints);
            }
            pos += cellSize + 1;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getNumberOfPoints() {
        return points.length / 3;
    }

    /**
     * @return a read-only view of the flattened xyz coordinates
     */
    public FloatBuffer getPoints() {
        return FloatBuffer.wrap(points).asReadOnlyBuffer();
    }

    public float[] getPoint(int index) {
        return Arrays.copyOfRange(points, 3 * index, 3 * index + 3);
    }

    public Set<CellType> getCellTypes() {
        return cells.keySet();
    }

    public boolean hasCells(CellType cellType) {
        return cells.containsKey(cellType);
    }

    /**
     * @return a read-only view of the count prefixed connectivity or an empty buffer
     * if the poly data has no cells of the given kind
     */
    public IntBuffer getCells(CellType cellType) {
        int[] connectivity = cells.get(cellType);
        return IntBuffer.wrap(connectivity == null ? new int[0] : connectivity).asReadOnlyBuffer();
    }

    public int getNumberOfCells(CellType cellType) {
        int[] connectivity = cells.get(cellType);
        if (connectivity == null) {
            return 0;
        }
        int n = 0;
        for (int pos = 0; pos < connectivity.length; pos += connectivity[pos] + 1) {
            n++;
        }
        return n;
    }

    public DataSetAttributes getPointData() {
        return pointData;
    }

    public DataSetAttributes getCellData() {
        return cellData;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        PolyData polyData = (PolyData) o;

        if (!cells.keySet().equals(polyData.cells.keySet())) {
            return false;
        }
        for (CellType cellType : cells.keySet()) {
            if (!Arrays.equals(cells.get(cellType), polyData.cells.get(cellType))) {
                return false;
            }
        }
        return new EqualsBuilder()
                .append(points, polyData.points)
                .append(pointData, polyData.pointData)
                .append(cellData, polyData.cellData)
                .isEquals();
    }

    @Override
    public int hashCode() {
        HashCodeBuilder hashCodeBuilder = new HashCodeBuilder(17, 37)
                .append(points)
                .append(pointData)
                .append(cellData);
        cells.forEach((cellType, connectivity) -> hashCodeBuilder.append(cellType).append(connectivity));
        return hashCodeBuilder.toHashCode();
    }

    @Override
    public String toString() {
        ToStringBuilder toStringBuilder = new ToStringBuilder(this)
                .append("numberOfPoints", getNumberOfPoints());
        cells.keySet().forEach(cellType -> toStringBuilder.append(cellType.getKey(), getNumberOfCells(cellType)));
        return toStringBuilder
                .append("pointData", pointData)
                .append("cellData", cellData)
                .toString();
    }

    public static class Builder {
        private float[] points;
        private final Map<CellType, int[]> cells = new EnumMap<>(CellType.class);
        private DataSetAttributes pointData = DataSetAttributes.empty();
        private DataSetAttributes cellData = DataSetAttributes.empty();

        private Builder() {
        }

        /**
         * @param points flattened xyz coordinates; the array is copied
         */
        public Builder points(float[] points) {
            this.points = points.clone();
            return this;
        }

        /**
         * Set the connectivity of a cell kind. Empty connectivity removes the cell kind.
         * The array is copied.
         */
        public Builder cells(CellType cellType, int[] connectivity) {
            if (connectivity == null || connectivity.length == 0) {
                cells.remove(cellType);
            } else {
                cells.put(cellType, connectivity.clone());
            }
            return this;
        }

        public Builder pointData(DataSetAttributes pointData) {
            this.pointData = pointData == null ? DataSetAttributes.empty() : pointData;
            return this;
        }

        public Builder cellData(DataSetAttributes cellData) {
            this.cellData = cellData == null ? DataSetAttributes.empty() : cellData;
            return this;
        }

        public PolyData build() {
            return new PolyData(this);
        }
    }
}
