package org.janelia.vizbridge.image;

import java.util.Arrays;
import java.util.stream.IntStream;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.janelia.vizbridge.model.SpatialImage;

/**
 * Maps between discrete indices and physical positions using the spacing, origin and direction
 * of an image. Axes are canonical axes (slowest first).
 */
public class SpatialIndexMapper {

    private final long[] dims;
    private final double[] spacing;
    private final double[] origin;
    private final RealMatrix direction;

    public SpatialIndexMapper(SpatialImage image) {
        int n = image.getDimension();
        this.dims = image.getDims();
        this.spacing = image.getSpacing();
        this.origin = image.getOrigin();
        double[][] d = new double[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                d[r][c] = image.getDirection(r, c);
            }
        }
        this.direction = MatrixUtils.createRealMatrix(d);
    }

    public double[] indexToPosition(long[] indices) {
        return indexToPosition(allAxes(), indices);
    }

    /**
     * @param spatialAxes canonical axes the indices refer to
     * @param indices one index per selected axis
     * @return the physical position, one coordinate per selected axis
     */
    public double[] indexToPosition(int[] spatialAxes, long[] indices) {
        Preconditions.checkArgument(spatialAxes.length == indices.length,
                "%s indices given for %s axes", indices.length, spatialAxes.length);
        RealMatrix d = direction.getSubMatrix(spatialAxes, spatialAxes);
        double[] scaled = new double[spatialAxes.length];
        for (int i = 0; i < spatialAxes.length; i++) {
            scaled[i] = spacing[spatialAxes[i]] * indices[i];
        }
        double[] rotated = d.operate(scaled);
        double[] position = new double[spatialAxes.length];
        for (int i = 0; i < spatialAxes.length; i++) {
            position[i] = rotated[i] + origin[spatialAxes[i]];
        }
        return position;
    }

    public long[] positionToIndex(double[] position) {
        return positionToIndex(allAxes(), position);
    }

    /**
     * Inverse of {@link #indexToPosition(int[], long[])} with every coordinate snapped to the
     * nearest index inside the image extent.
     *
     * @throws SingularDirectionException if the direction sub-matrix of the selected axes is singular
     */
    public long[] positionToIndex(int[] spatialAxes, double[] position) {
        Preconditions.checkArgument(spatialAxes.length == position.length,
                "%s coordinates given for %s axes", position.length, spatialAxes.length);
        RealMatrix inverse = invert(direction.getSubMatrix(spatialAxes, spatialAxes), spatialAxes);
        double[] relative = new double[spatialAxes.length];
        for (int i = 0; i < spatialAxes.length; i++) {
            relative[i] = position[i] - origin[spatialAxes[i]];
        }
        RealVector continuous = inverse.operate(MatrixUtils.createRealVector(relative));
        long[] indices = new long[spatialAxes.length];
        for (int i = 0; i < spatialAxes.length; i++) {
            int axis = spatialAxes[i];
            long index = Math.round(continuous.getEntry(i) / spacing[axis]);
            indices[i] = Math.max(0, Math.min(dims[axis] - 1, index));
        }
        return indices;
    }

    private static RealMatrix invert(RealMatrix m, int[] axes) {
        try {
            LUDecomposition lu = new LUDecomposition(m);
            if (!lu.getSolver().isNonSingular()) {
                throw new SingularDirectionException("Direction matrix of axes " + Arrays.toString(axes) + " is singular");
            }
            return lu.getSolver().getInverse();
        } catch (SingularMatrixException e) {
            throw new SingularDirectionException("Direction matrix of axes " + Arrays.toString(axes) + " is singular", e);
        }
    }

    private int[] allAxes() {
        return IntStream.range(0, dims.length).toArray();
    }
}
