package org.janelia.vizbridge.geometry;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.janelia.vizbridge.model.PolyData;

/**
 * Converts a 2-D ImgLib2 interval whose first dimension holds the 2 or 3 coordinates of a point
 * and whose second dimension enumerates the points.
 */
@SuppressWarnings("rawtypes")
public class ImgLib2PointsConverter extends AbstractGeometryConverter<RandomAccessibleInterval> {

    public ImgLib2PointsConverter() {
        super(RandomAccessibleInterval.class, null);
    }

    @Override
    protected boolean acceptsSource(RandomAccessibleInterval source) {
        if (source.numDimensions() != 2) {
            return false;
        }
        long nCoords = source.dimension(0);
        return (nCoords == 2 || nCoords == 3)
                && source.dimension(1) > 0
                && Views.flatIterable((RandomAccessibleInterval<?>) source).firstElement() instanceof RealType;
    }

    @Override
    protected PolyData convertSource(RandomAccessibleInterval source) {
        return convertPoints((RandomAccessibleInterval<?>) source);
    }

    private static <T> PolyData convertPoints(RandomAccessibleInterval<T> source) {
        GeometryAccumulator geometry = new GeometryAccumulator();
        int nCoords = (int) source.dimension(0);
        long nPoints = source.dimension(1);
        RandomAccess<T> access = source.randomAccess();
        double[] coords = new double[nCoords];
        for (long p = 0; p < nPoints; p++) {
            for (int c = 0; c < nCoords; c++) {
                access.setPosition(source.min(0) + c, 0);
                access.setPosition(source.min(1) + p, 1);
                coords[c] = ((RealType<?>) access.get()).getRealDouble();
            }
            geometry.addVertex(geometry.addPoint(coords));
        }
        return geometry.build();
    }
}
