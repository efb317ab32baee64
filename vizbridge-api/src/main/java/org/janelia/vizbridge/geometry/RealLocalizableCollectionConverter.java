package org.janelia.vizbridge.geometry;

import java.util.Collection;

import net.imglib2.RealLocalizable;
import org.janelia.vizbridge.model.PolyData;

/**
 * Converts a non empty collection of 2-D or 3-D ImgLib2 {@link RealLocalizable}s into points.
 */
@SuppressWarnings("rawtypes")
public class RealLocalizableCollectionConverter extends AbstractGeometryConverter<Collection> {

    public RealLocalizableCollectionConverter() {
        super(Collection.class, null);
    }

    @Override
    protected boolean acceptsSource(Collection source) {
        if (source.isEmpty()) {
            return false;
        }
        int ndims = -1;
        for (Object o : source) {
            if (!(o instanceof RealLocalizable)) {
                return false;
            }
            int n = ((RealLocalizable) o).numDimensions();
            if (n != 2 && n != 3 || ndims != -1 && n != ndims) {
                return false;
            }
            ndims = n;
        }
        return true;
    }

    @Override
    protected PolyData convertSource(Collection source) {
        GeometryAccumulator geometry = new GeometryAccumulator();
        for (Object o : source) {
            geometry.addVertex(geometry.addPoint(((RealLocalizable) o).positionAsDoubleArray()));
        }
        return geometry.build();
    }
}
