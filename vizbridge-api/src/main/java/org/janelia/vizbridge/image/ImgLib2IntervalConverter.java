package org.janelia.vizbridge.image;

import java.lang.reflect.Array;
import java.nio.Buffer;
import java.util.Optional;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.ArrayDataAccess;
import net.imglib2.type.Type;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.PixelType;
import org.janelia.vizbridge.model.SpatialImage;
import org.janelia.vizbridge.model.TypedBuffers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts an ImgLib2 interval of one of the native real types. ImgLib2 dimension 0 is the fastest
 * varying one so the canonical dims are the interval dims reversed, while the flat iteration
 * order is already the canonical element order.
 */
@SuppressWarnings("rawtypes")
public class ImgLib2IntervalConverter extends AbstractImageConverter<RandomAccessibleInterval> {

    private static final Logger LOG = LoggerFactory.getLogger(ImgLib2IntervalConverter.class);

    private final BufferOwnershipPolicy bufferOwnershipPolicy;

    public ImgLib2IntervalConverter(BufferOwnershipPolicy bufferOwnershipPolicy) {
        super(RandomAccessibleInterval.class, null);
        this.bufferOwnershipPolicy = bufferOwnershipPolicy;
    }

    @Override
    public boolean accepts(Object source) {
        if (!super.accepts(source)) {
            return false;
        }
        RandomAccessibleInterval<?> interval = (RandomAccessibleInterval<?>) source;
        return interval.numDimensions() > 0
                && Intervals.numElements(interval) > 0
                && ImgLib2Types.isCanonicalType(firstPixel(interval));
    }

    @Override
    protected Optional<SpatialImage> convertSource(RandomAccessibleInterval source) {
        RandomAccessibleInterval<?> interval = source;
        ComponentType componentType = ImgLib2Types.getComponentType(firstPixel(interval));
        long[] dims = reversed(interval.dimensionsAsLongArray());
        int nElements = checkedBufferSize(dims, 1);
        Buffer buffer = null;
        if (bufferOwnershipPolicy.decide(interval) == BufferOwnership.VIEW) {
            buffer = storageView(interval, componentType, nElements);
            if (buffer == null) {
                LOG.debug("{} has no array storage that can be aliased - copy it", interval);
            }
        }
        if (buffer == null) {
            buffer = copyPixels(interval, componentType, nElements);
        }
        return Optional.of(SpatialImage.builder()
                .dims(dims)
                .pixelType(PixelType.SCALAR)
                .componentType(componentType)
                .componentsPerPixel(1)
                .buffer(buffer)
                .build());
    }

    /**
     * @return a buffer over the storage array of an {@link ArrayImg} or null if the interval has no
     * primitive storage holding exactly its pixels
     */
    private static Buffer storageView(RandomAccessibleInterval<?> interval, ComponentType componentType, int nElements) {
        if (!(interval instanceof ArrayImg)) {
            return null;
        }
        Object access = ((ArrayImg<?, ?>) interval).update(null);
        if (!(access instanceof ArrayDataAccess)) {
            return null;
        }
        Object storage = ((ArrayDataAccess<?>) access).getCurrentStorageArray();
        if (storage == null || !storage.getClass().isArray() || Array.getLength(storage) != nElements) {
            return null;
        }
        Buffer view = TypedBuffers.wrap(storage);
        if (!TypedBuffers.matches(view, componentType)) {
            return null;
        }
        LOG.debug("Alias the storage of {}", interval);
        return view;
    }

    private static <T> Type<?> firstPixel(RandomAccessibleInterval<T> interval) {
        T first = Views.flatIterable(interval).firstElement();
        return first instanceof Type ? (Type<?>) first : null;
    }

    private static <T> Buffer copyPixels(RandomAccessibleInterval<T> interval, ComponentType componentType, int nElements) {
        Buffer buffer = TypedBuffers.allocate(componentType, nElements);
        Cursor<T> cursor = Views.flatIterable(interval).cursor();
        int index = 0;
        while (cursor.hasNext()) {
            T pixel = cursor.next();
            if (componentType.isInteger()) {
                TypedBuffers.putLong(buffer, componentType, index++, ((IntegerType<?>) pixel).getIntegerLong());
            } else {
                TypedBuffers.put(buffer, componentType, index++, ((RealType<?>) pixel).getRealDouble());
            }
        }
        return buffer;
    }
}
