package org.janelia.vizbridge.image;

import java.lang.reflect.Array;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.ArrayDataAccess;
import net.imglib2.type.Type;
import net.imglib2.util.Intervals;
import org.janelia.vizbridge.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allows a view only for an {@link ArrayImg} of one of the canonical element types whose
 * single primitive storage array holds exactly one element per pixel. Cell images, views,
 * converted intervals and any other source are copied.
 */
public class DefaultBufferOwnershipPolicy implements BufferOwnershipPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultBufferOwnershipPolicy.class);

    private final boolean allowViews;

    public DefaultBufferOwnershipPolicy(boolean allowViews) {
        this.allowViews = allowViews;
    }

    public static DefaultBufferOwnershipPolicy fromConfig(Config config) {
        return new DefaultBufferOwnershipPolicy(config.getBooleanPropertyValue("BufferOwnership.AllowViews", true));
    }

    @Override
    public BufferOwnership decide(Object source) {
        if (!allowViews || !(source instanceof ArrayImg)) {
            return BufferOwnership.COPY;
        }
        ArrayImg<?, ?> arrayImg = (ArrayImg<?, ?>) source;
        Object type = arrayImg.firstElement();
        if (!(type instanceof Type) || !ImgLib2Types.isCanonicalType((Type<?>) type)) {
            return BufferOwnership.COPY;
        }
        Object access = arrayImg.update(null);
        if (!(access instanceof ArrayDataAccess)) {
            return BufferOwnership.COPY;
        }
        Object storage = ((ArrayDataAccess<?>) access).getCurrentStorageArray();
        if (storage == null || !storage.getClass().isArray()
                || Array.getLength(storage) != Intervals.numElements(arrayImg)) {
            LOG.debug("Storage of {} does not hold exactly one element per pixel - copy it", arrayImg);
            return BufferOwnership.COPY;
        }
        return BufferOwnership.VIEW;
    }
}
