package org.janelia.vizbridge.image;

import java.util.HashMap;
import java.util.Map;

import net.imglib2.type.Type;
import net.imglib2.type.numeric.integer.ByteType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.integer.LongType;
import net.imglib2.type.numeric.integer.ShortType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedIntType;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.vizbridge.model.ComponentType;

/**
 * Mapping between the ImgLib2 native real types and the canonical component types.
 */
public class ImgLib2Types {

    private static final Map<Class<?>, ComponentType> COMPONENT_TYPES = new HashMap<>();
    static {
        COMPONENT_TYPES.put(ByteType.class, ComponentType.INT8);
        COMPONENT_TYPES.put(UnsignedByteType.class, ComponentType.UINT8);
        COMPONENT_TYPES.put(ShortType.class, ComponentType.INT16);
        COMPONENT_TYPES.put(UnsignedShortType.class, ComponentType.UINT16);
        COMPONENT_TYPES.put(IntType.class, ComponentType.INT32);
        COMPONENT_TYPES.put(UnsignedIntType.class, ComponentType.UINT32);
        COMPONENT_TYPES.put(LongType.class, ComponentType.INT64);
        COMPONENT_TYPES.put(UnsignedLongType.class, ComponentType.UINT64);
        COMPONENT_TYPES.put(FloatType.class, ComponentType.FLOAT32);
        COMPONENT_TYPES.put(DoubleType.class, ComponentType.FLOAT64);
    }

    public static boolean isCanonicalType(Type<?> type) {
        return type != null && COMPONENT_TYPES.containsKey(type.getClass());
    }

    /**
     * @return the component type of the pixel type or null if the pixel type has no canonical counterpart
     */
    public static ComponentType getComponentType(Type<?> type) {
        return type == null ? null : COMPONENT_TYPES.get(type.getClass());
    }
}
