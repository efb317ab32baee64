package org.janelia.vizbridge.model;

import java.nio.Buffer;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;
import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Helpers for the typed nio buffers that hold canonical pixel and attribute values.
 * A buffer of a given {@link ComponentType} is always the nio flavor with the same width
 * (ByteBuffer for 8 bit types, ShortBuffer for 16 bit types, ...). Buffers handled here start
 * at position 0 and their limit is the element count.
 */
public class TypedBuffers {

    public static Buffer allocate(ComponentType componentType, int nElements) {
        switch (componentType) {
            case INT8:
            case UINT8:
                return ByteBuffer.allocate(nElements);
            case INT16:
            case UINT16:
                return ShortBuffer.allocate(nElements);
            case INT32:
            case UINT32:
                return IntBuffer.allocate(nElements);
            case INT64:
            case UINT64:
                return LongBuffer.allocate(nElements);
            case FLOAT32:
                return FloatBuffer.allocate(nElements);
            case FLOAT64:
                return DoubleBuffer.allocate(nElements);
            default:
                throw new UnsupportedComponentTypeException("Unsupported component type: " + componentType);
        }
    }

    /**
     * Wrap a primitive array without copying it.
     */
    public static Buffer wrap(Object primitiveArray) {
        if (primitiveArray instanceof byte[]) {
            return ByteBuffer.wrap((byte[]) primitiveArray);
        } else if (primitiveArray instanceof short[]) {
            return ShortBuffer.wrap((short[]) primitiveArray);
        } else if (primitiveArray instanceof int[]) {
            return IntBuffer.wrap((int[]) primitiveArray);
        } else if (primitiveArray instanceof long[]) {
            return LongBuffer.wrap((long[]) primitiveArray);
        } else if (primitiveArray instanceof float[]) {
            return FloatBuffer.wrap((float[]) primitiveArray);
        } else if (primitiveArray instanceof double[]) {
            return DoubleBuffer.wrap((double[]) primitiveArray);
        } else {
            throw new IllegalArgumentException("Not a primitive numeric array: " + primitiveArray);
        }
    }

    /**
     * Check that the buffer flavor is the one expected for the component type.
     */
    public static boolean matches(Buffer buffer, ComponentType componentType) {
        switch (componentType.getByteWidth()) {
            case 1:
                return buffer instanceof ByteBuffer;
            case 2:
                return buffer instanceof ShortBuffer;
            case 4:
                return componentType == ComponentType.FLOAT32 ? buffer instanceof FloatBuffer : buffer instanceof IntBuffer;
            case 8:
                return componentType == ComponentType.FLOAT64 ? buffer instanceof DoubleBuffer : buffer instanceof LongBuffer;
            default:
                return false;
        }
    }

    public static Buffer readOnly(Buffer buffer) {
        Buffer ro;
        if (buffer instanceof ByteBuffer) {
            ro = ((ByteBuffer) buffer).asReadOnlyBuffer();
        } else if (buffer instanceof ShortBuffer) {
            ro = ((ShortBuffer) buffer).asReadOnlyBuffer();
        } else if (buffer instanceof IntBuffer) {
            ro = ((IntBuffer) buffer).asReadOnlyBuffer();
        } else if (buffer instanceof LongBuffer) {
            ro = ((LongBuffer) buffer).asReadOnlyBuffer();
        } else if (buffer instanceof FloatBuffer) {
            ro = ((FloatBuffer) buffer).asReadOnlyBuffer();
        } else if (buffer instanceof DoubleBuffer) {
            ro = ((DoubleBuffer) buffer).asReadOnlyBuffer();
        } else {
            throw new IllegalArgumentException("Unsupported buffer " + buffer);
        }
        ro.rewind();
        return ro;
    }

    /**
     * @return the buffer elements serialized as little endian bytes
     */
    public static byte[] toLittleEndianBytes(Buffer buffer) {
        Buffer src = readOnly(buffer);
        if (src instanceof ByteBuffer) {
            byte[] bytes = new byte[src.remaining()];
            ((ByteBuffer) src).get(bytes);
            return bytes;
        }
        int elementWidth = elementWidth(src);
        ByteBuffer out = ByteBuffer.allocate(src.remaining() * elementWidth).order(ByteOrder.LITTLE_ENDIAN);
        if (src instanceof ShortBuffer) {
            out.asShortBuffer().put((ShortBuffer) src);
        } else if (src instanceof IntBuffer) {
            out.asIntBuffer().put((IntBuffer) src);
        } else if (src instanceof LongBuffer) {
            out.asLongBuffer().put((LongBuffer) src);
        } else if (src instanceof FloatBuffer) {
            out.asFloatBuffer().put((FloatBuffer) src);
        } else {
            out.asDoubleBuffer().put((DoubleBuffer) src);
        }
        return out.array();
    }

    /**
     * Interpret little endian bytes as elements of the given type. The returned buffer
     * is backed by the given array.
     */
    public static Buffer fromLittleEndianBytes(byte[] bytes, ComponentType componentType) {
        Preconditions.checkArgument(bytes.length % componentType.getByteWidth() == 0,
                "%s bytes is not a multiple of the %s width", bytes.length, componentType);
        ByteBuffer src = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        switch (componentType) {
            case INT8:
            case UINT8:
                return src;
            case INT16:
            case UINT16:
                return src.asShortBuffer();
            case INT32:
            case UINT32:
                return src.asIntBuffer();
            case INT64:
            case UINT64:
                return src.asLongBuffer();
            case FLOAT32:
                return src.asFloatBuffer();
            case FLOAT64:
                return src.asDoubleBuffer();
            default:
                throw new UnsupportedComponentTypeException("Unsupported component type: " + componentType);
        }
    }

    public static int elementWidth(Buffer buffer) {
        if (buffer instanceof ByteBuffer) {
            return 1;
        } else if (buffer instanceof ShortBuffer) {
            return 2;
        } else if (buffer instanceof IntBuffer || buffer instanceof FloatBuffer) {
            return 4;
        } else {
            return 8;
        }
    }

    /**
     * Read an integer element honoring the signedness of the component type.
     * UINT64 values above {@link Long#MAX_VALUE} come back negative.
     */
    public static long getLong(Buffer buffer, ComponentType componentType, int index) {
        switch (componentType) {
            case INT8:
                return ((ByteBuffer) buffer).get(index);
            case UINT8:
                return ((ByteBuffer) buffer).get(index) & 0xFFL;
            case INT16:
                return ((ShortBuffer) buffer).get(index);
            case UINT16:
                return ((ShortBuffer) buffer).get(index) & 0xFFFFL;
            case INT32:
                return ((IntBuffer) buffer).get(index);
            case UINT32:
                return ((IntBuffer) buffer).get(index) & 0xFFFFFFFFL;
            case INT64:
            case UINT64:
                return ((LongBuffer) buffer).get(index);
            case FLOAT32:
                return (long) ((FloatBuffer) buffer).get(index);
            case FLOAT64:
                return (long) ((DoubleBuffer) buffer).get(index);
            default:
                throw new UnsupportedComponentTypeException("Unsupported component type: " + componentType);
        }
    }

    public static double getDouble(Buffer buffer, ComponentType componentType, int index) {
        switch (componentType) {
            case FLOAT32:
                return ((FloatBuffer) buffer).get(index);
            case FLOAT64:
                return ((DoubleBuffer) buffer).get(index);
            case UINT64:
                long v = ((LongBuffer) buffer).get(index);
                return v >= 0 ? v : (double) (v >>> 1) * 2.0 + (v & 1);
            default:
                return getLong(buffer, componentType, index);
        }
    }

    /**
     * Store a value, truncating it to the width of the component type.
     */
    public static void put(Buffer buffer, ComponentType componentType, int index, double value) {
        switch (componentType) {
            case INT8:
            case UINT8:
                ((ByteBuffer) buffer).put(index, (byte) (long) value);
                break;
            case INT16:
            case UINT16:
                ((ShortBuffer) buffer).put(index, (short) (long) value);
                break;
            case INT32:
            case UINT32:
                ((IntBuffer) buffer).put(index, (int) (long) value);
                break;
            case INT64:
            case UINT64:
                ((LongBuffer) buffer).put(index, (long) value);
                break;
            case FLOAT32:
                ((FloatBuffer) buffer).put(index, (float) value);
                break;
            case FLOAT64:
                ((DoubleBuffer) buffer).put(index, value);
                break;
            default:
                throw new UnsupportedComponentTypeException("Unsupported component type: " + componentType);
        }
    }

    public static void putLong(Buffer buffer, ComponentType componentType, int index, long value) {
        switch (componentType) {
            case INT8:
            case UINT8:
                ((ByteBuffer) buffer).put(index, (byte) value);
                break;
            case INT16:
            case UINT16:
                ((ShortBuffer) buffer).put(index, (short) value);
                break;
            case INT32:
            case UINT32:
                ((IntBuffer) buffer).put(index, (int) value);
                break;
            case INT64:
            case UINT64:
                ((LongBuffer) buffer).put(index, value);
                break;
            default:
                put(buffer, componentType, index, (double) value);
        }
    }

    public static boolean contentEquals(Buffer b1, Buffer b2) {
        if (b1 == b2) {
            return true;
        } else if (b1 == null || b2 == null || elementWidth(b1) != elementWidth(b2)) {
            return false;
        }
        return Arrays.equals(toLittleEndianBytes(b1), toLittleEndianBytes(b2));
    }

    public static int contentHashCode(Buffer buffer) {
        return buffer == null ? 0 : Arrays.hashCode(toLittleEndianBytes(buffer));
    }
}
