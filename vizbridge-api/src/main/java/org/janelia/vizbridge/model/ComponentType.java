package org.janelia.vizbridge.model;

import java.util.Arrays;

/**
 * Scalar storage type of an image component or of a data array value.
 * Each type knows its symbolic name on the image wire ({@code uint8_t}, {@code float}, ...)
 * and its typed array name in the geometry wire schema ({@code Uint8Array}, ...).
 */
public enum ComponentType {
    INT8("int8_t", "Int8Array", 1, true, true),
    UINT8("uint8_t", "Uint8Array", 1, true, false),
    INT16("int16_t", "Int16Array", 2, true, true),
    UINT16("uint16_t", "Uint16Array", 2, true, false),
    INT32("int32_t", "Int32Array", 4, true, true),
    UINT32("uint32_t", "Uint32Array", 4, true, false),
    INT64("int64_t", "BigInt64Array", 8, true, true),
    UINT64("uint64_t", "BigUint64Array", 8, true, false),
    FLOAT32("float", "Float32Array", 4, false, true),
    FLOAT64("double", "Float64Array", 8, false, true);

    private final String wireName;
    private final String arrayTypeName;
    private final int byteWidth;
    private final boolean integer;
    private final boolean signed;

    ComponentType(String wireName, String arrayTypeName, int byteWidth, boolean integer, boolean signed) {
        this.wireName = wireName;
        this.arrayTypeName = arrayTypeName;
        this.byteWidth = byteWidth;
        this.integer = integer;
        this.signed = signed;
    }

    public String getWireName() {
        return wireName;
    }

    public String getArrayTypeName() {
        return arrayTypeName;
    }

    public int getByteWidth() {
        return byteWidth;
    }

    public boolean isInteger() {
        return integer;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean is64BitInteger() {
        return integer && byteWidth == 8;
    }

    /**
     * @return the smallest value representable by this type, for integer types only
     */
    public long getMinIntegerValue() {
        switch (this) {
            case INT8: return Byte.MIN_VALUE;
            case INT16: return Short.MIN_VALUE;
            case INT32: return Integer.MIN_VALUE;
            case INT64: return Long.MIN_VALUE;
            case UINT8:
            case UINT16:
            case UINT32:
            case UINT64:
                return 0;
            default:
                throw new IllegalStateException(this + " is not an integer type");
        }
    }

    /**
     * @return the largest value representable by this type, for integer types up to 32 bits and INT64
     */
    public long getMaxIntegerValue() {
        switch (this) {
            case INT8: return Byte.MAX_VALUE;
            case UINT8: return 0xFFL;
            case INT16: return Short.MAX_VALUE;
            case UINT16: return 0xFFFFL;
            case INT32: return Integer.MAX_VALUE;
            case UINT32: return 0xFFFFFFFFL;
            case INT64: return Long.MAX_VALUE;
            default:
                throw new IllegalStateException("No long maximum for " + this);
        }
    }

    /**
     * The 32-bit type a 64-bit integer type is narrowed to.
     */
    public ComponentType narrowed() {
        switch (this) {
            case INT64: return INT32;
            case UINT64: return UINT32;
            default: return this;
        }
    }

    public static ComponentType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(ct -> ct.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new UnsupportedComponentTypeException("Unsupported component type: " + wireName));
    }

    public static ComponentType fromArrayTypeName(String arrayTypeName) {
        return Arrays.stream(values())
                .filter(ct -> ct.arrayTypeName.equals(arrayTypeName))
                .findFirst()
                .orElseThrow(() -> new UnsupportedComponentTypeException("Unsupported array data type: " + arrayTypeName));
    }
}
