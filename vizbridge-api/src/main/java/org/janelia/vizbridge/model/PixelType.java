package org.janelia.vizbridge.model;

import java.util.Arrays;

/**
 * Pixel kind tag. The codes are the ones the remote renderer understands.
 */
public enum PixelType {
    UNKNOWN(0),
    SCALAR(1),
    RGB(2),
    RGBA(3),
    OFFSET(4),
    VECTOR(5),
    POINT(6),
    COVARIANT_VECTOR(7),
    SYMMETRIC_SECOND_RANK_TENSOR(8),
    DIFFUSION_TENSOR_3D(9),
    COMPLEX(10),
    FIXED_ARRAY(11),
    ARRAY(12),
    MATRIX(13),
    VARIABLE_LENGTH_VECTOR(14),
    VARIABLE_SIZE_MATRIX(15);

    private final int code;

    PixelType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static PixelType fromCode(int code) {
        return Arrays.stream(values())
                .filter(pt -> pt.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid pixel type code: " + code));
    }

    /**
     * Pixel type for an image with the given number of interleaved components
     * when the source does not say anything more specific.
     */
    public static PixelType forComponents(int componentsPerPixel) {
        return componentsPerPixel == 1 ? SCALAR : VARIABLE_LENGTH_VECTOR;
    }
}
