package org.janelia.vizbridge.model;

import java.nio.Buffer;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Canonical image: extents, physical metadata, pixel layout and a pixel buffer.
 *
 * All per axis values ({@code dims}, {@code spacing}, {@code origin} and the rows/columns of
 * {@code direction}) are in array order, i.e. the slowest varying axis first and the fastest
 * varying axis last. Pixel components are interleaved.
 *
 * Instances are immutable. The buffer may alias the source array when the normalizer
 * decided that a view is safe, so it is only handed out as a read-only buffer.
 */
public class SpatialImage {

    private final long[] dims;
    private final double[] spacing;
    private final double[] origin;
    private final double[] direction;
    private final PixelType pixelType;
    private final ComponentType componentType;
    private final int componentsPerPixel;
    private final Buffer buffer;

    private SpatialImage(Builder builder) {
        this.dims = builder.dims.clone();
        int ndims = dims.length;
        Preconditions.checkArgument(ndims >= 1, "An image must have at least one dimension");
        for (long d : dims) {
            Preconditions.checkArgument(d > 0, "Invalid image dimensions: %s", Arrays.toString(dims));
        }
        this.spacing = builder.spacing != null ? builder.spacing.clone() : filled(ndims, 1.);
        this.origin = builder.origin != null ? builder.origin.clone() : filled(ndims, 0.);
        this.direction = builder.direction != null ? builder.direction.clone() : identity(ndims);
        Preconditions.checkArgument(spacing.length == ndims, "Spacing has %s values for %s dims", spacing.length, ndims);
        Preconditions.checkArgument(origin.length == ndims, "Origin has %s values for %s dims", origin.length, ndims);
        Preconditions.checkArgument(direction.length == ndims * ndims,
                "Direction has %s values for a %sx%s matrix", direction.length, ndims, ndims);
        this.componentType = Preconditions.checkNotNull(builder.componentType, "Component type is required");
        this.componentsPerPixel = builder.componentsPerPixel;
        Preconditions.checkArgument(componentsPerPixel > 0, "Invalid components per pixel: %s", componentsPerPixel);
        this.pixelType = builder.pixelType != null ? builder.pixelType : PixelType.forComponents(componentsPerPixel);
        Preconditions.checkNotNull(builder.buffer, "Pixel buffer is required");
        Preconditions.checkArgument(TypedBuffers.matches(builder.buffer, componentType),
                "A %s buffer cannot hold %s values", builder.buffer.getClass().getSimpleName(), componentType);
        long expectedElements = getNumberOfPixels() * componentsPerPixel;
        Preconditions.checkArgument(builder.buffer.capacity() == expectedElements,
                "Buffer holds %s elements but %s dims with %s components need %s",
                builder.buffer.capacity(), Arrays.toString(dims), componentsPerPixel, expectedElements);
        this.buffer = TypedBuffers.readOnly(builder.buffer);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .dims(dims)
                .spacing(spacing)
                .origin(origin)
                .direction(direction)
                .pixelType(pixelType)
                .componentType(componentType)
                .componentsPerPixel(componentsPerPixel)
                .buffer(buffer);
    }

    public int getDimension() {
        return dims.length;
    }

    public long[] getDims() {
        return dims.clone();
    }

    public long getDim(int axis) {
        return dims[axis];
    }

    public double[] getSpacing() {
        return spacing.clone();
    }

    public double[] getOrigin() {
        return origin.clone();
    }

    /**
     * @return the direction matrix flattened in row-major order
     */
    public double[] getDirection() {
        return direction.clone();
    }

    public double getDirection(int row, int col) {
        return direction[row * dims.length + col];
    }

    public PixelType getPixelType() {
        return pixelType;
    }

    public ComponentType getComponentType() {
        return componentType;
    }

    public int getComponentsPerPixel() {
        return componentsPerPixel;
    }

    /**
     * @return a read-only view of the pixel buffer positioned at the first element
     */
    public Buffer getBuffer() {
        return TypedBuffers.readOnly(buffer);
    }

    public long getNumberOfPixels() {
        return Arrays.stream(dims).reduce(1L, (d1, d2) -> d1 * d2);
    }

    public long getBufferByteLength() {
        return getNumberOfPixels() * componentsPerPixel * componentType.getByteWidth();
    }

    /**
     * Linear element offset of a pixel component.
     *
     * @param indices pixel index in array order (slowest axis first)
     */
    public int elementOffset(long[] indices, int component) {
        Preconditions.checkArgument(indices.length == dims.length, "Expected %s indices", dims.length);
        long offset = 0;
        for (int d = 0; d < dims.length; d++) {
            Preconditions.checkElementIndex((int) indices[d], (int) dims[d]);
            offset = offset * dims[d] + indices[d];
        }
        return (int) (offset * componentsPerPixel + component);
    }

    public long getIntegerValue(long[] indices, int component) {
        return TypedBuffers.getLong(buffer, componentType, elementOffset(indices, component));
    }

    public double getRealValue(long[] indices, int component) {
        return TypedBuffers.getDouble(buffer, componentType, elementOffset(indices, component));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        SpatialImage that = (SpatialImage) o;

        return new EqualsBuilder()
                .append(dims, that.dims)
                .append(spacing, that.spacing)
                .append(origin, that.origin)
                .append(direction, that.direction)
                .append(pixelType, that.pixelType)
                .append(componentType, that.componentType)
                .append(componentsPerPixel, that.componentsPerPixel)
                .isEquals() && TypedBuffers.contentEquals(buffer, that.buffer);
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(dims)
                .append(spacing)
                .append(origin)
                .append(direction)
                .append(pixelType)
                .append(componentType)
                .append(componentsPerPixel)
                .append(TypedBuffers.contentHashCode(buffer))
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("dims", dims)
                .append("spacing", spacing)
                .append("origin", origin)
                .append("direction", direction)
                .append("pixelType", pixelType)
                .append("componentType", componentType)
                .append("componentsPerPixel", componentsPerPixel)
                .toString();
    }

    private static double[] filled(int n, double v) {
        double[] values = new double[n];
        Arrays.fill(values, v);
        return values;
    }

    public static double[] identity(int n) {
        double[] m = new double[n * n];
        for (int i = 0; i < n; i++) {
            m[i * n + i] = 1.;
        }
        return m;
    }

    public static class Builder {
        private long[] dims;
        private double[] spacing;
        private double[] origin;
        private double[] direction;
        private PixelType pixelType;
        private ComponentType componentType;
        private int componentsPerPixel = 1;
        private Buffer buffer;

        private Builder() {
        }

        public Builder dims(long... dims) {
            this.dims = dims;
            return this;
        }

        public Builder spacing(double... spacing) {
            this.spacing = spacing;
            return this;
        }

        public Builder origin(double... origin) {
            this.origin = origin;
            return this;
        }

        /**
         * @param direction row-major direction matrix
         */
        public Builder direction(double... direction) {
            this.direction = direction;
            return this;
        }

        public Builder pixelType(PixelType pixelType) {
            this.pixelType = pixelType;
            return this;
        }

        public Builder componentType(ComponentType componentType) {
            this.componentType = componentType;
            return this;
        }

        public Builder componentsPerPixel(int componentsPerPixel) {
            this.componentsPerPixel = componentsPerPixel;
            return this;
        }

        /**
         * The buffer is not copied.
         */
        public Builder buffer(Buffer buffer) {
            this.buffer = buffer;
            return this;
        }

        public SpatialImage build() {
            Preconditions.checkNotNull(dims, "Image dims are required");
            return new SpatialImage(this);
        }
    }
}
