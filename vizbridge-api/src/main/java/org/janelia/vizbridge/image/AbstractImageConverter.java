package org.janelia.vizbridge.image;

import java.util.Optional;

import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.PixelType;
import org.janelia.vizbridge.model.SpatialImage;

public abstract class AbstractImageConverter<S> implements ImageConverter {

    private final Class<S> sourceClass;
    private final Capability requiredCapability;

    protected AbstractImageConverter(Class<S> sourceClass, Capability requiredCapability) {
        this.sourceClass = sourceClass;
        this.requiredCapability = requiredCapability;
    }

    @Override
    public Capability getRequiredCapability() {
        return requiredCapability;
    }

    @Override
    public boolean accepts(Object source) {
        return sourceClass.isInstance(source);
    }

    @Override
    public Optional<SpatialImage> convert(Object source) {
        return convertSource(sourceClass.cast(source));
    }

    protected abstract Optional<SpatialImage> convertSource(S source);

    /**
     * 1 component is a scalar, 3 are RGB, 4 are RGBA and any other count a variable length vector.
     */
    static PixelType pixelTypeForComponents(int componentsPerPixel) {
        switch (componentsPerPixel) {
            case 1: return PixelType.SCALAR;
            case 3: return PixelType.RGB;
            case 4: return PixelType.RGBA;
            default: return PixelType.VARIABLE_LENGTH_VECTOR;
        }
    }

    static long[] reversed(long[] values) {
        long[] r = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            r[i] = values[values.length - 1 - i];
        }
        return r;
    }

    static double[] reversed(double[] values) {
        double[] r = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            r[i] = values[values.length - 1 - i];
        }
        return r;
    }

    static int checkedBufferSize(long[] dims, int componentsPerPixel) {
        long n = componentsPerPixel;
        for (long d : dims) {
            n *= d;
        }
        if (n > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image with " + n + " elements is too large for a single buffer");
        }
        return (int) n;
    }
}
