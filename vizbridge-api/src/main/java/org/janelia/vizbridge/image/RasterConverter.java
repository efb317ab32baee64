package org.janelia.vizbridge.image;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.nio.Buffer;
import java.util.Arrays;
import java.util.Optional;

import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.SpatialImage;
import org.janelia.vizbridge.model.TypedBuffers;

/**
 * Copies the band samples of an AWT {@link Raster} or {@link BufferedImage}.
 */
public class RasterConverter extends AbstractImageConverter<Raster> {

    public RasterConverter() {
        super(Raster.class, Capability.AWT);
    }

    @Override
    public boolean accepts(Object source) {
        return source instanceof BufferedImage || super.accepts(source);
    }

    @Override
    public Optional<SpatialImage> convert(Object source) {
        if (source instanceof BufferedImage) {
            return convertSource(((BufferedImage) source).getRaster());
        }
        return super.convert(source);
    }

    @Override
    protected Optional<SpatialImage> convertSource(Raster raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        int nBands = raster.getNumBands();
        ComponentType componentType = getComponentType(raster);
        long[] dims = new long[] {height, width};
        int nElements = checkedBufferSize(dims, nBands);
        Buffer buffer = TypedBuffers.allocate(componentType, nElements);
        int minX = raster.getMinX();
        int minY = raster.getMinY();
        switch (componentType) {
            case FLOAT32: {
                float[] samples = raster.getPixels(minX, minY, width, height, (float[]) null);
                for (int i = 0; i < nElements; i++) {
                    TypedBuffers.put(buffer, componentType, i, samples[i]);
                }
                break;
            }
            case FLOAT64: {
                double[] samples = raster.getPixels(minX, minY, width, height, (double[]) null);
                for (int i = 0; i < nElements; i++) {
                    TypedBuffers.put(buffer, componentType, i, samples[i]);
                }
                break;
            }
            default: {
                int[] samples = raster.getPixels(minX, minY, width, height, (int[]) null);
                for (int i = 0; i < nElements; i++) {
                    TypedBuffers.putLong(buffer, componentType, i, samples[i]);
                }
            }
        }
        return Optional.of(SpatialImage.builder()
                .dims(dims)
                .origin(minY, minX)
                .pixelType(pixelTypeForComponents(nBands))
                .componentType(componentType)
                .componentsPerPixel(nBands)
                .buffer(buffer)
                .build());
    }

    private static ComponentType getComponentType(Raster raster) {
        int maxSampleSize = Arrays.stream(raster.getSampleModel().getSampleSize()).max().orElse(0);
        switch (raster.getTransferType()) {
            case DataBuffer.TYPE_BYTE:
                return ComponentType.UINT8;
            case DataBuffer.TYPE_USHORT:
                return maxSampleSize <= 8 ? ComponentType.UINT8 : ComponentType.UINT16;
            case DataBuffer.TYPE_SHORT:
                return ComponentType.INT16;
            case DataBuffer.TYPE_INT:
                return maxSampleSize <= 8 ? ComponentType.UINT8 : ComponentType.INT32;
            case DataBuffer.TYPE_FLOAT:
                return ComponentType.FLOAT32;
            case DataBuffer.TYPE_DOUBLE:
                return ComponentType.FLOAT64;
            default:
                throw new IllegalArgumentException("Unsupported raster transfer type " + raster.getTransferType());
        }
    }
}
