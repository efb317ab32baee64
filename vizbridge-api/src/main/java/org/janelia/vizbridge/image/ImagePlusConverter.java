package org.janelia.vizbridge.image;

import java.nio.Buffer;
import java.util.Optional;

import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.ImageProcessor;
import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.PixelType;
import org.janelia.vizbridge.model.SpatialImage;
import org.janelia.vizbridge.model.TypedBuffers;

/**
 * Copies the pixels of an ImageJ {@link ImagePlus}. Slices become the slowest axis, channels become
 * interleaved components and the spatial calibration becomes spacing and origin.
 */
public class ImagePlusConverter extends AbstractImageConverter<ImagePlus> {

    public ImagePlusConverter() {
        super(ImagePlus.class, Capability.IMAGEJ);
    }

    @Override
    protected Optional<SpatialImage> convertSource(ImagePlus imp) {
        if (imp.getNFrames() > 1) {
            throw new IllegalArgumentException("Time series are not supported: " + imp.getTitle() + " has " + imp.getNFrames() + " frames");
        }
        int width = imp.getWidth();
        int height = imp.getHeight();
        int nSlices = imp.getNSlices();
        int nChannels = imp.getNChannels();
        boolean rgb = imp.getType() == ImagePlus.COLOR_RGB;
        if (rgb && nChannels > 1) {
            throw new IllegalArgumentException("Multichannel RGB images are not supported: " + imp.getTitle());
        }
        ComponentType componentType = getComponentType(imp);
        int componentsPerPixel = rgb ? 3 : nChannels;

        Calibration cal = imp.getCalibration();
        long[] dims;
        double[] spacing;
        double[] origin;
        if (nSlices > 1) {
            dims = new long[] {nSlices, height, width};
            spacing = new double[] {cal.pixelDepth, cal.pixelHeight, cal.pixelWidth};
            origin = new double[] {-cal.zOrigin * cal.pixelDepth, -cal.yOrigin * cal.pixelHeight, -cal.xOrigin * cal.pixelWidth};
        } else {
            dims = new long[] {height, width};
            spacing = new double[] {cal.pixelHeight, cal.pixelWidth};
            origin = new double[] {-cal.yOrigin * cal.pixelHeight, -cal.xOrigin * cal.pixelWidth};
        }

        Buffer buffer = TypedBuffers.allocate(componentType, checkedBufferSize(dims, componentsPerPixel));
        ImageStack stack = imp.getStack();
        int slicePixels = width * height;
        for (int z = 0; z < nSlices; z++) {
            if (rgb) {
                int[] pixels = (int[]) stack.getProcessor(imp.getStackIndex(1, z + 1, 1)).getPixels();
                int offset = z * slicePixels * 3;
                for (int i = 0; i < slicePixels; i++) {
                    int rgbValue = pixels[i];
                    TypedBuffers.putLong(buffer, componentType, offset + 3 * i, (rgbValue >> 16) & 0xff);
                    TypedBuffers.putLong(buffer, componentType, offset + 3 * i + 1, (rgbValue >> 8) & 0xff);
                    TypedBuffers.putLong(buffer, componentType, offset + 3 * i + 2, rgbValue & 0xff);
                }
            } else {
                for (int c = 0; c < nChannels; c++) {
                    ImageProcessor ip = stack.getProcessor(imp.getStackIndex(c + 1, z + 1, 1));
                    copyChannel(ip, buffer, componentType, z * slicePixels, c, nChannels);
                }
            }
        }
        return Optional.of(SpatialImage.builder()
                .dims(dims)
                .spacing(spacing)
                .origin(origin)
                .pixelType(rgb ? PixelType.RGB : PixelType.forComponents(componentsPerPixel))
                .componentType(componentType)
                .componentsPerPixel(componentsPerPixel)
                .buffer(buffer)
                .build());
    }

    private static void copyChannel(ImageProcessor ip, Buffer buffer, ComponentType componentType,
                                    int pixelOffset, int channel, int nChannels) {
        Object pixels = ip.getPixels();
        int n = ip.getPixelCount();
        for (int i = 0; i < n; i++) {
            int index = (pixelOffset + i) * nChannels + channel;
            if (pixels instanceof byte[]) {
                TypedBuffers.putLong(buffer, componentType, index, ((byte[]) pixels)[i] & 0xff);
            } else if (pixels instanceof short[]) {
                TypedBuffers.putLong(buffer, componentType, index, ((short[]) pixels)[i] & 0xffff);
            } else if (pixels instanceof float[]) {
                TypedBuffers.put(buffer, componentType, index, ((float[]) pixels)[i]);
            } else {
                throw new IllegalArgumentException("Unexpected pixel array " + pixels);
            }
        }
    }

    private static ComponentType getComponentType(ImagePlus imp) {
        switch (imp.getType()) {
            case ImagePlus.GRAY8:
            case ImagePlus.COLOR_256:
            case ImagePlus.COLOR_RGB:
                return ComponentType.UINT8;
            case ImagePlus.GRAY16:
                return ComponentType.UINT16;
            case ImagePlus.GRAY32:
                return ComponentType.FLOAT32;
            default:
                throw new IllegalArgumentException("Unsupported ImageJ image type " + imp.getType() + " for " + imp.getTitle());
        }
    }
}
