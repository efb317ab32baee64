package org.janelia.vizbridge.image;

import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;
import java.util.Optional;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ShortProcessor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.img.cell.CellImgFactory;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.capability.CapabilityRegistry;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.PixelType;
import org.janelia.vizbridge.model.SpatialImage;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ImageNormalizerTest {

    private ImageNormalizer imageNormalizer;

    @Before
    public void setUp() {
        imageNormalizer = new ImageNormalizer(
                CapabilityRegistry.builder().withAll().build(),
                new DefaultBufferOwnershipPolicy(true));
    }

    @Test
    public void arrayImgIsAliased() {
        byte[] pixels = new byte[4 * 3];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (byte) i;
        }
        ArrayImg<UnsignedByteType, ByteArray> img = ArrayImgs.unsignedBytes(pixels, 4, 3);

        SpatialImage image = imageNormalizer.normalizeImage(img).orElseThrow(AssertionError::new);

        assertArrayEquals(new long[] {3, 4}, image.getDims());
        assertEquals(ComponentType.UINT8, image.getComponentType());
        assertEquals(PixelType.SCALAR, image.getPixelType());
        assertEquals(6, image.getIntegerValue(new long[] {1, 2}, 0));
        pixels[6] = 100;
        assertEquals(100, image.getIntegerValue(new long[] {1, 2}, 0));
    }

    @Test
    public void arrayImgIsCopiedWhenViewsAreNotAllowed() {
        float[] pixels = new float[] {1.5f, 2.5f, 3.5f, 4.5f, 5.5f, 6.5f};
        ImageNormalizer copyingNormalizer = new ImageNormalizer(
                CapabilityRegistry.builder().withAll().build(),
                new DefaultBufferOwnershipPolicy(false));

        SpatialImage image = copyingNormalizer.normalizeImage(ArrayImgs.floats(pixels, 3, 2)).orElseThrow(AssertionError::new);

        assertEquals(ComponentType.FLOAT32, image.getComponentType());
        pixels[0] = -1;
        assertEquals(1.5, image.getRealValue(new long[] {0, 0}, 0), 0.);
        assertEquals(6.5, image.getRealValue(new long[] {1, 2}, 0), 0.);
    }

    @Test
    public void cellImgIsCopied() {
        Img<UnsignedShortType> img = new CellImgFactory<>(new UnsignedShortType(), 2).create(5, 4, 3);
        int v = 0;
        for (UnsignedShortType px : Views.flatIterable(img)) {
            px.set(v++);
        }

        SpatialImage image = imageNormalizer.normalizeImage(img).orElseThrow(AssertionError::new);

        assertArrayEquals(new long[] {3, 4, 5}, image.getDims());
        assertEquals(ComponentType.UINT16, image.getComponentType());
        assertEquals(0, image.getIntegerValue(new long[] {0, 0, 0}, 0));
        assertEquals(5 * 4 * 3 - 1, image.getIntegerValue(new long[] {2, 3, 4}, 0));
        assertEquals(5 + 2, image.getIntegerValue(new long[] {0, 1, 2}, 0));
    }

    @Test
    public void viewIsCopied() {
        float[] pixels = new float[6 * 6];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = i;
        }
        RandomAccessibleInterval<FloatType> crop = Views.interval(ArrayImgs.floats(pixels, 6, 6), new long[] {2, 1}, new long[] {4, 2});

        SpatialImage image = imageNormalizer.normalizeImage(crop).orElseThrow(AssertionError::new);

        assertArrayEquals(new long[] {2, 3}, image.getDims());
        assertEquals(8, image.getRealValue(new long[] {0, 0}, 0), 0.);
        assertEquals(16, image.getRealValue(new long[] {1, 2}, 0), 0.);
        pixels[8] = -1;
        assertEquals(8, image.getRealValue(new long[] {0, 0}, 0), 0.);
    }

    @Test
    public void sourcesWithoutArrayStorageAreCopiedWhenAPolicyAllowsAView() {
        ImageNormalizer viewingNormalizer = new ImageNormalizer(
                CapabilityRegistry.builder().withAll().build(),
                source -> BufferOwnership.VIEW);
        Img<UnsignedShortType> cellImg = new CellImgFactory<>(new UnsignedShortType(), 2).create(3, 2);
        int v = 0;
        for (UnsignedShortType px : Views.flatIterable(cellImg)) {
            px.set(v++);
        }
        float[] pixels = new float[] {0, 1, 2, 3, 4, 5, 6, 7, 8};
        RandomAccessibleInterval<FloatType> crop = Views.interval(ArrayImgs.floats(pixels, 3, 3), new long[] {1, 1}, new long[] {2, 2});

        SpatialImage fromCells = viewingNormalizer.normalizeImage(cellImg).orElseThrow(AssertionError::new);
        SpatialImage fromCrop = viewingNormalizer.normalizeImage(crop).orElseThrow(AssertionError::new);

        assertArrayEquals(new long[] {2, 3}, fromCells.getDims());
        assertEquals(4, fromCells.getIntegerValue(new long[] {1, 1}, 0));
        assertArrayEquals(new long[] {2, 2}, fromCrop.getDims());
        assertEquals(4, fromCrop.getRealValue(new long[] {0, 0}, 0), 0.);
        assertEquals(8, fromCrop.getRealValue(new long[] {1, 1}, 0), 0.);
        pixels[4] = -1;
        assertEquals(4, fromCrop.getRealValue(new long[] {0, 0}, 0), 0.);
    }

    @Test
    public void unsupportedSourcesAreNotConverted() {
        assertFalse(imageNormalizer.normalizeImage(null).isPresent());
        assertFalse(imageNormalizer.normalizeImage("not an image").isPresent());
        assertFalse(imageNormalizer.normalizeImage(new int[] {1, 2, 3}).isPresent());
        assertFalse(imageNormalizer.normalizeImage(ArrayImgs.argbs(2, 2)).isPresent());
    }

    @Test
    public void imagePlusStackWithCalibration() {
        ImageStack stack = new ImageStack(3, 2);
        for (int z = 0; z < 4; z++) {
            short[] pixels = new short[6];
            for (int i = 0; i < pixels.length; i++) {
                pixels[i] = (short) (1000 * z + i);
            }
            stack.addSlice(new ShortProcessor(3, 2, pixels, null));
        }
        ImagePlus imp = new ImagePlus("stack", stack);
        imp.getCalibration().pixelWidth = 0.5;
        imp.getCalibration().pixelHeight = 0.25;
        imp.getCalibration().pixelDepth = 2;
        imp.getCalibration().xOrigin = 4;

        SpatialImage image = imageNormalizer.normalizeImage(imp).orElseThrow(AssertionError::new);

        assertArrayEquals(new long[] {4, 2, 3}, image.getDims());
        assertArrayEquals(new double[] {2, 0.25, 0.5}, image.getSpacing(), 0.);
        assertArrayEquals(new double[] {0, 0, -2}, image.getOrigin(), 0.);
        assertEquals(ComponentType.UINT16, image.getComponentType());
        assertEquals(3005, image.getIntegerValue(new long[] {3, 1, 2}, 0));
    }

    @Test
    public void rgbImagePlusHasInterleavedComponents() {
        ColorProcessor cp = new ColorProcessor(2, 2);
        cp.set(1, 0, (10 << 16) | (20 << 8) | 30);
        SpatialImage image = imageNormalizer.normalizeImage(new ImagePlus("rgb", cp)).orElseThrow(AssertionError::new);

        assertEquals(PixelType.RGB, image.getPixelType());
        assertEquals(3, image.getComponentsPerPixel());
        assertEquals(10, image.getIntegerValue(new long[] {0, 1}, 0));
        assertEquals(20, image.getIntegerValue(new long[] {0, 1}, 1));
        assertEquals(30, image.getIntegerValue(new long[] {0, 1}, 2));
        assertEquals(0, image.getIntegerValue(new long[] {1, 1}, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void timeSeriesAreRejected() {
        ImageStack stack = new ImageStack(2, 2);
        stack.addSlice(new FloatProcessor(2, 2));
        stack.addSlice(new FloatProcessor(2, 2));
        ImagePlus imp = new ImagePlus("frames", stack);
        imp.setDimensions(1, 1, 2);
        imageNormalizer.normalizeImage(imp);
    }

    @Test
    public void bufferedImageBands() {
        BufferedImage gray = new BufferedImage(3, 2, BufferedImage.TYPE_BYTE_GRAY);
        gray.getRaster().setSample(2, 1, 0, 200);
        BufferedImage rgb = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 1, (1 << 16) | (2 << 8) | 3);

        SpatialImage grayImage = imageNormalizer.normalizeImage(gray).orElseThrow(AssertionError::new);
        SpatialImage rgbImage = imageNormalizer.normalizeImage(rgb).orElseThrow(AssertionError::new);

        assertArrayEquals(new long[] {2, 3}, grayImage.getDims());
        assertEquals(PixelType.SCALAR, grayImage.getPixelType());
        assertEquals(200, grayImage.getIntegerValue(new long[] {1, 2}, 0));
        assertEquals(PixelType.RGB, rgbImage.getPixelType());
        assertEquals(ComponentType.UINT8, rgbImage.getComponentType());
        assertEquals(1, rgbImage.getIntegerValue(new long[] {1, 0}, 0));
        assertEquals(3, rgbImage.getIntegerValue(new long[] {1, 0}, 2));
    }

    @Test
    public void convertersOfMissingCapabilitiesAreSkipped() {
        ImageNormalizer imageJLessNormalizer = new ImageNormalizer(
                CapabilityRegistry.builder().withAll().with(Capability.IMAGEJ, false).build(),
                new DefaultBufferOwnershipPolicy(true));

        Optional<SpatialImage> result = imageJLessNormalizer.normalizeImage(new ImagePlus("gray", new ByteProcessor(2, 2)));

        assertFalse(result.isPresent());
        assertTrue(imageJLessNormalizer.getConverters().stream()
                .noneMatch(c -> c.getRequiredCapability() == Capability.IMAGEJ));
    }

    @Test
    public void unresolvedSessionReferenceIsNotConverted() {
        assertFalse(imageNormalizer.normalizeImage(ImageJImageReference.ofTitle("no such image")).isPresent());
    }

    @Test
    public void normalizedBufferIsReadOnly() {
        SpatialImage image = imageNormalizer.normalizeImage(ArrayImgs.unsignedBytes(2, 2)).orElseThrow(AssertionError::new);
        assertTrue(image.getBuffer().isReadOnly());
        assertTrue(image.getBuffer() instanceof ByteBuffer);
    }
}
