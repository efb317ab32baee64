package org.janelia.vizbridge.wire;

import java.util.Arrays;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;
import org.janelia.vizbridge.config.Config;
import org.janelia.vizbridge.config.ConfigProvider;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.PixelType;
import org.janelia.vizbridge.model.SpatialImage;
import org.janelia.vizbridge.model.TypedBuffers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes a {@link SpatialImage} into an {@link ImagePayload} and back.
 *
 * The pixel bytes are little endian, row-major with interleaved components, compressed as a single
 * Zstandard frame that records the content size. The header axes are reversed with respect to the
 * canonical axes and so are both the rows and the columns of the direction matrix.
 */
public class ImageWireCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ImageWireCodec.class);
    public static final int DEFAULT_COMPRESSION_LEVEL = 3;

    private final int compressionLevel;

    public ImageWireCodec() {
        this(ConfigProvider.getDefaultConfig());
    }

    public ImageWireCodec(Config config) {
        this(config.getIntegerPropertyValue("WireCodec.CompressionLevel", DEFAULT_COMPRESSION_LEVEL));
    }

    public ImageWireCodec(int compressionLevel) {
        this.compressionLevel = compressionLevel;
    }

    public ImagePayload encodeImage(SpatialImage image) {
        long startTime = System.currentTimeMillis();
        int n = image.getDimension();
        ImagePayload payload = new ImagePayload();
        payload.setImageType(new ImagePayload.ImageType(
                n,
                image.getComponentType().getWireName(),
                image.getPixelType().getCode(),
                image.getComponentsPerPixel()));
        payload.setOrigin(reversed(image.getOrigin()));
        payload.setSpacing(reversed(image.getSpacing()));
        payload.setSize(reversed(image.getDims()));
        payload.setDirection(new ImagePayload.Direction(flipAxes(image.getDirection(), n), n, n));

        byte[] pixelBytes = TypedBuffers.toLittleEndianBytes(image.getBuffer());
        byte[] compressed = Zstd.compress(pixelBytes, compressionLevel);
        payload.setCompressedData(compressed);
        LOG.debug("Compressed {} pixel bytes into {} bytes in {}ms",
                pixelBytes.length, compressed.length, System.currentTimeMillis() - startTime);
        return payload;
    }

    /**
     * @throws CorruptPayloadException if the header is inconsistent or the compressed data does not
     * decompress to exactly the number of bytes the header announces
     * @throws org.janelia.vizbridge.model.UnsupportedComponentTypeException if the component type is unknown
     */
    public SpatialImage decodeImage(ImagePayload payload) {
        ImagePayload.ImageType imageType = payload.getImageType();
        if (imageType == null) {
            throw new CorruptPayloadException("Image payload has no image type");
        }
        int n = imageType.getDimension();
        if (n < 1) {
            throw new CorruptPayloadException("Invalid image dimension " + n);
        }
        checkLength("origin", payload.getOrigin() == null ? -1 : payload.getOrigin().length, n);
        checkLength("spacing", payload.getSpacing() == null ? -1 : payload.getSpacing().length, n);
        checkLength("size", payload.getSize() == null ? -1 : payload.getSize().length, n);
        ImagePayload.Direction direction = payload.getDirection();
        if (direction == null || direction.getData() == null
                || direction.getRows() != n || direction.getColumns() != n || direction.getData().length != n * n) {
            throw new CorruptPayloadException("Direction must be a " + n + "x" + n + " matrix");
        }
        if (imageType.getComponents() < 1) {
            throw new CorruptPayloadException("Invalid number of components " + imageType.getComponents());
        }
        PixelType pixelType;
        try {
            pixelType = PixelType.fromCode(imageType.getPixelType());
        } catch (IllegalArgumentException e) {
            throw new CorruptPayloadException("Invalid pixel type " + imageType.getPixelType(), e);
        }
        ComponentType componentType = ComponentType.fromWireName(imageType.getComponentType());

        long expectedLength = (long) imageType.getComponents() * componentType.getByteWidth();
        for (long d : payload.getSize()) {
            if (d < 1) {
                throw new CorruptPayloadException("Invalid image size " + Arrays.toString(payload.getSize()));
            }
            expectedLength *= d;
        }
        if (expectedLength > Integer.MAX_VALUE) {
            throw new CorruptPayloadException("Payload announces " + expectedLength + " bytes which exceeds the supported size");
        }
        byte[] pixelBytes = decompress(payload.getCompressedData(), (int) expectedLength);

        return SpatialImage.builder()
                .dims(reversed(payload.getSize()))
                .spacing(reversed(payload.getSpacing()))
                .origin(reversed(payload.getOrigin()))
                .direction(flipAxes(direction.getData(), n))
                .pixelType(pixelType)
                .componentType(componentType)
                .componentsPerPixel(imageType.getComponents())
                .buffer(TypedBuffers.fromLittleEndianBytes(pixelBytes, componentType))
                .build();
    }

    private static byte[] decompress(byte[] compressed, int expectedLength) {
        if (compressed == null || compressed.length == 0) {
            throw new CorruptPayloadException("Image payload has no compressed data");
        }
        long frameContentSize = Zstd.decompressedSize(compressed);
        if (frameContentSize > 0 && frameContentSize != expectedLength) {
            throw new CorruptPayloadException("Compressed frame holds " + frameContentSize + " bytes but the header requires " + expectedLength);
        }
        byte[] pixelBytes;
        try {
            pixelBytes = Zstd.decompress(compressed, expectedLength);
        } catch (ZstdException e) {
            throw new CorruptPayloadException("Error decompressing image data: " + e.getMessage(), e);
        }
        if (pixelBytes.length != expectedLength) {
            throw new CorruptPayloadException("Decompressed " + pixelBytes.length + " bytes but the header requires " + expectedLength);
        }
        return pixelBytes;
    }

    private static void checkLength(String field, int actual, int expected) {
        if (actual != expected) {
            throw new CorruptPayloadException("Expected " + expected + " " + field + " values but found " + (actual < 0 ? "none" : actual));
        }
    }

    /**
     * Reverse the order of both the rows and the columns of a row-major n x n matrix.
     */
    static double[] flipAxes(double[] matrix, int n) {
        double[] flipped = new double[n * n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                flipped[r * n + c] = matrix[(n - 1 - r) * n + (n - 1 - c)];
            }
        }
        return flipped;
    }

    private static double[] reversed(double[] values) {
        double[] r = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            r[i] = values[values.length - 1 - i];
        }
        return r;
    }

    private static long[] reversed(long[] values) {
        long[] r = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            r[i] = values[values.length - 1 - i];
        }
        return r;
    }
}
