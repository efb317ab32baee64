package org.janelia.vizbridge.cmd;

import java.nio.Buffer;
import java.nio.file.Paths;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.measure.Calibration;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.PixelType;
import org.janelia.vizbridge.model.SpatialImage;
import org.janelia.vizbridge.model.TypedBuffers;
import org.janelia.vizbridge.wire.ImageWireCodec;
import org.janelia.vizbridge.wire.WireJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to decode a JSON image payload into a TIFF file.
 */
class DecodeImageCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(DecodeImageCmd.class);

    @Parameters(commandDescription = "Decode a JSON image payload into a TIFF file")
    static class DecodeImageArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, description = "JSON image payload", required = true)
        String input;

        @Parameter(names = {"--output", "-o"}, description = "Output TIFF file", required = true)
        String output;

        DecodeImageArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }
    }

    private final DecodeImageArgs args;

    DecodeImageCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new DecodeImageArgs(commonArgs);
    }

    @Override
    DecodeImageArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        SpatialImage image = new ImageWireCodec(getConfig()).decodeImage(new WireJson().readImagePayload(Paths.get(args.input)));
        ImagePlus imp = toImagePlus(image, Paths.get(args.output).getFileName().toString());
        FileSaver fileSaver = new FileSaver(imp);
        boolean saved = imp.getStackSize() > 1 ? fileSaver.saveAsTiffStack(args.output) : fileSaver.saveAsTiff(args.output);
        if (!saved) {
            throw new IllegalStateException("Could not write " + args.output);
        }
        LOG.info("Decoded {} into {}", args.input, args.output);
    }

    static ImagePlus toImagePlus(SpatialImage image, String title) {
        int n = image.getDimension();
        if (n < 2 || n > 3) {
            throw new IllegalArgumentException("Only 2-D and 3-D images can be written as TIFF; this one has " + n + " dimensions");
        }
        int width = (int) image.getDim(n - 1);
        int height = (int) image.getDim(n - 2);
        int depth = n == 3 ? (int) image.getDim(0) : 1;
        int nComponents = image.getComponentsPerPixel();
        boolean rgb = image.getPixelType() == PixelType.RGB && image.getComponentType() == ComponentType.UINT8 && nComponents == 3;
        int nChannels = rgb ? 1 : nComponents;
        Buffer buffer = image.getBuffer();
        ImageStack stack = new ImageStack(width, height);
        int slicePixels = width * height;
        for (int z = 0; z < depth; z++) {
            for (int c = 0; c < nChannels; c++) {
                ImageProcessor ip = createProcessor(image.getComponentType(), rgb, width, height);
                for (int i = 0; i < slicePixels; i++) {
                    int element = (z * slicePixels + i) * nComponents;
                    if (rgb) {
                        int r = (int) TypedBuffers.getLong(buffer, ComponentType.UINT8, element);
                        int g = (int) TypedBuffers.getLong(buffer, ComponentType.UINT8, element + 1);
                        int b = (int) TypedBuffers.getLong(buffer, ComponentType.UINT8, element + 2);
                        ip.set(i, (r << 16) | (g << 8) | b);
                    } else {
                        ip.setf(i, (float) TypedBuffers.getDouble(buffer, image.getComponentType(), element + c));
                    }
                }
                stack.addSlice(ip);
            }
        }
        ImagePlus imp = new ImagePlus(title, stack);
        imp.setDimensions(nChannels, depth, 1);
        Calibration cal = imp.getCalibration();
        double[] spacing = image.getSpacing();
        double[] origin = image.getOrigin();
        cal.pixelWidth = spacing[n - 1];
        cal.pixelHeight = spacing[n - 2];
        cal.xOrigin = -origin[n - 1] / spacing[n - 1];
        cal.yOrigin = -origin[n - 2] / spacing[n - 2];
        if (n == 3) {
            cal.pixelDepth = spacing[0];
            cal.zOrigin = -origin[0] / spacing[0];
        }
        return imp;
    }

    private static ImageProcessor createProcessor(ComponentType componentType, boolean rgb, int width, int height) {
        if (rgb) {
            return new ColorProcessor(width, height);
        }
        switch (componentType) {
            case UINT8:
                return new ByteProcessor(width, height);
            case UINT16:
                return new ShortProcessor(width, height);
            default:
                return new FloatProcessor(width, height);
        }
    }
}
