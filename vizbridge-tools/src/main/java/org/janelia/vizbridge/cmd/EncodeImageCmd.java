package org.janelia.vizbridge.cmd;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import ij.IJ;
import ij.ImagePlus;
import org.janelia.vizbridge.image.DefaultBufferOwnershipPolicy;
import org.janelia.vizbridge.image.ImageNormalizer;
import org.janelia.vizbridge.model.SpatialImage;
import org.janelia.vizbridge.wire.ImagePayload;
import org.janelia.vizbridge.wire.ImageWireCodec;
import org.janelia.vizbridge.wire.WireJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to encode an image file as a JSON image payload.
 */
class EncodeImageCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(EncodeImageCmd.class);

    @Parameters(commandDescription = "Encode an image file into a compressed JSON image payload")
    static class EncodeImageArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, description = "Image file readable by ImageJ", required = true)
        String input;

        @Parameter(names = {"--output", "-o"}, description = "Output JSON payload", required = true)
        String output;

        EncodeImageArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (input.equals(output)) {
                errors.add("Input and output must be different files");
            }
            return errors;
        }
    }

    private final EncodeImageArgs args;

    EncodeImageCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new EncodeImageArgs(commonArgs);
    }

    @Override
    EncodeImageArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        ImagePlus imp = IJ.openImage(args.input);
        if (imp == null) {
            throw new IllegalArgumentException("Could not open image " + args.input);
        }
        ImageNormalizer imageNormalizer = new ImageNormalizer(getCapabilityRegistry(), DefaultBufferOwnershipPolicy.fromConfig(getConfig()));
        SpatialImage image = imageNormalizer.normalizeImage(imp)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported image " + args.input));
        ImagePayload payload = new ImageWireCodec(getConfig()).encodeImage(image);
        new WireJson().writeImagePayload(payload, Paths.get(args.output));
        LOG.info("Encoded {} ({} bytes) into {} ({} compressed bytes) in {}s",
                args.input, image.getBufferByteLength(), args.output, payload.getCompressedData().length,
                (System.currentTimeMillis() - startTime) / 1000.);
    }
}
