package org.janelia.vizbridge.cmd;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.apache.commons.lang3.StringUtils;
import org.janelia.vizbridge.geometry.GeometryNormalizer;
import org.janelia.vizbridge.io.SwcSkeletonReader;
import org.janelia.vizbridge.model.PolyData;
import org.janelia.vizbridge.wire.GeometryWireCodec;
import org.janelia.vizbridge.wire.WireJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to convert an SWC reconstruction or a vtk.js document into the geometry wire format.
 */
class ConvertGeometryCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(ConvertGeometryCmd.class);

    @Parameters(commandDescription = "Convert an SWC skeleton or a vtk.js data set document into a geometry payload")
    static class ConvertGeometryArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, description = "SWC file or vtk.js JSON document", required = true)
        String input;

        @Parameter(names = {"--output", "-o"}, description = "Output JSON geometry payload", required = true)
        String output;

        @Parameter(names = {"--spacing"}, description = "SWC x,y,z spacing")
        String spacing;

        @Parameter(names = {"--points-only"}, description = "Only keep the points", arity = 0)
        boolean pointsOnly = false;

        ConvertGeometryArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        double[] getSpacing() {
            if (StringUtils.isBlank(spacing)) {
                return new double[] {1., 1., 1.};
            }
            String[] values = StringUtils.split(spacing, ',');
            double[] xyz = new double[3];
            for (int d = 0; d < 3; d++) {
                xyz[d] = Double.parseDouble(values[Math.min(d, values.length - 1)].trim());
            }
            return xyz;
        }

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            try {
                for (double s : getSpacing()) {
                    if (s <= 0) {
                        errors.add("Spacing values must be positive: " + spacing);
                        break;
                    }
                }
            } catch (NumberFormatException e) {
                errors.add("Invalid spacing: " + spacing);
            }
            return errors;
        }
    }

    private final ConvertGeometryArgs args;

    ConvertGeometryCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new ConvertGeometryArgs(commonArgs);
    }

    @Override
    ConvertGeometryArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        WireJson wireJson = new WireJson();
        Object source;
        if (StringUtils.endsWithIgnoreCase(args.input, ".swc")) {
            double[] spacing = args.getSpacing();
            source = new SwcSkeletonReader(spacing[0], spacing[1], spacing[2]).readSkeleton(Paths.get(args.input));
        } else {
            source = wireJson.readDocument(Paths.get(args.input));
        }
        GeometryNormalizer geometryNormalizer = new GeometryNormalizer(getCapabilityRegistry());
        PolyData polyData = (args.pointsOnly
                ? geometryNormalizer.normalizePointSet(source)
                : geometryNormalizer.normalizeGeometry(source))
                .orElseThrow(() -> new IllegalArgumentException("Unsupported geometry in " + args.input));
        wireJson.writeDocument(new GeometryWireCodec().encodeGeometry(polyData), Paths.get(args.output));
        LOG.info("Converted {} into {}: {}", args.input, args.output, polyData);
    }
}
