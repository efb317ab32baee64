package org.janelia.vizbridge.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public class VizBridgeCmd {

    private static final Logger LOG = LoggerFactory.getLogger(VizBridgeCmd.class);

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    static int run(String[] argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new EncodeImageCmd("encodeImage", commonArgs),
                new DecodeImageCmd("decodeImage", commonArgs),
                new ConvertGeometryCmd("convertGeometry", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder().addObject(commonArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            StringBuilder sb = new StringBuilder(e.getMessage()).append('\n');
            if (StringUtils.isNotBlank(e.getJCommander().getParsedCommand())) {
                e.getJCommander().getUsageFormatter().usage(e.getJCommander().getParsedCommand(), sb);
            } else {
                e.getJCommander().getUsageFormatter().usage(sb);
            }
            e.getJCommander().getConsole().println(sb.toString());
            return 1;
        }

        if (commonArgs.displayHelpMessage || StringUtils.isBlank(cmdline.getParsedCommand())) {
            cmdline.usage();
            return commonArgs.displayHelpMessage ? 0 : 1;
        }

        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(cmdline.getParsedCommand()))
                .findFirst()
                .orElse(null);
        if (cmd == null) {
            LOG.error("Invalid command: {}", cmdline.getParsedCommand());
            return 1;
        }
        List<String> errors = cmd.getArgs().validate();
        if (!errors.isEmpty()) {
            LOG.error("Invalid arguments for {}: {}", cmd.getCommandName(), errors);
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (Exception e) {
            LOG.error("Error running {}", cmd.getCommandName(), e);
            return 1;
        }
    }
}
