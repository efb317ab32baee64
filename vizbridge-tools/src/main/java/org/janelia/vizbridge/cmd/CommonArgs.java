package org.janelia.vizbridge.cmd;

import com.beust.jcommander.Parameter;

class CommonArgs {
    @Parameter(names = "--config", description = "Config file")
    String configFileName;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
