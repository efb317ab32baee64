package org.janelia.vizbridge.cmd;

import org.apache.commons.lang3.StringUtils;
import org.janelia.vizbridge.capability.CapabilityRegistry;
import org.janelia.vizbridge.config.Config;
import org.janelia.vizbridge.config.ConfigProvider;

abstract class AbstractCmd {

    private final String commandName;
    private Config config;
    private CapabilityRegistry capabilityRegistry;

    AbstractCmd(String commandName) {
        this.commandName = commandName;
        this.config = null;
    }

    public String getCommandName() {
        return commandName;
    }

    abstract AbstractCmdArgs getArgs();

    boolean matches(String commandName) {
        return StringUtils.isNotBlank(commandName) && StringUtils.equals(this.commandName, commandName);
    }

    abstract void execute();

    Config getConfig() {
        if (config == null) {
            config = ConfigProvider.getInstance()
                    .fromDefaultResources()
                    .fromFile(getArgs().getConfigFileName())
                    .get();
        }
        return config;
    }

    /**
     * Capabilities probed with the command's configuration, which may disable some of them.
     */
    CapabilityRegistry getCapabilityRegistry() {
        if (capabilityRegistry == null) {
            capabilityRegistry = CapabilityRegistry.probe(getConfig());
        }
        return capabilityRegistry;
    }
}
