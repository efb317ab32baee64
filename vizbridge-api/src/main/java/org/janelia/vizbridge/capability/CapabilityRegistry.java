package org.janelia.vizbridge.capability;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.vizbridge.config.Config;
import org.janelia.vizbridge.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record of the optional integrations that are available. The process wide registry is probed
 * once, the first time it is requested, and never changes afterwards.
 */
public class CapabilityRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(CapabilityRegistry.class);

    private static class Holder {
        private static final CapabilityRegistry INSTANCE = probe(ConfigProvider.getDefaultConfig());
    }

    private final Map<Capability, Boolean> capabilities;

    private CapabilityRegistry(Map<Capability, Boolean> capabilities) {
        Map<Capability, Boolean> allCapabilities = new EnumMap<>(Capability.class);
        for (Capability c : Capability.values()) {
            allCapabilities.put(c, capabilities.getOrDefault(c, false));
        }
        this.capabilities = Collections.unmodifiableMap(allCapabilities);
    }

    public static CapabilityRegistry getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * Probe all capabilities, honoring the ones disabled in the configuration.
     */
    public static CapabilityRegistry probe(Config config) {
        Set<Capability> disabled = EnumSet.noneOf(Capability.class);
        for (String name : config.getStringListPropertyValue("Capabilities.Disabled")) {
            try {
                disabled.add(Capability.valueOf(name.toUpperCase()));
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignore unknown capability {} in Capabilities.Disabled", name);
            }
        }
        Map<Capability, Boolean> probed = new EnumMap<>(Capability.class);
        for (Capability c : Capability.values()) {
            if (disabled.contains(c)) {
                LOG.info("Capability {} disabled by configuration", c);
                probed.put(c, false);
            } else {
                boolean available = isPresent(c);
                LOG.info("Capability {} is {}", c, available ? "available" : "not available");
                probed.put(c, available);
            }
        }
        return new CapabilityRegistry(probed);
    }

    private static boolean isPresent(Capability c) {
        try {
            Class<?> probeClass = Class.forName(c.getProbeClassName(), false, CapabilityRegistry.class.getClassLoader());
            if (c.isService()) {
                return ServiceLoader.load(probeClass, CapabilityRegistry.class.getClassLoader()).findFirst().isPresent();
            }
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.debug("Probe class {} for {} could not be loaded", c.getProbeClassName(), c, e);
            return false;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isAvailable(Capability capability) {
        return capabilities.get(capability);
    }

    /**
     * @throws MissingCapabilityException if the capability is not available
     */
    public void require(Capability capability, String reason) {
        if (!isAvailable(capability)) {
            throw new MissingCapabilityException(capability, reason);
        }
    }

    public Set<Capability> getAvailableCapabilities() {
        Set<Capability> available = EnumSet.noneOf(Capability.class);
        capabilities.forEach((c, present) -> {
            if (present) available.add(c);
        });
        return available;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("capabilities", capabilities)
                .toString();
    }

    /**
     * Builds a private registry with explicitly chosen capabilities, typically for embedding or testing.
     */
    public static class Builder {
        private final Map<Capability, Boolean> capabilities = new EnumMap<>(Capability.class);

        private Builder() {
        }

        public Builder with(Capability capability, boolean available) {
            capabilities.put(capability, available);
            return this;
        }

        public Builder withAll() {
            for (Capability c : Capability.values()) {
                capabilities.put(c, true);
            }
            return this;
        }

        public Builder withProbed(CapabilityRegistry registry) {
            capabilities.putAll(registry.capabilities);
            return this;
        }

        public CapabilityRegistry build() {
            return new CapabilityRegistry(capabilities);
        }
    }
}
