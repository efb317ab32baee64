package org.janelia.vizbridge.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Read-only view of the configured properties.
 */
public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    public String getStringPropertyValue(String name) {
        return getStringPropertyValue(name, null);
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = properties.getProperty(name);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public Integer getIntegerPropertyValue(String name, Integer defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + value, e);
        }
    }

    public boolean getBooleanPropertyValue(String name, boolean defaultValue) {
        String value = getStringPropertyValue(name);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    public List<String> getStringListPropertyValue(String name) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return Collections.emptyList();
        }
        return Arrays.stream(StringUtils.split(value, ','))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("properties", properties)
                .toString();
    }
}
