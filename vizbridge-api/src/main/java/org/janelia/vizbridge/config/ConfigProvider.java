package org.janelia.vizbridge.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} by layering the default class path resource, an optional
 * properties file and the JVM system properties (last one wins).
 */
public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/vizbridge.properties";

    private static volatile Config defaultConfig;

    private final Properties properties = new Properties();

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    /**
     * Process wide configuration built from the default resources and the system properties.
     */
    public static Config getDefaultConfig() {
        if (defaultConfig == null) {
            synchronized (ConfigProvider.class) {
                if (defaultConfig == null) {
                    defaultConfig = getInstance().fromDefaultResources().get();
                }
            }
        }
        return defaultConfig;
    }

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream resourceStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (resourceStream == null) {
                LOG.debug("No config resource {} found", resourceName);
            } else {
                properties.load(resourceStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config resource " + resourceName, e);
        }
        return this;
    }

    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configFile = Paths.get(fileName);
        if (Files.notExists(configFile)) {
            LOG.warn("Config file {} not found", fileName);
            return this;
        }
        try (InputStream fileStream = Files.newInputStream(configFile)) {
            properties.load(fileStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config file " + fileName, e);
        }
        return this;
    }

    public ConfigProvider fromProperties(Properties overrides) {
        properties.putAll(overrides);
        return this;
    }

    public Config get() {
        Properties effective = new Properties();
        effective.putAll(properties);
        System.getProperties().stringPropertyNames().stream()
                .filter(properties::containsKey)
                .forEach(name -> effective.setProperty(name, System.getProperty(name)));
        return new Config(effective);
    }
}
