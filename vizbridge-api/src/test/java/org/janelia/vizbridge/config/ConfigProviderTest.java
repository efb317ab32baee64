package org.janelia.vizbridge.config;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ConfigProviderTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    @Test
    public void defaultResources() {
        Config config = ConfigProvider.getInstance().fromDefaultResources().get();

        assertEquals(Integer.valueOf(3), config.getIntegerPropertyValue("WireCodec.CompressionLevel", 0));
        assertTrue(config.getBooleanPropertyValue("BufferOwnership.AllowViews", false));
        assertTrue(config.getStringListPropertyValue("Capabilities.Disabled").isEmpty());
    }

    @Test
    public void laterSourcesOverrideEarlierOnes() throws IOException {
        Path configFile = tempFolder.newFile("override.properties").toPath();
        Properties fileProperties = new Properties();
        fileProperties.setProperty("BufferOwnership.AllowViews", "false");
        fileProperties.setProperty("WireCodec.CompressionLevel", "5");
        try (OutputStream out = Files.newOutputStream(configFile)) {
            fileProperties.store(out, null);
        }
        Properties overrides = new Properties();
        overrides.setProperty("WireCodec.CompressionLevel", "7");

        Config config = ConfigProvider.getInstance()
                .fromDefaultResources()
                .fromResource("/vizbridge-test.properties")
                .fromFile(configFile.toString())
                .fromProperties(overrides)
                .get();

        assertEquals(Integer.valueOf(7), config.getIntegerPropertyValue("WireCodec.CompressionLevel", 0));
        assertFalse(config.getBooleanPropertyValue("BufferOwnership.AllowViews", true));
        assertEquals(Arrays.asList("jts", "bogus"), config.getStringListPropertyValue("Capabilities.Disabled"));
    }

    @Test
    public void missingSourcesAreSkipped() {
        Config config = ConfigProvider.getInstance()
                .fromResource("/no-such-resource.properties")
                .fromFile(tempFolder.getRoot().toPath().resolve("missing.properties").toString())
                .fromFile(null)
                .get();

        assertNull(config.getStringPropertyValue("WireCodec.CompressionLevel"));
        assertEquals("x", config.getStringPropertyValue("WireCodec.CompressionLevel", "x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidInteger() {
        Properties properties = new Properties();
        properties.setProperty("WireCodec.CompressionLevel", "high");
        ConfigProvider.getInstance().fromProperties(properties).get()
                .getIntegerPropertyValue("WireCodec.CompressionLevel", 3);
    }
}
