package com.pdqhash.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigLoaderTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(ConfigLoader.CONFIG_PROPERTY);
    }

    @Test
    public void testClasspathDefaults() {
        HasherConfig config = ConfigLoader.load();
        assertEquals(2, config.jaroszPasses);
        assertEquals(128, config.windowSizeDivisor);
        assertEquals("matrix", config.dctTransform);
        assertEquals(31, config.matchDistanceThreshold);
        assertTrue(config.imageExtensions.contains("png"));
    }

    @Test
    public void testSystemPropertyOverridesClasspath() throws Exception {
        String path = Paths.get(getClass().getResource("/config/unrolled_config.json").toURI()).toString();
        System.setProperty(ConfigLoader.CONFIG_PROPERTY, path);

        HasherConfig config = ConfigLoader.load();
        assertEquals("unrolled", config.dctTransform);
        assertEquals(40, config.qualityThreshold);
        assertEquals(2, config.effectiveBatchThreads());
        assertEquals(1, config.imageExtensions.size());
        // Fields absent from the file keep their defaults
        assertEquals(2, config.jaroszPasses);
    }

    @Test
    public void testMissingPropertyFileFallsBack() {
        System.setProperty(ConfigLoader.CONFIG_PROPERTY, "/no/such/pdq_config.json");
        HasherConfig config = ConfigLoader.load();
        assertEquals("matrix", config.dctTransform);
    }

    @Test
    public void testInvalidValuesRejected() throws Exception {
        String path = Paths.get(getClass().getResource("/config/invalid_config.json").toURI()).toString();
        System.setProperty(ConfigLoader.CONFIG_PROPERTY, path);
        assertThrows(IllegalArgumentException.class, ConfigLoader::load);

        try (InputStream is = getClass().getResourceAsStream("/config/invalid_config.json")) {
            assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(is));
        }
    }

    @Test
    public void testLoadFromStream() throws Exception {
        String json = "{\"windowSizeDivisor\": 64, \"batchThreads\": 3}";
        HasherConfig config = ConfigLoader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        assertEquals(64, config.windowSizeDivisor);
        assertEquals(3, config.effectiveBatchThreads());
    }

    @Test
    public void testValidateRanges() {
        HasherConfig config = HasherConfig.defaults();
        config.qualityThreshold = 101;
        assertThrows(IllegalArgumentException.class, config::validate);

        config = HasherConfig.defaults();
        config.matchDistanceThreshold = -1;
        assertThrows(IllegalArgumentException.class, config::validate);

        config = HasherConfig.defaults();
        config.batchThreads = -2;
        assertThrows(IllegalArgumentException.class, config::validate);

        config = HasherConfig.defaults();
        config.batchThreads = 0;
        assertTrue(config.effectiveBatchThreads() >= 1);
    }

    @Test
    public void testCopyIsIndependent() {
        HasherConfig original = HasherConfig.defaults();
        HasherConfig copy = original.copy();
        copy.imageExtensions.add("tiff");
        copy.dctTransform = "unrolled";
        assertFalse(original.imageExtensions.contains("tiff"));
        assertEquals("matrix", original.dctTransform);
    }
}
