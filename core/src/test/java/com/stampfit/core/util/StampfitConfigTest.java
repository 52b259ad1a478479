package com.stampfit.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class StampfitConfigTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(DataPathResolver.DATA_DIR_PROPERTY);
    }

    @Test
    public void testBundledConfigParses() throws Exception {
        InputStream is = getClass().getResourceAsStream(StampfitConfig.RESOURCE);
        assertNotNull(is, "stampfit_config.json not found on the classpath");

        StampfitConfig config = StampfitConfig.read(is);

        assertEquals(32, config.extraction.patchSize);
        assertEquals("median", config.averaging.mode);
        assertEquals(0, (config.averaging.size - config.extraction.patchSize) % 2);
        assertTrue(config.fitting.resolveThreads() >= 1);
    }

    @Test
    public void testMissingSectionsKeepDefaults() throws Exception {
        String json = "{\"averaging\": {\"step\": 128}, \"fitting\": null, \"unknown\": 1}";
        StampfitConfig config = StampfitConfig.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(128, config.averaging.step);
        assertEquals("median", config.averaging.mode);
        assertEquals(3.0, config.detection.threshold, 0.0);
        assertNotNull(config.fitting);
        assertEquals(1000, config.fitting.maxIterations);
    }

    @Test
    public void testDataDirectoryPrecedence() {
        StampfitConfig config = new StampfitConfig();
        assertEquals(".", DataPathResolver.resolveDataDirectory(config));

        config.data_directory = "/data/psf";
        assertEquals("/data/psf", DataPathResolver.resolveDataDirectory(config));
        assertEquals("/data/psf" + File.separator + "patches.db", DataPathResolver.resolveDbPath(config));

        System.setProperty(DataPathResolver.DATA_DIR_PROPERTY, "/override");
        assertEquals("/override", DataPathResolver.resolveDataDirectory(config));
    }
}
