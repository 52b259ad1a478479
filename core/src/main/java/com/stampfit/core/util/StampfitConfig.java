package com.stampfit.core.util;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Settings read from {@code stampfit_config.json}. Fields left out of the file
 * keep the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StampfitConfig {

    private static final Logger logger = LoggerFactory.getLogger(StampfitConfig.class);

    public static final String RESOURCE = "/stampfit_config.json";

    public String data_directory;
    public ExtractionConfig extraction = new ExtractionConfig();
    public DetectionConfig detection = new DetectionConfig();
    public AveragingConfig averaging = new AveragingConfig();
    public FittingConfig fitting = new FittingConfig();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtractionConfig {
        public int patchSize = 32;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DetectionConfig {
        public double threshold = 3.0;
        public int minArea = 5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AveragingConfig {
        public int size = 32;
        public int step = 512;
        public String mode = "median";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FittingConfig {
        // 0 means one worker per available processor
        public int threads = 0;
        public int maxIterations = 1000;
        public int maxEvaluations = 10000;
        public double costRelativeTolerance = 1e-10;
        public double parameterRelativeTolerance = 1e-10;
        public double orthoTolerance = 1e-10;

        public int resolveThreads() {
            return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        }
    }

    public static StampfitConfig read(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        StampfitConfig config = mapper.readValue(jsonStream, StampfitConfig.class);
        // explicit nulls in the file fall back to defaults
        if (config.extraction == null) {
            config.extraction = new ExtractionConfig();
        }
        if (config.detection == null) {
            config.detection = new DetectionConfig();
        }
        if (config.averaging == null) {
            config.averaging = new AveragingConfig();
        }
        if (config.fitting == null) {
            config.fitting = new FittingConfig();
        }
        return config;
    }

    /**
     * Loads the bundled configuration, or the defaults if it is missing or
     * unreadable.
     */
    public static StampfitConfig loadDefault() {
        try (InputStream is = StampfitConfig.class.getResourceAsStream(RESOURCE)) {
            if (is != null) {
                return read(is);
            }
            logger.warn("{} not found on the classpath, using defaults", RESOURCE);
        } catch (IOException e) {
            logger.error("Failed to read {}, using defaults", RESOURCE, e);
        }
        return new StampfitConfig();
    }
}
